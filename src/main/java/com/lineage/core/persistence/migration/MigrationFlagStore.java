package com.lineage.core.persistence.migration;

import com.lineage.core.persistence.TableNames;
import com.lineage.core.persistence.TimelineSchema;
import com.lineage.core.persistence.Timestamps;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the migration idempotency flags.
 */
public class MigrationFlagStore {

    private final String table;
    private final Clock clock;

    public MigrationFlagStore(TableNames tables, Clock clock) {
        this.table = tables.migrationFlags();
        this.clock = clock;
    }

    public void createTable(Connection conn) throws SQLException {
        SchemaInspector.execute(conn, TimelineSchema.createTable(table, TimelineSchema.FLAG_COLUMNS));
    }

    public Optional<MigrationFlag> find(Connection conn, String migrationType) throws SQLException {
        String sql = "SELECT migration_type, completed_at, migrated_count FROM %s WHERE migration_type = ?"
                .formatted(table);
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, migrationType);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs));
                }
            }
        }
        return Optional.empty();
    }

    public List<MigrationFlag> list(Connection conn) throws SQLException {
        String sql = "SELECT migration_type, completed_at, migrated_count FROM %s ORDER BY id".formatted(table);
        List<MigrationFlag> flags = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                flags.add(map(rs));
            }
        }
        return flags;
    }

    /**
     * Upserts the flag for {@code migrationType}; there is never more than one row per type.
     */
    public void markCompleted(Connection conn, String migrationType, int migratedCount) throws SQLException {
        String sql = """
                INSERT OR REPLACE INTO %s (migration_type, completed_at, migrated_count)
                VALUES (?, ?, ?)
                """.formatted(table);
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, migrationType);
            stmt.setString(2, Timestamps.format(clock.instant()));
            stmt.setInt(3, migratedCount);
            stmt.executeUpdate();
        }
    }

    public boolean remove(Connection conn, String migrationType) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "DELETE FROM %s WHERE migration_type = ?".formatted(table))) {
            stmt.setString(1, migrationType);
            return stmt.executeUpdate() > 0;
        }
    }

    private static MigrationFlag map(ResultSet rs) throws SQLException {
        return new MigrationFlag(
                rs.getString("migration_type"),
                Timestamps.parseOr(rs.getString("completed_at"), null),
                rs.getInt("migrated_count"));
    }
}
