package com.lineage.core.persistence.migration;

import com.lineage.core.persistence.SqliteTestSupport;
import com.lineage.core.persistence.TableNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the generic migration procedure using a small single-table migration.
 */
class MigrationRunnerTest {

    private static final String WIDGETS = "widgets";

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private MigrationFlagStore flags;
    private MigrationRunner runner;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = SqliteTestSupport.dataSource(tempDir);
        flags = new MigrationFlagStore(new TableNames("test"),
                Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
        runner = new MigrationRunner(dataSource, flags);
        SqliteTestSupport.exec(dataSource,
                "CREATE TABLE widgets (name TEXT, legacy_note TEXT)",
                "INSERT INTO widgets VALUES ('gear', 'a')",
                "INSERT INTO widgets VALUES ('bolt', 'b')",
                "INSERT INTO widgets VALUES ('gear', 'duplicate')");
    }

    @Test
    @DisplayName("migrates rows, swaps tables and records the flag")
    void migrates() throws SQLException {
        MigrationResult result = runner.run(new WidgetMigration(false), MigrationOptions.defaults());

        assertTrue(result.success());
        assertEquals(2, result.migratedCount());
        assertTrue(result.backupCreated());
        assertEquals(List.of("bolt", "gear"),
                SqliteTestSupport.column(dataSource, "SELECT name FROM widgets ORDER BY name"));
        assertFalse(hasColumn("widgets", "legacy_note"));
        assertFalse(SqliteTestSupport.tableExists(dataSource, "widgets_temp"));
        assertEquals(3, SqliteTestSupport.count(dataSource, "widgets_backup"));
        assertEquals(2, flag(WidgetMigration.TYPE).migratedCount());
    }

    @Test
    @DisplayName("second run is a no-op")
    void idempotent() {
        runner.run(new WidgetMigration(false), MigrationOptions.defaults());

        MigrationResult second = runner.run(new WidgetMigration(false), MigrationOptions.defaults());

        assertTrue(second.success());
        assertEquals(0, second.migratedCount());
    }

    @Test
    @DisplayName("nothing pending returns success without a flag")
    void notPending() throws SQLException {
        SqliteTestSupport.exec(dataSource, "DROP TABLE widgets");

        MigrationResult result = runner.run(new WidgetMigration(false), MigrationOptions.defaults());

        assertTrue(result.success());
        assertEquals(0, result.migratedCount());
        assertFalse(result.backupCreated());
        assertNull(flagOrNull(WidgetMigration.TYPE));
    }

    @Test
    @DisplayName("failure mid-copy rolls back and leaves the legacy table untouched")
    void failureRollsBack() throws SQLException {
        MigrationResult result = runner.run(new WidgetMigration(true), MigrationOptions.defaults());

        assertFalse(result.success());
        assertInstanceOf(IllegalStateException.class, result.error());
        assertTrue(result.backupCreated());
        assertTrue(hasColumn("widgets", "legacy_note"));
        assertEquals(3, SqliteTestSupport.count(dataSource, "widgets"));
        assertFalse(SqliteTestSupport.tableExists(dataSource, "widgets_temp"));
        assertNull(flagOrNull(WidgetMigration.TYPE));
    }

    @Test
    @DisplayName("backup is dropped when requested")
    void dropsBackup() throws SQLException {
        MigrationResult result = runner.run(new WidgetMigration(false), new MigrationOptions(true, true));

        assertTrue(result.success());
        assertFalse(result.backupCreated());
        assertFalse(SqliteTestSupport.tableExists(dataSource, "widgets_backup"));
    }

    @Test
    @DisplayName("no backup is taken without createBackup")
    void withoutBackup() throws SQLException {
        MigrationResult result = runner.run(new WidgetMigration(false), MigrationOptions.withoutBackup());

        assertTrue(result.success());
        assertFalse(result.backupCreated());
        assertFalse(runner.backupExists(new WidgetMigration(false)));
        assertFalse(SqliteTestSupport.tableExists(dataSource, "widgets_backup"));
    }

    @Test
    @DisplayName("restore fails when no backup exists")
    void restoreWithoutBackup() {
        MigrationResult result = runner.restoreFromBackup(new WidgetMigration(false));

        assertFalse(result.success());
        assertTrue(result.errorMessage().contains("No backup found"));
    }

    @Test
    @DisplayName("restore puts the legacy table back and allows a re-run")
    void restoreAllowsRerun() throws SQLException {
        runner.run(new WidgetMigration(false), MigrationOptions.defaults());

        MigrationResult restored = runner.restoreFromBackup(new WidgetMigration(false));

        assertTrue(restored.success());
        assertTrue(hasColumn("widgets", "legacy_note"));
        assertEquals(3, SqliteTestSupport.count(dataSource, "widgets"));
        assertFalse(SqliteTestSupport.tableExists(dataSource, "widgets_backup"));
        assertNull(flagOrNull(WidgetMigration.TYPE));

        MigrationResult rerun = runner.run(new WidgetMigration(false), MigrationOptions.defaults());
        assertTrue(rerun.success());
        assertEquals(2, rerun.migratedCount());
    }

    private boolean hasColumn(String table, String column) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            return SchemaInspector.hasColumn(conn, table, column);
        }
    }

    private MigrationFlag flag(String type) throws SQLException {
        MigrationFlag flag = flagOrNull(type);
        assertNotNull(flag, "flag " + type);
        return flag;
    }

    private MigrationFlag flagOrNull(String type) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            flags.createTable(conn);
            return flags.find(conn, type).orElse(null);
        }
    }

    /**
     * Drops the legacy column and deduplicates by name; optionally fails after
     * writing the first row.
     */
    private static final class WidgetMigration implements SchemaMigration {

        static final String TYPE = "widget_migration";

        private final boolean failMidway;

        WidgetMigration(boolean failMidway) {
            this.failMidway = failMidway;
        }

        @Override
        public String type() {
            return TYPE;
        }

        @Override
        public List<String> liveTables() {
            return List.of(WIDGETS);
        }

        @Override
        public List<TableSwap> swaps() {
            return List.of(new TableSwap(WIDGETS, "name TEXT PRIMARY KEY"));
        }

        @Override
        public boolean isPending(Connection conn) throws SQLException {
            return SchemaInspector.tableExists(conn, WIDGETS) && SchemaInspector.hasColumn(conn, WIDGETS, "legacy_note");
        }

        @Override
        public int copyRows(Connection conn) throws SQLException {
            int copied = 0;
            try (PreparedStatement select = conn.prepareStatement("SELECT name FROM widgets ORDER BY rowid");
                 ResultSet rs = select.executeQuery();
                 PreparedStatement insert = conn.prepareStatement("INSERT OR IGNORE INTO widgets_temp (name) VALUES (?)")) {
                while (rs.next()) {
                    insert.setString(1, rs.getString("name"));
                    copied += insert.executeUpdate();
                    if (failMidway) {
                        throw new IllegalStateException("simulated failure");
                    }
                }
            }
            return copied;
        }

        @Override
        public List<String> indexStatements(Connection conn) {
            return List.of("CREATE INDEX IF NOT EXISTS idx_widgets_name ON widgets(name)");
        }
    }
}
