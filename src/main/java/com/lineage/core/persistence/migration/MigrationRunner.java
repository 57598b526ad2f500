package com.lineage.core.persistence.migration;

import com.lineage.core.persistence.StorageException;
import com.lineage.core.persistence.TableNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Executes {@link SchemaMigration}s with backup, a single transaction and an
 * idempotency flag, and restores live tables from their backups.
 * <p>
 * Legacy tables are only dropped after every row has been copied into the
 * temporary tables, so a failure before commit leaves them untouched.
 */
public class MigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private final DataSource dataSource;
    private final MigrationFlagStore flags;

    public MigrationRunner(DataSource dataSource, MigrationFlagStore flags) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.flags = Objects.requireNonNull(flags, "MigrationFlagStore must not be null");
    }

    public MigrationResult run(SchemaMigration migration, MigrationOptions options) {
        String type = migration.type();
        try (Connection conn = dataSource.getConnection()) {
            flags.createTable(conn);
            if (flags.find(conn, type).isPresent()) {
                log.debug("Migration {} already completed, skipping", type);
                return MigrationResult.skipped();
            }
            if (!migration.isPending(conn)) {
                log.debug("Migration {} not required, tables already in target shape", type);
                return MigrationResult.skipped();
            }

            boolean backupCreated = false;
            if (options.createBackup()) {
                createBackups(conn, migration.liveTables());
                backupCreated = true;
            }

            log.info("Running migration {}", type);
            int migrated;
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                for (TableSwap swap : migration.swaps()) {
                    SchemaInspector.execute(conn, "DROP TABLE IF EXISTS " + swap.tempTable());
                    SchemaInspector.execute(conn, swap.createTempSql());
                }
                migrated = migration.copyRows(conn);
                for (TableSwap swap : migration.swaps()) {
                    SchemaInspector.execute(conn, "DROP TABLE IF EXISTS " + swap.liveTable());
                    SchemaInspector.execute(conn,
                            "ALTER TABLE " + swap.tempTable() + " RENAME TO " + swap.liveTable());
                }
                for (String statement : migration.indexStatements(conn)) {
                    SchemaInspector.execute(conn, statement);
                }
                flags.markCompleted(conn, type, migrated);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, type, e);
                log.error("Migration {} failed and was rolled back: {}", type, e.getMessage(), e);
                return MigrationResult.failed(e, backupCreated);
            } finally {
                conn.setAutoCommit(autoCommit);
            }

            if (backupCreated && options.deleteBackupAfterSuccess()) {
                dropBackups(conn, migration.liveTables());
                backupCreated = false;
            }
            log.info("Migration {} completed: {} records migrated", type, migrated);
            return MigrationResult.migrated(migrated, backupCreated);
        } catch (SQLException e) {
            log.error("Migration {} could not start: {}", type, e.getMessage(), e);
            return MigrationResult.failed(e, false);
        }
    }

    /**
     * Replaces every live table of {@code migration} with its backup and clears
     * the migration's flag so it can run again. A secondary table that had no
     * backup is dropped, since it did not exist before the migration.
     */
    public MigrationResult restoreFromBackup(SchemaMigration migration) {
        String type = migration.type();
        List<String> tables = migration.liveTables();
        try (Connection conn = dataSource.getConnection()) {
            String primary = tables.get(0);
            if (!SchemaInspector.tableExists(conn, TableNames.backupOf(primary))) {
                return MigrationResult.failed(
                        new StorageException("No backup found for table " + primary), false);
            }

            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                for (String table : tables) {
                    String backup = TableNames.backupOf(table);
                    SchemaInspector.execute(conn, "DROP TABLE IF EXISTS " + table);
                    if (SchemaInspector.tableExists(conn, backup)) {
                        SchemaInspector.execute(conn, "ALTER TABLE " + backup + " RENAME TO " + table);
                    }
                }
                flags.createTable(conn);
                flags.remove(conn, type);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, type, e);
                log.error("Restore for {} failed and was rolled back: {}", type, e.getMessage(), e);
                return MigrationResult.failed(e, true);
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            log.info("Restored {} table(s) from backup for {}", tables.size(), type);
            return MigrationResult.migrated(tables.size(), false);
        } catch (SQLException e) {
            log.error("Restore for {} could not start: {}", type, e.getMessage(), e);
            return MigrationResult.failed(e, false);
        }
    }

    public boolean backupExists(SchemaMigration migration) {
        try (Connection conn = dataSource.getConnection()) {
            return SchemaInspector.tableExists(conn, TableNames.backupOf(migration.liveTables().get(0)));
        } catch (SQLException e) {
            throw new StorageException("Failed to inspect backup tables", e);
        }
    }

    private void createBackups(Connection conn, List<String> tables) throws SQLException {
        for (String table : tables) {
            if (!SchemaInspector.tableExists(conn, table)) {
                continue;
            }
            String backup = TableNames.backupOf(table);
            SchemaInspector.execute(conn, "DROP TABLE IF EXISTS " + backup);
            SchemaInspector.copyTable(conn, table, backup);
            log.info("Backed up {} to {}", table, backup);
        }
    }

    private void dropBackups(Connection conn, List<String> tables) throws SQLException {
        for (String table : tables) {
            SchemaInspector.execute(conn, "DROP TABLE IF EXISTS " + TableNames.backupOf(table));
        }
        log.debug("Dropped backups for {}", tables);
    }

    private static void rollbackQuietly(Connection conn, String type, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
            log.warn("Rollback of {} failed: {}", type, rollbackError.getMessage());
        }
    }
}
