package com.lineage.core.persistence.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * One forward schema migration, described as data for {@link MigrationRunner}.
 * <p>
 * The runner owns backups, the transaction, the swap of temporary tables into
 * place and the idempotency flag; an implementation only inspects the legacy
 * shape and copies rows.
 */
public interface SchemaMigration {

    /** Key of the idempotency flag, e.g. {@code conversation_schema_migration}. */
    String type();

    /**
     * Tables snapshotted before migrating and replaced on restore. The first
     * entry is the family's primary table and must have a backup for a
     * restore to run; any other table without a backup did not exist before
     * the migration and is dropped on restore.
     */
    List<String> liveTables();

    /** Tables rebuilt through a temporary copy, in creation order. */
    List<TableSwap> swaps();

    /**
     * Whether any live table still has the legacy shape. Absent tables and
     * tables already in the target shape are not pending.
     */
    boolean isPending(Connection conn) throws SQLException;

    /**
     * Streams legacy rows into the temporary tables created from {@link #swaps()}.
     * Runs inside the migration transaction; rows that cannot be transformed
     * are skipped and logged.
     *
     * @return the number of logical records migrated
     */
    int copyRows(Connection conn) throws SQLException;

    /** Index statements run after the temporary tables are renamed into place. */
    List<String> indexStatements(Connection conn) throws SQLException;
}
