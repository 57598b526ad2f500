package com.lineage.core.persistence.migration;

/**
 * Structured outcome of a migration or restore, reported to operators.
 *
 * @param success       whether the run committed (or had nothing to do)
 * @param migratedCount rows migrated, 0 for no-ops and already-applied runs
 * @param error         the failure, when {@code success} is false
 * @param backupCreated whether a backup snapshot exists after the run
 */
public record MigrationResult(boolean success, int migratedCount, Throwable error, boolean backupCreated) {

    public static MigrationResult skipped() {
        return new MigrationResult(true, 0, null, false);
    }

    public static MigrationResult migrated(int count, boolean backupCreated) {
        return new MigrationResult(true, count, null, backupCreated);
    }

    public static MigrationResult failed(Throwable error, boolean backupCreated) {
        return new MigrationResult(false, 0, error, backupCreated);
    }

    public String errorMessage() {
        return error == null ? null : error.getMessage();
    }
}
