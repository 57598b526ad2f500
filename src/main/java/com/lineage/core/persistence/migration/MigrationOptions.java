package com.lineage.core.persistence.migration;

/**
 * @param createBackup             snapshot live tables into {@code *_backup} before migrating
 * @param deleteBackupAfterSuccess drop the snapshot once the migration commits
 */
public record MigrationOptions(boolean createBackup, boolean deleteBackupAfterSuccess) {

    public static MigrationOptions defaults() {
        return new MigrationOptions(true, false);
    }

    public static MigrationOptions withoutBackup() {
        return new MigrationOptions(false, false);
    }
}
