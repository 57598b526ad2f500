package com.lineage.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the durable timeline store.
 * Bound from the {@code lineage.storage} prefix in application.yml.
 */
@ConfigurationProperties(prefix = "lineage.storage")
public class StorageProperties {

    /** Prefix applied to every table name. */
    private String tablePrefix = "lineage_memory";

    /** Messages retained per conversation before the oldest are pruned. */
    private int storageLimit = 100;

    /** Raises store logging from DEBUG to INFO. */
    private boolean debug = false;

    private Migration migration = new Migration();

    public String getTablePrefix() { return tablePrefix; }
    public void setTablePrefix(String tablePrefix) { this.tablePrefix = tablePrefix; }

    public int getStorageLimit() { return storageLimit; }
    public void setStorageLimit(int storageLimit) { this.storageLimit = storageLimit; }

    public boolean isDebug() { return debug; }
    public void setDebug(boolean debug) { this.debug = debug; }

    public Migration getMigration() { return migration; }
    public void setMigration(Migration migration) { this.migration = migration; }

    public static class Migration {

        /** Run pending migrations when the store starts. */
        private boolean runOnStartup = true;

        /** Snapshot legacy tables before migrating agent history. */
        private boolean createBackup = true;

        /** Drop the agent history snapshot once its migration commits. */
        private boolean deleteBackupAfterSuccess = false;

        public boolean isRunOnStartup() { return runOnStartup; }
        public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }

        public boolean isCreateBackup() { return createBackup; }
        public void setCreateBackup(boolean createBackup) { this.createBackup = createBackup; }

        public boolean isDeleteBackupAfterSuccess() { return deleteBackupAfterSuccess; }
        public void setDeleteBackupAfterSuccess(boolean deleteBackupAfterSuccess) {
            this.deleteBackupAfterSuccess = deleteBackupAfterSuccess;
        }
    }
}
