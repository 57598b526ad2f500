package com.lineage.core.persistence.migration;

/**
 * Lifecycle of one table family inside the store.
 */
public enum MigrationState {
    UNINITIALIZED,
    SCHEMA_CHECKED,
    MIGRATING,
    READY
}
