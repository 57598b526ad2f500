package com.lineage.core.persistence.migration;

import java.time.Instant;

/**
 * Record of a completed migration; at most one per type.
 */
public record MigrationFlag(String migrationType, Instant completedAt, int migratedCount) {
}
