package com.lineage.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * A conversation owned by one user and scoped to one resource (typically an agent).
 */
public record Conversation(
    String id,
    String resourceId,
    String userId,
    String title,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt
) {
    public Conversation {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
