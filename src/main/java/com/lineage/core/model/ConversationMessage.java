package com.lineage.core.model;

import java.time.Instant;

/**
 * A single message in a conversation's append-only log.
 *
 * @param id        message id, unique within its conversation
 * @param role      "user", "assistant", "system" or "tool"
 * @param content   message body; structured content is stored as JSON text
 * @param type      "text", "tool-call" or "tool-result"
 * @param createdAt creation time, used for ordering and pruning
 */
public record ConversationMessage(
    String id,
    String role,
    String content,
    String type,
    Instant createdAt
) {
}
