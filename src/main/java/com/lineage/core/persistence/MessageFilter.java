package com.lineage.core.persistence;

import java.time.Instant;

/**
 * Criteria for {@link DurableTimelineStore#getMessages(MessageFilter)}.
 * The newest {@code limit} matches are returned, oldest first.
 *
 * @param userId         owner filter; null or "default" skips the ownership join
 * @param conversationId conversation filter, optional
 * @param limit          maximum messages, optional
 * @param before         only messages created strictly before, optional
 * @param after          only messages created strictly after, optional
 * @param role           role filter, optional
 */
public record MessageFilter(
    String userId,
    String conversationId,
    Integer limit,
    Instant before,
    Instant after,
    String role
) {
    public static MessageFilter forConversation(String userId, String conversationId) {
        return new MessageFilter(userId, conversationId, null, null, null, null);
    }

    public MessageFilter withLimit(int newLimit) {
        return new MessageFilter(userId, conversationId, newLimit, before, after, role);
    }

    public MessageFilter withRole(String newRole) {
        return new MessageFilter(userId, conversationId, limit, before, after, newRole);
    }

    public MessageFilter between(Instant newAfter, Instant newBefore) {
        return new MessageFilter(userId, conversationId, limit, newBefore, newAfter, role);
    }
}
