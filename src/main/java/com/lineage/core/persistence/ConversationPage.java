package com.lineage.core.persistence;

import com.lineage.core.model.Conversation;

import java.util.List;

/**
 * One page of a user's conversations. {@code page} is 1-based.
 */
public record ConversationPage(List<Conversation> conversations, int page, int pageSize, boolean hasMore) {
}
