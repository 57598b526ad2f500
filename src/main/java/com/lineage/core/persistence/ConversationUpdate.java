package com.lineage.core.persistence;

import java.util.Map;

/**
 * Partial update of a conversation; null fields are left unchanged.
 */
public record ConversationUpdate(String title, String resourceId, Map<String, Object> metadata) {

    public static ConversationUpdate title(String title) {
        return new ConversationUpdate(title, null, null);
    }

    public boolean isEmpty() {
        return title == null && resourceId == null && metadata == null;
    }
}
