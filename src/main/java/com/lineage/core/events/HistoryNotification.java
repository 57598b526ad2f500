package com.lineage.core.events;

import com.lineage.core.model.ExecutionEntry;

/**
 * Payload of history created/updated notifications.
 *
 * @param agentId        the agent whose observers should see the entry
 * @param entry          the persisted entry
 * @param sequenceNumber ordering hint from the producer, null when it supplied none
 */
public record HistoryNotification(String agentId, ExecutionEntry entry, Long sequenceNumber) {

    public HistoryNotification(String agentId, ExecutionEntry entry) {
        this(agentId, entry, null);
    }
}
