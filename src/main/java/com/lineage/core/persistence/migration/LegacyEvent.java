package com.lineage.core.persistence.migration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Loosely typed event envelope found in the {@code events} array of legacy
 * agent history blobs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyEvent(
    String id,
    String type,
    String name,
    String timestamp,
    String startTime,
    String updatedAt,
    String endTime,
    String status,
    String level,
    String version,
    String parentEventId,
    String affectedNodeId,
    Object statusMessage,
    Object input,
    Object output,
    Object error,
    Map<String, Object> metadata,
    Map<String, Object> data
) {
    public LegacyEvent {
        data = data == null ? Map.of() : data;
    }

    /** Message-node events only carry the user input forward. */
    public boolean isMessageNode() {
        return affectedNodeId != null && affectedNodeId.startsWith("message_");
    }

    /** Trailing {@code _}-separated segment of the affected node id. */
    public String nodeSuffix() {
        if (affectedNodeId == null) {
            return null;
        }
        int idx = affectedNodeId.lastIndexOf('_');
        return idx < 0 ? affectedNodeId : affectedNodeId.substring(idx + 1);
    }

    public Object dataValue(String key) {
        return data.get(key);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> dataMap(String key) {
        return data.get(key) instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }
}
