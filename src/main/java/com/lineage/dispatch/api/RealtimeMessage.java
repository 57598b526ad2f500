package com.lineage.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope of every frame sent to real-time clients.
 *
 * @param type           one of the {@code TYPE_*} constants
 * @param success        always true for server-originated frames
 * @param sequenceNumber ordering hint, present on history updates only
 * @param data           frame payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RealtimeMessage(
    String type,
    Boolean success,
    Long sequenceNumber,
    Object data
) {
    public static final String TYPE_HISTORY_LIST = "HISTORY_LIST";
    public static final String TYPE_HISTORY_UPDATE = "HISTORY_UPDATE";
    public static final String TYPE_HISTORY_CREATED = "HISTORY_CREATED";
    public static final String TYPE_CONNECTION_TEST = "CONNECTION_TEST";
    public static final String TYPE_ECHO = "ECHO";

    public static RealtimeMessage historyList(Object entries) {
        return new RealtimeMessage(TYPE_HISTORY_LIST, true, null, entries);
    }

    public static RealtimeMessage historyUpdate(long sequenceNumber, Object entry) {
        return new RealtimeMessage(TYPE_HISTORY_UPDATE, true, sequenceNumber, entry);
    }

    public static RealtimeMessage historyCreated(Object entry) {
        return new RealtimeMessage(TYPE_HISTORY_CREATED, true, null, entry);
    }

    public static RealtimeMessage connectionTest(Object data) {
        return new RealtimeMessage(TYPE_CONNECTION_TEST, true, null, data);
    }

    public static RealtimeMessage echo(Object data) {
        return new RealtimeMessage(TYPE_ECHO, true, null, data);
    }
}
