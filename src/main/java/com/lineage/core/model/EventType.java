package com.lineage.core.model;

/**
 * Known {@link TimelineEvent#type()} values. The column itself stays open so
 * legacy rows with other kinds survive a migration.
 */
public enum EventType {
    AGENT("agent"),
    TOOL("tool"),
    MEMORY("memory"),
    RETRIEVER("retriever"),
    WORKFLOW("workflow");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
