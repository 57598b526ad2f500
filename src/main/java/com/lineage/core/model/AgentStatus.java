package com.lineage.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an {@link ExecutionEntry}.
 */
public enum AgentStatus {
    IDLE("idle"),
    RUNNING("running"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    AgentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * True once the run has finished, successfully or not.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    @JsonCreator
    public static AgentStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AgentStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + value);
    }
}
