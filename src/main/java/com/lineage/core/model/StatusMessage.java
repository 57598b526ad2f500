package com.lineage.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Human-readable status detail attached to a timeline event, usually an error.
 *
 * @param message the message shown to operators
 * @param stack   optional stack trace text
 * @param code    optional machine-readable error code
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusMessage(String message, String stack, String code) {

    public static StatusMessage of(String message) {
        return new StatusMessage(message, null, null);
    }
}
