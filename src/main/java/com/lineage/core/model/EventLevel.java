package com.lineage.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Severity attached to a {@link TimelineEvent}.
 */
public enum EventLevel {
    DEBUG, INFO, WARNING, ERROR, CRITICAL;

    private static final Logger log = LoggerFactory.getLogger(EventLevel.class);

    /**
     * Lenient parse used when reading stored rows; unknown or missing values map to INFO.
     */
    public static EventLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            log.debug("Unknown event level '{}', falling back to INFO", value);
            return INFO;
        }
    }
}
