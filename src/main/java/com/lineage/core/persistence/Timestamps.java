package com.lineage.core.persistence;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Text encoding of instants for TEXT columns.
 * <p>
 * Always writes fixed-width UTC with millisecond precision so lexical order
 * equals chronological order in ORDER BY and range filters.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    /** SQLite's own datetime('now') layout. */
    private static final DateTimeFormatter SQLITE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Timestamps() {}

    public static String format(Instant instant) {
        return instant == null ? null : FORMAT.format(instant);
    }

    /**
     * Parses ISO-8601 instants, offset date-times, SQLite datetime text and
     * epoch milliseconds.
     *
     * @throws IllegalArgumentException if the text is in none of those forms
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // not ISO_INSTANT, try the other layouts
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDateTime.parse(value, SQLITE_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unrecognized timestamp: " + text, e);
        }
    }

    /**
     * Like {@link #parse(String)} but yields {@code fallback} for unreadable text.
     */
    public static Instant parseOr(String text, Instant fallback) {
        try {
            Instant parsed = parse(text);
            return parsed != null ? parsed : fallback;
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
