package com.lineage.core.persistence;

import java.util.ArrayList;
import java.util.List;

/**
 * Target DDL for every table family. Shared by table creation and by the
 * migrations that rebuild tables into this shape.
 */
public final class TimelineSchema {

    public static final String CONVERSATION_COLUMNS = """
            id          TEXT PRIMARY KEY,
            resource_id TEXT NOT NULL,
            user_id     TEXT NOT NULL,
            title       TEXT,
            metadata    TEXT,
            created_at  TEXT NOT NULL,
            updated_at  TEXT NOT NULL
            """;

    public static final String MESSAGE_COLUMNS = """
            conversation_id TEXT NOT NULL,
            message_id      TEXT NOT NULL,
            role            TEXT NOT NULL,
            content         TEXT NOT NULL,
            type            TEXT NOT NULL,
            created_at      TEXT NOT NULL,
            PRIMARY KEY (conversation_id, message_id)
            """;

    public static final String HISTORY_COLUMNS = """
            id        TEXT PRIMARY KEY,
            agent_id  TEXT NOT NULL,
            timestamp TEXT NOT NULL,
            status    TEXT,
            input     TEXT,
            output    TEXT,
            usage     TEXT,
            metadata  TEXT
            """;

    public static final String STEP_COLUMNS = """
            key        TEXT PRIMARY KEY,
            value      TEXT NOT NULL,
            history_id TEXT NOT NULL,
            agent_id   TEXT
            """;

    public static final String EVENT_COLUMNS = """
            id              TEXT PRIMARY KEY,
            history_id      TEXT NOT NULL,
            agent_id        TEXT,
            event_type      TEXT NOT NULL,
            event_name      TEXT NOT NULL,
            start_time      TEXT NOT NULL,
            end_time        TEXT,
            status          TEXT,
            status_message  TEXT,
            level           TEXT DEFAULT 'INFO',
            version         TEXT,
            parent_event_id TEXT,
            tags            TEXT,
            input           TEXT,
            output          TEXT,
            error           TEXT,
            metadata        TEXT
            """;

    public static final String FLAG_COLUMNS = """
            id             INTEGER PRIMARY KEY AUTOINCREMENT,
            migration_type TEXT NOT NULL UNIQUE,
            completed_at   TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now')),
            migrated_count INTEGER DEFAULT 0,
            metadata       TEXT DEFAULT '{}'
            """;

    private TimelineSchema() {}

    public static String createTable(String table, String columns) {
        return "CREATE TABLE IF NOT EXISTS " + table + " (\n" + columns + ")";
    }

    public static List<String> conversationIndexes(TableNames tables, boolean hasUserId) {
        List<String> statements = new ArrayList<>();
        statements.add(index(tables.conversations(), "resource_id"));
        if (hasUserId) {
            statements.add(index(tables.conversations(), "user_id"));
        }
        return statements;
    }

    public static List<String> messageIndexes(TableNames tables) {
        return List.of("CREATE INDEX IF NOT EXISTS idx_%1$s_lookup ON %1$s(conversation_id, created_at)"
                .formatted(tables.messages()));
    }

    public static List<String> historyIndexes(TableNames tables) {
        return List.of(index(tables.history(), "agent_id"));
    }

    public static List<String> stepIndexes(TableNames tables) {
        return List.of(index(tables.steps(), "history_id"), index(tables.steps(), "agent_id"));
    }

    public static List<String> eventIndexes(TableNames tables) {
        return List.of(
                index(tables.events(), "history_id"),
                index(tables.events(), "agent_id"),
                index(tables.events(), "event_type"),
                index(tables.events(), "event_name"),
                index(tables.events(), "parent_event_id"),
                index(tables.events(), "status"));
    }

    private static String index(String table, String column) {
        return "CREATE INDEX IF NOT EXISTS idx_%1$s_%2$s ON %1$s(%2$s)".formatted(table, column);
    }
}
