package com.lineage.core.persistence.migration;

import com.lineage.core.persistence.TableNames;
import com.lineage.core.persistence.TimelineSchema;
import com.lineage.core.persistence.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moves ownership from messages to conversations.
 * <p>
 * Legacy shape: {@code messages} carries {@code user_id} and/or
 * {@code conversations} lacks it. Every referenced conversation is written
 * once with an owner, taken from the conversation row if it has one and
 * otherwise from its first message. Messages that reference a missing
 * conversation get an auto-created "Migrated Conversation".
 */
public class ConversationSchemaMigration implements SchemaMigration {

    public static final String TYPE = "conversation_schema_migration";

    static final String DEFAULT_USER = "default";
    static final String DEFAULT_RESOURCE = "default";
    static final String MIGRATED_TITLE = "Migrated Conversation";

    private static final Logger log = LoggerFactory.getLogger(ConversationSchemaMigration.class);

    private final TableNames tables;
    private final Clock clock;

    public ConversationSchemaMigration(TableNames tables, Clock clock) {
        this.tables = tables;
        this.clock = clock;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<String> liveTables() {
        return List.of(tables.conversations(), tables.messages());
    }

    @Override
    public List<TableSwap> swaps() {
        return List.of(
                new TableSwap(tables.conversations(), TimelineSchema.CONVERSATION_COLUMNS),
                new TableSwap(tables.messages(), TimelineSchema.MESSAGE_COLUMNS));
    }

    @Override
    public boolean isPending(Connection conn) throws SQLException {
        boolean conversationsExist = SchemaInspector.tableExists(conn, tables.conversations());
        boolean messagesExist = SchemaInspector.tableExists(conn, tables.messages());
        if (!conversationsExist && !messagesExist) {
            return false;
        }
        boolean messagesHaveUser = messagesExist
                && SchemaInspector.hasColumn(conn, tables.messages(), "user_id");
        boolean conversationsHaveUser = conversationsExist
                && SchemaInspector.hasColumn(conn, tables.conversations(), "user_id");
        return messagesHaveUser || (conversationsExist && !conversationsHaveUser);
    }

    @Override
    public int copyRows(Connection conn) throws SQLException {
        Map<String, Map<String, String>> existing = loadConversations(conn);
        boolean messagesHaveUser = SchemaInspector.hasColumn(conn, tables.messages(), "user_id");
        String now = Timestamps.format(clock.instant());

        String insertConversation = """
                INSERT OR REPLACE INTO %s (id, resource_id, user_id, title, metadata, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """.formatted(TableNames.tempOf(tables.conversations()));
        String insertMessage = """
                INSERT OR REPLACE INTO %s (conversation_id, message_id, role, content, type, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """.formatted(TableNames.tempOf(tables.messages()));
        String selectMessages = "SELECT * FROM %s ORDER BY created_at ASC".formatted(tables.messages());

        Set<String> written = new HashSet<>();
        try (PreparedStatement conversationStmt = conn.prepareStatement(insertConversation);
             PreparedStatement messageStmt = conn.prepareStatement(insertMessage)) {

            if (SchemaInspector.tableExists(conn, tables.messages())) {
                try (PreparedStatement query = conn.prepareStatement(selectMessages);
                     ResultSet rs = query.executeQuery()) {
                    while (rs.next()) {
                        String conversationId = rs.getString("conversation_id");
                        String messageId = rs.getString("message_id");
                        if (conversationId == null || messageId == null) {
                            log.warn("Skipping legacy message without conversation or message id");
                            continue;
                        }
                        String messageUser = messagesHaveUser ? rs.getString("user_id") : null;

                        if (written.add(conversationId)) {
                            Map<String, String> source = existing.get(conversationId);
                            if (source != null) {
                                String owner = firstNonNull(source.get("user_id"), messageUser, DEFAULT_USER);
                                writeConversation(conversationStmt, source, owner, now);
                            } else {
                                writeConversation(conversationStmt, autoCreated(conversationId, now),
                                        firstNonNull(messageUser, DEFAULT_USER), now);
                            }
                        }

                        messageStmt.setString(1, conversationId);
                        messageStmt.setString(2, messageId);
                        messageStmt.setString(3, firstNonNull(rs.getString("role"), "user"));
                        messageStmt.setString(4, firstNonNull(rs.getString("content"), ""));
                        messageStmt.setString(5, firstNonNull(rs.getString("type"), "text"));
                        messageStmt.setString(6, firstNonNull(rs.getString("created_at"), now));
                        messageStmt.executeUpdate();
                    }
                }
            }

            for (Map.Entry<String, Map<String, String>> entry : existing.entrySet()) {
                if (written.add(entry.getKey())) {
                    Map<String, String> source = entry.getValue();
                    writeConversation(conversationStmt, source,
                            firstNonNull(source.get("user_id"), DEFAULT_USER), now);
                }
            }
        }
        log.debug("Conversation migration wrote {} conversations", written.size());
        return written.size();
    }

    @Override
    public List<String> indexStatements(Connection conn) {
        List<String> statements = new ArrayList<>(TimelineSchema.conversationIndexes(tables, true));
        statements.addAll(TimelineSchema.messageIndexes(tables));
        return statements;
    }

    private Map<String, Map<String, String>> loadConversations(Connection conn) throws SQLException {
        Map<String, Map<String, String>> rows = new LinkedHashMap<>();
        if (!SchemaInspector.tableExists(conn, tables.conversations())) {
            return rows;
        }
        Set<String> columns = SchemaInspector.columns(conn, tables.conversations());
        try (PreparedStatement stmt = conn.prepareStatement("SELECT * FROM " + tables.conversations());
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                Map<String, String> row = new LinkedHashMap<>();
                for (String column : columns) {
                    row.put(column, rs.getString(column));
                }
                if (row.get("id") != null) {
                    rows.put(row.get("id"), row);
                }
            }
        }
        return rows;
    }

    private static Map<String, String> autoCreated(String conversationId, String now) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("id", conversationId);
        row.put("resource_id", DEFAULT_RESOURCE);
        row.put("title", MIGRATED_TITLE);
        row.put("metadata", "{}");
        row.put("created_at", now);
        row.put("updated_at", now);
        return row;
    }

    private static void writeConversation(PreparedStatement stmt, Map<String, String> row,
                                          String owner, String now) throws SQLException {
        stmt.setString(1, row.get("id"));
        stmt.setString(2, firstNonNull(row.get("resource_id"), DEFAULT_RESOURCE));
        stmt.setString(3, owner);
        stmt.setString(4, row.get("title"));
        stmt.setString(5, firstNonNull(row.get("metadata"), "{}"));
        stmt.setString(6, firstNonNull(row.get("created_at"), now));
        stmt.setString(7, firstNonNull(row.get("updated_at"), row.get("created_at"), now));
        stmt.executeUpdate();
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
