package com.lineage.core.persistence.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lineage.core.model.TimelineEvent;
import com.lineage.core.persistence.JsonColumns;
import com.lineage.core.persistence.TableNames;
import com.lineage.core.persistence.TimelineEventRows;
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
import java.util.List;
import java.util.Set;

/**
 * Rewrites the legacy key/value agent history log into typed history rows and
 * timeline events.
 * <p>
 * Legacy shape: {@code agent_history(key, value, agent_id)} where {@code value}
 * is a JSON blob holding the whole entry, including an {@code events} array.
 */
public class AgentHistoryLogMigration implements SchemaMigration {

    public static final String TYPE = "agent_history_data_migration";

    private static final Logger log = LoggerFactory.getLogger(AgentHistoryLogMigration.class);

    private final TableNames tables;
    private final JsonColumns json;
    private final TimelineEventRows eventRows;
    private final LegacyEventTransformer transformer;
    private final Clock clock;

    public AgentHistoryLogMigration(TableNames tables, JsonColumns json,
                                    LegacyEventTransformer transformer, Clock clock) {
        this.tables = tables;
        this.json = json;
        this.eventRows = new TimelineEventRows(tables, json);
        this.transformer = transformer;
        this.clock = clock;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<String> liveTables() {
        return List.of(tables.history(), tables.events());
    }

    @Override
    public List<TableSwap> swaps() {
        return List.of(new TableSwap(tables.history(), TimelineSchema.HISTORY_COLUMNS));
    }

    @Override
    public boolean isPending(Connection conn) throws SQLException {
        return SchemaInspector.tableExists(conn, tables.history())
                && SchemaInspector.hasColumn(conn, tables.history(), "value");
    }

    @Override
    public int copyRows(Connection conn) throws SQLException {
        SchemaInspector.execute(conn, TimelineSchema.createTable(tables.events(), TimelineSchema.EVENT_COLUMNS));

        String select = "SELECT key, value, agent_id FROM %s".formatted(tables.history());
        String insert = """
                INSERT INTO %s (id, agent_id, timestamp, status, input, output, usage, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, NULL)
                """.formatted(TableNames.tempOf(tables.history()));

        Set<String> migratedIds = new HashSet<>();
        int migrated = 0;
        try (PreparedStatement query = conn.prepareStatement(select);
             ResultSet rs = query.executeQuery();
             PreparedStatement stmt = conn.prepareStatement(insert)) {
            while (rs.next()) {
                String key = rs.getString("key");
                LegacyRow row;
                try {
                    row = parse(key, rs.getString("value"), rs.getString("agent_id"));
                } catch (RuntimeException e) {
                    log.warn("Skipping legacy history row {}: {}", key, e.getMessage());
                    continue;
                }
                if (!migratedIds.add(row.id())) {
                    log.debug("Legacy history row {} duplicates entry {}, skipping", key, row.id());
                    continue;
                }

                stmt.setString(1, row.id());
                stmt.setString(2, row.agentId());
                stmt.setString(3, row.timestamp());
                stmt.setString(4, text(row.value().get("status")));
                stmt.setString(5, jsonOrNull(row.value().get("input")));
                stmt.setString(6, jsonOrNull(row.value().get("output")));
                stmt.setString(7, jsonOrNull(row.value().get("usage")));
                stmt.executeUpdate();

                for (TimelineEvent event : row.events()) {
                    eventRows.upsert(conn, event, row.id(), row.agentId());
                }
                migrated++;
            }
        }
        return migrated;
    }

    @Override
    public List<String> indexStatements(Connection conn) {
        return TimelineSchema.historyIndexes(tables);
    }

    private LegacyRow parse(String key, String value, String agentId) {
        ObjectMapper mapper = json.mapper();
        JsonNode node;
        try {
            node = mapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("value is not a JSON object");
        }

        String id = node.hasNonNull("id") ? node.get("id").asText() : key;
        if (id == null) {
            throw new IllegalArgumentException("row has neither id nor key");
        }
        String owner = node.hasNonNull("_agentId") ? node.get("_agentId").asText() : agentId;
        if (owner == null) {
            throw new IllegalArgumentException("row has no agent id");
        }
        String timestamp = Timestamps.format(
                Timestamps.parseOr(text(node.get("timestamp")), clock.instant()));

        List<LegacyEvent> legacyEvents = new ArrayList<>();
        JsonNode events = node.get("events");
        if (events != null && events.isArray()) {
            for (JsonNode eventNode : events) {
                try {
                    legacyEvents.add(mapper.treeToValue(eventNode, LegacyEvent.class));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    log.warn("Skipping malformed legacy event in entry {}: {}", id, e.getMessage());
                }
            }
        }
        return new LegacyRow(id, owner, timestamp, node, transformer.transformAll(legacyEvents));
    }

    private String jsonOrNull(JsonNode node) throws SQLException {
        if (node == null || node.isNull()) {
            return null;
        }
        return json.write(node);
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private record LegacyRow(String id, String agentId, String timestamp, JsonNode value,
                             List<TimelineEvent> events) {
    }
}
