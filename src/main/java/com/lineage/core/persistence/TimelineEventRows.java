package com.lineage.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lineage.core.model.EventLevel;
import com.lineage.core.model.StatusMessage;
import com.lineage.core.model.TimelineEvent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Row mapping for the timeline events table, used by the store and by the
 * agent history migration.
 */
public class TimelineEventRows {

    private static final TypeReference<List<String>> TAGS_TYPE = new TypeReference<>() {};

    private final TableNames tables;
    private final JsonColumns json;

    public TimelineEventRows(TableNames tables, JsonColumns json) {
        this.tables = tables;
        this.json = json;
    }

    public void upsert(Connection conn, TimelineEvent event, String historyId, String agentId)
            throws SQLException {
        String sql = """
                INSERT OR REPLACE INTO %s
                    (id, history_id, agent_id, event_type, event_name, start_time, end_time,
                     status, status_message, level, version, parent_event_id,
                     tags, input, output, error, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """.formatted(tables.events());
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, event.id());
            stmt.setString(2, historyId);
            stmt.setString(3, agentId);
            stmt.setString(4, event.type());
            stmt.setString(5, event.name());
            stmt.setString(6, Timestamps.format(event.startTime()));
            stmt.setString(7, Timestamps.format(event.endTime()));
            stmt.setString(8, event.status());
            stmt.setString(9, json.write(event.statusMessage()));
            stmt.setString(10, event.level().name());
            stmt.setString(11, event.version());
            stmt.setString(12, event.parentEventId());
            stmt.setString(13, json.write(event.tags()));
            stmt.setString(14, json.write(event.input()));
            stmt.setString(15, json.write(event.output()));
            stmt.setString(16, json.write(event.error()));
            stmt.setString(17, json.write(event.metadata()));
            stmt.executeUpdate();
        }
    }

    public TimelineEvent map(ResultSet rs) throws SQLException {
        Map<String, Object> metadata = json.readMap(rs.getString("metadata"));
        return new TimelineEvent(
                rs.getString("id"),
                rs.getString("event_type"),
                rs.getString("event_name"),
                Timestamps.parseOr(rs.getString("start_time"), null),
                Timestamps.parseOr(rs.getString("end_time"), null),
                rs.getString("status"),
                readStatusMessage(rs.getString("status_message")),
                EventLevel.parse(rs.getString("level")),
                rs.getString("version"),
                rs.getString("parent_event_id"),
                json.read(rs.getString("tags"), TAGS_TYPE),
                json.readValue(rs.getString("input")),
                json.readValue(rs.getString("output")),
                json.readValue(rs.getString("error")),
                metadata);
    }

    // Older rows hold the bare message text rather than a JSON object.
    private StatusMessage readStatusMessage(String column) {
        if (column == null || column.isBlank()) {
            return null;
        }
        StatusMessage parsed = column.trim().startsWith("{") ? json.read(column, StatusMessage.class) : null;
        return parsed != null ? parsed : StatusMessage.of(column);
    }
}
