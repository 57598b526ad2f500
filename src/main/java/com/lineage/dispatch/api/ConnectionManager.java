package com.lineage.dispatch.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lineage.core.events.EventHub;
import com.lineage.core.events.HistoryNotification;
import com.lineage.core.metrics.LineageMetrics;
import com.lineage.core.model.ExecutionEntry;
import com.lineage.core.persistence.Timestamps;
import com.lineage.core.registry.AgentRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fans history notifications out to the real-time clients watching each agent.
 * <p>
 * The manager subscribes to the {@link EventHub} on construction. Every
 * history update or creation is serialized once and written to each open
 * connection of the owning agent; a connection whose send fails is dropped
 * on the spot.
 */
@Service
public class ConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final Object lock = new Object();
    private final Map<String, Set<Connection>> connectionsByAgent = new HashMap<>();

    private final AgentRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final LineageMetrics metrics;
    private final List<EventHub.Subscription> subscriptions = new ArrayList<>();

    @Autowired
    public ConnectionManager(EventHub eventHub, AgentRegistry registry, ObjectMapper objectMapper, Clock clock,
                             @Autowired(required = false) LineageMetrics metrics) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
        subscriptions.add(eventHub.onHistoryUpdate(this::onHistoryUpdate));
        subscriptions.add(eventHub.onHistoryEntryCreated(this::onHistoryEntryCreated));
    }

    // ── Registry ─────────────────────────────────────────────────────────

    public void addConnection(String agentId, Connection connection) {
        synchronized (lock) {
            connectionsByAgent.computeIfAbsent(agentId, k -> new LinkedHashSet<>()).add(connection);
        }
        log.debug("Connection {} watching agent {}", connection.id(), agentId);
    }

    public void removeConnection(String agentId, Connection connection) {
        synchronized (lock) {
            Set<Connection> connections = connectionsByAgent.get(agentId);
            if (connections == null) {
                return;
            }
            connections.remove(connection);
            if (connections.isEmpty()) {
                connectionsByAgent.remove(agentId);
            }
        }
        log.debug("Connection {} no longer watching agent {}", connection.id(), agentId);
    }

    public int connectionCount(String agentId) {
        synchronized (lock) {
            Set<Connection> connections = connectionsByAgent.get(agentId);
            return connections == null ? 0 : connections.size();
        }
    }

    /**
     * Snapshot of the registry: total connections and number of watched agents.
     */
    public Map<String, Integer> getConnectionStats() {
        synchronized (lock) {
            int total = connectionsByAgent.values().stream().mapToInt(Set::size).sum();
            Map<String, Integer> stats = new LinkedHashMap<>();
            stats.put("totalConnections", total);
            stats.put("agentCount", connectionsByAgent.size());
            return stats;
        }
    }

    // ── Fan-out ──────────────────────────────────────────────────────────

    /**
     * Sends {@code message} to every open connection watching {@code agentId}.
     *
     * @return the number of connections that received the frame
     */
    public int broadcastToAgent(String agentId, RealtimeMessage message) {
        List<Connection> targets;
        synchronized (lock) {
            Set<Connection> connections = connectionsByAgent.get(agentId);
            if (connections == null || connections.isEmpty()) {
                return 0;
            }
            targets = List.copyOf(connections);
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} for agent {}: {}", message.type(), agentId, e.getMessage(), e);
            return 0;
        }

        int delivered = 0;
        for (Connection connection : targets) {
            if (!connection.isOpen()) {
                continue;
            }
            try {
                connection.send(payload);
                delivered++;
            } catch (IOException | RuntimeException e) {
                log.warn("Dropping connection {} for agent {} after failed send: {}",
                        connection.id(), agentId, e.getMessage());
                dropAfterFailedSend(agentId, connection);
            }
        }
        if (metrics != null) {
            metrics.recordBroadcast(message.type(), delivered);
        }
        return delivered;
    }

    private void onHistoryUpdate(HistoryNotification notification) {
        long sequence = notification.sequenceNumber() != null
                ? notification.sequenceNumber()
                : clock.millis();
        broadcastToAgent(notification.agentId(), RealtimeMessage.historyUpdate(sequence, notification.entry()));
    }

    private void onHistoryEntryCreated(HistoryNotification notification) {
        broadcastToAgent(notification.agentId(), RealtimeMessage.historyCreated(notification.entry()));
    }

    // ── Per-connection replies ───────────────────────────────────────────

    /**
     * Builds the HISTORY_LIST snapshot sent when a client starts watching an agent.
     *
     * @return empty when the agent is unknown, has no history, or loading fails
     */
    public Optional<RealtimeMessage> getInitialAgentState(String agentId) {
        var agent = registry.getAgent(agentId);
        if (agent.isEmpty()) {
            return Optional.empty();
        }
        try {
            List<ExecutionEntry> history = agent.get().getHistory();
            if (history == null || history.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(RealtimeMessage.historyList(history));
        } catch (RuntimeException e) {
            log.error("Failed to load history for agent {}: {}", agentId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Sends the HISTORY_LIST snapshot to a newly connected client and, when
     * the agent has a run still in progress, a HISTORY_UPDATE for the first
     * such run. A connection that cannot take either frame is unregistered.
     *
     * @return the number of frames sent
     */
    public int sendInitialState(String agentId, Connection connection) {
        Optional<RealtimeMessage> snapshot = getInitialAgentState(agentId);
        if (snapshot.isEmpty()) {
            return 0;
        }
        if (!send(connection, snapshot.get())) {
            dropAfterFailedSend(agentId, connection);
            return 0;
        }
        ExecutionEntry active = null;
        if (snapshot.get().data() instanceof List<?> entries) {
            for (Object item : entries) {
                if (item instanceof ExecutionEntry entry && entry.isActive()) {
                    active = entry;
                    break;
                }
            }
        }
        if (active == null) {
            return 1;
        }
        if (!send(connection, RealtimeMessage.historyUpdate(clock.millis(), active))) {
            dropAfterFailedSend(agentId, connection);
            return 1;
        }
        return 2;
    }

    public void handleTestConnection(Connection connection) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "WebSocket test connection successful");
        data.put("timestamp", Timestamps.format(clock.instant()));
        send(connection, RealtimeMessage.connectionTest(data));
    }

    /**
     * Answers a client frame with an ECHO of its parsed content. Frames that
     * are not JSON are logged and dropped.
     */
    public void handleEchoMessage(Connection connection, String payload) {
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed frame on connection {}: {}", connection.id(), e.getOriginalMessage());
            return;
        }
        send(connection, RealtimeMessage.echo(parsed));
    }

    /**
     * Writes one frame to one connection.
     *
     * @return false when the connection is closed or the write failed
     */
    public boolean send(Connection connection, RealtimeMessage message) {
        if (!connection.isOpen()) {
            return false;
        }
        try {
            connection.send(objectMapper.writeValueAsString(message));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to send {} to connection {}: {}", message.type(), connection.id(), e.getMessage());
            return false;
        }
    }

    private void dropAfterFailedSend(String agentId, Connection connection) {
        removeConnection(agentId, connection);
        if (metrics != null) {
            metrics.recordDroppedConnection();
        }
    }

    @PreDestroy
    @Override
    public void close() {
        subscriptions.forEach(EventHub.Subscription::unsubscribe);
        subscriptions.clear();
        synchronized (lock) {
            connectionsByAgent.clear();
        }
        log.info("Connection manager closed");
    }
}
