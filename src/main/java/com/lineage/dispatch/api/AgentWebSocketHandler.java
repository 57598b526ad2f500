package com.lineage.dispatch.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.Optional;

/**
 * WebSocket endpoint for {@code /ws/agents/{agentId}}.
 * <p>
 * On connect the client receives the agent's HISTORY_LIST snapshot and, when
 * the newest entry is still running, a HISTORY_UPDATE for it. After that the
 * {@link ConnectionManager} pushes every update for the agent.
 */
@Component
public class AgentWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(AgentWebSocketHandler.class);

    static final String PATH_PREFIX = "/ws/agents/";
    private static final String AGENT_ID_ATTRIBUTE = "agentId";

    private final ConnectionManager connectionManager;

    public AgentWebSocketHandler(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Optional<String> agentId = agentIdOf(session.getUri());
        if (agentId.isEmpty()) {
            log.warn("Rejecting WebSocket session {}: no agent id in {}", session.getId(), session.getUri());
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        session.getAttributes().put(AGENT_ID_ATTRIBUTE, agentId.get());
        var connection = new WebSocketSessionConnection(session);
        connectionManager.addConnection(agentId.get(), connection);
        log.info("WebSocket session {} watching agent {}", session.getId(), agentId.get());

        connectionManager.sendInitialState(agentId.get(), connection);
    }

    /** Agent channels are push-only; client frames are ignored. */
    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Ignoring {}-byte frame on agent session {}", message.getPayloadLength(), session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on WebSocket session {}: {}", session.getId(), exception.getMessage());
        unregister(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket session {} closed ({})", session.getId(), status);
        unregister(session);
    }

    private void unregister(WebSocketSession session) {
        Object agentId = session.getAttributes().get(AGENT_ID_ATTRIBUTE);
        if (agentId != null) {
            connectionManager.removeConnection(agentId.toString(), new WebSocketSessionConnection(session));
        }
    }

    static Optional<String> agentIdOf(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return Optional.empty();
        }
        String path = uri.getPath();
        int start = path.indexOf(PATH_PREFIX);
        if (start < 0) {
            return Optional.empty();
        }
        String id = path.substring(start + PATH_PREFIX.length());
        if (id.endsWith("/")) {
            id = id.substring(0, id.length() - 1);
        }
        return id.isBlank() || id.contains("/") ? Optional.empty() : Optional.of(id);
    }
}
