package com.lineage.dispatch.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint for {@code /ws}: a connectivity check that greets on
 * connect and echoes every JSON frame.
 */
@Component
public class TestChannelWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TestChannelWebSocketHandler.class);

    private final ConnectionManager connectionManager;

    public TestChannelWebSocketHandler(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.debug("Test channel session {} opened", session.getId());
        connectionManager.handleTestConnection(new WebSocketSessionConnection(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        connectionManager.handleEchoMessage(new WebSocketSessionConnection(session), message.getPayload());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Test channel session {} closed ({})", session.getId(), status);
    }
}
