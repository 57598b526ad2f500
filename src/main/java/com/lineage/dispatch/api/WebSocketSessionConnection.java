package com.lineage.dispatch.api;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link Connection} over a servlet {@link WebSocketSession}.
 * <p>
 * Sends are serialized per session since the container does not allow
 * concurrent writes to one session.
 */
public class WebSocketSessionConnection implements Connection {

    private final WebSocketSession session;

    public WebSocketSessionConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        synchronized (session) {
            session.sendMessage(new TextMessage(payload));
        }
    }

    @Override
    public void close() throws IOException {
        session.close(CloseStatus.NORMAL);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WebSocketSessionConnection other && other.session.getId().equals(session.getId());
    }

    @Override
    public int hashCode() {
        return session.getId().hashCode();
    }
}
