package com.agentrelay.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * One control client (desktop app or channel bridge) attached over WebSocket.
 */
@Slf4j
@Getter
public class GatewayConnection {

    private final String connectionId;
    private final WebSocketSession session;
    private final long connectedAt;

    public GatewayConnection(String connectionId, WebSocketSession session) {
        this.connectionId = connectionId;
        this.session = session;
        this.connectedAt = System.currentTimeMillis();
    }

    public boolean isOpen() {
        return session != null && session.isOpen();
    }

    /**
     * @return false when the socket is closed or the write failed
     */
    public boolean sendResponse(ProtocolFrames.ResponseFrame response, ObjectMapper mapper) {
        return write(response, mapper);
    }

    /**
     * @return false when the socket is closed or the write failed
     */
    public boolean sendEvent(ProtocolFrames.EventFrame event, ObjectMapper mapper) {
        return write(event, mapper);
    }

    // WebSocketSession does not allow concurrent sends.
    private synchronized boolean write(Object frame, ObjectMapper mapper) {
        if (!isOpen()) {
            return false;
        }
        try {
            session.sendMessage(new TextMessage(mapper.writeValueAsString(frame)));
            return true;
        } catch (IOException e) {
            log.warn("ws:out failed conn={}: {}", connectionId, e.getMessage());
            return false;
        }
    }
}
