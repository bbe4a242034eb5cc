package com.agentrelay.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Control WebSocket: request frames are dispatched to {@link GatewayMethodRouter},
 * events are pushed through {@link EventBroadcaster}.
 */
@Slf4j
public class GatewayWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final GatewayMethodRouter methodRouter;
    private final EventBroadcaster broadcaster;
    private final Map<String, GatewayConnection> connections = new ConcurrentHashMap<>();

    public GatewayWebSocketHandler(ObjectMapper objectMapper, GatewayMethodRouter methodRouter,
            EventBroadcaster broadcaster) {
        this.objectMapper = objectMapper;
        this.methodRouter = methodRouter;
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        GatewayConnection connection = new GatewayConnection(session.getId(), session);
        connections.put(session.getId(), connection);
        broadcaster.addConnection(connection);
        log.debug("ws:in:open conn={}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connections.remove(session.getId());
        broadcaster.removeConnection(session.getId());
        log.debug("ws:in:close conn={} code={}", session.getId(), status.getCode());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        GatewayConnection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        handleFrame(connection, message.getPayload());
    }

    void handleFrame(GatewayConnection connection, String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("parse error conn={}: {}", connection.getConnectionId(), e.getMessage());
            connection.sendResponse(ProtocolFrames.ResponseFrame.failure(null,
                    ProtocolFrames.ErrorCodes.INVALID_REQUEST, "invalid JSON"), objectMapper);
            return;
        }
        String id = node.hasNonNull("id") ? node.get("id").asText() : null;
        String method = node.hasNonNull("method") ? node.get("method").asText() : null;
        if (id == null || id.isEmpty() || method == null || method.isEmpty()) {
            connection.sendResponse(ProtocolFrames.ResponseFrame.failure(id,
                    ProtocolFrames.ErrorCodes.INVALID_REQUEST, "invalid request frame"), objectMapper);
            return;
        }

        log.debug("ws:in:req conn={} id={} method={}", connection.getConnectionId(), id, method);
        methodRouter.dispatch(method, node.get("params"), connection)
                .thenAccept(result -> connection.sendResponse(
                        ProtocolFrames.ResponseFrame.success(id, result), objectMapper))
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    String code;
                    if (cause instanceof UnsupportedOperationException) {
                        code = ProtocolFrames.ErrorCodes.NOT_FOUND;
                        log.debug("method not found: {}", method);
                    } else if (cause instanceof IllegalArgumentException) {
                        code = ProtocolFrames.ErrorCodes.INVALID_REQUEST;
                        log.debug("method {} rejected: {}", method, cause.getMessage());
                    } else {
                        code = ProtocolFrames.ErrorCodes.UNAVAILABLE;
                        log.error("method {} failed: {}", method, cause.getMessage(), cause);
                    }
                    connection.sendResponse(ProtocolFrames.ResponseFrame.failure(id, code, cause.getMessage()),
                            objectMapper);
                    return null;
                });
    }

    public int getConnectionCount() {
        return connections.size();
    }
}
