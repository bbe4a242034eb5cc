package com.agentrelay.gateway.websocket;

import com.agentrelay.gateway.routing.RouterEvents;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans router, cron and heartbeat events out to every attached control client.
 * Connections whose socket has gone away are dropped on the next broadcast.
 */
@Slf4j
public class EventBroadcaster implements RouterEvents {

    private final Map<String, GatewayConnection> connections = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public EventBroadcaster(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void addConnection(GatewayConnection connection) {
        connections.put(connection.getConnectionId(), connection);
    }

    public void removeConnection(String connectionId) {
        connections.remove(connectionId);
    }

    @Override
    public void emit(String event, Object data) {
        broadcastToAll(event, data);
    }

    /**
     * @return number of clients the event reached
     */
    public int broadcastToAll(String event, Object data) {
        ProtocolFrames.EventFrame frame = ProtocolFrames.EventFrame.of(event, data);
        int delivered = 0;
        Iterator<GatewayConnection> it = connections.values().iterator();
        while (it.hasNext()) {
            GatewayConnection conn = it.next();
            if (!conn.isOpen()) {
                it.remove();
                log.debug("Dropped closed connection {}", conn.getConnectionId());
                continue;
            }
            try {
                if (conn.sendEvent(frame, objectMapper)) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to broadcast event {} to {}: {}", event, conn.getConnectionId(), e.getMessage());
            }
        }
        return delivered;
    }

    public int getConnectedCount() {
        return (int) connections.values().stream().filter(GatewayConnection::isOpen).count();
    }
}
