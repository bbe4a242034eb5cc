package com.agentrelay.app.health;

import com.agentrelay.gateway.session.SessionRegistry;
import com.agentrelay.gateway.websocket.EventBroadcaster;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness probe.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SessionRegistry sessions;
    private final EventBroadcaster broadcaster;

    public HealthEndpoint(SessionRegistry sessions, EventBroadcaster broadcaster) {
        this.sessions = sessions;
        this.broadcaster = broadcaster;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        ObjectNode node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());
        node.put("sessions", sessions.size());
        node.put("activeRuns", sessions.activeRunKeys().size());
        node.put("clients", broadcaster.getConnectedCount());

        ObjectNode memory = node.putObject("memory");
        Runtime rt = Runtime.getRuntime();
        memory.put("used_mb", (rt.totalMemory() - rt.freeMemory()) / (1024 * 1024));
        memory.put("max_mb", rt.maxMemory() / (1024 * 1024));
        return node;
    }
}
