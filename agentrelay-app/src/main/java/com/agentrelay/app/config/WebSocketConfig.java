package com.agentrelay.app.config;

import com.agentrelay.gateway.websocket.EventBroadcaster;
import com.agentrelay.gateway.websocket.GatewayMethodRouter;
import com.agentrelay.gateway.websocket.GatewayWebSocketHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Control WebSocket at {@code agentrelay.ws.path}. Clients without an Origin header
 * (the desktop app, channel bridges) are always accepted; browser origins must match
 * {@code agentrelay.ws.allowed-origins}.
 */
@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ObjectMapper objectMapper;
    private final GatewayMethodRouter methodRouter;
    private final EventBroadcaster broadcaster;

    @Value("${agentrelay.ws.path:/ws}")
    private String path;
    @Value("${agentrelay.ws.allowed-origins:http://localhost:*,http://127.0.0.1:*}")
    private String[] allowedOrigins;
    @Value("${agentrelay.ws.max-frame-bytes:524288}")
    private int maxFrameBytes;

    public WebSocketConfig(ObjectMapper objectMapper, GatewayMethodRouter methodRouter,
            EventBroadcaster broadcaster) {
        this.objectMapper = objectMapper;
        this.methodRouter = methodRouter;
        this.broadcaster = broadcaster;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(gatewayWebSocketHandler(), path)
                .setAllowedOriginPatterns(allowedOrigins);
        log.info("Control WebSocket at {} (origins {})", path, String.join(",", allowedOrigins));
    }

    @Bean
    public GatewayWebSocketHandler gatewayWebSocketHandler() {
        return new GatewayWebSocketHandler(objectMapper, methodRouter, broadcaster);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxFrameBytes);
        // no idle timeout: clients stay quiet while an approval is pending
        container.setMaxSessionIdleTimeout(0L);
        return container;
    }
}
