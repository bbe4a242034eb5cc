package com.agentrelay.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-based registry of control methods. Handlers always receive a params object,
 * empty when the caller sent none.
 */
@Slf4j
public class GatewayMethodRouter {

    @FunctionalInterface
    public interface MethodHandler {
        /**
         * @param connection calling connection; null for in-process calls
         */
        CompletableFuture<Object> handle(JsonNode params, GatewayConnection connection);
    }

    private final Map<String, MethodHandler> methodHandlers = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException when the name is already taken
     */
    public void registerMethod(String method, MethodHandler handler) {
        if (methodHandlers.putIfAbsent(method, handler) != null) {
            throw new IllegalStateException("Control method registered twice: " + method);
        }
        log.debug("Registered control method {}", method);
    }

    /**
     * Dispatch a call. Unknown methods fail with {@link UnsupportedOperationException};
     * handlers that throw synchronously yield a failed future.
     */
    public CompletableFuture<Object> dispatch(String method, JsonNode params, GatewayConnection connection) {
        MethodHandler handler = methodHandlers.get(method);
        if (handler == null) {
            return CompletableFuture.failedFuture(
                    new UnsupportedOperationException("Unknown control method: " + method));
        }
        JsonNode effective = params == null || params.isNull() || params.isMissingNode()
                ? JsonNodeFactory.instance.objectNode()
                : params;
        try {
            CompletableFuture<Object> result = handler.handle(effective, connection);
            return result != null ? result : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public boolean hasMethod(String method) {
        return methodHandlers.containsKey(method);
    }

    public Set<String> getRegisteredMethods() {
        return Collections.unmodifiableSet(new TreeSet<>(methodHandlers.keySet()));
    }
}
