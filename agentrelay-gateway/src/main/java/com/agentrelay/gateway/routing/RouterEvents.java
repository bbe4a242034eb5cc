package com.agentrelay.gateway.routing;

/**
 * Receives gateway events for the control surface, e.g. {@code agent.text} or
 * {@code approval.requested}. Implementations must not block.
 */
@FunctionalInterface
public interface RouterEvents {

    RouterEvents NONE = (event, payload) -> {
    };

    void emit(String event, Object payload);
}
