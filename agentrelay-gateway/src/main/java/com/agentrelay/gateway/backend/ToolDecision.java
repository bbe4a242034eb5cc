package com.agentrelay.gateway.backend;

/**
 * Router verdict on a proposed action.
 */
public record ToolDecision(boolean allowed, String reason) {

    public static ToolDecision allow() {
        return new ToolDecision(true, null);
    }

    public static ToolDecision deny(String reason) {
        return new ToolDecision(false, reason);
    }
}
