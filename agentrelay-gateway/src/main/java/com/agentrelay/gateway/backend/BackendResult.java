package com.agentrelay.gateway.backend;

/**
 * Final result reported by the backend when a run completes normally.
 */
public record BackendResult(String text, String continuationId, double costUsd) {

    public static BackendResult of(String text) {
        return new BackendResult(text, null, 0);
    }
}
