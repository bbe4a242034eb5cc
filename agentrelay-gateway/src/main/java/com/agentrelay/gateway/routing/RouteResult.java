package com.agentrelay.gateway.routing;

import java.util.concurrent.CompletableFuture;

/**
 * Result of routing one inbound message.
 *
 * @param run completion of the started run; null unless {@link RouteStatus#STARTED}
 */
public record RouteResult(RouteStatus status, String sessionKey, String detail, CompletableFuture<RunOutcome> run) {

    public static RouteResult started(String sessionKey, CompletableFuture<RunOutcome> run) {
        return new RouteResult(RouteStatus.STARTED, sessionKey, null, run);
    }

    public static RouteResult of(RouteStatus status, String sessionKey, String detail) {
        return new RouteResult(status, sessionKey, detail, null);
    }
}
