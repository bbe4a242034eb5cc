package com.agentrelay.gateway.routing;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point used by schedulers to start runs through the router.
 */
@FunctionalInterface
public interface TriggerDispatcher {

    /**
     * Start a run for the trigger. The future never completes exceptionally; failures are
     * reported through {@link RunOutcome#status()}.
     */
    CompletableFuture<RunOutcome> dispatchTrigger(TriggerRequest request);
}
