package com.agentrelay.gateway.backend;

import java.util.concurrent.CompletableFuture;

/**
 * A started backend run.
 */
public interface RunHandle {

    /** Completes with the final result, or exceptionally when the run fails. */
    CompletableFuture<BackendResult> completion();

    /** Abort the run. Idempotent; the completion future settles afterwards. */
    void cancel();
}
