package com.agentrelay.gateway.backend;

/**
 * The conversational-automation backend the router drives.
 */
public interface AutomationBackend {

    /**
     * Start a run. Implementations must not block the caller until completion.
     */
    RunHandle run(RunRequest request, RunCallbacks callbacks);
}
