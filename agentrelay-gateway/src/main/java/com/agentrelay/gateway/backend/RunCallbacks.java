package com.agentrelay.gateway.backend;

import java.util.concurrent.CompletionStage;

/**
 * Hooks the router gives the backend for one run. Callbacks may arrive on any thread.
 */
public interface RunCallbacks {

    /** The backend announced its own session id; it is passed back on the next run. */
    void onContinuationId(String continuationId);

    /** Assistant text as it streams. */
    void onText(String text);

    /**
     * The backend proposes an action. The run must not perform it until the stage
     * completes; an allowed decision lets it proceed.
     */
    CompletionStage<ToolDecision> onToolProposed(ProposedAction action);

    /** Result of an action that was performed. */
    void onToolResult(String toolUseId, String content, boolean error);

    /** The backend asks the user to pick among options. */
    CompletionStage<QuestionAnswer> onQuestion(QuestionRequest question);
}
