package com.agentrelay.gateway.session;

import com.agentrelay.gateway.backend.QuestionAnswer;
import com.agentrelay.gateway.backend.QuestionRequest;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A backend question waiting for the user's choice.
 */
public record PendingQuestion(
        String requestId,
        String question,
        List<QuestionRequest.Option> options,
        String sessionKey,
        String promptChannel,
        String promptConversation,
        String promptKey,
        long createdAtMs,
        CompletableFuture<QuestionAnswer> answer) {
}
