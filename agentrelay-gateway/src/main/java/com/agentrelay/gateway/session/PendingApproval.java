package com.agentrelay.gateway.session;

import com.agentrelay.gateway.backend.ToolDecision;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A proposed action waiting for a human decision.
 *
 * @param sessionKey session whose run proposed the action
 * @param promptKey  session key of the conversation the prompt was rendered in
 */
public record PendingApproval(
        String requestId,
        String toolUseId,
        String toolName,
        Map<String, Object> input,
        String sessionKey,
        String promptChannel,
        String promptConversation,
        String promptKey,
        long createdAtMs,
        CompletableFuture<ToolDecision> decision) {
}
