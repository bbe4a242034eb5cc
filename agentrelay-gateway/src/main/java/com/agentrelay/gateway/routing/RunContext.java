package com.agentrelay.gateway.routing;

import com.agentrelay.gateway.backend.PermissionMode;
import com.agentrelay.gateway.backend.RunHandle;
import com.agentrelay.gateway.channel.ChatType;
import com.agentrelay.gateway.channel.InboundMessage;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-run state shared between the router and the backend callbacks of one run.
 */
final class RunContext {

    final String runId;
    final String sessionKey;
    final String source;
    final String prompt;
    final String channel;
    final String conversationId;
    final ChatType chatType;
    final PermissionMode permissionMode;
    /** Live message that started the run; null for triggers. */
    final InboundMessage origin;
    /** Trigger that started the run; null for live messages. */
    final TriggerRequest trigger;
    final CompletableFuture<RunOutcome> outcome = new CompletableFuture<>();

    final Set<String> approvalIds = ConcurrentHashMap.newKeySet();
    final Set<String> questionIds = ConcurrentHashMap.newKeySet();

    volatile String statusMessageId;
    volatile String lastText;
    volatile boolean manualSendOccurred;
    volatile boolean timedOut;
    volatile RunHandle handle;
    volatile ScheduledFuture<?> timeoutTask;

    RunContext(String runId, String sessionKey, String source, String prompt, String channel,
            String conversationId, ChatType chatType, PermissionMode permissionMode,
            InboundMessage origin, TriggerRequest trigger) {
        this.runId = runId;
        this.sessionKey = sessionKey;
        this.source = source;
        this.prompt = prompt;
        this.channel = channel;
        this.conversationId = conversationId;
        this.chatType = chatType;
        this.permissionMode = permissionMode;
        this.origin = origin;
        this.trigger = trigger;
    }

    boolean isLive() {
        return origin != null;
    }
}
