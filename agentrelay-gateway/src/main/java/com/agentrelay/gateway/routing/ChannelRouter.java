package com.agentrelay.gateway.routing;

import com.agentrelay.common.infra.DedupeCache;
import com.agentrelay.gateway.backend.AutomationBackend;
import com.agentrelay.gateway.backend.BackendResult;
import com.agentrelay.gateway.backend.PermissionMode;
import com.agentrelay.gateway.backend.ProposedAction;
import com.agentrelay.gateway.backend.QuestionAnswer;
import com.agentrelay.gateway.backend.QuestionRequest;
import com.agentrelay.gateway.backend.RunCallbacks;
import com.agentrelay.gateway.backend.RunHandle;
import com.agentrelay.gateway.backend.RunRequest;
import com.agentrelay.gateway.backend.ToolDecision;
import com.agentrelay.gateway.channel.ChannelAdapter;
import com.agentrelay.gateway.channel.ChannelAdapterRegistry;
import com.agentrelay.gateway.channel.ChatType;
import com.agentrelay.gateway.channel.InboundMessage;
import com.agentrelay.gateway.channel.OutboundResult;
import com.agentrelay.gateway.channel.SendOptions;
import com.agentrelay.gateway.policy.ToolRiskClassifier;
import com.agentrelay.gateway.policy.ToolRiskTier;
import com.agentrelay.gateway.session.PendingApproval;
import com.agentrelay.gateway.session.PendingQuestion;
import com.agentrelay.gateway.session.SessionDescriptor;
import com.agentrelay.gateway.session.SessionInfo;
import com.agentrelay.gateway.session.SessionKeys;
import com.agentrelay.gateway.session.SessionRegistry;
import com.agentrelay.gateway.session.SessionTranscriptStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single entry point for inbound messages and scheduled triggers.
 *
 * <p>
 * Decides whether a run starts, enforces one active run per session key, drives
 * approval and question round-trips through the originating channel, and delivers the
 * final result. The run gate of a key is released on every exit path of its run; when
 * messages were queued meanwhile, the gate is handed straight to one batched follow-up run.
 * </p>
 */
@Slf4j
public class ChannelRouter implements TriggerDispatcher {

    /** Backend reply meaning "nothing to send". */
    public static final String SILENT_REPLY = "SILENT_REPLY";

    static final String THINKING = "thinking...";
    static final String QUEUED_NOTICE = "got it, I'll get to this after I'm done";
    static final String BUSY_NOTICE = "still working on the previous request";
    static final String EXPIRED_NOTICE = "that request has expired";
    static final int TOOL_RESULT_PREVIEW_CHARS = 2000;
    static final int ACTION_SUMMARY_CHARS = 300;
    static final long DELIVERY_TIMEOUT_MS = 30_000;
    private static final int DEDUPE_MAX_ENTRIES = 1000;

    private final RouterSettings settings;
    private final SessionRegistry registry;
    private final SessionTranscriptStore transcripts;
    private final ChannelAdapterRegistry adapters;
    private final AutomationBackend backend;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final RouterEvents events;
    private final DedupeCache dedupe;
    private final ObjectMapper mapper = new ObjectMapper();

    /** Guards the run gate together with {@link #queues}. */
    private final Object gateLock = new Object();
    private final Map<String, Deque<InboundMessage>> queues = new HashMap<>();
    private final Map<String, RunContext> runs = new ConcurrentHashMap<>();

    public ChannelRouter(RouterSettings settings, SessionRegistry registry, SessionTranscriptStore transcripts,
            ChannelAdapterRegistry adapters, AutomationBackend backend, ScheduledExecutorService scheduler,
            Clock clock, RouterEvents events) {
        this.settings = settings;
        this.registry = registry;
        this.transcripts = transcripts;
        this.adapters = adapters;
        this.backend = backend;
        this.scheduler = scheduler;
        this.clock = clock;
        this.events = events != null ? events : RouterEvents.NONE;
        this.dedupe = new DedupeCache(Duration.ofMillis(settings.getDedupeWindowMs()), DEDUPE_MAX_ENTRIES, clock);
    }

    public RouterSettings getSettings() {
        return settings;
    }

    // =========================================================================
    // Inbound messages
    // =========================================================================

    /**
     * Route one inbound message.
     *
     * @return the routing decision; fails with {@link IllegalArgumentException} when the
     *         message lacks a channel or conversation id
     */
    public CompletableFuture<RouteResult> route(InboundMessage msg) {
        try {
            return CompletableFuture.completedFuture(routeNow(msg));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private RouteResult routeNow(InboundMessage msg) {
        if (msg == null) {
            throw new IllegalArgumentException("message required");
        }
        SessionDescriptor descriptor = SessionDescriptor.of(msg);
        String key = descriptor.key();
        String body = msg.getBody() != null ? msg.getBody() : "";
        long now = clock.millis();
        emit("channel.message", payload(
                "channel", msg.getChannel(),
                "conversationId", msg.getConversationId(),
                "chatType", descriptor.chatType().key(),
                "senderId", msg.getSenderId(),
                "senderName", msg.getSenderName(),
                "body", body,
                "timestamp", msg.getTimestamp()));

        if (dedupe.isDuplicate(dedupeKey(msg, body, now))) {
            log.debug("Duplicate message suppressed for {}", key);
            return RouteResult.of(RouteStatus.DUPLICATE, key, null);
        }

        Optional<String> commandReply = handleCommand(descriptor, key, body);
        if (commandReply.isPresent()) {
            sendNotice(msg, commandReply.get());
            return RouteResult.of(RouteStatus.COMMAND, key, commandReply.get());
        }

        RouteResult resolved = resolveReply(key, body, msg.getSenderId());
        if (resolved != null) {
            return resolved;
        }
        if (ReplyMatcher.isButtonData(body)) {
            log.info("Stale button reply in {}: {}", key, body.trim());
            sendNotice(msg, EXPIRED_NOTICE);
            return RouteResult.of(RouteStatus.EXPIRED, key, EXPIRED_NOTICE);
        }

        SessionInfo session = resolveSession(descriptor, now);
        registry.incrementMessages(key);
        transcripts.appendInbound(session.getSessionId(), msg.getChannel(), msg.getSenderId(), body);

        synchronized (gateLock) {
            if (!registry.tryBeginRun(key)) {
                return busy(msg, key);
            }
        }
        RunContext ctx = liveContext(key, msg, formatPrompt(msg, body));
        log.info("Run {} started for {} ({})", ctx.runId, key, ctx.source);
        return RouteResult.started(key, startRun(ctx));
    }

    /** Caller holds {@link #gateLock}. */
    private RouteResult busy(InboundMessage msg, String key) {
        if (settings.getBusyPolicy() == BusyPolicy.QUEUE) {
            Deque<InboundMessage> queue = queues.computeIfAbsent(key, k -> new ArrayDeque<>());
            if (queue.size() < settings.getMaxQueuedMessages()) {
                queue.addLast(msg);
                log.info("Session {} busy, queued message ({} waiting)", key, queue.size());
                sendNotice(msg, QUEUED_NOTICE);
                return RouteResult.of(RouteStatus.QUEUED, key, QUEUED_NOTICE);
            }
            log.warn("Session {} busy and queue is full, rejecting message", key);
        } else {
            log.info("Session {} busy, rejecting message", key);
        }
        sendNotice(msg, BUSY_NOTICE);
        return RouteResult.of(RouteStatus.REJECTED, key, BUSY_NOTICE);
    }

    private SessionInfo resolveSession(SessionDescriptor descriptor, long now) {
        String key = descriptor.key();
        SessionInfo session = registry.getOrCreate(descriptor);
        long idle = now - session.getLastMessageAt();
        if (session.getMessageCount() > 0 && idle > settings.getIdleResetMs() && !registry.isRunActive(key)) {
            log.info("Idle timeout for {} ({}h), starting new session", key, idle / 3_600_000L);
            session = registry.reset(key).orElse(session);
        }
        return session;
    }

    private String dedupeKey(InboundMessage msg, String body, long now) {
        long ts = msg.getTimestamp() > 0 ? msg.getTimestamp() : now;
        long window = Math.max(1, settings.getDedupeWindowMs());
        return msg.getChannel() + "|" + msg.getConversationId() + "|" + msg.getSenderId() + "|" + body
                + "|" + (ts / window);
    }

    private String formatPrompt(InboundMessage msg, String body) {
        if (settings.getOwnerChannel().equals(msg.getChannel())) {
            return body;
        }
        String sender = msg.getSenderName() != null ? msg.getSenderName()
                : msg.getSenderId() != null ? msg.getSenderId() : "unknown";
        return "[Incoming " + msg.getChannel() + " message from " + sender + " in chat "
                + msg.getConversationId() + "]\n" + body;
    }

    private RunContext liveContext(String key, InboundMessage msg, String prompt) {
        boolean ownerPresent = settings.getOwnerChannel().equals(msg.getChannel());
        PermissionMode mode = ownerPresent ? settings.getOwnerPermissionMode() : PermissionMode.DEFAULT;
        ChatType chatType = msg.getChatType() != null ? msg.getChatType() : ChatType.DM;
        return new RunContext(newId("run"), key, msg.getChannel() + "/" + msg.getConversationId(), prompt,
                msg.getChannel(), msg.getConversationId(), chatType, mode, msg, null);
    }

    // =========================================================================
    // Chat commands
    // =========================================================================

    private Optional<String> handleCommand(SessionDescriptor descriptor, String key, String body) {
        String text = body.trim();
        if (!text.startsWith("/")) {
            return Optional.empty();
        }
        String command = text.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        int at = command.indexOf('@');
        if (at > 0) {
            command = command.substring(0, at);
        }
        switch (command) {
            case "/new": {
                Optional<SessionInfo> old = registry.get(key);
                synchronized (gateLock) {
                    queues.remove(key);
                }
                if (old.isPresent()) {
                    int count = old.get().getMessageCount();
                    registry.reset(key);
                    log.info("Session {} reset by /new", key);
                    return Optional.of("session reset. old: " + count + " messages. new session started.");
                }
                registry.getOrCreate(descriptor);
                return Optional.of("new session started.");
            }
            case "/status": {
                Optional<SessionInfo> session = registry.get(key);
                if (session.isEmpty()) {
                    return Optional.of("no active session for this chat.");
                }
                SessionInfo s = session.get();
                long ageMin = Math.max(0, clock.millis() - s.getLastMessageAt()) / 60_000L;
                String id = s.getSessionId();
                return Optional.of(String.join("\n",
                        "session: " + (id.length() > 30 ? id.substring(0, 30) : id),
                        "messages: " + s.getMessageCount(),
                        "last activity: " + ageMin + "m ago",
                        "active: " + (registry.isRunActive(key) ? "yes" : "no"),
                        "queued: " + queuedCount(key)));
            }
            default:
                return Optional.empty();
        }
    }

    // =========================================================================
    // Replies to pending approvals / questions
    // =========================================================================

    private RouteResult resolveReply(String promptKey, String body, String senderId) {
        Optional<PendingApproval> approval = registry.findApprovalByPromptKey(promptKey);
        if (approval.isPresent()) {
            PendingApproval pending = approval.get();
            Optional<ReplyMatcher.ApprovalReply> reply = ReplyMatcher.matchApproval(body, pending.requestId());
            if (reply.isPresent()
                    && resolveApproval(pending, reply.get().approved(), reply.get().reason(), "channel:" + senderId)) {
                return RouteResult.of(RouteStatus.APPROVAL_RESOLVED, pending.sessionKey(),
                        reply.get().approved() ? "approved" : "denied");
            }
        }
        Optional<PendingQuestion> question = registry.findQuestionByPromptKey(promptKey);
        if (question.isPresent()) {
            PendingQuestion pending = question.get();
            OptionalInt index = ReplyMatcher.matchQuestion(body, pending.requestId(), pending.options());
            if (index.isPresent() && answerQuestion(pending, index.getAsInt(), "channel:" + senderId)) {
                return RouteResult.of(RouteStatus.QUESTION_ANSWERED, pending.sessionKey(),
                        pending.options().get(index.getAsInt()).label());
            }
        }
        return null;
    }

    /**
     * Resolve a pending approval by request id, e.g. from the control surface.
     *
     * @return false if no such approval is pending
     */
    public boolean resolveApproval(String requestId, boolean approved, String reason) {
        return registry.findApprovalByRequestId(requestId)
                .map(p -> resolveApproval(p, approved, reason, "control"))
                .orElse(false);
    }

    private boolean resolveApproval(PendingApproval pending, boolean approved, String reason, String resolvedBy) {
        Optional<PendingApproval> cleared = registry.clearPendingApproval(pending.sessionKey(), pending.requestId());
        if (cleared.isEmpty()) {
            return false;
        }
        ToolDecision decision = approved
                ? ToolDecision.allow()
                : ToolDecision.deny(reason != null && !reason.isBlank() ? reason : "denied by user");
        log.info("Approval {} ({}) for {} {} by {}", pending.requestId(), pending.toolName(),
                pending.sessionKey(), approved ? "approved" : "denied", resolvedBy);
        emit("approval.resolved", payload(
                "requestId", pending.requestId(),
                "sessionKey", pending.sessionKey(),
                "approved", approved,
                "reason", decision.reason(),
                "resolvedBy", resolvedBy));
        pending.decision().complete(decision);
        return true;
    }

    /**
     * Answer a pending question by request id with a zero-based option index.
     *
     * @return false if no such question is pending or the index is out of range
     */
    public boolean answerQuestion(String requestId, int index) {
        return registry.findQuestionByRequestId(requestId)
                .filter(p -> index >= 0 && index < p.options().size())
                .map(p -> answerQuestion(p, index, "control"))
                .orElse(false);
    }

    private boolean answerQuestion(PendingQuestion pending, int index, String answeredBy) {
        Optional<PendingQuestion> cleared = registry.clearPendingQuestion(pending.sessionKey(), pending.requestId());
        if (cleared.isEmpty()) {
            return false;
        }
        String label = pending.options().get(index).label();
        log.info("Question {} for {} answered with option {} ({}) by {}", pending.requestId(),
                pending.sessionKey(), index + 1, label, answeredBy);
        emit("question.answered", payload(
                "requestId", pending.requestId(),
                "sessionKey", pending.sessionKey(),
                "index", index,
                "label", label,
                "answeredBy", answeredBy));
        pending.answer().complete(QuestionAnswer.of(index, label));
        return true;
    }

    // =========================================================================
    // Scheduled triggers
    // =========================================================================

    /**
     * Start a run for a scheduled trigger. Busy sessions yield {@link RunStatus#SKIPPED} with
     * reason {@value RunOutcome#REASON_BUSY}. Trigger runs always use the restricted
     * permission mode.
     */
    @Override
    public CompletableFuture<RunOutcome> dispatchTrigger(TriggerRequest request) {
        try {
            if (request == null || request.getSession() == null
                    || request.getPrompt() == null || request.getPrompt().isBlank()) {
                return CompletableFuture.completedFuture(RunOutcome.error(null, null, "invalid trigger"));
            }
            SessionDescriptor descriptor = request.getSession();
            String key = descriptor.key();
            SessionInfo session = registry.getOrCreate(descriptor);
            synchronized (gateLock) {
                if (!registry.tryBeginRun(key)) {
                    log.info("Trigger {} skipped: session {} is busy", request.getSource(), key);
                    return CompletableFuture.completedFuture(RunOutcome.skipped(key, RunOutcome.REASON_BUSY));
                }
            }
            transcripts.appendInbound(session.getSessionId(), "trigger", request.getSource(), request.getPrompt());
            RunContext ctx = new RunContext(newId("run"), key, request.getSource(), request.getPrompt(),
                    descriptor.channel(), descriptor.conversationId(), descriptor.chatType(),
                    PermissionMode.DEFAULT, null, request);
            log.info("Run {} started for {} ({})", ctx.runId, key, ctx.source);
            return startRun(ctx);
        } catch (RuntimeException e) {
            log.error("Failed to dispatch trigger {}: {}", request != null ? request.getSource() : null,
                    e.getMessage(), e);
            return CompletableFuture.completedFuture(RunOutcome.error(null, null, e.getMessage()));
        }
    }

    // =========================================================================
    // Run lifecycle
    // =========================================================================

    private CompletableFuture<RunOutcome> startRun(RunContext ctx) {
        runs.put(ctx.sessionKey, ctx);
        emit("status.update", payload("activeRun", true, "sessionKey", ctx.sessionKey, "source", ctx.source));
        emit("agent.started", payload(
                "runId", ctx.runId,
                "sessionKey", ctx.sessionKey,
                "source", ctx.source,
                "prompt", ctx.prompt,
                "permissionMode", ctx.permissionMode.key()));

        CompletableFuture<RunOutcome> done = new CompletableFuture<>();
        ctx.outcome.whenComplete((outcome, err) -> {
            RunOutcome effective = err != null
                    ? RunOutcome.error(ctx.runId, ctx.sessionKey, rootMessage(err))
                    : outcome;
            finishRun(ctx, effective).whenComplete((v, e) -> done.complete(effective));
        });

        CompletableFuture<Void> status = ctx.isLive() && settings.isStatusMessages()
                ? postStatusMessage(ctx)
                : CompletableFuture.completedFuture(null);
        status.whenComplete((v, e) -> launch(ctx));
        return done;
    }

    private void launch(RunContext ctx) {
        try {
            SessionInfo session = registry.get(ctx.sessionKey).orElse(null);
            RunRequest request = RunRequest.builder()
                    .runId(ctx.runId)
                    .prompt(ctx.prompt)
                    .sessionId(session != null ? session.getSessionId() : null)
                    .continuationId(session != null ? session.getContinuationId() : null)
                    .permissionMode(ctx.permissionMode)
                    .channel(ctx.channel)
                    .source(ctx.source)
                    .workspace(settings.getWorkspace())
                    .model(ctx.trigger != null && ctx.trigger.getModel() != null
                            ? ctx.trigger.getModel()
                            : settings.getModel())
                    .build();
            RunHandle handle = backend.run(request, new Callbacks(ctx));
            ctx.handle = handle;
            if (settings.getRunTimeoutMs() > 0) {
                ctx.timeoutTask = scheduler.schedule(() -> onTimeout(ctx), settings.getRunTimeoutMs(),
                        TimeUnit.MILLISECONDS);
            }
            handle.completion().whenComplete((result, err) -> onBackendDone(ctx, result, err));
        } catch (RuntimeException e) {
            log.error("Backend failed to start run {} for {}: {}", ctx.runId, ctx.sessionKey, e.getMessage(), e);
            ctx.outcome.complete(RunOutcome.error(ctx.runId, ctx.sessionKey, rootMessage(e)));
        }
    }

    private void onBackendDone(RunContext ctx, BackendResult result, Throwable err) {
        if (err != null) {
            if (ctx.timedOut) {
                ctx.outcome.complete(RunOutcome.timedOut(ctx.runId, ctx.sessionKey));
                return;
            }
            if (!ctx.outcome.isDone()) {
                log.warn("Run {} for {} failed: {}", ctx.runId, ctx.sessionKey, rootMessage(err));
            }
            ctx.outcome.complete(RunOutcome.error(ctx.runId, ctx.sessionKey, rootMessage(err)));
            return;
        }
        if (result != null && result.continuationId() != null) {
            registry.setContinuationId(ctx.sessionKey, result.continuationId());
        }
        String text = result != null && result.text() != null ? result.text() : ctx.lastText;
        ctx.outcome.complete(RunOutcome.completed(ctx.runId, ctx.sessionKey, text));
    }

    private void onTimeout(RunContext ctx) {
        if (ctx.outcome.isDone()) {
            return;
        }
        log.warn("Run {} for {} timed out after {}ms, cancelling", ctx.runId, ctx.sessionKey,
                settings.getRunTimeoutMs());
        ctx.timedOut = true;
        RunHandle handle = ctx.handle;
        if (handle != null) {
            try {
                handle.cancel();
            } catch (RuntimeException e) {
                log.warn("Cancelling run {} failed: {}", ctx.runId, e.getMessage());
            }
        }
        ctx.outcome.complete(RunOutcome.timedOut(ctx.runId, ctx.sessionKey));
    }

    /**
     * Abort the active run of a session, if any.
     *
     * @return false when the session has no active run
     */
    public boolean abortRun(String sessionKey) {
        RunContext ctx = runs.get(sessionKey);
        if (ctx == null) {
            return false;
        }
        boolean aborted = ctx.outcome.complete(RunOutcome.error(ctx.runId, sessionKey, "aborted"));
        RunHandle handle = ctx.handle;
        if (handle != null) {
            try {
                handle.cancel();
            } catch (RuntimeException e) {
                log.warn("Cancelling run {} failed: {}", ctx.runId, e.getMessage());
            }
        }
        if (aborted) {
            log.info("Run {} for {} aborted", ctx.runId, sessionKey);
        }
        return aborted;
    }

    private CompletableFuture<Void> finishRun(RunContext ctx, RunOutcome outcome) {
        CompletableFuture<Void> delivery;
        try {
            ScheduledFuture<?> timeout = ctx.timeoutTask;
            if (timeout != null) {
                timeout.cancel(false);
            }
            abandonPending(ctx);
            publishOutcome(ctx, outcome);
            delivery = deliverResult(ctx, outcome);
        } catch (RuntimeException e) {
            log.error("Failed to finish run {} for {}: {}", ctx.runId, ctx.sessionKey, e.getMessage(), e);
            delivery = CompletableFuture.completedFuture(null);
        }
        return delivery
                .orTimeout(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .handle((v, err) -> {
                    if (err != null) {
                        log.warn("Delivering result of run {} failed: {}", ctx.runId, rootMessage(err));
                    }
                    releaseGate(ctx);
                    return null;
                });
    }

    private void publishOutcome(RunContext ctx, RunOutcome outcome) {
        Optional<String> sessionId = registry.get(ctx.sessionKey).map(SessionInfo::getSessionId);
        if (outcome.isCompleted()) {
            log.info("Run {} for {} completed", ctx.runId, ctx.sessionKey);
            if (outcome.text() != null && !outcome.text().isBlank()) {
                sessionId.ifPresent(id -> transcripts.appendOutbound(id, ctx.channel, outcome.text()));
            }
            emit("agent.result", payload(
                    "runId", ctx.runId,
                    "sessionKey", ctx.sessionKey,
                    "source", ctx.source,
                    "result", outcome.text()));
        } else {
            sessionId.ifPresent(id -> transcripts.appendSystem(id,
                    "run " + outcome.status().wireName() + ": " + outcome.detail()));
            emit("agent.error", payload(
                    "runId", ctx.runId,
                    "sessionKey", ctx.sessionKey,
                    "source", ctx.source,
                    "status", outcome.status().wireName(),
                    "error", outcome.detail()));
        }
    }

    /**
     * Hands the gate to the queued messages of the key or clears it. A run whose session was
     * removed and restarted meanwhile no longer owns the gate and leaves it alone.
     */
    private void releaseGate(RunContext ctx) {
        List<InboundMessage> batch = null;
        synchronized (gateLock) {
            if (!runs.remove(ctx.sessionKey, ctx)) {
                log.debug("Run {} no longer owns the gate of {}", ctx.runId, ctx.sessionKey);
                return;
            }
            Deque<InboundMessage> queue = queues.remove(ctx.sessionKey);
            if (queue != null && !queue.isEmpty()) {
                batch = new ArrayList<>(queue);
                if (registry.get(ctx.sessionKey).isEmpty()) {
                    // session removed mid-run: queued senders were promised a run
                    registry.getOrCreate(SessionDescriptor.of(batch.get(batch.size() - 1)));
                    registry.tryBeginRun(ctx.sessionKey);
                }
            } else {
                registry.setActiveRun(ctx.sessionKey, false);
            }
        }
        if (batch == null) {
            emit("status.update", payload("activeRun", false, "sessionKey", ctx.sessionKey, "source", ctx.source));
            return;
        }
        startBatch(ctx.sessionKey, batch);
    }

    /** Gate of {@code key} is already held. */
    private void startBatch(String key, List<InboundMessage> batch) {
        InboundMessage last = batch.get(batch.size() - 1);
        String body;
        if (batch.size() == 1) {
            body = last.getBody() != null ? last.getBody() : "";
        } else {
            StringBuilder sb = new StringBuilder("Multiple messages:");
            for (int i = 0; i < batch.size(); i++) {
                String b = batch.get(i).getBody();
                sb.append('\n').append(i + 1).append(". ").append(b != null ? b : "");
            }
            body = sb.toString();
        }
        RunContext ctx = liveContext(key, last, formatPrompt(last, body));
        log.info("Run {} started for {} with {} queued message(s)", ctx.runId, key, batch.size());
        startRun(ctx);
    }

    // =========================================================================
    // Backend callbacks
    // =========================================================================

    private final class Callbacks implements RunCallbacks {
        private final RunContext ctx;

        Callbacks(RunContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public void onContinuationId(String continuationId) {
            registry.setContinuationId(ctx.sessionKey, continuationId);
        }

        @Override
        public void onText(String text) {
            ctx.lastText = text;
            emit("agent.text", payload("runId", ctx.runId, "sessionKey", ctx.sessionKey, "text", text));
        }

        @Override
        public CompletableFuture<ToolDecision> onToolProposed(ProposedAction action) {
            return proposeAction(ctx, action);
        }

        @Override
        public void onToolResult(String toolUseId, String content, boolean error) {
            String preview = content != null && content.length() > TOOL_RESULT_PREVIEW_CHARS
                    ? content.substring(0, TOOL_RESULT_PREVIEW_CHARS)
                    : content;
            emit("agent.tool_result", payload(
                    "runId", ctx.runId,
                    "sessionKey", ctx.sessionKey,
                    "toolUseId", toolUseId,
                    "content", preview,
                    "isError", error));
        }

        @Override
        public CompletableFuture<QuestionAnswer> onQuestion(QuestionRequest question) {
            return askQuestion(ctx, question);
        }
    }

    private CompletableFuture<ToolDecision> proposeAction(RunContext ctx, ProposedAction action) {
        if (ctx.outcome.isDone()) {
            return CompletableFuture.completedFuture(ToolDecision.deny("run is no longer active"));
        }
        ToolRiskTier tier = ToolRiskClassifier.classify(action.toolName(), action.input());
        emit("agent.tool", payload(
                "runId", ctx.runId,
                "sessionKey", ctx.sessionKey,
                "toolUseId", action.toolUseId(),
                "tool", action.toolName(),
                "tier", tier.wireName()));
        updateStatus(ctx, "running " + action.toolName() + "...");

        CompletableFuture<ToolDecision> decision;
        switch (tier) {
            case REQUIRE_APPROVAL:
                decision = requestApproval(ctx, action);
                break;
            case NOTIFY:
                notifyOwner(ctx, action);
                decision = CompletableFuture.completedFuture(ToolDecision.allow());
                break;
            default:
                decision = CompletableFuture.completedFuture(ToolDecision.allow());
                break;
        }
        boolean manualSend = isSendToOrigin(ctx, action);
        return decision.thenApply(d -> {
            if (d.allowed() && manualSend) {
                ctx.manualSendOccurred = true;
            }
            return d;
        });
    }

    /**
     * True for an outward message send aimed at the conversation the run answers to.
     */
    static boolean isSendToOrigin(RunContext ctx, ProposedAction action) {
        String bare = ToolRiskClassifier.stripMcpPrefix(action.toolName() != null ? action.toolName() : "");
        if (!"message".equals(bare) || !"send".equals(action.stringArg("action"))) {
            return false;
        }
        String channel = action.stringArg("channel");
        String to = action.stringArg("to");
        if (to == null) {
            to = action.stringArg("chatId");
        }
        boolean sameChannel = channel == null || channel.equals(ctx.channel);
        boolean sameConversation = to == null || to.equals(ctx.conversationId);
        return sameChannel && sameConversation;
    }

    private record PromptTarget(String channel, String conversationId, String key) {
    }

    /**
     * Prompts go to the originating conversation when its channel has an adapter, otherwise
     * to the owner conversation.
     */
    private PromptTarget promptTarget(RunContext ctx) {
        if (ctx.isLive() && adapters.find(ctx.channel).isPresent()) {
            return new PromptTarget(ctx.channel, ctx.conversationId,
                    SessionKeys.keyOf(ctx.channel, ctx.chatType, ctx.conversationId));
        }
        return new PromptTarget(settings.getOwnerChannel(), settings.getOwnerConversation(),
                SessionKeys.keyOf(settings.getOwnerChannel(), ChatType.DM, settings.getOwnerConversation()));
    }

    private CompletableFuture<ToolDecision> requestApproval(RunContext ctx, ProposedAction action) {
        String requestId = newId(null);
        PromptTarget target = promptTarget(ctx);
        CompletableFuture<ToolDecision> decision = new CompletableFuture<>();
        PendingApproval pending = new PendingApproval(requestId, action.toolUseId(), action.toolName(),
                action.input(), ctx.sessionKey, target.channel(), target.conversationId(), target.key(),
                clock.millis(), decision);
        if (!registry.setPendingApproval(pending)) {
            log.info("Denying {} for {}: another approval is already pending", action.toolName(), ctx.sessionKey);
            return CompletableFuture.completedFuture(ToolDecision.deny("another approval is already pending"));
        }
        ctx.approvalIds.add(requestId);
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> resolveApproval(pending, false, "approval timed out", "timeout"),
                settings.getApprovalTimeoutMs(), TimeUnit.MILLISECONDS);
        decision.whenComplete((d, e) -> {
            timer.cancel(false);
            ctx.approvalIds.remove(requestId);
        });

        String summary = summarize(action);
        log.info("Approval {} requested for {} ({}) in {}", requestId, action.toolName(), ctx.sessionKey, target.key());
        emit("approval.requested", payload(
                "requestId", requestId,
                "sessionKey", ctx.sessionKey,
                "tool", action.toolName(),
                "input", action.input(),
                "summary", summary,
                "promptChannel", target.channel(),
                "promptConversation", target.conversationId()));

        String text = "approval needed: " + action.toolName() + "\n" + summary + "\nreply yes or no";
        SendOptions options = SendOptions.withButtons(List.of(
                new SendOptions.Button("approve", ReplyMatcher.approveData(requestId)),
                new SendOptions.Button("deny", ReplyMatcher.denyData(requestId))));
        send(target.channel(), target.conversationId(), text, options).whenComplete((r, err) -> {
            if (err == null) {
                return;
            }
            log.warn("Approval prompt {} could not be delivered to {}: {}", requestId, target.key(), rootMessage(err));
            registry.clearPendingApproval(ctx.sessionKey, requestId).ifPresent(p -> {
                emit("approval.resolved", payload(
                        "requestId", requestId,
                        "sessionKey", ctx.sessionKey,
                        "approved", false,
                        "reason", "prompt delivery failed",
                        "resolvedBy", "transport"));
                p.decision().complete(ToolDecision.deny("approval prompt could not be delivered"));
            });
        });
        return decision;
    }

    private CompletableFuture<QuestionAnswer> askQuestion(RunContext ctx, QuestionRequest question) {
        if (ctx.outcome.isDone()) {
            return CompletableFuture.completedFuture(QuestionAnswer.unanswered("run is no longer active"));
        }
        if (question.options().isEmpty()) {
            return CompletableFuture.completedFuture(QuestionAnswer.unanswered("question has no options"));
        }
        String requestId = newId(null);
        PromptTarget target = promptTarget(ctx);
        CompletableFuture<QuestionAnswer> answer = new CompletableFuture<>();
        PendingQuestion pending = new PendingQuestion(requestId, question.question(), question.options(),
                ctx.sessionKey, target.channel(), target.conversationId(), target.key(), clock.millis(), answer);
        if (!registry.setPendingQuestion(pending)) {
            return CompletableFuture.completedFuture(QuestionAnswer.unanswered("another question is already pending"));
        }
        ctx.questionIds.add(requestId);
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> abandonQuestion(ctx.sessionKey, requestId, "question timed out"),
                settings.getQuestionTimeoutMs(), TimeUnit.MILLISECONDS);
        answer.whenComplete((a, e) -> {
            timer.cancel(false);
            ctx.questionIds.remove(requestId);
        });

        emit("question.asked", payload(
                "requestId", requestId,
                "sessionKey", ctx.sessionKey,
                "question", question.question(),
                "options", question.options(),
                "promptChannel", target.channel(),
                "promptConversation", target.conversationId()));

        StringBuilder text = new StringBuilder(question.question() != null ? question.question() : "");
        List<SendOptions.Button> buttons = new ArrayList<>();
        for (int i = 0; i < question.options().size(); i++) {
            QuestionRequest.Option option = question.options().get(i);
            text.append('\n').append(i + 1).append(". ").append(option.label());
            if (option.description() != null && !option.description().isBlank()) {
                text.append(" (").append(option.description()).append(')');
            }
            buttons.add(new SendOptions.Button(option.label(), ReplyMatcher.questionData(requestId, i)));
        }
        text.append("\nreply with a number or an option");
        send(target.channel(), target.conversationId(), text.toString(), SendOptions.withButtons(buttons))
                .whenComplete((r, err) -> {
                    if (err != null) {
                        log.warn("Question {} could not be delivered to {}: {}", requestId, target.key(),
                                rootMessage(err));
                        abandonQuestion(ctx.sessionKey, requestId, "question could not be delivered");
                    }
                });
        return answer;
    }

    private void abandonQuestion(String sessionKey, String requestId, String reason) {
        registry.clearPendingQuestion(sessionKey, requestId).ifPresent(p -> {
            log.info("Question {} for {} abandoned: {}", requestId, sessionKey, reason);
            emit("question.answered", payload(
                    "requestId", requestId,
                    "sessionKey", sessionKey,
                    "answered", false,
                    "reason", reason));
            p.answer().complete(QuestionAnswer.unanswered(reason));
        });
    }

    private void abandonPending(RunContext ctx) {
        for (String requestId : List.copyOf(ctx.approvalIds)) {
            registry.clearPendingApproval(ctx.sessionKey, requestId).ifPresent(p -> {
                emit("approval.resolved", payload(
                        "requestId", requestId,
                        "sessionKey", ctx.sessionKey,
                        "approved", false,
                        "reason", "run ended",
                        "resolvedBy", "run"));
                p.decision().complete(ToolDecision.deny("run ended"));
            });
        }
        for (String requestId : List.copyOf(ctx.questionIds)) {
            abandonQuestion(ctx.sessionKey, requestId, "run ended");
        }
    }

    private void notifyOwner(RunContext ctx, ProposedAction action) {
        String text = "notice: " + action.toolName() + " (" + ctx.source + ")\n" + summarize(action);
        emit("tool.notify", payload(
                "runId", ctx.runId,
                "sessionKey", ctx.sessionKey,
                "tool", action.toolName(),
                "summary", summarize(action)));
        if (adapters.find(settings.getOwnerChannel()).isEmpty()) {
            log.debug("No owner channel adapter for notice about {}", action.toolName());
            return;
        }
        send(settings.getOwnerChannel(), settings.getOwnerConversation(), text, SendOptions.none())
                .whenComplete((r, err) -> {
                    if (err != null) {
                        log.warn("Owner notice for {} failed: {}", action.toolName(), rootMessage(err));
                    }
                });
    }

    // =========================================================================
    // Outbound
    // =========================================================================

    private CompletableFuture<Void> postStatusMessage(RunContext ctx) {
        Optional<ChannelAdapter> adapter = adapters.find(ctx.channel);
        if (adapter.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return safe(() -> adapter.get().send(ctx.conversationId, THINKING, SendOptions.builder().silent(true).build()))
                .handle((r, err) -> {
                    if (err != null) {
                        log.debug("Status message for {} failed: {}", ctx.sessionKey, rootMessage(err));
                    } else if (r != null) {
                        ctx.statusMessageId = r.id();
                    }
                    return null;
                });
    }

    private void updateStatus(RunContext ctx, String text) {
        String statusId = ctx.statusMessageId;
        if (statusId == null) {
            return;
        }
        adapters.find(ctx.channel).ifPresent(adapter -> safe(() -> adapter.edit(ctx.conversationId, statusId, text))
                .whenComplete((v, err) -> {
                    if (err != null) {
                        log.debug("Status update for {} failed: {}", ctx.sessionKey, rootMessage(err));
                    }
                }));
    }

    private CompletableFuture<Void> deliverResult(RunContext ctx, RunOutcome outcome) {
        if (!outcome.isCompleted()) {
            String statusId = ctx.statusMessageId;
            Optional<ChannelAdapter> adapter = adapters.find(ctx.channel);
            if (ctx.isLive() && statusId != null && adapter.isPresent()) {
                String text = outcome.status() == RunStatus.TIMED_OUT
                        ? "run timed out"
                        : "run failed: " + outcome.detail();
                return safe(() -> adapter.get().edit(ctx.conversationId, statusId, text));
            }
            return CompletableFuture.completedFuture(null);
        }
        String text = outcome.text();
        boolean deliverable = text != null && !text.isBlank() && !SILENT_REPLY.equals(text.trim());
        if (ctx.isLive()) {
            return deliverLive(ctx, deliverable ? text : null);
        }
        if (ctx.trigger != null && ctx.trigger.hasDelivery() && deliverable && !ctx.manualSendOccurred) {
            return send(ctx.trigger.getDeliverChannel(), ctx.trigger.getDeliverTo(), text, SendOptions.none())
                    .thenApply(r -> null);
        }
        return CompletableFuture.completedFuture(null);
    }

    private CompletableFuture<Void> deliverLive(RunContext ctx, String text) {
        Optional<ChannelAdapter> found = adapters.find(ctx.channel);
        if (found.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        ChannelAdapter adapter = found.get();
        String statusId = ctx.statusMessageId;
        if (ctx.manualSendOccurred || text == null) {
            return statusId != null
                    ? safe(() -> adapter.delete(ctx.conversationId, statusId))
                    : CompletableFuture.completedFuture(null);
        }
        if (statusId == null) {
            return safe(() -> adapter.send(ctx.conversationId, text, SendOptions.none())).thenApply(r -> null);
        }
        return safe(() -> adapter.edit(ctx.conversationId, statusId, text))
                .exceptionallyCompose(err -> {
                    log.debug("Editing status message for {} failed, sending instead: {}", ctx.sessionKey,
                            rootMessage(err));
                    return safe(() -> adapter.send(ctx.conversationId, text, SendOptions.none())).thenApply(r -> null);
                });
    }

    private void sendNotice(InboundMessage msg, String text) {
        send(msg.getChannel(), msg.getConversationId(), text, SendOptions.builder().replyTo(msg.getId()).build())
                .whenComplete((r, err) -> {
                    if (err != null) {
                        log.warn("Notice to {}/{} failed: {}", msg.getChannel(), msg.getConversationId(),
                                rootMessage(err));
                    }
                });
    }

    private CompletableFuture<OutboundResult> send(String channel, String target, String text, SendOptions options) {
        Optional<ChannelAdapter> adapter = adapters.find(channel);
        if (adapter.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalStateException("No adapter for channel " + channel));
        }
        return safe(() -> adapter.get().send(target, text, options));
    }

    /** Adapter calls that throw synchronously become failed futures. */
    private static <T> CompletableFuture<T> safe(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> f = call.get();
            return f != null ? f : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // =========================================================================
    // Status
    // =========================================================================

    public int queuedCount(String sessionKey) {
        synchronized (gateLock) {
            Deque<InboundMessage> queue = queues.get(sessionKey);
            return queue != null ? queue.size() : 0;
        }
    }

    /**
     * Active runs keyed by session key.
     */
    public List<Map<String, Object>> activeRuns() {
        List<Map<String, Object>> list = new ArrayList<>();
        runs.values().forEach(ctx -> list.add(payload(
                "runId", ctx.runId,
                "sessionKey", ctx.sessionKey,
                "source", ctx.source,
                "permissionMode", ctx.permissionMode.key(),
                "queued", queuedCount(ctx.sessionKey))));
        return list;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private String summarize(ProposedAction action) {
        String command = action.stringArg("command");
        String summary;
        if (command != null) {
            summary = command;
        } else {
            try {
                summary = mapper.writeValueAsString(action.input());
            } catch (JsonProcessingException e) {
                summary = String.valueOf(action.input());
            }
        }
        return summary.length() > ACTION_SUMMARY_CHARS ? summary.substring(0, ACTION_SUMMARY_CHARS) + "..." : summary;
    }

    private void emit(String event, Object data) {
        try {
            events.emit(event, data);
        } catch (RuntimeException e) {
            log.warn("Event listener failed for {}: {}", event, e.getMessage());
        }
    }

    static Map<String, Object> payload(Object... kv) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            map.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return map;
    }

    private static String newId(String prefix) {
        String id = UUID.randomUUID().toString().substring(0, 8);
        return prefix != null ? prefix + "-" + id : id;
    }

    static String rootMessage(Throwable err) {
        Throwable t = err;
        while (t.getCause() != null && t != t.getCause()) {
            t = t.getCause();
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
