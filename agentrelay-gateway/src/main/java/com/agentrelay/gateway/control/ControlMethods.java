package com.agentrelay.gateway.control;

import com.agentrelay.gateway.channel.ChatType;
import com.agentrelay.gateway.channel.InboundMessage;
import com.agentrelay.gateway.cron.ScheduledJob;
import com.agentrelay.gateway.routing.RouteResult;
import com.agentrelay.gateway.session.PendingApproval;
import com.agentrelay.gateway.session.PendingQuestion;
import com.agentrelay.gateway.session.SessionInfo;
import com.agentrelay.gateway.websocket.GatewayConnection;
import com.agentrelay.gateway.websocket.GatewayMethodRouter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Registers the control methods of the gateway: status, chat, sessions, cron and heartbeat.
 */
@Slf4j
public class ControlMethods {

    static final int DEFAULT_HISTORY_LIMIT = 50;
    static final int DEFAULT_RUN_LOG_LIMIT = 20;

    private final GatewayContext ctx;
    private final long startedAt;

    public ControlMethods(GatewayContext ctx) {
        this.ctx = ctx;
        this.startedAt = ctx.getClock().millis();
    }

    public void register(GatewayMethodRouter methodRouter) {
        methodRouter.registerMethod("status", this::handleStatus);

        // Chat
        methodRouter.registerMethod("chat.send", this::handleChatSend);
        methodRouter.registerMethod("chat.approve", this::handleChatApprove);
        methodRouter.registerMethod("chat.answer", this::handleChatAnswer);
        methodRouter.registerMethod("chat.history", this::handleChatHistory);
        methodRouter.registerMethod("channel.inbound", this::handleChannelInbound);

        // Sessions
        methodRouter.registerMethod("sessions.list", this::handleSessionsList);
        methodRouter.registerMethod("sessions.get", this::handleSessionsGet);
        methodRouter.registerMethod("sessions.delete", this::handleSessionsDelete);
        methodRouter.registerMethod("sessions.reset", this::handleSessionsReset);

        // Cron
        methodRouter.registerMethod("cron.list", this::handleCronList);
        methodRouter.registerMethod("cron.add", this::handleCronAdd);
        methodRouter.registerMethod("cron.remove", this::handleCronRemove);
        methodRouter.registerMethod("cron.toggle", this::handleCronToggle);
        methodRouter.registerMethod("cron.enable", this::handleCronEnable);
        methodRouter.registerMethod("cron.run", this::handleCronRun);
        methodRouter.registerMethod("cron.runs", this::handleCronRuns);

        // Heartbeat
        methodRouter.registerMethod("heartbeat.status", this::handleHeartbeatStatus);
        methodRouter.registerMethod("heartbeat.run", this::handleHeartbeatRun);

        log.info("Registered {} control methods", methodRouter.getRegisteredMethods().size());
    }

    // --- Status ---

    private CompletableFuture<Object> handleStatus(JsonNode params, GatewayConnection conn) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("uptimeMs", ctx.getClock().millis() - startedAt);
        status.put("sessions", ctx.getSessions().size());
        status.put("activeRuns", ctx.getRouter().activeRuns());
        status.put("channels", ctx.getChannels().channelIds());
        status.put("cron", ctx.getCron().status());
        status.put("heartbeat", ctx.getHeartbeat().status());
        return CompletableFuture.completedFuture(status);
    }

    // --- Chat ---

    /**
     * A message typed by the owner in the desktop client.
     */
    private CompletableFuture<Object> handleChatSend(JsonNode params, GatewayConnection conn) {
        String text = requireText(params, "text");
        String conversationId = optText(params, "conversationId",
                ctx.getRouter().getSettings().getOwnerConversation());
        InboundMessage msg = InboundMessage.builder()
                .id(UUID.randomUUID().toString())
                .channel(ctx.getRouter().getSettings().getOwnerChannel())
                .conversationId(conversationId)
                .chatType(ChatType.DM)
                .senderId("owner")
                .senderName(optText(params, "senderName", null))
                .body(text)
                .timestamp(ctx.getClock().millis())
                .build();
        return ctx.getRouter().route(msg).thenApply(ControlMethods::routeResultToMap);
    }

    /**
     * A message relayed by an external channel bridge.
     */
    private CompletableFuture<Object> handleChannelInbound(JsonNode params, GatewayConnection conn) {
        InboundMessage msg = InboundMessage.builder()
                .id(optText(params, "id", UUID.randomUUID().toString()))
                .channel(requireText(params, "channel"))
                .accountId(optText(params, "accountId", null))
                .conversationId(requireText(params, "conversationId"))
                .chatType(ChatType.fromKey(optText(params, "chatType", null)))
                .senderId(optText(params, "senderId", null))
                .senderName(optText(params, "senderName", null))
                .body(optText(params, "body", ""))
                .timestamp(params.has("timestamp") ? params.get("timestamp").asLong() : ctx.getClock().millis())
                .replyToId(optText(params, "replyToId", null))
                .build();
        return ctx.getRouter().route(msg).thenApply(ControlMethods::routeResultToMap);
    }

    private CompletableFuture<Object> handleChatApprove(JsonNode params, GatewayConnection conn) {
        String requestId = requireText(params, "requestId");
        boolean approved = !params.has("approved") || params.get("approved").asBoolean(true);
        String reason = optText(params, "reason", null);
        if (!ctx.getRouter().resolveApproval(requestId, approved, reason)) {
            throw new IllegalArgumentException("No pending approval: " + requestId);
        }
        return CompletableFuture.completedFuture(Map.of("requestId", requestId, "approved", approved));
    }

    private CompletableFuture<Object> handleChatAnswer(JsonNode params, GatewayConnection conn) {
        String requestId = requireText(params, "requestId");
        if (!params.has("index")) {
            throw new IllegalArgumentException("index is required");
        }
        int index = params.get("index").asInt(-1);
        if (!ctx.getRouter().answerQuestion(requestId, index)) {
            throw new IllegalArgumentException("No pending question " + requestId + " with option " + index);
        }
        return CompletableFuture.completedFuture(Map.of("requestId", requestId, "index", index));
    }

    private CompletableFuture<Object> handleChatHistory(JsonNode params, GatewayConnection conn) {
        SessionInfo session = requireSession(params);
        int limit = params.has("limit") ? params.get("limit").asInt(DEFAULT_HISTORY_LIMIT) : DEFAULT_HISTORY_LIMIT;
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("sessionKey", session.getKey());
        result.put("sessionId", session.getSessionId());
        result.put("entries", ctx.getTranscripts().read(session.getSessionId(), limit));
        return CompletableFuture.completedFuture(result);
    }

    // --- Sessions ---

    private CompletableFuture<Object> handleSessionsList(JsonNode params, GatewayConnection conn) {
        List<Map<String, Object>> sessions = new ArrayList<>();
        for (SessionInfo session : ctx.getSessions().list()) {
            sessions.add(sessionToMap(session));
        }
        return CompletableFuture.completedFuture(Map.of("sessions", sessions, "count", sessions.size()));
    }

    private CompletableFuture<Object> handleSessionsGet(JsonNode params, GatewayConnection conn) {
        SessionInfo session = requireSession(params);
        Map<String, Object> result = sessionToMap(session);
        PendingApproval approval = session.getPendingApproval();
        if (approval != null) {
            result.put("pendingApproval", Map.of(
                    "requestId", approval.requestId(),
                    "tool", approval.toolName(),
                    "createdAt", approval.createdAtMs()));
        }
        PendingQuestion question = session.getPendingQuestion();
        if (question != null) {
            result.put("pendingQuestion", Map.of(
                    "requestId", question.requestId(),
                    "question", question.question(),
                    "options", question.options()));
        }
        result.put("queued", ctx.getRouter().queuedCount(session.getKey()));
        return CompletableFuture.completedFuture(result);
    }

    private CompletableFuture<Object> handleSessionsDelete(JsonNode params, GatewayConnection conn) {
        SessionInfo session = requireSession(params);
        String key = session.getKey();
        ctx.getRouter().abortRun(key);
        boolean removed = ctx.getSessions().remove(key);
        if (params.has("deleteTranscript") && params.get("deleteTranscript").asBoolean()) {
            ctx.getTranscripts().delete(session.getSessionId());
        }
        log.info("Session {} deleted via control", key);
        return CompletableFuture.completedFuture(Map.of("key", key, "deleted", removed));
    }

    private CompletableFuture<Object> handleSessionsReset(JsonNode params, GatewayConnection conn) {
        SessionInfo session = requireSession(params);
        SessionInfo fresh = ctx.getSessions().reset(session.getKey())
                .orElseThrow(() -> new IllegalArgumentException("Session not found: " + session.getKey()));
        return CompletableFuture.completedFuture(Map.of(
                "key", fresh.getKey(),
                "previousSessionId", session.getSessionId(),
                "sessionId", fresh.getSessionId()));
    }

    // --- Cron ---

    private CompletableFuture<Object> handleCronList(JsonNode params, GatewayConnection conn) {
        List<ScheduledJob> jobs = ctx.getCron().listJobs();
        return CompletableFuture.completedFuture(Map.of("jobs", jobs, "count", jobs.size()));
    }

    private CompletableFuture<Object> handleCronAdd(JsonNode params, GatewayConnection conn) {
        if (params == null || !params.isObject()) {
            throw new IllegalArgumentException("job params required");
        }
        JsonNode jobNode = params.has("job") ? params.get("job") : params;
        ScheduledJob draft;
        try {
            draft = ctx.getObjectMapper().treeToValue(jobNode, ScheduledJob.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid job: " + e.getOriginalMessage(), e);
        }
        return CompletableFuture.completedFuture(ctx.getCron().addJob(draft));
    }

    private CompletableFuture<Object> handleCronRemove(JsonNode params, GatewayConnection conn) {
        String id = requireText(params, "id");
        if (!ctx.getCron().removeJob(id)) {
            throw new IllegalArgumentException("Job not found: " + id);
        }
        return CompletableFuture.completedFuture(Map.of("id", id, "removed", true));
    }

    private CompletableFuture<Object> handleCronToggle(JsonNode params, GatewayConnection conn) {
        String id = requireText(params, "id");
        return CompletableFuture.completedFuture(ctx.getCron().toggle(id)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + id)));
    }

    private CompletableFuture<Object> handleCronEnable(JsonNode params, GatewayConnection conn) {
        String id = requireText(params, "id");
        boolean enabled = !params.has("enabled") || params.get("enabled").asBoolean(true);
        return CompletableFuture.completedFuture(ctx.getCron().setEnabled(id, enabled)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + id)));
    }

    private CompletableFuture<Object> handleCronRun(JsonNode params, GatewayConnection conn) {
        String id = requireText(params, "id");
        return ctx.getCron().runNow(id).thenApply(run -> (Object) run);
    }

    private CompletableFuture<Object> handleCronRuns(JsonNode params, GatewayConnection conn) {
        String id = requireText(params, "id");
        int limit = params.has("limit") ? params.get("limit").asInt(DEFAULT_RUN_LOG_LIMIT) : DEFAULT_RUN_LOG_LIMIT;
        return CompletableFuture.completedFuture(Map.of("id", id, "runs", ctx.getCron().getRunLogs(id, limit)));
    }

    // --- Heartbeat ---

    private CompletableFuture<Object> handleHeartbeatStatus(JsonNode params, GatewayConnection conn) {
        return CompletableFuture.completedFuture(ctx.getHeartbeat().status());
    }

    private CompletableFuture<Object> handleHeartbeatRun(JsonNode params, GatewayConnection conn) {
        String reason = optText(params, "reason", "manual");
        return ctx.getHeartbeat().runNow(reason).thenApply(result -> (Object) result);
    }

    // --- Helpers ---

    private SessionInfo requireSession(JsonNode params) {
        String key = requireText(params, "key");
        return ctx.getSessions().get(key)
                .orElseThrow(() -> new IllegalArgumentException("Session not found: " + key));
    }

    private Map<String, Object> sessionToMap(SessionInfo session) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("key", session.getKey());
        map.put("channel", session.getChannel());
        map.put("conversationId", session.getConversationId());
        map.put("chatType", session.getChatType());
        map.put("sessionId", session.getSessionId());
        map.put("messageCount", session.getMessageCount());
        map.put("createdAt", session.getCreatedAt());
        map.put("lastMessageAt", session.getLastMessageAt());
        map.put("activeRun", ctx.getSessions().isRunActive(session.getKey()));
        return map;
    }

    private static Object routeResultToMap(RouteResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", result.status().name().toLowerCase(Locale.ROOT));
        map.put("sessionKey", result.sessionKey());
        if (result.detail() != null) {
            map.put("detail", result.detail());
        }
        return map;
    }

    static String requireText(JsonNode params, String name) {
        String value = optText(params, name, null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    static String optText(JsonNode params, String name, String fallback) {
        if (params == null || !params.hasNonNull(name)) {
            return fallback;
        }
        return params.get(name).asText();
    }
}
