package com.agentrelay.gateway.routing;

import com.agentrelay.common.config.RelayConfig;
import com.agentrelay.common.infra.Durations;
import com.agentrelay.gateway.backend.PermissionMode;
import lombok.Builder;
import lombok.Value;

/**
 * Resolved router policy.
 */
@Value
@Builder(toBuilder = true)
public class RouterSettings {

    public static final long DEFAULT_RUN_TIMEOUT_MS = 10 * 60_000L;
    public static final long DEFAULT_APPROVAL_TIMEOUT_MS = 5 * 60_000L;
    public static final long DEFAULT_QUESTION_TIMEOUT_MS = 5 * 60_000L;
    public static final long DEFAULT_DEDUPE_WINDOW_MS = 5_000L;
    public static final long DEFAULT_IDLE_RESET_MS = 4 * 3_600_000L;
    public static final int DEFAULT_MAX_QUEUED = 20;

    @Builder.Default
    String ownerChannel = "desktop";
    @Builder.Default
    String ownerConversation = "default";
    /** Mode for owner-present runs; all other runs use {@link PermissionMode#DEFAULT}. */
    @Builder.Default
    PermissionMode ownerPermissionMode = PermissionMode.DEFAULT;
    @Builder.Default
    BusyPolicy busyPolicy = BusyPolicy.QUEUE;
    @Builder.Default
    int maxQueuedMessages = DEFAULT_MAX_QUEUED;
    @Builder.Default
    long runTimeoutMs = DEFAULT_RUN_TIMEOUT_MS;
    @Builder.Default
    long approvalTimeoutMs = DEFAULT_APPROVAL_TIMEOUT_MS;
    @Builder.Default
    long questionTimeoutMs = DEFAULT_QUESTION_TIMEOUT_MS;
    @Builder.Default
    long dedupeWindowMs = DEFAULT_DEDUPE_WINDOW_MS;
    @Builder.Default
    long idleResetMs = DEFAULT_IDLE_RESET_MS;
    @Builder.Default
    boolean statusMessages = true;
    String workspace;
    String model;

    public static RouterSettings from(RelayConfig config) {
        RelayConfig.RouterConfig r = config.getRouter() != null ? config.getRouter() : new RelayConfig.RouterConfig();
        return RouterSettings.builder()
                .ownerChannel(r.getOwnerChannel())
                .ownerConversation(r.getOwnerConversation())
                .ownerPermissionMode(PermissionMode.fromKey(config.getPermissionMode()))
                .busyPolicy(BusyPolicy.fromKey(r.getBusyPolicy()))
                .maxQueuedMessages(Math.max(0, r.getMaxQueuedMessages()))
                .runTimeoutMs(Durations.parseDurationMs(r.getRunTimeout(), DEFAULT_RUN_TIMEOUT_MS))
                .approvalTimeoutMs(Durations.parseDurationMs(r.getApprovalTimeout(), DEFAULT_APPROVAL_TIMEOUT_MS))
                .questionTimeoutMs(Durations.parseDurationMs(r.getQuestionTimeout(), DEFAULT_QUESTION_TIMEOUT_MS))
                .dedupeWindowMs(isOff(r.getDedupeWindow())
                        ? 0
                        : Durations.parseDurationMs(r.getDedupeWindow(), DEFAULT_DEDUPE_WINDOW_MS))
                .idleResetMs(Durations.parseDurationMs(r.getIdleReset(), DEFAULT_IDLE_RESET_MS))
                .statusMessages(r.isStatusMessages())
                .workspace(config.getWorkspace())
                .model(config.getBackend() != null ? config.getBackend().getModel() : null)
                .build();
    }

    /** "0" and "off" disable a window. */
    static boolean isOff(String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.trim();
        return value.equals("0") || value.equalsIgnoreCase("off");
    }
}
