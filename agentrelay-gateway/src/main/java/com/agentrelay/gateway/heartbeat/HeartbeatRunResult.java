package com.agentrelay.gateway.heartbeat;

/**
 * Outcome of one heartbeat firing.
 *
 * @param status "ran", "skipped" or "failed"
 */
public record HeartbeatRunResult(String status, String reason, Long durationMs) {

    public static final String RAN = "ran";
    public static final String SKIPPED = "skipped";
    public static final String FAILED = "failed";

    public static HeartbeatRunResult ran(String reason, long durationMs) {
        return new HeartbeatRunResult(RAN, reason, durationMs);
    }

    public static HeartbeatRunResult skipped(String reason) {
        return new HeartbeatRunResult(SKIPPED, reason, null);
    }

    public static HeartbeatRunResult skipped(String reason, long durationMs) {
        return new HeartbeatRunResult(SKIPPED, reason, durationMs);
    }

    public static HeartbeatRunResult failed(String reason, long durationMs) {
        return new HeartbeatRunResult(FAILED, reason, durationMs);
    }
}
