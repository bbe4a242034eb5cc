package com.agentrelay.gateway.heartbeat;

import lombok.Data;

/**
 * Mutable heartbeat bookkeeping, one per runner.
 */
@Data
public class HeartbeatState {
    private long intervalMs;
    private long nextDueMs;
    private Long lastRunMs;
    /** Last delivered text, for duplicate suppression. */
    private String lastText;
    private Long lastSentAt;
    private String lastStatus;
    private String lastReason;

    HeartbeatState copy() {
        HeartbeatState c = new HeartbeatState();
        c.setIntervalMs(intervalMs);
        c.setNextDueMs(nextDueMs);
        c.setLastRunMs(lastRunMs);
        c.setLastText(lastText);
        c.setLastSentAt(lastSentAt);
        c.setLastStatus(lastStatus);
        c.setLastReason(lastReason);
        return c;
    }
}
