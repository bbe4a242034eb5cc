package com.agentrelay.gateway.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Record of one job firing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronRunLog {
    private String jobId;
    private String jobName;
    /** "schedule" or "manual". */
    private String trigger;
    private Instant startedAt;
    private Instant finishedAt;
    private long durationMs;
    private String status;
    private String error;
    private String resultText;

    public boolean isSuccess() {
        return "completed".equals(status);
    }
}
