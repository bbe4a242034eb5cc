package com.agentrelay.gateway.cron;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A durable trigger definition. Exactly one of {@code cron}, {@code every} and {@code at} is set.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduledJob {

    public static final String SESSION_MAIN = "main";
    public static final String SESSION_ISOLATED = "isolated";

    private String id;
    private String name;
    /** Five-field cron expression. */
    private String cron;
    /** Fixed interval such as "4h". */
    private String every;
    /** One-shot time, absolute ISO-8601 once stored. */
    private String at;
    /** IANA zone for cron evaluation; the service zone when absent. */
    private String timezone;
    private String message;
    /** "main" runs in the owner conversation, "isolated" in a session of its own. */
    @Builder.Default
    private String session = SESSION_MAIN;
    private String model;
    private String channel;
    private String to;
    private boolean deliver;
    private boolean deleteAfterRun;
    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private String lastStatus; // "completed" | "error" | "timed-out" | "skipped"
    private String lastError;
    private int runCount;

    public ScheduleKind scheduleKind() {
        if (cron != null) {
            return ScheduleKind.CRON;
        }
        if (every != null) {
            return ScheduleKind.EVERY;
        }
        return at != null ? ScheduleKind.AT : null;
    }

    public String scheduleText() {
        ScheduleKind kind = scheduleKind();
        if (kind == null) {
            return "none";
        }
        return switch (kind) {
            case CRON -> "cron " + cron;
            case EVERY -> "every " + every;
            case AT -> "at " + at;
        };
    }

    public enum ScheduleKind {
        CRON, EVERY, AT
    }
}
