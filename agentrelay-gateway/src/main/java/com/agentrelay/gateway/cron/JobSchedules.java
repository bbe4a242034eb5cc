package com.agentrelay.gateway.cron;

import com.agentrelay.common.infra.Durations;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Schedule arithmetic for {@link ScheduledJob}s.
 */
public final class JobSchedules {

    private JobSchedules() {
    }

    private static final Pattern ISO_TZ_RE = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T");
    private static final Pattern EPOCH_MS_RE = Pattern.compile("^\\d{10,}$");

    /**
     * Next fire time of a job strictly after {@code nowMs}.
     *
     * <ul>
     * <li>cron: next matching minute in the job's zone</li>
     * <li>every: last run + interval, or now + interval if never run; missed slots are not
     * replayed</li>
     * <li>at: the stored time, only while it is still ahead</li>
     * </ul>
     *
     * @return epoch millis, or null when the job has nothing left to fire
     */
    public static Long computeNextRunAtMs(ScheduledJob job, long nowMs, ZoneId defaultZone) {
        ScheduledJob.ScheduleKind kind = job.scheduleKind();
        if (kind == null) {
            return null;
        }
        switch (kind) {
            case CRON: {
                ZoneId zone = resolveZone(job.getTimezone(), defaultZone);
                if (zone == null) {
                    return null;
                }
                return CronExpression.tryParse(job.getCron())
                        .flatMap(expr -> expr.next(Instant.ofEpochMilli(nowMs), zone))
                        .map(Instant::toEpochMilli)
                        .orElse(null);
            }
            case EVERY: {
                Long intervalMs = Durations.parseDurationMs(job.getEvery());
                if (intervalMs == null) {
                    return null;
                }
                long next = job.getLastRunAt() != null
                        ? job.getLastRunAt().toEpochMilli() + intervalMs
                        : nowMs + intervalMs;
                return next > nowMs ? next : nowMs + intervalMs;
            }
            case AT: {
                Long atMs = parseAbsoluteTimeMs(job.getAt());
                return atMs != null && atMs > nowMs ? atMs : null;
            }
            default:
                return null;
        }
    }

    /**
     * Resolve a user-supplied one-shot time to an absolute ISO-8601 instant. Relative
     * durations ("20m", "2h") count from {@code nowMs}.
     *
     * @throws IllegalArgumentException when the value is neither
     */
    public static String resolveAt(String at, long nowMs) {
        if (at == null || at.isBlank()) {
            throw new IllegalArgumentException("'at' is empty");
        }
        Long relative = Durations.parseDurationMs(at.trim());
        if (relative != null) {
            return Instant.ofEpochMilli(nowMs + relative).toString();
        }
        Long absolute = parseAbsoluteTimeMs(at);
        if (absolute == null) {
            throw new IllegalArgumentException("Invalid 'at' time: " + at);
        }
        return Instant.ofEpochMilli(absolute).toString();
    }

    /**
     * Parse epoch millis (10 or more digits) or an ISO-8601 date / date-time. Values without
     * an offset are read as UTC.
     *
     * @return epoch millis, or null if unparseable
     */
    public static Long parseAbsoluteTimeMs(String input) {
        if (input == null) {
            return null;
        }
        String raw = input.trim();
        if (raw.isEmpty()) {
            return null;
        }
        if (EPOCH_MS_RE.matcher(raw).matches()) {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            return Instant.parse(normalizeUtcIso(raw)).toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String normalizeUtcIso(String raw) {
        if (ISO_TZ_RE.matcher(raw).find()) {
            return raw;
        }
        if (ISO_DATE_RE.matcher(raw).matches()) {
            return raw + "T00:00:00Z";
        }
        if (ISO_DATE_TIME_RE.matcher(raw).find()) {
            return raw + "Z";
        }
        return raw;
    }

    /**
     * @return the zone, {@code fallback} when blank, or null when the id is unknown
     */
    static ZoneId resolveZone(String timezone, ZoneId fallback) {
        if (timezone == null || timezone.isBlank()) {
            return fallback;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            return null;
        }
    }
}
