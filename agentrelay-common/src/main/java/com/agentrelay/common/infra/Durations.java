package com.agentrelay.common.infra;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact duration strings such as "30m", "4h", "90s" or "250ms".
 */
public final class Durations {

    private Durations() {
    }

    private static final Pattern DURATION_RE = Pattern.compile("^(\\d+)(ms|s|m|h|d)?$", Pattern.CASE_INSENSITIVE);

    /**
     * Parse a duration into milliseconds. A bare number is read as minutes.
     *
     * @return milliseconds, or null when the input is not a positive duration
     */
    public static Long parseDurationMs(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher m = DURATION_RE.matcher(raw.trim());
        if (!m.matches()) {
            return null;
        }
        long value;
        try {
            value = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        if (value <= 0) {
            return null;
        }
        String unit = m.group(2) != null ? m.group(2).toLowerCase(Locale.ROOT) : "m";
        long multiplier = switch (unit) {
            case "ms" -> 1L;
            case "s" -> 1_000L;
            case "h" -> 3_600_000L;
            case "d" -> 86_400_000L;
            default -> 60_000L;
        };
        try {
            return Math.multiplyExact(value, multiplier);
        } catch (ArithmeticException e) {
            return null;
        }
    }

    /**
     * Parse a duration, falling back to a default when missing or malformed.
     */
    public static long parseDurationMs(String raw, long fallbackMs) {
        Long parsed = parseDurationMs(raw);
        return parsed != null ? parsed : fallbackMs;
    }
}
