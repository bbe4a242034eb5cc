package com.agentrelay.gateway.heartbeat;

import com.agentrelay.common.config.RelayConfig;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Daily time-of-day window, in minutes since midnight. {@code end < start} wraps past midnight.
 */
public record ActiveHours(int startMinute, int endMinute, ZoneId zone) {

    private static final Pattern HHMM = Pattern.compile("^([01]\\d|2[0-3]|24):[0-5]\\d$");

    /**
     * Build a window from configuration.
     *
     * @return empty when the window is absent or malformed, which means "always active"
     */
    public static Optional<ActiveHours> from(RelayConfig.ActiveHoursConfig config, ZoneId fallbackZone) {
        if (config == null || config.getStart() == null || config.getEnd() == null) {
            return Optional.empty();
        }
        int start = parseHhmm(config.getStart().trim(), false);
        int end = parseHhmm(config.getEnd().trim(), true);
        if (start < 0 || end < 0 || start == end) {
            return Optional.empty();
        }
        ZoneId zone = fallbackZone;
        if (config.getTimezone() != null && !config.getTimezone().isBlank()) {
            try {
                zone = ZoneId.of(config.getTimezone().trim());
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
        return Optional.of(new ActiveHours(start, end, zone));
    }

    public boolean contains(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        int current = local.getHour() * 60 + local.getMinute();
        if (endMinute > startMinute) {
            return current >= startMinute && current < endMinute;
        }
        return current >= startMinute || current < endMinute;
    }

    /**
     * @return minutes since midnight, or -1 if malformed; "24:00" only where allowed
     */
    static int parseHhmm(String hhmm, boolean allow24) {
        if (hhmm == null || !HHMM.matcher(hhmm).matches()) {
            return -1;
        }
        int h = Integer.parseInt(hhmm.substring(0, 2));
        int m = Integer.parseInt(hhmm.substring(3, 5));
        if (h == 24 && (!allow24 || m != 0)) {
            return -1;
        }
        return h * 60 + m;
    }
}
