package com.agentrelay.gateway.cron;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>
 * Each field accepts {@code *}, comma lists, ranges {@code a-b} and steps {@code *}{@code /n},
 * {@code a/n} or {@code a-b/n}. Day-of-week runs 0 (Sunday) to 6. A day qualifies when its
 * month matches and either its day-of-month or its day-of-week matches. A day field written
 * with a leading {@code *} does not restrict on its own: when only one of the two day fields is
 * restricted, that field alone decides.
 * </p>
 */
public final class CronExpression {

    /** Days scanned forward by {@link #next}. */
    static final int SEARCH_DAYS = 366;

    private final String source;
    private final int[] minutes;
    private final int[] hours;
    private final int[] daysOfMonth;
    private final int[] months;
    private final int[] daysOfWeek;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String source, int[] minutes, int[] hours, int[] daysOfMonth,
            int[] months, int[] daysOfWeek, boolean dayOfMonthRestricted, boolean dayOfWeekRestricted) {
        this.source = source;
        this.minutes = minutes;
        this.hours = hours;
        this.daysOfMonth = daysOfMonth;
        this.months = months;
        this.daysOfWeek = daysOfWeek;
        this.dayOfMonthRestricted = dayOfMonthRestricted;
        this.dayOfWeekRestricted = dayOfWeekRestricted;
    }

    /**
     * Parse an expression.
     *
     * @throws IllegalArgumentException on a wrong field count or any malformed field
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new IllegalArgumentException(
                    "Cron expression must have 5 fields, got " + parts.length + ": " + expression);
        }
        return new CronExpression(expression.trim(),
                parseField(parts[0], 0, 59, "minute"),
                parseField(parts[1], 0, 23, "hour"),
                parseField(parts[2], 1, 31, "day-of-month"),
                parseField(parts[3], 1, 12, "month"),
                parseField(parts[4], 0, 6, "day-of-week"),
                !parts[2].startsWith("*"),
                !parts[4].startsWith("*"));
    }

    public static Optional<CronExpression> tryParse(String expression) {
        try {
            return Optional.of(parse(expression));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static int[] parseField(String field, int min, int max, String name) {
        TreeSet<Integer> values = new TreeSet<>();
        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty list item in " + name + " field: " + field);
            }
            int step = 1;
            String range = part;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), name);
                if (step <= 0) {
                    throw new IllegalArgumentException("Step must be positive in " + name + " field: " + part);
                }
            }
            int start;
            int end;
            if ("*".equals(range)) {
                start = min;
                end = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw new IllegalArgumentException("Malformed range in " + name + " field: " + part);
                }
                start = parseNumber(bounds[0], name);
                end = parseNumber(bounds[1], name);
            } else {
                start = parseNumber(range, name);
                end = slash >= 0 ? max : start;
            }
            if (start < min || end > max || start > end) {
                throw new IllegalArgumentException(
                        "Value out of range " + min + "-" + max + " in " + name + " field: " + part);
            }
            for (int v = start; v <= end; v += step) {
                values.add(v);
            }
        }
        return values.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int parseNumber(String raw, String name) {
        if (raw.isEmpty() || !raw.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Not a number in " + name + " field: '" + raw + "'");
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Number too large in " + name + " field: " + raw, e);
        }
    }

    /**
     * First fire time strictly after {@code after}, evaluated in {@code zone}.
     *
     * @return empty when nothing matches within the search horizon
     */
    public Optional<Instant> next(Instant after, ZoneId zone) {
        LocalDate startDate = after.atZone(zone).toLocalDate();
        for (int offset = 0; offset < SEARCH_DAYS; offset++) {
            LocalDate day = startDate.plusDays(offset);
            if (!dayMatches(day)) {
                continue;
            }
            for (int hour : hours) {
                for (int minute : minutes) {
                    Instant candidate = ZonedDateTime.of(day, LocalTime.of(hour, minute), zone).toInstant();
                    if (candidate.isAfter(after)) {
                        return Optional.of(candidate);
                    }
                }
            }
        }
        return Optional.empty();
    }

    boolean dayMatches(LocalDate day) {
        if (!contains(months, day.getMonthValue())) {
            return false;
        }
        boolean domMatch = contains(daysOfMonth, day.getDayOfMonth());
        boolean dowMatch = contains(daysOfWeek, day.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && !dayOfWeekRestricted) {
            return domMatch;
        }
        if (dayOfWeekRestricted && !dayOfMonthRestricted) {
            return dowMatch;
        }
        return domMatch || dowMatch;
    }

    private static boolean contains(int[] sorted, int value) {
        return Arrays.binarySearch(sorted, value) >= 0;
    }

    int[] minutes() {
        return minutes.clone();
    }

    int[] hours() {
        return hours.clone();
    }

    int[] daysOfMonth() {
        return daysOfMonth.clone();
    }

    int[] months() {
        return months.clone();
    }

    int[] daysOfWeek() {
        return daysOfWeek.clone();
    }

    @Override
    public String toString() {
        return source;
    }
}
