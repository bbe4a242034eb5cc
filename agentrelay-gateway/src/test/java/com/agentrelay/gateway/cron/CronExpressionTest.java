package com.agentrelay.gateway.cron;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CronExpressionTest {

    private static Instant next(String expression, String after) {
        return CronExpression.parse(expression).next(Instant.parse(after), ZoneOffset.UTC).orElseThrow();
    }

    @ParameterizedTest
    @CsvSource({
            "'*/15 * * * *', 2026-01-05T10:07:00Z, 2026-01-05T10:15:00Z",
            "'*/15 * * * *', 2026-01-05T10:15:00Z, 2026-01-05T10:30:00Z",
            "'0 * * * *', 2026-01-05T10:00:30Z, 2026-01-05T11:00:00Z",
            "'30 8 * * *', 2026-01-05T09:00:00Z, 2026-01-06T08:30:00Z",
            "'0 9 * * 1-5', 2026-01-10T12:00:00Z, 2026-01-12T09:00:00Z",
            "'0 9 * * 0', 2026-01-05T12:00:00Z, 2026-01-11T09:00:00Z",
            "'0 0 1 * *', 2026-01-05T00:00:00Z, 2026-02-01T00:00:00Z",
            "'5-10/5 3 * * *', 2026-01-05T03:06:00Z, 2026-01-05T03:10:00Z",
            "'0 0 29 2 *', 2027-03-01T00:00:00Z, 2028-02-29T00:00:00Z" })
    void next_findsFirstMatchStrictlyAfter(String expression, String after, String expected) {
        assertEquals(Instant.parse(expected), next(expression, after));
    }

    @Test
    void restrictedDayFields_areOred() {
        // 2026-01-05 and 2026-01-12 are Mondays; the 15th is a Thursday
        assertEquals(Instant.parse("2026-01-12T00:00:00Z"), next("0 0 1,15 * 1", "2026-01-05T12:00:00Z"));
        assertEquals(Instant.parse("2026-01-15T00:00:00Z"), next("0 0 1,15 * 1", "2026-01-13T00:00:00Z"));
    }

    @Test
    void starredDayOfWeek_leavesDayOfMonthAlone() {
        CronExpression expr = CronExpression.parse("0 0 15 * *");
        assertTrue(expr.dayMatches(LocalDate.of(2026, 1, 15)));
        assertFalse(expr.dayMatches(LocalDate.of(2026, 1, 12)));
    }

    @Test
    void steppedDayOfWeek_doesNotRestrict() {
        CronExpression expr = CronExpression.parse("0 0 1 * */2");
        assertTrue(expr.dayMatches(LocalDate.of(2026, 2, 1)));
        assertFalse(expr.dayMatches(LocalDate.of(2026, 2, 3)));
    }

    @Test
    void next_usesZone() {
        Instant result = CronExpression.parse("0 9 * * *")
                .next(Instant.parse("2026-01-05T12:00:00Z"), ZoneId.of("America/New_York"))
                .orElseThrow();
        assertEquals(Instant.parse("2026-01-05T14:00:00Z"), result);
    }

    @Test
    void impossibleDate_hasNoNextRun() {
        assertTrue(CronExpression.parse("0 12 31 2 *").next(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC)
                .isEmpty());
    }

    @Test
    void parseField_expandsListsRangesAndSteps() {
        assertArrayEquals(new int[] { 1, 2, 3, 10, 20, 30 }, CronExpression.parseField("1-3,10/10", 0, 30, "minute"));
        assertArrayEquals(new int[] { 0, 2, 4, 6 }, CronExpression.parseField("*/2", 0, 6, "day-of-week"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "* * * *",
            "* * * * * *",
            "60 * * * *",
            "* 24 * * *",
            "* * 0 * *",
            "* * * 13 *",
            "* * * * 7",
            "a * * * *",
            "*/0 * * * *",
            "5-1 * * * *",
            "1,,2 * * * *",
            "1-2-3 * * * *" })
    void parse_rejectsMalformed(String expression) {
        assertThrows(IllegalArgumentException.class, () -> CronExpression.parse(expression));
        assertTrue(CronExpression.tryParse(expression).isEmpty());
    }

    @Test
    void toString_isSource() {
        assertEquals("*/5 * * * *", CronExpression.parse("  */5 * * * * ").toString());
    }
}
