package com.agentrelay.gateway.cron;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class JobSchedulesTest {

    private static final long NOW = Instant.parse("2026-01-05T10:07:00Z").toEpochMilli();
    private static final long HOUR = 3_600_000L;

    // =========================================================================
    // computeNextRunAtMs
    // =========================================================================

    @Nested
    class NextRun {

        @Test
        void cron_usesJobZone() {
            ScheduledJob job = ScheduledJob.builder().cron("0 9 * * *").timezone("Europe/Berlin").build();

            Long next = JobSchedules.computeNextRunAtMs(job, NOW, ZoneOffset.UTC);

            assertEquals(Instant.parse("2026-01-06T08:00:00Z").toEpochMilli(), next);
        }

        @Test
        void cron_fallsBackToDefaultZone() {
            ScheduledJob job = ScheduledJob.builder().cron("*/15 * * * *").build();

            assertEquals(Instant.parse("2026-01-05T10:15:00Z").toEpochMilli(),
                    JobSchedules.computeNextRunAtMs(job, NOW, ZoneOffset.UTC));
        }

        @Test
        void cron_unknownZone_hasNoNextRun() {
            ScheduledJob job = ScheduledJob.builder().cron("0 9 * * *").timezone("Mars/Olympus").build();

            assertNull(JobSchedules.computeNextRunAtMs(job, NOW, ZoneOffset.UTC));
        }

        @Test
        void every_neverRun_startsFromNow() {
            ScheduledJob job = ScheduledJob.builder().every("4h").build();

            assertEquals(NOW + 4 * HOUR, JobSchedules.computeNextRunAtMs(job, NOW, ZoneOffset.UTC));
        }

        @Test
        void every_followsLastRun() {
            ScheduledJob job = ScheduledJob.builder().every("4h").lastRunAt(Instant.ofEpochMilli(NOW - HOUR)).build();

            assertEquals(NOW + 3 * HOUR, JobSchedules.computeNextRunAtMs(job, NOW, ZoneOffset.UTC));
        }

        @Test
        void every_missedSlots_areNotReplayed() {
            ScheduledJob job = ScheduledJob.builder().every("4h")
                    .lastRunAt(Instant.ofEpochMilli(NOW - 10 * HOUR)).build();

            assertEquals(NOW + 4 * HOUR, JobSchedules.computeNextRunAtMs(job, NOW, ZoneOffset.UTC));
        }

        @Test
        void at_onlyWhileAhead() {
            ScheduledJob future = ScheduledJob.builder().at("2026-01-05T12:00:00Z").build();
            ScheduledJob past = ScheduledJob.builder().at("2026-01-05T09:00:00Z").build();

            assertEquals(Instant.parse("2026-01-05T12:00:00Z").toEpochMilli(),
                    JobSchedules.computeNextRunAtMs(future, NOW, ZoneOffset.UTC));
            assertNull(JobSchedules.computeNextRunAtMs(past, NOW, ZoneOffset.UTC));
        }

        @Test
        void noSchedule_hasNoNextRun() {
            assertNull(JobSchedules.computeNextRunAtMs(new ScheduledJob(), NOW, ZoneOffset.UTC));
        }
    }

    // =========================================================================
    // Time parsing
    // =========================================================================

    @Nested
    class TimeParsing {

        @Test
        void resolveAt_relativeDuration_countsFromNow() {
            assertEquals("2026-01-05T10:27:00Z", JobSchedules.resolveAt("20m", NOW));
        }

        @Test
        void resolveAt_absolute_isNormalized() {
            assertEquals("2026-02-01T09:30:00Z", JobSchedules.resolveAt("2026-02-01T10:30:00+01:00", NOW));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = { "tomorrow", "2026-13-01" })
        void resolveAt_rejectsGarbage(String at) {
            assertThrows(IllegalArgumentException.class, () -> JobSchedules.resolveAt(at, NOW));
        }

        @ParameterizedTest
        @CsvSource({
                "2026-01-05, 2026-01-05T00:00:00Z",
                "2026-01-05T10:00:00, 2026-01-05T10:00:00Z",
                "2026-01-05T10:00:00Z, 2026-01-05T10:00:00Z",
                "2026-01-05T10:00:00+02:00, 2026-01-05T10:00:00+02:00" })
        void normalizeUtcIso_assumesUtc(String raw, String expected) {
            assertEquals(expected, JobSchedules.normalizeUtcIso(raw));
        }

        @Test
        void parseAbsoluteTimeMs_acceptsEpochMillis() {
            assertEquals(1767607200000L, JobSchedules.parseAbsoluteTimeMs("1767607200000"));
            assertNull(JobSchedules.parseAbsoluteTimeMs("12345"));
            assertNull(JobSchedules.parseAbsoluteTimeMs("  "));
        }

        @Test
        void resolveZone_blankUsesFallback() {
            assertEquals(ZoneOffset.UTC, JobSchedules.resolveZone(" ", ZoneOffset.UTC));
            assertEquals(ZoneId.of("Asia/Tokyo"), JobSchedules.resolveZone("Asia/Tokyo", ZoneOffset.UTC));
            assertNull(JobSchedules.resolveZone("Nowhere/Special", ZoneOffset.UTC));
        }
    }
}
