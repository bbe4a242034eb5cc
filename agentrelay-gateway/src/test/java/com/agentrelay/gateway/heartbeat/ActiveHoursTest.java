package com.agentrelay.gateway.heartbeat;

import com.agentrelay.common.config.RelayConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ActiveHoursTest {

    private static RelayConfig.ActiveHoursConfig config(String start, String end, String zone) {
        RelayConfig.ActiveHoursConfig cfg = new RelayConfig.ActiveHoursConfig();
        cfg.setStart(start);
        cfg.setEnd(end);
        cfg.setTimezone(zone);
        return cfg;
    }

    @ParameterizedTest
    @CsvSource({
            "08:00, 22:00, 2026-01-05T08:00:00Z, true",
            "08:00, 22:00, 2026-01-05T21:59:00Z, true",
            "08:00, 22:00, 2026-01-05T22:00:00Z, false",
            "08:00, 22:00, 2026-01-05T07:59:00Z, false",
            "22:00, 06:00, 2026-01-05T23:30:00Z, true",
            "22:00, 06:00, 2026-01-05T05:59:00Z, true",
            "22:00, 06:00, 2026-01-05T12:00:00Z, false",
            "00:00, 24:00, 2026-01-05T23:59:00Z, true" })
    void contains_window(String start, String end, String at, boolean expected) {
        ActiveHours hours = ActiveHours.from(config(start, end, null), ZoneOffset.UTC).orElseThrow();

        assertEquals(expected, hours.contains(Instant.parse(at)));
    }

    @Test
    void timezone_overridesFallback() {
        ActiveHours hours = ActiveHours.from(config("09:00", "17:00", "Asia/Tokyo"), ZoneOffset.UTC).orElseThrow();

        assertEquals(ZoneId.of("Asia/Tokyo"), hours.zone());
        // 01:00Z is 10:00 in Tokyo
        assertTrue(hours.contains(Instant.parse("2026-01-05T01:00:00Z")));
        assertFalse(hours.contains(Instant.parse("2026-01-05T12:00:00Z")));
    }

    @Test
    void missingOrMalformed_meansAlwaysActive() {
        assertTrue(ActiveHours.from(null, ZoneOffset.UTC).isEmpty());
        assertTrue(ActiveHours.from(config("08:00", null, null), ZoneOffset.UTC).isEmpty());
        assertTrue(ActiveHours.from(config("8am", "17:00", null), ZoneOffset.UTC).isEmpty());
        assertTrue(ActiveHours.from(config("24:00", "17:00", null), ZoneOffset.UTC).isEmpty());
        assertTrue(ActiveHours.from(config("09:00", "09:00", null), ZoneOffset.UTC).isEmpty());
        assertTrue(ActiveHours.from(config("09:00", "17:00", "Not/AZone"), ZoneOffset.UTC).isEmpty());
    }

    @Test
    void parseHhmm_bounds() {
        assertEquals(0, ActiveHours.parseHhmm("00:00", false));
        assertEquals(1439, ActiveHours.parseHhmm("23:59", false));
        assertEquals(1440, ActiveHours.parseHhmm("24:00", true));
        assertEquals(-1, ActiveHours.parseHhmm("24:30", true));
        assertEquals(-1, ActiveHours.parseHhmm("7:00", false));
    }
}
