package com.agentrelay.common.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFile_returnsDefaults() {
        ConfigService service = new ConfigService(tempDir.resolve("missing.json"));
        RelayConfig config = service.loadConfig();

        assertEquals("default", config.getPermissionMode());
        assertEquals("desktop", config.getRouter().getOwnerChannel());
        assertEquals("queue", config.getRouter().getBusyPolicy());
        assertFalse(config.getHeartbeat().isEnabled());
        assertTrue(config.getCron().isEnabled());
        assertNotNull(config.getSessionDir());
        assertTrue(config.getCron().getStore().endsWith("cron-jobs.json"));
    }

    @Test
    void loadsFileAndSubstitutesEnv() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, """
                {
                  "stateDir": "%s",
                  "permissionMode": "${MODE:-acceptEdits}",
                  "router": { "busyPolicy": "reject", "runTimeout": "${TIMEOUT}" },
                  "heartbeat": { "enabled": true, "every": "15m", "channel": "telegram", "to": "42" },
                  "unknownField": 1
                }
                """.formatted(tempDir.toString().replace("\\", "\\\\")));

        ConfigService service = new ConfigService(file, Duration.ofMillis(200),
                ConfigService.envOf(Map.of("TIMEOUT", "2m")));
        RelayConfig config = service.loadConfig();

        assertEquals("acceptEdits", config.getPermissionMode());
        assertEquals("reject", config.getRouter().getBusyPolicy());
        assertEquals("2m", config.getRouter().getRunTimeout());
        assertTrue(config.getHeartbeat().isEnabled());
        assertEquals("telegram", config.getHeartbeat().getChannel());
        assertEquals(tempDir.resolve("sessions").toString(), config.getSessionDir());
        assertEquals(tempDir.resolve("cron-jobs.json").toString(), config.getCron().getStore());
    }

    @Test
    void corruptFile_fallsBackToDefaults() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{ not json");

        RelayConfig config = new ConfigService(file).loadConfig();
        assertEquals("default", config.getPermissionMode());
    }

    @Test
    void expandHome_replacesTilde() {
        Path expanded = ConfigService.expandHome("~/x");
        assertEquals(Path.of(System.getProperty("user.home"), "x"), expanded);
    }
}
