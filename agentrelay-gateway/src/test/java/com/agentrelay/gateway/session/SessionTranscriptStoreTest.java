package com.agentrelay.gateway.session;

import com.agentrelay.gateway.testing.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionTranscriptStoreTest {

    @TempDir
    Path tempDir;

    private SessionTranscriptStore store;

    @BeforeEach
    void setUp() {
        store = new SessionTranscriptStore(tempDir.resolve("sessions"), new ObjectMapper(),
                MutableClock.utc("2026-02-01T12:00:00Z"));
    }

    @Test
    void firstAppend_writesHeaderLine() throws Exception {
        store.appendInbound("s1", "telegram", "u1", "hello");

        List<String> lines = Files.readAllLines(store.transcriptPath("s1"));
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"type\":\"session\""));
        assertTrue(lines.get(0).contains("\"id\":\"s1\""));
    }

    @Test
    void read_returnsEntriesOldestFirst() {
        store.appendInbound("s1", "telegram", "u1", "hello");
        store.appendOutbound("s1", "telegram", "hi back");
        store.appendSystem("s1", "run error: boom");

        List<Map<String, Object>> entries = store.read("s1", 0);

        assertEquals(3, entries.size());
        assertEquals("in", entries.get(0).get("direction"));
        assertEquals("u1", entries.get(0).get("sender"));
        assertEquals("out", entries.get(1).get("direction"));
        assertEquals("system", entries.get(2).get("direction"));
    }

    @Test
    void read_withLimit_keepsNewest() {
        for (int i = 1; i <= 5; i++) {
            store.appendOutbound("s1", "desktop", "msg " + i);
        }

        List<Map<String, Object>> entries = store.read("s1", 2);

        assertEquals(List.of("msg 4", "msg 5"), entries.stream().map(e -> e.get("text")).toList());
    }

    @Test
    void read_skipsMalformedLines() throws Exception {
        store.appendOutbound("s1", "desktop", "good");
        Files.writeString(store.transcriptPath("s1"), "{broken\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        store.appendOutbound("s1", "desktop", "also good");

        assertEquals(2, store.read("s1", 0).size());
    }

    @Test
    void unknownSession_readsEmpty() {
        assertTrue(store.read("missing", 10).isEmpty());
    }

    @Test
    void nullText_isIgnored() {
        store.appendOutbound("s1", "desktop", null);

        assertFalse(Files.exists(store.transcriptPath("s1")));
    }

    @Test
    void delete_removesFile() {
        store.appendOutbound("s1", "desktop", "x");

        assertTrue(store.delete("s1"));
        assertFalse(store.delete("s1"));
    }
}
