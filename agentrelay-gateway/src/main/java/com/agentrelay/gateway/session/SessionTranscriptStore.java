package com.agentrelay.gateway.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-session JSONL transcript.
 *
 * <p>
 * File {@code <sessionDir>/<sessionId>.jsonl}. The first line is a header
 * {@code {"type":"session","version":1,"id":...,"timestamp":...}}, every following line one
 * entry {@code {"direction":"in|out|system","channel":...,"text":...,"ts":...}}.
 * </p>
 * <p>
 * Transcript writes never fail the caller; I/O errors are logged.
 * </p>
 */
@Slf4j
public class SessionTranscriptStore {

    public static final String DIRECTION_IN = "in";
    public static final String DIRECTION_OUT = "out";
    public static final String DIRECTION_SYSTEM = "system";

    private static final int TRANSCRIPT_VERSION = 1;

    private final Path sessionDir;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SessionTranscriptStore(Path sessionDir, ObjectMapper mapper, Clock clock) {
        this.sessionDir = sessionDir;
        this.mapper = mapper;
        this.clock = clock;
    }

    public Path transcriptPath(String sessionId) {
        return sessionDir.resolve(sessionId + ".jsonl");
    }

    public void appendInbound(String sessionId, String channel, String senderId, String text) {
        append(sessionId, DIRECTION_IN, channel, senderId, text);
    }

    public void appendOutbound(String sessionId, String channel, String text) {
        append(sessionId, DIRECTION_OUT, channel, null, text);
    }

    public void appendSystem(String sessionId, String text) {
        append(sessionId, DIRECTION_SYSTEM, null, null, text);
    }

    private synchronized void append(String sessionId, String direction, String channel,
            String senderId, String text) {
        if (sessionId == null || text == null) {
            return;
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("direction", direction);
        if (channel != null) {
            entry.put("channel", channel);
        }
        if (senderId != null) {
            entry.put("sender", senderId);
        }
        entry.put("text", text);
        entry.put("ts", clock.millis());
        try {
            Path file = ensureFile(sessionId);
            Files.writeString(file, mapper.writeValueAsString(entry) + "\n",
                    StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Failed to append transcript for session {}: {}", sessionId, e.getMessage());
        }
    }

    private Path ensureFile(String sessionId) throws IOException {
        Path file = transcriptPath(sessionId);
        if (Files.exists(file)) {
            return file;
        }
        Files.createDirectories(sessionDir);
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("type", "session");
        header.put("version", TRANSCRIPT_VERSION);
        header.put("id", sessionId);
        header.put("timestamp", Instant.ofEpochMilli(clock.millis()).toString());
        Files.writeString(file, mapper.writeValueAsString(header) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        log.debug("Created transcript file: {}", file);
        return file;
    }

    /**
     * Entries of a transcript, oldest first, header excluded.
     *
     * @param limit keep only the last {@code limit} entries when positive
     */
    public List<Map<String, Object>> read(String sessionId, int limit) {
        Path file = transcriptPath(sessionId);
        if (!Files.exists(file)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                Map<String, Object> parsed;
                try {
                    parsed = mapper.readValue(line, new TypeReference<Map<String, Object>>() {
                    });
                } catch (IOException e) {
                    log.warn("Skipping malformed transcript line {} of {}", lineNo, file);
                    continue;
                }
                if (!"session".equals(parsed.get("type"))) {
                    entries.add(parsed);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to read transcript for session {}: {}", sessionId, e.getMessage());
        }
        if (limit > 0 && entries.size() > limit) {
            return new ArrayList<>(entries.subList(entries.size() - limit, entries.size()));
        }
        return entries;
    }

    public boolean delete(String sessionId) {
        try {
            return Files.deleteIfExists(transcriptPath(sessionId));
        } catch (IOException e) {
            log.warn("Failed to delete transcript for session {}: {}", sessionId, e.getMessage());
            return false;
        }
    }
}
