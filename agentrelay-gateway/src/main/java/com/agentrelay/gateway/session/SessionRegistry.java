package com.agentrelay.gateway.session;

import com.agentrelay.common.infra.JsonFile;
import com.agentrelay.gateway.channel.ChatType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns one {@link SessionInfo} per session key and the per-key run gate.
 *
 * <p>
 * In-memory state is authoritative. The registry is snapshotted to a JSON file (a map of
 * key to session) with debounced writes; on load every session comes back with
 * {@code activeRun=false}. Snapshot failures are logged and never surface to callers.
 * </p>
 */
@Slf4j
public class SessionRegistry implements AutoCloseable {

    public static final long DEFAULT_SAVE_DEBOUNCE_MS = 1_000;
    public static final String REGISTRY_FILE = "_registry.json";

    private final Map<String, SessionInfo> sessions = new ConcurrentHashMap<>();
    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();
    private final Path registryPath;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final long saveDebounceMs;

    private ScheduledFuture<?> saveTask;

    public SessionRegistry(Path registryPath, ScheduledExecutorService scheduler, Clock clock) {
        this(registryPath, scheduler, clock, DEFAULT_SAVE_DEBOUNCE_MS);
    }

    public SessionRegistry(Path registryPath, ScheduledExecutorService scheduler, Clock clock,
            long saveDebounceMs) {
        this.registryPath = registryPath;
        this.scheduler = scheduler;
        this.clock = clock;
        this.saveDebounceMs = saveDebounceMs;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // =========================================================================
    // Load / Save
    // =========================================================================

    /**
     * Restore sessions from the snapshot file. A missing or corrupt file leaves the registry empty.
     */
    public void loadFromDisk() {
        try {
            String raw = JsonFile.readIfPresent(registryPath);
            if (raw == null) {
                return;
            }
            Map<String, SessionInfo> data = mapper.readValue(raw, new TypeReference<Map<String, SessionInfo>>() {
            });
            for (Map.Entry<String, SessionInfo> e : data.entrySet()) {
                SessionInfo info = e.getValue();
                if (info == null) {
                    continue;
                }
                info.setActiveRun(false);
                if (info.getKey() == null) {
                    info.setKey(e.getKey());
                }
                sessions.put(e.getKey(), info);
            }
            log.info("Loaded {} sessions from {}", sessions.size(), registryPath);
        } catch (IOException e) {
            log.error("Failed to load session registry from {}: {}", registryPath, e.getMessage());
        }
    }

    /**
     * Write the snapshot now.
     */
    public void saveToDisk() {
        Map<String, SessionInfo> snapshot = new LinkedHashMap<>();
        sessions.values().stream()
                .sorted(Comparator.comparing(SessionInfo::getKey))
                .forEach(s -> snapshot.put(s.getKey(), s.snapshot()));
        try {
            JsonFile.save(mapper, registryPath, snapshot);
            log.debug("Saved session registry with {} entries to {}", snapshot.size(), registryPath);
        } catch (IOException e) {
            log.error("Failed to save session registry to {}: {}", registryPath, e.getMessage());
        }
    }

    /**
     * Cancel any pending debounced save and write immediately.
     */
    public void flush() {
        synchronized (this) {
            if (saveTask != null) {
                saveTask.cancel(false);
                saveTask = null;
            }
        }
        saveToDisk();
    }

    private synchronized void scheduleSave() {
        if (saveTask != null) {
            saveTask.cancel(false);
        }
        saveTask = scheduler.schedule(() -> {
            synchronized (this) {
                saveTask = null;
            }
            saveToDisk();
        }, saveDebounceMs, TimeUnit.MILLISECONDS);
    }

    // =========================================================================
    // Sessions
    // =========================================================================

    /**
     * Return the session for the descriptor's key, creating it on first use.
     */
    public SessionInfo getOrCreate(SessionDescriptor descriptor) {
        String key = descriptor.key();
        boolean[] created = { false };
        SessionInfo session = sessions.computeIfAbsent(key, k -> {
            created[0] = true;
            long now = clock.millis();
            return SessionInfo.builder()
                    .key(k)
                    .channel(descriptor.channel())
                    .conversationId(descriptor.conversationId())
                    .chatType(descriptor.chatType().key())
                    .sessionId(newSessionId(descriptor, now))
                    .createdAt(now)
                    .lastMessageAt(now)
                    .activeRun(activeRuns.contains(k))
                    .build();
        });
        if (created[0]) {
            log.debug("Session created: {} (id={})", key, session.getSessionId());
            scheduleSave();
        }
        return session;
    }

    static String newSessionId(SessionDescriptor descriptor, long nowMs) {
        return descriptor.channel() + "-" + descriptor.chatType().key() + "-"
                + SessionKeys.sanitize(descriptor.conversationId()) + "-" + nowMs;
    }

    public Optional<SessionInfo> get(String key) {
        return Optional.ofNullable(sessions.get(key));
    }

    /**
     * Sessions ordered by most recent activity first.
     */
    public List<SessionInfo> list() {
        List<SessionInfo> result = new ArrayList<>(sessions.values());
        result.sort(Comparator.comparingLong(SessionInfo::getLastMessageAt).reversed());
        return result;
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Count an inbound message and refresh last activity.
     */
    public void incrementMessages(String key) {
        SessionInfo s = sessions.get(key);
        if (s != null) {
            synchronized (s) {
                s.setMessageCount(s.getMessageCount() + 1);
                s.setLastMessageAt(clock.millis());
            }
            scheduleSave();
        }
    }

    /**
     * Record the backend's continuation id for the next run of this key.
     */
    public void setContinuationId(String key, String continuationId) {
        SessionInfo s = sessions.get(key);
        if (s != null && continuationId != null && !continuationId.equals(s.getContinuationId())) {
            s.setContinuationId(continuationId);
            scheduleSave();
        }
    }

    /**
     * Remove a session and any run bookkeeping for it.
     */
    public boolean remove(String key) {
        activeRuns.remove(key);
        SessionInfo removed = sessions.remove(key);
        if (removed != null) {
            removed.setActiveRun(false);
            scheduleSave();
            log.info("Session removed: {}", key);
        }
        return removed != null;
    }

    /**
     * Replace the session of a key with a fresh one: new internal id, no continuation, zero
     * messages. The run gate of the key is left as is.
     *
     * @return the new session, or empty if the key is unknown
     */
    public Optional<SessionInfo> reset(String key) {
        SessionInfo fresh = sessions.computeIfPresent(key, (k, old) -> {
            long now = clock.millis();
            SessionDescriptor descriptor = new SessionDescriptor(old.getChannel(),
                    ChatType.fromKey(old.getChatType()), old.getConversationId());
            return SessionInfo.builder()
                    .key(k)
                    .channel(old.getChannel())
                    .conversationId(old.getConversationId())
                    .chatType(old.getChatType())
                    .sessionId(newSessionId(descriptor, now))
                    .createdAt(now)
                    .lastMessageAt(now)
                    .activeRun(activeRuns.contains(k))
                    .pendingApproval(old.getPendingApproval())
                    .pendingQuestion(old.getPendingQuestion())
                    .build();
        });
        if (fresh != null) {
            log.info("Session reset: {} (id={})", key, fresh.getSessionId());
            scheduleSave();
        }
        return Optional.ofNullable(fresh);
    }

    public void clear() {
        sessions.clear();
        activeRuns.clear();
        scheduleSave();
    }

    // =========================================================================
    // Run gate
    // =========================================================================

    /**
     * Set or clear the active-run flag of a key.
     */
    public void setActiveRun(String key, boolean active) {
        if (active) {
            activeRuns.add(key);
        } else {
            activeRuns.remove(key);
        }
        SessionInfo s = sessions.get(key);
        if (s != null) {
            s.setActiveRun(active);
        }
    }

    /**
     * Atomically claim the run gate of a key.
     *
     * @return false if a run is already active for the key
     */
    public boolean tryBeginRun(String key) {
        if (!activeRuns.add(key)) {
            return false;
        }
        SessionInfo s = sessions.get(key);
        if (s != null) {
            s.setActiveRun(true);
        }
        return true;
    }

    public boolean isRunActive(String key) {
        return activeRuns.contains(key);
    }

    public boolean hasActiveRun() {
        return !activeRuns.isEmpty();
    }

    public List<String> activeRunKeys() {
        return activeRuns.stream().sorted().toList();
    }

    // =========================================================================
    // Pending approval / question
    // =========================================================================

    /**
     * Attach a pending approval to its session.
     *
     * @return false if the session is unknown or already has one
     */
    public boolean setPendingApproval(PendingApproval pending) {
        SessionInfo s = sessions.get(pending.sessionKey());
        if (s == null) {
            return false;
        }
        synchronized (s) {
            if (s.getPendingApproval() != null) {
                return false;
            }
            s.setPendingApproval(pending);
        }
        return true;
    }

    /**
     * Detach the session's pending approval if it is the given request.
     */
    public Optional<PendingApproval> clearPendingApproval(String key, String requestId) {
        SessionInfo s = sessions.get(key);
        if (s == null) {
            return Optional.empty();
        }
        synchronized (s) {
            PendingApproval current = s.getPendingApproval();
            if (current == null || !current.requestId().equals(requestId)) {
                return Optional.empty();
            }
            s.setPendingApproval(null);
            return Optional.of(current);
        }
    }

    public Optional<PendingApproval> pendingApprovalFor(String key) {
        return get(key).map(SessionInfo::getPendingApproval);
    }

    /**
     * Find the pending approval whose prompt was rendered in the given conversation.
     */
    public Optional<PendingApproval> findApprovalByPromptKey(String promptKey) {
        return sessions.values().stream()
                .map(SessionInfo::getPendingApproval)
                .filter(p -> p != null && promptKey.equals(p.promptKey()))
                .min(Comparator.comparingLong(PendingApproval::createdAtMs));
    }

    public Optional<PendingApproval> findApprovalByRequestId(String requestId) {
        return sessions.values().stream()
                .map(SessionInfo::getPendingApproval)
                .filter(p -> p != null && p.requestId().equals(requestId))
                .findFirst();
    }

    public boolean setPendingQuestion(PendingQuestion pending) {
        SessionInfo s = sessions.get(pending.sessionKey());
        if (s == null) {
            return false;
        }
        synchronized (s) {
            if (s.getPendingQuestion() != null) {
                return false;
            }
            s.setPendingQuestion(pending);
        }
        return true;
    }

    public Optional<PendingQuestion> clearPendingQuestion(String key, String requestId) {
        SessionInfo s = sessions.get(key);
        if (s == null) {
            return Optional.empty();
        }
        synchronized (s) {
            PendingQuestion current = s.getPendingQuestion();
            if (current == null || !current.requestId().equals(requestId)) {
                return Optional.empty();
            }
            s.setPendingQuestion(null);
            return Optional.of(current);
        }
    }

    public Optional<PendingQuestion> pendingQuestionFor(String key) {
        return get(key).map(SessionInfo::getPendingQuestion);
    }

    public Optional<PendingQuestion> findQuestionByPromptKey(String promptKey) {
        return sessions.values().stream()
                .map(SessionInfo::getPendingQuestion)
                .filter(p -> p != null && promptKey.equals(p.promptKey()))
                .min(Comparator.comparingLong(PendingQuestion::createdAtMs));
    }

    public Optional<PendingQuestion> findQuestionByRequestId(String requestId) {
        return sessions.values().stream()
                .map(SessionInfo::getPendingQuestion)
                .filter(p -> p != null && p.requestId().equals(requestId))
                .findFirst();
    }

    @Override
    public void close() {
        flush();
    }
}
