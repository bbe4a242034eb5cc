package com.agentrelay.gateway.heartbeat;

import com.agentrelay.common.config.RelayConfig;
import com.agentrelay.common.infra.Durations;
import com.agentrelay.gateway.channel.ChannelAdapter;
import com.agentrelay.gateway.channel.ChannelAdapterRegistry;
import com.agentrelay.gateway.channel.SendOptions;
import com.agentrelay.gateway.routing.RouterEvents;
import com.agentrelay.gateway.routing.RunOutcome;
import com.agentrelay.gateway.routing.RunStatus;
import com.agentrelay.gateway.routing.TriggerDispatcher;
import com.agentrelay.gateway.routing.TriggerRequest;
import com.agentrelay.gateway.session.SessionDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-interval trigger that asks the backend to check {@code HEARTBEAT.md} and only
 * delivers replies that carry news.
 *
 * <p>
 * Runs use the session {@code heartbeat:dm:main}. After every firing, scheduled or manual,
 * {@code nextDueMs = lastRunMs + intervalMs} and the timer is re-armed.
 * </p>
 */
@Slf4j
public class HeartbeatRunner implements AutoCloseable {

    public static final long DEFAULT_INTERVAL_MS = 30 * 60_000L;
    public static final long DEFAULT_DUPLICATE_WINDOW_MS = 24 * 3_600_000L;
    public static final SessionDescriptor SESSION = SessionDescriptor.dm("heartbeat", "main");

    private final Path workspace;
    private final ScheduledExecutorService scheduler;
    private final TriggerDispatcher dispatcher;
    private final ChannelAdapterRegistry adapters;
    private final RouterEvents events;
    private final Clock clock;
    private final HeartbeatState state = new HeartbeatState();

    private volatile RelayConfig.HeartbeatConfig settings;
    private ScheduledFuture<?> timer;
    private boolean started;

    public HeartbeatRunner(RelayConfig.HeartbeatConfig settings, Path workspace,
            ScheduledExecutorService scheduler, TriggerDispatcher dispatcher,
            ChannelAdapterRegistry adapters, RouterEvents events, Clock clock) {
        this.settings = settings != null ? settings : new RelayConfig.HeartbeatConfig();
        this.workspace = workspace;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.adapters = adapters;
        this.events = events != null ? events : RouterEvents.NONE;
        this.clock = clock;
        this.state.setIntervalMs(intervalOf(this.settings));
        this.state.setNextDueMs(clock.millis() + state.getIntervalMs());
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    public synchronized void start() {
        started = true;
        state.setNextDueMs(clock.millis() + state.getIntervalMs());
        if (!settings.isEnabled()) {
            log.info("Heartbeat disabled");
            return;
        }
        scheduleNext();
        log.info("Heartbeat started, interval {}ms", state.getIntervalMs());
    }

    public synchronized void stop() {
        started = false;
        cancelTimer();
        log.info("Heartbeat stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Apply new settings. The next due time is recomputed from the last run.
     */
    public synchronized void updateConfig(RelayConfig.HeartbeatConfig newSettings) {
        this.settings = newSettings != null ? newSettings : new RelayConfig.HeartbeatConfig();
        state.setIntervalMs(intervalOf(settings));
        long base = state.getLastRunMs() != null ? state.getLastRunMs() : clock.millis();
        state.setNextDueMs(base + state.getIntervalMs());
        if (started && settings.isEnabled()) {
            scheduleNext();
        } else {
            cancelTimer();
        }
        log.info("Heartbeat config updated: enabled={}, interval={}ms", settings.isEnabled(), state.getIntervalMs());
    }

    private void scheduleNext() {
        cancelTimer();
        long delay = Math.max(0, state.getNextDueMs() - clock.millis());
        timer = scheduler.schedule(this::tick, delay, TimeUnit.MILLISECONDS);
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    private void tick() {
        synchronized (this) {
            timer = null;
            if (!started) {
                return;
            }
        }
        runOnce("interval");
    }

    // ── Running ─────────────────────────────────────────────────────────

    /**
     * Fire now, outside the schedule; the timer restarts from this run.
     */
    public CompletableFuture<HeartbeatRunResult> runNow(String reason) {
        return runOnce(reason != null ? reason : "manual");
    }

    private CompletableFuture<HeartbeatRunResult> runOnce(String reason) {
        long startedAt = clock.millis();
        CompletableFuture<HeartbeatRunResult> result;
        try {
            result = evaluate(startedAt);
        } catch (RuntimeException e) {
            result = CompletableFuture.completedFuture(
                    HeartbeatRunResult.failed(e.getMessage(), clock.millis() - startedAt));
        }
        return result.handle((r, err) -> {
            HeartbeatRunResult effective = err != null
                    ? HeartbeatRunResult.failed(String.valueOf(err.getMessage()), clock.millis() - startedAt)
                    : r;
            afterRun(reason, effective);
            return effective;
        });
    }

    private CompletableFuture<HeartbeatRunResult> evaluate(long startedAt) {
        RelayConfig.HeartbeatConfig cfg = settings;
        if (!cfg.isEnabled()) {
            return CompletableFuture.completedFuture(HeartbeatRunResult.skipped("disabled"));
        }
        if (Durations.parseDurationMs(cfg.getEvery()) == null) {
            return CompletableFuture.completedFuture(HeartbeatRunResult.skipped("invalid-interval"));
        }
        Optional<ActiveHours> activeHours = ActiveHours.from(cfg.getActiveHours(), clock.getZone());
        if (activeHours.isPresent() && !activeHours.get().contains(Instant.ofEpochMilli(startedAt))) {
            return CompletableFuture.completedFuture(HeartbeatRunResult.skipped("quiet-hours"));
        }
        if (isHeartbeatFileEmpty()) {
            return CompletableFuture.completedFuture(HeartbeatRunResult.skipped("empty-heartbeat-file"));
        }

        TriggerRequest request = TriggerRequest.builder()
                .source("heartbeat")
                .session(SESSION)
                .prompt(cfg.getPrompt() != null && !cfg.getPrompt().isBlank()
                        ? cfg.getPrompt()
                        : HeartbeatText.DEFAULT_PROMPT)
                .build();
        return dispatcher.dispatchTrigger(request)
                .thenCompose(outcome -> handleOutcome(cfg, outcome, startedAt));
    }

    private CompletableFuture<HeartbeatRunResult> handleOutcome(RelayConfig.HeartbeatConfig cfg,
            RunOutcome outcome, long startedAt) {
        if (outcome.status() == RunStatus.SKIPPED) {
            return CompletableFuture.completedFuture(
                    HeartbeatRunResult.skipped(outcome.detail(), clock.millis() - startedAt));
        }
        if (!outcome.isCompleted()) {
            return CompletableFuture.completedFuture(
                    HeartbeatRunResult.failed(outcome.detail(), clock.millis() - startedAt));
        }

        HeartbeatText.Stripped stripped = HeartbeatText.stripToken(outcome.text(), cfg.getAckMaxChars());
        if (stripped.ack()) {
            return CompletableFuture.completedFuture(
                    HeartbeatRunResult.ran("heartbeat-ok", clock.millis() - startedAt));
        }
        if (isDuplicate(stripped.text(), startedAt, cfg)) {
            return CompletableFuture.completedFuture(
                    HeartbeatRunResult.skipped("duplicate", clock.millis() - startedAt));
        }
        return deliver(cfg, stripped.text()).handle((ignored, err) -> {
            if (err != null) {
                log.warn("Heartbeat delivery to {}/{} failed: {}", cfg.getChannel(), cfg.getTo(), err.getMessage());
                return HeartbeatRunResult.failed("delivery-failed", clock.millis() - startedAt);
            }
            synchronized (this) {
                state.setLastText(stripped.text());
                state.setLastSentAt(startedAt);
            }
            events.emit("heartbeat.message", Map.of("text", stripped.text()));
            return HeartbeatRunResult.ran(null, clock.millis() - startedAt);
        });
    }

    private synchronized boolean isDuplicate(String text, long startedAt, RelayConfig.HeartbeatConfig cfg) {
        long window = Durations.parseDurationMs(cfg.getDuplicateWindow(), DEFAULT_DUPLICATE_WINDOW_MS);
        return text.equals(state.getLastText())
                && state.getLastSentAt() != null
                && startedAt - state.getLastSentAt() < window;
    }

    private CompletableFuture<Void> deliver(RelayConfig.HeartbeatConfig cfg, String text) {
        if (cfg.getChannel() == null || cfg.getTo() == null) {
            return CompletableFuture.completedFuture(null);
        }
        Optional<ChannelAdapter> adapter = adapters.find(cfg.getChannel());
        if (adapter.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("No adapter for channel " + cfg.getChannel()));
        }
        return adapter.get().send(cfg.getTo(), text, SendOptions.none()).thenApply(r -> null);
    }

    private boolean isHeartbeatFileEmpty() {
        if (workspace == null) {
            return false;
        }
        Path file = workspace.resolve(HeartbeatText.FILE_NAME);
        if (!Files.exists(file)) {
            return false;
        }
        try {
            return HeartbeatText.isContentEffectivelyEmpty(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", file, e.getMessage());
            return false;
        }
    }

    private synchronized void afterRun(String reason, HeartbeatRunResult result) {
        long now = clock.millis();
        state.setLastRunMs(now);
        state.setNextDueMs(now + state.getIntervalMs());
        state.setLastStatus(result.status());
        state.setLastReason(result.reason());
        if (HeartbeatRunResult.FAILED.equals(result.status())) {
            log.warn("Heartbeat ({}) failed: {}", reason, result.reason());
        } else {
            log.debug("Heartbeat ({}) {}{}", reason, result.status(),
                    result.reason() != null ? ": " + result.reason() : "");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", result.status());
        payload.put("reason", result.reason());
        payload.put("durationMs", result.durationMs());
        events.emit("heartbeat", payload);
        if (started && settings.isEnabled()) {
            scheduleNext();
        }
    }

    // ── Status ──────────────────────────────────────────────────────────

    public synchronized HeartbeatState state() {
        return state.copy();
    }

    public synchronized boolean isArmed() {
        return timer != null && !timer.isDone();
    }

    public Map<String, Object> status() {
        HeartbeatState s = state();
        RelayConfig.HeartbeatConfig cfg = settings;
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("enabled", cfg.isEnabled());
        status.put("every", cfg.getEvery());
        status.put("intervalMs", s.getIntervalMs());
        status.put("nextDueMs", s.getNextDueMs());
        status.put("lastRunMs", s.getLastRunMs());
        status.put("lastStatus", s.getLastStatus());
        status.put("lastReason", s.getLastReason());
        status.put("lastSentAt", s.getLastSentAt());
        status.put("target", cfg.getChannel() != null ? cfg.getChannel() + "/" + cfg.getTo() : null);
        return status;
    }

    static long intervalOf(RelayConfig.HeartbeatConfig cfg) {
        return Durations.parseDurationMs(cfg.getEvery(), DEFAULT_INTERVAL_MS);
    }
}
