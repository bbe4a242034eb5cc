package com.agentrelay.gateway.cron;

import com.agentrelay.common.infra.Durations;
import com.agentrelay.gateway.routing.RunOutcome;
import com.agentrelay.gateway.routing.TriggerDispatcher;
import com.agentrelay.gateway.routing.TriggerRequest;
import com.agentrelay.gateway.session.SessionDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Manages scheduled jobs: CRUD, persistence, timers and firing.
 *
 * <p>
 * Each enabled job with a future fire time holds one timer on the shared scheduler. A firing
 * dispatches the job's prompt through the {@link TriggerDispatcher}, records the outcome on
 * the job, then either deletes the job ({@code deleteAfterRun}) or re-arms it. Outcomes
 * never stop rescheduling.
 * </p>
 */
@Slf4j
public class CronService implements AutoCloseable {

    static final int MAX_RUN_LOGS = 200;
    static final String CRON_CHANNEL = "cron";

    private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> scheduledTasks = new ConcurrentHashMap<>();
    private final LinkedList<CronRunLog> runLogs = new LinkedList<>();
    private final CronStore store;
    private final ScheduledExecutorService scheduler;
    private final TriggerDispatcher dispatcher;
    private final SessionDescriptor mainSession;
    private final Clock clock;

    private volatile boolean running;

    /**
     * @param mainSession session that jobs bound to "main" run in
     */
    public CronService(CronStore store, ScheduledExecutorService scheduler, TriggerDispatcher dispatcher,
            SessionDescriptor mainSession, Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.mainSession = mainSession;
        this.clock = clock;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Load persisted jobs and arm every enabled one.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        jobs.clear();
        for (ScheduledJob job : store.load()) {
            jobs.put(job.getId(), job);
        }
        running = true;
        for (ScheduledJob job : jobs.values()) {
            if (job.isEnabled()) {
                String problem = validateSchedule(job);
                if (problem != null) {
                    log.warn("Cron job {} ({}) has an invalid schedule, not armed: {}",
                            job.getId(), job.getName(), problem);
                    continue;
                }
                arm(job);
            }
        }
        log.info("Cron service started with {} jobs ({} enabled)",
                jobs.size(),
                jobs.values().stream().filter(ScheduledJob::isEnabled).count());
    }

    /**
     * Cancel all timers. Jobs stay in memory and on disk.
     */
    public synchronized void stop() {
        running = false;
        for (ScheduledFuture<?> task : scheduledTasks.values()) {
            task.cancel(false);
        }
        scheduledTasks.clear();
        log.info("Cron service stopped");
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
    }

    // =========================================================================
    // CRUD
    // =========================================================================

    /**
     * Validate, store, persist and arm a new job.
     *
     * @throws IllegalArgumentException when the definition is invalid; nothing is stored
     */
    public synchronized ScheduledJob addJob(ScheduledJob draft) {
        if (draft.getMessage() == null || draft.getMessage().isBlank()) {
            throw new IllegalArgumentException("Job message is required");
        }
        int kinds = (draft.getCron() != null ? 1 : 0) + (draft.getEvery() != null ? 1 : 0)
                + (draft.getAt() != null ? 1 : 0);
        if (kinds != 1) {
            throw new IllegalArgumentException("Exactly one of cron, every or at is required");
        }
        String session = draft.getSession() != null ? draft.getSession() : ScheduledJob.SESSION_MAIN;
        if (!ScheduledJob.SESSION_MAIN.equals(session) && !ScheduledJob.SESSION_ISOLATED.equals(session)) {
            throw new IllegalArgumentException("Session must be 'main' or 'isolated': " + session);
        }
        if (draft.isDeliver() && (draft.getChannel() == null || draft.getTo() == null)) {
            throw new IllegalArgumentException("Delivery requires channel and to");
        }

        long now = clock.millis();
        ScheduledJob job = draft.toBuilder()
                .id(generateJobId(now))
                .session(session)
                .at(draft.getAt() != null ? JobSchedules.resolveAt(draft.getAt(), now) : null)
                .createdAt(Instant.ofEpochMilli(now))
                .lastRunAt(null)
                .nextRunAt(null)
                .lastStatus(null)
                .lastError(null)
                .runCount(0)
                .build();
        if (job.getName() == null || job.getName().isBlank()) {
            job.setName(job.getId());
        }
        String problem = validateSchedule(job);
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }

        jobs.put(job.getId(), job);
        if (running) {
            arm(job);
        }
        persist();
        log.info("Added cron job: {} ({})", job.getName(), job.scheduleText());
        return job;
    }

    public Optional<ScheduledJob> getJob(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /**
     * Jobs ordered by creation time.
     */
    public List<ScheduledJob> listJobs() {
        List<ScheduledJob> list = new ArrayList<>(jobs.values());
        list.sort(Comparator.comparing(ScheduledJob::getCreatedAt,
                Comparator.nullsFirst(Comparator.naturalOrder())));
        return list;
    }

    public synchronized boolean removeJob(String id) {
        ScheduledJob removed = jobs.remove(id);
        if (removed == null) {
            return false;
        }
        disarm(id);
        persist();
        log.info("Removed cron job: {}", id);
        return true;
    }

    /**
     * Enable or disable a job; enabling re-arms it.
     */
    public synchronized Optional<ScheduledJob> setEnabled(String id, boolean enabled) {
        ScheduledJob job = jobs.get(id);
        if (job == null) {
            return Optional.empty();
        }
        job.setEnabled(enabled);
        if (enabled && running) {
            arm(job);
        } else {
            disarm(id);
            job.setNextRunAt(null);
        }
        persist();
        log.info("Cron job {} {}", id, enabled ? "enabled" : "disabled");
        return Optional.of(job);
    }

    public synchronized Optional<ScheduledJob> toggle(String id) {
        ScheduledJob job = jobs.get(id);
        if (job == null) {
            return Optional.empty();
        }
        return setEnabled(id, !job.isEnabled());
    }

    /**
     * Whether a timer is currently pending for the job.
     */
    public boolean isArmed(String id) {
        ScheduledFuture<?> task = scheduledTasks.get(id);
        return task != null && !task.isDone();
    }

    // =========================================================================
    // Execution
    // =========================================================================

    /**
     * Fire a job now, regardless of its enabled flag. The job is re-armed afterwards and is
     * never deleted by a manual run.
     */
    public CompletableFuture<CronRunLog> runNow(String id) {
        ScheduledJob job = jobs.get(id);
        if (job == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Job not found: " + id));
        }
        return execute(job, "manual");
    }

    private void fire(String id) {
        scheduledTasks.remove(id);
        ScheduledJob job = jobs.get(id);
        if (!running || job == null || !job.isEnabled()) {
            log.debug("Cron job {} fired but is gone or disabled", id);
            return;
        }
        execute(job, "schedule");
    }

    private CompletableFuture<CronRunLog> execute(ScheduledJob job, String trigger) {
        Instant start = Instant.ofEpochMilli(clock.millis());
        CompletableFuture<RunOutcome> outcome;
        try {
            outcome = dispatcher.dispatchTrigger(toTrigger(job));
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }
        return outcome.handle((result, err) -> {
            RunOutcome effective = err != null
                    ? RunOutcome.error(null, null, rootMessage(err))
                    : result;
            return complete(job, trigger, start, effective);
        });
    }

    private synchronized CronRunLog complete(ScheduledJob job, String trigger, Instant start, RunOutcome outcome) {
        Instant end = Instant.ofEpochMilli(clock.millis());
        job.setLastRunAt(end);
        job.setLastStatus(outcome.status().wireName());
        job.setLastError(outcome.isCompleted() ? null : outcome.detail());
        job.setRunCount(job.getRunCount() + 1);

        CronRunLog runLog = CronRunLog.builder()
                .jobId(job.getId())
                .jobName(job.getName())
                .trigger(trigger)
                .startedAt(start)
                .finishedAt(end)
                .durationMs(Duration.between(start, end).toMillis())
                .status(outcome.status().wireName())
                .error(outcome.isCompleted() ? null : outcome.detail())
                .resultText(outcome.text())
                .build();
        synchronized (runLogs) {
            runLogs.addLast(runLog);
            while (runLogs.size() > MAX_RUN_LOGS) {
                runLogs.removeFirst();
            }
        }

        if (outcome.isCompleted()) {
            log.info("Cron job {} executed successfully in {}ms", job.getName(), runLog.getDurationMs());
        } else {
            log.warn("Cron job {} finished with status {}: {}", job.getName(),
                    outcome.status().wireName(), outcome.detail());
        }

        boolean stillPresent = jobs.get(job.getId()) == job;
        if (stillPresent && job.isDeleteAfterRun() && "schedule".equals(trigger)) {
            jobs.remove(job.getId());
            disarm(job.getId());
            log.info("Removed one-shot cron job after run: {}", job.getId());
        } else if (stillPresent && job.isEnabled() && running) {
            arm(job);
        }
        if (stillPresent) {
            persist();
        }
        return runLog;
    }

    TriggerRequest toTrigger(ScheduledJob job) {
        SessionDescriptor session = ScheduledJob.SESSION_ISOLATED.equals(job.getSession())
                ? SessionDescriptor.dm(CRON_CHANNEL, job.getId())
                : mainSession;
        TriggerRequest.TriggerRequestBuilder builder = TriggerRequest.builder()
                .source("cron/" + job.getId())
                .session(session)
                .prompt(job.getMessage())
                .model(job.getModel());
        if (job.isDeliver()) {
            builder.deliverChannel(job.getChannel()).deliverTo(job.getTo());
        }
        return builder.build();
    }

    // =========================================================================
    // Timers
    // =========================================================================

    private void arm(ScheduledJob job) {
        disarm(job.getId());
        long now = clock.millis();
        Long next = JobSchedules.computeNextRunAtMs(job, now, clock.getZone());
        if (next == null) {
            job.setNextRunAt(null);
            log.debug("Cron job {} has no upcoming fire time", job.getId());
            return;
        }
        job.setNextRunAt(Instant.ofEpochMilli(next));
        String id = job.getId();
        ScheduledFuture<?> future = scheduler.schedule(() -> fire(id), Math.max(0, next - now),
                TimeUnit.MILLISECONDS);
        scheduledTasks.put(id, future);
        log.debug("Scheduled cron job {} at {}", job.getName(), job.getNextRunAt());
    }

    private void disarm(String id) {
        ScheduledFuture<?> task = scheduledTasks.remove(id);
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * @return a description of what is wrong with the job's schedule, or null if it is valid
     */
    String validateSchedule(ScheduledJob job) {
        ScheduledJob.ScheduleKind kind = job.scheduleKind();
        if (kind == null) {
            return "Job has no schedule";
        }
        if (job.getTimezone() != null && JobSchedules.resolveZone(job.getTimezone(), clock.getZone()) == null) {
            return "Unknown timezone: " + job.getTimezone();
        }
        switch (kind) {
            case CRON:
                try {
                    CronExpression.parse(job.getCron());
                } catch (IllegalArgumentException e) {
                    return e.getMessage();
                }
                return null;
            case EVERY:
                return Durations.parseDurationMs(job.getEvery()) == null
                        ? "Invalid interval: " + job.getEvery()
                        : null;
            case AT:
                return JobSchedules.parseAbsoluteTimeMs(job.getAt()) == null
                        ? "Invalid 'at' time: " + job.getAt()
                        : null;
            default:
                return null;
        }
    }

    // =========================================================================
    // Status / logs
    // =========================================================================

    public List<CronRunLog> getRunLogs(String jobId, int limit) {
        synchronized (runLogs) {
            return runLogs.stream()
                    .filter(l -> jobId == null || jobId.equals(l.getJobId()))
                    .sorted(Comparator.comparing(CronRunLog::getStartedAt).reversed())
                    .limit(Math.max(0, limit))
                    .toList();
        }
    }

    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", running);
        status.put("jobs", jobs.size());
        status.put("enabledJobs", jobs.values().stream().filter(ScheduledJob::isEnabled).count());
        status.put("armedJobs", scheduledTasks.size());
        jobs.values().stream()
                .map(ScheduledJob::getNextRunAt)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .ifPresent(next -> status.put("nextWakeAt", next.toString()));
        status.put("storePath", store.getStorePath().toString());
        return status;
    }

    private void persist() {
        store.save(listJobs());
    }

    static String generateJobId(long nowMs) {
        String rand = Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36), 36);
        return "cron-" + Long.toString(nowMs, 36) + "-" + "0".repeat(4 - rand.length()) + rand;
    }

    private static String rootMessage(Throwable err) {
        Throwable t = err;
        while (t.getCause() != null && t != t.getCause()) {
            t = t.getCause();
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
