package com.agentrelay.gateway.control;

import com.agentrelay.common.config.RelayConfig;
import com.agentrelay.gateway.channel.ChannelAdapterRegistry;
import com.agentrelay.gateway.cron.CronRunLog;
import com.agentrelay.gateway.cron.CronService;
import com.agentrelay.gateway.cron.CronStore;
import com.agentrelay.gateway.cron.ScheduledJob;
import com.agentrelay.gateway.heartbeat.HeartbeatRunResult;
import com.agentrelay.gateway.heartbeat.HeartbeatRunner;
import com.agentrelay.gateway.routing.ChannelRouter;
import com.agentrelay.gateway.routing.RouterSettings;
import com.agentrelay.gateway.session.SessionDescriptor;
import com.agentrelay.gateway.session.SessionRegistry;
import com.agentrelay.gateway.session.SessionTranscriptStore;
import com.agentrelay.gateway.testing.FakeBackend;
import com.agentrelay.gateway.testing.ManualScheduler;
import com.agentrelay.gateway.testing.MutableClock;
import com.agentrelay.gateway.testing.RecordingAdapter;
import com.agentrelay.gateway.websocket.GatewayMethodRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class ControlMethodsTest {

    private static final String OWNER_KEY = "desktop:dm:default";

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private MutableClock clock;
    private SessionRegistry sessions;
    private FakeBackend backend;
    private RecordingAdapter telegram;
    private CronService cron;
    private GatewayMethodRouter methods;

    @BeforeEach
    void setUp() {
        clock = MutableClock.utc("2026-01-05T10:00:00Z");
        ManualScheduler scheduler = new ManualScheduler(clock);
        sessions = new SessionRegistry(tempDir.resolve(SessionRegistry.REGISTRY_FILE), scheduler, clock);
        SessionTranscriptStore transcripts = new SessionTranscriptStore(tempDir, mapper, clock);
        ChannelAdapterRegistry channels = new ChannelAdapterRegistry();
        channels.register(new RecordingAdapter("desktop"));
        telegram = new RecordingAdapter("telegram");
        channels.register(telegram);
        backend = new FakeBackend();
        ChannelRouter router = new ChannelRouter(RouterSettings.builder().build(), sessions, transcripts,
                channels, backend, scheduler, clock, (event, payload) -> { });
        cron = new CronService(new CronStore(tempDir.resolve(CronStore.DEFAULT_FILE_NAME)), scheduler, router,
                SessionDescriptor.dm("desktop", "default"), clock);

        RelayConfig.HeartbeatConfig heartbeatConfig = new RelayConfig.HeartbeatConfig();
        heartbeatConfig.setEnabled(false);
        HeartbeatRunner heartbeat = new HeartbeatRunner(heartbeatConfig, tempDir, scheduler, router, channels,
                (event, payload) -> { }, clock);

        GatewayContext ctx = GatewayContext.builder()
                .config(new RelayConfig())
                .objectMapper(mapper)
                .scheduler(scheduler)
                .clock(clock)
                .sessions(sessions)
                .transcripts(transcripts)
                .channels(channels)
                .router(router)
                .cron(cron)
                .heartbeat(heartbeat)
                .build();
        methods = new GatewayMethodRouter();
        new ControlMethods(ctx).register(methods);
    }

    private CompletableFuture<Object> call(String method, String paramsJson) {
        try {
            return methods.dispatch(method, paramsJson == null ? null : mapper.readTree(paramsJson), null);
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> callForMap(String method, String paramsJson) {
        return (Map<String, Object>) call(method, paramsJson).join();
    }

    private static Throwable failureOf(CompletableFuture<Object> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        return e.getCause();
    }

    @Test
    void register_exposesAllMethods() {
        assertTrue(methods.getRegisteredMethods().containsAll(List.of(
                "status", "chat.send", "chat.approve", "chat.answer", "chat.history", "channel.inbound",
                "sessions.list", "sessions.get", "sessions.delete", "sessions.reset",
                "cron.list", "cron.add", "cron.remove", "cron.toggle", "cron.enable", "cron.run", "cron.runs",
                "heartbeat.status", "heartbeat.run")));
    }

    @Test
    void status_reportsCounts() {
        Map<String, Object> status = callForMap("status", null);

        assertEquals(0, status.get("sessions"));
        assertEquals(List.of("desktop", "telegram"), status.get("channels"));
        assertNotNull(status.get("cron"));
        assertNotNull(status.get("heartbeat"));
    }

    // =========================================================================
    // Chat
    // =========================================================================

    @Nested
    class Chat {

        @Test
        void chatSend_startsRunInOwnerSession() {
            Map<String, Object> result = callForMap("chat.send", "{\"text\":\"hello\"}");

            assertEquals("started", result.get("status"));
            assertEquals(OWNER_KEY, result.get("sessionKey"));
            assertEquals(1, backend.runs().size());
        }

        @Test
        void chatSend_whileBusy_isQueued() {
            call("chat.send", "{\"text\":\"first\"}").join();

            Map<String, Object> result = callForMap("chat.send", "{\"text\":\"second\"}");

            assertEquals("queued", result.get("status"));
        }

        @Test
        void chatSend_withoutText_isInvalid() {
            assertInstanceOf(IllegalArgumentException.class, failureOf(call("chat.send", "{}")));
        }

        @Test
        void channelInbound_routesExternalMessage() {
            Map<String, Object> result = callForMap("channel.inbound",
                    "{\"channel\":\"telegram\",\"conversationId\":\"chat1\",\"senderName\":\"Alice\",\"body\":\"hi\"}");

            assertEquals("started", result.get("status"));
            assertEquals("telegram:dm:chat1", result.get("sessionKey"));
            assertTrue(backend.lastRun().request().getPrompt()
                    .startsWith("[Incoming telegram message from Alice in chat chat1]"));
        }

        @Test
        void chatApprove_unknownRequest_isInvalid() {
            Throwable cause = failureOf(call("chat.approve", "{\"requestId\":\"nope\",\"approved\":true}"));

            assertInstanceOf(IllegalArgumentException.class, cause);
            assertTrue(cause.getMessage().contains("nope"));
        }

        @Test
        void chatAnswer_withoutIndex_isInvalid() {
            assertInstanceOf(IllegalArgumentException.class,
                    failureOf(call("chat.answer", "{\"requestId\":\"q1\"}")));
        }

        @Test
        @SuppressWarnings("unchecked")
        void chatHistory_returnsTranscript() {
            call("chat.send", "{\"text\":\"hello\"}").join();
            backend.lastRun().complete("hi back");

            Map<String, Object> history = callForMap("chat.history", "{\"key\":\"" + OWNER_KEY + "\"}");

            List<Object> entries = (List<Object>) history.get("entries");
            assertEquals(2, entries.size());
        }
    }

    // =========================================================================
    // Sessions
    // =========================================================================

    @Nested
    class Sessions {

        @BeforeEach
        void finishedRun() {
            call("chat.send", "{\"text\":\"hello\"}").join();
            backend.lastRun().complete("done");
        }

        @Test
        @SuppressWarnings("unchecked")
        void list_returnsKnownSessions() {
            Map<String, Object> result = callForMap("sessions.list", null);

            assertEquals(1, result.get("count"));
            List<Map<String, Object>> list = (List<Map<String, Object>>) result.get("sessions");
            assertEquals(OWNER_KEY, list.get(0).get("key"));
            assertEquals(false, list.get(0).get("activeRun"));
        }

        @Test
        void get_unknownKey_isInvalid() {
            assertInstanceOf(IllegalArgumentException.class,
                    failureOf(call("sessions.get", "{\"key\":\"desktop:dm:other\"}")));
        }

        @Test
        void get_includesQueueDepth() {
            Map<String, Object> result = callForMap("sessions.get", "{\"key\":\"" + OWNER_KEY + "\"}");

            assertEquals(0, result.get("queued"));
            assertFalse(result.containsKey("pendingApproval"));
        }

        @Test
        void reset_issuesNewSessionId() {
            String before = sessions.get(OWNER_KEY).orElseThrow().getSessionId();
            clock.advance(Duration.ofSeconds(1));

            Map<String, Object> result = callForMap("sessions.reset", "{\"key\":\"" + OWNER_KEY + "\"}");

            assertEquals(before, result.get("previousSessionId"));
            assertNotEquals(before, result.get("sessionId"));
        }

        @Test
        void delete_removesSession() {
            Map<String, Object> result = callForMap("sessions.delete",
                    "{\"key\":\"" + OWNER_KEY + "\",\"deleteTranscript\":true}");

            assertEquals(true, result.get("deleted"));
            assertTrue(sessions.get(OWNER_KEY).isEmpty());
        }
    }

    // =========================================================================
    // Cron
    // =========================================================================

    @Nested
    class Cron {

        private String addJob() {
            ScheduledJob job = (ScheduledJob) call("cron.add",
                    "{\"job\":{\"name\":\"digest\",\"every\":\"1h\",\"message\":\"summarize inbox\"}}").join();
            return job.getId();
        }

        @Test
        void add_thenList() {
            String id = addJob();

            Map<String, Object> list = callForMap("cron.list", null);

            assertTrue(id.startsWith("cron-"));
            assertEquals(1, list.get("count"));
        }

        @Test
        void add_withoutSchedule_isInvalid() {
            assertInstanceOf(IllegalArgumentException.class,
                    failureOf(call("cron.add", "{\"message\":\"no schedule\"}")));
            assertTrue(cron.listJobs().isEmpty());
        }

        @Test
        void toggle_flipsEnabled() {
            String id = addJob();

            ScheduledJob toggled = (ScheduledJob) call("cron.toggle", "{\"id\":\"" + id + "\"}").join();

            assertFalse(toggled.isEnabled());
            assertFalse(cron.isArmed(id));
        }

        @Test
        void remove_twice_secondIsInvalid() {
            String id = addJob();

            assertEquals(true, callForMap("cron.remove", "{\"id\":\"" + id + "\"}").get("removed"));
            assertInstanceOf(IllegalArgumentException.class,
                    failureOf(call("cron.remove", "{\"id\":\"" + id + "\"}")));
        }

        @Test
        void run_firesJobAndRecordsLog() {
            String id = addJob();

            CompletableFuture<Object> run = call("cron.run", "{\"id\":\"" + id + "\"}");
            backend.lastRun().complete("two new mails");

            CronRunLog log = (CronRunLog) run.join();
            assertEquals("completed", log.getStatus());
            assertEquals("manual", log.getTrigger());
            Map<String, Object> runs = callForMap("cron.runs", "{\"id\":\"" + id + "\"}");
            assertEquals(1, ((List<?>) runs.get("runs")).size());
        }

        @Test
        void run_unknownJob_isInvalid() {
            assertInstanceOf(IllegalArgumentException.class,
                    failureOf(call("cron.run", "{\"id\":\"cron-missing\"}")));
        }
    }

    // =========================================================================
    // Heartbeat
    // =========================================================================

    @Test
    void heartbeatRun_disabled_isSkipped() {
        HeartbeatRunResult result = (HeartbeatRunResult) call("heartbeat.run", null).join();

        assertEquals(HeartbeatRunResult.SKIPPED, result.status());
        assertEquals("disabled", result.reason());
    }
}
