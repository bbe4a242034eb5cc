package com.agentrelay.app.config;

import com.agentrelay.app.backend.ProcessAutomationBackend;
import com.agentrelay.app.desktop.DesktopChannelAdapter;
import com.agentrelay.common.config.ConfigService;
import com.agentrelay.common.config.RelayConfig;
import com.agentrelay.gateway.backend.AutomationBackend;
import com.agentrelay.gateway.channel.ChannelAdapterRegistry;
import com.agentrelay.gateway.control.ControlMethods;
import com.agentrelay.gateway.control.GatewayContext;
import com.agentrelay.gateway.cron.CronService;
import com.agentrelay.gateway.cron.CronStore;
import com.agentrelay.gateway.heartbeat.HeartbeatRunner;
import com.agentrelay.gateway.routing.ChannelRouter;
import com.agentrelay.gateway.routing.RouterSettings;
import com.agentrelay.gateway.session.SessionDescriptor;
import com.agentrelay.gateway.session.SessionRegistry;
import com.agentrelay.gateway.session.SessionTranscriptStore;
import com.agentrelay.gateway.websocket.EventBroadcaster;
import com.agentrelay.gateway.websocket.GatewayMethodRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the relay. Every gateway collaborator is constructed here
 * explicitly; nothing in the gateway module is a Spring component.
 */
@Configuration
public class RelayBeanConfig {

    @Value("${agentrelay.config.path:~/.agentrelay/config.json}")
    private String configPath;
    @Value("${agentrelay.state.dir:~/.agentrelay}")
    private String stateDir;

    @Bean
    public ConfigService configService() {
        return new ConfigService(ConfigService.expandHome(configPath));
    }

    @Bean
    public RelayConfig relayConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService relayScheduler() {
        return Executors.newScheduledThreadPool(2, daemonThreads("relay-timer-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService backendIoExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("backend-io-"));
    }

    @Bean(destroyMethod = "close")
    public SessionRegistry sessionRegistry(RelayConfig config, ScheduledExecutorService relayScheduler, Clock clock) {
        SessionRegistry registry = new SessionRegistry(
                resolveSessionDir(config).resolve(SessionRegistry.REGISTRY_FILE), relayScheduler, clock);
        registry.loadFromDisk();
        return registry;
    }

    @Bean
    public SessionTranscriptStore sessionTranscriptStore(RelayConfig config, ObjectMapper objectMapper, Clock clock) {
        return new SessionTranscriptStore(resolveSessionDir(config), objectMapper, clock);
    }

    @Bean
    public GatewayMethodRouter gatewayMethodRouter() {
        return new GatewayMethodRouter();
    }

    @Bean
    public EventBroadcaster eventBroadcaster(ObjectMapper objectMapper) {
        return new EventBroadcaster(objectMapper);
    }

    @Bean
    public ChannelAdapterRegistry channelAdapterRegistry(EventBroadcaster eventBroadcaster) {
        ChannelAdapterRegistry registry = new ChannelAdapterRegistry();
        registry.register(new DesktopChannelAdapter(eventBroadcaster));
        return registry;
    }

    @Bean
    public AutomationBackend automationBackend(RelayConfig config, ObjectMapper objectMapper,
            ExecutorService backendIoExecutor) {
        RelayConfig.BackendConfig backend = config.getBackend() != null
                ? config.getBackend()
                : new RelayConfig.BackendConfig();
        return new ProcessAutomationBackend(backend, objectMapper, backendIoExecutor);
    }

    @Bean
    public ChannelRouter channelRouter(RelayConfig config, SessionRegistry sessionRegistry,
            SessionTranscriptStore sessionTranscriptStore, ChannelAdapterRegistry channelAdapterRegistry,
            AutomationBackend automationBackend, ScheduledExecutorService relayScheduler, Clock clock,
            EventBroadcaster eventBroadcaster) {
        return new ChannelRouter(RouterSettings.from(config), sessionRegistry, sessionTranscriptStore,
                channelAdapterRegistry, automationBackend, relayScheduler, clock, eventBroadcaster);
    }

    @Bean(destroyMethod = "close")
    public CronService cronService(RelayConfig config, ScheduledExecutorService relayScheduler,
            ChannelRouter channelRouter, Clock clock) {
        String store = config.getCron() != null ? config.getCron().getStore() : null;
        Path storePath = store != null && !store.isBlank()
                ? ConfigService.expandHome(store)
                : resolveStateDir(config).resolve(CronStore.DEFAULT_FILE_NAME);
        RouterSettings settings = channelRouter.getSettings();
        return new CronService(new CronStore(storePath), relayScheduler, channelRouter,
                SessionDescriptor.dm(settings.getOwnerChannel(), settings.getOwnerConversation()), clock);
    }

    @Bean(destroyMethod = "close")
    public HeartbeatRunner heartbeatRunner(RelayConfig config, ScheduledExecutorService relayScheduler,
            ChannelRouter channelRouter, ChannelAdapterRegistry channelAdapterRegistry,
            EventBroadcaster eventBroadcaster, Clock clock) {
        Path workspace = config.getWorkspace() != null ? ConfigService.expandHome(config.getWorkspace()) : null;
        return new HeartbeatRunner(config.getHeartbeat(), workspace, relayScheduler, channelRouter,
                channelAdapterRegistry, eventBroadcaster, clock);
    }

    @Bean
    public GatewayContext gatewayContext(RelayConfig config, ObjectMapper objectMapper,
            ScheduledExecutorService relayScheduler, Clock clock, SessionRegistry sessionRegistry,
            SessionTranscriptStore sessionTranscriptStore, ChannelAdapterRegistry channelAdapterRegistry,
            ChannelRouter channelRouter, CronService cronService, HeartbeatRunner heartbeatRunner) {
        return GatewayContext.builder()
                .config(config)
                .objectMapper(objectMapper)
                .scheduler(relayScheduler)
                .clock(clock)
                .sessions(sessionRegistry)
                .transcripts(sessionTranscriptStore)
                .channels(channelAdapterRegistry)
                .router(channelRouter)
                .cron(cronService)
                .heartbeat(heartbeatRunner)
                .build();
    }

    @Bean
    public ControlMethods controlMethods(GatewayContext gatewayContext, GatewayMethodRouter gatewayMethodRouter) {
        ControlMethods methods = new ControlMethods(gatewayContext);
        methods.register(gatewayMethodRouter);
        return methods;
    }

    private Path resolveStateDir(RelayConfig config) {
        String dir = config.getStateDir() != null ? config.getStateDir() : stateDir;
        return ConfigService.expandHome(dir);
    }

    private Path resolveSessionDir(RelayConfig config) {
        return config.getSessionDir() != null
                ? ConfigService.expandHome(config.getSessionDir())
                : resolveStateDir(config).resolve("sessions");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
