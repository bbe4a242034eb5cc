package com.agentrelay.app.config;

import com.agentrelay.common.config.RelayConfig;
import com.agentrelay.gateway.cron.CronService;
import com.agentrelay.gateway.heartbeat.HeartbeatRunner;
import com.agentrelay.gateway.session.SessionRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the schedulers once the application is ready and flushes session state on shutdown.
 */
@Slf4j
@Component
public class RelayBootstrap {

    private final RelayConfig config;
    private final SessionRegistry sessions;
    private final CronService cron;
    private final HeartbeatRunner heartbeat;

    public RelayBootstrap(RelayConfig config, SessionRegistry sessions, CronService cron, HeartbeatRunner heartbeat) {
        this.config = config;
        this.sessions = sessions;
        this.cron = cron;
        this.heartbeat = heartbeat;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (config.getCron() == null || config.getCron().isEnabled()) {
            cron.start();
        } else {
            log.info("Cron disabled by config");
        }
        heartbeat.start();
        log.info("Agent relay ready ({} sessions restored)", sessions.size());
    }

    @PreDestroy
    public void onShutdown() {
        heartbeat.stop();
        cron.stop();
        sessions.flush();
        log.info("Agent relay stopped");
    }
}
