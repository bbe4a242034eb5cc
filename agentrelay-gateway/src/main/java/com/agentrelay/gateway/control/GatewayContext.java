package com.agentrelay.gateway.control;

import com.agentrelay.common.config.RelayConfig;
import com.agentrelay.gateway.channel.ChannelAdapterRegistry;
import com.agentrelay.gateway.cron.CronService;
import com.agentrelay.gateway.heartbeat.HeartbeatRunner;
import com.agentrelay.gateway.routing.ChannelRouter;
import com.agentrelay.gateway.session.SessionRegistry;
import com.agentrelay.gateway.session.SessionTranscriptStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * The collaborators of one gateway instance, built once at startup and handed to
 * the control methods.
 */
@Value
@Builder
public class GatewayContext {
    RelayConfig config;
    ObjectMapper objectMapper;
    ScheduledExecutorService scheduler;
    Clock clock;
    SessionRegistry sessions;
    SessionTranscriptStore transcripts;
    ChannelAdapterRegistry channels;
    ChannelRouter router;
    CronService cron;
    HeartbeatRunner heartbeat;
}
