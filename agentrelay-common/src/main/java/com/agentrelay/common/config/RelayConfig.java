package com.agentrelay.common.config;

import lombok.Data;

import java.util.List;

/**
 * Root configuration for the relay.
 */
@Data
public class RelayConfig {

    /** Directory for registry, job store and other state files. */
    private String stateDir;

    /** Directory holding the session registry snapshot and transcripts. */
    private String sessionDir;

    /** Working directory handed to the backend; also where HEARTBEAT.md lives. */
    private String workspace;

    /** Permission mode for owner-present runs: default | acceptEdits | bypassPermissions | plan. */
    private String permissionMode = "default";

    private RouterConfig router = new RouterConfig();

    private HeartbeatConfig heartbeat = new HeartbeatConfig();

    private CronConfig cron = new CronConfig();

    private BackendConfig backend = new BackendConfig();

    // --- Nested config types ---

    @Data
    public static class RouterConfig {
        /** Channel whose messages are treated as owner-present. */
        private String ownerChannel = "desktop";
        /** Conversation used for owner notifications and fallback prompts. */
        private String ownerConversation = "default";
        /** queue | reject */
        private String busyPolicy = "queue";
        private int maxQueuedMessages = 20;
        private String runTimeout = "10m";
        private String approvalTimeout = "5m";
        private String questionTimeout = "5m";
        /** Window for suppressing redelivered inbound messages. */
        private String dedupeWindow = "5s";
        /** Idle gap after which a conversation starts a fresh session. */
        private String idleReset = "4h";
        /** Post a "thinking..." message and edit it with the final answer. */
        private boolean statusMessages = true;
    }

    @Data
    public static class HeartbeatConfig {
        private boolean enabled = false;
        private String every = "30m";
        private String prompt;
        /** Channel to deliver heartbeat output to; none when null. */
        private String channel;
        /** Conversation target inside {@link #channel}. */
        private String to;
        private int ackMaxChars = 300;
        private ActiveHoursConfig activeHours;
        private String duplicateWindow = "24h";
    }

    @Data
    public static class ActiveHoursConfig {
        /** HH:mm */
        private String start;
        /** HH:mm, or 24:00 */
        private String end;
        private String timezone;
    }

    @Data
    public static class CronConfig {
        private boolean enabled = true;
        /** Job store file; defaults to {stateDir}/cron-jobs.json. */
        private String store;
    }

    @Data
    public static class BackendConfig {
        /** Executable that speaks the JSON-lines run protocol. */
        private String command;
        private List<String> args;
        private String model;
    }
}
