package com.agentrelay.gateway.backend;

import lombok.Builder;
import lombok.Value;

/**
 * One automation run as handed to the backend.
 */
@Value
@Builder
public class RunRequest {
    String runId;
    String prompt;
    /** Internal session id, used by backends that keep their own log. */
    String sessionId;
    /** Backend continuation id from an earlier run; null on the first run. */
    String continuationId;
    PermissionMode permissionMode;
    String channel;
    /** Human-readable origin, e.g. "telegram/12345" or "cron/cron-abc". */
    String source;
    String workspace;
    /** Model override for this run; null uses the backend default. */
    String model;
}
