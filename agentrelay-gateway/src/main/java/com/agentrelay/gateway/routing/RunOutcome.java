package com.agentrelay.gateway.routing;

/**
 * Result of one run as seen by its initiator.
 *
 * @param text   final backend text, null unless completed
 * @param detail error message or skip reason
 */
public record RunOutcome(String runId, String sessionKey, RunStatus status, String text, String detail) {

    public static final String REASON_BUSY = "busy";

    public static RunOutcome completed(String runId, String sessionKey, String text) {
        return new RunOutcome(runId, sessionKey, RunStatus.COMPLETED, text, null);
    }

    public static RunOutcome error(String runId, String sessionKey, String message) {
        return new RunOutcome(runId, sessionKey, RunStatus.ERROR, null, message);
    }

    public static RunOutcome timedOut(String runId, String sessionKey) {
        return new RunOutcome(runId, sessionKey, RunStatus.TIMED_OUT, null, "run timed out");
    }

    public static RunOutcome skipped(String sessionKey, String reason) {
        return new RunOutcome(null, sessionKey, RunStatus.SKIPPED, null, reason);
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }
}
