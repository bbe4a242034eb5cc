package com.agentrelay.gateway.routing;

/**
 * Terminal status of one automation run.
 */
public enum RunStatus {
    COMPLETED("completed"),
    ERROR("error"),
    TIMED_OUT("timed-out"),
    /** Not started: the session already had an active run, or the trigger was suppressed. */
    SKIPPED("skipped");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
