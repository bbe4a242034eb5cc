package com.agentrelay.gateway.routing;

import java.util.Locale;

/**
 * What happens to a message that arrives while its session has an active run.
 */
public enum BusyPolicy {
    /** Hold it (bounded) and replay it after the run. */
    QUEUE,
    /** Answer with a notice and drop it. */
    REJECT;

    public static BusyPolicy fromKey(String raw) {
        if (raw != null && "reject".equals(raw.trim().toLowerCase(Locale.ROOT))) {
            return REJECT;
        }
        return QUEUE;
    }
}
