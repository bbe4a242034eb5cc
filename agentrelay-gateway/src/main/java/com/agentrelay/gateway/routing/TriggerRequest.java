package com.agentrelay.gateway.routing;

import com.agentrelay.gateway.session.SessionDescriptor;
import lombok.Builder;
import lombok.Value;

/**
 * A scheduled, synthetic inbound event.
 */
@Value
@Builder
public class TriggerRequest {
    /** Origin shown in logs and events, e.g. "cron/cron-lq2x-ab12" or "heartbeat". */
    String source;
    SessionDescriptor session;
    String prompt;
    String model;
    /** Channel the final text is delivered to; null keeps the result internal. */
    String deliverChannel;
    String deliverTo;

    public boolean hasDelivery() {
        return deliverChannel != null && deliverTo != null;
    }
}
