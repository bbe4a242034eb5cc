package com.agentrelay.gateway.routing;

/**
 * What {@link ChannelRouter#route} did with an inbound message.
 */
public enum RouteStatus {
    /** A run was started; {@link RouteResult#run()} completes when it is finished. */
    STARTED,
    /** The session is busy; the message will be replayed after the current run. */
    QUEUED,
    /** The session is busy and the message was turned away with a notice. */
    REJECTED,
    /** Same message seen within the dedupe window. */
    DUPLICATE,
    /** A chat command such as /new or /status was answered. */
    COMMAND,
    APPROVAL_RESOLVED,
    QUESTION_ANSWERED,
    /** Button data of an approval or question that is no longer pending. */
    EXPIRED
}
