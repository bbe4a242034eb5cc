package com.agentrelay.gateway.channel;

/**
 * Identity of a message a channel adapter sent.
 */
public record OutboundResult(String id, String conversationId) {
}
