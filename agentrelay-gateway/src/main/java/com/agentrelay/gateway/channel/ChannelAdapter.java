package com.agentrelay.gateway.channel;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound side of one external channel. Futures complete exceptionally on transport errors.
 */
public interface ChannelAdapter {

    /** Channel identifier, e.g. "telegram", "whatsapp", "desktop". */
    String channelId();

    CompletableFuture<OutboundResult> send(String target, String text, SendOptions options);

    CompletableFuture<Void> edit(String conversationId, String messageId, String text);

    CompletableFuture<Void> delete(String conversationId, String messageId);
}
