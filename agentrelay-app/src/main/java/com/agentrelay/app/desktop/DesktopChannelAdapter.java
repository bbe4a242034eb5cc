package com.agentrelay.app.desktop;

import com.agentrelay.gateway.channel.ChannelAdapter;
import com.agentrelay.gateway.channel.OutboundResult;
import com.agentrelay.gateway.channel.SendOptions;
import com.agentrelay.gateway.websocket.EventBroadcaster;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * The owner's desktop client. Outbound messages become events on the control WebSocket;
 * the client renders them and answers through {@code chat.send}.
 */
@Slf4j
public class DesktopChannelAdapter implements ChannelAdapter {

    public static final String CHANNEL_ID = "desktop";

    private final EventBroadcaster broadcaster;

    public DesktopChannelAdapter(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public String channelId() {
        return CHANNEL_ID;
    }

    @Override
    public CompletableFuture<OutboundResult> send(String target, String text, SendOptions options) {
        String messageId = UUID.randomUUID().toString();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversationId", target);
        data.put("messageId", messageId);
        data.put("text", text);
        if (options != null && options.getButtons() != null && !options.getButtons().isEmpty()) {
            data.put("buttons", options.getButtons());
        }
        if (options != null && options.getReplyTo() != null) {
            data.put("replyTo", options.getReplyTo());
        }
        if (broadcaster.broadcastToAll("channel.reply", data) == 0) {
            log.debug("No desktop client attached; reply {} to {} is not shown", messageId, target);
        }
        return CompletableFuture.completedFuture(new OutboundResult(messageId, target));
    }

    @Override
    public CompletableFuture<Void> edit(String conversationId, String messageId, String text) {
        broadcaster.broadcastToAll("channel.edit", Map.of(
                "conversationId", conversationId,
                "messageId", messageId,
                "text", text));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> delete(String conversationId, String messageId) {
        broadcaster.broadcastToAll("channel.delete", Map.of(
                "conversationId", conversationId,
                "messageId", messageId));
        return CompletableFuture.completedFuture(null);
    }
}
