package com.agentrelay.gateway.session;

import com.agentrelay.gateway.channel.ChatType;
import com.agentrelay.gateway.channel.InboundMessage;

/**
 * The identity triple a session is resolved from.
 */
public record SessionDescriptor(String channel, ChatType chatType, String conversationId) {

    public SessionDescriptor {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel required");
        }
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId required");
        }
        chatType = chatType != null ? chatType : ChatType.DM;
    }

    public static SessionDescriptor of(InboundMessage msg) {
        return new SessionDescriptor(msg.getChannel(), msg.getChatType(), msg.getConversationId());
    }

    public static SessionDescriptor dm(String channel, String conversationId) {
        return new SessionDescriptor(channel, ChatType.DM, conversationId);
    }

    public String key() {
        return SessionKeys.keyOf(this);
    }
}
