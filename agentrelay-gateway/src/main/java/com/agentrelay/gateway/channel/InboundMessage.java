package com.agentrelay.gateway.channel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An inbound message normalized from any channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {
    private String id;
    private String channel;
    private String accountId;
    private String conversationId;
    @Builder.Default
    private ChatType chatType = ChatType.DM;
    private String senderId;
    private String senderName;
    private String body;
    private long timestamp;
    private String replyToId;
}
