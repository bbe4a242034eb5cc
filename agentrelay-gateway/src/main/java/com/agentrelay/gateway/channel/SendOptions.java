package com.agentrelay.gateway.channel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Options for an outbound send.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendOptions {
    private String replyTo;
    private boolean silent;
    /** Inline choices; adapters without buttons render the text only. */
    private List<Button> buttons;

    public static SendOptions none() {
        return new SendOptions();
    }

    public static SendOptions withButtons(List<Button> buttons) {
        return SendOptions.builder().buttons(buttons).build();
    }

    /**
     * A reply button; {@code data} comes back as the body of the inbound reply.
     */
    public record Button(String label, String data) {
    }
}
