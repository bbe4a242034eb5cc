package com.agentrelay.gateway.channel;

import java.util.Locale;

/**
 * Conversation kind.
 */
public enum ChatType {
    DM, GROUP, CHANNEL;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalize a raw chat type; "direct" is an alias of dm, anything unknown is dm.
     */
    public static ChatType fromKey(String raw) {
        if (raw == null) {
            return DM;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "group", "supergroup" -> GROUP;
            case "channel" -> CHANNEL;
            default -> DM;
        };
    }
}
