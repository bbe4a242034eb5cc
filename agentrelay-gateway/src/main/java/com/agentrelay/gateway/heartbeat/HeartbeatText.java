package com.agentrelay.gateway.heartbeat;

import java.util.regex.Pattern;

/**
 * Text rules for heartbeat prompts and replies.
 */
public final class HeartbeatText {

    private HeartbeatText() {
    }

    /** Sentinel a heartbeat reply uses to say nothing needs attention. */
    public static final String TOKEN = "HEARTBEAT_OK";

    public static final String FILE_NAME = "HEARTBEAT.md";

    public static final String DEFAULT_PROMPT = "Read HEARTBEAT.md if it exists (workspace context). "
            + "Follow it strictly. Do not infer or repeat old tasks from prior chats. "
            + "If nothing needs attention, reply HEARTBEAT_OK.";

    private static final Pattern MARKDOWN_HEADER = Pattern.compile("^#+(\\s|$)");
    private static final Pattern EMPTY_LIST_ITEM = Pattern.compile("^[-*+]\\s*(\\[[\\sXx]?\\]\\s*)?$");

    /**
     * Reply text after removing the sentinel from its edges.
     *
     * @param ack true when the reply only acknowledges and must not be delivered
     */
    public record Stripped(boolean ack, String text) {
    }

    /**
     * Strip {@link #TOKEN} from both edges. A reply that carried the token and is at most
     * {@code ackMaxChars} long afterwards counts as an acknowledgement.
     */
    public static Stripped stripToken(String text, int ackMaxChars) {
        if (text == null || text.isBlank()) {
            return new Stripped(true, "");
        }
        String result = text.trim();
        if (!result.contains(TOKEN)) {
            return new Stripped(false, result);
        }
        while (result.startsWith(TOKEN)) {
            result = result.substring(TOKEN.length()).trim();
        }
        while (result.endsWith(TOKEN)) {
            result = result.substring(0, result.length() - TOKEN.length()).trim();
        }
        if (result.isEmpty() || result.length() <= ackMaxChars) {
            return new Stripped(true, "");
        }
        return new Stripped(false, result);
    }

    /**
     * True when a HEARTBEAT.md has no actionable line: only blank lines, headers and empty
     * list items. Null content is not "empty"; a missing file does not suppress runs.
     */
    public static boolean isContentEffectivelyEmpty(String content) {
        if (content == null) {
            return false;
        }
        for (String line : content.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (MARKDOWN_HEADER.matcher(trimmed).find()) {
                continue;
            }
            if (EMPTY_LIST_ITEM.matcher(trimmed).matches()) {
                continue;
            }
            return false;
        }
        return true;
    }
}
