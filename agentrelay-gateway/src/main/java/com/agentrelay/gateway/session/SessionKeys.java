package com.agentrelay.gateway.session;

import com.agentrelay.gateway.channel.ChatType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Session key derivation.
 *
 * <p>
 * A key has the form {@code channel:kind:conversation}. Conversation ids are made safe for
 * file naming by collapsing runs of {@code / \ .} into {@code _}; when that changed the id,
 * a short digest of the raw id is appended so that "a/b" and "a.b" stay distinct. A raw id
 * that already ends like a digest suffix gets one too, so it never equals the safe form of
 * another id.
 * </p>
 */
public final class SessionKeys {

    private SessionKeys() {
    }

    private static final Pattern UNSAFE_RUN = Pattern.compile("[/\\\\.]+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");
    private static final int DIGEST_CHARS = 8;
    private static final Pattern DIGEST_SUFFIX = Pattern.compile("-[0-9a-f]{" + DIGEST_CHARS + "}$");

    public static String keyOf(String channel, ChatType chatType, String conversationId) {
        ChatType kind = chatType != null ? chatType : ChatType.DM;
        return channel + ":" + kind.key() + ":" + sanitize(conversationId);
    }

    public static String keyOf(SessionDescriptor descriptor) {
        return keyOf(descriptor.channel(), descriptor.chatType(), descriptor.conversationId());
    }

    /**
     * File-safe form of a conversation id. Deterministic.
     */
    public static String sanitize(String conversationId) {
        String raw = conversationId != null ? conversationId : "";
        String collapsed = EDGE_UNDERSCORES.matcher(UNSAFE_RUN.matcher(raw).replaceAll("_")).replaceAll("");
        if (collapsed.equals(raw) && !DIGEST_SUFFIX.matcher(raw).find()) {
            return raw;
        }
        return collapsed + "-" + shortDigest(raw);
    }

    private static String shortDigest(String raw) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(raw.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, DIGEST_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
