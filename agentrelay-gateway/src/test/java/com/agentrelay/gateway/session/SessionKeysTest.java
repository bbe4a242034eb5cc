package com.agentrelay.gateway.session;

import com.agentrelay.gateway.channel.ChatType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SessionKeysTest {

    @Test
    void keyOf_joinsChannelKindAndConversation() {
        assertEquals("telegram:group:-100123", SessionKeys.keyOf("telegram", ChatType.GROUP, "-100123"));
        assertEquals("desktop:dm:default", SessionKeys.keyOf("desktop", null, "default"));
    }

    @Test
    void keyOf_descriptor_matchesExplicitForm() {
        SessionDescriptor d = SessionDescriptor.dm("cron", "cron-abc");
        assertEquals("cron:dm:cron-abc", d.key());
    }

    @ParameterizedTest
    @CsvSource({
            "12345, 12345",
            "user@example, user@example",
            "a-b_c, a-b_c" })
    void sanitize_safeIds_unchanged(String raw, String expected) {
        assertEquals(expected, SessionKeys.sanitize(raw));
    }

    @Test
    void sanitize_unsafeIds_collapseAndKeepDistinct() {
        String slash = SessionKeys.sanitize("a/b");
        String dot = SessionKeys.sanitize("a.b");

        assertTrue(slash.startsWith("a_b-"));
        assertTrue(dot.startsWith("a_b-"));
        assertNotEquals(slash, dot);
        assertFalse(SessionKeys.sanitize("../../etc/passwd").contains("/"));
        assertFalse(SessionKeys.sanitize("../../etc/passwd").contains(".."));
    }

    @Test
    void sanitize_rawIdShapedLikeSafeForm_staysDistinct() {
        String safe = SessionKeys.sanitize("a/b");

        assertNotEquals(safe, SessionKeys.sanitize(safe));
        assertTrue(SessionKeys.sanitize(safe).startsWith(safe + "-"));
        assertEquals("chat-12345678x", SessionKeys.sanitize("chat-12345678x"));
    }

    @Test
    void sanitize_isDeterministic() {
        assertEquals(SessionKeys.sanitize("x/y\\z"), SessionKeys.sanitize("x/y\\z"));
    }

    @Test
    void descriptor_requiresChannelAndConversation() {
        assertThrows(IllegalArgumentException.class, () -> SessionDescriptor.dm("", "x"));
        assertThrows(IllegalArgumentException.class, () -> SessionDescriptor.dm("desktop", null));
        assertEquals(ChatType.DM, new SessionDescriptor("desktop", null, "x").chatType());
    }
}
