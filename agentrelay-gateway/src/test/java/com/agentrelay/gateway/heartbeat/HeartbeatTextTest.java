package com.agentrelay.gateway.heartbeat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatTextTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "HEARTBEAT_OK", "  HEARTBEAT_OK  ", "HEARTBEAT_OK HEARTBEAT_OK", "HEARTBEAT_OK all quiet" })
    void stripToken_acknowledgements(String reply) {
        HeartbeatText.Stripped stripped = HeartbeatText.stripToken(reply, 300);

        assertTrue(stripped.ack());
        assertEquals("", stripped.text());
    }

    @Test
    void stripToken_withoutToken_isDelivered() {
        HeartbeatText.Stripped stripped = HeartbeatText.stripToken("  disk is 95% full ", 300);

        assertFalse(stripped.ack());
        assertEquals("disk is 95% full", stripped.text());
    }

    @Test
    void stripToken_longTextAroundToken_isDeliveredWithoutToken() {
        HeartbeatText.Stripped stripped = HeartbeatText.stripToken("HEARTBEAT_OK but the backup failed", 5);

        assertFalse(stripped.ack());
        assertEquals("but the backup failed", stripped.text());
    }

    @Test
    void stripToken_tokenInTheMiddle_isKept() {
        HeartbeatText.Stripped stripped = HeartbeatText.stripToken("one HEARTBEAT_OK two", 0);

        assertFalse(stripped.ack());
        assertEquals("one HEARTBEAT_OK two", stripped.text());
    }

    @Test
    void isContentEffectivelyEmpty_headersAndEmptyItems() {
        assertTrue(HeartbeatText.isContentEffectivelyEmpty(""));
        assertTrue(HeartbeatText.isContentEffectivelyEmpty("# Heartbeat\n\n## Tasks\n- \n* [ ]\n+ [x]\n"));
    }

    @Test
    void isContentEffectivelyEmpty_actionableLine() {
        assertFalse(HeartbeatText.isContentEffectivelyEmpty("# Heartbeat\n- check the build\n"));
        assertFalse(HeartbeatText.isContentEffectivelyEmpty("#hashtag is not a header"));
    }

    @Test
    void isContentEffectivelyEmpty_nullIsNotEmpty() {
        assertFalse(HeartbeatText.isContentEffectivelyEmpty(null));
    }
}
