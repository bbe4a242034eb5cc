package com.agentrelay.gateway.routing;

import com.agentrelay.gateway.backend.QuestionRequest;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ReplyMatcherTest {

    // =========================================================================
    // Approvals
    // =========================================================================

    @Nested
    class Approval {

        @ParameterizedTest
        @ValueSource(strings = { "yes", "Y", "ok", "approve", "allow", " yes! ", "YES." })
        void approveWords_match(String body) {
            assertTrue(ReplyMatcher.matchApproval(body, "r1").orElseThrow().approved());
        }

        @ParameterizedTest
        @ValueSource(strings = { "no", "N", "deny", "reject", "No!" })
        void denyWords_match(String body) {
            ReplyMatcher.ApprovalReply reply = ReplyMatcher.matchApproval(body, "r1").orElseThrow();
            assertFalse(reply.approved());
            assertNull(reply.reason());
        }

        @Test
        void denyWithReason_keepsReason() {
            ReplyMatcher.ApprovalReply reply = ReplyMatcher.matchApproval("deny too risky right now", "r1")
                    .orElseThrow();
            assertFalse(reply.approved());
            assertEquals("too risky right now", reply.reason());
        }

        @Test
        void buttonData_matchesOwnRequestOnly() {
            assertTrue(ReplyMatcher.matchApproval("approve:r1", "r1").orElseThrow().approved());
            assertFalse(ReplyMatcher.matchApproval("deny:r1", "r1").orElseThrow().approved());
            assertTrue(ReplyMatcher.matchApproval("approve:r2", "r1").isEmpty());
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = { "yes please do it", "maybe", "approve it", "nope" })
        void otherText_doesNotMatch(String body) {
            assertTrue(ReplyMatcher.matchApproval(body, "r1").isEmpty());
        }
    }

    // =========================================================================
    // Questions
    // =========================================================================

    @Nested
    class Question {

        private final List<QuestionRequest.Option> options = List.of(
                new QuestionRequest.Option("Red", null),
                new QuestionRequest.Option("Green", null),
                new QuestionRequest.Option("Blue", null));

        @Test
        void number_isOneBased() {
            assertEquals(OptionalInt.of(0), ReplyMatcher.matchQuestion("1", "q1", options));
            assertEquals(OptionalInt.of(2), ReplyMatcher.matchQuestion(" 3 ", "q1", options));
        }

        @ParameterizedTest
        @ValueSource(strings = { "0", "4", "999" })
        void outOfRangeNumber_doesNotMatch(String body) {
            assertTrue(ReplyMatcher.matchQuestion(body, "q1", options).isEmpty());
        }

        @Test
        void label_isCaseInsensitive() {
            assertEquals(OptionalInt.of(1), ReplyMatcher.matchQuestion("green!", "q1", options));
        }

        @Test
        void buttonData_resolvesIndex() {
            String data = ReplyMatcher.questionData("q1", 2);
            assertEquals("q:q1:3", data);
            assertEquals(OptionalInt.of(2), ReplyMatcher.matchQuestion(data, "q1", options));
            assertTrue(ReplyMatcher.matchQuestion("q:q1:9", "q1", options).isEmpty());
        }

        @Test
        void freeText_doesNotMatch() {
            assertTrue(ReplyMatcher.matchQuestion("I like purple", "q1", options).isEmpty());
            assertTrue(ReplyMatcher.matchQuestion("1", "q1", List.of()).isEmpty());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = { "approve:1a2b3c4d", "DENY:1a2b3c4d", " q:1a2b3c4d:2 " })
    void isButtonData_recognizesAnyRequestId(String body) {
        assertTrue(ReplyMatcher.isButtonData(body));
    }

    @ParameterizedTest
    @ValueSource(strings = { "approve", "deny: not now", "approve:the plan", "q:1a2b3c4d", "yes" })
    void isButtonData_ignoresOrdinaryText(String body) {
        assertFalse(ReplyMatcher.isButtonData(body));
    }
}
