package com.agentrelay.gateway.backend;

/**
 * The user's choice for a {@link QuestionRequest}. {@code index} is zero-based.
 */
public record QuestionAnswer(boolean answered, int index, String label, String reason) {

    public static QuestionAnswer of(int index, String label) {
        return new QuestionAnswer(true, index, label, null);
    }

    public static QuestionAnswer unanswered(String reason) {
        return new QuestionAnswer(false, -1, null, reason);
    }
}
