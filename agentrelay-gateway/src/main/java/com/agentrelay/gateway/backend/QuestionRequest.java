package com.agentrelay.gateway.backend;

import java.util.List;

/**
 * A multiple-choice question the backend asks the user mid-run.
 */
public record QuestionRequest(String question, List<Option> options) {

    public QuestionRequest {
        options = options != null ? List.copyOf(options) : List.of();
    }

    public record Option(String label, String description) {
    }
}
