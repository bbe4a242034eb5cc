package com.agentrelay.gateway.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action the backend wants to perform during a run.
 */
public record ProposedAction(String toolUseId, String toolName, Map<String, Object> input) {

    public ProposedAction {
        input = input != null ? Collections.unmodifiableMap(new LinkedHashMap<>(input)) : Map.of();
    }

    /**
     * String-valued argument, or null.
     */
    public String stringArg(String name) {
        Object value = input.get(name);
        return value instanceof String s ? s : null;
    }
}
