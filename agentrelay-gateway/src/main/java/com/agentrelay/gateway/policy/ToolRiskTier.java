package com.agentrelay.gateway.policy;

/**
 * Risk tier of a proposed action.
 */
public enum ToolRiskTier {
    /** Proceeds silently. */
    AUTO_ALLOW("auto-allow"),
    /** Proceeds, and the owner is told about it. */
    NOTIFY("notify"),
    /** Held until a human approves it. */
    REQUIRE_APPROVAL("require-approval");

    private final String wireName;

    ToolRiskTier(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
