package com.agentrelay.gateway.backend;

import java.util.Locale;

/**
 * Action-permission mode handed to the backend for a run.
 * {@link #DEFAULT} is the restricted mode in which risky actions go through approval.
 */
public enum PermissionMode {
    DEFAULT("default"),
    ACCEPT_EDITS("acceptEdits"),
    BYPASS_PERMISSIONS("bypassPermissions"),
    PLAN("plan");

    private final String key;

    PermissionMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isRestricted() {
        return this == DEFAULT || this == PLAN;
    }

    /**
     * Resolve a configured mode; unknown or missing values map to {@link #DEFAULT}.
     */
    public static PermissionMode fromKey(String raw) {
        if (raw == null) {
            return DEFAULT;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (PermissionMode mode : values()) {
            if (mode.key.toLowerCase(Locale.ROOT).equals(value)) {
                return mode;
            }
        }
        return DEFAULT;
    }
}
