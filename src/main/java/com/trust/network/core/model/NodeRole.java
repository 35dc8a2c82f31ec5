package com.trust.network.core.model;

/**
 * Role of a node after both selectors have finished.
 */
public enum NodeRole {
    SENTINEL,
    MAINTENANCE,
    SENTINEL_MAINTENANCE,
    NONE;

    public static NodeRole of(boolean sentinel, boolean maintenance) {
        if (sentinel && maintenance) {
            return SENTINEL_MAINTENANCE;
        }
        if (sentinel) {
            return SENTINEL;
        }
        return maintenance ? MAINTENANCE : NONE;
    }

    public boolean isSentinel() {
        return this == SENTINEL || this == SENTINEL_MAINTENANCE;
    }

    public boolean isMaintenance() {
        return this == MAINTENANCE || this == SENTINEL_MAINTENANCE;
    }
}
