package io.fwaas.firewall.model;

import java.util.Locale;

/**
 * Lifecycle status of a firewall as stored by the orchestrator and reported by agents.
 */
public enum FirewallStatus {
    INACTIVE,
    ACTIVE,
    DOWN,
    PENDING_CREATE,
    PENDING_UPDATE,
    PENDING_DELETE,
    ERROR;

    public boolean isPending() {
        return this == PENDING_CREATE || this == PENDING_UPDATE || this == PENDING_DELETE;
    }

    /**
     * Maps a status string received from an agent. Anything that is not a known status name
     * becomes {@link #ERROR}.
     */
    public static FirewallStatus fromReported(String value) {
        if (value == null || value.isBlank()) {
            return ERROR;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ERROR;
        }
    }
}
