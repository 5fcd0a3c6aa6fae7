package io.fwaas.orchestrator.domain;

import io.fwaas.firewall.model.FirewallStatus;

/**
 * Raised when a firewall, directly or through its policy or rules, is mutated while an earlier
 * mutation still waits for agent acknowledgment. Callers retry later.
 */
public class FirewallInPendingStateException extends FirewallException {
    private final String firewallId;
    private final FirewallStatus pendingState;

    public FirewallInPendingStateException(String firewallId, FirewallStatus pendingState) {
        super("Operation cannot be performed since associated Firewall %s is in %s"
            .formatted(firewallId, pendingState));
        this.firewallId = firewallId;
        this.pendingState = pendingState;
    }

    public String getFirewallId() {
        return firewallId;
    }

    public FirewallStatus getPendingState() {
        return pendingState;
    }
}
