package io.fwaas.orchestrator.domain;

public class FirewallNotFoundException extends FirewallException {
    private final String firewallId;

    public FirewallNotFoundException(String firewallId) {
        super("Firewall %s could not be found".formatted(firewallId));
        this.firewallId = firewallId;
    }

    public String getFirewallId() {
        return firewallId;
    }
}
