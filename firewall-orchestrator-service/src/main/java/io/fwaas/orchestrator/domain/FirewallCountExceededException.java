package io.fwaas.orchestrator.domain;

public class FirewallCountExceededException extends FirewallException {
    private final String tenantId;

    public FirewallCountExceededException(String tenantId, int limit) {
        super("Exceeded allowed count of firewalls for tenant %s. Only %d firewall(s) supported per tenant."
            .formatted(tenantId, limit));
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
