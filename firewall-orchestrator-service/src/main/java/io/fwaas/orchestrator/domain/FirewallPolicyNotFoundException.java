package io.fwaas.orchestrator.domain;

public class FirewallPolicyNotFoundException extends FirewallException {
    private final String policyId;

    public FirewallPolicyNotFoundException(String policyId) {
        super("Firewall Policy %s could not be found".formatted(policyId));
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
