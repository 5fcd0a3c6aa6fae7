package io.fwaas.orchestrator.domain;

public class FirewallPolicyInUseException extends FirewallException {
    private final String policyId;

    public FirewallPolicyInUseException(String policyId) {
        super("Firewall Policy %s is being used".formatted(policyId));
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
