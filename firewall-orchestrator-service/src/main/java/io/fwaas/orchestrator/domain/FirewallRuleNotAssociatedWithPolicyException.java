package io.fwaas.orchestrator.domain;

public class FirewallRuleNotAssociatedWithPolicyException extends FirewallException {
    public FirewallRuleNotAssociatedWithPolicyException(String ruleId, String policyId) {
        super("Firewall Rule %s is not associated with Firewall Policy %s".formatted(ruleId, policyId));
    }
}
