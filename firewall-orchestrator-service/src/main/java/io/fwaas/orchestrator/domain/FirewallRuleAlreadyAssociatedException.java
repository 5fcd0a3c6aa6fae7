package io.fwaas.orchestrator.domain;

public class FirewallRuleAlreadyAssociatedException extends FirewallException {
    public FirewallRuleAlreadyAssociatedException(String ruleId, String policyId) {
        super("Firewall Rule %s is already associated with Firewall Policy %s".formatted(ruleId, policyId));
    }
}
