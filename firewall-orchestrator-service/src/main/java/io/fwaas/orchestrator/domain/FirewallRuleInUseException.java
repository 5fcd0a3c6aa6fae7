package io.fwaas.orchestrator.domain;

public class FirewallRuleInUseException extends FirewallException {
    private final String ruleId;

    public FirewallRuleInUseException(String ruleId) {
        super("Firewall Rule %s is being used".formatted(ruleId));
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
