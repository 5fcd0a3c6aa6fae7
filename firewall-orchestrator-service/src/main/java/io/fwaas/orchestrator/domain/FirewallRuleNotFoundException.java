package io.fwaas.orchestrator.domain;

public class FirewallRuleNotFoundException extends FirewallException {
    private final String ruleId;

    public FirewallRuleNotFoundException(String ruleId) {
        super("Firewall Rule %s could not be found".formatted(ruleId));
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
