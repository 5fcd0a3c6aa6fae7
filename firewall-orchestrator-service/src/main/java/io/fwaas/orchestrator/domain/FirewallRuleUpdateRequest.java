package io.fwaas.orchestrator.domain;

/**
 * Partial rule update; {@code null} leaves a field unchanged.
 */
public record FirewallRuleUpdateRequest(String name,
                                        String description,
                                        Boolean shared,
                                        String protocol,
                                        Integer ipVersion,
                                        String sourceIpAddress,
                                        String destinationIpAddress,
                                        String sourcePort,
                                        String destinationPort,
                                        String action,
                                        Boolean enabled) {

    public static FirewallRuleUpdateRequest changeAction(String action) {
        return new FirewallRuleUpdateRequest(null, null, null, null, null, null, null, null, null, action, null);
    }

    public static FirewallRuleUpdateRequest changeEnabled(boolean enabled) {
        return new FirewallRuleUpdateRequest(null, null, null, null, null, null, null, null, null, null, enabled);
    }
}
