package io.fwaas.orchestrator.domain;

import java.util.Objects;

public record FirewallRuleCreateRequest(String tenantId,
                                        String name,
                                        String description,
                                        boolean shared,
                                        String protocol,
                                        Integer ipVersion,
                                        String sourceIpAddress,
                                        String destinationIpAddress,
                                        String sourcePort,
                                        String destinationPort,
                                        String action,
                                        Boolean enabled) {

    public FirewallRuleCreateRequest {
        Objects.requireNonNull(tenantId, "tenantId");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
    }

    public static FirewallRuleCreateRequest of(String tenantId, String name, String protocol, String action) {
        return new FirewallRuleCreateRequest(tenantId, name, null, false, protocol, null,
            null, null, null, null, action, null);
    }
}
