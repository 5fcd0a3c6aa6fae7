package io.fwaas.orchestrator.domain;

import java.util.List;
import java.util.Objects;

public record FirewallPolicyCreateRequest(String tenantId,
                                          String name,
                                          String description,
                                          boolean shared,
                                          boolean audited,
                                          List<String> ruleIds) {

    public FirewallPolicyCreateRequest {
        Objects.requireNonNull(tenantId, "tenantId");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        ruleIds = ruleIds == null ? List.of() : List.copyOf(ruleIds);
    }
}
