package io.fwaas.orchestrator.domain;

import java.util.List;
import java.util.Objects;

/**
 * Parameters for creating a firewall.
 * <p>
 * {@code routerIds == null} means "not specified" and attaches every router the tenant owns; an
 * empty list creates the firewall without routers.
 */
public record FirewallCreateRequest(String tenantId,
                                    String name,
                                    String description,
                                    Boolean adminStateUp,
                                    boolean shared,
                                    String firewallPolicyId,
                                    List<String> routerIds) {

    public FirewallCreateRequest {
        Objects.requireNonNull(tenantId, "tenantId");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        routerIds = routerIds == null ? null : List.copyOf(routerIds);
    }

    public boolean adminStateUpOrDefault() {
        return adminStateUp == null || adminStateUp;
    }
}
