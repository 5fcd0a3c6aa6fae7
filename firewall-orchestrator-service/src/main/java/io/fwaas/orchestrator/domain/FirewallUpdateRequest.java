package io.fwaas.orchestrator.domain;

import java.util.List;

/**
 * Partial firewall update; {@code null} leaves a field unchanged. An explicit empty
 * {@code routerIds} detaches every router.
 */
public record FirewallUpdateRequest(String name,
                                    String description,
                                    Boolean adminStateUp,
                                    Boolean shared,
                                    String firewallPolicyId,
                                    List<String> routerIds) {

    public FirewallUpdateRequest {
        routerIds = routerIds == null ? null : List.copyOf(routerIds);
    }

    public static FirewallUpdateRequest routers(List<String> routerIds) {
        return new FirewallUpdateRequest(null, null, null, null, null, routerIds);
    }
}
