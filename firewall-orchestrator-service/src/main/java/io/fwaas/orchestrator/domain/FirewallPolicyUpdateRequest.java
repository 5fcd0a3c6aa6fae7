package io.fwaas.orchestrator.domain;

import java.util.List;

/**
 * Partial policy update. A non-null {@code ruleIds} replaces the policy's ordered rule list.
 */
public record FirewallPolicyUpdateRequest(String name,
                                          String description,
                                          Boolean shared,
                                          Boolean audited,
                                          List<String> ruleIds) {

    public FirewallPolicyUpdateRequest {
        ruleIds = ruleIds == null ? null : List.copyOf(ruleIds);
    }

    public static FirewallPolicyUpdateRequest rules(List<String> ruleIds) {
        return new FirewallPolicyUpdateRequest(null, null, null, null, ruleIds);
    }
}
