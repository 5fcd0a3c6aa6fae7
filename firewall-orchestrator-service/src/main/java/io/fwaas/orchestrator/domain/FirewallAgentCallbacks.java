package io.fwaas.orchestrator.domain;

import io.fwaas.firewall.model.FirewallDocument;
import io.fwaas.firewall.model.FirewallStatus;
import java.util.List;

/**
 * Operations agents invoke on the orchestrator. Calls may arrive late, duplicated or out of order.
 */
public interface FirewallAgentCallbacks {

    /**
     * @return {@code true} when the reported status was stored
     */
    boolean reportStatus(String firewallId, FirewallStatus status);

    /**
     * @return {@code true} when the firewall is gone after the call
     */
    boolean reportDeleted(String firewallId);

    List<FirewallDocument> listFirewalls(String tenantId);

    List<FirewallDocument> listFirewallsWithRules(String tenantId);

    List<String> listTenantsWithFirewalls();
}
