package io.fwaas.orchestrator.app;

import io.fwaas.firewall.model.FirewallDocument;
import io.fwaas.orchestrator.domain.Firewall;
import io.fwaas.orchestrator.domain.FirewallStore;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Builds the firewall documents shared with agents and callers.
 */
@Component
public class FirewallDocuments {

    private final FirewallStore store;
    private final FirewallPolicyCatalog catalog;

    public FirewallDocuments(FirewallStore store, FirewallPolicyCatalog catalog) {
        this.store = Objects.requireNonNull(store, "store");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Firewall fields plus the routers currently attached.
     */
    public FirewallDocument describe(Firewall firewall) {
        return describe(firewall, store.routersOf(firewall.getId()));
    }

    public FirewallDocument describe(Firewall firewall, List<String> routerIds) {
        return new FirewallDocument(firewall.getId(), firewall.getTenantId(), firewall.getName(),
            firewall.getDescription(), firewall.isAdminStateUp(), firewall.isShared(),
            firewall.getFirewallPolicyId(), firewall.getStatus(), routerIds, null, null, null, null);
    }

    /**
     * {@link #describe(Firewall, List)} plus the policy's ordered rule list.
     */
    public FirewallDocument withRules(Firewall firewall, List<String> routerIds) {
        return describe(firewall, routerIds).withRules(catalog.ruleDocuments(firewall.getFirewallPolicyId()));
    }

    public FirewallDocument withRules(Firewall firewall) {
        return withRules(firewall, store.routersOf(firewall.getId()));
    }
}
