package io.fwaas.firewall.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Firewall representation exchanged with agents.
 * <p>
 * Read queries return the core fields plus {@code router_ids}. Notifications additionally carry
 * the ordered {@code firewall_rule_list} and the router diff ({@code add-router-ids},
 * {@code del-router-ids}, optional {@code last-router}). Absent optional parts are omitted from the
 * JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FirewallDocument(
    @JsonProperty("id") String id,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("admin_state_up") boolean adminStateUp,
    @JsonProperty("shared") boolean shared,
    @JsonProperty("firewall_policy_id") String firewallPolicyId,
    @JsonProperty("status") FirewallStatus status,
    @JsonProperty("router_ids") List<String> routerIds,
    @JsonProperty("firewall_rule_list") List<FirewallRuleDocument> firewallRuleList,
    @JsonProperty("add-router-ids") List<String> addRouterIds,
    @JsonProperty("del-router-ids") List<String> delRouterIds,
    @JsonProperty("last-router") Boolean lastRouter) {

    public FirewallDocument {
        routerIds = routerIds == null ? List.of() : List.copyOf(routerIds);
        firewallRuleList = firewallRuleList == null ? null : List.copyOf(firewallRuleList);
        addRouterIds = addRouterIds == null ? null : List.copyOf(addRouterIds);
        delRouterIds = delRouterIds == null ? null : List.copyOf(delRouterIds);
    }

    public FirewallDocument withRules(List<FirewallRuleDocument> rules) {
        return new FirewallDocument(id, tenantId, name, description, adminStateUp, shared, firewallPolicyId,
            status, routerIds, rules == null ? List.of() : rules, addRouterIds, delRouterIds, lastRouter);
    }

    public FirewallDocument withRouterChanges(List<String> add, List<String> del, Boolean last) {
        return new FirewallDocument(id, tenantId, name, description, adminStateUp, shared, firewallPolicyId,
            status, routerIds, firewallRuleList, add == null ? List.of() : add, del == null ? List.of() : del, last);
    }
}
