package io.fwaas.orchestrator.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence of firewalls, policies, rules and router associations.
 * <p>
 * Reads return detached copies; changes become visible through the {@code save*} methods.
 * {@link #atomically(Collection, Supplier)} is the unit in which a status check, status write and
 * association write commit together for the named firewalls.
 */
public interface FirewallStore {

    /**
     * Runs {@code work} while holding exclusive access to every listed firewall. A nested call on
     * the same thread may only name firewalls the outer call already holds.
     */
    <T> T atomically(Collection<String> firewallIds, Supplier<T> work);

    /**
     * Runs {@code work} while holding exclusive access to the tenant's firewall set, used when
     * creating firewalls under a per-tenant quota.
     */
    <T> T atomicallyForTenant(String tenantId, Supplier<T> work);

    Firewall saveFirewall(Firewall firewall);

    Optional<Firewall> findFirewall(String firewallId);

    List<Firewall> listFirewalls();

    int countFirewalls(String tenantId);

    /**
     * Removes the firewall and its router associations.
     *
     * @return {@code false} when no such firewall existed
     */
    boolean deleteFirewall(String firewallId);

    List<String> firewallsUsingPolicy(String policyId);

    List<String> routersOf(String firewallId);

    Optional<String> firewallOwningRouter(String routerId);

    /**
     * Replaces the firewall's router set.
     *
     * @throws RoutersInUseException when one of the routers belongs to a different firewall
     */
    void replaceRouters(String firewallId, Collection<String> routerIds);

    FirewallPolicy savePolicy(FirewallPolicy policy);

    Optional<FirewallPolicy> findPolicy(String policyId);

    List<FirewallPolicy> listPolicies();

    boolean deletePolicy(String policyId);

    FirewallRule saveRule(FirewallRule rule);

    Optional<FirewallRule> findRule(String ruleId);

    List<FirewallRule> listRules();

    boolean deleteRule(String ruleId);
}
