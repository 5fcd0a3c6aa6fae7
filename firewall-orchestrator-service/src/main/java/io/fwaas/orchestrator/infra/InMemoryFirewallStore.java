package io.fwaas.orchestrator.infra;

import io.fwaas.orchestrator.domain.Firewall;
import io.fwaas.orchestrator.domain.FirewallPolicy;
import io.fwaas.orchestrator.domain.FirewallRule;
import io.fwaas.orchestrator.domain.FirewallStore;
import io.fwaas.orchestrator.domain.RoutersInUseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process firewall store.
 * <p>
 * Every entity is copied on the way in and out so callers only change state through the save
 * methods. Firewall and tenant ids map onto a fixed pool of lock stripes; a unit takes its stripes
 * in ascending stripe order so multi-firewall units never deadlock.
 */
@Component
public class InMemoryFirewallStore implements FirewallStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFirewallStore.class);
    static final int DEFAULT_LOCK_STRIPES = 64;

    private final Map<String, Firewall> firewalls = new ConcurrentHashMap<>();
    private final Map<String, FirewallPolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, FirewallRule> rules = new ConcurrentHashMap<>();
    private final ReentrantLock[] firewallLocks;
    private final ReentrantLock[] tenantLocks;

    // router associations, guarded by "associations"
    private final Map<String, Set<String>> associations = new HashMap<>();
    private final Map<String, String> routerOwners = new HashMap<>();

    public InMemoryFirewallStore() {
        this(DEFAULT_LOCK_STRIPES);
    }

    InMemoryFirewallStore(int lockStripes) {
        if (lockStripes < 1) {
            throw new IllegalArgumentException("lockStripes must be positive");
        }
        this.firewallLocks = newStripes(lockStripes);
        this.tenantLocks = newStripes(lockStripes);
    }

    @Override
    public <T> T atomically(Collection<String> firewallIds, Supplier<T> work) {
        Objects.requireNonNull(work, "work");
        List<ReentrantLock> held = new ArrayList<>();
        try {
            Set<Integer> stripes = new TreeSet<>();
            for (String id : firewallIds) {
                stripes.add(stripe(Objects.requireNonNull(id, "firewallId"), firewallLocks.length));
            }
            for (int stripe : stripes) {
                ReentrantLock lock = firewallLocks[stripe];
                lock.lock();
                held.add(lock);
            }
            return work.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    @Override
    public <T> T atomicallyForTenant(String tenantId, Supplier<T> work) {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(work, "work");
        ReentrantLock lock = tenantLocks[stripe(tenantId, tenantLocks.length)];
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Firewall saveFirewall(Firewall firewall) {
        Objects.requireNonNull(firewall, "firewall");
        Firewall previous = firewalls.put(firewall.getId(), firewall.copy());
        if (previous == null) {
            log.info("FirewallStore: created firewall id={} tenant={} status={}",
                firewall.getId(), firewall.getTenantId(), firewall.getStatus());
        } else if (previous.getStatus() != firewall.getStatus()) {
            log.info("FirewallStore: status change id={} {} -> {}",
                firewall.getId(), previous.getStatus(), firewall.getStatus());
        }
        return firewall.copy();
    }

    @Override
    public Optional<Firewall> findFirewall(String firewallId) {
        return Optional.ofNullable(firewalls.get(firewallId)).map(Firewall::copy);
    }

    @Override
    public List<Firewall> listFirewalls() {
        return firewalls.values().stream()
            .sorted(Comparator.comparing(Firewall::getId))
            .map(Firewall::copy)
            .toList();
    }

    @Override
    public int countFirewalls(String tenantId) {
        return (int) firewalls.values().stream()
            .filter(fw -> fw.getTenantId().equals(tenantId))
            .count();
    }

    @Override
    public boolean deleteFirewall(String firewallId) {
        synchronized (associations) {
            Set<String> routers = associations.remove(firewallId);
            if (routers != null) {
                routers.forEach(routerOwners::remove);
            }
        }
        Firewall removed = firewalls.remove(firewallId);
        if (removed == null) {
            log.info("FirewallStore: delete called for unknown firewall id={}", firewallId);
            return false;
        }
        log.info("FirewallStore: removed firewall id={} tenant={}", firewallId, removed.getTenantId());
        return true;
    }

    @Override
    public List<String> firewallsUsingPolicy(String policyId) {
        if (policyId == null) {
            return List.of();
        }
        return firewalls.values().stream()
            .filter(fw -> policyId.equals(fw.getFirewallPolicyId()))
            .map(Firewall::getId)
            .sorted()
            .toList();
    }

    @Override
    public List<String> routersOf(String firewallId) {
        synchronized (associations) {
            Set<String> routers = associations.get(firewallId);
            return routers == null ? List.of() : List.copyOf(routers);
        }
    }

    @Override
    public Optional<String> firewallOwningRouter(String routerId) {
        synchronized (associations) {
            return Optional.ofNullable(routerOwners.get(routerId));
        }
    }

    @Override
    public void replaceRouters(String firewallId, Collection<String> routerIds) {
        Objects.requireNonNull(firewallId, "firewallId");
        Set<String> desired = new LinkedHashSet<>(routerIds);
        synchronized (associations) {
            List<String> inUse = desired.stream()
                .filter(router -> {
                    String owner = routerOwners.get(router);
                    return owner != null && !owner.equals(firewallId);
                })
                .toList();
            if (!inUse.isEmpty()) {
                throw new RoutersInUseException(inUse);
            }
            Set<String> previous = associations.remove(firewallId);
            if (previous != null) {
                previous.forEach(routerOwners::remove);
            }
            if (!desired.isEmpty()) {
                associations.put(firewallId, desired);
                desired.forEach(router -> routerOwners.put(router, firewallId));
            }
        }
        log.debug("FirewallStore: routers id={} -> {}", firewallId, desired);
    }

    @Override
    public FirewallPolicy savePolicy(FirewallPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        policies.put(policy.getId(), policy.copy());
        return policy.copy();
    }

    @Override
    public Optional<FirewallPolicy> findPolicy(String policyId) {
        return Optional.ofNullable(policyId).map(policies::get).map(FirewallPolicy::copy);
    }

    @Override
    public List<FirewallPolicy> listPolicies() {
        return policies.values().stream()
            .sorted(Comparator.comparing(FirewallPolicy::getId))
            .map(FirewallPolicy::copy)
            .toList();
    }

    @Override
    public boolean deletePolicy(String policyId) {
        return policies.remove(policyId) != null;
    }

    @Override
    public FirewallRule saveRule(FirewallRule rule) {
        Objects.requireNonNull(rule, "rule");
        rules.put(rule.getId(), rule.copy());
        return rule.copy();
    }

    @Override
    public Optional<FirewallRule> findRule(String ruleId) {
        return Optional.ofNullable(ruleId).map(rules::get).map(FirewallRule::copy);
    }

    @Override
    public List<FirewallRule> listRules() {
        return rules.values().stream()
            .sorted(Comparator.comparing(FirewallRule::getId))
            .map(FirewallRule::copy)
            .toList();
    }

    @Override
    public boolean deleteRule(String ruleId) {
        return rules.remove(ruleId) != null;
    }

    /**
     * Number of locks held by the store; fixed at construction.
     */
    int lockCount() {
        return firewallLocks.length + tenantLocks.length;
    }

    private static int stripe(String id, int stripes) {
        return Math.floorMod(id.hashCode(), stripes);
    }

    private static ReentrantLock[] newStripes(int count) {
        ReentrantLock[] locks = new ReentrantLock[count];
        for (int i = 0; i < count; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }

    /**
     * Association snapshot keyed by firewall id, for diagnostics and tests.
     */
    Map<String, List<String>> associationSnapshot() {
        synchronized (associations) {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            associations.forEach((id, routers) -> copy.put(id, List.copyOf(routers)));
            return copy;
        }
    }
}
