package io.fwaas.orchestrator.app;

import io.fwaas.firewall.model.FirewallDocument;
import io.fwaas.firewall.model.FirewallStatus;
import io.fwaas.orchestrator.config.OrchestratorProperties;
import io.fwaas.orchestrator.domain.Firewall;
import io.fwaas.orchestrator.domain.FirewallAgentNotifier;
import io.fwaas.orchestrator.domain.FirewallCountExceededException;
import io.fwaas.orchestrator.domain.FirewallCreateRequest;
import io.fwaas.orchestrator.domain.FirewallLifecycle;
import io.fwaas.orchestrator.domain.FirewallNotFoundException;
import io.fwaas.orchestrator.domain.FirewallPolicy;
import io.fwaas.orchestrator.domain.FirewallPolicyUpdateRequest;
import io.fwaas.orchestrator.domain.FirewallRule;
import io.fwaas.orchestrator.domain.FirewallRuleUpdateRequest;
import io.fwaas.orchestrator.domain.FirewallStore;
import io.fwaas.orchestrator.domain.FirewallUpdateRequest;
import io.fwaas.orchestrator.domain.RouterDiff;
import io.fwaas.orchestrator.domain.RoutersInUseException;
import io.fwaas.orchestrator.domain.RuleInsertion;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for firewall mutations.
 * <p>
 * Every mutation validates against the lifecycle, computes router changes, persists, and then
 * announces the result to agents, all inside the affected firewalls' atomic unit. Agents answer
 * later through {@link FirewallAcknowledgmentHandler}.
 */
@Service
public class FirewallOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FirewallOrchestrator.class);

    private final FirewallStore store;
    private final AttachmentResolver resolver;
    private final FirewallAgentNotifier notifier;
    private final FirewallPolicyCatalog catalog;
    private final FirewallDocuments documents;
    private final int maxFirewallsPerTenant;

    public FirewallOrchestrator(FirewallStore store,
                                AttachmentResolver resolver,
                                FirewallAgentNotifier notifier,
                                FirewallPolicyCatalog catalog,
                                FirewallDocuments documents,
                                OrchestratorProperties properties) {
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.maxFirewallsPerTenant = properties.getMaxFirewallsPerTenant();
    }

    public FirewallDocument createFirewall(FirewallCreateRequest request) {
        Objects.requireNonNull(request, "request");
        String tenantId = request.tenantId();
        return store.atomicallyForTenant(tenantId, () -> {
            if (maxFirewallsPerTenant > 0 && store.countFirewalls(tenantId) >= maxFirewallsPerTenant) {
                throw new FirewallCountExceededException(tenantId, maxFirewallsPerTenant);
            }
            catalog.whilePolicyExists(request.firewallPolicyId(), () -> null);
            List<String> routers = resolver.resolveForCreate(tenantId, request.routerIds());
            Firewall firewall = new Firewall(UUID.randomUUID().toString(), tenantId, request.name(),
                request.description(), request.adminStateUpOrDefault(), request.shared(),
                request.firewallPolicyId(), FirewallLifecycle.initialStatus(routers));
            return store.atomically(List.of(firewall.getId()), () -> {
                Firewall saved = catalog.whilePolicyExists(firewall.getFirewallPolicyId(),
                    () -> store.saveFirewall(firewall));
                try {
                    store.replaceRouters(saved.getId(), routers);
                } catch (RoutersInUseException e) {
                    store.deleteFirewall(saved.getId());
                    throw e;
                }
                if (saved.getStatus() == FirewallStatus.PENDING_CREATE) {
                    FirewallDocument payload = documents.withRules(saved, routers)
                        .withRouterChanges(routers, List.of(), null);
                    log.info("firewall {} created for tenant {} on routers {}", saved.getId(), tenantId, routers);
                    notifier.notifyCreate(payload);
                } else {
                    log.info("firewall {} created for tenant {} without routers", saved.getId(), tenantId);
                }
                return documents.describe(saved, routers);
            });
        });
    }

    public FirewallDocument updateFirewall(String firewallId, FirewallUpdateRequest request) {
        Objects.requireNonNull(request, "request");
        return store.atomically(List.of(firewallId), () -> {
            Firewall firewall = requireFirewall(firewallId);
            FirewallLifecycle.ensureMutable(firewall);
            String policyId = request.firewallPolicyId() != null
                ? request.firewallPolicyId()
                : firewall.getFirewallPolicyId();
            catalog.whilePolicyExists(policyId, () -> null);

            List<String> current = store.routersOf(firewallId);
            List<String> desired = current;
            if (request.routerIds() != null) {
                desired = resolver.resolveForUpdate(firewallId, request.routerIds());
                store.replaceRouters(firewallId, desired);
            }

            if (request.name() != null) {
                firewall.setName(request.name());
            }
            if (request.description() != null) {
                firewall.setDescription(request.description());
            }
            if (request.adminStateUp() != null) {
                firewall.setAdminStateUp(request.adminStateUp());
            }
            if (request.shared() != null) {
                firewall.setShared(request.shared());
            }
            firewall.setFirewallPolicyId(policyId);
            firewall.transitionTo(FirewallLifecycle.statusForUpdate(current, desired));

            Firewall saved;
            try {
                saved = catalog.whilePolicyExists(policyId, () -> store.saveFirewall(firewall));
            } catch (RuntimeException e) {
                store.replaceRouters(firewallId, current);
                throw e;
            }
            if (saved.getStatus() == FirewallStatus.PENDING_UPDATE) {
                RouterDiff diff = resolver.diff(current, desired);
                FirewallDocument payload = documents.withRules(saved, desired)
                    .withRouterChanges(diff.added(), diff.removed(), desired.isEmpty());
                log.info("firewall {} updated add={} del={} last-router={}",
                    firewallId, diff.added(), diff.removed(), desired.isEmpty());
                notifier.notifyUpdate(payload);
            } else {
                log.info("firewall {} updated without routers", firewallId);
            }
            return documents.describe(saved, desired);
        });
    }

    public void deleteFirewall(String firewallId) {
        store.atomically(List.of(firewallId), () -> {
            Firewall firewall = requireFirewall(firewallId);
            firewall.transitionTo(FirewallStatus.PENDING_DELETE);
            Firewall saved = store.saveFirewall(firewall);
            List<String> routers = store.routersOf(firewallId);
            if (routers.isEmpty()) {
                store.deleteFirewall(firewallId);
                log.info("firewall {} deleted, no routers attached", firewallId);
                return null;
            }
            FirewallDocument payload = documents.withRules(saved, routers)
                .withRouterChanges(List.of(), routers, null);
            log.info("firewall {} pending delete on routers {}", firewallId, routers);
            notifier.notifyDelete(payload);
            return null;
        });
    }

    public FirewallDocument getFirewall(String firewallId) {
        return documents.describe(requireFirewall(firewallId));
    }

    /**
     * The firewall as agents see it, including the ordered rules of its policy.
     */
    public FirewallDocument getFirewallWithRules(String firewallId) {
        return documents.withRules(requireFirewall(firewallId));
    }

    public List<FirewallDocument> listFirewalls() {
        return listFirewalls(null);
    }

    /**
     * @param tenantId {@code null} for every tenant
     */
    public List<FirewallDocument> listFirewalls(String tenantId) {
        return store.listFirewalls().stream()
            .filter(firewall -> tenantId == null || tenantId.equals(firewall.getTenantId()))
            .map(documents::describe)
            .toList();
    }

    public FirewallPolicy updateFirewallPolicy(String policyId, FirewallPolicyUpdateRequest request) {
        Objects.requireNonNull(request, "request");
        catalog.getFirewallPolicy(policyId);
        return editAndFanOut(policyId, () -> catalog.applyPolicyUpdate(policyId, request));
    }

    /**
     * Updates a rule and, when it belongs to a policy, every firewall enforcing that policy.
     */
    public FirewallRule updateFirewallRule(String ruleId, FirewallRuleUpdateRequest request) {
        Objects.requireNonNull(request, "request");
        FirewallRule rule = catalog.getFirewallRule(ruleId);
        if (rule.getFirewallPolicyId() == null) {
            return catalog.applyRuleUpdate(ruleId, request);
        }
        return editAndFanOut(rule.getFirewallPolicyId(), () -> catalog.applyRuleUpdate(ruleId, request));
    }

    public FirewallPolicy insertRule(String policyId, RuleInsertion insertion) {
        Objects.requireNonNull(insertion, "insertion");
        catalog.getFirewallPolicy(policyId);
        return editAndFanOut(policyId, () -> catalog.applyInsertRule(policyId, insertion));
    }

    public FirewallPolicy removeRule(String policyId, String ruleId) {
        catalog.getFirewallPolicy(policyId);
        return editAndFanOut(policyId, () -> catalog.applyRemoveRule(policyId, ruleId));
    }

    /**
     * Locks every firewall using the policy, rejects the edit when any of them is pending, applies
     * it and re-announces each firewall that has routers. Retries when a firewall starts using the
     * policy between listing and locking.
     */
    private <T> T editAndFanOut(String policyId, Supplier<T> edit) {
        while (true) {
            List<String> candidates = store.firewallsUsingPolicy(policyId);
            Optional<T> result = store.atomically(candidates, () -> {
                List<String> using = store.firewallsUsingPolicy(policyId);
                if (!new HashSet<>(candidates).containsAll(using)) {
                    return Optional.empty();
                }
                List<Firewall> firewalls = using.stream()
                    .map(store::findFirewall)
                    .flatMap(Optional::stream)
                    .toList();
                firewalls.forEach(FirewallLifecycle::ensureMutable);
                T value = edit.get();
                for (Firewall firewall : firewalls) {
                    List<String> routers = store.routersOf(firewall.getId());
                    if (routers.isEmpty()) {
                        continue;
                    }
                    firewall.transitionTo(FirewallStatus.PENDING_UPDATE);
                    Firewall saved = store.saveFirewall(firewall);
                    notifier.notifyUpdate(documents.withRules(saved, routers)
                        .withRouterChanges(List.of(), List.of(), null));
                }
                log.info("policy {} changed, re-announced {} firewall(s)", policyId, firewalls.size());
                return Optional.of(value);
            });
            if (result.isPresent()) {
                return result.get();
            }
            log.debug("policy {} gained a firewall while locking, retrying", policyId);
        }
    }

    private Firewall requireFirewall(String firewallId) {
        return store.findFirewall(firewallId).orElseThrow(() -> new FirewallNotFoundException(firewallId));
    }
}
