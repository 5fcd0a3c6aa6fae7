package io.fwaas.orchestrator.app;

import io.fwaas.firewall.model.FirewallRuleDocument;
import io.fwaas.orchestrator.domain.FirewallPolicy;
import io.fwaas.orchestrator.domain.FirewallPolicyCreateRequest;
import io.fwaas.orchestrator.domain.FirewallPolicyInUseException;
import io.fwaas.orchestrator.domain.FirewallPolicyNotFoundException;
import io.fwaas.orchestrator.domain.FirewallPolicyUpdateRequest;
import io.fwaas.orchestrator.domain.FirewallRule;
import io.fwaas.orchestrator.domain.FirewallRuleAlreadyAssociatedException;
import io.fwaas.orchestrator.domain.FirewallRuleCreateRequest;
import io.fwaas.orchestrator.domain.FirewallRuleInUseException;
import io.fwaas.orchestrator.domain.FirewallRuleNotAssociatedWithPolicyException;
import io.fwaas.orchestrator.domain.FirewallRuleNotFoundException;
import io.fwaas.orchestrator.domain.FirewallRuleUpdateRequest;
import io.fwaas.orchestrator.domain.FirewallStore;
import io.fwaas.orchestrator.domain.RuleInsertion;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Firewall policies and rules.
 * <p>
 * Creation, reads and deletion are served directly. Edits that change what a firewall enforces
 * ({@link #applyPolicyUpdate}, {@link #applyRuleUpdate}, {@link #applyInsertRule},
 * {@link #applyRemoveRule}) are only called by {@link FirewallOrchestrator}, which holds the
 * referencing firewalls' locks and announces the result to agents.
 * <p>
 * Writes are serialized on the catalog's monitor. The monitor is always the innermost lock.
 */
@Component
public class FirewallPolicyCatalog {

    private static final Logger log = LoggerFactory.getLogger(FirewallPolicyCatalog.class);

    private final FirewallStore store;

    public FirewallPolicyCatalog(FirewallStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public synchronized FirewallPolicy createFirewallPolicy(FirewallPolicyCreateRequest request) {
        Objects.requireNonNull(request, "request");
        FirewallPolicy policy = new FirewallPolicy(UUID.randomUUID().toString(), request.tenantId(),
            request.name(), request.description(), request.shared(), request.audited(), List.of());
        if (!request.ruleIds().isEmpty()) {
            setRules(policy, request.ruleIds());
        }
        FirewallPolicy saved = store.savePolicy(policy);
        log.info("created firewall policy id={} tenant={} rules={}", saved.getId(), saved.getTenantId(),
            saved.getRuleIds());
        return saved;
    }

    public FirewallPolicy getFirewallPolicy(String policyId) {
        return store.findPolicy(policyId).orElseThrow(() -> new FirewallPolicyNotFoundException(policyId));
    }

    /**
     * @param tenantId {@code null} for every tenant
     */
    public List<FirewallPolicy> listFirewallPolicies(String tenantId) {
        return store.listPolicies().stream()
            .filter(policy -> tenantId == null || tenantId.equals(policy.getTenantId()))
            .toList();
    }

    public synchronized void deleteFirewallPolicy(String policyId) {
        FirewallPolicy policy = getFirewallPolicy(policyId);
        if (!store.firewallsUsingPolicy(policyId).isEmpty()) {
            throw new FirewallPolicyInUseException(policyId);
        }
        for (String ruleId : policy.getRuleIds()) {
            store.findRule(ruleId).ifPresent(rule -> {
                rule.dissociate();
                store.saveRule(rule);
            });
        }
        store.deletePolicy(policyId);
        log.info("deleted firewall policy id={}", policyId);
    }

    public synchronized FirewallRule createFirewallRule(FirewallRuleCreateRequest request) {
        Objects.requireNonNull(request, "request");
        FirewallRule rule = new FirewallRule(UUID.randomUUID().toString(), request.tenantId());
        rule.setName(request.name());
        rule.setDescription(request.description());
        rule.setShared(request.shared());
        rule.setProtocol(request.protocol());
        if (request.ipVersion() != null) {
            rule.setIpVersion(request.ipVersion());
        }
        rule.setSourceIpAddress(request.sourceIpAddress());
        rule.setDestinationIpAddress(request.destinationIpAddress());
        rule.setSourcePort(request.sourcePort());
        rule.setDestinationPort(request.destinationPort());
        if (request.action() != null) {
            rule.setAction(request.action());
        }
        if (request.enabled() != null) {
            rule.setEnabled(request.enabled());
        }
        FirewallRule saved = store.saveRule(rule);
        log.info("created firewall rule id={} tenant={} action={}", saved.getId(), saved.getTenantId(),
            saved.getAction());
        return saved;
    }

    public FirewallRule getFirewallRule(String ruleId) {
        return store.findRule(ruleId).orElseThrow(() -> new FirewallRuleNotFoundException(ruleId));
    }

    /**
     * @param tenantId {@code null} for every tenant
     */
    public List<FirewallRule> listFirewallRules(String tenantId) {
        return store.listRules().stream()
            .filter(rule -> tenantId == null || tenantId.equals(rule.getTenantId()))
            .toList();
    }

    public synchronized void deleteFirewallRule(String ruleId) {
        FirewallRule rule = getFirewallRule(ruleId);
        if (rule.getFirewallPolicyId() != null) {
            throw new FirewallRuleInUseException(ruleId);
        }
        store.deleteRule(ruleId);
        log.info("deleted firewall rule id={}", ruleId);
    }

    /**
     * Runs {@code work} while no policy deletion can interleave, failing first when the policy is
     * missing. A {@code null} policy id needs no check.
     */
    public synchronized <T> T whilePolicyExists(String policyId, Supplier<T> work) {
        if (policyId != null) {
            getFirewallPolicy(policyId);
        }
        return work.get();
    }

    /**
     * Rules of the policy in evaluation order, as agents receive them.
     */
    public List<FirewallRuleDocument> ruleDocuments(String policyId) {
        if (policyId == null) {
            return List.of();
        }
        return store.findPolicy(policyId)
            .map(policy -> policy.getRuleIds().stream()
                .map(store::findRule)
                .flatMap(Optional::stream)
                .map(FirewallPolicyCatalog::toDocument)
                .toList())
            .orElse(List.of());
    }

    synchronized FirewallPolicy applyPolicyUpdate(String policyId, FirewallPolicyUpdateRequest request) {
        FirewallPolicy policy = getFirewallPolicy(policyId);
        if (request.name() != null) {
            policy.setName(request.name());
        }
        if (request.description() != null) {
            policy.setDescription(request.description());
        }
        if (request.shared() != null) {
            policy.setShared(request.shared());
        }
        if (request.audited() != null) {
            policy.setAudited(request.audited());
        }
        if (request.ruleIds() != null) {
            setRules(policy, request.ruleIds());
        }
        return store.savePolicy(policy);
    }

    synchronized FirewallRule applyRuleUpdate(String ruleId, FirewallRuleUpdateRequest request) {
        FirewallRule rule = getFirewallRule(ruleId);
        if (request.name() != null) {
            rule.setName(request.name());
        }
        if (request.description() != null) {
            rule.setDescription(request.description());
        }
        if (request.shared() != null) {
            rule.setShared(request.shared());
        }
        if (request.protocol() != null) {
            rule.setProtocol(request.protocol());
        }
        if (request.ipVersion() != null) {
            rule.setIpVersion(request.ipVersion());
        }
        if (request.sourceIpAddress() != null) {
            rule.setSourceIpAddress(request.sourceIpAddress());
        }
        if (request.destinationIpAddress() != null) {
            rule.setDestinationIpAddress(request.destinationIpAddress());
        }
        if (request.sourcePort() != null) {
            rule.setSourcePort(request.sourcePort());
        }
        if (request.destinationPort() != null) {
            rule.setDestinationPort(request.destinationPort());
        }
        if (request.action() != null) {
            rule.setAction(request.action());
        }
        if (request.enabled() != null) {
            rule.setEnabled(request.enabled());
        }
        return store.saveRule(rule);
    }

    synchronized FirewallPolicy applyInsertRule(String policyId, RuleInsertion insertion) {
        FirewallPolicy policy = getFirewallPolicy(policyId);
        FirewallRule rule = getFirewallRule(insertion.ruleId());
        if (rule.getFirewallPolicyId() != null) {
            throw new FirewallRuleAlreadyAssociatedException(rule.getId(), rule.getFirewallPolicyId());
        }
        List<String> ordered = new ArrayList<>(policy.getRuleIds());
        String reference = insertion.reference();
        int index = 0;
        if (reference != null) {
            int referenceIndex = ordered.indexOf(reference);
            if (referenceIndex < 0) {
                getFirewallRule(reference);
                throw new FirewallRuleNotAssociatedWithPolicyException(reference, policyId);
            }
            index = insertion.placesBefore() ? referenceIndex : referenceIndex + 1;
        }
        ordered.add(index, rule.getId());
        setRules(policy, ordered);
        log.info("inserted rule {} into policy {} at position {}", rule.getId(), policyId, index + 1);
        return store.savePolicy(policy);
    }

    synchronized FirewallPolicy applyRemoveRule(String policyId, String ruleId) {
        FirewallPolicy policy = getFirewallPolicy(policyId);
        FirewallRule rule = getFirewallRule(ruleId);
        if (!policyId.equals(rule.getFirewallPolicyId())) {
            throw new FirewallRuleNotAssociatedWithPolicyException(ruleId, policyId);
        }
        List<String> ordered = new ArrayList<>(policy.getRuleIds());
        ordered.remove(ruleId);
        setRules(policy, ordered);
        log.info("removed rule {} from policy {}", ruleId, policyId);
        return store.savePolicy(policy);
    }

    /**
     * Replaces the policy's rule list: listed rules are associated in order with positions 1..n,
     * rules dropped from the list are released. The policy itself is not saved.
     */
    private void setRules(FirewallPolicy policy, List<String> ruleIds) {
        Set<String> unique = new HashSet<>();
        List<FirewallRule> rules = new ArrayList<>();
        for (String ruleId : ruleIds) {
            if (!unique.add(ruleId)) {
                throw new IllegalArgumentException("Duplicate firewall rule " + ruleId + " in rule list");
            }
            FirewallRule rule = getFirewallRule(ruleId);
            String owner = rule.getFirewallPolicyId();
            if (owner != null && !owner.equals(policy.getId())) {
                throw new FirewallRuleInUseException(ruleId);
            }
            rules.add(rule);
        }
        for (String previous : policy.getRuleIds()) {
            if (!unique.contains(previous)) {
                store.findRule(previous).ifPresent(rule -> {
                    rule.dissociate();
                    store.saveRule(rule);
                });
            }
        }
        for (int i = 0; i < rules.size(); i++) {
            FirewallRule rule = rules.get(i);
            rule.associate(policy.getId(), i + 1);
            store.saveRule(rule);
        }
        policy.setRuleIds(ruleIds);
    }

    static FirewallRuleDocument toDocument(FirewallRule rule) {
        return new FirewallRuleDocument(rule.getId(), rule.getTenantId(), rule.getName(), rule.getDescription(),
            rule.getFirewallPolicyId(), rule.isShared(), rule.getProtocol(), rule.getIpVersion(),
            rule.getSourceIpAddress(), rule.getDestinationIpAddress(), rule.getSourcePort(),
            rule.getDestinationPort(), rule.getPosition(), rule.getAction(), rule.isEnabled());
    }
}
