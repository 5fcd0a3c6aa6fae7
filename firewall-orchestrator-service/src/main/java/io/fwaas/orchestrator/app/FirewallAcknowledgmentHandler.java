package io.fwaas.orchestrator.app;

import io.fwaas.firewall.model.FirewallDocument;
import io.fwaas.firewall.model.FirewallStatus;
import io.fwaas.orchestrator.domain.DeletionLedger;
import io.fwaas.orchestrator.domain.Firewall;
import io.fwaas.orchestrator.domain.FirewallAgentCallbacks;
import io.fwaas.orchestrator.domain.FirewallLifecycle;
import io.fwaas.orchestrator.domain.FirewallNotFoundException;
import io.fwaas.orchestrator.domain.FirewallStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reconciles agent reports into authoritative firewall state.
 * <p>
 * Reports may be late, duplicated or out of order. A pending delete is never overridden by a status
 * report, and repeated deletion confirmations never destroy a firewall twice.
 */
@Service
public class FirewallAcknowledgmentHandler implements FirewallAgentCallbacks {

    private static final Logger log = LoggerFactory.getLogger(FirewallAcknowledgmentHandler.class);

    private final FirewallStore store;
    private final DeletionLedger ledger;
    private final FirewallDocuments documents;

    public FirewallAcknowledgmentHandler(FirewallStore store, DeletionLedger ledger, FirewallDocuments documents) {
        this.store = Objects.requireNonNull(store, "store");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.documents = Objects.requireNonNull(documents, "documents");
    }

    @Override
    public boolean reportStatus(String firewallId, FirewallStatus status) {
        Objects.requireNonNull(status, "status");
        return store.atomically(List.of(firewallId), () -> {
            Firewall firewall = store.findFirewall(firewallId)
                .orElseThrow(() -> new FirewallNotFoundException(firewallId));
            FirewallStatus current = firewall.getStatus();
            FirewallLifecycle.StatusReport report = FirewallLifecycle.onStatusReport(current, status,
                !store.routersOf(firewallId).isEmpty());
            if (report.status() != current) {
                firewall.transitionTo(report.status());
                store.saveFirewall(firewall);
            }
            if (current == FirewallStatus.PENDING_DELETE) {
                log.debug("ignoring status {} for firewall {} pending delete", status, firewallId);
            } else if (!report.accepted()) {
                log.warn("firewall {} reported unexpected status {}, marked {}", firewallId, status, report.status());
            }
            return report.accepted();
        });
    }

    @Override
    public boolean reportDeleted(String firewallId) {
        return store.atomically(List.of(firewallId), () -> {
            Optional<Firewall> found = store.findFirewall(firewallId);
            if (found.isEmpty()) {
                if (ledger.isConfirmed(firewallId)) {
                    log.debug("repeated deletion confirmation for firewall {}", firewallId);
                    return true;
                }
                throw new FirewallNotFoundException(firewallId);
            }
            Firewall firewall = found.get();
            if (FirewallLifecycle.onDeleteReport(firewall.getStatus()) == FirewallLifecycle.DeleteReport.DESTROY) {
                store.deleteFirewall(firewallId);
                ledger.markConfirmed(firewallId);
                log.info("firewall {} deleted by agent", firewallId);
                return true;
            }
            log.warn("firewall {} reported deleted while {}, marked ERROR", firewallId, firewall.getStatus());
            firewall.transitionTo(FirewallStatus.ERROR);
            store.saveFirewall(firewall);
            return false;
        });
    }

    @Override
    public List<FirewallDocument> listFirewalls(String tenantId) {
        return firewallsOf(tenantId, documents::describe);
    }

    @Override
    public List<FirewallDocument> listFirewallsWithRules(String tenantId) {
        return firewallsOf(tenantId, documents::withRules);
    }

    @Override
    public List<String> listTenantsWithFirewalls() {
        return store.listFirewalls().stream()
            .map(Firewall::getTenantId)
            .distinct()
            .sorted()
            .toList();
    }

    private List<FirewallDocument> firewallsOf(String tenantId, Function<Firewall, FirewallDocument> mapper) {
        return store.listFirewalls().stream()
            .filter(firewall -> tenantId == null || tenantId.equals(firewall.getTenantId()))
            .map(mapper)
            .toList();
    }
}
