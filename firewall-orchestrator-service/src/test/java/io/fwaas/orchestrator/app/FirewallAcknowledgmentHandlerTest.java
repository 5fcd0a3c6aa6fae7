package io.fwaas.orchestrator.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fwaas.firewall.model.FirewallDocument;
import io.fwaas.firewall.model.FirewallStatus;
import io.fwaas.orchestrator.domain.Firewall;
import io.fwaas.orchestrator.domain.FirewallNotFoundException;
import io.fwaas.orchestrator.domain.FirewallPolicy;
import io.fwaas.orchestrator.domain.FirewallPolicyCreateRequest;
import io.fwaas.orchestrator.domain.FirewallRuleCreateRequest;
import io.fwaas.orchestrator.infra.InMemoryDeletionLedger;
import io.fwaas.orchestrator.infra.InMemoryFirewallStore;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class FirewallAcknowledgmentHandlerTest {

    private final InMemoryFirewallStore store = new InMemoryFirewallStore();
    private final FirewallPolicyCatalog catalog = new FirewallPolicyCatalog(store);
    private final FirewallAcknowledgmentHandler handler = new FirewallAcknowledgmentHandler(store,
        new InMemoryDeletionLedger(Duration.ofMinutes(5), 100), new FirewallDocuments(store, catalog));

    @Test
    void statusReportDuringPendingDeleteIsRejectedAndIgnored() {
        save("fw-1", "tenant-a", FirewallStatus.PENDING_DELETE, List.of("r1"));

        assertThat(handler.reportStatus("fw-1", FirewallStatus.ACTIVE)).isFalse();
        assertThat(status("fw-1")).isEqualTo(FirewallStatus.PENDING_DELETE);
    }

    @Test
    void activeAndDownAreStored() {
        save("fw-1", "tenant-a", FirewallStatus.PENDING_CREATE, List.of("r1"));

        assertThat(handler.reportStatus("fw-1", FirewallStatus.DOWN)).isTrue();
        assertThat(status("fw-1")).isEqualTo(FirewallStatus.DOWN);
        assertThat(handler.reportStatus("fw-1", FirewallStatus.ACTIVE)).isTrue();
        assertThat(status("fw-1")).isEqualTo(FirewallStatus.ACTIVE);
    }

    @Test
    void acknowledgedLastRouterDetachmentSettlesInactive() {
        save("fw-1", "tenant-a", FirewallStatus.PENDING_UPDATE, List.of());

        assertThat(handler.reportStatus("fw-1", FirewallStatus.DOWN)).isTrue();
        assertThat(status("fw-1")).isEqualTo(FirewallStatus.INACTIVE);
    }

    @Test
    void unexpectedStatusMarksError(CapturedOutput output) {
        save("fw-1", "tenant-a", FirewallStatus.PENDING_UPDATE, List.of("r1"));

        assertThat(handler.reportStatus("fw-1", FirewallStatus.PENDING_CREATE)).isFalse();
        assertThat(status("fw-1")).isEqualTo(FirewallStatus.ERROR);
        assertThat(output.getOut()).contains("firewall fw-1 reported unexpected status PENDING_CREATE");
    }

    @Test
    void repeatedDeletionConfirmationNeverDestroysTwice() {
        save("fw-1", "tenant-a", FirewallStatus.PENDING_DELETE, List.of("r1"));

        assertThat(handler.reportDeleted("fw-1")).isTrue();
        assertThat(handler.reportDeleted("fw-1")).isTrue();
        assertThat(store.findFirewall("fw-1")).isEmpty();
    }

    @Test
    void deletionConfirmationOfErroredFirewallDestroysIt() {
        save("fw-1", "tenant-a", FirewallStatus.ERROR, List.of("r1"));

        assertThat(handler.reportDeleted("fw-1")).isTrue();
        assertThat(store.findFirewall("fw-1")).isEmpty();
        assertThat(store.firewallOwningRouter("r1")).isEmpty();
    }

    @Test
    void deletionConfirmationOutsidePendingDeleteMarksErrorAndSecondConfirmationDestroys(CapturedOutput output) {
        save("fw-1", "tenant-a", FirewallStatus.ACTIVE, List.of("r1"));

        assertThat(handler.reportDeleted("fw-1")).isFalse();
        assertThat(status("fw-1")).isEqualTo(FirewallStatus.ERROR);
        assertThat(output.getOut()).contains("firewall fw-1 reported deleted while ACTIVE");

        assertThat(handler.reportDeleted("fw-1")).isTrue();
        assertThat(store.findFirewall("fw-1")).isEmpty();
    }

    @Test
    void unknownFirewallIsReported() {
        assertThatThrownBy(() -> handler.reportDeleted("ghost"))
            .isInstanceOf(FirewallNotFoundException.class);
        assertThatThrownBy(() -> handler.reportStatus("ghost", FirewallStatus.ACTIVE))
            .isInstanceOf(FirewallNotFoundException.class);
    }

    @Test
    void listsFirewallsPerTenantWithAndWithoutRules() {
        String ruleId = catalog.createFirewallRule(FirewallRuleCreateRequest.of("tenant-a", "web", "tcp", "allow")).getId();
        FirewallPolicy policy = catalog.createFirewallPolicy(
            new FirewallPolicyCreateRequest("tenant-a", "policy", null, false, false, List.of(ruleId)));
        Firewall firewall = save("fw-1", "tenant-a", FirewallStatus.ACTIVE, List.of("r1"));
        firewall.setFirewallPolicyId(policy.getId());
        store.saveFirewall(firewall);
        save("fw-2", "tenant-b", FirewallStatus.INACTIVE, List.of());

        List<FirewallDocument> bare = handler.listFirewalls("tenant-a");
        List<FirewallDocument> withRules = handler.listFirewallsWithRules("tenant-a");

        assertThat(bare).singleElement().satisfies(doc -> {
            assertThat(doc.routerIds()).containsExactly("r1");
            assertThat(doc.firewallRuleList()).isNull();
        });
        assertThat(withRules).singleElement()
            .satisfies(doc -> assertThat(doc.firewallRuleList()).hasSize(1));
        assertThat(handler.listTenantsWithFirewalls()).containsExactly("tenant-a", "tenant-b");
    }

    private Firewall save(String id, String tenant, FirewallStatus status, List<String> routers) {
        Firewall firewall = new Firewall(id, tenant, "edge", null, true, false, null, status);
        store.saveFirewall(firewall);
        store.replaceRouters(id, routers);
        return firewall;
    }

    private FirewallStatus status(String id) {
        return store.findFirewall(id).orElseThrow().getStatus();
    }
}
