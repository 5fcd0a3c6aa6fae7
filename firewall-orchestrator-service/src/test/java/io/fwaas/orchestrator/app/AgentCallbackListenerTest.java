package io.fwaas.orchestrator.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fwaas.firewall.model.AgentCall;
import io.fwaas.firewall.model.AgentCallMethod;
import io.fwaas.firewall.model.AgentCallReply;
import io.fwaas.firewall.model.FirewallDocument;
import io.fwaas.firewall.model.FirewallStatus;
import io.fwaas.orchestrator.domain.FirewallAgentCallbacks;
import io.fwaas.orchestrator.domain.FirewallNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AgentCallbackListenerTest {

    @Mock
    FirewallAgentCallbacks callbacks;

    private final ObjectMapper json = new JacksonConfiguration().objectMapper();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private AgentCallbackListener listener;

    @BeforeEach
    void setUp() {
        listener = new AgentCallbackListener(callbacks, json, new FirewallMetrics(registry));
    }

    @Test
    void statusReportIsForwardedAndAnswered() throws Exception {
        when(callbacks.reportStatus("fw-1", FirewallStatus.ACTIVE)).thenReturn(true);

        AgentCallReply reply = call(AgentCall.setFirewallStatus("agent-1", "fw-1", "ACTIVE"));

        assertThat(reply.method()).isEqualTo(AgentCallMethod.SET_FIREWALL_STATUS);
        assertThat(reply.accepted()).isTrue();
        assertThat(registry.get("fwaas_agent_reports_total")
            .tag("method", "set_firewall_status").tag("outcome", "accepted").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unknownReportedStatusIsTreatedAsError() throws Exception {
        when(callbacks.reportStatus("fw-1", FirewallStatus.ERROR)).thenReturn(false);

        AgentCallReply reply = call(AgentCall.setFirewallStatus("agent-1", "fw-1", "MELTING"));

        assertThat(reply.accepted()).isFalse();
        verify(callbacks).reportStatus("fw-1", FirewallStatus.ERROR);
    }

    @Test
    void unknownFirewallBecomesNegativeReply() throws Exception {
        when(callbacks.reportDeleted("ghost")).thenThrow(new FirewallNotFoundException("ghost"));

        AgentCallReply reply = call(AgentCall.firewallDeleted("agent-1", "ghost"));

        assertThat(reply.accepted()).isFalse();
        assertThat(reply.error()).contains("ghost");
        assertThat(registry.get("fwaas_agent_reports_total")
            .tag("method", "firewall_deleted").tag("outcome", "failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void tenantQueriesReturnFirewallsAndTenants() throws Exception {
        FirewallDocument firewall = new FirewallDocument("fw-1", "tenant-a", "edge", null, true, false, null,
            FirewallStatus.ACTIVE, List.of("r1"), List.of(), null, null, null);
        when(callbacks.listFirewallsWithRules("tenant-a")).thenReturn(List.of(firewall));
        when(callbacks.listFirewalls("tenant-a")).thenReturn(List.of(firewall));
        when(callbacks.listTenantsWithFirewalls()).thenReturn(List.of("tenant-a"));

        AgentCallReply withRules = call(AgentCall.forTenant(AgentCallMethod.GET_FIREWALLS_FOR_TENANT, "agent-1", "tenant-a"));
        AgentCallReply withoutRules = call(AgentCall.forTenant(
            AgentCallMethod.GET_FIREWALLS_FOR_TENANT_WITHOUT_RULES, "agent-1", "tenant-a"));
        AgentCallReply tenants = call(AgentCall.forTenant(AgentCallMethod.GET_TENANTS_WITH_FIREWALLS, "agent-1", null));

        assertThat(withRules.firewalls()).extracting(FirewallDocument::id).containsExactly("fw-1");
        assertThat(withoutRules.firewalls()).hasSize(1);
        assertThat(tenants.tenants()).containsExactly("tenant-a");
    }

    @Test
    void malformedPayloadsAreRejected() {
        assertThatThrownBy(() -> listener.handle("  "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> listener.handle("{\"method\":\"drop_tables\"}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> listener.handle("{\"host\":\"agent-1\"}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> listener.handle("{\"method\":\"firewall_deleted\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("firewall_id");
        verifyNoInteractions(callbacks);
    }

    private AgentCallReply call(AgentCall call) throws Exception {
        String reply = listener.handle(json.writeValueAsString(call));
        return json.readValue(reply, AgentCallReply.class);
    }
}
