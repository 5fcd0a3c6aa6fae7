package io.fwaas.firewall.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class FirewallModelSerializationTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void notificationUsesAgentWireNames() throws Exception {
        FirewallRuleDocument rule = new FirewallRuleDocument("r1", "t1", "allow-ssh", null, "p1", false,
            "tcp", 4, null, "10.0.0.0/24", null, "22", 1, "allow", true);
        FirewallDocument firewall = new FirewallDocument("fw1", "t1", "edge", null, true, false, "p1",
            FirewallStatus.PENDING_UPDATE, List.of("r2"), null, null, null, null)
            .withRules(List.of(rule))
            .withRouterChanges(List.of(), List.of("r1"), true);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(
            new AgentNotification(NotificationMethod.UPDATE_FIREWALL, "orchestrator-1", firewall)));

        assertThat(json.path("method").asText()).isEqualTo("update_firewall");
        assertThat(json.path("host").asText()).isEqualTo("orchestrator-1");
        JsonNode body = json.path("firewall");
        assertThat(body.path("tenant_id").asText()).isEqualTo("t1");
        assertThat(body.path("status").asText()).isEqualTo("PENDING_UPDATE");
        assertThat(body.path("add-router-ids").isArray()).isTrue();
        assertThat(body.path("add-router-ids")).isEmpty();
        assertThat(body.path("del-router-ids").get(0).asText()).isEqualTo("r1");
        assertThat(body.path("last-router").asBoolean()).isTrue();
        assertThat(body.path("firewall_rule_list").get(0).path("destination_port").asText()).isEqualTo("22");
        assertThat(body.path("firewall_rule_list").get(0).has("source_port")).isFalse();
    }

    @Test
    void lastRouterIsOmittedWhenNotSet() throws Exception {
        FirewallDocument firewall = new FirewallDocument("fw1", "t1", null, null, true, false, null,
            FirewallStatus.PENDING_CREATE, List.of("r1"), List.of(), null, null, null)
            .withRouterChanges(List.of("r1"), List.of(), null);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(firewall));

        assertThat(json.has("last-router")).isFalse();
        assertThat(json.has("firewall_policy_id")).isFalse();
        assertThat(json.path("add-router-ids").get(0).asText()).isEqualTo("r1");
    }

    @Test
    void readsAgentCallFromWire() throws Exception {
        String body = "{\"method\":\"set_firewall_status\",\"host\":\"gw-7\","
            + "\"firewall_id\":\"fw1\",\"status\":\"ACTIVE\",\"extra\":1}";

        AgentCall call = mapper.readValue(body, AgentCall.class);

        assertThat(call.method()).isEqualTo(AgentCallMethod.SET_FIREWALL_STATUS);
        assertThat(call.host()).isEqualTo("gw-7");
        assertThat(call.firewallId()).isEqualTo("fw1");
        assertThat(call.status()).isEqualTo("ACTIVE");
        assertThat(call.tenantId()).isNull();
    }

    @Test
    void rejectsUnknownAgentCallMethod() {
        assertThatThrownBy(() -> mapper.readValue("{\"method\":\"drop_tables\"}", AgentCall.class))
            .hasRootCauseInstanceOf(IllegalArgumentException.class)
            .hasRootCauseMessage("Unknown agent call method: drop_tables");
    }

    @Test
    void replyOmitsUnusedParts() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(
            AgentCallReply.tenants(List.of("t1", "t2"))));

        assertThat(json.path("method").asText()).isEqualTo("get_tenants_with_firewalls");
        assertThat(json.path("tenants")).hasSize(2);
        assertThat(json.has("accepted")).isFalse();
        assertThat(json.has("firewalls")).isFalse();
    }

    @Test
    void unknownReportedStatusMapsToError() {
        assertThat(FirewallStatus.fromReported("active")).isEqualTo(FirewallStatus.ACTIVE);
        assertThat(FirewallStatus.fromReported("BROKEN")).isEqualTo(FirewallStatus.ERROR);
        assertThat(FirewallStatus.fromReported(null)).isEqualTo(FirewallStatus.ERROR);
        assertThat(FirewallStatus.PENDING_DELETE.isPending()).isTrue();
        assertThat(FirewallStatus.ERROR.isPending()).isFalse();
    }
}
