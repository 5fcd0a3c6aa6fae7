package io.fwaas.orchestrator.infra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fwaas.firewall.model.FirewallDocument;
import io.fwaas.firewall.model.FirewallStatus;
import io.fwaas.orchestrator.OrchestratorTestProperties;
import io.fwaas.orchestrator.app.FirewallMetrics;
import io.fwaas.orchestrator.app.JacksonConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.ConnectException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.core.AmqpTemplate;

@ExtendWith(MockitoExtension.class)
class AmqpFirewallAgentNotifierTest {

    @Mock
    AmqpTemplate rabbit;

    private final ObjectMapper json = new JacksonConfiguration().objectMapper();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private AmqpFirewallAgentNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new AmqpFirewallAgentNotifier(rabbit, json, new FirewallMetrics(registry),
            OrchestratorTestProperties.defaults());
    }

    @Test
    void publishesUpdateOnFanoutExchangeStampedWithHost() throws Exception {
        FirewallDocument firewall = document().withRules(List.of())
            .withRouterChanges(List.of(), List.of("r1"), true);

        notifier.notifyUpdate(firewall);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(rabbit).convertAndSend(eq("fwaas.agent.fanout"), eq("update_firewall"), payload.capture());
        JsonNode node = json.readTree((String) payload.getValue());
        assertThat(node.path("method").asText()).isEqualTo("update_firewall");
        assertThat(node.path("host").asText()).isEqualTo("orch-test");
        assertThat(node.path("firewall").path("id").asText()).isEqualTo("fw-1");
        assertThat(node.path("firewall").path("del-router-ids").get(0).asText()).isEqualTo("r1");
        assertThat(node.path("firewall").path("last-router").asBoolean()).isTrue();
        assertThat(registry.get("fwaas_notifications_total")
            .tag("method", "update_firewall").tag("outcome", "published").counter().count()).isEqualTo(1.0);
    }

    @Test
    void createOmitsLastRouterHint() throws Exception {
        notifier.notifyCreate(document().withRules(List.of()).withRouterChanges(List.of("r1"), List.of(), null));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(rabbit).convertAndSend(eq("fwaas.agent.fanout"), eq("create_firewall"), payload.capture());
        JsonNode node = json.readTree((String) payload.getValue());
        assertThat(node.path("firewall").has("last-router")).isFalse();
        assertThat(node.path("firewall").path("add-router-ids").get(0).asText()).isEqualTo("r1");
    }

    @Test
    void publishFailureIsCountedNotRaised() {
        doThrow(new AmqpConnectException(new ConnectException("refused")))
            .when(rabbit).convertAndSend(eq("fwaas.agent.fanout"), anyString(), (Object) anyString());

        assertThatCode(() -> notifier.notifyDelete(document().withRouterChanges(List.of(), List.of("r1"), null)))
            .doesNotThrowAnyException();
        assertThat(registry.get("fwaas_notifications_total")
            .tag("method", "delete_firewall").tag("outcome", "failed").counter().count()).isEqualTo(1.0);
    }

    private static FirewallDocument document() {
        return new FirewallDocument("fw-1", "tenant-a", "edge", null, true, false, "pol-1",
            FirewallStatus.PENDING_UPDATE, List.of("r1"), null, null, null, null);
    }
}
