package io.fwaas.orchestrator.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fwaas.firewall.model.AgentNotification;
import io.fwaas.firewall.model.FirewallDocument;
import io.fwaas.firewall.model.NotificationMethod;
import io.fwaas.orchestrator.app.FirewallMetrics;
import io.fwaas.orchestrator.config.OrchestratorProperties;
import io.fwaas.orchestrator.domain.FirewallAgentNotifier;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes firewall instructions on the agents' fanout exchange.
 * <p>
 * A failed publish looks the same to the orchestrator as an agent that never received the message,
 * so it is logged and counted but not raised.
 */
@Component
public class AmqpFirewallAgentNotifier implements FirewallAgentNotifier {

    private static final Logger log = LoggerFactory.getLogger(AmqpFirewallAgentNotifier.class);

    private final AmqpTemplate rabbit;
    private final ObjectMapper json;
    private final FirewallMetrics metrics;
    private final String exchange;
    private final String host;

    public AmqpFirewallAgentNotifier(AmqpTemplate rabbit,
                                     ObjectMapper json,
                                     FirewallMetrics metrics,
                                     OrchestratorProperties properties) {
        this.rabbit = Objects.requireNonNull(rabbit, "rabbit");
        this.json = Objects.requireNonNull(json, "json");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(properties, "properties");
        this.exchange = properties.getRabbit().getAgentExchange();
        this.host = properties.getHost();
    }

    @Override
    public void notifyCreate(FirewallDocument firewall) {
        publish(NotificationMethod.CREATE_FIREWALL, firewall);
    }

    @Override
    public void notifyUpdate(FirewallDocument firewall) {
        publish(NotificationMethod.UPDATE_FIREWALL, firewall);
    }

    @Override
    public void notifyDelete(FirewallDocument firewall) {
        publish(NotificationMethod.DELETE_FIREWALL, firewall);
    }

    private void publish(NotificationMethod method, FirewallDocument firewall) {
        String payload = toJson(new AgentNotification(method, host, firewall));
        log.info("[AGENT] SEND {} fw={} add={} del={} payload={}",
            method.wireName(), firewall.id(), firewall.addRouterIds(), firewall.delRouterIds(), snippet(payload));
        try {
            rabbit.convertAndSend(exchange, method.wireName(), payload);
            metrics.notificationPublished(method);
        } catch (AmqpException e) {
            metrics.notificationFailed(method);
            log.warn("[AGENT] SEND {} fw={} failed on exchange {}", method.wireName(), firewall.id(), exchange, e);
        }
    }

    private String toJson(AgentNotification notification) {
        try {
            return json.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize %s for firewall %s".formatted(
                notification.method().wireName(), notification.firewall().id()), e);
        }
    }

    private static String snippet(String payload) {
        if (payload == null) {
            return "";
        }
        String trimmed = payload.strip();
        if (trimmed.length() > 300) {
            return trimmed.substring(0, 300) + "…";
        }
        return trimmed;
    }
}
