package io.fwaas.orchestrator.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fwaas.firewall.model.AgentCall;
import io.fwaas.firewall.model.AgentCallMethod;
import io.fwaas.firewall.model.AgentCallReply;
import io.fwaas.firewall.model.FirewallStatus;
import io.fwaas.orchestrator.domain.FirewallAgentCallbacks;
import io.fwaas.orchestrator.domain.FirewallException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Serves agent calls arriving on the plugin queue and answers with an {@link AgentCallReply}.
 * <p>
 * Messages that cannot be parsed are rejected with {@link IllegalArgumentException}; the listener
 * container is configured not to requeue them. Domain failures become a reply with
 * {@code accepted=false} and an error text, since the calling agent is the only party to tell.
 */
@Component
public class AgentCallbackListener {

    private static final Logger log = LoggerFactory.getLogger(AgentCallbackListener.class);

    private final FirewallAgentCallbacks callbacks;
    private final ObjectMapper json;
    private final FirewallMetrics metrics;

    public AgentCallbackListener(FirewallAgentCallbacks callbacks, ObjectMapper json, FirewallMetrics metrics) {
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
        this.json = Objects.requireNonNull(json, "json");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @RabbitListener(queues = "#{pluginQueue.name}")
    public String handle(String body) {
        AgentCall call = parse(body);
        log.info("[AGENT] RECV {} host={} payload={}", call.method().wireName(), call.host(), snippet(body));
        AgentCallReply reply;
        try {
            reply = dispatch(call);
            metrics.agentReport(call.method(), outcome(reply));
        } catch (FirewallException e) {
            log.warn("[AGENT] RECV {} failed: {}", call.method().wireName(), e.getMessage());
            metrics.agentReport(call.method(), "failed");
            reply = AgentCallReply.failed(call.method(), e.getMessage());
        }
        return toJson(reply);
    }

    AgentCallReply dispatch(AgentCall call) {
        return switch (call.method()) {
            case SET_FIREWALL_STATUS -> AgentCallReply.accepted(call.method(),
                callbacks.reportStatus(requireField(call.firewallId(), "firewall_id"),
                    FirewallStatus.fromReported(call.status())));
            case FIREWALL_DELETED -> AgentCallReply.accepted(call.method(),
                callbacks.reportDeleted(requireField(call.firewallId(), "firewall_id")));
            case GET_FIREWALLS_FOR_TENANT -> AgentCallReply.firewalls(call.method(),
                callbacks.listFirewallsWithRules(call.tenantId()));
            case GET_FIREWALLS_FOR_TENANT_WITHOUT_RULES -> AgentCallReply.firewalls(call.method(),
                callbacks.listFirewalls(call.tenantId()));
            case GET_TENANTS_WITH_FIREWALLS -> AgentCallReply.tenants(callbacks.listTenantsWithFirewalls());
        };
    }

    private AgentCall parse(String body) {
        if (body == null || body.isBlank()) {
            log.warn("[AGENT] RECV empty agent call");
            throw new IllegalArgumentException("Agent call payload must not be null or blank");
        }
        AgentCall call;
        try {
            call = json.readValue(body, AgentCall.class);
        } catch (JsonProcessingException e) {
            log.warn("[AGENT] RECV malformed agent call payload={}", snippet(body));
            throw new IllegalArgumentException("Malformed agent call", e);
        }
        if (call.method() == null) {
            log.warn("[AGENT] RECV agent call without method payload={}", snippet(body));
            throw new IllegalArgumentException("Agent call method must not be null");
        }
        return call;
    }

    private String toJson(AgentCallReply reply) {
        try {
            return json.writeValueAsString(reply);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reply to " + reply.method().wireName(), e);
        }
    }

    private static String requireField(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        return value;
    }

    private static String outcome(AgentCallReply reply) {
        if (reply.accepted() == null) {
            return "served";
        }
        return reply.accepted() ? "accepted" : "rejected";
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
