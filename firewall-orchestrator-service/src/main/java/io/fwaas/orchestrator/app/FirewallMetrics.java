package io.fwaas.orchestrator.app;

import io.fwaas.firewall.model.AgentCallMethod;
import io.fwaas.firewall.model.NotificationMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Counters for agent traffic in both directions.
 */
@Component
public class FirewallMetrics {

    static final String NOTIFICATIONS = "fwaas_notifications_total";
    static final String AGENT_REPORTS = "fwaas_agent_reports_total";

    private final MeterRegistry registry;

    public FirewallMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public void notificationPublished(NotificationMethod method) {
        notification(method, "published");
    }

    public void notificationFailed(NotificationMethod method) {
        notification(method, "failed");
    }

    public void agentReport(AgentCallMethod method, String outcome) {
        Counter.builder(AGENT_REPORTS)
            .description("Calls received from firewall agents")
            .tag("method", method.wireName())
            .tag("outcome", outcome)
            .register(registry)
            .increment();
    }

    private void notification(NotificationMethod method, String outcome) {
        Counter.builder(NOTIFICATIONS)
            .description("Broadcasts sent to firewall agents")
            .tag("method", method.wireName())
            .tag("outcome", outcome)
            .register(registry)
            .increment();
    }
}
