package io.fwaas.firewall.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Envelope of a one-way broadcast to every agent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentNotification(
    @JsonProperty("method") NotificationMethod method,
    @JsonProperty("host") String host,
    @JsonProperty("firewall") FirewallDocument firewall) {

    public AgentNotification {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(firewall, "firewall");
    }
}
