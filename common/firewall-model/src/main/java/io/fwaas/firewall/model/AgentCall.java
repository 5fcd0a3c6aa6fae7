package io.fwaas.firewall.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request an agent sends to the orchestrator's callback queue.
 * <p>
 * {@code status} stays a plain string on the wire: agents may report values the orchestrator does
 * not recognise, which reconciliation treats as {@link FirewallStatus#ERROR}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentCall(
    @JsonProperty("method") AgentCallMethod method,
    @JsonProperty("host") String host,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("firewall_id") String firewallId,
    @JsonProperty("status") String status) {

    public static AgentCall setFirewallStatus(String host, String firewallId, String status) {
        return new AgentCall(AgentCallMethod.SET_FIREWALL_STATUS, host, null, firewallId, status);
    }

    public static AgentCall firewallDeleted(String host, String firewallId) {
        return new AgentCall(AgentCallMethod.FIREWALL_DELETED, host, null, firewallId, null);
    }

    public static AgentCall forTenant(AgentCallMethod method, String host, String tenantId) {
        return new AgentCall(method, host, tenantId, null, null);
    }
}
