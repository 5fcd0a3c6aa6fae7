package io.fwaas.firewall.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Reply to an {@link AgentCall}. Exactly one of {@code accepted}, {@code firewalls},
 * {@code tenants} or {@code error} is populated depending on the method.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentCallReply(
    @JsonProperty("method") AgentCallMethod method,
    @JsonProperty("accepted") Boolean accepted,
    @JsonProperty("firewalls") List<FirewallDocument> firewalls,
    @JsonProperty("tenants") List<String> tenants,
    @JsonProperty("error") String error) {

    public AgentCallReply {
        firewalls = firewalls == null ? null : List.copyOf(firewalls);
        tenants = tenants == null ? null : List.copyOf(tenants);
    }

    public static AgentCallReply accepted(AgentCallMethod method, boolean accepted) {
        return new AgentCallReply(method, accepted, null, null, null);
    }

    public static AgentCallReply firewalls(AgentCallMethod method, List<FirewallDocument> firewalls) {
        return new AgentCallReply(method, null, firewalls, null, null);
    }

    public static AgentCallReply tenants(List<String> tenants) {
        return new AgentCallReply(AgentCallMethod.GET_TENANTS_WITH_FIREWALLS, null, null, tenants, null);
    }

    public static AgentCallReply failed(AgentCallMethod method, String error) {
        return new AgentCallReply(method, Boolean.FALSE, null, null, error);
    }
}
