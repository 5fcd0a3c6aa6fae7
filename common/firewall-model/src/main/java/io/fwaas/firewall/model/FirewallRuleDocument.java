package io.fwaas.firewall.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rule as shipped to agents inside {@code firewall_rule_list}. The match and action fields are
 * passed through untouched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FirewallRuleDocument(
    @JsonProperty("id") String id,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("firewall_policy_id") String firewallPolicyId,
    @JsonProperty("shared") boolean shared,
    @JsonProperty("protocol") String protocol,
    @JsonProperty("ip_version") int ipVersion,
    @JsonProperty("source_ip_address") String sourceIpAddress,
    @JsonProperty("destination_ip_address") String destinationIpAddress,
    @JsonProperty("source_port") String sourcePort,
    @JsonProperty("destination_port") String destinationPort,
    @JsonProperty("position") Integer position,
    @JsonProperty("action") String action,
    @JsonProperty("enabled") boolean enabled) {
}
