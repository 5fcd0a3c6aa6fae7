package io.fwaas.orchestrator.domain;

import java.util.Objects;

/**
 * Match/action rule. The orchestrator never interprets the match fields; it only orders rules
 * within their policy and ships them to agents.
 */
public class FirewallRule {
    private final String id;
    private final String tenantId;
    private String name;
    private String description;
    private boolean shared;
    private String protocol;
    private int ipVersion;
    private String sourceIpAddress;
    private String destinationIpAddress;
    private String sourcePort;
    private String destinationPort;
    private String action;
    private boolean enabled;
    private String firewallPolicyId;
    private Integer position;

    public FirewallRule(String id, String tenantId) {
        this.id = Objects.requireNonNull(id, "id");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.ipVersion = 4;
        this.action = "deny";
        this.enabled = true;
    }

    public String getId() {
        return id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isShared() {
        return shared;
    }

    public void setShared(boolean shared) {
        this.shared = shared;
    }

    public String getProtocol() {
        return protocol;
    }

    public void setProtocol(String protocol) {
        this.protocol = protocol;
    }

    public int getIpVersion() {
        return ipVersion;
    }

    public void setIpVersion(int ipVersion) {
        this.ipVersion = ipVersion;
    }

    public String getSourceIpAddress() {
        return sourceIpAddress;
    }

    public void setSourceIpAddress(String sourceIpAddress) {
        this.sourceIpAddress = sourceIpAddress;
    }

    public String getDestinationIpAddress() {
        return destinationIpAddress;
    }

    public void setDestinationIpAddress(String destinationIpAddress) {
        this.destinationIpAddress = destinationIpAddress;
    }

    public String getSourcePort() {
        return sourcePort;
    }

    public void setSourcePort(String sourcePort) {
        this.sourcePort = sourcePort;
    }

    public String getDestinationPort() {
        return destinationPort;
    }

    public void setDestinationPort(String destinationPort) {
        this.destinationPort = destinationPort;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getFirewallPolicyId() {
        return firewallPolicyId;
    }

    public Integer getPosition() {
        return position;
    }

    public void associate(String policyId, int position) {
        this.firewallPolicyId = Objects.requireNonNull(policyId, "policyId");
        this.position = position;
    }

    public void dissociate() {
        this.firewallPolicyId = null;
        this.position = null;
    }

    public FirewallRule copy() {
        FirewallRule copy = new FirewallRule(id, tenantId);
        copy.name = name;
        copy.description = description;
        copy.shared = shared;
        copy.protocol = protocol;
        copy.ipVersion = ipVersion;
        copy.sourceIpAddress = sourceIpAddress;
        copy.destinationIpAddress = destinationIpAddress;
        copy.sourcePort = sourcePort;
        copy.destinationPort = destinationPort;
        copy.action = action;
        copy.enabled = enabled;
        copy.firewallPolicyId = firewallPolicyId;
        copy.position = position;
        return copy;
    }
}
