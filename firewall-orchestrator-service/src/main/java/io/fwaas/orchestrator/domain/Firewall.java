package io.fwaas.orchestrator.domain;

import io.fwaas.firewall.model.FirewallStatus;
import java.util.Objects;

/**
 * Authoritative firewall record. Attached routers are kept in the association table of the
 * {@link FirewallStore}, not on the record itself.
 */
public class Firewall {
    private final String id;
    private final String tenantId;
    private String name;
    private String description;
    private boolean adminStateUp;
    private boolean shared;
    private String firewallPolicyId;
    private FirewallStatus status;

    public Firewall(String id,
                    String tenantId,
                    String name,
                    String description,
                    boolean adminStateUp,
                    boolean shared,
                    String firewallPolicyId,
                    FirewallStatus status) {
        this.id = Objects.requireNonNull(id, "id");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.name = name;
        this.description = description;
        this.adminStateUp = adminStateUp;
        this.shared = shared;
        this.firewallPolicyId = firewallPolicyId;
        this.status = Objects.requireNonNull(status, "status");
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

    public boolean isAdminStateUp() {
        return adminStateUp;
    }

    public void setAdminStateUp(boolean adminStateUp) {
        this.adminStateUp = adminStateUp;
    }

    public boolean isShared() {
        return shared;
    }

    public void setShared(boolean shared) {
        this.shared = shared;
    }

    public String getFirewallPolicyId() {
        return firewallPolicyId;
    }

    public void setFirewallPolicyId(String firewallPolicyId) {
        this.firewallPolicyId = firewallPolicyId;
    }

    public FirewallStatus getStatus() {
        return status;
    }

    public void transitionTo(FirewallStatus next) {
        if (!FirewallLifecycle.canTransition(status, next)) {
            throw new IllegalStateException("Cannot transition firewall " + id + " from " + status + " to " + next);
        }
        this.status = next;
    }

    public Firewall copy() {
        return new Firewall(id, tenantId, name, description, adminStateUp, shared, firewallPolicyId, status);
    }
}
