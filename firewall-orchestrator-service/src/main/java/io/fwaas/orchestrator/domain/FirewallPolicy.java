package io.fwaas.orchestrator.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class FirewallPolicy {
    private final String id;
    private final String tenantId;
    private String name;
    private String description;
    private boolean shared;
    private boolean audited;
    private final List<String> ruleIds = new ArrayList<>();

    public FirewallPolicy(String id,
                          String tenantId,
                          String name,
                          String description,
                          boolean shared,
                          boolean audited,
                          List<String> ruleIds) {
        this.id = Objects.requireNonNull(id, "id");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.name = name;
        this.description = description;
        this.shared = shared;
        this.audited = audited;
        if (ruleIds != null) {
            this.ruleIds.addAll(ruleIds);
        }
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

    public boolean isAudited() {
        return audited;
    }

    public void setAudited(boolean audited) {
        this.audited = audited;
    }

    /**
     * Rule ids in evaluation order.
     */
    public List<String> getRuleIds() {
        return List.copyOf(ruleIds);
    }

    public void setRuleIds(List<String> ids) {
        ruleIds.clear();
        if (ids != null) {
            ruleIds.addAll(ids);
        }
    }

    public FirewallPolicy copy() {
        return new FirewallPolicy(id, tenantId, name, description, shared, audited, ruleIds);
    }
}
