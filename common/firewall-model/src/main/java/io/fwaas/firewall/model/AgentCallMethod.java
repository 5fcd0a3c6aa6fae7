package io.fwaas.firewall.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of operations an agent may invoke on the orchestrator.
 */
public enum AgentCallMethod {
    SET_FIREWALL_STATUS("set_firewall_status"),
    FIREWALL_DELETED("firewall_deleted"),
    GET_FIREWALLS_FOR_TENANT("get_firewalls_for_tenant"),
    GET_FIREWALLS_FOR_TENANT_WITHOUT_RULES("get_firewalls_for_tenant_without_rules"),
    GET_TENANTS_WITH_FIREWALLS("get_tenants_with_firewalls");

    private final String wireName;

    AgentCallMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AgentCallMethod fromWire(String value) {
        for (AgentCallMethod method : values()) {
            if (method.wireName.equals(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown agent call method: " + value);
    }
}
