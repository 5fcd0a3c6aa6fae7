package io.fwaas.firewall.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Instructions the orchestrator broadcasts to agents.
 */
public enum NotificationMethod {
    CREATE_FIREWALL("create_firewall"),
    UPDATE_FIREWALL("update_firewall"),
    DELETE_FIREWALL("delete_firewall");

    private final String wireName;

    NotificationMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static NotificationMethod fromWire(String value) {
        for (NotificationMethod method : values()) {
            if (method.wireName.equals(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown notification method: " + value);
    }
}
