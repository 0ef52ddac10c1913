package com.dsaflow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Caller roles supplied by the identity provider.
 * SYSTEM is used by in-process schedulers only.
 */
public enum Role {
    ADMIN("admin"),
    DSA("dsa"),
    USER("user"),
    SYSTEM("system");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Role fromValue(String value) {
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }

    public static boolean isValid(String value) {
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
