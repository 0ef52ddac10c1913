package com.dsaflow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A single reviewer's verdict on an application
 */
public enum ReviewVerdict {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String value;

    ReviewVerdict(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isDecided() {
        return this != PENDING;
    }

    @JsonCreator
    public static ReviewVerdict fromValue(String value) {
        for (ReviewVerdict verdict : values()) {
            if (verdict.value.equalsIgnoreCase(value)) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("Unknown review verdict: " + value);
    }

    public static boolean isValid(String value) {
        for (ReviewVerdict verdict : values()) {
            if (verdict.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
