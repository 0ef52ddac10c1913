package com.dsaflow.domain.model;

/**
 * Kinds of entries written to an application's audit trail
 */
public enum AuditAction {
    ASSIGNED,
    DECISION_RECORDED,
    APPROVED,
    REJECTED,
    MISSED_DEADLINE,
    RESET_TO_PENDING,
    ESCALATED,
    ESCALATION_RESOLVED;

    public static AuditAction fromValue(String value) {
        for (AuditAction action : values()) {
            if (action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + value);
    }
}
