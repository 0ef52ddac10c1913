package com.dsaflow.domain.event;

/**
 * Notifications emitted by the review workflow
 */
public enum ReviewEventType {
    APPLICATION_ASSIGNED,
    DECISION_RECORDED,
    APPLICATION_APPROVED,
    APPLICATION_REJECTED,
    APPLICATION_RESET,
    APPLICATION_ESCALATED,
    REVIEWER_MISSED_DEADLINE,
    REVIEWER_FROZEN,
    REACTIVATION_REQUESTED,
    REVIEWER_REACTIVATED,
    REACTIVATION_REJECTED
}
