package com.dsaflow.domain.event;

import lombok.Value;

import java.time.Instant;

/**
 * Domain event consumed by notifiers (mailer, dashboards).
 * Either id may be null depending on the event type.
 */
@Value
public class ReviewEvent {
    ReviewEventType type;
    String applicationId;
    String reviewerId;
    Instant occurredAt;
    String detail;

    public static ReviewEvent forApplication(ReviewEventType type, String applicationId, Instant at, String detail) {
        return new ReviewEvent(type, applicationId, null, at, detail);
    }

    public static ReviewEvent forReviewer(ReviewEventType type, String reviewerId, Instant at, String detail) {
        return new ReviewEvent(type, null, reviewerId, at, detail);
    }
}
