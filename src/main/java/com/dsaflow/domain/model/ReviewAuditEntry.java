package com.dsaflow.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Immutable status-history entry on an application
 */
@Value
public class ReviewAuditEntry {
    AuditAction action;
    String actorId;
    Instant at;
    ApplicationStatus resultingStatus;
    String note;
}
