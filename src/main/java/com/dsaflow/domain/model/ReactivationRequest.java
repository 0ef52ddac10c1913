package com.dsaflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A frozen reviewer's petition to have their account reinstated
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReactivationRequest {
    public static final int MIN_REASON_LENGTH = 10;
    public static final int MIN_CLARIFICATION_LENGTH = 20;

    private String reason;
    private String clarification;
    private ReactivationStatus status;
    private Instant requestedAt;
    private String reviewedBy;          // Administrator who decided
    private Instant reviewedAt;
    private String adminNotes;

    public boolean isPending() {
        return ReactivationStatus.PENDING.equals(status);
    }

    public static ReactivationRequest pending(String reason, String clarification, Instant requestedAt) {
        return ReactivationRequest.builder()
                .reason(reason)
                .clarification(clarification)
                .status(ReactivationStatus.PENDING)
                .requestedAt(requestedAt)
                .build();
    }
}
