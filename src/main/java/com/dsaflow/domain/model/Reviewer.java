package com.dsaflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Reviewer (DSA) account with its review counters.
 * Never deleted, only deactivated.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Reviewer {
    private String id;
    private String name;
    private String email;
    private String phone;
    private boolean active;
    private boolean verified;
    private String verifiedBy;
    private Instant verifiedAt;
    private int missedDeadlineCount;
    private ReactivationRequest reactivationRequest;
    private long totalReviewed;
    private long approvedCount;
    private long rejectedCount;
    private Instant lastActivityAt;
    private Instant createdAt;

    /**
     * Eligible for new assignments
     */
    public boolean isAvailable() {
        return active && verified;
    }

    public boolean isFrozen() {
        return !active;
    }

    public boolean hasPendingReactivationRequest() {
        return reactivationRequest != null && reactivationRequest.isPending();
    }

    public Reviewer copy() {
        return toBuilder()
                .reactivationRequest(reactivationRequest == null ? null : reactivationRequest.toBuilder().build())
                .build();
    }
}
