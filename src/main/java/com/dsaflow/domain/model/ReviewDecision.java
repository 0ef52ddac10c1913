package com.dsaflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One assigned reviewer's decision slot on an application
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReviewDecision {
    private String reviewerId;
    private ReviewVerdict verdict;
    private String comment;
    private Instant decidedAt;

    public static ReviewDecision pendingFor(String reviewerId) {
        return ReviewDecision.builder()
                .reviewerId(reviewerId)
                .verdict(ReviewVerdict.PENDING)
                .build();
    }

    public boolean isPending() {
        return ReviewVerdict.PENDING.equals(verdict);
    }
}
