package com.dsaflow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loan application as seen by the review workflow.
 * Decisions keep assignment order, one slot per assigned reviewer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LoanApplication {
    public static final String PARTIALLY_APPROVED_LABEL = "partially_approved";

    private String id;
    private String applicationNumber;
    private String applicantId;
    private ApplicationStatus status;
    @Builder.Default
    private Set<String> assignedReviewers = new LinkedHashSet<>();
    @Builder.Default
    private List<ReviewDecision> reviewDecisions = new ArrayList<>();
    private int approvalThreshold;
    private Instant reviewDeadline;
    private Instant assignedAt;
    private Instant approvedAt;
    private String approvedBy;
    private Instant rejectedAt;
    private String rejectedBy;
    private String rejectionReason;
    @Builder.Default
    private List<ReviewAuditEntry> auditTrail = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    private long version;

    public boolean isUnderReview() {
        return ApplicationStatus.UNDER_REVIEW.equals(status);
    }

    public boolean isPending() {
        return ApplicationStatus.PENDING.equals(status);
    }

    public boolean isAssignedTo(String reviewerId) {
        return assignedReviewers.contains(reviewerId);
    }

    public Optional<ReviewDecision> decisionOf(String reviewerId) {
        return reviewDecisions.stream()
                .filter(decision -> decision.getReviewerId().equals(reviewerId))
                .findFirst();
    }

    public long countVerdicts(ReviewVerdict verdict) {
        return reviewDecisions.stream()
                .filter(decision -> verdict.equals(decision.getVerdict()))
                .count();
    }

    public boolean hasPendingDecisions() {
        return reviewDecisions.stream().anyMatch(ReviewDecision::isPending);
    }

    public boolean allDecisionsPending() {
        return reviewDecisions.stream().allMatch(ReviewDecision::isPending);
    }

    public List<String> pendingReviewerIds() {
        return reviewDecisions.stream()
                .filter(ReviewDecision::isPending)
                .map(ReviewDecision::getReviewerId)
                .collect(Collectors.toList());
    }

    public boolean isDeadlinePassed(Instant now) {
        return reviewDeadline != null && reviewDeadline.isBefore(now);
    }

    /**
     * Status shown to readers. partially_approved is never stored.
     */
    public String displayStatus() {
        if (isUnderReview()) {
            long approvals = countVerdicts(ReviewVerdict.APPROVED);
            if (approvals > 0 && approvals < approvalThreshold) {
                return PARTIALLY_APPROVED_LABEL;
            }
        }
        return status.getValue();
    }

    public void appendAudit(AuditAction action, String actorId, Instant at, String note) {
        auditTrail.add(new ReviewAuditEntry(action, actorId, at, status, note));
    }

    /**
     * Drop the current review cycle so the application can be assigned again
     */
    public void clearAssignment() {
        assignedReviewers.clear();
        reviewDecisions.clear();
        approvalThreshold = 0;
        reviewDeadline = null;
        assignedAt = null;
    }

    public LoanApplication copy() {
        return toBuilder()
                .assignedReviewers(new LinkedHashSet<>(assignedReviewers))
                .reviewDecisions(reviewDecisions.stream()
                        .map(decision -> decision.toBuilder().build())
                        .collect(Collectors.toCollection(ArrayList::new)))
                .auditTrail(new ArrayList<>(auditTrail))
                .build();
    }
}
