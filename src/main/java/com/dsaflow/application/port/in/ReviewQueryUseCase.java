package com.dsaflow.application.port.in;

import com.dsaflow.domain.model.ApplicationStatus;
import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.LoanApplication;
import com.dsaflow.domain.model.ReactivationRequest;
import com.dsaflow.domain.model.ReviewAuditEntry;
import com.dsaflow.domain.model.ReviewDecision;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Inbound port - read-only views over the workflow
 */
public interface ReviewQueryUseCase {

    Future<ApplicationReviewStatus> getApplicationReviewStatus(CallerIdentity caller, String applicationId);

    Future<List<PendingReactivation>> getPendingReactivationRequests(CallerIdentity caller);

    Future<ReviewerStatistics> getReviewerStatistics(CallerIdentity caller, String reviewerId);

    /**
     * Oldest open assignment of the calling reviewer
     */
    Future<Optional<NextApplication>> nextApplication(CallerIdentity caller);

    Future<AssignmentStatistics> assignmentStatistics(CallerIdentity caller);

    record ApplicationReviewStatus(
            String applicationId,
            String applicationNumber,
            ApplicationStatus status,
            String displayStatus,
            int approvalThreshold,
            long approvedCount,
            long rejectedCount,
            long pendingCount,
            List<ReviewDecision> decisions,
            Instant reviewDeadline,
            Long hoursRemaining,
            List<ReviewAuditEntry> auditTrail
    ) {}

    record PendingReactivation(
            String reviewerId,
            String name,
            String email,
            int missedDeadlineCount,
            ReactivationRequest request
    ) {}

    record ReviewerStatistics(
            String reviewerId,
            String name,
            boolean active,
            boolean verified,
            long totalReviewed,
            long approvedCount,
            long rejectedCount,
            int missedDeadlineCount,
            double approvalRate,
            double deadlineCompliance
    ) {}

    record NextApplication(LoanApplication application, long hoursRemaining, boolean urgent) {}

    record AssignmentStatistics(
            int availableReviewers,
            long unassignedApplications,
            long underReview,
            long awaitingAdminDecision,
            int overdue
    ) {}
}
