package com.dsaflow.application.port.in;

import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.model.CallerIdentity;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.List;

/**
 * Inbound port - attaches reviewers, threshold and deadline to pending applications
 */
public interface AssignmentUseCase {

    /**
     * Assign a random pool of active, verified reviewers to a pending application
     * @param caller administrator or system scheduler
     * @param applicationId application to assign
     * @return Future with the assignment, failing INVALID_STATE or INSUFFICIENT_REVIEWERS
     */
    Future<AssignmentResult> assign(CallerIdentity caller, String applicationId);

    /**
     * Assign the oldest unassigned pending applications, up to the configured batch limit
     */
    Future<BulkAssignmentResult> assignPending(CallerIdentity caller);

    record AssignmentResult(
            String applicationId,
            List<String> reviewerIds,
            int approvalThreshold,
            Instant reviewDeadline,
            Instant assignedAt
    ) {}

    record SkippedAssignment(String applicationId, ErrorCode code, String message) {}

    record BulkAssignmentResult(
            List<AssignmentResult> assigned,
            List<SkippedAssignment> skipped,
            int availableReviewers
    ) {}
}
