package com.dsaflow.application.service;

import com.dsaflow.application.port.in.AssignmentUseCase;
import com.dsaflow.application.port.out.ApplicationRepository;
import com.dsaflow.application.port.out.ReviewEventPublisher;
import com.dsaflow.domain.event.ReviewEvent;
import com.dsaflow.domain.event.ReviewEventType;
import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.exception.WorkflowException;
import com.dsaflow.domain.model.ApplicationStatus;
import com.dsaflow.domain.model.AuditAction;
import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.LoanApplication;
import com.dsaflow.domain.model.ReviewDecision;
import com.dsaflow.domain.model.Reviewer;
import com.dsaflow.domain.model.Role;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Assignment engine: picks the reviewer pool, threshold and deadline for a pending application
 */
@Slf4j
public class AssignmentService implements AssignmentUseCase {

    private final ApplicationRepository applicationRepository;
    private final ReviewerDirectory reviewerDirectory;
    private final ReviewerSelector selector;
    private final ApplicationLocks locks;
    private final ReviewEventPublisher eventPublisher;
    private final ReviewPolicy policy;
    private final Clock clock;

    public AssignmentService(
            ApplicationRepository applicationRepository,
            ReviewerDirectory reviewerDirectory,
            ReviewerSelector selector,
            ApplicationLocks locks,
            ReviewEventPublisher eventPublisher,
            ReviewPolicy policy,
            Clock clock
    ) {
        this.applicationRepository = applicationRepository;
        this.reviewerDirectory = reviewerDirectory;
        this.selector = selector;
        this.locks = locks;
        this.eventPublisher = eventPublisher;
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public Future<AssignmentResult> assign(CallerIdentity caller, String applicationId) {
        log.info("Assign reviewers to application {} requested by {}", applicationId, caller.callerId());

        return AccessGuard.requireRole(caller, Role.ADMIN, Role.SYSTEM)
                .compose(v -> locks.withLock(applicationId, () -> assignLocked(caller, applicationId)))
                .onSuccess(result -> {
                    log.info("Application {} assigned to {} (threshold {}, deadline {})",
                            applicationId, result.reviewerIds(), result.approvalThreshold(), result.reviewDeadline());
                    eventPublisher.publish(ReviewEvent.forApplication(
                            ReviewEventType.APPLICATION_ASSIGNED,
                            applicationId,
                            result.assignedAt(),
                            String.join(",", result.reviewerIds())));
                })
                .onFailure(error -> log.warn("Assignment of application {} failed: {}", applicationId, error.getMessage()));
    }

    @Override
    public Future<BulkAssignmentResult> assignPending(CallerIdentity caller) {
        log.info("Bulk assignment of pending applications requested by {}", caller.callerId());

        return AccessGuard.requireRole(caller, Role.ADMIN, Role.SYSTEM)
                .compose(v -> reviewerDirectory.listActive())
                .compose(pool -> {
                    if (pool.size() < policy.minReviewers()) {
                        return Future.failedFuture(insufficientReviewers(pool.size()));
                    }
                    return applicationRepository.findUnassignedPending(policy.bulkAssignLimit())
                            .compose(applications -> assignSequentially(caller, applications))
                            .map(outcome -> new BulkAssignmentResult(outcome.assigned, outcome.skipped, pool.size()));
                })
                .onSuccess(result -> log.info("Bulk assignment finished: {} assigned, {} skipped",
                        result.assigned().size(), result.skipped().size()));
    }

    private Future<BulkOutcome> assignSequentially(CallerIdentity caller, List<LoanApplication> applications) {
        BulkOutcome outcome = new BulkOutcome();
        Future<Void> chain = Future.succeededFuture();

        for (LoanApplication application : applications) {
            chain = chain.compose(v -> assign(caller, application.getId())
                    .map(result -> {
                        outcome.assigned.add(result);
                        return (Void) null;
                    })
                    .recover(error -> {
                        if (!(error instanceof WorkflowException)) {
                            return Future.failedFuture(error);
                        }
                        WorkflowException workflowError = (WorkflowException) error;
                        outcome.skipped.add(new SkippedAssignment(
                                application.getId(), workflowError.getCode(), workflowError.getMessage()));
                        return Future.succeededFuture();
                    }));
        }

        return chain.map(outcome);
    }

    private Future<AssignmentResult> assignLocked(CallerIdentity caller, String applicationId) {
        return applicationRepository.findById(applicationId)
                .compose(found -> Lookups.require(found, "Application", applicationId))
                .compose(application -> {
                    if (!application.isPending()) {
                        return Future.failedFuture(WorkflowException.invalidState(
                                "Application " + applicationId + " is " + application.getStatus().getValue()
                                        + ", only pending applications can be assigned"));
                    }
                    return reviewerDirectory.listActive()
                            .compose(pool -> assignFromPool(caller, application, pool));
                });
    }

    private Future<AssignmentResult> assignFromPool(CallerIdentity caller, LoanApplication application, List<Reviewer> pool) {
        if (pool.size() < policy.minReviewers()) {
            return Future.failedFuture(insufficientReviewers(pool.size()));
        }

        List<String> reviewerIds = selector.select(pool, policy.minReviewers(), policy.maxReviewers())
                .stream()
                .map(Reviewer::getId)
                .collect(Collectors.toList());
        Instant now = clock.instant();

        application.setAssignedReviewers(new LinkedHashSet<>(reviewerIds));
        application.setReviewDecisions(reviewerIds.stream()
                .map(ReviewDecision::pendingFor)
                .collect(Collectors.toCollection(ArrayList::new)));
        application.setApprovalThreshold(policy.thresholdFor(reviewerIds.size()));
        application.setReviewDeadline(now.plus(policy.reviewWindow()));
        application.setAssignedAt(now);
        application.setStatus(ApplicationStatus.UNDER_REVIEW);
        application.setUpdatedAt(now);
        application.appendAudit(AuditAction.ASSIGNED, caller.callerId(), now,
                "Assigned to " + reviewerIds.size() + " reviewers, " + application.getApprovalThreshold() + " approvals required");

        return applicationRepository.update(application)
                .map(saved -> new AssignmentResult(
                        saved.getId(),
                        List.copyOf(reviewerIds),
                        saved.getApprovalThreshold(),
                        saved.getReviewDeadline(),
                        saved.getAssignedAt()));
    }

    private WorkflowException insufficientReviewers(int available) {
        return new WorkflowException(ErrorCode.INSUFFICIENT_REVIEWERS,
                "At least " + policy.minReviewers() + " active, verified reviewers are required; " + available + " available");
    }

    private static class BulkOutcome {
        private final List<AssignmentResult> assigned = new ArrayList<>();
        private final List<SkippedAssignment> skipped = new ArrayList<>();
    }
}
