package com.dsaflow.application.service;

import com.dsaflow.application.port.in.ReviewDecisionUseCase;
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
import com.dsaflow.domain.model.ReviewVerdict;
import com.dsaflow.domain.model.Role;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;

/**
 * Review state machine: records reviewer decisions and aggregates them against the approval threshold.
 * Every check runs under the application lock, the deadline included.
 */
@Slf4j
public class ReviewDecisionService implements ReviewDecisionUseCase {

    private final ApplicationRepository applicationRepository;
    private final ReviewerDirectory reviewerDirectory;
    private final ApplicationLocks locks;
    private final ReviewEventPublisher eventPublisher;
    private final Clock clock;

    public ReviewDecisionService(
            ApplicationRepository applicationRepository,
            ReviewerDirectory reviewerDirectory,
            ApplicationLocks locks,
            ReviewEventPublisher eventPublisher,
            Clock clock
    ) {
        this.applicationRepository = applicationRepository;
        this.reviewerDirectory = reviewerDirectory;
        this.locks = locks;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public Future<LoanApplication> submitDecision(CallerIdentity caller, SubmitDecisionCommand command) {
        log.info("Decision {} on application {} submitted by reviewer {}",
                command.verdict(), command.applicationId(), command.reviewerId());

        return AccessGuard.requireRole(caller, Role.DSA)
                .compose(v -> AccessGuard.requireSelf(caller, command.reviewerId()))
                .compose(v -> locks.withLock(command.applicationId(), () -> submitLocked(command)))
                .compose(updated -> recordOutcome(updated, command))
                .onSuccess(updated -> publishDecisionEvents(updated, command))
                .onFailure(error -> log.warn("Decision by {} on application {} refused: {}",
                        command.reviewerId(), command.applicationId(), error.getMessage()));
    }

    @Override
    public Future<LoanApplication> resolveEscalation(
            CallerIdentity caller,
            String applicationId,
            EscalationResolution resolution,
            String notes
    ) {
        log.info("Escalation of application {} resolved as {} by {}", applicationId, resolution, caller.callerId());

        return AccessGuard.requireRole(caller, Role.ADMIN)
                .compose(v -> {
                    if (resolution == null) {
                        return Future.failedFuture(new WorkflowException(ErrorCode.INVALID_INPUT,
                                "resolution must be one of approve, reject, reassign"));
                    }
                    return locks.withLock(applicationId, () -> resolveLocked(caller, applicationId, resolution, notes));
                })
                .onSuccess(updated -> eventPublisher.publish(ReviewEvent.forApplication(
                        resolutionEventType(updated),
                        applicationId,
                        updated.getUpdatedAt(),
                        resolution.name())));
    }

    /**
     * The decision is already stored at this point; a failed counter update is logged and the decision stands.
     */
    private Future<LoanApplication> recordOutcome(LoanApplication updated, SubmitDecisionCommand command) {
        return reviewerDirectory.recordOutcome(command.reviewerId(), command.verdict())
                .map(updated)
                .recover(error -> {
                    log.error("Decision by {} on application {} stored but reviewer statistics not updated: {}",
                            command.reviewerId(), command.applicationId(), error.getMessage(), error);
                    return Future.succeededFuture(updated);
                });
    }

    private Future<LoanApplication> submitLocked(SubmitDecisionCommand command) {
        String applicationId = command.applicationId();
        String reviewerId = command.reviewerId();

        return applicationRepository.findById(applicationId)
                .compose(found -> Lookups.require(found, "Application", applicationId))
                .compose(application -> reviewerDirectory.get(reviewerId)
                        .compose(reviewer -> {
                            if (reviewer.isFrozen()) {
                                return Future.failedFuture(new WorkflowException(ErrorCode.ACCOUNT_FROZEN,
                                        "Reviewer " + reviewerId + " is frozen and cannot review"));
                            }
                            return Future.succeededFuture(application);
                        }))
                .compose(application -> applyDecision(application, command));
    }

    private Future<LoanApplication> applyDecision(LoanApplication application, SubmitDecisionCommand command) {
        Instant now = clock.instant();
        String reviewerId = command.reviewerId();

        if (application.getStatus().isTerminal()) {
            return Future.failedFuture(WorkflowException.invalidState(
                    "Application " + application.getId() + " was already " + application.getStatus().getValue()));
        }
        if (!application.isUnderReview()) {
            return Future.failedFuture(WorkflowException.invalidState(
                    "Application " + application.getId() + " is " + application.getStatus().getValue()
                            + " and no longer accepts decisions"));
        }
        if (application.isDeadlinePassed(now)) {
            return Future.failedFuture(new WorkflowException(ErrorCode.DEADLINE_EXPIRED,
                    "Review deadline " + application.getReviewDeadline() + " has passed"));
        }
        if (!application.isAssignedTo(reviewerId)) {
            return Future.failedFuture(new WorkflowException(ErrorCode.NOT_ASSIGNED,
                    "Reviewer " + reviewerId + " is not assigned to application " + application.getId()));
        }

        ReviewDecision slot = application.decisionOf(reviewerId).orElse(null);
        if (slot == null || !slot.isPending()) {
            return Future.failedFuture(new WorkflowException(ErrorCode.ALREADY_REVIEWED,
                    "Reviewer " + reviewerId + " already decided on application " + application.getId()));
        }
        if (command.verdict() == null || !command.verdict().isDecided()) {
            return Future.failedFuture(new WorkflowException(ErrorCode.INVALID_INPUT,
                    "decision must be approved or rejected"));
        }

        slot.setVerdict(command.verdict());
        slot.setComment(command.comment());
        slot.setDecidedAt(now);
        application.setUpdatedAt(now);
        application.appendAudit(AuditAction.DECISION_RECORDED, reviewerId, now, command.verdict().getValue());

        aggregate(application, reviewerId, command.comment(), now);

        return applicationRepository.update(application);
    }

    /**
     * Threshold met wins over a rejection in the same evaluation
     */
    private void aggregate(LoanApplication application, String reviewerId, String comment, Instant now) {
        long approvals = application.countVerdicts(ReviewVerdict.APPROVED);
        long rejections = application.countVerdicts(ReviewVerdict.REJECTED);

        if (approvals >= application.getApprovalThreshold()) {
            application.setStatus(ApplicationStatus.APPROVED);
            application.setApprovedAt(now);
            application.setApprovedBy(reviewerId);
            application.appendAudit(AuditAction.APPROVED, reviewerId, now,
                    approvals + " of " + application.getApprovalThreshold() + " required approvals");
            log.info("Application {} approved ({} approvals)", application.getId(), approvals);
        } else if (rejections > 0) {
            application.setStatus(ApplicationStatus.REJECTED);
            application.setRejectedAt(now);
            application.setRejectedBy(reviewerId);
            application.setRejectionReason(comment);
            application.appendAudit(AuditAction.REJECTED, reviewerId, now, comment);
            log.info("Application {} rejected by {}", application.getId(), reviewerId);
        }
    }

    private Future<LoanApplication> resolveLocked(
            CallerIdentity caller,
            String applicationId,
            EscalationResolution resolution,
            String notes
    ) {
        return applicationRepository.findById(applicationId)
                .compose(found -> Lookups.require(found, "Application", applicationId))
                .compose(application -> {
                    if (!ApplicationStatus.NEEDS_ADMIN_DECISION.equals(application.getStatus())) {
                        return Future.failedFuture(WorkflowException.invalidState(
                                "Application " + applicationId + " is " + application.getStatus().getValue()
                                        + ", only escalated applications can be resolved"));
                    }

                    Instant now = clock.instant();
                    String adminId = caller.callerId();
                    switch (resolution) {
                        case APPROVE:
                            application.setStatus(ApplicationStatus.APPROVED);
                            application.setApprovedAt(now);
                            application.setApprovedBy(adminId);
                            break;
                        case REJECT:
                            application.setStatus(ApplicationStatus.REJECTED);
                            application.setRejectedAt(now);
                            application.setRejectedBy(adminId);
                            application.setRejectionReason(notes);
                            break;
                        case REASSIGN:
                            application.setStatus(ApplicationStatus.PENDING);
                            application.clearAssignment();
                            break;
                    }
                    application.setUpdatedAt(now);
                    application.appendAudit(AuditAction.ESCALATION_RESOLVED, adminId, now,
                            notes == null ? resolution.name() : resolution.name() + ": " + notes);

                    return applicationRepository.update(application);
                });
    }

    private void publishDecisionEvents(LoanApplication application, SubmitDecisionCommand command) {
        Instant at = application.getUpdatedAt();
        eventPublisher.publish(new ReviewEvent(
                ReviewEventType.DECISION_RECORDED,
                application.getId(),
                command.reviewerId(),
                at,
                command.verdict().getValue()));

        if (ApplicationStatus.APPROVED.equals(application.getStatus())) {
            eventPublisher.publish(ReviewEvent.forApplication(
                    ReviewEventType.APPLICATION_APPROVED, application.getId(), at, application.getApprovedBy()));
        } else if (ApplicationStatus.REJECTED.equals(application.getStatus())) {
            eventPublisher.publish(ReviewEvent.forApplication(
                    ReviewEventType.APPLICATION_REJECTED, application.getId(), at, application.getRejectionReason()));
        }
    }

    private ReviewEventType resolutionEventType(LoanApplication application) {
        switch (application.getStatus()) {
            case APPROVED:
                return ReviewEventType.APPLICATION_APPROVED;
            case REJECTED:
                return ReviewEventType.APPLICATION_REJECTED;
            default:
                return ReviewEventType.APPLICATION_RESET;
        }
    }
}
