package com.dsaflow.application.service;

import com.dsaflow.application.port.in.ReactivationUseCase;
import com.dsaflow.application.port.out.ReviewEventPublisher;
import com.dsaflow.application.port.out.ReviewerRepository;
import com.dsaflow.domain.event.ReviewEvent;
import com.dsaflow.domain.event.ReviewEventType;
import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.exception.WorkflowException;
import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.ReactivationRequest;
import com.dsaflow.domain.model.ReactivationStatus;
import com.dsaflow.domain.model.Role;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Frozen reviewers ask to be reinstated; administrators approve or reject.
 * At most one pending request per reviewer, enforced by the repository's conditional write.
 */
@Slf4j
public class ReactivationService implements ReactivationUseCase {

    private final ReviewerRepository reviewerRepository;
    private final ReviewerDirectory reviewerDirectory;
    private final ReactivationRequestValidator validator;
    private final ReviewEventPublisher eventPublisher;
    private final Clock clock;

    public ReactivationService(
            ReviewerRepository reviewerRepository,
            ReviewerDirectory reviewerDirectory,
            ReactivationRequestValidator validator,
            ReviewEventPublisher eventPublisher,
            Clock clock
    ) {
        this.reviewerRepository = reviewerRepository;
        this.reviewerDirectory = reviewerDirectory;
        this.validator = validator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public Future<ReactivationRequest> request(CallerIdentity caller, String reason, String clarification) {
        return AccessGuard.requireRole(caller, Role.DSA)
                .compose(v -> {
                    List<String> errors = validator.validate(reason, clarification);
                    if (!errors.isEmpty()) {
                        log.warn("Reactivation request from {} rejected: {}", caller.callerId(), errors);
                        return Future.failedFuture(new WorkflowException(ErrorCode.INVALID_INPUT,
                                "Reactivation request is invalid", errors));
                    }
                    return reviewerDirectory.get(caller.callerId());
                })
                .compose(reviewer -> {
                    if (!reviewer.isFrozen()) {
                        return Future.failedFuture(new WorkflowException(ErrorCode.ALREADY_ACTIVE,
                                "Reviewer " + reviewer.getId() + " is active, nothing to reactivate"));
                    }
                    ReactivationRequest pending = ReactivationRequest.pending(
                            reason.trim(), clarification.trim(), clock.instant());
                    return reviewerRepository.savePendingReactivationRequest(reviewer.getId(), pending)
                            .compose(saved -> {
                                if (!saved) {
                                    return Future.failedFuture(new WorkflowException(ErrorCode.DUPLICATE_PENDING,
                                            "Reviewer " + reviewer.getId() + " already has a pending reactivation request"));
                                }
                                return Future.succeededFuture(pending);
                            });
                })
                .onSuccess(pending -> {
                    log.info("Reactivation requested by reviewer {}", caller.callerId());
                    eventPublisher.publish(ReviewEvent.forReviewer(
                            ReviewEventType.REACTIVATION_REQUESTED, caller.callerId(), pending.getRequestedAt(), pending.getReason()));
                });
    }

    @Override
    public Future<ReactivationRequest> decide(CallerIdentity caller, String reviewerId, boolean approve, String notes) {
        ReactivationStatus outcome = approve ? ReactivationStatus.APPROVED : ReactivationStatus.REJECTED;
        Instant now = clock.instant();

        return AccessGuard.requireRole(caller, Role.ADMIN)
                .compose(v -> reviewerDirectory.get(reviewerId))
                .compose(reviewer -> {
                    if (!reviewer.hasPendingReactivationRequest()) {
                        return Future.failedFuture(WorkflowException.notFound("Pending reactivation request for reviewer", reviewerId));
                    }
                    ReactivationRequest decided = reviewer.getReactivationRequest().toBuilder()
                            .status(outcome)
                            .reviewedBy(caller.callerId())
                            .reviewedAt(now)
                            .adminNotes(notes)
                            .build();
                    Future<Boolean> completion = approve
                            ? reviewerDirectory.approveReactivation(reviewerId, caller.callerId(), notes)
                            : reviewerRepository.completeReactivationRequest(reviewerId, outcome, caller.callerId(), now, notes);
                    return completion.compose(completed -> {
                        if (!completed) {
                            // decided concurrently by another administrator
                            return Future.failedFuture(WorkflowException.notFound(
                                    "Pending reactivation request for reviewer", reviewerId));
                        }
                        return Future.succeededFuture(decided);
                    });
                })
                .onSuccess(decided -> {
                    log.info("Reactivation request of reviewer {} {} by {}", reviewerId, outcome.getValue(), caller.callerId());
                    eventPublisher.publish(ReviewEvent.forReviewer(
                            approve ? ReviewEventType.REVIEWER_REACTIVATED : ReviewEventType.REACTIVATION_REJECTED,
                            reviewerId, now, notes));
                });
    }

    @Override
    public Future<Optional<ReactivationRequest>> myRequest(CallerIdentity caller) {
        return AccessGuard.requireRole(caller, Role.DSA)
                .compose(v -> reviewerDirectory.get(caller.callerId()))
                .map(reviewer -> Optional.ofNullable(reviewer.getReactivationRequest()));
    }
}
