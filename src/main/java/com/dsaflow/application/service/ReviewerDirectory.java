package com.dsaflow.application.service;

import com.dsaflow.application.port.out.ReviewerRepository;
import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.exception.WorkflowException;
import com.dsaflow.domain.model.ReviewVerdict;
import com.dsaflow.domain.model.Reviewer;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Reviewer accounts, their active/verified/frozen status and review counters.
 * Every operation on an unknown reviewer id fails with NOT_FOUND.
 */
@Slf4j
public class ReviewerDirectory {

    private final ReviewerRepository repository;
    private final ReviewPolicy policy;
    private final Clock clock;

    public ReviewerDirectory(ReviewerRepository repository, ReviewPolicy policy, Clock clock) {
        this.repository = repository;
        this.policy = policy;
        this.clock = clock;
    }

    public Future<Reviewer> get(String reviewerId) {
        return repository.findById(reviewerId)
                .compose(found -> Lookups.require(found, "Reviewer", reviewerId));
    }

    /**
     * Reviewers eligible for assignment (active and verified)
     */
    public Future<List<Reviewer>> listActive() {
        return repository.findAvailable();
    }

    /**
     * Deactivate and unverify. Freezing a frozen reviewer changes nothing.
     * @return true if this call froze the reviewer
     */
    public Future<Boolean> freeze(String reviewerId) {
        return get(reviewerId)
                .compose(reviewer -> {
                    if (reviewer.isFrozen()) {
                        log.debug("Reviewer {} already frozen", reviewerId);
                        return Future.succeededFuture(false);
                    }
                    return repository.freeze(reviewerId);
                })
                .onSuccess(changed -> {
                    if (changed) {
                        log.warn("Reviewer {} frozen", reviewerId);
                    }
                });
    }

    public Future<Void> reactivate(String reviewerId) {
        return get(reviewerId)
                .compose(reviewer -> repository.reactivate(reviewerId))
                .compose(updated -> requireUpdated(updated, reviewerId))
                .onSuccess(v -> log.info("Reviewer {} reactivated, missed deadlines reset", reviewerId));
    }

    public Future<Void> verify(String reviewerId, String adminId) {
        return get(reviewerId)
                .compose(reviewer -> repository.markVerified(reviewerId, adminId, clock.instant()))
                .compose(updated -> requireUpdated(updated, reviewerId))
                .onSuccess(v -> log.info("Reviewer {} verified by {}", reviewerId, adminId));
    }

    /**
     * Reactivate and verify the reviewer while closing its pending request as approved, in one repository write
     * @return false if the reviewer has no pending request
     */
    public Future<Boolean> approveReactivation(String reviewerId, String adminId, String notes) {
        return repository.approveReactivationRequest(reviewerId, adminId, clock.instant(), notes)
                .onSuccess(approved -> {
                    if (approved) {
                        log.info("Reviewer {} reactivated and verified by {}, missed deadlines reset", reviewerId, adminId);
                    }
                });
    }

    /**
     * Count a decided verdict towards the reviewer's statistics
     */
    public Future<Void> recordOutcome(String reviewerId, ReviewVerdict verdict) {
        if (verdict == null || !verdict.isDecided()) {
            return Future.failedFuture(new WorkflowException(ErrorCode.INVALID_INPUT,
                    "Only approved or rejected verdicts count as outcomes"));
        }
        return repository.recordOutcome(reviewerId, verdict, clock.instant())
                .compose(updated -> requireUpdated(updated, reviewerId))
                .onSuccess(v -> log.debug("Recorded {} outcome for reviewer {}", verdict.getValue(), reviewerId));
    }

    /**
     * Count a missed deadline; the reviewer is frozen once the count reaches the freeze threshold
     */
    public Future<MissedDeadlineOutcome> recordMissedDeadline(String reviewerId) {
        return repository.incrementMissedDeadlines(reviewerId)
                .compose(count -> Lookups.require(count, "Reviewer", reviewerId))
                .compose(count -> {
                    log.warn("Reviewer {} missed a review deadline ({} of {} allowed)",
                            reviewerId, count, policy.freezeThreshold());
                    if (count < policy.freezeThreshold()) {
                        return Future.succeededFuture(new MissedDeadlineOutcome(reviewerId, count, false));
                    }
                    return freeze(reviewerId)
                            .map(frozen -> new MissedDeadlineOutcome(reviewerId, count, frozen));
                });
    }

    private Future<Void> requireUpdated(boolean updated, String reviewerId) {
        if (!updated) {
            return Future.failedFuture(WorkflowException.notFound("Reviewer", reviewerId));
        }
        return Future.succeededFuture();
    }

    public record MissedDeadlineOutcome(String reviewerId, int missedDeadlineCount, boolean frozen) {}
}
