package com.dsaflow.application.port.out;

import com.dsaflow.domain.model.ReactivationRequest;
import com.dsaflow.domain.model.ReactivationStatus;
import com.dsaflow.domain.model.ReviewVerdict;
import com.dsaflow.domain.model.Reviewer;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Output port for reviewer (DSA) persistence.
 * Counter updates and reactivation writes must be atomic at the store.
 */
public interface ReviewerRepository {

    Future<Void> insert(Reviewer reviewer);

    /**
     * @return reviewer with its latest reactivation request, if any
     */
    Future<Optional<Reviewer>> findById(String reviewerId);

    /**
     * Reviewers that are both active and verified
     */
    Future<List<Reviewer>> findAvailable();

    Future<List<Reviewer>> findWithPendingReactivation();

    /**
     * Atomically increment totalReviewed and the counter matching the verdict
     * @return false if the reviewer does not exist
     */
    Future<Boolean> recordOutcome(String reviewerId, ReviewVerdict verdict, Instant at);

    /**
     * Atomically increment missedDeadlineCount
     * @return the new count, empty if the reviewer does not exist
     */
    Future<Optional<Integer>> incrementMissedDeadlines(String reviewerId);

    /**
     * Deactivate and unverify an active reviewer
     * @return true if the reviewer was active before the call
     */
    Future<Boolean> freeze(String reviewerId);

    /**
     * Set active and reset missedDeadlineCount to zero
     */
    Future<Boolean> reactivate(String reviewerId);

    Future<Boolean> markVerified(String reviewerId, String adminId, Instant at);

    /**
     * Store a new pending request unless one is already pending
     * @return false if a pending request already exists
     */
    Future<Boolean> savePendingReactivationRequest(String reviewerId, ReactivationRequest request);

    /**
     * Move the pending request to a terminal status
     * @return false if the reviewer has no pending request
     */
    Future<Boolean> completeReactivationRequest(
            String reviewerId,
            ReactivationStatus status,
            String adminId,
            Instant reviewedAt,
            String adminNotes
    );

    /**
     * Approve the pending request and reinstate the reviewer in one write:
     * active, verified by the administrator, missedDeadlineCount reset to zero
     * @return false if the reviewer has no pending request
     */
    Future<Boolean> approveReactivationRequest(
            String reviewerId,
            String adminId,
            Instant reviewedAt,
            String adminNotes
    );
}
