package com.dsaflow.adapter.out.persistence;

import com.dsaflow.application.port.out.ReviewerRepository;
import com.dsaflow.domain.model.ReactivationRequest;
import com.dsaflow.domain.model.ReactivationStatus;
import com.dsaflow.domain.model.ReviewVerdict;
import com.dsaflow.domain.model.Reviewer;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ReviewerRepository.
 * Used for local runs and tests; every method is synchronized so counter updates are atomic.
 * Callers always receive copies.
 */
@Slf4j
public class InMemoryReviewerAdapter implements ReviewerRepository {

    private final Map<String, Reviewer> reviewers = new LinkedHashMap<>();

    @Override
    public synchronized Future<Void> insert(Reviewer reviewer) {
        if (reviewers.containsKey(reviewer.getId())) {
            return Future.failedFuture(new IllegalStateException("Reviewer already exists: " + reviewer.getId()));
        }
        reviewers.put(reviewer.getId(), reviewer.copy());
        return Future.succeededFuture();
    }

    @Override
    public synchronized Future<Optional<Reviewer>> findById(String reviewerId) {
        return Future.succeededFuture(Optional.ofNullable(reviewers.get(reviewerId)).map(Reviewer::copy));
    }

    @Override
    public synchronized Future<List<Reviewer>> findAvailable() {
        return Future.succeededFuture(reviewers.values().stream()
                .filter(Reviewer::isAvailable)
                .map(Reviewer::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public synchronized Future<List<Reviewer>> findWithPendingReactivation() {
        return Future.succeededFuture(reviewers.values().stream()
                .filter(Reviewer::hasPendingReactivationRequest)
                .sorted(Comparator.comparing(reviewer -> reviewer.getReactivationRequest().getRequestedAt()))
                .map(Reviewer::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public synchronized Future<Boolean> recordOutcome(String reviewerId, ReviewVerdict verdict, Instant at) {
        Reviewer reviewer = reviewers.get(reviewerId);
        if (reviewer == null) {
            return Future.succeededFuture(false);
        }
        reviewer.setTotalReviewed(reviewer.getTotalReviewed() + 1);
        if (verdict == ReviewVerdict.APPROVED) {
            reviewer.setApprovedCount(reviewer.getApprovedCount() + 1);
        } else if (verdict == ReviewVerdict.REJECTED) {
            reviewer.setRejectedCount(reviewer.getRejectedCount() + 1);
        }
        reviewer.setLastActivityAt(at);
        return Future.succeededFuture(true);
    }

    @Override
    public synchronized Future<Optional<Integer>> incrementMissedDeadlines(String reviewerId) {
        Reviewer reviewer = reviewers.get(reviewerId);
        if (reviewer == null) {
            return Future.succeededFuture(Optional.empty());
        }
        reviewer.setMissedDeadlineCount(reviewer.getMissedDeadlineCount() + 1);
        return Future.succeededFuture(Optional.of(reviewer.getMissedDeadlineCount()));
    }

    @Override
    public synchronized Future<Boolean> freeze(String reviewerId) {
        Reviewer reviewer = reviewers.get(reviewerId);
        if (reviewer == null || !reviewer.isActive()) {
            return Future.succeededFuture(false);
        }
        reviewer.setActive(false);
        reviewer.setVerified(false);
        reviewer.setVerifiedBy(null);
        reviewer.setVerifiedAt(null);
        return Future.succeededFuture(true);
    }

    @Override
    public synchronized Future<Boolean> reactivate(String reviewerId) {
        Reviewer reviewer = reviewers.get(reviewerId);
        if (reviewer == null) {
            return Future.succeededFuture(false);
        }
        reviewer.setActive(true);
        reviewer.setMissedDeadlineCount(0);
        return Future.succeededFuture(true);
    }

    @Override
    public synchronized Future<Boolean> markVerified(String reviewerId, String adminId, Instant at) {
        Reviewer reviewer = reviewers.get(reviewerId);
        if (reviewer == null) {
            return Future.succeededFuture(false);
        }
        reviewer.setVerified(true);
        reviewer.setVerifiedBy(adminId);
        reviewer.setVerifiedAt(at);
        return Future.succeededFuture(true);
    }

    @Override
    public synchronized Future<Boolean> savePendingReactivationRequest(String reviewerId, ReactivationRequest request) {
        Reviewer reviewer = reviewers.get(reviewerId);
        if (reviewer == null || reviewer.hasPendingReactivationRequest()) {
            return Future.succeededFuture(false);
        }
        reviewer.setReactivationRequest(request.toBuilder().build());
        log.debug("Stored pending reactivation request for reviewer {}", reviewerId);
        return Future.succeededFuture(true);
    }

    @Override
    public synchronized Future<Boolean> completeReactivationRequest(
            String reviewerId,
            ReactivationStatus status,
            String adminId,
            Instant reviewedAt,
            String adminNotes
    ) {
        Reviewer reviewer = reviewers.get(reviewerId);
        if (reviewer == null || !reviewer.hasPendingReactivationRequest()) {
            return Future.succeededFuture(false);
        }
        ReactivationRequest request = reviewer.getReactivationRequest();
        request.setStatus(status);
        request.setReviewedBy(adminId);
        request.setReviewedAt(reviewedAt);
        request.setAdminNotes(adminNotes);
        return Future.succeededFuture(true);
    }

    @Override
    public synchronized Future<Boolean> approveReactivationRequest(
            String reviewerId,
            String adminId,
            Instant reviewedAt,
            String adminNotes
    ) {
        Reviewer reviewer = reviewers.get(reviewerId);
        if (reviewer == null || !reviewer.hasPendingReactivationRequest()) {
            return Future.succeededFuture(false);
        }
        ReactivationRequest request = reviewer.getReactivationRequest();
        request.setStatus(ReactivationStatus.APPROVED);
        request.setReviewedBy(adminId);
        request.setReviewedAt(reviewedAt);
        request.setAdminNotes(adminNotes);
        reviewer.setActive(true);
        reviewer.setMissedDeadlineCount(0);
        reviewer.setVerified(true);
        reviewer.setVerifiedBy(adminId);
        reviewer.setVerifiedAt(reviewedAt);
        return Future.succeededFuture(true);
    }
}
