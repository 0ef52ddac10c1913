package com.dsaflow.application.port.out;

import com.dsaflow.domain.model.ApplicationStatus;
import com.dsaflow.domain.model.LoanApplication;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output port for loan application persistence (with decisions and audit trail)
 */
public interface ApplicationRepository {

    Future<Void> insert(LoanApplication application);

    Future<Optional<LoanApplication>> findById(String applicationId);

    /**
     * Optimistic update keyed on the version the application was read with.
     * Fails with CONCURRENT_UPDATE when the stored version moved on.
     * @return the stored application carrying its new version
     */
    Future<LoanApplication> update(LoanApplication application);

    /**
     * Applications under review whose deadline is before {@code now}
     * and that still have at least one pending decision, oldest deadline first
     */
    Future<List<LoanApplication>> findExpiredUnderReview(Instant now);

    /**
     * Applications under review with a pending decision and a deadline within [from, to]
     */
    Future<List<LoanApplication>> findUnderReviewDueBetween(Instant from, Instant to);

    /**
     * Pending applications with no reviewers, oldest first
     */
    Future<List<LoanApplication>> findUnassignedPending(int limit);

    /**
     * Non-expired applications under review where the reviewer's decision is still pending,
     * ordered by assignment time
     */
    Future<List<LoanApplication>> findOpenAssignmentsFor(String reviewerId, Instant now);

    Future<Map<ApplicationStatus, Long>> countByStatus();
}
