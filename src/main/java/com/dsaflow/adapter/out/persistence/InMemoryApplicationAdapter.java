package com.dsaflow.adapter.out.persistence;

import com.dsaflow.application.port.out.ApplicationRepository;
import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.exception.WorkflowException;
import com.dsaflow.domain.model.ApplicationStatus;
import com.dsaflow.domain.model.LoanApplication;
import com.dsaflow.domain.model.ReviewDecision;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ApplicationRepository with the same optimistic versioning as the JDBC adapter
 */
@Slf4j
public class InMemoryApplicationAdapter implements ApplicationRepository {

    private static final Comparator<Instant> NULLS_LAST = Comparator.nullsLast(Comparator.naturalOrder());

    private final Map<String, LoanApplication> applications = new LinkedHashMap<>();

    @Override
    public synchronized Future<Void> insert(LoanApplication application) {
        if (applications.containsKey(application.getId())) {
            return Future.failedFuture(new IllegalStateException("Application already exists: " + application.getId()));
        }
        applications.put(application.getId(), application.copy());
        return Future.succeededFuture();
    }

    @Override
    public synchronized Future<Optional<LoanApplication>> findById(String applicationId) {
        return Future.succeededFuture(Optional.ofNullable(applications.get(applicationId)).map(LoanApplication::copy));
    }

    @Override
    public synchronized Future<LoanApplication> update(LoanApplication application) {
        LoanApplication stored = applications.get(application.getId());
        if (stored == null) {
            return Future.failedFuture(WorkflowException.notFound("Application", application.getId()));
        }
        if (stored.getVersion() != application.getVersion()) {
            log.warn("Stale write on application {}: read version {}, stored version {}",
                    application.getId(), application.getVersion(), stored.getVersion());
            return Future.failedFuture(new WorkflowException(ErrorCode.CONCURRENT_UPDATE,
                    "Application " + application.getId() + " was modified concurrently"));
        }

        LoanApplication next = application.copy();
        next.setVersion(stored.getVersion() + 1);
        applications.put(next.getId(), next);
        return Future.succeededFuture(next.copy());
    }

    @Override
    public synchronized Future<List<LoanApplication>> findExpiredUnderReview(Instant now) {
        return Future.succeededFuture(applications.values().stream()
                .filter(LoanApplication::isUnderReview)
                .filter(application -> application.isDeadlinePassed(now))
                .filter(LoanApplication::hasPendingDecisions)
                .sorted(Comparator.comparing(LoanApplication::getReviewDeadline))
                .map(LoanApplication::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public synchronized Future<List<LoanApplication>> findUnderReviewDueBetween(Instant from, Instant to) {
        return Future.succeededFuture(applications.values().stream()
                .filter(LoanApplication::isUnderReview)
                .filter(LoanApplication::hasPendingDecisions)
                .filter(application -> application.getReviewDeadline() != null
                        && !application.getReviewDeadline().isBefore(from)
                        && !application.getReviewDeadline().isAfter(to))
                .sorted(Comparator.comparing(LoanApplication::getReviewDeadline))
                .map(LoanApplication::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public synchronized Future<List<LoanApplication>> findUnassignedPending(int limit) {
        return Future.succeededFuture(applications.values().stream()
                .filter(LoanApplication::isPending)
                .filter(application -> application.getAssignedReviewers().isEmpty())
                .sorted(Comparator.comparing(LoanApplication::getCreatedAt, NULLS_LAST))
                .limit(limit)
                .map(LoanApplication::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public synchronized Future<List<LoanApplication>> findOpenAssignmentsFor(String reviewerId, Instant now) {
        return Future.succeededFuture(applications.values().stream()
                .filter(LoanApplication::isUnderReview)
                .filter(application -> !application.isDeadlinePassed(now))
                .filter(application -> application.decisionOf(reviewerId)
                        .map(ReviewDecision::isPending)
                        .orElse(false))
                .sorted(Comparator.comparing(LoanApplication::getAssignedAt, NULLS_LAST))
                .map(LoanApplication::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public synchronized Future<Map<ApplicationStatus, Long>> countByStatus() {
        Map<ApplicationStatus, Long> counts = new EnumMap<>(ApplicationStatus.class);
        applications.values().forEach(application -> counts.merge(application.getStatus(), 1L, Long::sum));
        return Future.succeededFuture(counts);
    }
}
