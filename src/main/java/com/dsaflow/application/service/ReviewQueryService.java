package com.dsaflow.application.service;

import com.dsaflow.application.port.in.ReviewQueryUseCase;
import com.dsaflow.application.port.out.ApplicationRepository;
import com.dsaflow.application.port.out.ReviewerRepository;
import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.exception.WorkflowException;
import com.dsaflow.domain.model.ApplicationStatus;
import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.LoanApplication;
import com.dsaflow.domain.model.ReviewVerdict;
import com.dsaflow.domain.model.Reviewer;
import com.dsaflow.domain.model.Role;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only views. Nothing here mutates state.
 */
@Slf4j
public class ReviewQueryService implements ReviewQueryUseCase {

    private static final long URGENT_HOURS = 24;

    private final ApplicationRepository applicationRepository;
    private final ReviewerRepository reviewerRepository;
    private final ReviewerDirectory reviewerDirectory;
    private final Clock clock;

    public ReviewQueryService(
            ApplicationRepository applicationRepository,
            ReviewerRepository reviewerRepository,
            ReviewerDirectory reviewerDirectory,
            Clock clock
    ) {
        this.applicationRepository = applicationRepository;
        this.reviewerRepository = reviewerRepository;
        this.reviewerDirectory = reviewerDirectory;
        this.clock = clock;
    }

    @Override
    public Future<ApplicationReviewStatus> getApplicationReviewStatus(CallerIdentity caller, String applicationId) {
        return AccessGuard.requireRole(caller, Role.ADMIN, Role.DSA, Role.USER, Role.SYSTEM)
                .compose(v -> applicationRepository.findById(applicationId))
                .compose(found -> Lookups.require(found, "Application", applicationId))
                .compose(application -> {
                    if (caller.hasRole(Role.USER) && !caller.callerId().equals(application.getApplicantId())) {
                        return Future.failedFuture(WorkflowException.forbidden(
                                "Applicant " + caller.callerId() + " may only read their own application"));
                    }
                    return Future.succeededFuture(toStatus(application, clock.instant()));
                });
    }

    private ApplicationReviewStatus toStatus(LoanApplication application, Instant now) {
        Long hoursRemaining = null;
        if (application.isUnderReview() && application.getReviewDeadline() != null) {
            hoursRemaining = Math.max(0, Duration.between(now, application.getReviewDeadline()).toHours());
        }

        return new ApplicationReviewStatus(
                application.getId(),
                application.getApplicationNumber(),
                application.getStatus(),
                application.displayStatus(),
                application.getApprovalThreshold(),
                application.countVerdicts(ReviewVerdict.APPROVED),
                application.countVerdicts(ReviewVerdict.REJECTED),
                application.countVerdicts(ReviewVerdict.PENDING),
                List.copyOf(application.getReviewDecisions()),
                application.getReviewDeadline(),
                hoursRemaining,
                List.copyOf(application.getAuditTrail()));
    }

    @Override
    public Future<List<PendingReactivation>> getPendingReactivationRequests(CallerIdentity caller) {
        return AccessGuard.requireRole(caller, Role.ADMIN)
                .compose(v -> reviewerRepository.findWithPendingReactivation())
                .map(reviewers -> reviewers.stream()
                        .map(reviewer -> new PendingReactivation(
                                reviewer.getId(),
                                reviewer.getName(),
                                reviewer.getEmail(),
                                reviewer.getMissedDeadlineCount(),
                                reviewer.getReactivationRequest()))
                        .collect(Collectors.toList()));
    }

    @Override
    public Future<ReviewerStatistics> getReviewerStatistics(CallerIdentity caller, String reviewerId) {
        Future<Void> allowed = caller != null && caller.hasRole(Role.DSA)
                ? AccessGuard.requireSelf(caller, reviewerId)
                : AccessGuard.requireRole(caller, Role.ADMIN);

        return allowed
                .compose(v -> reviewerDirectory.get(reviewerId))
                .map(this::toStatistics);
    }

    private ReviewerStatistics toStatistics(Reviewer reviewer) {
        long total = reviewer.getTotalReviewed();
        int missed = reviewer.getMissedDeadlineCount();

        double approvalRate = total == 0 ? 0.0 : percent(reviewer.getApprovedCount(), total);
        double deadlineCompliance = total + missed == 0 ? 100.0 : percent(total, total + missed);

        return new ReviewerStatistics(
                reviewer.getId(),
                reviewer.getName(),
                reviewer.isActive(),
                reviewer.isVerified(),
                total,
                reviewer.getApprovedCount(),
                reviewer.getRejectedCount(),
                missed,
                approvalRate,
                deadlineCompliance);
    }

    private static double percent(long part, long whole) {
        return Math.round(part * 10000.0 / whole) / 100.0;
    }

    @Override
    public Future<Optional<NextApplication>> nextApplication(CallerIdentity caller) {
        Instant now = clock.instant();

        return AccessGuard.requireRole(caller, Role.DSA)
                .compose(v -> reviewerDirectory.get(caller.callerId()))
                .compose(reviewer -> {
                    if (!reviewer.isAvailable()) {
                        return Future.failedFuture(new WorkflowException(ErrorCode.ACCOUNT_FROZEN,
                                "Reviewer " + reviewer.getId() + " is not active and verified"));
                    }
                    return applicationRepository.findOpenAssignmentsFor(reviewer.getId(), now);
                })
                .map(open -> open.stream()
                        .findFirst()
                        .map(application -> {
                            long hours = Math.max(0, Duration.between(now, application.getReviewDeadline()).toHours());
                            return new NextApplication(application, hours, hours < URGENT_HOURS);
                        }));
    }

    @Override
    public Future<AssignmentStatistics> assignmentStatistics(CallerIdentity caller) {
        Instant now = clock.instant();

        return AccessGuard.requireRole(caller, Role.ADMIN)
                .compose(v -> reviewerDirectory.listActive())
                .compose(active -> applicationRepository.countByStatus()
                        .compose(counts -> applicationRepository.findExpiredUnderReview(now)
                                .map(overdue -> new AssignmentStatistics(
                                        active.size(),
                                        // pending applications never carry reviewers
                                        counts.getOrDefault(ApplicationStatus.PENDING, 0L),
                                        counts.getOrDefault(ApplicationStatus.UNDER_REVIEW, 0L),
                                        counts.getOrDefault(ApplicationStatus.NEEDS_ADMIN_DECISION, 0L),
                                        overdue.size()))));
    }
}
