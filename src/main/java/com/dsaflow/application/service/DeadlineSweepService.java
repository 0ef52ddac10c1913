package com.dsaflow.application.service;

import com.dsaflow.application.port.in.DeadlineSweepUseCase;
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
import com.dsaflow.domain.model.Role;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Deadline enforcement for applications under review.
 * Runs on demand and every sweep interval with the system caller.
 */
@Slf4j
public class DeadlineSweepService implements DeadlineSweepUseCase {

    private final Vertx vertx;
    private final ApplicationRepository applicationRepository;
    private final ReviewerDirectory reviewerDirectory;
    private final ApplicationLocks locks;
    private final ReviewEventPublisher eventPublisher;
    private final ReviewPolicy policy;
    private final Clock clock;
    private Long timerId;

    public DeadlineSweepService(
            Vertx vertx,
            ApplicationRepository applicationRepository,
            ReviewerDirectory reviewerDirectory,
            ApplicationLocks locks,
            ReviewEventPublisher eventPublisher,
            ReviewPolicy policy,
            Clock clock
    ) {
        this.vertx = vertx;
        this.applicationRepository = applicationRepository;
        this.reviewerDirectory = reviewerDirectory;
        this.locks = locks;
        this.eventPublisher = eventPublisher;
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public Future<Void> startPeriodicSweep() {
        long intervalMs = policy.sweepInterval().toMillis();
        log.info("Starting deadline sweeper (interval: {} minutes)", policy.sweepInterval().toMinutes());

        return sweep(CallerIdentity.system(), clock.instant())
                .onSuccess(report -> {
                    timerId = vertx.setPeriodic(intervalMs, id -> {
                        log.debug("Periodic deadline sweep triggered");
                        sweep(CallerIdentity.system(), clock.instant())
                                .onFailure(error -> log.error("Periodic deadline sweep failed", error));
                    });
                    log.info("Deadline sweeper started");
                })
                .onFailure(error -> log.error("Failed to start deadline sweeper", error))
                .mapEmpty();
    }

    @Override
    public void stopPeriodicSweep() {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
            timerId = null;
            log.info("Deadline sweeper stopped");
        }
    }

    @Override
    public Future<SweepReport> sweep(CallerIdentity caller, Instant now) {
        return AccessGuard.requireRole(caller, Role.ADMIN, Role.SYSTEM)
                .compose(v -> applicationRepository.findExpiredUnderReview(now))
                .compose(expired -> {
                    if (!expired.isEmpty()) {
                        log.info("Deadline sweep at {} found {} expired applications", now, expired.size());
                    }
                    return sweepAll(expired, now);
                })
                .onSuccess(report -> {
                    if (report.expiredApplications() > 0) {
                        log.info("Deadline sweep done: {} missed deadlines, frozen {}, reset {}, escalated {}, failed {}",
                                report.missedDeadlines(), report.frozenReviewers(), report.resetApplications(),
                                report.escalatedApplications(), report.failedApplications());
                    }
                });
    }

    /**
     * One application at a time so that a failure only skips that application
     */
    private Future<SweepReport> sweepAll(List<LoanApplication> expired, Instant now) {
        SweepTally tally = new SweepTally();
        Future<Void> chain = Future.succeededFuture();

        for (LoanApplication candidate : expired) {
            String applicationId = candidate.getId();
            chain = chain.compose(v -> locks.withLock(applicationId, () -> sweepOne(applicationId, now, tally))
                    .recover(error -> {
                        log.error("Deadline sweep of application {} failed", applicationId, error);
                        tally.failed.add(applicationId);
                        return Future.succeededFuture();
                    }));
        }

        return chain.map(v -> new SweepReport(
                expired.size(),
                tally.missedDeadlines,
                List.copyOf(tally.frozen),
                List.copyOf(tally.reset),
                List.copyOf(tally.escalated),
                List.copyOf(tally.failed)));
    }

    private Future<Void> sweepOne(String applicationId, Instant now, SweepTally tally) {
        return applicationRepository.findById(applicationId)
                .compose(found -> Lookups.require(found, "Application", applicationId))
                .compose(application -> {
                    // state may have moved on since the query
                    if (!application.isUnderReview() || !application.isDeadlinePassed(now)
                            || !application.hasPendingDecisions()) {
                        log.debug("Application {} no longer expired, skipping", applicationId);
                        return Future.succeededFuture();
                    }
                    return penalizePendingReviewers(application, now, tally)
                            .compose(v -> closeReviewCycle(application, now, tally));
                });
    }

    private Future<Void> penalizePendingReviewers(LoanApplication application, Instant now, SweepTally tally) {
        Future<Void> chain = Future.succeededFuture();

        for (String reviewerId : application.pendingReviewerIds()) {
            chain = chain.compose(v -> reviewerDirectory.get(reviewerId)
                    .compose(reviewer -> {
                        if (!reviewer.isAvailable()) {
                            log.debug("Reviewer {} is not active and verified, no further penalty", reviewerId);
                            return Future.<Void>succeededFuture();
                        }
                        return reviewerDirectory.recordMissedDeadline(reviewerId)
                                .map(outcome -> {
                                    tally.missedDeadlines++;
                                    application.appendAudit(AuditAction.MISSED_DEADLINE, reviewerId, now,
                                            "Missed deadlines: " + outcome.missedDeadlineCount());
                                    eventPublisher.publish(new ReviewEvent(ReviewEventType.REVIEWER_MISSED_DEADLINE,
                                            application.getId(), reviewerId, now,
                                            String.valueOf(outcome.missedDeadlineCount())));
                                    if (outcome.frozen()) {
                                        tally.frozen.add(reviewerId);
                                        eventPublisher.publish(ReviewEvent.forReviewer(ReviewEventType.REVIEWER_FROZEN,
                                                reviewerId, now, "Missed " + outcome.missedDeadlineCount() + " review deadlines"));
                                    }
                                    return (Void) null;
                                });
                    })
                    .recover(error -> {
                        if (WorkflowException.hasCode(error, ErrorCode.NOT_FOUND)) {
                            log.warn("Pending reviewer {} on application {} does not exist", reviewerId, application.getId());
                            return Future.succeededFuture();
                        }
                        return Future.failedFuture(error);
                    }));
        }

        return chain;
    }

    private Future<Void> closeReviewCycle(LoanApplication application, Instant now, SweepTally tally) {
        boolean nobodyDecided = application.allDecisionsPending();

        if (nobodyDecided) {
            application.setStatus(ApplicationStatus.PENDING);
            application.clearAssignment();
            application.appendAudit(AuditAction.RESET_TO_PENDING, CallerIdentity.system().callerId(), now,
                    "No reviewer decided before the deadline");
        } else {
            application.setStatus(ApplicationStatus.NEEDS_ADMIN_DECISION);
            application.appendAudit(AuditAction.ESCALATED, CallerIdentity.system().callerId(), now,
                    "Deadline passed with decisions outstanding");
        }
        application.setUpdatedAt(now);

        return applicationRepository.update(application)
                .onSuccess(saved -> {
                    if (nobodyDecided) {
                        tally.reset.add(saved.getId());
                        eventPublisher.publish(ReviewEvent.forApplication(
                                ReviewEventType.APPLICATION_RESET, saved.getId(), now, null));
                    } else {
                        tally.escalated.add(saved.getId());
                        eventPublisher.publish(ReviewEvent.forApplication(
                                ReviewEventType.APPLICATION_ESCALATED, saved.getId(), now, null));
                    }
                })
                .mapEmpty();
    }

    @Override
    public Future<DeadlineOverview> deadlineOverview(CallerIdentity caller) {
        Instant now = clock.instant();

        return AccessGuard.requireRole(caller, Role.ADMIN)
                .compose(v -> applicationRepository.findExpiredUnderReview(now))
                .compose(overdue -> applicationRepository
                        .findUnderReviewDueBetween(now, now.plus(policy.upcomingWindow()))
                        .map(upcoming -> new DeadlineOverview(
                                overdue.stream()
                                        .map(application -> toItem(application,
                                                Duration.between(application.getReviewDeadline(), now)))
                                        .collect(Collectors.toList()),
                                upcoming.stream()
                                        .map(application -> toItem(application,
                                                Duration.between(now, application.getReviewDeadline())))
                                        .collect(Collectors.toList()))));
    }

    private DeadlineItem toItem(LoanApplication application, Duration distance) {
        return new DeadlineItem(
                application.getId(),
                application.getApplicationNumber(),
                application.getReviewDeadline(),
                distance.toHours(),
                application.pendingReviewerIds());
    }

    private static class SweepTally {
        private int missedDeadlines;
        private final List<String> frozen = new ArrayList<>();
        private final List<String> reset = new ArrayList<>();
        private final List<String> escalated = new ArrayList<>();
        private final List<String> failed = new ArrayList<>();
    }
}
