package com.dsaflow.application.port.in;

import com.dsaflow.domain.model.CallerIdentity;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.List;

/**
 * Inbound port - review deadline enforcement
 */
public interface DeadlineSweepUseCase {

    /**
     * Record missed deadlines, freeze repeat offenders and reset or escalate expired applications.
     * Safe to re-run with the same {@code now}.
     */
    Future<SweepReport> sweep(CallerIdentity caller, Instant now);

    /**
     * Run an initial sweep, then schedule one every configured interval
     */
    Future<Void> startPeriodicSweep();

    void stopPeriodicSweep();

    /**
     * Overdue applications and those due within the upcoming window
     */
    Future<DeadlineOverview> deadlineOverview(CallerIdentity caller);

    record SweepReport(
            int expiredApplications,
            int missedDeadlines,
            List<String> frozenReviewers,
            List<String> resetApplications,
            List<String> escalatedApplications,
            List<String> failedApplications
    ) {
        public int frozenCount() {
            return frozenReviewers.size();
        }

        public int resetCount() {
            return resetApplications.size();
        }
    }

    record DeadlineItem(
            String applicationId,
            String applicationNumber,
            Instant reviewDeadline,
            long hours,
            List<String> pendingReviewerIds
    ) {}

    record DeadlineOverview(List<DeadlineItem> overdue, List<DeadlineItem> upcoming) {}
}
