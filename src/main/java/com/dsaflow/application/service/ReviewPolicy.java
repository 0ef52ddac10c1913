package com.dsaflow.application.service;

import io.vertx.core.json.JsonObject;

import java.time.Duration;

/**
 * Review workflow constants, bound from the {@code review} section of application.yml
 */
public record ReviewPolicy(
        int minReviewers,
        int maxReviewers,
        int approvalThreshold,
        Duration reviewWindow,
        int freezeThreshold,
        Duration sweepInterval,
        Duration upcomingWindow,
        int bulkAssignLimit
) {
    public static final int DEFAULT_MIN_REVIEWERS = 2;
    public static final int DEFAULT_MAX_REVIEWERS = 3;
    public static final int DEFAULT_APPROVAL_THRESHOLD = 2;
    public static final long DEFAULT_DEADLINE_HOURS = 72;
    public static final int DEFAULT_FREEZE_THRESHOLD = 3;
    public static final long DEFAULT_SWEEP_INTERVAL_MINUTES = 5;
    public static final long DEFAULT_UPCOMING_WINDOW_HOURS = 24;
    public static final int DEFAULT_BULK_ASSIGN_LIMIT = 10;

    public ReviewPolicy {
        if (minReviewers < 1 || maxReviewers < minReviewers) {
            throw new IllegalArgumentException("Reviewer pool bounds must satisfy 1 <= min <= max");
        }
        if (approvalThreshold < 1) {
            throw new IllegalArgumentException("approval-threshold must be at least 1");
        }
        if (freezeThreshold < 1) {
            throw new IllegalArgumentException("freeze-threshold must be at least 1");
        }
    }

    public static ReviewPolicy defaults() {
        return fromConfig(new JsonObject());
    }

    public static ReviewPolicy fromConfig(JsonObject review) {
        JsonObject config = review == null ? new JsonObject() : review;
        return new ReviewPolicy(
                config.getInteger("min-reviewers", DEFAULT_MIN_REVIEWERS),
                config.getInteger("max-reviewers", DEFAULT_MAX_REVIEWERS),
                config.getInteger("approval-threshold", DEFAULT_APPROVAL_THRESHOLD),
                Duration.ofHours(config.getLong("deadline-hours", DEFAULT_DEADLINE_HOURS)),
                config.getInteger("freeze-threshold", DEFAULT_FREEZE_THRESHOLD),
                Duration.ofMinutes(config.getLong("sweep-interval-minutes", DEFAULT_SWEEP_INTERVAL_MINUTES)),
                Duration.ofHours(config.getLong("upcoming-window-hours", DEFAULT_UPCOMING_WINDOW_HOURS)),
                config.getInteger("bulk-assign-limit", DEFAULT_BULK_ASSIGN_LIMIT)
        );
    }

    /**
     * Threshold for a pool of the given size: never more than the pool itself
     */
    public int thresholdFor(int selectedReviewers) {
        return Math.min(approvalThreshold, selectedReviewers);
    }
}
