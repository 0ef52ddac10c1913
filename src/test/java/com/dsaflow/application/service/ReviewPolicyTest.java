package com.dsaflow.application.service;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReviewPolicyTest {

    @Test
    void defaults_matchWorkflowConstants() {
        ReviewPolicy policy = ReviewPolicy.defaults();

        assertEquals(2, policy.minReviewers());
        assertEquals(3, policy.maxReviewers());
        assertEquals(2, policy.approvalThreshold());
        assertEquals(Duration.ofHours(72), policy.reviewWindow());
        assertEquals(3, policy.freezeThreshold());
        assertEquals(Duration.ofMinutes(5), policy.sweepInterval());
    }

    @Test
    void fromConfig_readsReviewSection() {
        JsonObject review = new JsonObject()
                .put("min-reviewers", 3)
                .put("max-reviewers", 5)
                .put("approval-threshold", 3)
                .put("deadline-hours", 48)
                .put("freeze-threshold", 2)
                .put("sweep-interval-minutes", 1)
                .put("upcoming-window-hours", 12)
                .put("bulk-assign-limit", 50);

        ReviewPolicy policy = ReviewPolicy.fromConfig(review);

        assertEquals(5, policy.maxReviewers());
        assertEquals(Duration.ofHours(48), policy.reviewWindow());
        assertEquals(2, policy.freezeThreshold());
        assertEquals(Duration.ofHours(12), policy.upcomingWindow());
        assertEquals(50, policy.bulkAssignLimit());
    }

    @Test
    void missingSection_fallsBackToDefaults() {
        assertEquals(ReviewPolicy.defaults(), ReviewPolicy.fromConfig(null));
    }

    @Test
    void thresholdFor_neverExceedsPool() {
        ReviewPolicy policy = ReviewPolicy.defaults();

        assertEquals(2, policy.thresholdFor(3));
        assertEquals(2, policy.thresholdFor(2));
        assertEquals(1, policy.thresholdFor(1));
    }

    @Test
    void invalidBounds_areRejected() {
        JsonObject review = new JsonObject().put("min-reviewers", 4).put("max-reviewers", 3);

        assertThrows(IllegalArgumentException.class, () -> ReviewPolicy.fromConfig(review));
        assertThrows(IllegalArgumentException.class,
                () -> ReviewPolicy.fromConfig(new JsonObject().put("freeze-threshold", 0)));
    }
}
