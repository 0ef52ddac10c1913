package com.dsaflow.domain.model;

import com.dsaflow.support.TestData;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LoanApplication derived state
 */
class LoanApplicationTest {

    private static final Instant DEADLINE = TestData.T0.plus(Duration.ofHours(72));

    @Test
    void displayStatus_isPartiallyApprovedOnlyBetweenZeroAndThreshold() {
        LoanApplication application = TestData.underReview("app-1", 2, TestData.T0, DEADLINE, "r1", "r2", "r3");
        assertEquals("under_review", application.displayStatus());

        application.decisionOf("r1").orElseThrow().setVerdict(ReviewVerdict.APPROVED);
        assertEquals(LoanApplication.PARTIALLY_APPROVED_LABEL, application.displayStatus());
        // stored status is untouched
        assertEquals(ApplicationStatus.UNDER_REVIEW, application.getStatus());

        application.decisionOf("r2").orElseThrow().setVerdict(ReviewVerdict.APPROVED);
        assertEquals("under_review", application.displayStatus());
    }

    @Test
    void displayStatus_terminalStatusesAreShownAsStored() {
        LoanApplication application = TestData.underReview("app-1", 2, TestData.T0, DEADLINE, "r1", "r2");
        application.decisionOf("r1").orElseThrow().setVerdict(ReviewVerdict.APPROVED);
        application.setStatus(ApplicationStatus.NEEDS_ADMIN_DECISION);

        assertEquals("needs_admin_decision", application.displayStatus());
    }

    @Test
    void deadlinePassed_onlyStrictlyAfterDeadline() {
        LoanApplication application = TestData.underReview("app-1", 2, TestData.T0, DEADLINE, "r1", "r2");

        assertFalse(application.isDeadlinePassed(DEADLINE.minusSeconds(1)));
        assertFalse(application.isDeadlinePassed(DEADLINE));
        assertTrue(application.isDeadlinePassed(DEADLINE.plusMillis(1)));
    }

    @Test
    void pendingReviewerIds_followAssignmentOrder() {
        LoanApplication application = TestData.underReview("app-1", 2, TestData.T0, DEADLINE, "r3", "r1", "r2");
        application.decisionOf("r1").orElseThrow().setVerdict(ReviewVerdict.REJECTED);

        assertEquals(List.of("r3", "r2"), application.pendingReviewerIds());
        assertTrue(application.hasPendingDecisions());
        assertFalse(application.allDecisionsPending());
        assertEquals(1, application.countVerdicts(ReviewVerdict.REJECTED));
    }

    @Test
    void clearAssignment_dropsReviewCycle() {
        LoanApplication application = TestData.underReview("app-1", 2, TestData.T0, DEADLINE, "r1", "r2");

        application.clearAssignment();

        assertTrue(application.getAssignedReviewers().isEmpty());
        assertTrue(application.getReviewDecisions().isEmpty());
        assertEquals(0, application.getApprovalThreshold());
        assertNull(application.getReviewDeadline());
        assertNull(application.getAssignedAt());
    }

    @Test
    void copy_isIndependentOfOriginal() {
        LoanApplication original = TestData.underReview("app-1", 2, TestData.T0, DEADLINE, "r1", "r2");
        LoanApplication copy = original.copy();

        copy.decisionOf("r1").orElseThrow().setVerdict(ReviewVerdict.APPROVED);
        copy.getAssignedReviewers().add("r9");
        copy.appendAudit(AuditAction.DECISION_RECORDED, "r1", TestData.T0, null);

        assertTrue(original.decisionOf("r1").orElseThrow().isPending());
        assertFalse(original.isAssignedTo("r9"));
        assertTrue(original.getAuditTrail().isEmpty());
    }

    @Test
    void appendAudit_recordsCurrentStatus() {
        LoanApplication application = TestData.pendingApplication("app-1", TestData.T0);
        application.setStatus(ApplicationStatus.UNDER_REVIEW);

        application.appendAudit(AuditAction.ASSIGNED, "admin-1", TestData.T0, "note");

        ReviewAuditEntry entry = application.getAuditTrail().get(0);
        assertEquals(AuditAction.ASSIGNED, entry.getAction());
        assertEquals(ApplicationStatus.UNDER_REVIEW, entry.getResultingStatus());
        assertEquals("admin-1", entry.getActorId());
    }
}
