package com.dsaflow.application.service;

import com.dsaflow.application.port.in.ReviewDecisionUseCase.EscalationResolution;
import com.dsaflow.application.port.in.ReviewDecisionUseCase.SubmitDecisionCommand;
import com.dsaflow.application.port.out.ReviewerRepository;
import com.dsaflow.domain.event.ReviewEventType;
import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.exception.WorkflowException;
import com.dsaflow.domain.model.ApplicationStatus;
import com.dsaflow.domain.model.AuditAction;
import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.LoanApplication;
import com.dsaflow.domain.model.ReviewAuditEntry;
import com.dsaflow.domain.model.ReviewVerdict;
import com.dsaflow.domain.model.Reviewer;
import com.dsaflow.support.TestData;
import com.dsaflow.support.WorkflowFixture;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.dsaflow.support.FutureAwait.await;
import static com.dsaflow.support.FutureAwait.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class ReviewDecisionServiceTest {

    private static final Instant DEADLINE = TestData.T0.plus(Duration.ofHours(72));
    private static final CallerIdentity ADMIN = CallerIdentity.admin("admin-1");

    private WorkflowFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new WorkflowFixture();
        fixture.addReviewer(TestData.activeReviewer("r1"));
        fixture.addReviewer(TestData.activeReviewer("r2"));
        fixture.addReviewer(TestData.activeReviewer("r3"));
        fixture.addReviewer(TestData.activeReviewer("r4"));
        fixture.addApplication(TestData.underReview("app-1", 2, TestData.T0, DEADLINE, "r1", "r2", "r3"));
        fixture.clock.advance(Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private Future<LoanApplication> submit(String reviewerId, ReviewVerdict verdict, String comment) {
        return fixture.decisions.submitDecision(CallerIdentity.reviewer(reviewerId),
                new SubmitDecisionCommand("app-1", reviewerId, verdict, comment));
    }

    @Test
    void twoApprovalsOfThree_approveApplication() {
        LoanApplication afterFirst = await(submit("r1", ReviewVerdict.APPROVED, "looks fine"));

        assertEquals(ApplicationStatus.UNDER_REVIEW, afterFirst.getStatus());
        assertEquals(LoanApplication.PARTIALLY_APPROVED_LABEL, afterFirst.displayStatus());

        LoanApplication afterSecond = await(submit("r2", ReviewVerdict.APPROVED, null));

        assertEquals(ApplicationStatus.APPROVED, afterSecond.getStatus());
        assertEquals("r2", afterSecond.getApprovedBy());
        assertEquals(fixture.clock.instant(), afterSecond.getApprovedAt());
        assertEquals(2, afterSecond.countVerdicts(ReviewVerdict.APPROVED));
        assertEquals(List.of("r3"), afterSecond.pendingReviewerIds());

        awaitFailure(submit("r3", ReviewVerdict.APPROVED, "late"), ErrorCode.INVALID_STATE);

        assertEquals(1, fixture.reviewer("r1").getApprovedCount());
        assertEquals(1, fixture.reviewer("r2").getTotalReviewed());
        assertEquals(0, fixture.reviewer("r3").getTotalReviewed());
        assertEquals(List.of(
                ReviewEventType.DECISION_RECORDED,
                ReviewEventType.DECISION_RECORDED,
                ReviewEventType.APPLICATION_APPROVED), fixture.publishedTypes());
    }

    @Test
    void firstRejection_isTerminal() {
        LoanApplication rejected = await(submit("r1", ReviewVerdict.REJECTED, "income not verifiable"));

        assertEquals(ApplicationStatus.REJECTED, rejected.getStatus());
        assertEquals("r1", rejected.getRejectedBy());
        assertEquals("income not verifiable", rejected.getRejectionReason());
        assertNotNull(rejected.getRejectedAt());

        WorkflowException late = awaitFailure(submit("r2", ReviewVerdict.APPROVED, null), ErrorCode.INVALID_STATE);
        assertTrue(late.getMessage().contains("already rejected"), late.getMessage());

        LoanApplication stored = fixture.application("app-1");
        assertEquals(ApplicationStatus.REJECTED, stored.getStatus());
        assertTrue(stored.decisionOf("r2").orElseThrow().isPending());
        assertEquals(1, fixture.reviewer("r1").getRejectedCount());
    }

    @Test
    void approvalAfterApprovalThenRejection_rejects() {
        await(submit("r1", ReviewVerdict.APPROVED, null));
        LoanApplication result = await(submit("r2", ReviewVerdict.REJECTED, "collateral missing"));

        assertEquals(ApplicationStatus.REJECTED, result.getStatus());
        assertEquals("rejected", result.displayStatus());
    }

    @Test
    void thresholdOfOne_approvesOnFirstApproval() {
        fixture.addApplication(TestData.underReview("app-2", 1, TestData.T0, DEADLINE, "r1", "r2"));

        LoanApplication result = await(fixture.decisions.submitDecision(CallerIdentity.reviewer("r1"),
                new SubmitDecisionCommand("app-2", "r1", ReviewVerdict.APPROVED, null)));

        assertEquals(ApplicationStatus.APPROVED, result.getStatus());
    }

    @Test
    void secondSubmissionBySameReviewer_failsAlreadyReviewed() {
        await(submit("r1", ReviewVerdict.APPROVED, null));

        awaitFailure(submit("r1", ReviewVerdict.REJECTED, "changed my mind"), ErrorCode.ALREADY_REVIEWED);

        LoanApplication stored = fixture.application("app-1");
        assertEquals(ReviewVerdict.APPROVED, stored.decisionOf("r1").orElseThrow().getVerdict());
        assertEquals(ApplicationStatus.UNDER_REVIEW, stored.getStatus());
    }

    @Test
    void frozenReviewer_failsAccountFrozen() {
        await(fixture.directory.freeze("r1"));

        awaitFailure(submit("r1", ReviewVerdict.APPROVED, null), ErrorCode.ACCOUNT_FROZEN);
        assertTrue(fixture.application("app-1").decisionOf("r1").orElseThrow().isPending());
    }

    @Test
    void unknownReviewer_failsNotFound() {
        WorkflowException error = awaitFailure(fixture.decisions.submitDecision(CallerIdentity.reviewer("ghost"),
                new SubmitDecisionCommand("app-1", "ghost", ReviewVerdict.APPROVED, null)), ErrorCode.NOT_FOUND);

        assertTrue(error.getMessage().contains("ghost"));
        assertTrue(fixture.application("app-1").allDecisionsPending());
    }

    @Test
    void failedStatisticsUpdate_keepsStoredDecisionAndSucceeds() {
        // given
        ReviewerRepository reviewers = spy(fixture.reviewerRepository);
        doReturn(Future.failedFuture(new IllegalStateException("db down")))
                .when(reviewers).recordOutcome(anyString(), any(), any());
        ReviewDecisionService decisions = new ReviewDecisionService(fixture.applicationRepository,
                new ReviewerDirectory(reviewers, fixture.policy, fixture.clock), fixture.locks,
                fixture.eventPublisher, fixture.clock);

        // when
        LoanApplication result = await(decisions.submitDecision(CallerIdentity.reviewer("r1"),
                new SubmitDecisionCommand("app-1", "r1", ReviewVerdict.APPROVED, "looks fine")));

        // then
        assertEquals(ReviewVerdict.APPROVED, result.decisionOf("r1").orElseThrow().getVerdict());
        assertEquals(ReviewVerdict.APPROVED, fixture.application("app-1").decisionOf("r1").orElseThrow().getVerdict());
        assertEquals(0, fixture.reviewer("r1").getTotalReviewed());
        assertTrue(fixture.publishedTypes().contains(ReviewEventType.DECISION_RECORDED));
        awaitFailure(decisions.submitDecision(CallerIdentity.reviewer("r1"),
                new SubmitDecisionCommand("app-1", "r1", ReviewVerdict.APPROVED, null)), ErrorCode.ALREADY_REVIEWED);
    }

    @Test
    void afterDeadline_failsDeadlineExpired() {
        fixture.clock.set(DEADLINE.plusSeconds(1));

        awaitFailure(submit("r1", ReviewVerdict.APPROVED, null), ErrorCode.DEADLINE_EXPIRED);
        assertTrue(fixture.application("app-1").allDecisionsPending());
    }

    @Test
    void exactlyAtDeadline_isAccepted() {
        fixture.clock.set(DEADLINE);

        LoanApplication result = await(submit("r1", ReviewVerdict.APPROVED, null));

        assertEquals(ReviewVerdict.APPROVED, result.decisionOf("r1").orElseThrow().getVerdict());
    }

    @Test
    void unassignedReviewer_failsNotAssigned() {
        WorkflowException error = awaitFailure(fixture.decisions.submitDecision(CallerIdentity.reviewer("r4"),
                new SubmitDecisionCommand("app-1", "r4", ReviewVerdict.APPROVED, null)), ErrorCode.NOT_ASSIGNED);

        assertTrue(error.getMessage().contains("r4"));
    }

    @Test
    void submittingForAnotherReviewer_isForbidden() {
        awaitFailure(fixture.decisions.submitDecision(CallerIdentity.reviewer("r2"),
                new SubmitDecisionCommand("app-1", "r1", ReviewVerdict.APPROVED, null)), ErrorCode.FORBIDDEN);
        awaitFailure(fixture.decisions.submitDecision(ADMIN,
                new SubmitDecisionCommand("app-1", "admin-1", ReviewVerdict.APPROVED, null)), ErrorCode.FORBIDDEN);
    }

    @Test
    void pendingVerdict_failsInvalidInput() {
        awaitFailure(submit("r1", ReviewVerdict.PENDING, null), ErrorCode.INVALID_INPUT);
        awaitFailure(submit("r1", null, null), ErrorCode.INVALID_INPUT);
    }

    @Test
    void unknownApplication_failsNotFound() {
        awaitFailure(fixture.decisions.submitDecision(CallerIdentity.reviewer("r1"),
                new SubmitDecisionCommand("missing", "r1", ReviewVerdict.APPROVED, null)), ErrorCode.NOT_FOUND);
    }

    @Test
    void auditTrail_recordsDecisionAndOutcome() {
        await(submit("r1", ReviewVerdict.APPROVED, null));
        await(submit("r3", ReviewVerdict.APPROVED, null));

        List<AuditAction> actions = fixture.application("app-1").getAuditTrail().stream()
                .map(ReviewAuditEntry::getAction)
                .collect(Collectors.toList());
        assertEquals(List.of(AuditAction.DECISION_RECORDED, AuditAction.DECISION_RECORDED, AuditAction.APPROVED), actions);
    }

    @Test
    void concurrentApprovals_onlyThresholdManySucceed() {
        List<Future<LoanApplication>> attempts = new ArrayList<>();
        for (String reviewerId : List.of("r1", "r2", "r3")) {
            attempts.add(submit(reviewerId, ReviewVerdict.APPROVED, null));
        }

        int succeeded = 0;
        int invalidState = 0;
        for (Future<LoanApplication> attempt : attempts) {
            try {
                await(attempt);
                succeeded++;
            } catch (AssertionError e) {
                assertTrue(WorkflowException.hasCode(e.getCause(), ErrorCode.INVALID_STATE), String.valueOf(e.getCause()));
                invalidState++;
            }
        }

        assertEquals(2, succeeded);
        assertEquals(1, invalidState);
        LoanApplication stored = fixture.application("app-1");
        assertEquals(ApplicationStatus.APPROVED, stored.getStatus());
        assertEquals(2, stored.countVerdicts(ReviewVerdict.APPROVED));
        long totalReviewed = List.of("r1", "r2", "r3").stream()
                .map(fixture::reviewer)
                .mapToLong(Reviewer::getTotalReviewed)
                .sum();
        assertEquals(2, totalReviewed);
    }

    @Test
    void resolveEscalation_approveRejectReassign() {
        LoanApplication escalated = TestData.underReview("esc-1", 2, TestData.T0, DEADLINE, "r1", "r2");
        escalated.setStatus(ApplicationStatus.NEEDS_ADMIN_DECISION);
        fixture.addApplication(escalated);
        fixture.addApplication(escalated.toBuilder().id("esc-2").build().copy());
        fixture.addApplication(escalated.toBuilder().id("esc-3").build().copy());

        LoanApplication approved = await(fixture.decisions.resolveEscalation(ADMIN, "esc-1", EscalationResolution.APPROVE, null));
        LoanApplication rejected = await(fixture.decisions.resolveEscalation(ADMIN, "esc-2", EscalationResolution.REJECT, "stale review"));
        LoanApplication reassigned = await(fixture.decisions.resolveEscalation(ADMIN, "esc-3", EscalationResolution.REASSIGN, null));

        assertEquals(ApplicationStatus.APPROVED, approved.getStatus());
        assertEquals("admin-1", approved.getApprovedBy());
        assertEquals(ApplicationStatus.REJECTED, rejected.getStatus());
        assertEquals("stale review", rejected.getRejectionReason());
        assertEquals(ApplicationStatus.PENDING, reassigned.getStatus());
        assertTrue(reassigned.getAssignedReviewers().isEmpty());
        assertNull(reassigned.getReviewDeadline());
        assertEquals(AuditAction.ESCALATION_RESOLVED,
                reassigned.getAuditTrail().get(reassigned.getAuditTrail().size() - 1).getAction());
    }

    @Test
    void resolveEscalation_requiresEscalatedApplicationAndAdmin() {
        awaitFailure(fixture.decisions.resolveEscalation(ADMIN, "app-1", EscalationResolution.APPROVE, null),
                ErrorCode.INVALID_STATE);
        awaitFailure(fixture.decisions.resolveEscalation(CallerIdentity.reviewer("r1"), "app-1",
                EscalationResolution.APPROVE, null), ErrorCode.FORBIDDEN);
    }
}
