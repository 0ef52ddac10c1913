package com.dsaflow.adapter.out.persistence;

import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.model.ApplicationStatus;
import com.dsaflow.domain.model.LoanApplication;
import com.dsaflow.domain.model.ReviewVerdict;
import com.dsaflow.support.TestData;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.dsaflow.support.FutureAwait.await;
import static com.dsaflow.support.FutureAwait.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for InMemoryApplicationAdapter
 */
class InMemoryApplicationAdapterTest {

    private static final Instant T0 = TestData.T0;

    private InMemoryApplicationAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new InMemoryApplicationAdapter();
    }

    private static List<String> ids(List<LoanApplication> applications) {
        return applications.stream().map(LoanApplication::getId).collect(Collectors.toList());
    }

    @Test
    void update_bumpsVersionAndRejectsStaleWrites() {
        // Given
        await(adapter.insert(TestData.pendingApplication("app-1", T0)));
        LoanApplication first = await(adapter.findById("app-1")).orElseThrow();
        LoanApplication second = await(adapter.findById("app-1")).orElseThrow();

        // When
        first.setStatus(ApplicationStatus.UNDER_REVIEW);
        LoanApplication saved = await(adapter.update(first));
        second.setStatus(ApplicationStatus.REJECTED);
        Future<LoanApplication> stale = adapter.update(second);

        // Then
        assertEquals(1, saved.getVersion());
        awaitFailure(stale, ErrorCode.CONCURRENT_UPDATE);
        assertEquals(ApplicationStatus.UNDER_REVIEW, await(adapter.findById("app-1")).orElseThrow().getStatus());
    }

    @Test
    void update_unknownApplicationFailsNotFound() {
        awaitFailure(adapter.update(TestData.pendingApplication("ghost", T0)), ErrorCode.NOT_FOUND);
    }

    @Test
    void findById_returnsIsolatedCopies() {
        await(adapter.insert(TestData.underReview("app-1", 2, T0, T0.plus(Duration.ofHours(72)), "r1", "r2")));

        LoanApplication copy = await(adapter.findById("app-1")).orElseThrow();
        copy.getReviewDecisions().get(0).setVerdict(ReviewVerdict.APPROVED);
        copy.getAssignedReviewers().clear();

        LoanApplication stored = await(adapter.findById("app-1")).orElseThrow();
        assertTrue(stored.allDecisionsPending());
        assertEquals(2, stored.getAssignedReviewers().size());
    }

    @Test
    void insert_duplicateIdFails() {
        await(adapter.insert(TestData.pendingApplication("app-1", T0)));

        assertNotNull(awaitFailure(adapter.insert(TestData.pendingApplication("app-1", T0))));
    }

    @Test
    void findExpiredUnderReview_ordersByDeadlineAndSkipsFullyDecided() {
        Instant now = T0.plus(Duration.ofDays(10));
        await(adapter.insert(TestData.underReview("later", 2, T0, T0.plus(Duration.ofDays(4)), "r1", "r2")));
        await(adapter.insert(TestData.underReview("earlier", 2, T0, T0.plus(Duration.ofDays(3)), "r1", "r2")));
        await(adapter.insert(TestData.underReview("future", 2, T0, now.plusSeconds(1), "r1", "r2")));
        LoanApplication decided = TestData.underReview("decided", 2, T0, T0.plus(Duration.ofDays(1)), "r1");
        decided.getReviewDecisions().get(0).setVerdict(ReviewVerdict.APPROVED);
        await(adapter.insert(decided));

        assertEquals(List.of("earlier", "later"), ids(await(adapter.findExpiredUnderReview(now))));
    }

    @Test
    void findUnassignedPending_oldestFirstWithLimit() {
        await(adapter.insert(TestData.pendingApplication("c", T0.plusSeconds(30))));
        await(adapter.insert(TestData.pendingApplication("a", T0.plusSeconds(10))));
        await(adapter.insert(TestData.pendingApplication("b", T0.plusSeconds(20))));
        await(adapter.insert(TestData.underReview("busy", 2, T0, T0.plus(Duration.ofHours(72)), "r1", "r2")));

        assertEquals(List.of("a", "b"), ids(await(adapter.findUnassignedPending(2))));
    }

    @Test
    void findOpenAssignmentsFor_onlyPendingSlotsBeforeDeadline() {
        Instant deadline = T0.plus(Duration.ofHours(72));
        await(adapter.insert(TestData.underReview("second", 2, T0.plusSeconds(60), deadline, "r1", "r2")));
        await(adapter.insert(TestData.underReview("first", 2, T0, deadline, "r1", "r2")));
        await(adapter.insert(TestData.underReview("other", 2, T0, deadline, "r2", "r3")));

        assertEquals(List.of("first", "second"), ids(await(adapter.findOpenAssignmentsFor("r1", T0))));
        assertTrue(await(adapter.findOpenAssignmentsFor("r1", deadline.plusSeconds(1))).isEmpty());
    }

    @Test
    void countByStatus_groupsApplications() {
        await(adapter.insert(TestData.pendingApplication("p1", T0)));
        await(adapter.insert(TestData.pendingApplication("p2", T0)));
        await(adapter.insert(TestData.underReview("u1", 2, T0, T0.plus(Duration.ofHours(72)), "r1", "r2")));

        Map<ApplicationStatus, Long> counts = await(adapter.countByStatus());

        assertEquals(2L, counts.get(ApplicationStatus.PENDING));
        assertEquals(1L, counts.get(ApplicationStatus.UNDER_REVIEW));
        assertFalse(counts.containsKey(ApplicationStatus.APPROVED));
    }
}
