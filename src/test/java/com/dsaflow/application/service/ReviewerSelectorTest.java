package com.dsaflow.application.service;

import com.dsaflow.domain.model.Reviewer;
import com.dsaflow.support.TestData;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ReviewerSelectorTest {

    private final List<Reviewer> pool = IntStream.rangeClosed(1, 6)
            .mapToObj(i -> TestData.activeReviewer("r" + i))
            .collect(Collectors.toList());

    @Test
    void select_staysWithinBoundsWithoutDuplicates() {
        ReviewerSelector selector = new ReviewerSelector(new Random(3));

        for (int i = 0; i < 50; i++) {
            List<Reviewer> selected = selector.select(pool, 2, 3);

            assertTrue(selected.size() >= 2 && selected.size() <= 3, "size " + selected.size());
            Set<String> ids = selected.stream().map(Reviewer::getId).collect(Collectors.toSet());
            assertEquals(selected.size(), ids.size());
        }
    }

    @Test
    void select_isCappedByPoolSize() {
        ReviewerSelector selector = new ReviewerSelector(new Random(3));

        assertEquals(2, selector.select(pool.subList(0, 2), 2, 3).size());
    }

    @Test
    void select_reachesEveryReviewer() {
        ReviewerSelector selector = new ReviewerSelector(new Random(11));
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 100; i++) {
            selector.select(pool, 2, 3).forEach(reviewer -> seen.add(reviewer.getId()));
        }

        assertEquals(6, seen.size());
    }

    @Test
    void select_leavesPoolUntouched() {
        List<Reviewer> copy = List.copyOf(pool);

        new ReviewerSelector(new Random(5)).select(pool, 2, 3);

        assertEquals(copy, pool);
    }
}
