package com.dsaflow.application.service;

import com.dsaflow.domain.model.Reviewer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Uniformly random reviewer pool selection. Each application is drawn independently;
 * there is no load balancing across reviewers.
 */
public class ReviewerSelector {

    private final Random random;

    public ReviewerSelector() {
        this(new Random());
    }

    public ReviewerSelector(Random random) {
        this.random = random;
    }

    /**
     * @return between min and max reviewers (inclusive), capped at the pool size, in selection order
     */
    public List<Reviewer> select(List<Reviewer> pool, int min, int max) {
        int wanted = min + random.nextInt(max - min + 1);
        int count = Math.min(wanted, pool.size());

        List<Reviewer> shuffled = new ArrayList<>(pool);
        Collections.shuffle(shuffled, random);
        return new ArrayList<>(shuffled.subList(0, count));
    }
}
