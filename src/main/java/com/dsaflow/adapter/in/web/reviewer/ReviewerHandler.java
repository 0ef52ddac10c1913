package com.dsaflow.adapter.in.web.reviewer;

import com.dsaflow.adapter.in.web.RequestSupport;
import com.dsaflow.adapter.in.web.WebResponses;
import com.dsaflow.application.port.in.ReviewQueryUseCase;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * Reviewer-facing and admin dashboards:
 * GET /api/reviewers/:id/statistics, GET /api/dsa/next-application, GET /api/admin/assignment-statistics
 */
@RequiredArgsConstructor
public class ReviewerHandler {

    private final ReviewQueryUseCase queryUseCase;

    public void statistics(RoutingContext context) {
        String reviewerId = context.pathParam("id");

        RequestSupport.caller(context).ifPresent(caller ->
                queryUseCase.getReviewerStatistics(caller, reviewerId)
                        .onSuccess(statistics -> WebResponses.ok(context, statistics))
                        .onFailure(error -> WebResponses.fail(context, error)));
    }

    public void nextApplication(RoutingContext context) {
        RequestSupport.caller(context).ifPresent(caller ->
                queryUseCase.nextApplication(caller)
                        .onSuccess(next -> WebResponses.ok(context, next.orElse(null)))
                        .onFailure(error -> WebResponses.fail(context, error)));
    }

    public void assignmentStatistics(RoutingContext context) {
        RequestSupport.caller(context).ifPresent(caller ->
                queryUseCase.assignmentStatistics(caller)
                        .onSuccess(statistics -> WebResponses.ok(context, statistics))
                        .onFailure(error -> WebResponses.fail(context, error)));
    }
}
