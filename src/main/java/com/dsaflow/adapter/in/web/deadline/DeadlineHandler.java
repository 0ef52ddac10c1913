package com.dsaflow.adapter.in.web.deadline;

import com.dsaflow.adapter.in.web.RequestSupport;
import com.dsaflow.adapter.in.web.WebResponses;
import com.dsaflow.application.port.in.DeadlineSweepUseCase;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.time.Clock;

/**
 * Handles POST /api/admin/deadlines/sweep and GET /api/admin/deadlines
 */
@RequiredArgsConstructor
public class DeadlineHandler {

    private final DeadlineSweepUseCase sweepUseCase;
    private final Clock clock;

    public void sweep(RoutingContext context) {
        RequestSupport.caller(context).ifPresent(caller ->
                sweepUseCase.sweep(caller, clock.instant())
                        .onSuccess(report -> WebResponses.ok(context, report))
                        .onFailure(error -> WebResponses.fail(context, error)));
    }

    public void overview(RoutingContext context) {
        RequestSupport.caller(context).ifPresent(caller ->
                sweepUseCase.deadlineOverview(caller)
                        .onSuccess(overview -> WebResponses.ok(context, overview))
                        .onFailure(error -> WebResponses.fail(context, error)));
    }
}
