package com.dsaflow.adapter.in.web.review;

import com.dsaflow.adapter.in.web.RequestSupport;
import com.dsaflow.adapter.in.web.WebResponses;
import com.dsaflow.application.port.in.ReviewDecisionUseCase;
import com.dsaflow.application.port.in.ReviewDecisionUseCase.EscalationResolution;
import com.dsaflow.application.port.in.ReviewDecisionUseCase.SubmitDecisionCommand;
import com.dsaflow.application.port.in.ReviewQueryUseCase;
import com.dsaflow.domain.model.ReviewVerdict;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * HTTP handlers for the review state machine:
 * POST /api/applications/:id/decisions, GET /api/applications/:id/review-status,
 * POST /api/admin/applications/:id/escalation
 */
@RequiredArgsConstructor
public class ReviewHandler {

    private final ReviewDecisionUseCase decisionUseCase;
    private final ReviewQueryUseCase queryUseCase;

    public void submitDecision(RoutingContext context) {
        String applicationId = context.pathParam("id");

        RequestSupport.caller(context).ifPresent(caller ->
                RequestSupport.body(context, SubmitDecisionRequest.class).ifPresent(request -> {
                    if (request.decision() == null || !ReviewVerdict.isValid(request.decision())
                            || !ReviewVerdict.fromValue(request.decision()).isDecided()) {
                        WebResponses.badRequest(context, "decision must be approved or rejected");
                        return;
                    }

                    SubmitDecisionCommand command = new SubmitDecisionCommand(
                            applicationId,
                            caller.callerId(),
                            ReviewVerdict.fromValue(request.decision()),
                            request.comment()
                    );

                    decisionUseCase.submitDecision(caller, command)
                            .compose(updated -> queryUseCase.getApplicationReviewStatus(caller, updated.getId()))
                            .onSuccess(status -> WebResponses.ok(context, status))
                            .onFailure(error -> WebResponses.fail(context, error));
                }));
    }

    public void reviewStatus(RoutingContext context) {
        String applicationId = context.pathParam("id");

        RequestSupport.caller(context).ifPresent(caller ->
                queryUseCase.getApplicationReviewStatus(caller, applicationId)
                        .onSuccess(status -> WebResponses.ok(context, status))
                        .onFailure(error -> WebResponses.fail(context, error)));
    }

    public void resolveEscalation(RoutingContext context) {
        String applicationId = context.pathParam("id");

        RequestSupport.caller(context).ifPresent(caller ->
                RequestSupport.body(context, EscalationRequest.class).ifPresent(request -> {
                    EscalationResolution resolution;
                    try {
                        resolution = EscalationResolution.fromValue(request.resolution());
                    } catch (IllegalArgumentException e) {
                        WebResponses.badRequest(context, "resolution must be one of approve, reject, reassign");
                        return;
                    }

                    decisionUseCase.resolveEscalation(caller, applicationId, resolution, request.notes())
                            .compose(updated -> queryUseCase.getApplicationReviewStatus(caller, updated.getId()))
                            .onSuccess(status -> WebResponses.ok(context, status))
                            .onFailure(error -> WebResponses.fail(context, error));
                }));
    }
}
