package com.dsaflow.adapter.in.web.reactivation;

import com.dsaflow.adapter.in.web.RequestSupport;
import com.dsaflow.adapter.in.web.WebResponses;
import com.dsaflow.application.port.in.ReactivationUseCase;
import com.dsaflow.application.port.in.ReviewQueryUseCase;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * HTTP handlers for the reactivation workflow:
 * POST/GET /api/dsa/reactivation-request, GET /api/admin/reactivation-requests,
 * POST /api/admin/reactivation-requests/:reviewerId/decision
 */
@RequiredArgsConstructor
public class ReactivationHandler {

    private final ReactivationUseCase reactivationUseCase;
    private final ReviewQueryUseCase queryUseCase;

    public void submit(RoutingContext context) {
        RequestSupport.caller(context).ifPresent(caller ->
                RequestSupport.body(context, ReactivationSubmitRequest.class).ifPresent(request ->
                        reactivationUseCase.request(caller, request.reason(), request.clarification())
                                .onSuccess(pending -> WebResponses.created(context, pending))
                                .onFailure(error -> WebResponses.fail(context, error))));
    }

    public void myRequest(RoutingContext context) {
        RequestSupport.caller(context).ifPresent(caller ->
                reactivationUseCase.myRequest(caller)
                        .onSuccess(request -> WebResponses.ok(context, request.orElse(null)))
                        .onFailure(error -> WebResponses.fail(context, error)));
    }

    public void listPending(RoutingContext context) {
        RequestSupport.caller(context).ifPresent(caller ->
                queryUseCase.getPendingReactivationRequests(caller)
                        .onSuccess(pending -> WebResponses.ok(context, pending))
                        .onFailure(error -> WebResponses.fail(context, error)));
    }

    public void decide(RoutingContext context) {
        String reviewerId = context.pathParam("reviewerId");

        RequestSupport.caller(context).ifPresent(caller ->
                RequestSupport.body(context, ReactivationDecisionRequest.class).ifPresent(request -> {
                    if (!request.isValidAction()) {
                        WebResponses.badRequest(context, "action must be approve or reject");
                        return;
                    }
                    reactivationUseCase.decide(caller, reviewerId, request.isApproval(), request.adminNotes())
                            .onSuccess(decided -> WebResponses.ok(context, decided))
                            .onFailure(error -> WebResponses.fail(context, error));
                }));
    }
}
