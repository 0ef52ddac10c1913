package com.dsaflow.adapter.in.web.assignment;

import com.dsaflow.adapter.in.web.RequestSupport;
import com.dsaflow.adapter.in.web.WebResponses;
import com.dsaflow.application.port.in.AssignmentUseCase;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * Handles POST /api/admin/applications/:id/assign and POST /api/admin/applications/assign-pending
 */
@RequiredArgsConstructor
public class AssignmentHandler {

    private final AssignmentUseCase assignmentUseCase;

    public void assign(RoutingContext context) {
        String applicationId = context.pathParam("id");

        RequestSupport.caller(context).ifPresent(caller ->
                assignmentUseCase.assign(caller, applicationId)
                        .onSuccess(result -> WebResponses.ok(context, result))
                        .onFailure(error -> WebResponses.fail(context, error)));
    }

    public void assignPending(RoutingContext context) {
        RequestSupport.caller(context).ifPresent(caller ->
                assignmentUseCase.assignPending(caller)
                        .onSuccess(result -> WebResponses.ok(context, result))
                        .onFailure(error -> WebResponses.fail(context, error)));
    }
}
