package com.dsaflow.adapter.in.web.registration;

import com.dsaflow.adapter.in.web.RequestSupport;
import com.dsaflow.adapter.in.web.WebResponses;
import com.dsaflow.application.port.in.RegistrationUseCase;
import com.dsaflow.application.port.in.RegistrationUseCase.RegisterReviewerCommand;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Handles POST /api/admin/reviewers and POST /api/applications
 */
@RequiredArgsConstructor
public class RegistrationHandler {

    private final RegistrationUseCase registrationUseCase;

    public void registerReviewer(RoutingContext context) {
        RequestSupport.caller(context).ifPresent(caller ->
                RequestSupport.body(context, RegisterReviewerRequest.class).ifPresent(request ->
                        registrationUseCase.registerReviewer(caller,
                                        new RegisterReviewerCommand(request.name(), request.email(), request.phone()))
                                .onSuccess(reviewer -> WebResponses.created(context, reviewer))
                                .onFailure(error -> WebResponses.fail(context, error))));
    }

    public void registerApplication(RoutingContext context) {
        RequestSupport.caller(context).ifPresent(caller -> {
            String applicantId = null;
            // applicants may post without a body
            if (context.body().length() > 0) {
                Optional<RegisterApplicationRequest> request = RequestSupport.body(context, RegisterApplicationRequest.class);
                if (request.isEmpty()) {
                    return;
                }
                applicantId = request.get().applicantId();
            }

            registrationUseCase.registerApplication(caller, applicantId)
                    .onSuccess(application -> WebResponses.created(context, application))
                    .onFailure(error -> WebResponses.fail(context, error));
        });
    }
}
