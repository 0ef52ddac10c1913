package com.dsaflow.application.port.in;

import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.LoanApplication;
import com.dsaflow.domain.model.Reviewer;
import io.vertx.core.Future;

/**
 * Inbound port - creation of reviewers and applications entering the workflow
 */
public interface RegistrationUseCase {

    /**
     * Create a reviewer account, active and verified by the calling administrator
     */
    Future<Reviewer> registerReviewer(CallerIdentity caller, RegisterReviewerCommand command);

    /**
     * Create a pending application. Applicants register for themselves, administrators on behalf of one.
     */
    Future<LoanApplication> registerApplication(CallerIdentity caller, String applicantId);

    record RegisterReviewerCommand(String name, String email, String phone) {}
}
