package com.dsaflow.application.port.in;

import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.ReactivationRequest;
import io.vertx.core.Future;

import java.util.Optional;

/**
 * Inbound port - frozen reviewers petitioning for reinstatement
 */
public interface ReactivationUseCase {

    /**
     * File a reactivation request for the calling (frozen) reviewer
     * @return Future with the stored pending request
     */
    Future<ReactivationRequest> request(CallerIdentity caller, String reason, String clarification);

    /**
     * Approve or reject a reviewer's pending request
     * @param caller administrator deciding
     * @return Future with the request in its terminal status
     */
    Future<ReactivationRequest> decide(CallerIdentity caller, String reviewerId, boolean approve, String notes);

    /**
     * Latest request filed by the calling reviewer
     */
    Future<Optional<ReactivationRequest>> myRequest(CallerIdentity caller);
}
