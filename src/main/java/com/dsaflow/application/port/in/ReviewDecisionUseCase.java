package com.dsaflow.application.port.in;

import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.LoanApplication;
import com.dsaflow.domain.model.ReviewVerdict;
import io.vertx.core.Future;

/**
 * Inbound port - the review state machine
 */
public interface ReviewDecisionUseCase {

    /**
     * Record one reviewer's decision and re-evaluate the application against its threshold
     * @param caller the reviewer submitting (must match command.reviewerId)
     * @param command decision to record
     * @return Future with the updated application
     */
    Future<LoanApplication> submitDecision(CallerIdentity caller, SubmitDecisionCommand command);

    /**
     * Settle an application escalated by the deadline sweep
     * @param caller administrator
     * @param applicationId escalated application
     * @param resolution approve, reject or send back for reassignment
     * @param notes recorded on the audit trail (and as rejection reason)
     */
    Future<LoanApplication> resolveEscalation(
            CallerIdentity caller,
            String applicationId,
            EscalationResolution resolution,
            String notes
    );

    record SubmitDecisionCommand(
            String applicationId,
            String reviewerId,
            ReviewVerdict verdict,
            String comment
    ) {}

    enum EscalationResolution {
        APPROVE,
        REJECT,
        REASSIGN;

        public static EscalationResolution fromValue(String value) {
            for (EscalationResolution resolution : values()) {
                if (resolution.name().equalsIgnoreCase(value)) {
                    return resolution;
                }
            }
            throw new IllegalArgumentException("Unknown escalation resolution: " + value);
        }
    }
}
