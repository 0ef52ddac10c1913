package com.dsaflow.adapter.in.web.reactivation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for an administrator's answer to a reactivation request
 */
public record ReactivationDecisionRequest(String action, String adminNotes) {
    public static final String APPROVE = "approve";
    public static final String REJECT = "reject";

    @JsonCreator
    public ReactivationDecisionRequest(
            @JsonProperty("action") String action,
            @JsonProperty("adminNotes") String adminNotes
    ) {
        this.action = action;
        this.adminNotes = adminNotes;
    }

    public boolean isValidAction() {
        return APPROVE.equalsIgnoreCase(action) || REJECT.equalsIgnoreCase(action);
    }

    public boolean isApproval() {
        return APPROVE.equalsIgnoreCase(action);
    }
}
