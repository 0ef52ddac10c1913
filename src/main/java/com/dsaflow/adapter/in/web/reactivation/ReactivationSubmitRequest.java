package com.dsaflow.adapter.in.web.reactivation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a frozen reviewer asking to be reactivated
 */
public record ReactivationSubmitRequest(String reason, String clarification) {
    @JsonCreator
    public ReactivationSubmitRequest(
            @JsonProperty("reason") String reason,
            @JsonProperty("clarification") String clarification
    ) {
        this.reason = reason;
        this.clarification = clarification;
    }
}
