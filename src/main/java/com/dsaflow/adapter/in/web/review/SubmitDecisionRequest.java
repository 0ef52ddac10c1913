package com.dsaflow.adapter.in.web.review;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a reviewer's decision: approved or rejected, with an optional comment
 */
public record SubmitDecisionRequest(String decision, String comment) {
    @JsonCreator
    public SubmitDecisionRequest(
            @JsonProperty("decision") String decision,
            @JsonProperty("comment") String comment
    ) {
        this.decision = decision;
        this.comment = comment;
    }
}
