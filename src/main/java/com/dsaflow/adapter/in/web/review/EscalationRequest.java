package com.dsaflow.adapter.in.web.review;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for settling an escalated application: approve, reject or reassign
 */
public record EscalationRequest(String resolution, String notes) {
    @JsonCreator
    public EscalationRequest(
            @JsonProperty("resolution") String resolution,
            @JsonProperty("notes") String notes
    ) {
        this.resolution = resolution;
        this.notes = notes;
    }
}
