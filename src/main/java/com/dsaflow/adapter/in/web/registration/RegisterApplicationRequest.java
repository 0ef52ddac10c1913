package com.dsaflow.adapter.in.web.registration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for entering an application into the workflow; applicantId is only read for administrators
 */
public record RegisterApplicationRequest(String applicantId) {
    @JsonCreator
    public RegisterApplicationRequest(@JsonProperty("applicantId") String applicantId) {
        this.applicantId = applicantId;
    }
}
