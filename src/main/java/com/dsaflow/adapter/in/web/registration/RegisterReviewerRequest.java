package com.dsaflow.adapter.in.web.registration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for creating a reviewer account
 */
public record RegisterReviewerRequest(String name, String email, String phone) {
    @JsonCreator
    public RegisterReviewerRequest(
            @JsonProperty("name") String name,
            @JsonProperty("email") String email,
            @JsonProperty("phone") String phone
    ) {
        this.name = name;
        this.email = email;
        this.phone = phone;
    }
}
