package com.dsaflow.application.service;

import com.dsaflow.domain.model.ReactivationRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates the text a frozen reviewer submits with a reactivation request.
 * Lengths are measured after trimming.
 */
public class ReactivationRequestValidator {

    private static final int MAX_TEXT_LENGTH = 2000;

    /**
     * @return one message per violated rule, empty when the request is acceptable
     */
    public List<String> validate(String reason, String clarification) {
        List<String> errors = new ArrayList<>();

        validateRequiredFields(reason, clarification, errors);
        validateLengths(reason, clarification, errors);

        return errors;
    }

    private void validateRequiredFields(String reason, String clarification, List<String> errors) {
        if (isBlank(reason)) {
            errors.add("reason is required");
        }
        if (isBlank(clarification)) {
            errors.add("clarification is required");
        }
    }

    private void validateLengths(String reason, String clarification, List<String> errors) {
        if (!isBlank(reason)) {
            int length = reason.trim().length();
            if (length < ReactivationRequest.MIN_REASON_LENGTH) {
                errors.add("reason must be at least " + ReactivationRequest.MIN_REASON_LENGTH + " characters");
            }
            if (length > MAX_TEXT_LENGTH) {
                errors.add("reason exceeds maximum length of " + MAX_TEXT_LENGTH + " characters");
            }
        }
        if (!isBlank(clarification)) {
            int length = clarification.trim().length();
            if (length < ReactivationRequest.MIN_CLARIFICATION_LENGTH) {
                errors.add("clarification must be at least " + ReactivationRequest.MIN_CLARIFICATION_LENGTH + " characters");
            }
            if (length > MAX_TEXT_LENGTH) {
                errors.add("clarification exceeds maximum length of " + MAX_TEXT_LENGTH + " characters");
            }
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
