package com.dsaflow.domain.exception;

/**
 * Distinguishable failure kinds of the review workflow
 */
public enum ErrorCode {
    INVALID_INPUT(ErrorCategory.VALIDATION),
    INVALID_STATE(ErrorCategory.STATE_CONFLICT),
    ALREADY_REVIEWED(ErrorCategory.STATE_CONFLICT),
    DEADLINE_EXPIRED(ErrorCategory.STATE_CONFLICT),
    DUPLICATE_PENDING(ErrorCategory.STATE_CONFLICT),
    ALREADY_ACTIVE(ErrorCategory.STATE_CONFLICT),
    CONCURRENT_UPDATE(ErrorCategory.STATE_CONFLICT),
    ACCOUNT_FROZEN(ErrorCategory.AUTHORIZATION),
    NOT_ASSIGNED(ErrorCategory.AUTHORIZATION),
    FORBIDDEN(ErrorCategory.AUTHORIZATION),
    NOT_FOUND(ErrorCategory.RESOURCE),
    INSUFFICIENT_REVIEWERS(ErrorCategory.RESOURCE);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
