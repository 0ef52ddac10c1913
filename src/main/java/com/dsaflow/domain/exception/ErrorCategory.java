package com.dsaflow.domain.exception;

/**
 * How a caller should react to a failed workflow operation
 */
public enum ErrorCategory {
    /** Bad input shape; correct and retry */
    VALIDATION,
    /** Operation does not apply to current state; re-fetch before acting */
    STATE_CONFLICT,
    /** Caller may not perform the operation */
    AUTHORIZATION,
    /** Missing record or capacity problem */
    RESOURCE
}
