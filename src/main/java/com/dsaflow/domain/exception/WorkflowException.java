package com.dsaflow.domain.exception;

import java.util.Collections;
import java.util.List;

/**
 * Typed failure of a workflow operation, carried in failed futures
 */
public class WorkflowException extends RuntimeException {

    private final ErrorCode code;
    private final List<String> details;

    public WorkflowException(ErrorCode code, String message) {
        this(code, message, Collections.emptyList());
    }

    public WorkflowException(ErrorCode code, String message, List<String> details) {
        super(message);
        this.code = code;
        this.details = List.copyOf(details);
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public List<String> getDetails() {
        return details;
    }

    public static WorkflowException notFound(String what, String id) {
        return new WorkflowException(ErrorCode.NOT_FOUND, what + " not found: " + id);
    }

    public static WorkflowException invalidState(String message) {
        return new WorkflowException(ErrorCode.INVALID_STATE, message);
    }

    public static WorkflowException forbidden(String message) {
        return new WorkflowException(ErrorCode.FORBIDDEN, message);
    }

    public static boolean hasCode(Throwable error, ErrorCode code) {
        return error instanceof WorkflowException && ((WorkflowException) error).getCode() == code;
    }
}
