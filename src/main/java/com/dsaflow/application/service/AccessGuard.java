package com.dsaflow.application.service;

import com.dsaflow.domain.exception.WorkflowException;
import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.Role;
import io.vertx.core.Future;

import java.util.Arrays;

/**
 * Role checks on the caller identity threaded through every operation
 */
final class AccessGuard {

    private AccessGuard() {
    }

    static Future<Void> requireRole(CallerIdentity caller, Role... allowed) {
        if (caller == null) {
            return Future.failedFuture(WorkflowException.forbidden("Caller identity is required"));
        }
        if (!caller.hasRole(allowed)) {
            return Future.failedFuture(WorkflowException.forbidden(
                    "Role " + caller.role().getValue() + " may not perform this operation (allowed: "
                            + Arrays.toString(allowed) + ")"));
        }
        return Future.succeededFuture();
    }

    static Future<Void> requireSelf(CallerIdentity caller, String reviewerId) {
        if (!caller.callerId().equals(reviewerId)) {
            return Future.failedFuture(WorkflowException.forbidden(
                    "Caller " + caller.callerId() + " cannot act for reviewer " + reviewerId));
        }
        return Future.succeededFuture();
    }
}
