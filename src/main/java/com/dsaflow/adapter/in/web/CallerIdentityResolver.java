package com.dsaflow.adapter.in.web;

import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.Role;
import io.vertx.core.MultiMap;

import java.util.Optional;

/**
 * Reads the caller identity forwarded by the upstream identity provider.
 * The system role is reserved for in-process schedulers and never accepted from a request.
 */
public final class CallerIdentityResolver {

    public static final String CALLER_ID_HEADER = "X-Caller-Id";
    public static final String CALLER_ROLE_HEADER = "X-Caller-Role";

    private CallerIdentityResolver() {
    }

    public static Optional<CallerIdentity> resolve(MultiMap headers) {
        String callerId = headers.get(CALLER_ID_HEADER);
        String role = headers.get(CALLER_ROLE_HEADER);

        if (callerId == null || callerId.isBlank() || role == null || !Role.isValid(role)) {
            return Optional.empty();
        }
        Role parsed = Role.fromValue(role);
        if (parsed == Role.SYSTEM) {
            return Optional.empty();
        }
        return Optional.of(new CallerIdentity(callerId.trim(), parsed));
    }
}
