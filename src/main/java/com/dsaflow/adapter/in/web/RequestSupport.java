package com.dsaflow.adapter.in.web;

import com.dsaflow.domain.model.CallerIdentity;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Request parsing shared by the handlers. An empty result means the error response was already sent.
 */
@Slf4j
public final class RequestSupport {

    private RequestSupport() {
    }

    public static Optional<CallerIdentity> caller(RoutingContext context) {
        Optional<CallerIdentity> caller = CallerIdentityResolver.resolve(context.request().headers());
        if (caller.isEmpty()) {
            log.warn("Rejected {} {}: missing or invalid caller headers", context.request().method(), context.request().path());
            WebResponses.unauthenticated(context, CallerIdentityResolver.CALLER_ID_HEADER + " and "
                    + CallerIdentityResolver.CALLER_ROLE_HEADER + " (admin, dsa or user) are required");
        }
        return caller;
    }

    public static <T> Optional<T> body(RoutingContext context, Class<T> type) {
        JsonObject json;
        try {
            json = context.body().asJsonObject();
        } catch (RuntimeException e) {
            WebResponses.badRequest(context, "Request body must be a JSON object");
            return Optional.empty();
        }
        if (json == null) {
            WebResponses.badRequest(context, "Request body is required");
            return Optional.empty();
        }

        try {
            return Optional.of(json.mapTo(type));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid request body for {}: {}", type.getSimpleName(), e.getMessage());
            WebResponses.badRequest(context, "Invalid request format");
            return Optional.empty();
        }
    }
}
