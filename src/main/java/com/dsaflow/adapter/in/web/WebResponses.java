package com.dsaflow.adapter.in.web;

import com.dsaflow.domain.exception.ErrorCategory;
import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.exception.WorkflowException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON envelopes and the single mapping from workflow failures to HTTP status codes
 */
@Slf4j
public final class WebResponses {

    private static final String CONTENT_TYPE = "application/json";

    private WebResponses() {
    }

    public static void ok(RoutingContext context, Object data) {
        send(context, 200, data);
    }

    public static void created(RoutingContext context, Object data) {
        send(context, 201, data);
    }

    private static void send(RoutingContext context, int statusCode, Object data) {
        String body = "{\"status\":\"success\",\"data\":" + Json.encode(data) + "}";
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", CONTENT_TYPE)
                .end(body);
    }

    public static int statusFor(ErrorCode code) {
        switch (code) {
            case NOT_FOUND:
                return 404;
            case INSUFFICIENT_REVIEWERS:
                return 503;
            default:
                break;
        }
        switch (code.getCategory()) {
            case VALIDATION:
                return 400;
            case STATE_CONFLICT:
                return 409;
            case AUTHORIZATION:
                return 403;
            default:
                return 500;
        }
    }

    public static void fail(RoutingContext context, Throwable error) {
        if (error instanceof WorkflowException) {
            WorkflowException workflowError = (WorkflowException) error;
            JsonObject body = errorBody(workflowError.getCode().name(), workflowError.getCategory().name(),
                    workflowError.getMessage());
            if (!workflowError.getDetails().isEmpty()) {
                body.put("errors", new JsonArray(workflowError.getDetails()));
            }
            end(context, statusFor(workflowError.getCode()), body);
            return;
        }

        log.error("Unexpected failure handling {} {}", context.request().method(), context.request().path(), error);
        end(context, 500, errorBody("INTERNAL_ERROR", null, "Internal server error"));
    }

    public static void badRequest(RoutingContext context, String message) {
        fail(context, new WorkflowException(ErrorCode.INVALID_INPUT, message));
    }

    public static void unauthenticated(RoutingContext context, String message) {
        end(context, 401, errorBody("UNAUTHENTICATED", ErrorCategory.AUTHORIZATION.name(), message));
    }

    public static void notFoundRoute(RoutingContext context) {
        end(context, 404, errorBody("NOT_FOUND", ErrorCategory.RESOURCE.name(), "Endpoint not found"));
    }

    private static JsonObject errorBody(String code, String category, String message) {
        JsonObject body = new JsonObject()
                .put("status", "error")
                .put("code", code)
                .put("message", message);
        if (category != null) {
            body.put("category", category);
        }
        return body;
    }

    private static void end(RoutingContext context, int statusCode, JsonObject body) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", CONTENT_TYPE)
                .end(body.encode());
    }
}
