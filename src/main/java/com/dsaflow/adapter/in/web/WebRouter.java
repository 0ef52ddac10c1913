package com.dsaflow.adapter.in.web;

import com.dsaflow.adapter.in.web.assignment.AssignmentHandler;
import com.dsaflow.adapter.in.web.deadline.DeadlineHandler;
import com.dsaflow.adapter.in.web.reactivation.ReactivationHandler;
import com.dsaflow.adapter.in.web.registration.RegistrationHandler;
import com.dsaflow.adapter.in.web.review.ReviewHandler;
import com.dsaflow.adapter.in.web.reviewer.ReviewerHandler;
import io.vertx.ext.web.Router;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for the review workflow endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    @Getter
    private final Router router;
    private final RegistrationHandler registrationHandler;
    private final AssignmentHandler assignmentHandler;
    private final ReviewHandler reviewHandler;
    private final DeadlineHandler deadlineHandler;
    private final ReactivationHandler reactivationHandler;
    private final ReviewerHandler reviewerHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, "
                            + CallerIdentityResolver.CALLER_ID_HEADER + ", " + CallerIdentityResolver.CALLER_ROLE_HEADER);
            ctx.next();
        });

        // Handle OPTIONS preflight requests
        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // Registration
        router.post("/api/admin/reviewers").handler(registrationHandler::registerReviewer);
        router.post("/api/applications").handler(registrationHandler::registerApplication);

        // Assignment (literal path before the :id pattern)
        router.post("/api/admin/applications/assign-pending").handler(assignmentHandler::assignPending);
        router.post("/api/admin/applications/:id/assign").handler(assignmentHandler::assign);

        // Review
        router.post("/api/applications/:id/decisions").handler(reviewHandler::submitDecision);
        router.get("/api/applications/:id/review-status").handler(reviewHandler::reviewStatus);
        router.post("/api/admin/applications/:id/escalation").handler(reviewHandler::resolveEscalation);

        // Deadlines
        router.post("/api/admin/deadlines/sweep").handler(deadlineHandler::sweep);
        router.get("/api/admin/deadlines").handler(deadlineHandler::overview);

        // Reactivation
        router.post("/api/dsa/reactivation-request").handler(reactivationHandler::submit);
        router.get("/api/dsa/reactivation-request").handler(reactivationHandler::myRequest);
        router.get("/api/admin/reactivation-requests").handler(reactivationHandler::listPending);
        router.post("/api/admin/reactivation-requests/:reviewerId/decision").handler(reactivationHandler::decide);

        // Reviewer dashboards
        router.get("/api/reviewers/:id/statistics").handler(reviewerHandler::statistics);
        router.get("/api/dsa/next-application").handler(reviewerHandler::nextApplication);
        router.get("/api/admin/assignment-statistics").handler(reviewerHandler::assignmentStatistics);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"dsa-review-workflow\"}");
                });
    }
}
