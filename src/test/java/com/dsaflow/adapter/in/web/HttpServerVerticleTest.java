package com.dsaflow.adapter.in.web;

import com.dsaflow.support.MutableClock;
import com.dsaflow.support.TestData;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.dsaflow.support.FutureAwait.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the HTTP surface end to end over in-memory storage
 */
class HttpServerVerticleTest {

    private static final int PORT = 18093;

    private Vertx vertx;
    private HttpClient client;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        clock = new MutableClock(TestData.T0);
        JsonObject config = new JsonObject()
                .put("http", new JsonObject().put("port", PORT))
                .put("storage", new JsonObject().put("type", "memory"))
                .put("review", new JsonObject()
                        .put("min-reviewers", 2)
                        .put("max-reviewers", 2)
                        .put("approval-threshold", 2));
        await(vertx.deployVerticle(new HttpServerVerticle(clock), new DeploymentOptions().setConfig(config)));
        client = vertx.createHttpClient();
    }

    @AfterEach
    void tearDown() {
        await(vertx.close());
    }

    private Response call(HttpMethod method, String uri, String callerId, String role, JsonObject body) {
        MultiMap headers = MultiMap.caseInsensitiveMultiMap();
        if (callerId != null) {
            headers.add(CallerIdentityResolver.CALLER_ID_HEADER, callerId);
            headers.add(CallerIdentityResolver.CALLER_ROLE_HEADER, role);
        }
        Future<Response> response = client.request(method, PORT, "localhost", uri)
                .compose(request -> {
                    request.headers().addAll(headers);
                    if (body == null) {
                        return request.send();
                    }
                    request.putHeader("Content-Type", "application/json");
                    return request.send(body.encode());
                })
                .compose(result -> result.body()
                        .map(buffer -> new Response(result.statusCode(), buffer.toJsonObject())));
        return await(response);
    }

    private Response admin(HttpMethod method, String uri, JsonObject body) {
        return call(method, uri, "admin-1", "admin", body);
    }

    private String registerReviewer(String name) {
        Response response = admin(HttpMethod.POST, "/api/admin/reviewers",
                new JsonObject().put("name", name).put("email", name.toLowerCase() + "@dsa.example.com"));
        assertEquals(201, response.status, response.body.encode());
        return response.data().getString("id");
    }

    @Test
    void health_reportsUp() {
        Response response = call(HttpMethod.GET, "/health", null, null, null);

        assertEquals(200, response.status);
        assertEquals("UP", response.body.getString("status"));
    }

    @Test
    void missingCallerHeaders_areUnauthenticated() {
        Response response = call(HttpMethod.GET, "/api/admin/deadlines", null, null, null);

        assertEquals(401, response.status);
        assertEquals("UNAUTHENTICATED", response.body.getString("code"));
    }

    @Test
    void unknownRoute_isNotFound() {
        assertEquals(404, admin(HttpMethod.GET, "/api/nowhere", null).status);
    }

    @Test
    void fullReviewCycle_approvesWithTwoApprovals() {
        registerReviewer("Asha");
        registerReviewer("Bilal");

        Response registered = call(HttpMethod.POST, "/api/applications", "u-1", "user", null);
        assertEquals(201, registered.status, registered.body.encode());
        String applicationId = registered.data().getString("id");

        Response assigned = admin(HttpMethod.POST, "/api/admin/applications/" + applicationId + "/assign", null);
        assertEquals(200, assigned.status, assigned.body.encode());
        JsonArray reviewerIds = assigned.data().getJsonArray("reviewerIds");
        assertEquals(2, reviewerIds.size());

        List<Response> decisions = new ArrayList<>();
        for (int i = 0; i < reviewerIds.size(); i++) {
            clock.advance(Duration.ofHours(1));
            decisions.add(call(HttpMethod.POST, "/api/applications/" + applicationId + "/decisions",
                    reviewerIds.getString(i), "dsa",
                    new JsonObject().put("decision", "approved").put("comment", "documents verified")));
        }

        assertEquals(200, decisions.get(0).status, decisions.get(0).body.encode());
        assertEquals("partially_approved", decisions.get(0).data().getString("displayStatus"));
        assertEquals(200, decisions.get(1).status);
        assertEquals("approved", decisions.get(1).data().getString("status"));

        Response ownView = call(HttpMethod.GET, "/api/applications/" + applicationId + "/review-status",
                "u-1", "user", null);
        assertEquals(200, ownView.status);
        assertEquals(2, ownView.data().getInteger("approvedCount"));

        Response otherView = call(HttpMethod.GET, "/api/applications/" + applicationId + "/review-status",
                "u-2", "user", null);
        assertEquals(403, otherView.status);
    }

    @Test
    void assignWithoutReviewers_isServiceUnavailable() {
        Response registered = call(HttpMethod.POST, "/api/applications", "u-1", "user", null);
        String applicationId = registered.data().getString("id");

        Response response = admin(HttpMethod.POST, "/api/admin/applications/" + applicationId + "/assign", null);

        assertEquals(503, response.status);
        assertEquals("INSUFFICIENT_REVIEWERS", response.body.getString("code"));
    }

    @Test
    void expiredReview_isResetBySweep() {
        registerReviewer("Asha");
        registerReviewer("Bilal");
        String applicationId = call(HttpMethod.POST, "/api/applications", "u-1", "user", null)
                .data().getString("id");
        admin(HttpMethod.POST, "/api/admin/applications/" + applicationId + "/assign", null);

        clock.advance(Duration.ofHours(73));
        Response sweep = admin(HttpMethod.POST, "/api/admin/deadlines/sweep", null);

        assertEquals(200, sweep.status, sweep.body.encode());
        assertEquals(1, sweep.data().getInteger("expiredApplications"));
        assertEquals(2, sweep.data().getInteger("missedDeadlines"));
        assertEquals(new JsonArray().add(applicationId), sweep.data().getJsonArray("resetApplications"));

        Response status = admin(HttpMethod.GET, "/api/applications/" + applicationId + "/review-status", null);
        assertEquals("pending", status.data().getString("status"));
    }

    @Test
    void invalidDecisionBody_isBadRequest() {
        Response response = call(HttpMethod.POST, "/api/applications/any/decisions", "r1", "dsa",
                new JsonObject().put("decision", "pending"));

        assertEquals(400, response.status);
        assertEquals("INVALID_INPUT", response.body.getString("code"));
    }

    @Test
    void reactivationRequestForActiveReviewer_isConflict() {
        String reviewerId = registerReviewer("Asha");

        Response response = call(HttpMethod.POST, "/api/dsa/reactivation-request", reviewerId, "dsa",
                new JsonObject()
                        .put("reason", "Family emergency last week")
                        .put("clarification", "I will clear assigned reviews within a day"));

        assertEquals(409, response.status, response.body.encode());
        assertEquals("ALREADY_ACTIVE", response.body.getString("code"));
    }

    private static final class Response {
        private final int status;
        private final JsonObject body;

        private Response(int status, JsonObject body) {
            this.status = status;
            this.body = body;
        }

        private JsonObject data() {
            return body.getJsonObject("data");
        }
    }
}
