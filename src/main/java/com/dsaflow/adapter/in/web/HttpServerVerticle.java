package com.dsaflow.adapter.in.web;

import com.dsaflow.adapter.in.web.assignment.AssignmentHandler;
import com.dsaflow.adapter.in.web.deadline.DeadlineHandler;
import com.dsaflow.adapter.in.web.reactivation.ReactivationHandler;
import com.dsaflow.adapter.in.web.registration.RegistrationHandler;
import com.dsaflow.adapter.in.web.review.ReviewHandler;
import com.dsaflow.adapter.in.web.reviewer.ReviewerHandler;
import com.dsaflow.adapter.out.event.EventBusReviewEventPublisher;
import com.dsaflow.adapter.out.persistence.InMemoryApplicationAdapter;
import com.dsaflow.adapter.out.persistence.InMemoryReviewerAdapter;
import com.dsaflow.adapter.out.persistence.JdbcApplicationPersistenceAdapter;
import com.dsaflow.adapter.out.persistence.JdbcReviewerPersistenceAdapter;
import com.dsaflow.application.port.in.AssignmentUseCase;
import com.dsaflow.application.port.in.DeadlineSweepUseCase;
import com.dsaflow.application.port.in.ReactivationUseCase;
import com.dsaflow.application.port.in.RegistrationUseCase;
import com.dsaflow.application.port.in.ReviewDecisionUseCase;
import com.dsaflow.application.port.in.ReviewQueryUseCase;
import com.dsaflow.application.port.out.ApplicationRepository;
import com.dsaflow.application.port.out.ReviewEventPublisher;
import com.dsaflow.application.port.out.ReviewerRepository;
import com.dsaflow.application.service.ApplicationLocks;
import com.dsaflow.application.service.AssignmentService;
import com.dsaflow.application.service.DeadlineSweepService;
import com.dsaflow.application.service.ReactivationRequestValidator;
import com.dsaflow.application.service.ReactivationService;
import com.dsaflow.application.service.RegistrationService;
import com.dsaflow.application.service.ReviewDecisionService;
import com.dsaflow.application.service.ReviewPolicy;
import com.dsaflow.application.service.ReviewQueryService;
import com.dsaflow.application.service.ReviewerDirectory;
import com.dsaflow.application.service.ReviewerSelector;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import io.vertx.jdbcclient.JDBCPool;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8081;
    private static final String STORAGE_JDBC = "jdbc";
    private static final String STORAGE_MEMORY = "memory";

    private final Clock clock;

    private JDBCPool jdbcPool;
    private ReviewerRepository reviewerRepository;
    private ApplicationRepository applicationRepository;
    private DeadlineSweepUseCase deadlineSweepUseCase;
    private WebRouter webRouter;

    public HttpServerVerticle() {
        this(Clock.systemUTC());
    }

    public HttpServerVerticle(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeStorage()
                .compose(v -> {
                    log.info("Storage initialized ({})", storageType());
                    return initializeServices();
                })
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", getPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (deadlineSweepUseCase != null) {
            deadlineSweepUseCase.stopPeriodicSweep();
        }
        if (jdbcPool != null) {
            jdbcPool.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> initializeStorage() {
        String storage = storageType();
        if (STORAGE_MEMORY.equals(storage)) {
            reviewerRepository = new InMemoryReviewerAdapter();
            applicationRepository = new InMemoryApplicationAdapter();
            return Future.succeededFuture();
        }
        if (!STORAGE_JDBC.equals(storage)) {
            return Future.failedFuture("Unknown storage.type '" + storage + "', expected memory or jdbc");
        }

        try {
            JsonObject dbConfig = config().getJsonObject("database");
            if (dbConfig == null) {
                return Future.failedFuture("Database configuration not found in application.yml");
            }

            log.info("Connecting to database: {}", dbConfig.getString("url"));

            JsonObject poolConfig = new JsonObject()
                    .put("url", dbConfig.getString("url"))
                    .put("user", dbConfig.getString("user"))
                    .put("password", dbConfig.getString("password"))
                    .put("driver_class", dbConfig.getString("driver_class"))
                    .put("max_pool_size", dbConfig.getInteger("max_pool_size", 10));

            jdbcPool = JDBCPool.pool(vertx, poolConfig);
            reviewerRepository = new JdbcReviewerPersistenceAdapter(jdbcPool);
            applicationRepository = new JdbcApplicationPersistenceAdapter(jdbcPool);

            return jdbcPool.query("SELECT 1 FROM DUAL").execute()
                    .onSuccess(result -> log.info("Database connection test successful"))
                    .onFailure(error -> log.error("Database connection failed", error))
                    .mapEmpty();

        } catch (Exception e) {
            log.error("Error initializing database", e);
            return Future.failedFuture(e);
        }
    }

    private Future<Void> initializeServices() {
        ReviewPolicy policy = ReviewPolicy.fromConfig(config().getJsonObject("review"));
        log.info("Review policy: {}", policy);

        // Output ports (adapters)
        ReviewEventPublisher eventPublisher = new EventBusReviewEventPublisher(vertx);

        // Application services (use cases)
        ApplicationLocks locks = new ApplicationLocks(vertx);
        ReviewerDirectory reviewerDirectory = new ReviewerDirectory(reviewerRepository, policy, clock);

        RegistrationUseCase registrationUseCase = new RegistrationService(reviewerRepository, applicationRepository, clock);
        AssignmentUseCase assignmentUseCase = new AssignmentService(
                applicationRepository, reviewerDirectory, new ReviewerSelector(), locks, eventPublisher, policy, clock);
        ReviewDecisionUseCase decisionUseCase = new ReviewDecisionService(
                applicationRepository, reviewerDirectory, locks, eventPublisher, clock);
        ReactivationUseCase reactivationUseCase = new ReactivationService(
                reviewerRepository, reviewerDirectory, new ReactivationRequestValidator(), eventPublisher, clock);
        ReviewQueryUseCase queryUseCase = new ReviewQueryService(
                applicationRepository, reviewerRepository, reviewerDirectory, clock);
        deadlineSweepUseCase = new DeadlineSweepService(
                vertx, applicationRepository, reviewerDirectory, locks, eventPublisher, policy, clock);

        // Input adapters (handlers)
        Router router = Router.router(vertx);
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        webRouter = new WebRouter(
                router,
                new RegistrationHandler(registrationUseCase),
                new AssignmentHandler(assignmentUseCase),
                new ReviewHandler(decisionUseCase, queryUseCase),
                new DeadlineHandler(deadlineSweepUseCase, clock),
                new ReactivationHandler(reactivationUseCase, queryUseCase),
                new ReviewerHandler(queryUseCase)
        );

        log.info("Services wired up (Hexagonal Architecture)");

        return deadlineSweepUseCase.startPeriodicSweep()
                .onSuccess(v -> log.info("Deadline sweeper running"));
    }

    private Future<Void> startHttpServer() {
        webRouter.setupRoutes();

        Router router = webRouter.getRouter();
        // Default route - 404
        router.route().handler(WebResponses::notFoundRoute);

        int port = getPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", port))
                .mapEmpty();
    }

    private String storageType() {
        JsonObject storage = config().getJsonObject("storage", new JsonObject());
        return storage.getString("type", STORAGE_MEMORY);
    }

    private int getPort() {
        JsonObject http = config().getJsonObject("http", new JsonObject());
        return http.getInteger("port", DEFAULT_PORT);
    }
}
