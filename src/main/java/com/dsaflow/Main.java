package com.dsaflow;

import com.dsaflow.adapter.in.web.HttpServerVerticle;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        // Vert.x internal logging through SLF4J/Logback
        System.setProperty("vertx.logger-delegate-factory-class-name", "io.vertx.core.logging.SLF4JLogDelegateFactory");

        log.info("Starting DSA Review Workflow...");

        // Write PID to file for easy process management
        writePidToFile();

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(5);

        Vertx vertx = Vertx.vertx(options);

        loadConfig(vertx)
                .compose(config -> vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                        .setConfig(config)
                        .setInstances(1)))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down DSA Review Workflow...");
                        vertx.close();
                    }));

                    log.info("DSA Review Workflow is ready!");
                    log.info("Health Check: http://localhost:8081/health");
                })
                .onFailure(error -> {
                    log.error("Failed to start DSA Review Workflow", error);
                    vertx.close();
                });
    }

    /**
     * application.yml from the classpath, overridable with -D system properties
     */
    static Future<JsonObject> loadConfig(Vertx vertx) {
        ConfigStoreOptions yaml = new ConfigStoreOptions()
                .setType("file")
                .setFormat("yaml")
                .setConfig(new JsonObject().put("path", "application.yml"));
        ConfigStoreOptions systemProperties = new ConfigStoreOptions().setType("sys");

        ConfigRetriever retriever = ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
                .addStore(yaml)
                .addStore(systemProperties));

        return retriever.getConfig()
                .onSuccess(config -> log.info("Loaded configuration from application.yml"))
                .onFailure(error -> log.error("Failed to load application.yml: {}", error.getMessage()))
                .onComplete(ar -> retriever.close());
    }

    /**
     * Write the current process PID to a file for easy management
     */
    private static void writePidToFile() {
        try {
            String pid = String.valueOf(ProcessHandle.current().pid());
            try (FileWriter writer = new FileWriter("app.pid")) {
                writer.write(pid);
            }
            log.info("PID written to app.pid: {}", pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
