package com.dsaflow.adapter.out.event;

import com.dsaflow.application.port.out.ReviewEventPublisher;
import com.dsaflow.domain.event.ReviewEvent;
import com.dsaflow.infrastructure.config.ReviewEventCodec;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes review events to the Vert.x event bus for notifiers to consume.
 * Registers the ReviewEvent codec on the instance it is given.
 */
@Slf4j
public class EventBusReviewEventPublisher implements ReviewEventPublisher {

    public static final String REVIEW_EVENT_ADDRESS = "review.events";

    private final Vertx vertx;

    public EventBusReviewEventPublisher(Vertx vertx) {
        this.vertx = vertx;
        registerCodec();
    }

    @Override
    public Future<Void> publish(ReviewEvent event) {
        log.debug("Publishing review event: {}", event);
        try {
            vertx.eventBus().publish(REVIEW_EVENT_ADDRESS, event);
            return Future.succeededFuture();
        } catch (RuntimeException e) {
            log.error("Failed to publish review event {}: {}", event.getType(), e.getMessage(), e);
            return Future.failedFuture(e);
        }
    }

    private void registerCodec() {
        try {
            vertx.eventBus().registerDefaultCodec(ReviewEvent.class, new ReviewEventCodec());
            log.info("Registered ReviewEvent message codec");
        } catch (IllegalStateException e) {
            // another publisher on this Vertx instance got there first
            log.debug("ReviewEvent message codec already registered: {}", e.getMessage());
        }
    }
}
