package com.dsaflow.adapter.out.event;

import com.dsaflow.domain.event.ReviewEvent;
import com.dsaflow.domain.event.ReviewEventType;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.dsaflow.support.FutureAwait.await;
import static com.dsaflow.support.FutureAwait.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventBusReviewEventPublisherTest {

    private static final ReviewEvent ASSIGNED = ReviewEvent.forApplication(ReviewEventType.APPLICATION_ASSIGNED,
            "app-1", Instant.parse("2024-03-01T09:00:00Z"), "r1,r2");

    private Vertx vertx;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
    }

    @AfterEach
    void tearDown() {
        await(vertx.close());
    }

    @Test
    void publish_onFreshVertx_reachesConsumer() {
        EventBusReviewEventPublisher publisher = new EventBusReviewEventPublisher(vertx);
        Promise<ReviewEvent> received = Promise.promise();
        vertx.eventBus().<ReviewEvent>consumer(EventBusReviewEventPublisher.REVIEW_EVENT_ADDRESS,
                message -> received.tryComplete(message.body()));

        await(publisher.publish(ASSIGNED));

        assertEquals(ASSIGNED, await(received.future()));
    }

    @Test
    void secondPublisherOnSameVertx_sharesTheCodec() {
        new EventBusReviewEventPublisher(vertx);
        EventBusReviewEventPublisher second = assertDoesNotThrow(() -> new EventBusReviewEventPublisher(vertx));

        await(second.publish(ASSIGNED));
    }

    @Test
    void eventBusFailure_isReturnedNotThrown() {
        // given
        Vertx brokenVertx = mock(Vertx.class);
        EventBus eventBus = mock(EventBus.class);
        when(brokenVertx.eventBus()).thenReturn(eventBus);
        when(eventBus.publish(anyString(), any()))
                .thenThrow(new IllegalArgumentException("No message codec for type: class ReviewEvent"));
        EventBusReviewEventPublisher publisher = new EventBusReviewEventPublisher(brokenVertx);

        // when
        Throwable error = awaitFailure(publisher.publish(ASSIGNED));

        // then
        assertInstanceOf(IllegalArgumentException.class, error);
    }
}
