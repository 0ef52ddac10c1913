package com.dsaflow.application.port.out;

import com.dsaflow.domain.event.ReviewEvent;
import io.vertx.core.Future;

/**
 * Output port for workflow notifications. Delivery is not confirmed.
 * Publishing failures are reported through the returned future, never thrown.
 */
public interface ReviewEventPublisher {

    Future<Void> publish(ReviewEvent event);
}
