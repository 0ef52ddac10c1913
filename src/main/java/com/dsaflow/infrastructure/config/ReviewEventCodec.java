package com.dsaflow.infrastructure.config;

import com.dsaflow.domain.event.ReviewEvent;
import com.dsaflow.domain.event.ReviewEventType;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Message codec for ReviewEvent to enable event bus communication
 */
public class ReviewEventCodec implements MessageCodec<ReviewEvent, ReviewEvent> {

    @Override
    public void encodeToWire(Buffer buffer, ReviewEvent event) {
        JsonObject json = new JsonObject()
                .put("type", event.getType().name())
                .put("applicationId", event.getApplicationId())
                .put("reviewerId", event.getReviewerId())
                .put("occurredAt", event.getOccurredAt() == null ? null : event.getOccurredAt().toString())
                .put("detail", event.getDetail());

        Buffer encoded = json.toBuffer();
        buffer.appendInt(encoded.length());
        buffer.appendBuffer(encoded);
    }

    @Override
    public ReviewEvent decodeFromWire(int pos, Buffer buffer) {
        int length = buffer.getInt(pos);
        JsonObject json = new JsonObject(buffer.getBuffer(pos + 4, pos + 4 + length));

        String occurredAt = json.getString("occurredAt");
        return new ReviewEvent(
                ReviewEventType.valueOf(json.getString("type")),
                json.getString("applicationId"),
                json.getString("reviewerId"),
                occurredAt == null ? null : Instant.parse(occurredAt),
                json.getString("detail")
        );
    }

    @Override
    public ReviewEvent transform(ReviewEvent event) {
        return event;
    }

    @Override
    public String name() {
        return "ReviewEventCodec";
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }
}
