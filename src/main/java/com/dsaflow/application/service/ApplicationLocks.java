package com.dsaflow.application.service;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.shareddata.Lock;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Serializes read-check-write sequences per application id.
 * Decisions, assignment and the deadline sweep all take the same lock,
 * so the deadline is always checked against a single consistent state.
 */
@Slf4j
public class ApplicationLocks {

    private static final String LOCK_PREFIX = "application-lock:";
    private static final long DEFAULT_TIMEOUT_MS = 10_000;

    private final Vertx vertx;
    private final long timeoutMs;

    public ApplicationLocks(Vertx vertx) {
        this(vertx, DEFAULT_TIMEOUT_MS);
    }

    public ApplicationLocks(Vertx vertx, long timeoutMs) {
        this.vertx = vertx;
        this.timeoutMs = timeoutMs;
    }

    public <T> Future<T> withLock(String applicationId, Supplier<Future<T>> action) {
        String name = LOCK_PREFIX + applicationId;
        return vertx.sharedData()
                .getLocalLockWithTimeout(name, timeoutMs)
                .onFailure(error -> log.error("Could not acquire lock for application {}: {}", applicationId, error.getMessage()))
                .compose(lock -> runAndRelease(lock, applicationId, action));
    }

    private <T> Future<T> runAndRelease(Lock lock, String applicationId, Supplier<Future<T>> action) {
        Future<T> result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result.onComplete(ar -> {
            lock.release();
            log.trace("Released lock for application {}", applicationId);
        });
    }
}
