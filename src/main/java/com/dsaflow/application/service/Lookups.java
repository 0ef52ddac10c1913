package com.dsaflow.application.service;

import com.dsaflow.domain.exception.WorkflowException;
import io.vertx.core.Future;

import java.util.Optional;

final class Lookups {

    private Lookups() {
    }

    static <T> Future<T> require(Optional<T> value, String what, String id) {
        return value.map(Future::succeededFuture)
                .orElseGet(() -> Future.failedFuture(WorkflowException.notFound(what, id)));
    }
}
