/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.aegis.resilience;

import dev.mars.aegis.core.ErrorClassifier;
import dev.mars.aegis.core.ErrorKind;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.event.RetryScheduledEvent;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.IntFunction;

/**
 * Runs an asynchronous operation under a {@link RetryPolicy}.
 *
 * <p>The operation receives the 1-based attempt number. Backoff waits are Vert.x timers,
 * so no thread is held while waiting. Failures classified as non-retryable end the call
 * at once; when every attempt fails, the last failure is the one returned.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final Vertx vertx;
    private final String endpoint;
    private final EventPublisher events;
    private final DoubleSupplier random;

    public RetryExecutor(Vertx vertx, String endpoint, EventPublisher events) {
        this(vertx, endpoint, events, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryExecutor(Vertx vertx, String endpoint, EventPublisher events, DoubleSupplier random) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        this.random = Objects.requireNonNull(random, "Random source cannot be null");
    }

    public <T> Future<T> execute(RetryPolicy policy, IntFunction<Future<T>> operation) {
        Objects.requireNonNull(policy, "Retry policy cannot be null");
        Objects.requireNonNull(operation, "Operation cannot be null");
        Promise<T> promise = Promise.promise();
        attempt(policy, operation, 1, promise);
        return promise.future();
    }

    private <T> void attempt(RetryPolicy policy, IntFunction<Future<T>> operation, int attempt, Promise<T> promise) {
        Future<T> future;
        try {
            future = Objects.requireNonNull(operation.apply(attempt), "Operation returned a null future");
        } catch (RuntimeException e) {
            future = Future.failedFuture(e);
        }

        future.onComplete(ar -> {
            if (ar.succeeded()) {
                if (attempt > 1) {
                    logger.info("Call to {} succeeded on attempt {}/{}", endpoint, attempt, policy.maxAttempts());
                }
                promise.complete(ar.result());
                return;
            }

            Throwable failure = ar.cause();
            ErrorKind kind = ErrorClassifier.classify(failure);
            if (!kind.isRetryable()) {
                logger.debug("Call to {} failed with non-retryable {} on attempt {}", endpoint, kind.code(), attempt);
                promise.fail(failure);
                return;
            }
            if (attempt >= policy.maxAttempts()) {
                logger.warn("Call to {} failed after {} attempt(s): {}", endpoint, attempt, failure.getMessage());
                promise.fail(failure);
                return;
            }

            long delayMs = policy.delayBeforeRetry(attempt, random);
            logger.warn("Attempt {}/{} to {} failed ({}), retrying in {}ms",
                    attempt, policy.maxAttempts(), endpoint, failure.getMessage(), delayMs);
            events.publish(new RetryScheduledEvent(endpoint, attempt, delayMs, kind, Instant.now()));
            // Vert.x rejects timers shorter than 1ms
            vertx.setTimer(Math.max(1, delayMs), id -> attempt(policy, operation, attempt + 1, promise));
        });
    }
}
