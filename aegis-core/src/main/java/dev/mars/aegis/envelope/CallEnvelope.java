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


package dev.mars.aegis.envelope;

import dev.mars.aegis.core.CallError;
import dev.mars.aegis.core.CallResult;
import dev.mars.aegis.core.ErrorClassifier;
import dev.mars.aegis.core.ErrorKind;
import dev.mars.aegis.core.exceptions.CallException;
import dev.mars.aegis.event.CallCompletedEvent;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.resilience.CircuitBreaker;
import dev.mars.aegis.resilience.EndpointResilience;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composes rate limiting, circuit breaking and retry around one outbound operation.
 *
 * <p>Every invocation runs the same sequence:</p>
 * <ol>
 *   <li>Validate the request; an invalid request touches no resilience state</li>
 *   <li>Ask the endpoint's circuit breaker for a permit</li>
 *   <li>Acquire a rate-limit token, possibly waiting in the queue</li>
 *   <li>Run the transport through the retry executor</li>
 *   <li>Report the outcome to the breaker; only upstream failures count against it</li>
 *   <li>Publish a {@link CallCompletedEvent} with the {@link CallResult}</li>
 *   <li>Map the outcome onto the variant's normalized response</li>
 * </ol>
 *
 * <p>The future returned by {@link #invoke(Object)} always succeeds for the expected
 * failure categories; failures are carried inside the response.</p>
 *
 * @param <Q> request type
 * @param <T> raw transport result type
 * @param <R> normalized response type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public abstract class CallEnvelope<Q, T, R> {

    private static final Logger logger = LoggerFactory.getLogger(CallEnvelope.class);

    private final String name;
    private final EventPublisher events;
    private final AtomicBoolean started = new AtomicBoolean(false);

    protected CallEnvelope(String name, EventPublisher events) {
        this.name = Objects.requireNonNull(name, "Envelope name cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
    }

    // ==================== Variant Hooks ====================

    /**
     * Rejects a malformed request by throwing a {@code VALIDATION_ERROR} {@link CallException}.
     */
    protected abstract void validate(Q request);

    /**
     * Selects the endpoint whose resilience state governs this request.
     */
    protected abstract EndpointResilience resolve(Q request);

    /**
     * Performs one transport attempt.
     */
    protected abstract Future<T> transport(Q request, int attempt);

    protected abstract R toSuccess(Q request, T raw, CallResult result);

    protected abstract R toFailure(Q request, CallError error, CallResult result);

    protected abstract String correlationIdOf(Q request);

    /**
     * Every endpoint this envelope can route to.
     */
    public abstract Collection<EndpointResilience> endpoints();

    // ==================== Lifecycle ====================

    /**
     * Starts the rate limiter tickers of every endpoint.
     */
    public Future<Void> start() {
        if (started.compareAndSet(false, true)) {
            endpoints().forEach(EndpointResilience::start);
            logger.info("Call envelope '{}' started with {} endpoint(s)", name, endpoints().size());
        }
        return Future.succeededFuture();
    }

    public Future<Void> stop() {
        if (started.compareAndSet(true, false)) {
            endpoints().forEach(EndpointResilience::stop);
            logger.info("Call envelope '{}' stopped", name);
        }
        return Future.succeededFuture();
    }

    public boolean isStarted() {
        return started.get();
    }

    public String name() {
        return name;
    }

    // ==================== Invocation ====================

    protected final Future<R> invoke(Q request) {
        long startNanos = System.nanoTime();
        String correlationId = request != null ? correlationIdOf(request) : null;

        EndpointResilience resilience;
        try {
            if (request == null) {
                throw CallException.validation("request cannot be null");
            }
            validate(request);
            resilience = resolve(request);
        } catch (CallException e) {
            logger.debug("Rejected invalid request on {}: {}", name, e.getMessage());
            return Future.succeededFuture(fail(request, name, e, correlationId, 0, startNanos));
        } catch (RuntimeException e) {
            logger.debug("Request on {} could not be validated", name, e);
            CallException rejected = CallException.validation("request could not be validated: " + e.getMessage(), e);
            return Future.succeededFuture(fail(request, name, rejected, correlationId, 0, startNanos));
        }

        String endpoint = resilience.endpoint();
        CircuitBreaker breaker = resilience.circuitBreaker();
        if (!breaker.tryAcquirePermission()) {
            logger.debug("Circuit open for {}, call short-circuited", endpoint);
            return Future.succeededFuture(
                    fail(request, endpoint, CallException.circuitOpen(endpoint), correlationId, 0, startNanos));
        }

        AtomicInteger attempts = new AtomicInteger();
        Promise<R> promise = Promise.promise();
        resilience.rateLimiter().acquire()
                .compose(granted -> resilience.retryExecutor().execute(resilience.retryPolicy(), attempt -> {
                    attempts.set(attempt);
                    return transport(request, attempt);
                }))
                .onComplete(ar -> {
                    if (ar.succeeded()) {
                        CallResult result = CallResult.succeeded(endpoint, attempts.get(), elapsedSince(startNanos));
                        R response;
                        try {
                            response = toSuccess(request, ar.result(), result);
                        } catch (RuntimeException e) {
                            logger.warn("Could not map response from {}: {}", endpoint, e.getMessage());
                            breaker.onIgnored();
                            promise.complete(fail(request, endpoint, CallException.parse(e.getMessage(), e),
                                    correlationId, attempts.get(), startNanos));
                            return;
                        }
                        breaker.onSuccess();
                        events.publish(new CallCompletedEvent(result));
                        promise.complete(response);
                    } else {
                        ErrorKind kind = ErrorClassifier.classify(ar.cause());
                        if (kind.countsAgainstBreaker()) {
                            breaker.onFailure();
                        } else {
                            breaker.onIgnored();
                        }
                        promise.complete(fail(request, endpoint, ar.cause(), correlationId, attempts.get(), startNanos));
                    }
                });
        return promise.future();
    }

    private R fail(Q request, String endpoint, Throwable failure, String correlationId, int attempts, long startNanos) {
        CallError error = ErrorClassifier.toCallError(failure, correlationId);
        CallResult result = CallResult.failed(endpoint, attempts, elapsedSince(startNanos), error.kind());
        events.publish(new CallCompletedEvent(result));
        logger.debug("Call to {} failed with {} after {} attempt(s): {}",
                endpoint, error.kind().code(), attempts, error.message());
        return toFailure(request, error, result);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
