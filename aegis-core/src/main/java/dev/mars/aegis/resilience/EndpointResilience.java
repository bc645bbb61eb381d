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

import dev.mars.aegis.config.ResilienceConfig;
import dev.mars.aegis.event.EventPublisher;
import io.vertx.core.Vertx;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The resilience state of one configured endpoint: its rate limiter, circuit breaker,
 * retry executor and retry policy. Created once per endpoint and shared by every call
 * that targets it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public final class EndpointResilience {

    private final String endpoint;
    private final ResilienceConfig config;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    public EndpointResilience(String endpoint, ResilienceConfig config, RateLimiter rateLimiter,
                              CircuitBreaker circuitBreaker, RetryExecutor retryExecutor) {
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        this.config = Objects.requireNonNull(config, "Resilience config cannot be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "Rate limiter cannot be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "Circuit breaker cannot be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "Retry executor cannot be null");
        this.retryPolicy = config.retryPolicy();
    }

    public static EndpointResilience create(Vertx vertx, String endpoint, ResilienceConfig config,
                                            EventPublisher events) {
        return create(vertx, endpoint, config, Clock.systemUTC(), events);
    }

    public static EndpointResilience create(Vertx vertx, String endpoint, ResilienceConfig config,
                                            Clock clock, EventPublisher events) {
        RateLimiter rateLimiter = new RateLimiter(vertx, endpoint, config.rateLimitPerMinute(),
                config.rateLimitQueueTimeoutMs(), events);
        CircuitBreaker circuitBreaker = new CircuitBreaker(endpoint, config.circuitBreakerThreshold(),
                Duration.ofMillis(config.circuitOpenDurationMs()), clock, events);
        RetryExecutor retryExecutor = new RetryExecutor(vertx, endpoint, events);
        return new EndpointResilience(endpoint, config, rateLimiter, circuitBreaker, retryExecutor);
    }

    public void start() {
        rateLimiter.start();
    }

    public void stop() {
        rateLimiter.stop();
    }

    public String endpoint() {
        return endpoint;
    }

    public ResilienceConfig config() {
        return config;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public RetryExecutor retryExecutor() {
        return retryExecutor;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("endpoint", endpoint);
        map.put("rateLimiter", rateLimiter.toMap());
        map.put("circuitBreaker", circuitBreaker.toMap());
        map.put("config", config.toMap());
        return map;
    }
}
