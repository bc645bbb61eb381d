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

import dev.mars.aegis.core.exceptions.CallException;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.event.RateLimitTimeoutEvent;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Token bucket with a FIFO wait queue for one endpoint.
 *
 * <p>The bucket holds at most {@code capacity} tokens and refills at {@code capacity/60}
 * tokens per second in proportion to the time elapsed between ticks, so fractional tokens
 * carry over from one tick to the next. A caller that finds the queue empty and a whole
 * token available is granted immediately. Everyone else waits in arrival order until a
 * refill releases them or their queue timeout expires.</p>
 *
 * <p>Refill, grant and expiry all run under the instance lock, which is what keeps a token
 * from being granted twice. Promises are completed after the lock is released.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    public static final long DEFAULT_REFILL_INTERVAL_MS = 1000;

    private final Vertx vertx;
    private final String endpoint;
    private final int capacity;
    private final long queueTimeoutMs;
    private final long refillIntervalMs;
    private final EventPublisher events;

    private final Deque<Waiter> waitQueue = new ArrayDeque<>();
    private double tokens;
    private Instant lastRefillTime;
    private long lastRefillNanos;
    private long tickerId = -1;

    private final LongAdder immediateGrants = new LongAdder();
    private final LongAdder queuedGrants = new LongAdder();
    private final LongAdder timeouts = new LongAdder();

    public RateLimiter(Vertx vertx, String endpoint, int capacity, long queueTimeoutMs, EventPublisher events) {
        this(vertx, endpoint, capacity, queueTimeoutMs, DEFAULT_REFILL_INTERVAL_MS, events);
    }

    public RateLimiter(Vertx vertx, String endpoint, int capacity, long queueTimeoutMs,
                       long refillIntervalMs, EventPublisher events) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got: " + capacity);
        }
        if (queueTimeoutMs <= 0 || refillIntervalMs <= 0) {
            throw new IllegalArgumentException("Queue timeout and refill interval must be positive");
        }
        this.capacity = capacity;
        this.queueTimeoutMs = queueTimeoutMs;
        this.refillIntervalMs = refillIntervalMs;
        this.tokens = capacity;
        this.lastRefillTime = Instant.now();
        this.lastRefillNanos = System.nanoTime();
    }

    // ==================== Lifecycle ====================

    /**
     * Starts the refill ticker. Calling start on a running limiter has no effect.
     */
    public synchronized void start() {
        if (tickerId >= 0) {
            return;
        }
        lastRefillNanos = System.nanoTime();
        tickerId = vertx.setPeriodic(refillIntervalMs, id -> tick());
        logger.debug("Rate limiter for {} started: {} tokens/minute", endpoint, capacity);
    }

    /**
     * Stops the ticker and fails every queued caller with a rate-limit timeout.
     */
    public void stop() {
        List<Waiter> abandoned;
        synchronized (this) {
            if (tickerId >= 0) {
                vertx.cancelTimer(tickerId);
                tickerId = -1;
            }
            abandoned = new ArrayList<>(waitQueue);
            waitQueue.clear();
        }
        for (Waiter waiter : abandoned) {
            vertx.cancelTimer(waiter.timerId);
            waiter.promise.tryFail(CallException.rateLimitTimeout(endpoint, waiter.waitedMs()));
        }
        if (!abandoned.isEmpty()) {
            logger.info("Rate limiter for {} stopped with {} queued caller(s)", endpoint, abandoned.size());
        }
    }

    public synchronized boolean isRunning() {
        return tickerId >= 0;
    }

    // ==================== Token Acquisition ====================

    /**
     * Acquires one token.
     *
     * @return a completed future when a token was available, otherwise a future that
     *         completes when a refill reaches this caller or fails with a
     *         {@code RATE_LIMIT_TIMEOUT} {@link CallException} after the queue timeout
     */
    public Future<Void> acquire() {
        Waiter waiter;
        synchronized (this) {
            if (waitQueue.isEmpty() && tokens >= 1.0) {
                tokens -= 1.0;
                immediateGrants.increment();
                return Future.succeededFuture();
            }
            waiter = new Waiter(Promise.promise(), System.nanoTime());
            waitQueue.addLast(waiter);
            waiter.timerId = vertx.setTimer(queueTimeoutMs, id -> expire(waiter));
            logger.debug("No token for {}, caller queued at position {}", endpoint, waitQueue.size());
        }
        return waiter.promise.future();
    }

    /**
     * Adds the tokens accrued over the given interval and releases queued callers.
     * Driven by the ticker; exposed so that refill can be exercised deterministically.
     */
    public void refill(long elapsedMs) {
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("Elapsed time cannot be negative: " + elapsedMs);
        }
        List<Waiter> released = new ArrayList<>();
        synchronized (this) {
            tokens = Math.min(capacity, tokens + elapsedMs * capacity / 60_000.0);
            lastRefillTime = Instant.now();
            while (!waitQueue.isEmpty() && tokens >= 1.0) {
                tokens -= 1.0;
                released.add(waitQueue.pollFirst());
            }
        }
        for (Waiter waiter : released) {
            vertx.cancelTimer(waiter.timerId);
            queuedGrants.increment();
            waiter.promise.tryComplete();
        }
        if (!released.isEmpty()) {
            logger.debug("Refill released {} queued caller(s) for {}", released.size(), endpoint);
        }
    }

    private void tick() {
        long now = System.nanoTime();
        long elapsedMs;
        synchronized (this) {
            elapsedMs = TimeUnit.NANOSECONDS.toMillis(now - lastRefillNanos);
            lastRefillNanos = now;
        }
        refill(elapsedMs);
    }

    private void expire(Waiter waiter) {
        int remaining;
        synchronized (this) {
            if (!waitQueue.remove(waiter)) {
                return;
            }
            remaining = waitQueue.size();
        }
        timeouts.increment();
        long waited = waiter.waitedMs();
        logger.warn("Rate limit wait for {} timed out after {}ms ({} still queued)", endpoint, waited, remaining);
        events.publish(new RateLimitTimeoutEvent(endpoint, waited, remaining, Instant.now()));
        waiter.promise.tryFail(CallException.rateLimitTimeout(endpoint, waited));
    }

    // ==================== State ====================

    public String getEndpoint() {
        return endpoint;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Whole tokens currently available.
     */
    public synchronized int tokensAvailable() {
        return (int) Math.floor(tokens);
    }

    public synchronized int queueLength() {
        return waitQueue.size();
    }

    public synchronized Instant lastRefillTime() {
        return lastRefillTime;
    }

    public long getTimeoutCount() {
        return timeouts.sum();
    }

    public synchronized Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("endpoint", endpoint);
        map.put("capacity", capacity);
        map.put("tokensAvailable", (int) Math.floor(tokens));
        map.put("queueLength", waitQueue.size());
        map.put("lastRefillTime", lastRefillTime.toString());
        map.put("immediateGrants", immediateGrants.sum());
        map.put("queuedGrants", queuedGrants.sum());
        map.put("timeouts", timeouts.sum());
        return map;
    }

    private static final class Waiter {
        private final Promise<Void> promise;
        private final long enqueuedNanos;
        private long timerId;

        private Waiter(Promise<Void> promise, long enqueuedNanos) {
            this.promise = promise;
            this.enqueuedNanos = enqueuedNanos;
        }

        private long waitedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - enqueuedNanos);
        }
    }
}
