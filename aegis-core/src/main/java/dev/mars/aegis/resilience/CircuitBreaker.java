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

import dev.mars.aegis.event.CircuitStateChangedEvent;
import dev.mars.aegis.event.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * Consecutive-failure circuit breaker for one endpoint.
 *
 * <p>Transitions:</p>
 * <pre>
 *   CLOSED    --(failures >= threshold)--> OPEN
 *   OPEN      --(cool-down elapsed)-----> HALF_OPEN
 *   HALF_OPEN --(trial succeeded)--------> CLOSED
 *   HALF_OPEN --(trial failed)-----------> OPEN (cool-down restarts)
 * </pre>
 *
 * <p>The OPEN to HALF_OPEN transition is evaluated against the clock whenever the
 * breaker is consulted. Exactly one caller obtains the trial permit in HALF_OPEN;
 * everyone else is rejected until the trial call reports back.</p>
 *
 * <p>Callers follow the protocol {@link #tryAcquirePermission()} followed by exactly
 * one of {@link #onSuccess()}, {@link #onFailure()} or {@link #onIgnored()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String endpoint;
    private final int failureThreshold;
    private final Duration openDuration;
    private final Clock clock;
    private final EventPublisher events;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant lastFailureTime;
    private Instant openedUntil;
    private boolean trialInFlight;

    private final LongAdder rejectedCalls = new LongAdder();
    private final LongAdder timesOpened = new LongAdder();

    public CircuitBreaker(String endpoint, int failureThreshold, Duration openDuration, EventPublisher events) {
        this(endpoint, failureThreshold, openDuration, Clock.systemUTC(), events);
    }

    public CircuitBreaker(String endpoint, int failureThreshold, Duration openDuration, Clock clock,
                          EventPublisher events) {
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        this.openDuration = Objects.requireNonNull(openDuration, "Open duration cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("Failure threshold must be positive, got: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
    }

    /**
     * Asks whether a call may proceed. A true result must be followed by exactly one outcome report.
     */
    public boolean tryAcquirePermission() {
        CircuitStateChangedEvent transition;
        boolean permitted;
        synchronized (this) {
            transition = refreshState();
            permitted = switch (state) {
                case CLOSED -> true;
                case OPEN -> false;
                case HALF_OPEN -> {
                    if (trialInFlight) {
                        yield false;
                    }
                    trialInFlight = true;
                    yield true;
                }
            };
            if (!permitted) {
                rejectedCalls.increment();
            }
        }
        publish(transition);
        return permitted;
    }

    public void onSuccess() {
        CircuitStateChangedEvent transition = null;
        synchronized (this) {
            if (state == CircuitState.HALF_OPEN) {
                trialInFlight = false;
                consecutiveFailures = 0;
                transition = transitionTo(CircuitState.CLOSED);
            } else if (state == CircuitState.CLOSED) {
                consecutiveFailures = 0;
            }
        }
        publish(transition);
    }

    /**
     * Records a confirmed service failure.
     */
    public void onFailure() {
        CircuitStateChangedEvent transition = null;
        synchronized (this) {
            consecutiveFailures++;
            lastFailureTime = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                trialInFlight = false;
                transition = open();
            } else if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
                transition = open();
            }
        }
        publish(transition);
    }

    /**
     * Releases a permit whose call ended without saying anything about the service,
     * such as an authentication or rate-limit failure. A half-open breaker stays half-open.
     */
    public synchronized void onIgnored() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    // ==================== State ====================

    public CircuitState getState() {
        CircuitStateChangedEvent transition;
        CircuitState current;
        synchronized (this) {
            transition = refreshState();
            current = state;
        }
        publish(transition);
        return current;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public synchronized Instant getOpenedUntil() {
        return openedUntil;
    }

    public long getRejectedCalls() {
        return rejectedCalls.sum();
    }

    public Map<String, Object> toMap() {
        CircuitState current = getState();
        Map<String, Object> map = new LinkedHashMap<>();
        synchronized (this) {
            map.put("endpoint", endpoint);
            map.put("state", current.getValue());
            map.put("consecutiveFailures", consecutiveFailures);
            map.put("failureThreshold", failureThreshold);
            map.put("lastFailureTime", lastFailureTime != null ? lastFailureTime.toString() : null);
            map.put("openedUntil", openedUntil != null ? openedUntil.toString() : null);
        }
        map.put("rejectedCalls", rejectedCalls.sum());
        map.put("timesOpened", timesOpened.sum());
        return map;
    }

    // ==================== Transitions (caller holds the lock) ====================

    private CircuitStateChangedEvent refreshState() {
        if (state == CircuitState.OPEN && !clock.instant().isBefore(openedUntil)) {
            trialInFlight = false;
            return transitionTo(CircuitState.HALF_OPEN);
        }
        return null;
    }

    private CircuitStateChangedEvent open() {
        openedUntil = clock.instant().plus(openDuration);
        timesOpened.increment();
        return transitionTo(CircuitState.OPEN);
    }

    private CircuitStateChangedEvent transitionTo(CircuitState newState) {
        CircuitState previous = state;
        state = newState;
        return new CircuitStateChangedEvent(endpoint, previous, newState, consecutiveFailures, clock.instant());
    }

    private void publish(CircuitStateChangedEvent transition) {
        if (transition == null) {
            return;
        }
        if (transition.newState() == CircuitState.OPEN) {
            logger.warn("Circuit for {} opened after {} consecutive failure(s), retry after {}",
                    endpoint, transition.consecutiveFailures(), openedUntilSnapshot());
        } else {
            logger.info("Circuit for {} moved {} -> {}", endpoint, transition.previousState(), transition.newState());
        }
        events.publish(transition);
    }

    private synchronized Instant openedUntilSnapshot() {
        return openedUntil;
    }
}
