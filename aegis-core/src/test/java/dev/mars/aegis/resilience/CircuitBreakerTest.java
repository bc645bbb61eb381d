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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for circuit breaker state transitions, driven by a clock the test controls.
 */
@DisplayName("CircuitBreaker")
class CircuitBreakerTest {

    private static final Duration COOL_DOWN = Duration.ofSeconds(30);

    private MutableClock clock;
    private List<CircuitStateChangedEvent> transitions;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingNow();
        transitions = new CopyOnWriteArrayList<>();
        EventPublisher events = new EventPublisher();
        events.subscribe(CircuitStateChangedEvent.class, transitions::add);
        breaker = new CircuitBreaker("inventory", 3, COOL_DOWN, clock, events);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            assertTrue(breaker.tryAcquirePermission());
            breaker.onFailure();
        }
    }

    @Nested
    @DisplayName("Closed state")
    class Closed {

        @Test
        @DisplayName("Should stay closed below the threshold")
        void staysClosedBelowThreshold() {
            fail(2);

            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(2, breaker.getConsecutiveFailures());
            assertTrue(transitions.isEmpty());
        }

        @Test
        @DisplayName("Success should reset the consecutive failure count")
        void successResetsCount() {
            fail(2);
            assertTrue(breaker.tryAcquirePermission());
            breaker.onSuccess();
            fail(2);

            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(2, breaker.getConsecutiveFailures());
        }

        @Test
        @DisplayName("Ignored outcomes should not count as failures")
        void ignoredDoesNotCount() {
            for (int i = 0; i < 5; i++) {
                assertTrue(breaker.tryAcquirePermission());
                breaker.onIgnored();
            }

            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(0, breaker.getConsecutiveFailures());
        }
    }

    @Nested
    @DisplayName("Open state")
    class Open {

        @Test
        @DisplayName("Should open at the threshold and publish the transition")
        void opensAtThreshold() {
            fail(3);

            assertEquals(CircuitState.OPEN, breaker.getState());
            assertEquals(clock.instant().plus(COOL_DOWN), breaker.getOpenedUntil());
            assertEquals(1, transitions.size());
            assertEquals(CircuitState.CLOSED, transitions.get(0).previousState());
            assertEquals(CircuitState.OPEN, transitions.get(0).newState());
        }

        @Test
        @DisplayName("Should reject calls while the cool-down runs")
        void rejectsDuringCoolDown() {
            fail(3);
            clock.advance(COOL_DOWN.minusMillis(1));

            assertFalse(breaker.tryAcquirePermission());
            assertEquals(CircuitState.OPEN, breaker.getState());
            assertEquals(1, breaker.getRejectedCalls());
        }

        @Test
        @DisplayName("Should move to half-open once the cool-down has elapsed")
        void halfOpensAfterCoolDown() {
            fail(3);
            clock.advance(COOL_DOWN);

            assertEquals(CircuitState.HALF_OPEN, breaker.getState());
            assertEquals(CircuitState.HALF_OPEN, transitions.get(transitions.size() - 1).newState());
        }
    }

    @Nested
    @DisplayName("Half-open state")
    class HalfOpen {

        @BeforeEach
        void openAndWait() {
            fail(3);
            clock.advance(COOL_DOWN);
        }

        @Test
        @DisplayName("Should let exactly one trial call through")
        void singleTrialCall() {
            assertTrue(breaker.tryAcquirePermission(), "First caller is the trial call");
            assertFalse(breaker.tryAcquirePermission(), "Concurrent caller is short-circuited");
            assertFalse(breaker.tryAcquirePermission());
        }

        @Test
        @DisplayName("Successful trial call should close the breaker and reset the count")
        void trialSuccessCloses() {
            assertTrue(breaker.tryAcquirePermission());
            breaker.onSuccess();

            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(0, breaker.getConsecutiveFailures());
            assertTrue(breaker.tryAcquirePermission());
        }

        @Test
        @DisplayName("Failed trial call should reopen with a restarted cool-down")
        void trialFailureReopens() {
            clock.advance(Duration.ofSeconds(5));
            assertTrue(breaker.tryAcquirePermission());
            breaker.onFailure();

            assertEquals(CircuitState.OPEN, breaker.getState());
            assertEquals(clock.instant().plus(COOL_DOWN), breaker.getOpenedUntil());

            clock.advance(COOL_DOWN.minusSeconds(1));
            assertFalse(breaker.tryAcquirePermission());
            clock.advance(Duration.ofSeconds(1));
            assertTrue(breaker.tryAcquirePermission());
        }

        @Test
        @DisplayName("Ignored trial call should release the slot and stay half-open")
        void ignoredTrialCallReleasesSlot() {
            assertTrue(breaker.tryAcquirePermission());
            breaker.onIgnored();

            assertEquals(CircuitState.HALF_OPEN, breaker.getState());
            assertTrue(breaker.tryAcquirePermission(), "Slot should be free for the next trial call");
        }

        @Test
        @DisplayName("Should publish every transition in order")
        void publishesTransitions() {
            assertTrue(breaker.tryAcquirePermission());
            breaker.onSuccess();

            List<CircuitState> states = transitions.stream().map(CircuitStateChangedEvent::newState).toList();
            assertEquals(List.of(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED), states);
        }
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void rejectsInvalidThreshold() {
        assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker("x", 0, COOL_DOWN, clock, new EventPublisher()));
    }

    @Test
    @DisplayName("toMap should expose the current state")
    void toMapExposesState() {
        fail(3);

        assertEquals("open", breaker.toMap().get("state"));
        assertEquals(3, breaker.toMap().get("consecutiveFailures"));
    }
}
