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


package dev.mars.aegis.event;

import dev.mars.aegis.core.CallResult;
import dev.mars.aegis.core.ErrorKind;
import dev.mars.aegis.resilience.CircuitState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventPublisher")
class EventPublisherTest {

    private static CircuitStateChangedEvent opened() {
        return new CircuitStateChangedEvent("generation", CircuitState.CLOSED, CircuitState.OPEN, 5,
                Instant.now());
    }

    @Test
    @DisplayName("Should deliver events only to listeners of a matching type")
    void deliversByType() {
        EventPublisher events = new EventPublisher();
        List<RuntimeEvent> all = new ArrayList<>();
        List<CircuitStateChangedEvent> circuits = new ArrayList<>();
        events.subscribe(RuntimeEvent.class, all::add);
        events.subscribe(CircuitStateChangedEvent.class, circuits::add);

        events.publish(opened());
        events.publish(new RetryScheduledEvent("generation", 1, 1000, ErrorKind.UPSTREAM_SERVICE_ERROR,
                Instant.now()));

        assertEquals(2, all.size());
        assertEquals(1, circuits.size());
        assertEquals(CircuitState.OPEN, circuits.get(0).newState());
    }

    @Test
    @DisplayName("A failing listener should not stop delivery to the others")
    void isolatesListenerFailures() {
        EventPublisher events = new EventPublisher();
        List<CallCompletedEvent> received = new ArrayList<>();
        events.subscribe(CallCompletedEvent.class, event -> {
            throw new IllegalStateException("listener bug");
        });
        events.subscribe(CallCompletedEvent.class, received::add);

        events.publish(new CallCompletedEvent(
                CallResult.succeeded("generation", 1, Duration.ofMillis(5))));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Cancelled subscriptions stop receiving events")
    void cancel() {
        EventPublisher events = new EventPublisher();
        List<RuntimeEvent> received = new ArrayList<>();
        EventPublisher.Subscription subscription = events.subscribe(RuntimeEvent.class, received::add);

        subscription.cancel();
        events.publish(opened());

        assertTrue(received.isEmpty());
        assertEquals(0, events.listenerCount());
    }
}
