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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Typed observer registry shared by the components of one agent process.
 *
 * <p>Listeners are invoked synchronously on the publishing thread, in registration
 * order. A listener that throws is logged and does not prevent delivery to the
 * remaining listeners or affect the publisher.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public class EventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();

    /**
     * Registers a listener for events assignable to the given type.
     *
     * @return a handle that removes the listener when cancelled
     */
    public <E extends RuntimeEvent> Subscription subscribe(Class<E> eventType, RuntimeEventListener<? super E> listener) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(listener, "Listener cannot be null");
        Registration<E> registration = new Registration<>(eventType, listener);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    public void publish(RuntimeEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        for (Registration<?> registration : registrations) {
            registration.deliver(event);
        }
    }

    public int listenerCount() {
        return registrations.size();
    }

    /**
     * Handle returned by {@link #subscribe}.
     */
    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }

    private record Registration<E extends RuntimeEvent>(Class<E> eventType, RuntimeEventListener<? super E> listener) {

        void deliver(RuntimeEvent event) {
            if (!eventType.isInstance(event)) {
                return;
            }
            try {
                listener.onEvent(eventType.cast(event));
            } catch (RuntimeException e) {
                logger.warn("Listener for {} failed: {}", eventType.getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
