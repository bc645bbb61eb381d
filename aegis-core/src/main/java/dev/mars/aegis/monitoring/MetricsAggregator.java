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


package dev.mars.aegis.monitoring;

import dev.mars.aegis.core.CallResult;
import dev.mars.aegis.event.CallCompletedEvent;
import dev.mars.aegis.event.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolls up call outcomes per endpoint and across the whole process.
 *
 * <p>Call envelopes publish a {@link CallCompletedEvent} for every invocation;
 * {@link #attach(EventPublisher)} subscribes this aggregator to them. Outcomes can also
 * be recorded directly through {@link #record(String, CallResult)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class MetricsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(MetricsAggregator.class);

    private final Map<String, EndpointMetrics> endpoints = new ConcurrentHashMap<>();
    private final Instant startTime = Instant.now();
    private EventPublisher.Subscription subscription;

    /**
     * Subscribes to call completions. Attaching a second time replaces the first subscription.
     */
    public synchronized MetricsAggregator attach(EventPublisher events) {
        Objects.requireNonNull(events, "Event publisher cannot be null");
        if (subscription != null) {
            subscription.cancel();
        }
        subscription = events.subscribe(CallCompletedEvent.class, event -> record(event.result()));
        return this;
    }

    public synchronized void detach() {
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
    }

    public void record(CallResult result) {
        record(result.endpoint(), result);
    }

    public void record(String endpoint, CallResult result) {
        Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        Objects.requireNonNull(result, "Call result cannot be null");
        endpoints.computeIfAbsent(endpoint, EndpointMetrics::new).record(result);
        if (!result.success()) {
            logger.debug("Recorded {} failure for {} in {}ms", result.errorKind(), endpoint, result.elapsedMs());
        }
    }

    public Optional<EndpointMetrics> getEndpointMetrics(String endpoint) {
        return Optional.ofNullable(endpoints.get(endpoint));
    }

    public long getTotalCalls() {
        return endpoints.values().stream().mapToLong(EndpointMetrics::getTotalCalls).sum();
    }

    public long getFailedCalls() {
        return endpoints.values().stream().mapToLong(EndpointMetrics::getFailedCalls).sum();
    }

    /**
     * Failed calls over all calls, across every endpoint; zero before the first call.
     */
    public double getGlobalErrorRate() {
        long total = getTotalCalls();
        return total == 0 ? 0.0 : (double) getFailedCalls() / total;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("startTime", startTime.toString());
        metrics.put("uptime", Duration.between(startTime, Instant.now()).toString());
        metrics.put("totalCalls", getTotalCalls());
        metrics.put("failedCalls", getFailedCalls());
        metrics.put("errorRate", getGlobalErrorRate());

        Map<String, Object> perEndpoint = new LinkedHashMap<>();
        endpoints.keySet().stream().sorted()
                .forEach(name -> perEndpoint.put(name, endpoints.get(name).toMap()));
        metrics.put("endpoints", perEndpoint);
        return metrics;
    }
}
