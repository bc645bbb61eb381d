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

import dev.mars.aegis.event.CallCompletedEvent;
import dev.mars.aegis.event.CircuitStateChangedEvent;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.event.RateLimitTimeoutEvent;
import dev.mars.aegis.event.RetryScheduledEvent;
import dev.mars.aegis.resilience.CircuitState;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * OpenTelemetry instruments fed from runtime events.
 *
 * Provides:
 * - aegis.calls.total (counter) - Calls completed, by endpoint and outcome
 * - aegis.calls.failed (counter) - Failed calls, by endpoint and error kind
 * - aegis.calls.duration (histogram) - Call duration in milliseconds
 * - aegis.retries.total (counter) - Retries scheduled
 * - aegis.circuit.transitions (counter) - Circuit breaker state changes
 * - aegis.circuit.state (gauge) - Current breaker state (0=closed, 1=half-open, 2=open)
 * - aegis.ratelimit.timeouts (counter) - Rate limit waits that timed out
 *
 * <p>Without an installed OpenTelemetry SDK the global meter is a no-op.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class ResilienceMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceMetrics.class);
    private static final String METER_NAME = "aegis-runtime";

    private static final AttributeKey<String> ENDPOINT_KEY = AttributeKey.stringKey("endpoint");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    private static final AttributeKey<String> ERROR_KIND_KEY = AttributeKey.stringKey("error.kind");
    private static final AttributeKey<String> STATE_KEY = AttributeKey.stringKey("state");

    private final LongCounter callsTotal;
    private final LongCounter callsFailed;
    private final DoubleHistogram callDuration;
    private final LongCounter retriesTotal;
    private final LongCounter circuitTransitions;
    private final LongCounter rateLimitTimeouts;
    private final Map<String, CircuitState> circuitStates = new ConcurrentHashMap<>();

    public ResilienceMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        callsTotal = meter.counterBuilder("aegis.calls.total")
                .setDescription("Total number of completed calls")
                .setUnit("1")
                .build();

        callsFailed = meter.counterBuilder("aegis.calls.failed")
                .setDescription("Number of failed calls")
                .setUnit("1")
                .build();

        callDuration = meter.histogramBuilder("aegis.calls.duration")
                .setDescription("Call duration including queueing and retries")
                .setUnit("ms")
                .build();

        retriesTotal = meter.counterBuilder("aegis.retries.total")
                .setDescription("Number of retries scheduled")
                .setUnit("1")
                .build();

        circuitTransitions = meter.counterBuilder("aegis.circuit.transitions")
                .setDescription("Number of circuit breaker state changes")
                .setUnit("1")
                .build();

        rateLimitTimeouts = meter.counterBuilder("aegis.ratelimit.timeouts")
                .setDescription("Number of rate limit waits that timed out")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("aegis.circuit.state")
                .setDescription("Circuit breaker state (0=closed, 1=half-open, 2=open)")
                .ofLongs()
                .buildWithCallback(measurement -> circuitStates.forEach((endpoint, state) ->
                        measurement.record(state.gaugeValue(), Attributes.of(ENDPOINT_KEY, endpoint))));

        logger.debug("ResilienceMetrics initialized");
    }

    /**
     * Subscribes the instruments to the given publisher.
     */
    public ResilienceMetrics attach(EventPublisher events) {
        events.subscribe(CallCompletedEvent.class, this::onCallCompleted);
        events.subscribe(RetryScheduledEvent.class, event ->
                retriesTotal.add(1, Attributes.of(ENDPOINT_KEY, event.endpoint(), ERROR_KIND_KEY, event.cause().code())));
        events.subscribe(CircuitStateChangedEvent.class, event -> {
            circuitStates.put(event.endpoint(), event.newState());
            circuitTransitions.add(1, Attributes.of(ENDPOINT_KEY, event.endpoint(), STATE_KEY, event.newState().getValue()));
        });
        events.subscribe(RateLimitTimeoutEvent.class, event ->
                rateLimitTimeouts.add(1, Attributes.of(ENDPOINT_KEY, event.endpoint())));
        return this;
    }

    private void onCallCompleted(CallCompletedEvent event) {
        var result = event.result();
        Attributes attrs = Attributes.of(ENDPOINT_KEY, result.endpoint(),
                OUTCOME_KEY, result.success() ? "success" : "failure");
        callsTotal.add(1, attrs);
        callDuration.record(result.elapsedMs(), Attributes.of(ENDPOINT_KEY, result.endpoint()));
        if (!result.success()) {
            callsFailed.add(1, Attributes.of(ENDPOINT_KEY, result.endpoint(), ERROR_KIND_KEY, result.errorKind().code()));
        }
    }
}
