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
import dev.mars.aegis.core.ErrorKind;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters and running-mean latency for the calls made to one endpoint.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class EndpointMetrics {

    private final String endpoint;

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long totalAttempts;
    private double averageLatencyMs;
    private long maxLatencyMs;
    private final Map<ErrorKind, Long> failuresByKind = new EnumMap<>(ErrorKind.class);
    private Instant lastCallTime;
    private boolean lastCallSuccess;

    public EndpointMetrics(String endpoint) {
        this.endpoint = endpoint;
    }

    public synchronized void record(CallResult result) {
        totalCalls++;
        totalAttempts += result.attempts();
        long latency = result.elapsedMs();
        averageLatencyMs += (latency - averageLatencyMs) / totalCalls;
        maxLatencyMs = Math.max(maxLatencyMs, latency);
        if (result.success()) {
            successfulCalls++;
        } else {
            failedCalls++;
            failuresByKind.merge(result.errorKind(), 1L, Long::sum);
        }
        lastCallTime = result.completedAt();
        lastCallSuccess = result.success();
    }

    public String getEndpoint() {
        return endpoint;
    }

    public synchronized long getTotalCalls() {
        return totalCalls;
    }

    public synchronized long getSuccessfulCalls() {
        return successfulCalls;
    }

    public synchronized long getFailedCalls() {
        return failedCalls;
    }

    public synchronized double getAverageLatencyMs() {
        return averageLatencyMs;
    }

    public synchronized long getFailures(ErrorKind kind) {
        return failuresByKind.getOrDefault(kind, 0L);
    }

    public synchronized double getErrorRate() {
        return totalCalls == 0 ? 0.0 : (double) failedCalls / totalCalls;
    }

    public synchronized Map<String, Object> toMap() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("endpoint", endpoint);
        metrics.put("totalCalls", totalCalls);
        metrics.put("successfulCalls", successfulCalls);
        metrics.put("failedCalls", failedCalls);
        metrics.put("totalAttempts", totalAttempts);
        metrics.put("errorRate", totalCalls == 0 ? 0.0 : (double) failedCalls / totalCalls);
        metrics.put("averageLatencyMs", averageLatencyMs);
        metrics.put("maxLatencyMs", maxLatencyMs);

        Map<String, Long> errors = new LinkedHashMap<>();
        failuresByKind.forEach((kind, count) -> errors.put(kind.code(), count));
        metrics.put("failuresByKind", errors);

        if (lastCallTime != null) {
            metrics.put("lastCallTime", lastCallTime.toString());
            metrics.put("lastCallSuccess", lastCallSuccess);
        }
        return metrics;
    }
}
