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


package dev.mars.aegis.monitoring.health;

import com.fasterxml.jackson.annotation.JsonValue;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Rolled-up result of one health check run.
 *
 * <p>Any {@code fail} makes the report {@code unhealthy}; otherwise any {@code warn} makes it
 * {@code degraded}; otherwise it is {@code healthy}. A report with no checks is healthy.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public record HealthReport(Status status, List<HealthCheckResult> checks, Instant timestamp, long durationMs) {

    public enum Status {
        HEALTHY("healthy"),
        DEGRADED("degraded"),
        UNHEALTHY("unhealthy");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    public HealthReport {
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        checks = List.copyOf(checks);
    }

    public static HealthReport of(List<HealthCheckResult> checks, long durationMs) {
        return new HealthReport(rollUp(checks), checks, Instant.now(), durationMs);
    }

    public static Status rollUp(List<HealthCheckResult> checks) {
        boolean warned = false;
        for (HealthCheckResult check : checks) {
            if (check.getStatus() == HealthCheckResult.Status.FAIL) {
                return Status.UNHEALTHY;
            }
            warned |= check.getStatus() == HealthCheckResult.Status.WARN;
        }
        return warned ? Status.DEGRADED : Status.HEALTHY;
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }

    public JsonObject toJson() {
        JsonArray checkArray = new JsonArray();
        checks.forEach(check -> checkArray.add(new JsonObject(check.toMap())));
        return new JsonObject()
                .put("status", status.getValue())
                .put("checks", checkArray)
                .put("timestamp", timestamp.toString())
                .put("durationMs", durationMs);
    }
}
