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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a single health check.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class HealthCheckResult {

    public enum Status {
        PASS("pass"),
        WARN("warn"),
        FAIL("fail");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    private final String name;
    private final Status status;
    private final String message;
    private final long durationMs;
    private final Instant timestamp;
    private final Map<String, Object> details;

    private HealthCheckResult(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Check name cannot be null");
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.message = builder.message != null ? builder.message : "";
        this.durationMs = builder.durationMs;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.details = new LinkedHashMap<>(builder.details);
    }

    public static HealthCheckResult pass(String name, String message) {
        return builder(name).pass().message(message).build();
    }

    public static HealthCheckResult warn(String name, String message) {
        return builder(name).warn().message(message).build();
    }

    public static HealthCheckResult fail(String name, String message) {
        return builder(name).fail().message(message).build();
    }

    /**
     * Copy with the measured duration filled in by the monitor.
     */
    public HealthCheckResult withDuration(long durationMs) {
        return builder(name).status(status).message(message).timestamp(timestamp)
                .details(details).durationMs(durationMs).build();
    }

    public String getName() {
        return name;
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getDetails() {
        return new LinkedHashMap<>(details);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("status", status.getValue());
        map.put("message", message);
        map.put("durationMs", durationMs);
        if (!details.isEmpty()) {
            map.put("details", new LinkedHashMap<>(details));
        }
        return map;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private Status status = Status.PASS;
        private String message;
        private long durationMs;
        private Instant timestamp;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder pass() {
            this.status = Status.PASS;
            return this;
        }

        public Builder warn() {
            this.status = Status.WARN;
            return this;
        }

        public Builder fail() {
            this.status = Status.FAIL;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder detail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details.putAll(details);
            return this;
        }

        public HealthCheckResult build() {
            return new HealthCheckResult(this);
        }
    }
}
