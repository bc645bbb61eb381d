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


package dev.mars.aegis.core;

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured error returned by a call envelope in place of a thrown exception.
 *
 * <p>Example JSON output:</p>
 * <pre>{@code
 * {
 *   "kind": "CIRCUIT_OPEN",
 *   "code": "A-2002",
 *   "message": "Circuit breaker is open: gateway:orders",
 *   "timestamp": "2026-03-02T10:00:00Z",
 *   "correlationId": "corr-1a2b3c4d"
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record CallError(
        ErrorKind kind,
        String code,
        String message,
        Instant timestamp,
        String correlationId,
        Map<String, Object> details
) {

    public CallError {
        Objects.requireNonNull(kind, "Error kind cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        code = code != null ? code : kind.shortCode();
        message = message != null ? message : kind.formatMessage("no detail");
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static CallError of(ErrorKind kind, String message) {
        return new CallError(kind, kind.shortCode(), message, Instant.now(), null, null);
    }

    public static CallError of(ErrorKind kind, String message, String correlationId) {
        return new CallError(kind, kind.shortCode(), message, Instant.now(), correlationId, null);
    }

    /**
     * Returns a copy carrying the given correlation id, keeping an id that is already set.
     */
    public CallError withCorrelationId(String id) {
        if (correlationId != null || id == null) {
            return this;
        }
        return new CallError(kind, code, message, timestamp, id, details);
    }

    public CallError withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new CallError(kind, code, message, timestamp, correlationId, merged);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("kind", kind.code())
                .put("code", code)
                .put("message", message)
                .put("timestamp", timestamp.toString());
        if (correlationId != null) {
            json.put("correlationId", correlationId);
        }
        if (!details.isEmpty()) {
            json.put("details", new JsonObject(new LinkedHashMap<>(details)));
        }
        return json;
    }
}
