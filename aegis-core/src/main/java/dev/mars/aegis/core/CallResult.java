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

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one call envelope invocation, produced exactly once per call and
 * consumed by the metrics rollup.
 *
 * @param endpoint    the endpoint name the call targeted
 * @param success     whether the call produced a usable response
 * @param attempts    transport attempts made; zero when the call never reached the transport
 * @param elapsed     wall time from entry into the envelope to completion
 * @param errorKind   failure classification, null on success
 * @param completedAt when the call finished
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record CallResult(
        String endpoint,
        boolean success,
        int attempts,
        Duration elapsed,
        ErrorKind errorKind,
        Instant completedAt
) {

    public CallResult {
        Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        Objects.requireNonNull(elapsed, "Elapsed time cannot be null");
        Objects.requireNonNull(completedAt, "Completion time cannot be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts cannot be negative: " + attempts);
        }
        if (success && errorKind != null) {
            throw new IllegalArgumentException("A successful call cannot carry an error kind");
        }
        if (!success && errorKind == null) {
            throw new IllegalArgumentException("A failed call must carry an error kind");
        }
    }

    public static CallResult succeeded(String endpoint, int attempts, Duration elapsed) {
        return new CallResult(endpoint, true, attempts, elapsed, null, Instant.now());
    }

    public static CallResult failed(String endpoint, int attempts, Duration elapsed, ErrorKind errorKind) {
        return new CallResult(endpoint, false, attempts, elapsed, errorKind, Instant.now());
    }

    public long elapsedMs() {
        return elapsed.toMillis();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("endpoint", endpoint);
        map.put("success", success);
        map.put("attempts", attempts);
        map.put("elapsedMs", elapsedMs());
        map.put("errorKind", errorKind != null ? errorKind.code() : null);
        map.put("completedAt", completedAt.toString());
        return map;
    }
}
