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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the delay between retries grows with the attempt number.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum BackoffStrategy {

    /** initialDelay x attempt */
    LINEAR("linear"),

    /** initialDelay x 2^(attempt-1) */
    EXPONENTIAL("exponential");

    private final String value;

    BackoffStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Unclamped delay in milliseconds after the given 1-based attempt failed.
     */
    public double baseDelayMs(long initialDelayMs, int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be at least 1, got: " + attempt);
        }
        return switch (this) {
            case LINEAR -> (double) initialDelayMs * attempt;
            case EXPONENTIAL -> initialDelayMs * Math.pow(2, attempt - 1);
        };
    }

    @JsonCreator
    public static BackoffStrategy fromValue(String value) {
        for (BackoffStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value.trim())) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown backoff strategy: " + value);
    }
}
