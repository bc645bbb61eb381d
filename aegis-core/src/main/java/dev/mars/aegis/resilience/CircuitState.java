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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Circuit breaker states.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 */
public enum CircuitState {

    /** Calls flow normally; consecutive service failures are counted */
    CLOSED("closed"),

    /** Calls are rejected until the cool-down elapses */
    OPEN("open"),

    /** A single trial call decides between closing and reopening */
    HALF_OPEN("half-open");

    private final String value;

    CircuitState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Numeric form used by the state gauge: 0 closed, 1 half-open, 2 open.
     */
    public int gaugeValue() {
        return switch (this) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    @Override
    public String toString() {
        return value;
    }
}
