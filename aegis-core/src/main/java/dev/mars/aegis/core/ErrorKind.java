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

import java.util.Arrays;
import java.util.Optional;

/**
 * Classification of every failure a call envelope can return.
 *
 * <p>Each kind carries:</p>
 * <ul>
 *   <li>A stable machine-readable code (e.g., "CIRCUIT_OPEN")</li>
 *   <li>A short code for log correlation (e.g., "A-2002")</li>
 *   <li>Whether the retry executor may try the call again</li>
 *   <li>Whether the failure counts against the endpoint's circuit breaker</li>
 * </ul>
 *
 * <p>Only {@link #UPSTREAM_SERVICE_ERROR} is retryable and only it trips the breaker.
 * Rate-limit timeouts and open circuits never reach the transport, so they say
 * nothing about the health of the remote service.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ErrorKind {

    // ==================== Caller Errors (1xxx) ====================

    /** Request failed shape validation before any resilience state was touched */
    VALIDATION_ERROR("VALIDATION_ERROR", "A-1001", false, false, "Invalid request: %s"),

    /** Remote service rejected the credentials */
    AUTH_ERROR("AUTH_ERROR", "A-1002", false, false, "Authentication failed: %s"),

    /** Credentials accepted but not allowed to perform the operation */
    PERMISSION_ERROR("PERMISSION_ERROR", "A-1003", false, false, "Permission denied: %s"),

    // ==================== Local Resilience Errors (2xxx) ====================

    /** Caller waited in the rate limiter queue longer than allowed */
    RATE_LIMIT_TIMEOUT("RATE_LIMIT_TIMEOUT", "A-2001", false, false, "Rate limit wait timed out: %s"),

    /** Circuit breaker short-circuited the call */
    CIRCUIT_OPEN("CIRCUIT_OPEN", "A-2002", false, false, "Circuit breaker is open: %s"),

    // ==================== Remote Errors (3xxx) ====================

    /** Server-side failure, transport timeout or connection failure */
    UPSTREAM_SERVICE_ERROR("UPSTREAM_SERVICE_ERROR", "A-3001", true, true, "Upstream service error: %s"),

    /** Transport succeeded but the body could not be understood */
    PARSE_ERROR("PARSE_ERROR", "A-3002", false, false, "Malformed response: %s");

    private final String code;
    private final String shortCode;
    private final boolean retryable;
    private final boolean breakerFailure;
    private final String messageTemplate;

    ErrorKind(String code, String shortCode, boolean retryable, boolean breakerFailure, String messageTemplate) {
        this.code = code;
        this.shortCode = shortCode;
        this.retryable = retryable;
        this.breakerFailure = breakerFailure;
        this.messageTemplate = messageTemplate;
    }

    public String code() {
        return code;
    }

    public String shortCode() {
        return shortCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns true if an outcome of this kind increments the circuit breaker failure counter.
     */
    public boolean countsAgainstBreaker() {
        return breakerFailure;
    }

    public String messageTemplate() {
        return messageTemplate;
    }

    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }

    /**
     * Looks up an ErrorKind by its string code.
     */
    public static Optional<ErrorKind> fromCode(String code) {
        return Arrays.stream(values())
                .filter(kind -> kind.code.equals(code))
                .findFirst();
    }
}
