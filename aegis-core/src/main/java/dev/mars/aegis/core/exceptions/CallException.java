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


package dev.mars.aegis.core.exceptions;

import dev.mars.aegis.core.CallError;
import dev.mars.aegis.core.ErrorKind;

import java.util.Objects;

/**
 * Unchecked exception carrying a {@link CallError} through a failed Vert.x future.
 *
 * <p>Transports and resilience components fail their futures with this exception so
 * that the retry executor and the call envelope can classify the failure without
 * inspecting messages. The envelope converts it back into a {@link CallError} before
 * anything leaves its boundary.</p>
 *
 * <pre>{@code
 * if (response.statusCode() == 401) {
 *     return Future.failedFuture(CallException.auth("invalid API key"));
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class CallException extends RuntimeException {

    private final CallError error;

    public CallException(CallError error) {
        super(Objects.requireNonNull(error, "Call error cannot be null").message());
        this.error = error;
    }

    public CallException(CallError error, Throwable cause) {
        super(Objects.requireNonNull(error, "Call error cannot be null").message(), cause);
        this.error = error;
    }

    public CallError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.kind();
    }

    // ==================== Factory Methods ====================

    public static CallException validation(String detail) {
        return of(ErrorKind.VALIDATION_ERROR, detail, null);
    }

    public static CallException validation(String detail, Throwable cause) {
        return of(ErrorKind.VALIDATION_ERROR, detail, cause);
    }

    public static CallException auth(String detail) {
        return of(ErrorKind.AUTH_ERROR, detail, null);
    }

    public static CallException permission(String detail) {
        return of(ErrorKind.PERMISSION_ERROR, detail, null);
    }

    public static CallException rateLimitTimeout(String endpoint, long waitedMs) {
        return of(ErrorKind.RATE_LIMIT_TIMEOUT,
                String.format("no token for '%s' within %d ms", endpoint, waitedMs), null);
    }

    public static CallException circuitOpen(String endpoint) {
        return of(ErrorKind.CIRCUIT_OPEN, endpoint, null);
    }

    public static CallException upstream(String detail) {
        return of(ErrorKind.UPSTREAM_SERVICE_ERROR, detail, null);
    }

    public static CallException upstream(String detail, Throwable cause) {
        return of(ErrorKind.UPSTREAM_SERVICE_ERROR, detail, cause);
    }

    public static CallException parse(String detail, Throwable cause) {
        return of(ErrorKind.PARSE_ERROR, detail, cause);
    }

    private static CallException of(ErrorKind kind, String detail, Throwable cause) {
        CallError error = CallError.of(kind, kind.formatMessage(detail));
        return cause == null ? new CallException(error) : new CallException(error, cause);
    }
}
