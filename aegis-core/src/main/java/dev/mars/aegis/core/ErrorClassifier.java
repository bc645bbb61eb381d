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

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.aegis.core.exceptions.CallException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.EncodeException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps arbitrary failures and HTTP status codes onto {@link ErrorKind}.
 *
 * <p>Anything the classifier does not recognise is treated as an upstream failure:
 * connection refusals, resets and timeouts all mean the remote side did not answer.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static ErrorKind classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof CallException callException) {
            return callException.getKind();
        }
        if (cause instanceof EncodeException) {
            return ErrorKind.VALIDATION_ERROR;
        }
        if (cause instanceof DecodeException || cause instanceof JsonProcessingException) {
            return ErrorKind.PARSE_ERROR;
        }
        return ErrorKind.UPSTREAM_SERVICE_ERROR;
    }

    /**
     * Classifies a non-2xx HTTP status returned by a remote service.
     */
    public static ErrorKind classifyHttpStatus(int status) {
        return switch (status) {
            case 400, 404, 405, 413, 422 -> ErrorKind.VALIDATION_ERROR;
            case 401 -> ErrorKind.AUTH_ERROR;
            case 403 -> ErrorKind.PERMISSION_ERROR;
            default -> ErrorKind.UPSTREAM_SERVICE_ERROR;
        };
    }

    /**
     * Builds the exception a transport fails with when the remote answered with a non-2xx status.
     */
    public static CallException fromHttpStatus(String endpoint, int status, String reason) {
        ErrorKind kind = classifyHttpStatus(status);
        String detail = String.format("%s answered HTTP %d%s", endpoint, status,
                reason == null || reason.isBlank() ? "" : " (" + reason + ")");
        CallError error = CallError.of(kind, kind.formatMessage(detail)).withDetail("httpStatus", status);
        return new CallException(error);
    }

    /**
     * Converts any failure into the structured error a call envelope returns.
     */
    public static CallError toCallError(Throwable failure, String correlationId) {
        Throwable cause = unwrap(failure);
        if (cause instanceof CallException callException) {
            return callException.getError().withCorrelationId(correlationId);
        }
        ErrorKind kind = classify(cause);
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return CallError.of(kind, kind.formatMessage(detail), correlationId);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
