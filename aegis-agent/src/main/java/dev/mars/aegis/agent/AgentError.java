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


package dev.mars.aegis.agent;

import dev.mars.aegis.core.CallError;
import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * An error recorded by the agent or returned in an {@link AgentResponse}.
 *
 * <p>Codes are either agent-level ({@link #AGENT_NOT_INITIALIZED}, {@link #AGENT_ERROR},
 * {@link #VALIDATION_ERROR}) or the code of the {@link dev.mars.aegis.core.ErrorKind}
 * of a failed outbound call.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
public record AgentError(String code, String message, Instant timestamp, String correlationId) {

    public static final String AGENT_NOT_INITIALIZED = "AGENT_NOT_INITIALIZED";
    public static final String AGENT_ERROR = "AGENT_ERROR";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    public static AgentError of(String code, String message, String correlationId) {
        return new AgentError(code, message, Instant.now(), correlationId);
    }

    public static AgentError from(CallError error) {
        return new AgentError(error.kind().code(), error.message(), error.timestamp(), error.correlationId());
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("code", code)
                .put("message", message)
                .put("timestamp", timestamp.toString());
        if (correlationId != null) {
            json.put("correlationId", correlationId);
        }
        return json;
    }
}
