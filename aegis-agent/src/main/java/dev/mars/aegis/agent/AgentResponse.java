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

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of {@link AgentLifecycleManager#processRequest(AgentRequest)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
public record AgentResponse(
        String id,
        String requestId,
        Instant timestamp,
        boolean success,
        JsonObject payload,
        AgentError error,
        long processingTimeMs
) {

    public static AgentResponse succeeded(String requestId, JsonObject payload, long processingTimeMs) {
        return new AgentResponse(newId(), requestId, Instant.now(), true, payload, null, processingTimeMs);
    }

    public static AgentResponse failed(String requestId, AgentError error, long processingTimeMs) {
        return new AgentResponse(newId(), requestId, Instant.now(), false, null, error, processingTimeMs);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("id", id)
                .put("requestId", requestId)
                .put("timestamp", timestamp.toString())
                .put("success", success)
                .put("processingTime", processingTimeMs);
        if (payload != null) {
            json.put("payload", payload);
        }
        if (error != null) {
            json.put("error", error.toJson());
        }
        return json;
    }

    private static String newId() {
        return "response_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
