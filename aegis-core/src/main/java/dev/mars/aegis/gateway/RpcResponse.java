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


package dev.mars.aegis.gateway;

import dev.mars.aegis.core.CallError;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.UUID;

/**
 * Normalized result of an RPC call. Exactly one of {@code data} and {@code error} is
 * meaningful, depending on {@code success}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public record RpcResponse(
        String id,
        String requestId,
        Instant timestamp,
        boolean success,
        Object data,
        CallError error,
        RpcResponseMetadata metadata
) {

    public static RpcResponse succeeded(String requestId, Object data, RpcResponseMetadata metadata) {
        return new RpcResponse(newId(), requestId, Instant.now(), true, data, null, metadata);
    }

    public static RpcResponse failed(String requestId, CallError error, RpcResponseMetadata metadata) {
        return new RpcResponse(newId(), requestId, Instant.now(), false, null, error, metadata);
    }

    /**
     * The payload as a JSON object, or null when the payload is absent or not an object.
     */
    public JsonObject dataAsJsonObject() {
        return data instanceof JsonObject json ? json : null;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("id", id)
                .put("requestId", requestId)
                .put("timestamp", timestamp.toString())
                .put("success", success)
                .put("metadata", metadata.toJson());
        if (data != null) {
            json.put("data", data);
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
