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

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An RPC request routed through the data gateway to one configured service.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public record RpcRequest(
        String id,
        Instant timestamp,
        String service,
        String operation,
        Map<String, Object> parameters,
        RpcMetadata metadata
) {

    public RpcRequest {
        parameters = parameters == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Builds a request with a fresh id and correlation id.
     */
    public static RpcRequest of(String service, String operation, Map<String, Object> parameters, String agentId) {
        return new RpcRequest("mcp_" + shortId(), Instant.now(), service, operation,
                parameters != null ? parameters : Map.of(), RpcMetadata.of("corr_" + shortId(), agentId));
    }

    public RpcRequest withMetadata(RpcMetadata newMetadata) {
        return new RpcRequest(id, timestamp, service, operation, parameters, newMetadata);
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("id", id)
                .put("timestamp", timestamp.toString())
                .put("service", service)
                .put("operation", operation)
                .put("parameters", new JsonObject(new LinkedHashMap<>(parameters)))
                .put("metadata", metadata.toJson());
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
