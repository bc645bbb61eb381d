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

import dev.mars.aegis.core.Priority;
import io.vertx.core.json.JsonObject;

/**
 * Per-call metadata of an RPC request.
 *
 * @param correlationId links the request to its response and side effects
 * @param timeoutMs     transport timeout for this call; 0 uses the service default
 * @param priority      delivery priority
 * @param agentId       the calling agent
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public record RpcMetadata(String correlationId, long timeoutMs, Priority priority, String agentId) {

    public RpcMetadata {
        priority = priority != null ? priority : Priority.NORMAL;
    }

    public static RpcMetadata of(String correlationId, String agentId) {
        return new RpcMetadata(correlationId, 0, Priority.NORMAL, agentId);
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("correlationId", correlationId)
                .put("timeout", timeoutMs)
                .put("priority", priority.getValue())
                .put("agentId", agentId);
    }
}
