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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A request handed to the agent for processing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
public record AgentRequest(
        String id,
        Instant timestamp,
        String correlationId,
        JsonObject payload,
        Map<String, Object> metadata
) {

    public AgentRequest {
        payload = payload != null ? payload.copy() : null;
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static AgentRequest of(JsonObject payload) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return new AgentRequest("req_" + suffix, Instant.now(), "corr_" + suffix, payload, null);
    }
}
