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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.List;

/**
 * Status view served on {@code GET /status}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
public record AgentHealthStatus(
        String agentId,
        AgentStatus status,
        boolean healthy,
        long uptimeMs,
        Instant lastHeartbeat,
        AgentMetricsSnapshot metrics,
        List<AgentError> recentErrors
) {

    public AgentHealthStatus {
        recentErrors = recentErrors != null ? List.copyOf(recentErrors) : List.of();
    }

    public AgentError lastError() {
        return recentErrors.isEmpty() ? null : recentErrors.get(recentErrors.size() - 1);
    }

    public JsonObject toJson() {
        JsonArray errors = new JsonArray();
        recentErrors.forEach(error -> errors.add(error.toJson()));
        JsonObject json = new JsonObject()
                .put("agentId", agentId)
                .put("status", status.getValue())
                .put("healthy", healthy)
                .put("uptime", uptimeMs)
                .put("lastHeartbeat", lastHeartbeat.toString())
                .put("metrics", metrics.toJson())
                .put("recentErrors", errors);
        AgentError last = lastError();
        if (last != null) {
            json.put("lastError", last.toJson());
        }
        return json;
    }
}
