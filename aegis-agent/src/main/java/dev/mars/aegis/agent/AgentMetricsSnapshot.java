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

/**
 * Point-in-time copy of the agent's metrics.
 *
 * @param requestsProcessed     requests accepted while running
 * @param averageResponseTimeMs running mean processing time of those requests
 * @param errorRate             failed requests over requests processed
 * @param uptimeMs              time since the last successful initialization
 * @param memoryUsageMb         heap in use, in megabytes
 * @param cpuUsage              system load per processor, as a percentage
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
public record AgentMetricsSnapshot(
        long requestsProcessed,
        double averageResponseTimeMs,
        double errorRate,
        long uptimeMs,
        long memoryUsageMb,
        double cpuUsage
) {

    public static final AgentMetricsSnapshot EMPTY = new AgentMetricsSnapshot(0, 0.0, 0.0, 0, 0, 0.0);

    public JsonObject toJson() {
        return new JsonObject()
                .put("requestsProcessed", requestsProcessed)
                .put("averageResponseTime", averageResponseTimeMs)
                .put("errorRate", errorRate)
                .put("uptime", uptimeMs)
                .put("memoryUsage", memoryUsageMb)
                .put("cpuUsage", cpuUsage);
    }
}
