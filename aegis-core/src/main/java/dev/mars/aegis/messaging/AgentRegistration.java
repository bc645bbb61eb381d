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


package dev.mars.aegis.messaging;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Objects;

/**
 * What an agent tells the hub about itself when it registers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public record AgentRegistration(
        String agentId,
        String agentType,
        List<String> capabilities,
        List<Subscription> subscriptions,
        String endpoint,
        long heartbeatIntervalMs
) {

    public AgentRegistration {
        Objects.requireNonNull(agentId, "Agent id cannot be null");
        capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        subscriptions = subscriptions != null ? List.copyOf(subscriptions) : List.of();
    }

    public JsonObject toJson() {
        JsonArray subs = new JsonArray();
        subscriptions.forEach(subscription -> subs.add(subscription.toJson()));
        return new JsonObject()
                .put("agentId", agentId)
                .put("agentType", agentType)
                .put("capabilities", new JsonArray(capabilities))
                .put("subscriptions", subs)
                .put("endpoint", endpoint)
                .put("heartbeatInterval", heartbeatIntervalMs);
    }
}
