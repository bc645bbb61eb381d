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

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Domain logic of an agent. The lifecycle manager validates each request, calls
 * {@link #handle}, and wraps the outcome in an {@link AgentResponse}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
public interface AgentHandler {

    /**
     * @return the response payload; a failed future becomes a failed response
     */
    Future<JsonObject> handle(AgentRequest request, AgentContext context);

    /**
     * Called once during initialization, after the agent has registered with the peer hub.
     * Handlers subscribe to topics here.
     */
    default Future<Void> start(AgentContext context) {
        return Future.succeededFuture();
    }

    /**
     * Called once during shutdown.
     */
    default Future<Void> cleanup() {
        return Future.succeededFuture();
    }
}
