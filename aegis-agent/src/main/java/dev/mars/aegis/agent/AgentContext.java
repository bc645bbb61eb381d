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

import dev.mars.aegis.generation.GenerationRequest;
import dev.mars.aegis.generation.GenerationResponse;
import dev.mars.aegis.messaging.DeliveryReceipt;
import dev.mars.aegis.messaging.PeerMessageHandler;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

import java.util.Map;

/**
 * What an {@link AgentHandler} may do besides computing its response: talk to peers,
 * query gateway services and call the AI service, all through the agent's call envelopes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
public interface AgentContext {

    String agentId();

    /**
     * Publishes a message to a topic, or to one agent when {@code targetAgent} is not null.
     */
    Future<DeliveryReceipt> sendMessage(String topic, String messageType, JsonObject payload, String targetAgent);

    /**
     * Calls a gateway operation and returns its data. Fails when the gateway response is
     * unsuccessful.
     */
    Future<Object> queryService(String service, String operation, Map<String, Object> parameters);

    Future<GenerationResponse> generate(GenerationRequest request);

    Future<Void> subscribe(String topic, PeerMessageHandler handler);
}
