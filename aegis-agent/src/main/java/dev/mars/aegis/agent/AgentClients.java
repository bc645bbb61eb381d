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

import dev.mars.aegis.envelope.CallEnvelope;
import dev.mars.aegis.gateway.GatewayClient;
import dev.mars.aegis.generation.GenerationClient;
import dev.mars.aegis.messaging.PeerMessagingClient;
import dev.mars.aegis.resilience.EndpointResilience;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The built call envelopes an agent works with. Any of them may be absent; operations
 * needing an absent client fail.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 */
public record AgentClients(GenerationClient generation, GatewayClient gateway, PeerMessagingClient messaging) {

    public static AgentClients none() {
        return new AgentClients(null, null, null);
    }

    public Optional<GenerationClient> generationClient() {
        return Optional.ofNullable(generation);
    }

    public Optional<GatewayClient> gatewayClient() {
        return Optional.ofNullable(gateway);
    }

    public Optional<PeerMessagingClient> messagingClient() {
        return Optional.ofNullable(messaging);
    }

    public List<CallEnvelope<?, ?, ?>> envelopes() {
        List<CallEnvelope<?, ?, ?>> envelopes = new ArrayList<>();
        if (generation != null) {
            envelopes.add(generation);
        }
        if (gateway != null) {
            envelopes.add(gateway);
        }
        if (messaging != null) {
            envelopes.add(messaging);
        }
        return envelopes;
    }

    public List<EndpointResilience> endpoints() {
        List<EndpointResilience> endpoints = new ArrayList<>();
        envelopes().forEach(envelope -> endpoints.addAll(envelope.endpoints()));
        return endpoints;
    }
}
