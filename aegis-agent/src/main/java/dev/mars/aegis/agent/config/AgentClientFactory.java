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


package dev.mars.aegis.agent.config;

import dev.mars.aegis.agent.AgentClients;
import dev.mars.aegis.config.AegisConfiguration;
import dev.mars.aegis.config.ResilienceConfig;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.gateway.GatewayClient;
import dev.mars.aegis.gateway.GatewayServiceConfig;
import dev.mars.aegis.gateway.HttpGatewayTransport;
import dev.mars.aegis.generation.GeminiHttpTransport;
import dev.mars.aegis.generation.GenerationClient;
import dev.mars.aegis.generation.GenerationSettings;
import dev.mars.aegis.messaging.HttpPeerTransport;
import dev.mars.aegis.messaging.InMemoryPeerHub;
import dev.mars.aegis.messaging.PeerMessagingClient;
import dev.mars.aegis.messaging.PeerTransport;
import dev.mars.aegis.resilience.EndpointResilience;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Builds the call envelopes an agent works with from configuration.
 *
 * <p>Resilience settings come from {@code aegis.resilience.*}, overridden per endpoint through
 * {@code aegis.endpoint.<name>.*}. The endpoint names are {@value #GENERATION_ENDPOINT},
 * {@value #PEER_HUB_ENDPOINT} and {@code gateway:<service>} for each gateway service.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
public class AgentClientFactory {

    private static final Logger logger = LoggerFactory.getLogger(AgentClientFactory.class);

    public static final String GENERATION_ENDPOINT = "generation";
    public static final String PEER_HUB_ENDPOINT = "peer-hub";

    private final Vertx vertx;
    private final AegisConfiguration configuration;
    private final EventPublisher events;

    public AgentClientFactory(Vertx vertx, AegisConfiguration configuration, EventPublisher events) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
    }

    /**
     * Builds every client. Without a hub URL the agent talks to a private in-process hub.
     */
    public AgentClients create(AgentConfig config) {
        return create(config, config.usesRemoteHub() ? null : new InMemoryPeerHub(vertx));
    }

    /**
     * Builds every client, using {@code localHub} for peer messaging when no hub URL is configured.
     * Agents sharing one in-process hub can message each other.
     */
    public AgentClients create(AgentConfig config, InMemoryPeerHub localHub) {
        AgentClients clients = new AgentClients(
                createGenerationClient(config),
                createGatewayClient(config),
                createMessagingClient(config, localHub));
        logger.info("Built clients for agent {}: generation={}, gateway={}, messaging={}", config.agentId(),
                clients.generation() != null, clients.gateway() != null, clients.messaging() != null);
        return clients;
    }

    public GenerationClient createGenerationClient(AgentConfig config) {
        GenerationSettings settings = new GenerationSettings(config.generationBaseUrl(), config.generationModel(),
                config.generationApiKey(), config.generationMaxTokens(), config.generationTemperature(),
                config.connectTimeoutMs(), config.requestTimeoutMs());
        EndpointResilience resilience = EndpointResilience.create(vertx, GENERATION_ENDPOINT,
                ResilienceConfig.forEndpoint(configuration, GENERATION_ENDPOINT), events);
        return new GenerationClient(resilience, new GeminiHttpTransport(vertx, settings), events);
    }

    /**
     * @return the gateway client, or {@code null} when no gateway services are configured
     */
    public GatewayClient createGatewayClient(AgentConfig config) {
        if (config.gatewayServices().isEmpty()) {
            logger.debug("No gateway services configured for agent {}", config.agentId());
            return null;
        }
        List<GatewayServiceConfig> services = config.gatewayServices().stream()
                .map(name -> GatewayServiceConfig.from(configuration, name))
                .toList();
        HttpGatewayTransport transport = new HttpGatewayTransport(vertx, config.gatewayUrl(),
                config.connectTimeoutMs());
        return GatewayClient.create(vertx, services, transport, events);
    }

    public PeerMessagingClient createMessagingClient(AgentConfig config, InMemoryPeerHub localHub) {
        PeerTransport transport;
        if (config.usesRemoteHub()) {
            transport = new HttpPeerTransport(vertx, config.hubUrl(), config.connectTimeoutMs(),
                    config.requestTimeoutMs());
        } else {
            Objects.requireNonNull(localHub, "A local hub is required when no hub URL is configured");
            transport = localHub.transport();
        }
        EndpointResilience resilience = EndpointResilience.create(vertx, PEER_HUB_ENDPOINT,
                ResilienceConfig.forEndpoint(configuration, PEER_HUB_ENDPOINT), events);
        return new PeerMessagingClient(config.agentId(), resilience, transport, events);
    }
}
