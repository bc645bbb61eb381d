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

import dev.mars.aegis.core.CallError;
import dev.mars.aegis.core.CallResult;
import dev.mars.aegis.core.exceptions.CallException;
import dev.mars.aegis.envelope.CallEnvelope;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.resilience.EndpointResilience;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.EncodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Call envelope for RPC calls through the data gateway.
 *
 * <p>Each configured service owns its own rate limiter, circuit breaker and retry policy,
 * tracked under the endpoint name {@code gateway:<service>}. A failing service therefore
 * never trips the breaker of another.</p>
 *
 * <pre>{@code
 * RpcResponse response = gateway.call("orders", "getOrder", Map.of("orderId", "o-1"), agentId)
 *         .toCompletionStage().toCompletableFuture().join();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class GatewayClient extends CallEnvelope<RpcRequest, Object, RpcResponse> {

    private static final Logger logger = LoggerFactory.getLogger(GatewayClient.class);

    private final Map<String, GatewayServiceConfig> services;
    private final Map<String, EndpointResilience> resilienceByService;
    private final GatewayTransport transport;
    private final OperationRegistry operations;

    public GatewayClient(Map<String, GatewayServiceConfig> services, Map<String, EndpointResilience> resilienceByService,
                         GatewayTransport transport, OperationRegistry operations, EventPublisher events) {
        super("gateway", events);
        Objects.requireNonNull(services, "Services cannot be null");
        Objects.requireNonNull(resilienceByService, "Resilience map cannot be null");
        for (String service : services.keySet()) {
            if (!resilienceByService.containsKey(service)) {
                throw new IllegalArgumentException("No resilience state for service: " + service);
            }
        }
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
        this.resilienceByService = Collections.unmodifiableMap(new LinkedHashMap<>(resilienceByService));
        this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
        this.operations = operations != null ? operations : new OperationRegistry();
    }

    public static GatewayClient create(Vertx vertx, Collection<GatewayServiceConfig> services,
                                       GatewayTransport transport, EventPublisher events) {
        return create(vertx, services, transport, Clock.systemUTC(), events);
    }

    public static GatewayClient create(Vertx vertx, Collection<GatewayServiceConfig> services,
                                       GatewayTransport transport, Clock clock, EventPublisher events) {
        Map<String, GatewayServiceConfig> byName = new LinkedHashMap<>();
        Map<String, EndpointResilience> resilience = new LinkedHashMap<>();
        for (GatewayServiceConfig service : services) {
            byName.put(service.name(), service);
            resilience.put(service.name(),
                    EndpointResilience.create(vertx, service.resilienceEndpoint(), service.resilience(), clock, events));
        }
        logger.info("Gateway client configured for services {}", byName.keySet());
        return new GatewayClient(byName, resilience, transport, new OperationRegistry(), events);
    }

    // ==================== Operations ====================

    public Future<RpcResponse> request(RpcRequest request) {
        return invoke(request);
    }

    public Future<RpcResponse> call(String service, String operation, Map<String, Object> parameters, String agentId) {
        return invoke(RpcRequest.of(service, operation, parameters, agentId));
    }

    /**
     * Fetches the gateway's definition of a configured service. This call does not go
     * through the envelope and leaves the service's resilience state untouched.
     */
    public Future<ServiceDefinition> describeService(String service) {
        GatewayServiceConfig config = services.get(service);
        if (config == null) {
            return Future.failedFuture(CallException.validation("service '" + service + "' is not configured"));
        }
        return transport.describe(config);
    }

    /**
     * Pings the gateway. Never fails; an unreachable gateway reports false.
     */
    public Future<Boolean> healthCheck() {
        return transport.healthCheck().recover(failure -> {
            logger.debug("Gateway health check failed: {}", failure.getMessage());
            return Future.succeededFuture(false);
        });
    }

    public OperationRegistry operations() {
        return operations;
    }

    public Set<String> serviceNames() {
        return services.keySet();
    }

    public EndpointResilience resilienceOf(String service) {
        return resilienceByService.get(service);
    }

    @Override
    public Future<Void> stop() {
        return super.stop().compose(v -> transport.close());
    }

    // ==================== Envelope Hooks ====================

    @Override
    protected void validate(RpcRequest request) {
        if (isBlank(request.id())) {
            throw CallException.validation("request id is required");
        }
        if (request.timestamp() == null) {
            throw CallException.validation("request timestamp is required");
        }
        if (isBlank(request.service())) {
            throw CallException.validation("service is required");
        }
        if (isBlank(request.operation())) {
            throw CallException.validation("operation is required");
        }
        if (request.parameters() == null) {
            throw CallException.validation("parameters are required");
        }
        if (request.metadata() == null || isBlank(request.metadata().correlationId())) {
            throw CallException.validation("metadata with a correlation id is required");
        }
        if (request.metadata().timeoutMs() < 0) {
            throw CallException.validation("timeout cannot be negative");
        }
        if (!services.containsKey(request.service())) {
            throw CallException.validation("service '" + request.service() + "' is not configured");
        }
        List<String> violations = operations.validate(request.service(), request.operation(), request.parameters());
        if (!violations.isEmpty()) {
            throw CallException.validation(String.join("; ", violations));
        }
        try {
            request.toJson().toBuffer();
        } catch (EncodeException | IllegalStateException e) {
            throw CallException.validation("parameters are not JSON-encodable: " + e.getMessage(), e);
        }
    }

    @Override
    protected EndpointResilience resolve(RpcRequest request) {
        return resilienceByService.get(request.service());
    }

    @Override
    protected Future<Object> transport(RpcRequest request, int attempt) {
        return transport.send(services.get(request.service()), request);
    }

    @Override
    protected RpcResponse toSuccess(RpcRequest request, Object raw, CallResult result) {
        return RpcResponse.succeeded(request.id(), raw, metadataFor(request, result));
    }

    @Override
    protected RpcResponse toFailure(RpcRequest request, CallError error, CallResult result) {
        return RpcResponse.failed(request != null ? request.id() : null, error, metadataFor(request, result));
    }

    @Override
    protected String correlationIdOf(RpcRequest request) {
        return request.metadata() != null ? request.metadata().correlationId() : null;
    }

    @Override
    public Collection<EndpointResilience> endpoints() {
        return resilienceByService.values();
    }

    private RpcResponseMetadata metadataFor(RpcRequest request, CallResult result) {
        GatewayServiceConfig service = request != null && request.service() != null ? services.get(request.service()) : null;
        return new RpcResponseMetadata(result.elapsedMs(), service != null ? service.endpoint() : null,
                Math.max(0, result.attempts() - 1), false);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
