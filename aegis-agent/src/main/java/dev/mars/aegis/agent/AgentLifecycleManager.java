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

import dev.mars.aegis.agent.config.AgentConfig;
import dev.mars.aegis.agent.event.AgentMetricsUpdatedEvent;
import dev.mars.aegis.agent.event.AgentStatusChangedEvent;
import dev.mars.aegis.agent.event.HeartbeatEvent;
import dev.mars.aegis.agent.observability.AgentMetrics;
import dev.mars.aegis.core.exceptions.CallException;
import dev.mars.aegis.core.exceptions.InvalidTransitionException;
import dev.mars.aegis.envelope.CallEnvelope;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.generation.GenerationRequest;
import dev.mars.aegis.generation.GenerationResponse;
import dev.mars.aegis.messaging.AgentRegistration;
import dev.mars.aegis.messaging.DeliveryReceipt;
import dev.mars.aegis.messaging.PeerMessageHandler;
import dev.mars.aegis.messaging.PeerMessagingClient;
import dev.mars.aegis.monitoring.MetricsAggregator;
import dev.mars.aegis.monitoring.health.EndpointReachabilityHealthCheck;
import dev.mars.aegis.monitoring.health.ErrorRateHealthCheck;
import dev.mars.aegis.monitoring.health.HealthMonitor;
import dev.mars.aegis.monitoring.health.HealthReport;
import dev.mars.aegis.monitoring.health.HeapUsageHealthCheck;
import dev.mars.aegis.resilience.EndpointResilience;
import dev.mars.aegis.scheduling.TaskScheduler;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Drives one agent through its lifecycle and wraps inbound request handling.
 *
 * <p>The manager owns the agent's {@link AgentState}, a {@link TaskScheduler} for the heartbeat
 * and metrics timers, a {@link MetricsAggregator} fed by the envelopes' call completions, and a
 * {@link HealthMonitor} with the default heap, reachability and error-rate checks. The call
 * envelopes are built elsewhere (see {@code AgentClientFactory}) and handed in as
 * {@link AgentClients}.
 *
 * <p>Status flow: {@code initializing → running} when every envelope has started, the agent has
 * connected and registered with the peer hub, and the handler has started;
 * {@code initializing → error} when any of those steps fails; {@code running|error → stopped} on
 * {@link #shutdown()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
public class AgentLifecycleManager implements AgentContext {

    private static final Logger logger = LoggerFactory.getLogger(AgentLifecycleManager.class);

    static final String HEARTBEAT_TASK = "heartbeat";
    static final String METRICS_TASK = "metrics";
    static final double HEALTHY_ERROR_RATE = 0.1;

    private final Vertx vertx;
    private final AgentConfig config;
    private final AgentClients clients;
    private final AgentHandler handler;
    private final EventPublisher events;
    private final Clock clock;

    private final AgentState state;
    private final TaskScheduler scheduler;
    private final MetricsAggregator metricsAggregator;
    private final HealthMonitor healthMonitor;
    private final AgentMetrics agentMetrics;

    private final AtomicBoolean initializeCalled = new AtomicBoolean(false);
    private final AtomicBoolean shutdownCalled = new AtomicBoolean(false);

    public AgentLifecycleManager(Vertx vertx, AgentConfig config, AgentClients clients, AgentHandler handler,
                                 EventPublisher events) {
        this(vertx, config, clients, handler, events, Clock.systemUTC());
    }

    public AgentLifecycleManager(Vertx vertx, AgentConfig config, AgentClients clients, AgentHandler handler,
                                 EventPublisher events, Clock clock) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.config = Objects.requireNonNull(config, "Agent config cannot be null");
        this.clients = clients != null ? clients : AgentClients.none();
        this.handler = Objects.requireNonNull(handler, "Agent handler cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");

        this.state = new AgentState(config.agentId());
        this.scheduler = new TaskScheduler(vertx, "agent:" + config.agentId());
        this.metricsAggregator = new MetricsAggregator().attach(events);
        this.healthMonitor = new HealthMonitor(vertx)
                .register(new HeapUsageHealthCheck())
                .register(new EndpointReachabilityHealthCheck(() -> this.clients.endpoints().stream()
                        .map(EndpointResilience::circuitBreaker)
                        .toList()))
                .register(new ErrorRateHealthCheck(metricsAggregator::getGlobalErrorRate));
        this.agentMetrics = new AgentMetrics(config.agentId(), () -> state.snapshot(clock.instant()).uptimeMs());

        logger.info("Agent lifecycle manager created for {} with envelopes {}", config.agentId(),
                this.clients.envelopes().stream().map(CallEnvelope::name).toList());
    }

    // ==================== Lifecycle ====================

    /**
     * Starts the envelopes, connects and registers with the peer hub, starts the handler and
     * moves the agent to {@code running}. On failure the agent moves to {@code error} and the
     * returned future fails with the cause.
     */
    public Future<Void> initialize() {
        if (!initializeCalled.compareAndSet(false, true)) {
            return Future.failedFuture(new IllegalStateException(
                    "Agent " + config.agentId() + " has already been initialized"));
        }
        state.reset(clock.instant());
        agentMetrics.setStatus(AgentStatus.INITIALIZING);
        logger.info("Initializing agent {} ({})", config.agentId(), config.agentType());

        return startEnvelopes()
                .compose(v -> connectToHub())
                .compose(v -> handler.start(this))
                .compose(v -> {
                    if (!transition(AgentStatus.RUNNING)) {
                        return Future.<Void>failedFuture(new IllegalStateException(
                                "Agent " + config.agentId() + " could not enter running state from "
                                        + state.getStatus()));
                    }
                    startBackgroundTasks();
                    logger.info("Agent {} initialized and running", config.agentId());
                    return Future.<Void>succeededFuture();
                })
                .recover(cause -> {
                    String message = "Initialization failed: " + cause.getMessage();
                    state.recordError(AgentError.of(AgentError.AGENT_ERROR, message, null));
                    transition(AgentStatus.ERROR);
                    logger.error("Agent {} failed to initialize", config.agentId(), cause);
                    return Future.failedFuture(cause);
                });
    }

    /**
     * Stops timers, disconnects from the hub, runs handler cleanup and stops the envelopes.
     * Calling it again, or before initialization has finished, does nothing.
     */
    public Future<Void> shutdown() {
        AgentStatus current = state.getStatus();
        if (current == AgentStatus.INITIALIZING) {
            logger.info("Agent {} is not initialized, skipping shutdown", config.agentId());
            return Future.succeededFuture();
        }
        if (!shutdownCalled.compareAndSet(false, true)) {
            logger.info("Agent {} already shut down, skipping", config.agentId());
            return Future.succeededFuture();
        }

        logger.info("Shutting down agent {} (status: {})", config.agentId(), current);
        transition(AgentStatus.STOPPED);
        scheduler.stop();

        return runShutdownStep("disconnect", () -> clients.messagingClient()
                        .map(PeerMessagingClient::disconnect)
                        .orElseGet(Future::succeededFuture))
                .compose(v -> runShutdownStep("handler cleanup", handler::cleanup))
                .compose(v -> runShutdownStep("envelope stop", () -> Future.all(clients.envelopes().stream()
                        .map(CallEnvelope::stop)
                        .toList()).mapEmpty()))
                .onComplete(ar -> {
                    metricsAggregator.detach();
                    logger.info("Agent {} shutdown complete", config.agentId());
                });
    }

    // ==================== Request Handling ====================

    /**
     * Validates the request, runs the handler and records the outcome. The returned future
     * always succeeds; failures are carried in the response.
     */
    public Future<AgentResponse> processRequest(AgentRequest request) {
        String requestId = request != null ? request.id() : null;
        String correlationId = request != null ? request.correlationId() : null;

        AgentStatus status = state.getStatus();
        if (status != AgentStatus.RUNNING) {
            AgentError error = AgentError.of(AgentError.AGENT_NOT_INITIALIZED,
                    "Agent " + config.agentId() + " is not running (status: " + status + ")", correlationId);
            logger.warn("Rejected request {}: {}", requestId, error.message());
            return Future.succeededFuture(AgentResponse.failed(requestId, error, 0));
        }

        long start = System.currentTimeMillis();
        Future<JsonObject> outcome;
        try {
            validateRequest(request);
            logger.debug("Processing request {} (correlation {})", requestId, correlationId);
            outcome = handler.handle(request, this);
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }

        return outcome.transform(ar -> {
            long elapsed = System.currentTimeMillis() - start;
            if (ar.succeeded()) {
                state.recordRequest(elapsed, true);
                agentMetrics.recordRequest(elapsed, null);
                return Future.succeededFuture(AgentResponse.succeeded(requestId, ar.result(), elapsed));
            }
            AgentError error = toAgentError(ar.cause(), correlationId);
            state.recordRequest(elapsed, false);
            state.recordError(error);
            agentMetrics.recordRequest(elapsed, error.code());
            logger.warn("Request {} failed with {}: {}", requestId, error.code(), error.message());
            return Future.succeededFuture(AgentResponse.failed(requestId, error, elapsed));
        });
    }

    // ==================== Agent Context ====================

    @Override
    public String agentId() {
        return config.agentId();
    }

    @Override
    public Future<DeliveryReceipt> sendMessage(String topic, String messageType, JsonObject payload,
                                               String targetAgent) {
        return clients.messagingClient()
                .map(client -> client.publish(topic, messageType, payload, targetAgent))
                .orElseGet(() -> Future.failedFuture(missingClient("peer messaging")));
    }

    @Override
    public Future<Object> queryService(String service, String operation, Map<String, Object> parameters) {
        return clients.gatewayClient()
                .map(client -> client.call(service, operation, parameters, config.agentId())
                        .compose(response -> response.success()
                                ? Future.succeededFuture(response.data())
                                : Future.failedFuture(new CallException(response.error()))))
                .orElseGet(() -> Future.failedFuture(missingClient("gateway")));
    }

    @Override
    public Future<GenerationResponse> generate(GenerationRequest request) {
        return clients.generationClient()
                .map(client -> client.generate(request))
                .orElseGet(() -> Future.failedFuture(missingClient("generation")));
    }

    public Future<GenerationResponse> generate(String prompt) {
        return generate(GenerationRequest.of(prompt));
    }

    @Override
    public Future<Void> subscribe(String topic, PeerMessageHandler messageHandler) {
        return clients.messagingClient()
                .map(client -> client.subscribe(topic, messageHandler))
                .orElseGet(() -> Future.failedFuture(missingClient("peer messaging")));
    }

    // ==================== Health ====================

    public AgentHealthStatus healthStatus() {
        Instant now = clock.instant();
        AgentMetricsSnapshot snapshot = state.snapshot(now);
        return new AgentHealthStatus(config.agentId(), state.getStatus(), isHealthy(), snapshot.uptimeMs(),
                state.getLastHeartbeat(), snapshot, state.getRecentErrors());
    }

    public boolean isHealthy() {
        return state.getStatus() == AgentStatus.RUNNING && state.getErrorRate() < HEALTHY_ERROR_RATE;
    }

    public Future<HealthReport> runHealthChecks() {
        return healthMonitor.runHealthChecks();
    }

    // ==================== Background Tasks ====================

    void heartbeat() {
        Instant now = clock.instant();
        state.heartbeat(now);
        agentMetrics.recordHeartbeat();
        events.publish(new HeartbeatEvent(config.agentId(), now));
        logger.debug("Heartbeat for agent {}", config.agentId());
    }

    void refreshMetrics() {
        Runtime runtime = Runtime.getRuntime();
        long usedMb = (runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024);
        double load = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
        double cpu = load < 0 ? 0.0 : load / runtime.availableProcessors();
        state.refreshSystemMetrics(usedMb, cpu);

        Instant now = clock.instant();
        events.publish(new AgentMetricsUpdatedEvent(config.agentId(), state.snapshot(now), now));
    }

    // ==================== Accessors ====================

    public AgentStatus getStatus() {
        return state.getStatus();
    }

    public AgentState getState() {
        return state;
    }

    public AgentConfig getConfig() {
        return config;
    }

    public AgentClients getClients() {
        return clients;
    }

    public MetricsAggregator getMetricsAggregator() {
        return metricsAggregator;
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public TaskScheduler getScheduler() {
        return scheduler;
    }

    public AgentMetrics getAgentMetrics() {
        return agentMetrics;
    }

    public Vertx getVertx() {
        return vertx;
    }

    // ==================== Internals ====================

    private Future<Void> startEnvelopes() {
        List<Future<Void>> starts = clients.envelopes().stream()
                .map(CallEnvelope::start)
                .toList();
        return Future.all(starts).mapEmpty();
    }

    private Future<Void> connectToHub() {
        return clients.messagingClient()
                .map(client -> client.connect()
                        .compose(v -> client.register(new AgentRegistration(config.agentId(), config.agentType(),
                                config.capabilities(), List.of(), config.agentEndpoint(),
                                config.heartbeatIntervalMs()))))
                .orElseGet(Future::succeededFuture);
    }

    private void startBackgroundTasks() {
        scheduler.start();
        if (!config.backgroundTasksEnabled()) {
            logger.info("Background tasks disabled for agent {}", config.agentId());
            return;
        }
        scheduler.schedulePeriodic(HEARTBEAT_TASK, config.heartbeatIntervalMs(), this::heartbeat);
        scheduler.schedulePeriodic(METRICS_TASK, config.metricsIntervalMs(), this::refreshMetrics);
        logger.info("Background tasks started for agent {} (heartbeat {}ms, metrics {}ms)", config.agentId(),
                config.heartbeatIntervalMs(), config.metricsIntervalMs());
    }

    private boolean transition(AgentStatus target) {
        try {
            AgentStatus previous = state.transitionTo(target);
            agentMetrics.setStatus(target);
            logger.info("Agent {} status: {} -> {}", config.agentId(), previous, target);
            events.publish(new AgentStatusChangedEvent(config.agentId(), previous, target, clock.instant()));
            return true;
        } catch (InvalidTransitionException e) {
            logger.warn("Agent {}: {}", config.agentId(), e.getMessage());
            return false;
        }
    }

    private Future<Void> runShutdownStep(String step, Supplier<Future<Void>> action) {
        Future<Void> result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result.recover(cause -> {
            String message = "Shutdown step '" + step + "' failed: " + cause.getMessage();
            logger.warn("Agent {}: {}", config.agentId(), message);
            state.recordError(AgentError.of(AgentError.AGENT_ERROR, message, null));
            return Future.succeededFuture();
        });
    }

    private static void validateRequest(AgentRequest request) {
        if (request == null) {
            throw CallException.validation("Request is required");
        }
        if (request.id() == null || request.id().isBlank()) {
            throw CallException.validation("Request ID is required");
        }
        if (request.timestamp() == null) {
            throw CallException.validation("Request timestamp is required");
        }
        if (request.correlationId() == null || request.correlationId().isBlank()) {
            throw CallException.validation("Correlation ID is required");
        }
        if (request.payload() == null) {
            throw CallException.validation("Request payload is required");
        }
    }

    private static AgentError toAgentError(Throwable cause, String correlationId) {
        if (cause instanceof CallException callException) {
            return AgentError.from(callException.getError().withCorrelationId(correlationId));
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return AgentError.of(AgentError.AGENT_ERROR, message, correlationId);
    }

    private static CallException missingClient(String client) {
        return CallException.validation("No " + client + " client is configured for this agent");
    }
}
