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

import dev.mars.aegis.agent.config.AgentClientFactory;
import dev.mars.aegis.agent.config.AgentConfig;
import dev.mars.aegis.agent.event.AgentStatusChangedEvent;
import dev.mars.aegis.agent.event.HeartbeatEvent;
import dev.mars.aegis.config.AegisConfiguration;
import dev.mars.aegis.core.exceptions.CallException;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.messaging.InMemoryPeerHub;
import dev.mars.aegis.messaging.PeerMessage;
import dev.mars.aegis.monitoring.health.HealthCheckResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.Checkpoint;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle and request handling of an agent wired to an in-memory peer hub.
 * Uses real Vert.x components, no mocks.
 */
@ExtendWith(VertxExtension.class)
@DisplayName("AgentLifecycleManager")
class AgentLifecycleManagerTest {

    private InMemoryPeerHub hub;
    private EventPublisher events;
    private AgentClientFactory factory;
    private List<AgentStatusChangedEvent> statusChanges;
    private final List<AgentLifecycleManager> agents = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp(Vertx vertx) {
        hub = new InMemoryPeerHub(vertx);
        events = new EventPublisher();
        factory = new AgentClientFactory(vertx, new AegisConfiguration(new Properties(), key -> null), events);
        statusChanges = new CopyOnWriteArrayList<>();
        events.subscribe(AgentStatusChangedEvent.class, statusChanges::add);
        agents.clear();
    }

    @AfterEach
    void tearDown(VertxTestContext ctx) {
        Future.all(agents.stream().map(AgentLifecycleManager::shutdown).toList())
                .onComplete(ctx.succeedingThenComplete());
    }

    private AgentLifecycleManager agent(Vertx vertx, AgentConfig config, AgentHandler handler) {
        AgentClients clients = new AgentClients(null, null, factory.createMessagingClient(config, hub));
        AgentLifecycleManager agent = new AgentLifecycleManager(vertx, config, clients, handler, events);
        agents.add(agent);
        return agent;
    }

    private AgentLifecycleManager agent(Vertx vertx, AgentHandler handler) {
        return agent(vertx, AgentConfig.forTesting("agent-under-test"), handler);
    }

    /**
     * Succeeds with the payload unless it carries {@code fail: true}.
     */
    private static class EchoHandler implements AgentHandler {
        final AtomicInteger handled = new AtomicInteger();
        final AtomicBoolean cleanedUp = new AtomicBoolean();

        @Override
        public Future<JsonObject> handle(AgentRequest request, AgentContext context) {
            handled.incrementAndGet();
            if (request.payload().getBoolean("fail", false)) {
                return Future.failedFuture(new IllegalStateException("handler rejected the payload"));
            }
            return Future.succeededFuture(new JsonObject().put("echo", request.payload()));
        }

        @Override
        public Future<Void> cleanup() {
            cleanedUp.set(true);
            return Future.succeededFuture();
        }
    }

    private static AgentRequest request(JsonObject payload) {
        return AgentRequest.of(payload);
    }

    @Nested
    @DisplayName("Initialization")
    class Initialization {

        @Test
        @DisplayName("Should start envelopes, register with the hub and enter running")
        void initializes(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new EchoHandler());
            assertEquals(AgentStatus.INITIALIZING, agent.getStatus());

            agent.initialize().onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                assertEquals(AgentStatus.RUNNING, agent.getStatus());
                assertTrue(hub.isRegistered("agent-under-test"));
                assertTrue(hub.isConnected("agent-under-test"));
                assertTrue(agent.getClients().messaging().isStarted());
                assertTrue(agent.getScheduler().isRunning());
                assertEquals(1, statusChanges.size());
                assertEquals(AgentStatus.RUNNING, statusChanges.get(0).newStatus());
                assertEquals(1, agent.getAgentMetrics().getStatusValue());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("A second initialize should fail without changing state")
        void initializeTwice(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new EchoHandler());

            agent.initialize()
                    .compose(v -> agent.initialize())
                    .onComplete(ctx.failing(failure -> ctx.verify(() -> {
                        assertInstanceOf(IllegalStateException.class, failure);
                        assertEquals(AgentStatus.RUNNING, agent.getStatus());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("A failing handler start should put the agent in error and re-raise")
        void handlerStartFails(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new AgentHandler() {
                @Override
                public Future<JsonObject> handle(AgentRequest request, AgentContext context) {
                    return Future.succeededFuture(new JsonObject());
                }

                @Override
                public Future<Void> start(AgentContext context) {
                    return Future.failedFuture(new IllegalStateException("model cache unavailable"));
                }
            });

            agent.initialize().onComplete(ctx.failing(failure -> ctx.verify(() -> {
                assertEquals("model cache unavailable", failure.getMessage());
                assertEquals(AgentStatus.ERROR, agent.getStatus());
                AgentError recorded = agent.getState().getLastError();
                assertEquals(AgentError.AGENT_ERROR, recorded.code());
                assertEquals("Initialization failed: model cache unavailable", recorded.message());
                assertFalse(agent.isHealthy());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Handlers can subscribe to topics while starting")
        void handlerSubscribesOnStart(Vertx vertx, VertxTestContext ctx) {
            Promise<PeerMessage> inbox = Promise.promise();
            AgentLifecycleManager listener = agent(vertx, AgentConfig.forTesting("listener"), new EchoHandler() {
                @Override
                public Future<Void> start(AgentContext context) {
                    return context.subscribe("alerts", message -> {
                        inbox.tryComplete(message);
                        return Future.succeededFuture();
                    });
                }
            });
            AgentLifecycleManager sender = agent(vertx, AgentConfig.forTesting("sender"), new EchoHandler());

            Future.all(listener.initialize(), sender.initialize())
                    .compose(v -> sender.sendMessage("alerts", "disk_full", new JsonObject().put("host", "db-1"), null))
                    .compose(receipt -> receipt.isDelivered()
                            ? inbox.future()
                            : Future.<PeerMessage>failedFuture("Alert was not delivered: " + receipt.status()))
                    .onComplete(ctx.succeeding(message -> ctx.verify(() -> {
                        assertEquals("sender", message.sourceAgent());
                        assertEquals("db-1", message.payload().getString("host"));
                        ctx.completeNow();
                    })));
        }
    }

    @Nested
    @DisplayName("Request processing")
    class RequestProcessing {

        @Test
        @DisplayName("Requests before initialization are refused and not counted")
        void notInitialized(Vertx vertx, VertxTestContext ctx) {
            EchoHandler handler = new EchoHandler();
            AgentLifecycleManager agent = agent(vertx, handler);

            agent.processRequest(request(new JsonObject())).onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                assertFalse(response.success());
                assertEquals(AgentError.AGENT_NOT_INITIALIZED, response.error().code());
                assertEquals(0, handler.handled.get());
                assertEquals(0, agent.healthStatus().metrics().requestsProcessed());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Successful requests carry the handler payload")
        void success(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new EchoHandler());
            AgentRequest request = request(new JsonObject().put("question", "status?"));

            agent.initialize()
                    .compose(v -> agent.processRequest(request))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertTrue(response.success());
                        assertEquals(request.id(), response.requestId());
                        assertEquals("status?", response.payload().getJsonObject("echo").getString("question"));
                        assertEquals(1, agent.healthStatus().metrics().requestsProcessed());
                        assertTrue(agent.isHealthy());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Malformed requests are rejected before the handler and count as failures")
        void validation(Vertx vertx, VertxTestContext ctx) {
            EchoHandler handler = new EchoHandler();
            AgentLifecycleManager agent = agent(vertx, handler);
            AgentRequest noCorrelation = new AgentRequest("req-1", Instant.now(), null, new JsonObject(), null);
            AgentRequest noPayload = new AgentRequest("req-2", Instant.now(), "corr-2", null, null);
            AgentRequest noTimestamp = new AgentRequest("req-3", null, "corr-3", new JsonObject(), null);

            agent.initialize()
                    .compose(v -> Future.join(agent.processRequest(noCorrelation), agent.processRequest(noPayload),
                            agent.processRequest(noTimestamp)))
                    .onComplete(ctx.succeeding(all -> ctx.verify(() -> {
                        AgentResponse first = all.resultAt(0);
                        AgentResponse second = all.resultAt(1);
                        AgentResponse third = all.resultAt(2);
                        assertEquals(AgentError.VALIDATION_ERROR, first.error().code());
                        assertTrue(first.error().message().contains("Correlation ID is required"));
                        assertTrue(second.error().message().contains("Request payload is required"));
                        assertEquals("corr-2", second.error().correlationId());
                        assertTrue(third.error().message().contains("Request timestamp is required"));
                        assertEquals(0, handler.handled.get());
                        assertEquals(1.0, agent.healthStatus().metrics().errorRate());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Handler failures update error rate, recent errors and health")
        void handlerFailure(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new EchoHandler());
            AgentRequest failing = request(new JsonObject().put("fail", true));

            agent.initialize()
                    .compose(v -> agent.processRequest(request(new JsonObject())))
                    .compose(r -> agent.processRequest(request(new JsonObject())))
                    .compose(r -> agent.processRequest(failing))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertFalse(response.success());
                        assertEquals(AgentError.AGENT_ERROR, response.error().code());
                        assertEquals("handler rejected the payload", response.error().message());
                        assertEquals(failing.correlationId(), response.error().correlationId());

                        AgentHealthStatus health = agent.healthStatus();
                        assertEquals(3, health.metrics().requestsProcessed());
                        assertEquals(1.0 / 3, health.metrics().errorRate(), 0.0001);
                        assertEquals(1, health.recentErrors().size());
                        assertEquals(response.error(), health.lastError());
                        assertFalse(health.healthy());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("A handler that throws is reported like a failed future")
        void handlerThrows(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, (request, context) -> {
                throw new IllegalArgumentException("unsupported payload");
            });

            agent.initialize()
                    .compose(v -> agent.processRequest(request(new JsonObject())))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertFalse(response.success());
                        assertEquals("unsupported payload", response.error().message());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Context operations without a configured client fail with a validation error")
        void missingClients(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new EchoHandler());

            agent.queryService("inventory", "getStock", Map.of())
                    .onComplete(ctx.failing(failure -> ctx.verify(() -> {
                        assertInstanceOf(CallException.class, failure);
                        assertTrue(failure.getMessage().contains("No gateway client"));
                        ctx.completeNow();
                    })));
        }
    }

    @Nested
    @DisplayName("Shutdown and background tasks")
    class ShutdownAndTasks {

        @Test
        @DisplayName("Shutdown should stop timers, disconnect and clean up exactly once")
        void shutdown(Vertx vertx, VertxTestContext ctx) {
            EchoHandler handler = new EchoHandler();
            AgentLifecycleManager agent = agent(vertx, handler);

            agent.initialize()
                    .compose(v -> agent.shutdown())
                    .compose(v -> agent.shutdown())
                    .compose(v -> agent.processRequest(request(new JsonObject())))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(AgentStatus.STOPPED, agent.getStatus());
                        assertFalse(agent.getScheduler().isRunning());
                        assertFalse(hub.isConnected("agent-under-test"));
                        assertFalse(agent.getClients().messaging().isStarted());
                        assertTrue(handler.cleanedUp.get());
                        assertEquals(List.of(AgentStatus.RUNNING, AgentStatus.STOPPED),
                                statusChanges.stream().map(AgentStatusChangedEvent::newStatus).toList());
                        assertEquals(AgentError.AGENT_NOT_INITIALIZED, response.error().code());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Shutdown before initialization is a no-op")
        void shutdownBeforeInitialize(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new EchoHandler());

            agent.shutdown().onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                assertEquals(AgentStatus.INITIALIZING, agent.getStatus());
                assertTrue(statusChanges.isEmpty());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("An agent in error can still be shut down")
        void shutdownFromError(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new EchoHandler() {
                @Override
                public Future<Void> start(AgentContext context) {
                    return Future.failedFuture(new IllegalStateException("boom"));
                }
            });

            agent.initialize()
                    .recover(failure -> agent.shutdown())
                    .onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                        assertEquals(AgentStatus.STOPPED, agent.getStatus());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("A failing cleanup is recorded without failing shutdown")
        void cleanupFailure(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new EchoHandler() {
                @Override
                public Future<Void> cleanup() {
                    return Future.failedFuture(new IllegalStateException("flush failed"));
                }
            });

            agent.initialize()
                    .compose(v -> agent.shutdown())
                    .onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                        assertEquals(AgentStatus.STOPPED, agent.getStatus());
                        assertTrue(agent.getState().getLastError().message().contains("flush failed"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Test configuration schedules no background tasks")
        void noBackgroundTasksInTests(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new EchoHandler());

            agent.initialize().onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                assertTrue(agent.getScheduler().scheduledTasks().isEmpty());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Enabled background tasks emit heartbeats until shutdown")
        void heartbeats(Vertx vertx, VertxTestContext ctx) {
            AgentConfig config = AgentConfig.forTesting("beating").withBackgroundTasks(true, 20, 25);
            AgentLifecycleManager agent = agent(vertx, config, new EchoHandler());
            Checkpoint beats = ctx.checkpoint(3);
            events.subscribe(HeartbeatEvent.class, event -> {
                if ("beating".equals(event.agentId()) && agent.getStatus() == AgentStatus.RUNNING) {
                    beats.flag();
                }
            });

            agent.initialize().onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                assertTrue(agent.getScheduler().isScheduled(AgentLifecycleManager.HEARTBEAT_TASK));
                assertTrue(agent.getScheduler().isScheduled(AgentLifecycleManager.METRICS_TASK));
            })));
        }

        @Test
        @DisplayName("Health checks include the default checks")
        void healthChecks(Vertx vertx, VertxTestContext ctx) {
            AgentLifecycleManager agent = agent(vertx, new EchoHandler());

            agent.initialize()
                    .compose(v -> agent.runHealthChecks())
                    .onComplete(ctx.succeeding(report -> ctx.verify(() -> {
                        Map<String, HealthCheckResult.Status> byName = report.checks().stream()
                                .collect(Collectors.toMap(HealthCheckResult::getName, HealthCheckResult::getStatus));
                        assertEquals(3, byName.size());
                        assertEquals(HealthCheckResult.Status.PASS, byName.get("endpoint_reachability"));
                        assertEquals(HealthCheckResult.Status.PASS, byName.get("error_rate"));
                        ctx.completeNow();
                    })));
        }
    }
}
