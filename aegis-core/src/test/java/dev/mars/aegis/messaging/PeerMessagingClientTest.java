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

import dev.mars.aegis.config.ResilienceConfig;
import dev.mars.aegis.core.ErrorKind;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.resilience.BackoffStrategy;
import dev.mars.aegis.resilience.EndpointResilience;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
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
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two or three agents talking through an in-memory hub.
 */
@ExtendWith(VertxExtension.class)
@DisplayName("PeerMessagingClient")
class PeerMessagingClientTest {

    private InMemoryPeerHub hub;
    private EventPublisher events;
    private final List<PeerMessagingClient> clients = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp(Vertx vertx) {
        hub = new InMemoryPeerHub(vertx);
        events = new EventPublisher();
        clients.clear();
    }

    @AfterEach
    void tearDown(VertxTestContext ctx) {
        Future.all(clients.stream().map(PeerMessagingClient::stop).toList())
                .onComplete(ctx.succeedingThenComplete());
    }

    private PeerMessagingClient client(Vertx vertx, String agentId) {
        ResilienceConfig config = ResilienceConfig.builder()
                .retryMaxAttempts(2)
                .retryBackoffStrategy(BackoffStrategy.LINEAR)
                .retryInitialDelayMs(5)
                .retryMaxDelayMs(5)
                .retryJitter(false)
                .build();
        EndpointResilience resilience = EndpointResilience.create(vertx, "peer-hub:" + agentId, config, events);
        PeerMessagingClient client = new PeerMessagingClient(agentId, resilience, hub.transport(), events);
        clients.add(client);
        return client;
    }

    private Future<PeerMessagingClient> online(Vertx vertx, String agentId) {
        PeerMessagingClient client = client(vertx, agentId);
        return client.start()
                .compose(v -> client.connect())
                .compose(v -> client.register(new AgentRegistration(agentId, "worker", List.of("tasks"),
                        List.of(), null, 30000)))
                .map(v -> client);
    }

    @Nested
    @DisplayName("Topic delivery")
    class TopicDelivery {

        @Test
        @DisplayName("Subscribers should receive messages published on their topic")
        void deliversToSubscriber(Vertx vertx, VertxTestContext ctx) {
            Promise<PeerMessage> inbox = Promise.promise();

            Future.join(online(vertx, "alice"), online(vertx, "bob"))
                    .compose(both -> {
                        PeerMessagingClient alice = both.resultAt(0);
                        PeerMessagingClient bob = both.resultAt(1);
                        return bob.subscribe("tasks", message -> {
                                    inbox.tryComplete(message);
                                    return Future.succeededFuture();
                                })
                                .compose(v -> alice.publish("tasks", "task_assigned",
                                        new JsonObject().put("task", "reindex"), null));
                    })
                    .compose(receipt -> {
                        assertEquals(DeliveryStatus.DELIVERED, receipt.status());
                        assertEquals("bob", receipt.targetAgent());
                        return inbox.future();
                    })
                    .onComplete(ctx.succeeding(received -> ctx.verify(() -> {
                        assertEquals("alice", received.sourceAgent());
                        assertEquals("reindex", received.payload().getString("task"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("A message no agent subscribes to should come back as failed")
        void noRecipients(Vertx vertx, VertxTestContext ctx) {
            online(vertx, "alice")
                    .compose(alice -> alice.publish("nobody-listens", "ping", new JsonObject(), null))
                    .onComplete(ctx.succeeding(receipt -> ctx.verify(() -> {
                        assertEquals(DeliveryStatus.FAILED, receipt.status());
                        assertNotNull(receipt.error());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Subscribing before registering is refused and leaves no binding")
        void subscribeRequiresRegistration(Vertx vertx, VertxTestContext ctx) {
            PeerMessagingClient stranger = client(vertx, "stranger");

            stranger.subscribe("tasks", message -> Future.succeededFuture())
                    .onComplete(ctx.failing(failure -> ctx.verify(() -> {
                        assertFalse(stranger.isSubscribed("tasks"));
                        assertTrue(failure.getMessage().contains("not registered"));
                        ctx.completeNow();
                    })));
        }
    }

    @Nested
    @DisplayName("Direct messages")
    class DirectMessages {

        @Test
        @DisplayName("A handler reply should reach the sender as a response message")
        void requestReply(Vertx vertx, VertxTestContext ctx) {
            Promise<PeerMessage> reply = Promise.promise();

            Future.join(online(vertx, "alice"), online(vertx, "bob"))
                    .compose(both -> {
                        PeerMessagingClient alice = both.resultAt(0);
                        PeerMessagingClient bob = both.resultAt(1);
                        bob.onMessageType("status_query",
                                message -> Future.succeededFuture(new JsonObject().put("load", 0.25)));
                        alice.onMessageType("status_query_response", message -> {
                            reply.tryComplete(message);
                            return Future.succeededFuture();
                        });
                        PeerMessage query = PeerMessage.of("alice", "direct", "status_query", new JsonObject())
                                .withTargetAgent("bob");
                        return alice.publish(query.withMetadata(query.metadata().withReplyTo("alice")));
                    })
                    .compose(receipt -> reply.future())
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals("bob", response.sourceAgent());
                        assertEquals("alice", response.targetAgent());
                        assertEquals(0.25, response.payload().getDouble("load"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Messages for a registered but disconnected agent are queued until it connects")
        void queuesForDisconnectedAgent(Vertx vertx, VertxTestContext ctx) {
            Promise<PeerMessage> inbox = Promise.promise();
            hub.register(new AgentRegistration("carol", "worker", List.of(), List.of(), null, 30000));
            PeerMessagingClient carol = client(vertx, "carol");
            carol.onMessageType("wake_up", message -> {
                inbox.tryComplete(message);
                return Future.succeededFuture();
            });

            online(vertx, "alice")
                    .compose(alice -> alice.publish("direct", "wake_up", new JsonObject(), "carol"))
                    .compose(receipt -> {
                        assertEquals(DeliveryStatus.DELIVERED, receipt.status());
                        assertEquals(1, hub.pendingCount("carol"));
                        return carol.connect();
                    })
                    .compose(v -> inbox.future())
                    .onComplete(ctx.succeeding(message -> ctx.verify(() -> {
                        assertEquals("alice", message.sourceAgent());
                        assertEquals(0, hub.pendingCount("carol"));
                        ctx.completeNow();
                    })));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Invalid messages fail validation without reaching the hub")
        void invalidMessage(Vertx vertx, VertxTestContext ctx) {
            online(vertx, "alice")
                    .compose(alice -> alice.publish("", "ping", new JsonObject(), null))
                    .onComplete(ctx.succeeding(receipt -> ctx.verify(() -> {
                        assertEquals(DeliveryStatus.FAILED, receipt.status());
                        assertEquals(ErrorKind.VALIDATION_ERROR, receipt.error().kind());
                        assertEquals(0, hub.getPublishedCount());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Payloads JSON cannot represent are reported as validation failures")
        void unencodablePayload(Vertx vertx, VertxTestContext ctx) {
            online(vertx, "alice")
                    .compose(alice -> alice.publish("tasks", "ping", new JsonObject().put("handle", new Object()), null)
                            .map(receipt -> {
                                assertEquals(0, alice.endpoints().iterator().next()
                                        .circuitBreaker().getConsecutiveFailures());
                                return receipt;
                            }))
                    .onComplete(ctx.succeeding(receipt -> ctx.verify(() -> {
                        assertEquals(DeliveryStatus.FAILED, receipt.status());
                        assertEquals(ErrorKind.VALIDATION_ERROR, receipt.error().kind());
                        assertTrue(receipt.error().message().contains("payload is not JSON-encodable"));
                        assertEquals(0, hub.getPublishedCount());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("An unavailable hub should be retried then reported as an upstream failure")
        void hubUnavailable(Vertx vertx, VertxTestContext ctx) {
            online(vertx, "alice")
                    .compose(alice -> {
                        hub.setHealthy(false);
                        return Future.join(alice.publish("tasks", "ping", new JsonObject(), null), alice.healthCheck());
                    })
                    .onComplete(ctx.succeeding(both -> ctx.verify(() -> {
                        DeliveryReceipt receipt = both.resultAt(0);
                        Boolean healthy = both.resultAt(1);
                        assertEquals(DeliveryStatus.FAILED, receipt.status());
                        assertEquals(ErrorKind.UPSTREAM_SERVICE_ERROR, receipt.error().kind());
                        assertFalse(healthy);
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Expired and invalid inbound messages are dropped and counted")
        void dropsExpiredAndInvalidInbound(Vertx vertx) {
            PeerMessagingClient bob = client(vertx, "bob");
            List<PeerMessage> handled = new CopyOnWriteArrayList<>();
            bob.onMessageType("ping", message -> {
                handled.add(message);
                return Future.succeededFuture();
            });

            PeerMessage stale = PeerMessage.of("alice", "direct", "ping", new JsonObject()).withTargetAgent("bob");
            stale = new PeerMessage(stale.id(), Instant.now().minusSeconds(10), "alice", "bob", "direct", "ping",
                    null, new JsonObject(), stale.metadata().withTtl(1000));
            bob.onInbound(stale);
            bob.onInbound(PeerMessage.of("", "direct", "ping", new JsonObject()));
            bob.onInbound(PeerMessage.of("alice", "direct", "unknown_type", new JsonObject()));

            Map<String, Object> stats = bob.statistics();
            assertEquals(3L, stats.get("received"));
            assertEquals(1L, stats.get("expired"));
            assertEquals(1L, stats.get("rejected"));
            assertEquals(1L, stats.get("unhandled"));
            assertTrue(handled.isEmpty());
        }
    }
}
