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

import dev.mars.aegis.core.CallError;
import dev.mars.aegis.core.ErrorKind;
import dev.mars.aegis.core.exceptions.CallException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Message hub living inside one process.
 *
 * <p>Routing follows the remote hub: a message with a target agent goes to that agent
 * only; otherwise it goes to every registered agent whose subscription to the topic
 * accepts the message type. Messages for a registered agent that is not connected are
 * queued and flushed when it connects. Delivery runs on a later event-loop turn so that
 * a handler never executes inside the publisher's call.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public class InMemoryPeerHub {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPeerHub.class);

    private final Vertx vertx;
    private final Clock clock;
    private final Map<String, AgentRegistration> registrations = new LinkedHashMap<>();
    private final Map<String, Map<String, Subscription>> subscriptionsByAgent = new LinkedHashMap<>();
    private final Map<String, Consumer<PeerMessage>> connections = new LinkedHashMap<>();
    private final Map<String, Deque<PeerMessage>> pending = new LinkedHashMap<>();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();
    private boolean healthy = true;

    public InMemoryPeerHub(Vertx vertx) {
        this(vertx, Clock.systemUTC());
    }

    public InMemoryPeerHub(Vertx vertx, Clock clock) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * A transport bound to this hub for one agent process.
     */
    public PeerTransport transport() {
        return new HubTransport();
    }

    // ==================== Hub Operations ====================

    public synchronized void register(AgentRegistration registration) {
        registrations.put(registration.agentId(), registration);
        Map<String, Subscription> subs = subscriptionsByAgent.computeIfAbsent(registration.agentId(),
                k -> new LinkedHashMap<>());
        registration.subscriptions().forEach(sub -> subs.put(sub.topic(), sub));
        logger.info("Agent registered with in-memory hub: {} ({})", registration.agentId(), registration.agentType());
    }

    public synchronized void unregister(String agentId) {
        registrations.remove(agentId);
        subscriptionsByAgent.remove(agentId);
        connections.remove(agentId);
        pending.remove(agentId);
    }

    public synchronized void subscribe(String agentId, Subscription subscription) {
        if (!registrations.containsKey(agentId)) {
            throw CallException.validation("agent '" + agentId + "' is not registered");
        }
        subscriptionsByAgent.computeIfAbsent(agentId, k -> new LinkedHashMap<>()).put(subscription.topic(), subscription);
    }

    public synchronized void unsubscribe(String agentId, String topic) {
        Map<String, Subscription> subs = subscriptionsByAgent.get(agentId);
        if (subs != null) {
            subs.remove(topic);
        }
    }

    public void connect(String agentId, Consumer<PeerMessage> inbound) {
        List<PeerMessage> backlog;
        synchronized (this) {
            connections.put(agentId, inbound);
            Deque<PeerMessage> queued = pending.remove(agentId);
            backlog = queued != null ? new ArrayList<>(queued) : List.of();
        }
        logger.debug("Agent {} connected to in-memory hub, flushing {} queued message(s)", agentId, backlog.size());
        backlog.forEach(message -> dispatch(inbound, message));
    }

    public synchronized void disconnect(String agentId) {
        connections.remove(agentId);
    }

    public DeliveryReceipt publish(PeerMessage message) {
        published.incrementAndGet();
        if (message.isExpired(Instant.now(clock))) {
            expired.incrementAndGet();
            logger.debug("Message {} expired before routing", message.id());
            return DeliveryReceipt.expired(message.id(), target(message));
        }

        List<String> recipients;
        List<Consumer<PeerMessage>> live = new ArrayList<>();
        synchronized (this) {
            recipients = recipientsOf(message);
            if (recipients.isEmpty()) {
                logger.debug("No recipients for message {} on topic {}", message.id(), message.topic());
                return DeliveryReceipt.failed(message.id(), target(message),
                        CallError.of(ErrorKind.UPSTREAM_SERVICE_ERROR, "no recipients for topic " + message.topic()));
            }
            for (String agentId : recipients) {
                Consumer<PeerMessage> connection = connections.get(agentId);
                if (connection != null) {
                    live.add(connection);
                } else {
                    pending.computeIfAbsent(agentId, k -> new ArrayDeque<>()).add(message);
                }
            }
        }
        live.forEach(connection -> dispatch(connection, message));
        return DeliveryReceipt.delivered(message.id(), recipients.size() == 1 ? recipients.get(0) : message.topic());
    }

    // ==================== Inspection ====================

    public synchronized boolean isRegistered(String agentId) {
        return registrations.containsKey(agentId);
    }

    public synchronized boolean isConnected(String agentId) {
        return connections.containsKey(agentId);
    }

    public synchronized List<String> subscribersOf(String topic) {
        List<String> subscribers = new ArrayList<>();
        subscriptionsByAgent.forEach((agentId, subs) -> {
            if (subs.containsKey(topic)) {
                subscribers.add(agentId);
            }
        });
        return subscribers;
    }

    public synchronized int pendingCount(String agentId) {
        Deque<PeerMessage> queued = pending.get(agentId);
        return queued != null ? queued.size() : 0;
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getExpiredCount() {
        return expired.get();
    }

    /**
     * Controls the answer to health checks, for simulating an unavailable hub.
     */
    public synchronized void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    public synchronized boolean isHealthy() {
        return healthy;
    }

    private List<String> recipientsOf(PeerMessage message) {
        if (message.targetAgent() != null) {
            return registrations.containsKey(message.targetAgent()) ? List.of(message.targetAgent()) : List.of();
        }
        List<String> recipients = new ArrayList<>();
        subscriptionsByAgent.forEach((agentId, subs) -> {
            Subscription subscription = subs.get(message.topic());
            if (subscription != null && subscription.accepts(message.messageType())) {
                recipients.add(agentId);
            }
        });
        return recipients;
    }

    private void dispatch(Consumer<PeerMessage> connection, PeerMessage message) {
        vertx.runOnContext(v -> connection.accept(message));
    }

    private static String target(PeerMessage message) {
        return message.targetAgent() != null ? message.targetAgent() : "none";
    }

    // ==================== Transport ====================

    private final class HubTransport implements PeerTransport {

        private volatile String agentId;

        @Override
        public Future<Void> connect(String id, Consumer<PeerMessage> inbound) {
            this.agentId = id;
            InMemoryPeerHub.this.connect(id, inbound);
            return Future.succeededFuture();
        }

        @Override
        public Future<Void> disconnect() {
            if (agentId != null) {
                InMemoryPeerHub.this.disconnect(agentId);
            }
            return Future.succeededFuture();
        }

        @Override
        public Future<Void> register(AgentRegistration registration) {
            InMemoryPeerHub.this.register(registration);
            return Future.succeededFuture();
        }

        @Override
        public Future<Void> subscribe(String id, Subscription subscription) {
            try {
                InMemoryPeerHub.this.subscribe(id, subscription);
                return Future.succeededFuture();
            } catch (CallException e) {
                return Future.failedFuture(e);
            }
        }

        @Override
        public Future<Void> unsubscribe(String id, String topic) {
            InMemoryPeerHub.this.unsubscribe(id, topic);
            return Future.succeededFuture();
        }

        @Override
        public Future<DeliveryReceipt> publish(PeerMessage message) {
            if (!isHealthy()) {
                return Future.failedFuture(CallException.upstream("in-memory hub is unavailable"));
            }
            return Future.succeededFuture(InMemoryPeerHub.this.publish(message));
        }

        @Override
        public Future<Boolean> healthCheck() {
            return Future.succeededFuture(isHealthy());
        }
    }
}
