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

import io.vertx.core.Future;

import java.util.function.Consumer;

/**
 * Connection of one agent to a message hub.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public interface PeerTransport {

    /**
     * Opens the inbound channel; messages addressed to the agent reach {@code inbound}.
     */
    Future<Void> connect(String agentId, Consumer<PeerMessage> inbound);

    Future<Void> disconnect();

    Future<Void> register(AgentRegistration registration);

    Future<Void> subscribe(String agentId, Subscription subscription);

    Future<Void> unsubscribe(String agentId, String topic);

    /**
     * Hands one message to the hub. A hub that accepted the message but could not
     * deliver it answers with a failed or expired receipt rather than a failed future.
     */
    Future<DeliveryReceipt> publish(PeerMessage message);

    Future<Boolean> healthCheck();

    default Future<Void> close() {
        return Future.succeededFuture();
    }
}
