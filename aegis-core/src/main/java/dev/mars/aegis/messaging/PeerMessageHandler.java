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
import io.vertx.core.json.JsonObject;

/**
 * Handles inbound peer messages.
 *
 * <p>The returned future may carry a reply payload. When it does and the message names a
 * {@code replyTo}, the messaging client publishes the reply to the sender as
 * {@code <messageType>_response}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
@FunctionalInterface
public interface PeerMessageHandler {

    Future<JsonObject> handle(PeerMessage message);
}
