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
import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Delivery metadata returned for a published message. A publish never returns a
 * response body; the receipt is all the sender learns.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public record DeliveryReceipt(String messageId, Instant timestamp, DeliveryStatus status, String targetAgent,
                              CallError error) {

    public static DeliveryReceipt delivered(String messageId, String targetAgent) {
        return new DeliveryReceipt(messageId, Instant.now(), DeliveryStatus.DELIVERED, targetAgent, null);
    }

    public static DeliveryReceipt failed(String messageId, String targetAgent, CallError error) {
        return new DeliveryReceipt(messageId, Instant.now(), DeliveryStatus.FAILED, targetAgent, error);
    }

    public static DeliveryReceipt expired(String messageId, String targetAgent) {
        return new DeliveryReceipt(messageId, Instant.now(), DeliveryStatus.EXPIRED, targetAgent, null);
    }

    public boolean isDelivered() {
        return status == DeliveryStatus.DELIVERED;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("messageId", messageId)
                .put("timestamp", timestamp.toString())
                .put("status", status.getValue())
                .put("targetAgent", targetAgent);
        if (error != null) {
            json.put("error", error.toJson());
        }
        return json;
    }

    /**
     * Reads a receipt produced by a remote hub. A remote error is carried as an upstream
     * error with the hub's message.
     */
    public static DeliveryReceipt fromJson(JsonObject json) {
        String timestamp = json.getString("timestamp");
        JsonObject error = json.getJsonObject("error");
        CallError callError = error == null ? null
                : CallError.of(ErrorKind.UPSTREAM_SERVICE_ERROR, error.getString("message", "delivery failed"));
        return new DeliveryReceipt(
                json.getString("messageId"),
                timestamp != null ? Instant.parse(timestamp) : Instant.now(),
                DeliveryStatus.fromValue(json.getString("status")),
                json.getString("targetAgent"),
                callError);
    }
}
