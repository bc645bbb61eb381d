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

import dev.mars.aegis.core.ErrorClassifier;
import dev.mars.aegis.core.exceptions.CallException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Peer transport talking to a remote hub.
 *
 * <p>Control calls and publishing use HTTP ({@code /agents/register}, {@code /subscriptions},
 * {@code /messages}, {@code /health}); inbound messages arrive over a WebSocket opened on
 * {@code /ws} with the agent id in the {@code X-Agent-ID} header.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 */
public class HttpPeerTransport implements PeerTransport {

    private static final Logger logger = LoggerFactory.getLogger(HttpPeerTransport.class);
    private static final String ENDPOINT = "peer-hub";

    private final String hubUrl;
    private final long requestTimeoutMs;
    private final WebClient webClient;
    private final WebSocketClient webSocketClient;
    private volatile WebSocket webSocket;

    public HttpPeerTransport(Vertx vertx, String hubUrl, int connectTimeoutMs, long requestTimeoutMs) {
        Objects.requireNonNull(hubUrl, "Hub URL cannot be null");
        this.hubUrl = hubUrl.endsWith("/") ? hubUrl.substring(0, hubUrl.length() - 1) : hubUrl;
        this.requestTimeoutMs = requestTimeoutMs;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout(connectTimeoutMs)
                .setUserAgent("Aegis-Peer-Client/1.0"));
        this.webSocketClient = vertx.createWebSocketClient(new WebSocketClientOptions()
                .setConnectTimeout(connectTimeoutMs));
    }

    @Override
    public Future<Void> connect(String agentId, Consumer<PeerMessage> inbound) {
        String wsUrl = hubUrl.replaceFirst("^http", "ws") + "/ws";
        WebSocketConnectOptions options = new WebSocketConnectOptions()
                .setAbsoluteURI(wsUrl)
                .addHeader("X-Agent-ID", agentId);
        return webSocketClient.connect(options)
                .map(ws -> {
                    ws.textMessageHandler(text -> onFrame(text, inbound));
                    ws.closeHandler(v -> {
                        logger.info("Hub connection closed for agent {}", agentId);
                        webSocket = null;
                    });
                    webSocket = ws;
                    logger.info("Agent {} connected to hub at {}", agentId, wsUrl);
                    return (Void) null;
                })
                .recover(failure -> Future.failedFuture(
                        CallException.upstream("cannot connect to hub at " + wsUrl + ": " + failure.getMessage(), failure)));
    }

    @Override
    public Future<Void> disconnect() {
        WebSocket ws = webSocket;
        webSocket = null;
        if (ws == null || ws.isClosed()) {
            return Future.succeededFuture();
        }
        return ws.close();
    }

    @Override
    public Future<Void> register(AgentRegistration registration) {
        return post("/agents/register", registration.toJson()).mapEmpty();
    }

    @Override
    public Future<Void> subscribe(String agentId, Subscription subscription) {
        JsonObject body = new JsonObject()
                .put("agentId", agentId)
                .put("subscription", subscription.toJson());
        return post("/subscriptions", body).mapEmpty();
    }

    @Override
    public Future<Void> unsubscribe(String agentId, String topic) {
        return webClient.deleteAbs(hubUrl + "/subscriptions/" + topic)
                .addQueryParam("agentId", agentId)
                .send()
                .timeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .map(HttpPeerTransport::requireSuccess)
                .mapEmpty();
    }

    @Override
    public Future<DeliveryReceipt> publish(PeerMessage message) {
        return post("/messages", message.toJson()).map(response -> parseReceipt(message, response));
    }

    @Override
    public Future<Boolean> healthCheck() {
        return webClient.getAbs(hubUrl + "/health")
                .send()
                .timeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .map(response -> response.statusCode() == 200);
    }

    @Override
    public Future<Void> close() {
        webClient.close();
        return disconnect().compose(v -> webSocketClient.close());
    }

    public boolean isConnected() {
        WebSocket ws = webSocket;
        return ws != null && !ws.isClosed();
    }

    // ==================== Internals ====================

    private Future<HttpResponse<Buffer>> post(String path, JsonObject body) {
        return webClient.postAbs(hubUrl + path)
                .putHeader("Content-Type", "application/json")
                .sendJsonObject(body)
                .timeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .map(HttpPeerTransport::requireSuccess);
    }

    private static HttpResponse<Buffer> requireSuccess(HttpResponse<Buffer> response) {
        if (response.statusCode() / 100 != 2) {
            throw ErrorClassifier.fromHttpStatus(ENDPOINT, response.statusCode(), response.statusMessage());
        }
        return response;
    }

    /**
     * The hub may answer with a single receipt or with one receipt per recipient; the
     * first receipt stands for the publish.
     */
    private static DeliveryReceipt parseReceipt(PeerMessage message, HttpResponse<Buffer> response) {
        Buffer body = response.body();
        if (body == null || body.length() == 0) {
            return DeliveryReceipt.delivered(message.id(), "hub");
        }
        try {
            Object decoded = Json.decodeValue(body);
            if (decoded instanceof JsonArray receipts && !receipts.isEmpty()) {
                return DeliveryReceipt.fromJson(receipts.getJsonObject(0));
            }
            if (decoded instanceof JsonObject receipt) {
                return DeliveryReceipt.fromJson(receipt);
            }
            return DeliveryReceipt.delivered(message.id(), "hub");
        } catch (DecodeException | ClassCastException | IllegalArgumentException | DateTimeParseException e) {
            throw CallException.parse("undecodable delivery receipt from hub", e);
        }
    }

    private static void onFrame(String text, Consumer<PeerMessage> inbound) {
        JsonObject frame;
        try {
            frame = new JsonObject(text);
        } catch (DecodeException e) {
            logger.warn("Ignoring undecodable frame from hub: {}", e.getMessage());
            return;
        }
        String type = frame.getString("type");
        if ("error".equals(type)) {
            logger.warn("Hub reported an error: {}", frame.getString("message"));
            return;
        }
        if (type != null) {
            logger.debug("Ignoring hub frame of type {}", type);
            return;
        }
        try {
            inbound.accept(PeerMessage.fromJson(frame));
        } catch (ClassCastException | IllegalArgumentException | DateTimeParseException e) {
            logger.warn("Ignoring malformed message from hub: {}", e.getMessage());
        }
    }
}
