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

import dev.mars.aegis.core.ErrorClassifier;
import dev.mars.aegis.core.exceptions.CallException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Gateway transport over HTTP.
 *
 * <ul>
 *   <li>{@code POST {gateway}/mcp/request} with the request as JSON body</li>
 *   <li>{@code GET {gateway}/mcp/services/{service}/definition}</li>
 *   <li>{@code GET {gateway}/mcp/health}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class HttpGatewayTransport implements GatewayTransport {

    private static final Logger logger = LoggerFactory.getLogger(HttpGatewayTransport.class);
    private static final long HEALTH_TIMEOUT_MS = 5000;

    private final String gatewayUrl;
    private final WebClient webClient;

    public HttpGatewayTransport(Vertx vertx, String gatewayUrl, int connectTimeoutMs) {
        Objects.requireNonNull(gatewayUrl, "Gateway URL cannot be null");
        this.gatewayUrl = gatewayUrl.endsWith("/") ? gatewayUrl.substring(0, gatewayUrl.length() - 1) : gatewayUrl;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout(connectTimeoutMs)
                .setUserAgent("Aegis-Gateway-Client/1.0"));
    }

    @Override
    public Future<Object> send(GatewayServiceConfig service, RpcRequest request) {
        long timeoutMs = request.metadata().timeoutMs() > 0 ? request.metadata().timeoutMs() : service.timeoutMs();
        logger.debug("POST {}/mcp/request for {}.{} (timeout {} ms)",
                gatewayUrl, request.service(), request.operation(), timeoutMs);
        return webClient.postAbs(gatewayUrl + "/mcp/request")
                .putHeader("Content-Type", "application/json")
                .putHeader("X-Correlation-Id", request.metadata().correlationId())
                .sendJsonObject(request.toJson())
                .timeout(timeoutMs, TimeUnit.MILLISECONDS)
                .map(response -> decodePayload(service.resilienceEndpoint(), response));
    }

    @Override
    public Future<ServiceDefinition> describe(GatewayServiceConfig service) {
        return webClient.getAbs(gatewayUrl + "/mcp/services/" + service.name() + "/definition")
                .send()
                .timeout(service.timeoutMs(), TimeUnit.MILLISECONDS)
                .map(response -> {
                    Object payload = decodePayload(service.resilienceEndpoint(), response);
                    if (!(payload instanceof JsonObject json)) {
                        throw CallException.parse("service definition of '" + service.name() + "' is not a JSON object", null);
                    }
                    try {
                        return ServiceDefinition.fromJson(json);
                    } catch (ClassCastException | NullPointerException e) {
                        throw CallException.parse("malformed service definition of '" + service.name() + "'", e);
                    }
                });
    }

    @Override
    public Future<Boolean> healthCheck() {
        return webClient.getAbs(gatewayUrl + "/mcp/health")
                .send()
                .timeout(HEALTH_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .map(response -> response.statusCode() == 200);
    }

    @Override
    public Future<Void> close() {
        webClient.close();
        return Future.succeededFuture();
    }

    private static Object decodePayload(String endpoint, HttpResponse<Buffer> response) {
        if (response.statusCode() / 100 != 2) {
            throw ErrorClassifier.fromHttpStatus(endpoint, response.statusCode(), response.statusMessage());
        }
        Buffer body = response.body();
        if (body == null || body.length() == 0) {
            return null;
        }
        try {
            return Json.decodeValue(body);
        } catch (DecodeException e) {
            throw CallException.parse("undecodable response body from " + endpoint, e);
        }
    }
}
