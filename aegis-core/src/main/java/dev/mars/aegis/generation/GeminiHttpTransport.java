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


package dev.mars.aegis.generation;

import dev.mars.aegis.core.ErrorClassifier;
import dev.mars.aegis.core.exceptions.CallException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.core.parsetools.RecordParser;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Generation transport for the Gemini REST API.
 *
 * <p>Plain calls go through the Vert.x WebClient to {@code :generateContent}. Streaming
 * calls use the core HTTP client against {@code :streamGenerateContent?alt=sse} and parse
 * the server-sent events line by line, handing each text fragment to the caller as soon
 * as its event is complete.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class GeminiHttpTransport implements GenerationTransport {

    private static final Logger logger = LoggerFactory.getLogger(GeminiHttpTransport.class);
    private static final String SERVICE = "generation";
    private static final String SSE_DATA_PREFIX = "data:";

    private final GenerationSettings settings;
    private final WebClient webClient;
    private final HttpClient httpClient;

    public GeminiHttpTransport(Vertx vertx, GenerationSettings settings) {
        this.settings = settings;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout(settings.connectTimeoutMs())
                .setUserAgent("Aegis-Agent/1.0"));
        this.httpClient = vertx.createHttpClient(new HttpClientOptions()
                .setConnectTimeout(settings.connectTimeoutMs()));
        logger.debug("GeminiHttpTransport initialized for model {} at {}", settings.model(), settings.baseUrl());
    }

    @Override
    public Future<GenerationResult> generate(GenerationRequest request) {
        String url = settings.baseUrl() + "/models/" + settings.model() + ":generateContent";
        return webClient.postAbs(url)
                .addQueryParam("key", settings.apiKey())
                .putHeader("Content-Type", "application/json")
                .sendJsonObject(buildRequestBody(request))
                .timeout(settings.requestTimeoutMs(), TimeUnit.MILLISECONDS)
                .map(this::handleResponse);
    }

    @Override
    public Future<GenerationResult> generateStream(GenerationRequest request, Consumer<String> fragments) {
        String url = settings.baseUrl() + "/models/" + settings.model() + ":streamGenerateContent?alt=sse&key="
                + URLEncoder.encode(settings.apiKey(), StandardCharsets.UTF_8);
        RequestOptions options = new RequestOptions()
                .setMethod(HttpMethod.POST)
                .setAbsoluteURI(url)
                .setIdleTimeout(settings.requestTimeoutMs())
                .putHeader("Content-Type", "application/json")
                .putHeader("Accept", "text/event-stream");

        // Cleared once this attempt is abandoned; a retry must never see fragments from it.
        AtomicBoolean current = new AtomicBoolean(true);
        AtomicReference<HttpClientRequest> inFlight = new AtomicReference<>();

        return httpClient.request(options)
                .compose(req -> {
                    inFlight.set(req);
                    return req.send(buildRequestBody(request).toBuffer());
                })
                .compose(response -> {
                    if (response.statusCode() / 100 != 2) {
                        int status = response.statusCode();
                        return response.body().compose(body ->
                                Future.failedFuture(ErrorClassifier.fromHttpStatus(SERVICE, status, errorMessage(body))));
                    }
                    StreamAccumulator accumulator = new StreamAccumulator(fragments, current);
                    response.handler(RecordParser.newDelimited("\n", accumulator::onLine));
                    return response.end().compose(done -> accumulator.result());
                })
                .timeout(settings.requestTimeoutMs(), TimeUnit.MILLISECONDS)
                .onFailure(err -> abandon(current, inFlight.get(), err));
    }

    private static void abandon(AtomicBoolean current, HttpClientRequest request, Throwable cause) {
        current.set(false);
        if (request != null) {
            logger.debug("Resetting abandoned stream request: {}", cause.getMessage());
            request.reset(0, cause);
        }
    }

    @Override
    public Future<Void> close() {
        logger.debug("Shutting down GeminiHttpTransport clients");
        webClient.close();
        return httpClient.close();
    }

    // ==================== Request / Response Mapping ====================

    JsonObject buildRequestBody(GenerationRequest request) {
        GenerationOptions options = request.options();
        JsonObject generationConfig = new JsonObject()
                .put("maxOutputTokens", options.maxTokens() != null ? options.maxTokens() : settings.defaultMaxTokens())
                .put("temperature", options.temperature() != null ? options.temperature() : settings.defaultTemperature())
                .put("topP", options.effectiveTopP())
                .put("topK", options.effectiveTopK())
                .put("stopSequences", new JsonArray(options.stopSequences()));

        JsonArray safety = new JsonArray();
        options.safetySettings().forEach(setting -> safety.add(setting.toJson()));

        JsonObject content = new JsonObject()
                .put("role", "user")
                .put("parts", new JsonArray().add(new JsonObject().put("text", request.effectivePrompt())));

        return new JsonObject()
                .put("contents", new JsonArray().add(content))
                .put("generationConfig", generationConfig)
                .put("safetySettings", safety);
    }

    private GenerationResult handleResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() / 100 != 2) {
            throw ErrorClassifier.fromHttpStatus(SERVICE, response.statusCode(), errorMessage(response.body()));
        }
        JsonObject body = response.bodyAsJsonObject();
        if (body == null) {
            throw CallException.parse("empty response body from " + SERVICE, null);
        }
        return parseResult(body);
    }

    static GenerationResult parseResult(JsonObject body) {
        try {
            JsonArray candidates = body.getJsonArray("candidates", new JsonArray());
            TokenUsage usage = parseUsage(body.getJsonObject("usageMetadata"));
            if (candidates.isEmpty()) {
                JsonObject feedback = body.getJsonObject("promptFeedback");
                String blockReason = feedback != null ? feedback.getString("blockReason") : null;
                return new GenerationResult("", usage, blockReason != null ? "BLOCKED_" + blockReason : null);
            }
            JsonObject candidate = candidates.getJsonObject(0);
            StringBuilder text = new StringBuilder();
            JsonObject content = candidate.getJsonObject("content");
            if (content != null) {
                JsonArray parts = content.getJsonArray("parts", new JsonArray());
                for (int i = 0; i < parts.size(); i++) {
                    text.append(parts.getJsonObject(i).getString("text", ""));
                }
            }
            return new GenerationResult(text.toString(), usage, candidate.getString("finishReason"));
        } catch (ClassCastException e) {
            throw CallException.parse("unexpected response structure from " + SERVICE, e);
        }
    }

    private static TokenUsage parseUsage(JsonObject usage) {
        if (usage == null) {
            return null;
        }
        return new TokenUsage(
                usage.getInteger("promptTokenCount", 0),
                usage.getInteger("candidatesTokenCount", 0),
                usage.getInteger("totalTokenCount", 0));
    }

    private static String errorMessage(Buffer body) {
        if (body == null || body.length() == 0) {
            return null;
        }
        try {
            JsonObject error = new JsonObject(body).getJsonObject("error");
            return error != null ? error.getString("message") : null;
        } catch (DecodeException | ClassCastException e) {
            logger.debug("Error body is not JSON: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Collects streamed events into one result, forwarding fragments as they arrive.
     */
    private static final class StreamAccumulator {
        private final Consumer<String> fragments;
        private final AtomicBoolean current;
        private final StringBuilder content = new StringBuilder();
        private TokenUsage usage;
        private String finishReason;
        private CallException failure;

        private StreamAccumulator(Consumer<String> fragments, AtomicBoolean current) {
            this.fragments = fragments;
            this.current = current;
        }

        private void onLine(Buffer line) {
            String text = line.toString(StandardCharsets.UTF_8).trim();
            if (!current.get() || failure != null || !text.startsWith(SSE_DATA_PREFIX)) {
                return;
            }
            String data = text.substring(SSE_DATA_PREFIX.length()).trim();
            if (data.isEmpty() || "[DONE]".equals(data)) {
                return;
            }
            GenerationResult chunk;
            try {
                chunk = parseResult(new JsonObject(data));
            } catch (DecodeException e) {
                failure = CallException.parse("malformed stream event from " + SERVICE, e);
                return;
            } catch (CallException e) {
                failure = e;
                return;
            }
            if (!chunk.content().isEmpty()) {
                content.append(chunk.content());
                fragments.accept(chunk.content());
            }
            if (chunk.usage() != TokenUsage.NONE) {
                usage = chunk.usage();
            }
            if (chunk.finishReason() != null) {
                finishReason = chunk.finishReason();
            }
        }

        private Future<GenerationResult> result() {
            if (failure != null) {
                return Future.failedFuture(failure);
            }
            return Future.succeededFuture(new GenerationResult(content.toString(), usage, finishReason));
        }
    }
}
