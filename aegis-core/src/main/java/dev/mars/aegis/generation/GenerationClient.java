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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.aegis.core.CallError;
import dev.mars.aegis.core.CallResult;
import dev.mars.aegis.core.ErrorKind;
import dev.mars.aegis.core.exceptions.CallException;
import dev.mars.aegis.envelope.CallEnvelope;
import dev.mars.aegis.event.EventPublisher;
import dev.mars.aegis.resilience.EndpointResilience;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.concurrent.atomic.LongAdder;

/**
 * Call envelope for the generative AI service.
 *
 * <p>All operations return futures that succeed with a normalized response; failures
 * are reported through {@link GenerationResponse#error()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class GenerationClient extends CallEnvelope<GenerationCall, GenerationResult, GenerationResponse> {

    private static final Logger logger = LoggerFactory.getLogger(GenerationClient.class);

    public static final int MAX_PROMPT_LENGTH = 100_000;
    public static final int BATCH_CONCURRENCY = 3;
    static final String JSON_INSTRUCTION = "\n\nPlease respond with valid JSON format only.";

    private final EndpointResilience resilience;
    private final GenerationTransport transport;
    private final ObjectMapper objectMapper;

    private final LongAdder requestCount = new LongAdder();
    private final LongAdder errorCount = new LongAdder();
    private final LongAdder totalProcessingMs = new LongAdder();

    public GenerationClient(EndpointResilience resilience, GenerationTransport transport, EventPublisher events) {
        this(resilience, transport, events, new ObjectMapper());
    }

    public GenerationClient(EndpointResilience resilience, GenerationTransport transport, EventPublisher events,
                            ObjectMapper objectMapper) {
        super("generation", events);
        this.resilience = Objects.requireNonNull(resilience, "Endpoint resilience cannot be null");
        this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    // ==================== Operations ====================

    public Future<GenerationResponse> generate(GenerationRequest request) {
        return invoke(new GenerationCall(request, null));
    }

    /**
     * Generates with incremental delivery: each text fragment reaches {@code fragments} as it
     * arrives, then the future completes with the same response shape as {@link #generate}.
     * If an attempt fails midway and is retried, fragments of the retried attempt are delivered again.
     */
    public Future<GenerationResponse> generateStream(GenerationRequest request, Consumer<String> fragments) {
        Objects.requireNonNull(fragments, "Fragment consumer cannot be null");
        return invoke(new GenerationCall(request, fragments));
    }

    /**
     * Asks for a JSON answer and parses it into {@code type}.
     */
    public <T> Future<StructuredResponse<T>> generateStructured(GenerationRequest request, Class<T> type) {
        GenerationRequest jsonRequest = request != null && request.prompt() != null
                ? request.withPrompt(request.prompt() + JSON_INSTRUCTION) : request;
        return generate(jsonRequest).map(response -> {
            if (!response.success()) {
                return StructuredResponse.failed(response, response.error());
            }
            try {
                return StructuredResponse.parsed(objectMapper.readValue(stripCodeFence(response.content()), type), response);
            } catch (JsonProcessingException e) {
                logger.warn("Generation {} did not return valid JSON: {}", response.requestId(), e.getOriginalMessage());
                CallError error = CallError.of(ErrorKind.PARSE_ERROR,
                        ErrorKind.PARSE_ERROR.formatMessage("failed to parse response as JSON"), response.requestId())
                        .withDetail("targetType", type.getSimpleName());
                return StructuredResponse.failed(response, error);
            }
        });
    }

    /**
     * Runs the requests in groups of {@value #BATCH_CONCURRENCY}; responses keep the input order.
     */
    public Future<List<GenerationResponse>> batchGenerate(List<GenerationRequest> requests) {
        Objects.requireNonNull(requests, "Requests cannot be null");
        List<GenerationResponse> responses = new ArrayList<>(requests.size());
        return runBatch(requests, 0, responses).map(done -> {
            logger.debug("Batch of {} generation(s) completed", requests.size());
            return responses;
        });
    }

    private Future<Void> runBatch(List<GenerationRequest> requests, int from, List<GenerationResponse> responses) {
        if (from >= requests.size()) {
            return Future.succeededFuture();
        }
        int to = Math.min(from + BATCH_CONCURRENCY, requests.size());
        List<Future<GenerationResponse>> group = new ArrayList<>();
        for (GenerationRequest request : requests.subList(from, to)) {
            group.add(generate(request));
        }
        return Future.all(group).compose(done -> {
            group.forEach(future -> responses.add(future.result()));
            return runBatch(requests, to, responses);
        });
    }

    public Map<String, Object> statistics() {
        long requests = requestCount.sum();
        long errors = errorCount.sum();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("requestCount", requests);
        stats.put("errorCount", errors);
        stats.put("errorRate", requests == 0 ? 0.0 : (double) errors / requests);
        stats.put("averageProcessingTime", requests == 0 ? 0.0 : (double) totalProcessingMs.sum() / requests);
        stats.put("rateLimitTokens", resilience.rateLimiter().tokensAvailable());
        stats.put("queueLength", resilience.rateLimiter().queueLength());
        stats.put("circuitState", resilience.circuitBreaker().getState().getValue());
        return stats;
    }

    @Override
    public Future<Void> stop() {
        return super.stop().compose(v -> transport.close());
    }

    // ==================== Envelope Hooks ====================

    @Override
    protected void validate(GenerationCall call) {
        GenerationRequest request = call.request();
        if (request == null) {
            throw CallException.validation("generation request cannot be null");
        }
        if (request.id() == null || request.id().isBlank()) {
            throw CallException.validation("request id is required");
        }
        if (request.timestamp() == null) {
            throw CallException.validation("request timestamp is required");
        }
        if (request.prompt() == null || request.prompt().isBlank()) {
            throw CallException.validation("prompt is required and cannot be empty");
        }
        if (request.prompt().length() > MAX_PROMPT_LENGTH) {
            throw CallException.validation("prompt exceeds maximum length of " + MAX_PROMPT_LENGTH + " characters");
        }
        GenerationOptions options = request.options();
        if (options.maxTokens() != null && options.maxTokens() <= 0) {
            throw CallException.validation("maxTokens must be positive");
        }
        if (options.temperature() != null && (options.temperature() < 0 || options.temperature() > 2)) {
            throw CallException.validation("temperature must be between 0 and 2");
        }
        if (options.topP() != null && (options.topP() < 0 || options.topP() > 1)) {
            throw CallException.validation("topP must be between 0 and 1");
        }
        if (options.topK() != null && options.topK() <= 0) {
            throw CallException.validation("topK must be positive");
        }
    }

    @Override
    protected EndpointResilience resolve(GenerationCall call) {
        return resilience;
    }

    @Override
    protected Future<GenerationResult> transport(GenerationCall call, int attempt) {
        return call.streaming()
                ? transport.generateStream(call.request(), call.fragments())
                : transport.generate(call.request());
    }

    @Override
    protected GenerationResponse toSuccess(GenerationCall call, GenerationResult raw, CallResult result) {
        record(result);
        return GenerationResponse.succeeded(call.request().id(), raw, result.elapsedMs());
    }

    @Override
    protected GenerationResponse toFailure(GenerationCall call, CallError error, CallResult result) {
        record(result);
        String requestId = call != null && call.request() != null ? call.request().id() : null;
        return GenerationResponse.failed(requestId, error, result.elapsedMs());
    }

    @Override
    protected String correlationIdOf(GenerationCall call) {
        return call.request() != null ? call.request().id() : null;
    }

    @Override
    public Collection<EndpointResilience> endpoints() {
        return List.of(resilience);
    }

    private void record(CallResult result) {
        requestCount.increment();
        totalProcessingMs.add(result.elapsedMs());
        if (!result.success()) {
            errorCount.increment();
        }
    }

    static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }
}
