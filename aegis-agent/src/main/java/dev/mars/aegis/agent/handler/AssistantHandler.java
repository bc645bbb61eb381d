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


package dev.mars.aegis.agent.handler;

import dev.mars.aegis.agent.AgentContext;
import dev.mars.aegis.agent.AgentHandler;
import dev.mars.aegis.agent.AgentRequest;
import dev.mars.aegis.core.exceptions.CallException;
import dev.mars.aegis.generation.GenerationRequest;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * General-purpose assistant: forwards {@code payload.prompt} to the AI service and returns the
 * generated text.
 *
 * <p>Optional payload fields: {@code systemInstruction}. The response payload carries
 * {@code content}, {@code finishReason} and, when reported, {@code usage}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
public class AssistantHandler implements AgentHandler {

    private static final Logger logger = LoggerFactory.getLogger(AssistantHandler.class);

    @Override
    public Future<JsonObject> handle(AgentRequest request, AgentContext context) {
        String prompt = request.payload().getString("prompt");
        if (prompt == null || prompt.isBlank()) {
            return Future.failedFuture(CallException.validation("payload.prompt is required"));
        }

        GenerationRequest generation = GenerationRequest.of(prompt);
        String instruction = request.payload().getString("systemInstruction");
        if (instruction != null && !instruction.isBlank()) {
            generation = generation.withSystemInstruction(instruction);
        }

        logger.debug("Assistant request {} forwarded as generation {}", request.id(), generation.id());
        return context.generate(generation).compose(response -> {
            if (!response.success()) {
                return Future.failedFuture(new CallException(response.error()));
            }
            JsonObject payload = new JsonObject()
                    .put("content", response.content())
                    .put("finishReason", response.finishReason());
            if (response.usage() != null) {
                payload.put("usage", response.usage().toJson());
            }
            return Future.succeededFuture(payload);
        });
    }
}
