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

import java.time.Instant;
import java.util.UUID;

/**
 * A prompt to send to the generative AI service.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public record GenerationRequest(
        String id,
        Instant timestamp,
        String prompt,
        GenerationOptions options,
        String systemInstruction
) {

    public GenerationRequest {
        options = options != null ? options : GenerationOptions.defaults();
    }

    public static GenerationRequest of(String prompt) {
        return of(prompt, GenerationOptions.defaults());
    }

    public static GenerationRequest of(String prompt, GenerationOptions options) {
        return new GenerationRequest(newId(), Instant.now(), prompt, options, null);
    }

    public GenerationRequest withSystemInstruction(String instruction) {
        return new GenerationRequest(id, timestamp, prompt, options, instruction);
    }

    public GenerationRequest withPrompt(String newPrompt) {
        return new GenerationRequest(id, timestamp, newPrompt, options, systemInstruction);
    }

    /**
     * The prompt as sent to the service, with the system instruction prepended when present.
     */
    public String effectivePrompt() {
        if (systemInstruction == null || systemInstruction.isBlank()) {
            return prompt;
        }
        return systemInstruction + "\n\nUser: " + prompt;
    }

    public static String newId() {
        return "gen_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
