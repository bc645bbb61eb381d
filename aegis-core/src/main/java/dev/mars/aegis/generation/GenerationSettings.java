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

import java.util.Objects;

/**
 * Connection settings for the generative AI service.
 *
 * @param baseUrl            API root, e.g. https://generativelanguage.googleapis.com/v1beta
 * @param model              model name, e.g. gemini-pro
 * @param apiKey             key passed with every request
 * @param defaultMaxTokens   output token limit when the request does not set one
 * @param defaultTemperature temperature when the request does not set one
 * @param connectTimeoutMs   TCP connect timeout
 * @param requestTimeoutMs   limit on one attempt, including the full streamed body
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public record GenerationSettings(
        String baseUrl,
        String model,
        String apiKey,
        int defaultMaxTokens,
        double defaultTemperature,
        int connectTimeoutMs,
        long requestTimeoutMs
) {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";
    public static final String DEFAULT_MODEL = "gemini-pro";
    public static final int DEFAULT_MAX_TOKENS = 2048;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public GenerationSettings {
        Objects.requireNonNull(baseUrl, "Base URL cannot be null");
        Objects.requireNonNull(model, "Model cannot be null");
        apiKey = apiKey != null ? apiKey : "";
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static GenerationSettings of(String baseUrl, String model, String apiKey) {
        return new GenerationSettings(baseUrl, model, apiKey, DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE, 5000, 30000);
    }
}
