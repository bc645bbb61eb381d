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

import dev.mars.aegis.core.CallError;

/**
 * Result of a generation whose content was parsed as JSON into {@code T}.
 *
 * @param success  true when both the call and the parse succeeded
 * @param value    the parsed value, null on failure
 * @param response the underlying generation response
 * @param error    the call or parse error, null on success
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public record StructuredResponse<T>(boolean success, T value, GenerationResponse response, CallError error) {

    public static <T> StructuredResponse<T> parsed(T value, GenerationResponse response) {
        return new StructuredResponse<>(true, value, response, null);
    }

    public static <T> StructuredResponse<T> failed(GenerationResponse response, CallError error) {
        return new StructuredResponse<>(false, null, response, error);
    }
}
