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

import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Objects;

/**
 * Content-safety threshold for one harm category.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public record SafetySetting(String category, String threshold) {

    public static final String BLOCK_MEDIUM_AND_ABOVE = "BLOCK_MEDIUM_AND_ABOVE";

    public static final List<SafetySetting> DEFAULTS = List.of(
            new SafetySetting("HARM_CATEGORY_HARASSMENT", BLOCK_MEDIUM_AND_ABOVE),
            new SafetySetting("HARM_CATEGORY_HATE_SPEECH", BLOCK_MEDIUM_AND_ABOVE),
            new SafetySetting("HARM_CATEGORY_SEXUALLY_EXPLICIT", BLOCK_MEDIUM_AND_ABOVE),
            new SafetySetting("HARM_CATEGORY_DANGEROUS_CONTENT", BLOCK_MEDIUM_AND_ABOVE));

    public SafetySetting {
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(threshold, "Threshold cannot be null");
    }

    public JsonObject toJson() {
        return new JsonObject().put("category", category).put("threshold", threshold);
    }
}
