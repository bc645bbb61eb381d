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

import io.vertx.core.json.JsonObject;

import java.util.Objects;

/**
 * One declared parameter of a gateway operation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public record ParameterSpec(String name, ParameterType type, boolean required, String description) {

    public ParameterSpec {
        Objects.requireNonNull(name, "Parameter name cannot be null");
        type = type != null ? type : ParameterType.ANY;
        description = description != null ? description : "";
    }

    public static ParameterSpec required(String name, ParameterType type) {
        return new ParameterSpec(name, type, true, null);
    }

    public static ParameterSpec optional(String name, ParameterType type) {
        return new ParameterSpec(name, type, false, null);
    }

    static ParameterSpec fromJson(JsonObject json) {
        return new ParameterSpec(
                json.getString("name"),
                ParameterType.fromValue(json.getString("type")),
                json.getBoolean("required", false),
                json.getString("description"));
    }
}
