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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The parameter contract of one operation offered by a gateway service.
 *
 * <p>Validation checks that every required parameter is present and non-null and that
 * every declared parameter has its declared type. Undeclared parameters are passed through.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public record OperationSchema(String name, String description, List<ParameterSpec> parameters) {

    public OperationSchema {
        Objects.requireNonNull(name, "Operation name cannot be null");
        description = description != null ? description : "";
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public static OperationSchema of(String name, ParameterSpec... parameters) {
        return new OperationSchema(name, null, List.of(parameters));
    }

    /**
     * @return the violations found, empty when the parameters conform
     */
    public List<String> validate(Map<String, Object> values) {
        List<String> violations = new ArrayList<>();
        for (ParameterSpec spec : parameters) {
            Object value = values.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    violations.add("missing required parameter '" + spec.name() + "'");
                }
            } else if (!spec.type().matches(value)) {
                violations.add("parameter '" + spec.name() + "' must be of type " + spec.type());
            }
        }
        return violations;
    }

    static OperationSchema fromJson(JsonObject json) {
        List<ParameterSpec> specs = new ArrayList<>();
        JsonArray declared = json.getJsonArray("parameters", new JsonArray());
        for (int i = 0; i < declared.size(); i++) {
            specs.add(ParameterSpec.fromJson(declared.getJsonObject(i)));
        }
        return new OperationSchema(json.getString("name"), json.getString("description"), specs);
    }
}
