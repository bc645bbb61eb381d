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
import java.util.Optional;

/**
 * A service definition as published by the gateway.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public record ServiceDefinition(String name, String version, String description, List<OperationSchema> operations) {

    public ServiceDefinition {
        operations = operations != null ? List.copyOf(operations) : List.of();
    }

    public Optional<OperationSchema> operation(String operationName) {
        return operations.stream().filter(op -> op.name().equals(operationName)).findFirst();
    }

    /**
     * @throws ClassCastException if a field has the wrong JSON type
     * @throws NullPointerException if an operation has no name
     */
    public static ServiceDefinition fromJson(JsonObject json) {
        List<OperationSchema> operations = new ArrayList<>();
        JsonArray declared = json.getJsonArray("operations", new JsonArray());
        for (int i = 0; i < declared.size(); i++) {
            operations.add(OperationSchema.fromJson(declared.getJsonObject(i)));
        }
        return new ServiceDefinition(json.getString("name"), json.getString("version"),
                json.getString("description"), operations);
    }
}
