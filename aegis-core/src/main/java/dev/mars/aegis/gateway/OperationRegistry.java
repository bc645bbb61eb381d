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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operation schemas known for each gateway service.
 *
 * <p>A service with no registered schema accepts any operation. Once at least one schema
 * is registered for a service, calls to operations without a schema are rejected.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class OperationRegistry {

    private static final Logger logger = LoggerFactory.getLogger(OperationRegistry.class);

    private final Map<String, Map<String, OperationSchema>> schemas = new ConcurrentHashMap<>();

    public void register(String service, OperationSchema schema) {
        Objects.requireNonNull(service, "Service cannot be null");
        Objects.requireNonNull(schema, "Schema cannot be null");
        schemas.computeIfAbsent(service, k -> new ConcurrentHashMap<>()).put(schema.name(), schema);
        logger.debug("Registered schema for {}.{} with {} parameter(s)", service, schema.name(),
                schema.parameters().size());
    }

    public void register(ServiceDefinition definition) {
        Objects.requireNonNull(definition, "Service definition cannot be null");
        definition.operations().forEach(op -> register(definition.name(), op));
    }

    public Optional<OperationSchema> find(String service, String operation) {
        Map<String, OperationSchema> forService = schemas.get(service);
        return forService == null ? Optional.empty() : Optional.ofNullable(forService.get(operation));
    }

    public boolean hasSchemas(String service) {
        Map<String, OperationSchema> forService = schemas.get(service);
        return forService != null && !forService.isEmpty();
    }

    /**
     * @return the violations found, empty when the call is acceptable
     */
    public List<String> validate(String service, String operation, Map<String, Object> parameters) {
        if (!hasSchemas(service)) {
            return List.of();
        }
        return find(service, operation)
                .map(schema -> schema.validate(parameters))
                .orElseGet(() -> List.of("unknown operation '" + operation + "' for service '" + service + "'"));
    }
}
