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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Map;

/**
 * JSON value types an operation parameter may declare.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public enum ParameterType {

    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    ANY("any");

    private final String value;

    ParameterType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether a decoded parameter value has this type. Null never matches.
     */
    public boolean matches(Object candidate) {
        if (candidate == null) {
            return false;
        }
        return switch (this) {
            case STRING -> candidate instanceof CharSequence;
            case NUMBER -> candidate instanceof Number;
            case INTEGER -> candidate instanceof Integer || candidate instanceof Long
                    || candidate instanceof Short || candidate instanceof Byte;
            case BOOLEAN -> candidate instanceof Boolean;
            case OBJECT -> candidate instanceof Map || candidate instanceof io.vertx.core.json.JsonObject;
            case ARRAY -> candidate instanceof Collection || candidate instanceof io.vertx.core.json.JsonArray
                    || candidate.getClass().isArray();
            case ANY -> true;
        };
    }

    @JsonCreator
    public static ParameterType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ANY;
        }
        for (ParameterType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return ANY;
    }

    @Override
    public String toString() {
        return value;
    }
}
