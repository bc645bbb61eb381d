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


package dev.mars.aegis.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Layered configuration source for Aegis components.
 *
 * <p>Resolution order (highest to lowest priority):
 * <ol>
 *   <li>Environment variable (e.g., AEGIS_RESILIENCE_RATE_LIMIT_PER_MINUTE)</li>
 *   <li>System property (e.g., -Daegis.resilience.rate-limit-per-minute=120)</li>
 *   <li>Properties file ({@value #CONFIG_FILE} on the classpath) or explicit properties</li>
 *   <li>Default value supplied by the caller</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class AegisConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AegisConfiguration.class);

    public static final String CONFIG_FILE = "aegis.properties";

    private final Properties properties;
    private final UnaryOperator<String> environment;

    /**
     * Creates a configuration backed by the given properties and the process environment.
     */
    public AegisConfiguration(Properties properties) {
        this(properties, System::getenv);
    }

    /**
     * Creates a configuration with an explicit environment lookup.
     */
    public AegisConfiguration(Properties properties, UnaryOperator<String> environment) {
        this.properties = new Properties();
        if (properties != null) {
            this.properties.putAll(properties);
        }
        this.environment = Objects.requireNonNull(environment, "Environment lookup cannot be null");
    }

    /**
     * Loads {@value #CONFIG_FILE} from the classpath, falling back to an empty property set.
     */
    public static AegisConfiguration load() {
        Properties properties = new Properties();
        try (InputStream input = AegisConfiguration.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file {}: {}", CONFIG_FILE, e.getMessage());
            logger.debug("Stack trace", e);
        }
        return new AegisConfiguration(properties);
    }

    // ==================== Core Property Accessors ====================

    public String getString(String key, String defaultValue) {
        String envValue = environment.apply(toEnvironmentKey(key));
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid decimal value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Reads a comma-separated list, dropping blank entries.
     */
    public List<String> getList(String key, List<String> defaultValue) {
        String value = getString(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public boolean contains(String key) {
        return getString(key, null) != null;
    }

    static String toEnvironmentKey(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }
}
