package dev.mars.streamledger.core.config;

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

import dev.mars.streamledger.core.reconciliation.ReconciliatorOptions;
import dev.mars.streamledger.core.repository.DeleteMode;
import dev.mars.streamledger.core.repository.EventSourcingRepositoryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Layered configuration for StreamLedger.
 *
 * <p>Sources, later ones winning: {@code /streamledger-default.properties},
 * {@code /streamledger-<profile>.properties}, {@code STREAMLEDGER_*} environment variables
 * and {@code streamledger.*} system properties.</p>
 *
 * <p>An environment variable sets the property whose name, upper-cased with dots and hyphens
 * turned into underscores, equals the variable's name:
 * {@code STREAMLEDGER_RECONCILIATOR_MAX_CONCURRENT_AGGREGATES} sets
 * {@code streamledger.reconciliator.max-concurrent-aggregates}. Variables matching no property of
 * the loaded files map to the dotted lower-case form.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class StreamLedgerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(StreamLedgerConfiguration.class);

    private final Properties properties;
    private final String profile;

    public StreamLedgerConfiguration() {
        this(getActiveProfile());
    }

    public StreamLedgerConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * @param overrides properties applied on top of every other source, mainly for tests
     */
    public StreamLedgerConfiguration(String profile, Properties overrides) {
        this(profile, overrides, System.getenv());
    }

    StreamLedgerConfiguration(String profile, Properties overrides, Map<String, String> environment) {
        this.profile = profile;
        this.properties = loadProperties(profile, environment);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded StreamLedger configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("streamledger.profile",
               System.getenv("STREAMLEDGER_PROFILE") != null ? System.getenv("STREAMLEDGER_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/streamledger-default.properties");
        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/streamledger-" + profile + ".properties");
        }

        Map<String, String> keysByVariable = new HashMap<>();
        props.stringPropertyNames().forEach(key -> keysByVariable.put(toVariableName(key), key));
        environment.forEach((variable, value) -> {
            if (variable.startsWith("STREAMLEDGER_") && !"STREAMLEDGER_PROFILE".equals(variable)) {
                String key = keysByVariable.getOrDefault(variable, variable.toLowerCase(Locale.ROOT).replace('_', '.'));
                props.setProperty(key, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("streamledger.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    static String toVariableName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        if (getInt("streamledger.reconciliator.max-concurrent-aggregates", 8) < 1) {
            errors.add("Max concurrent aggregates must be at least 1");
        }
        if (getInt("streamledger.reconciliator.retry.attempts", 3) < 0) {
            errors.add("Retry attempts must be non-negative");
        }
        if (getDouble("streamledger.reconciliator.retry.backoff-multiplier", 2.0) < 1.0) {
            errors.add("Retry backoff multiplier must be at least 1.0");
        }
        if (getInt("streamledger.reconciliator.queue.capacity", 256) < 1) {
            errors.add("Queue capacity must be at least 1");
        }
        if (getDuration("streamledger.reconciliator.handler-timeout", Duration.ofSeconds(30)).compareTo(Duration.ofMillis(1)) < 0) {
            errors.add("Handler timeout must be positive");
        }

        String deleteMode = getString("streamledger.repository.delete-mode", DeleteMode.DISABLED.name());
        try {
            DeleteMode.valueOf(deleteMode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            errors.add("Unknown repository delete mode: " + deleteMode);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }
        logger.debug("Configuration validation passed");
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Durations use ISO-8601 notation, e.g. {@code PT30S}.
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public ReconciliatorOptions getReconciliatorOptions() {
        return ReconciliatorOptions.builder()
            .maxConcurrentAggregates(getInt("streamledger.reconciliator.max-concurrent-aggregates", 8))
            .handlerTimeout(getDuration("streamledger.reconciliator.handler-timeout", Duration.ofSeconds(30)))
            .retryAttempts(getInt("streamledger.reconciliator.retry.attempts", 3))
            .retryBackoff(getDuration("streamledger.reconciliator.retry.backoff", Duration.ofMillis(100)))
            .retryBackoffMultiplier(getDouble("streamledger.reconciliator.retry.backoff-multiplier", 2.0))
            .maxRetryBackoff(getDuration("streamledger.reconciliator.retry.max-backoff", Duration.ofSeconds(10)))
            .queueCapacity(getInt("streamledger.reconciliator.queue.capacity", 256))
            .queueIdleTimeout(getDuration("streamledger.reconciliator.queue.idle-timeout", Duration.ofMinutes(5)))
            .evictionInterval(getDuration("streamledger.reconciliator.queue.eviction-interval", Duration.ofMinutes(1)))
            .shutdownTimeout(getDuration("streamledger.reconciliator.shutdown-timeout", Duration.ofSeconds(30)))
            .build();
    }

    public EventSourcingRepositoryOptions getRepositoryOptions() {
        return EventSourcingRepositoryOptions.builder()
            .deleteMode(DeleteMode.valueOf(
                getString("streamledger.repository.delete-mode", DeleteMode.DISABLED.name()).toUpperCase(Locale.ROOT)))
            .build();
    }

    public String getMetricsInstanceId() {
        return getString("streamledger.metrics.instance-id", "streamledger");
    }

    public String getProfile() {
        return profile;
    }
}
