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

package dev.mars.actionflow.config;

import dev.mars.actionflow.diagnostic.Severity;
import dev.mars.actionflow.model.EventTypes;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for Actionflow.
 * Handles loading and providing access to parser, monitoring and CLI settings.
 *
 * <p>Values are resolved in order: built-in defaults, the first {@code actionflow.properties}
 * found on disk or on the classpath, then {@code actionflow.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ActionflowConfiguration {
    private static final Logger logger = Logger.getLogger(ActionflowConfiguration.class.getName());

    public static final String FAILURE_THRESHOLD = "actionflow.parser.failure.threshold";
    public static final String EXTRA_EVENT_TYPES = "actionflow.parser.event.types.extra";
    public static final String REMOVED_EVENT_TYPES = "actionflow.parser.event.types.removed";
    public static final String METRICS_ENABLED = "actionflow.monitoring.metrics.enabled";
    public static final String OUTPUT_FORMAT = "actionflow.cli.output.format";

    // Default configuration values
    private static final Severity DEFAULT_FAILURE_THRESHOLD = Severity.WARNING;
    private static final String DEFAULT_OUTPUT_FORMAT = "text";

    private final Properties properties;

    public ActionflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public ActionflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Parser Configuration
    public Severity getFailureThreshold() {
        String value = properties.getProperty(FAILURE_THRESHOLD);
        if (value != null) {
            try {
                return Severity.fromString(value);
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid severity value for property " + FAILURE_THRESHOLD + ": " + value +
                             ". Using default: " + DEFAULT_FAILURE_THRESHOLD);
            }
        }
        return DEFAULT_FAILURE_THRESHOLD;
    }

    public List<String> getExtraEventTypes() {
        return getListProperty(EXTRA_EVENT_TYPES);
    }

    public List<String> getRemovedEventTypes() {
        return getListProperty(REMOVED_EVENT_TYPES);
    }

    /**
     * The default event allow-list adjusted by the extra and removed lists.
     */
    public EventTypes getEventTypes() {
        return EventTypes.defaults()
                .withAdded(getExtraEventTypes())
                .withRemoved(getRemovedEventTypes());
    }

    // Monitoring Configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // CLI Configuration
    public String getOutputFormat() {
        return getStringProperty(OUTPUT_FORMAT, DEFAULT_OUTPUT_FORMAT).trim().toLowerCase(Locale.ROOT);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private List<String> getListProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(FAILURE_THRESHOLD, DEFAULT_FAILURE_THRESHOLD.name());
        properties.setProperty(EXTRA_EVENT_TYPES, "");
        properties.setProperty(REMOVED_EVENT_TYPES, "");
        properties.setProperty(METRICS_ENABLED, "true");
        properties.setProperty(OUTPUT_FORMAT, DEFAULT_OUTPUT_FORMAT);
    }

    private void loadConfigurationFromFile() {
        // Try to load from various locations
        String[] configFiles = {
                "actionflow.properties",
                "config/actionflow.properties",
                System.getProperty("user.home") + "/.actionflow/actionflow.properties",
                "/etc/actionflow/actionflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        // Try to load from classpath
        try (InputStream input = getClass().getClassLoader().getResourceAsStream("actionflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        // Override with system properties that start with "actionflow."
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("actionflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "ActionflowConfiguration{" +
                "failureThreshold=" + getFailureThreshold() +
                ", extraEventTypes=" + getExtraEventTypes() +
                ", removedEventTypes=" + getRemovedEventTypes() +
                ", metricsEnabled=" + isMetricsEnabled() +
                ", outputFormat='" + getOutputFormat() + '\'' +
                '}';
    }
}
