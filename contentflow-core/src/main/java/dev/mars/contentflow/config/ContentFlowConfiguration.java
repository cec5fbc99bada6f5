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

package dev.mars.contentflow.config;

import dev.mars.contentflow.model.RetryBackoff;
import dev.mars.contentflow.model.StrategyType;
import dev.mars.contentflow.storage.RunIdMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for ContentFlow.
 *
 * <p>Values are resolved in this order, later sources overriding earlier ones:</p>
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>the first readable {@code contentflow.properties} among the working directory,
 *       {@code config/}, {@code ~/.contentflow/} and {@code /etc/contentflow/}, or else
 *       the one on the classpath</li>
 *   <li>system properties starting with {@code contentflow.}</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ContentFlowConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(ContentFlowConfiguration.class);

    public static final String PREFIX = "contentflow.";

    public static final String STORAGE_DIR = "contentflow.storage.dir";
    public static final String STORAGE_TYPE = "contentflow.storage.type";
    public static final String ARCHIVE_MAX_ENTRIES = "contentflow.archive.max.entries";
    public static final String ENGINE_STRATEGY = "contentflow.engine.strategy";
    public static final String ENGINE_PERSISTENCE_ENABLED = "contentflow.engine.persistence.enabled";
    public static final String ENGINE_MAX_RETRIES = "contentflow.engine.max.retries";
    public static final String ENGINE_RETRY_BACKOFF = "contentflow.engine.retry.backoff";
    public static final String ENGINE_RETRY_DELAY_MS = "contentflow.engine.retry.delay.ms";
    public static final String ENGINE_RETRY_MAX_DELAY_MS = "contentflow.engine.retry.max.delay.ms";
    public static final String ENGINE_STEP_TIMEOUT_MS = "contentflow.engine.step.timeout.ms";
    public static final String ENGINE_RUN_ID_MODE = "contentflow.engine.run.id.mode";
    public static final String ENGINE_WORKER_THREADS = "contentflow.engine.worker.threads";
    public static final String METRICS_ENABLED = "contentflow.monitoring.metrics.enabled";

    // Default configuration values
    private static final String DEFAULT_STORAGE_DIR = "workflow_runs";
    private static final String DEFAULT_STORAGE_TYPE = "filesystem";
    private static final int DEFAULT_ARCHIVE_MAX_ENTRIES = 50;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 1000;
    private static final long DEFAULT_RETRY_MAX_DELAY_MS = 30000;
    private static final long DEFAULT_STEP_TIMEOUT_MS = 300000; // 5 minutes
    private static final int DEFAULT_WORKER_THREADS = 4;

    private final Properties properties;

    public ContentFlowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Builds a configuration from defaults plus the given properties only.
     * Files and system properties are not consulted.
     */
    public ContentFlowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Storage Configuration
    public Path getStorageDirectory() {
        return Paths.get(getStringProperty(STORAGE_DIR, DEFAULT_STORAGE_DIR));
    }

    /**
     * @return {@code filesystem} or {@code memory}
     */
    public String getStorageType() {
        return getStringProperty(STORAGE_TYPE, DEFAULT_STORAGE_TYPE).trim().toLowerCase();
    }

    public int getArchiveMaxEntries() {
        int value = getIntProperty(ARCHIVE_MAX_ENTRIES, DEFAULT_ARCHIVE_MAX_ENTRIES);
        if (value < 1) {
            logger.warn("Archive size must be positive, got {}. Using default: {}", value, DEFAULT_ARCHIVE_MAX_ENTRIES);
            return DEFAULT_ARCHIVE_MAX_ENTRIES;
        }
        return value;
    }

    // Engine Configuration
    public StrategyType getStrategy() {
        String value = getStringProperty(ENGINE_STRATEGY, StrategyType.PLAIN.getValue());
        try {
            return StrategyType.fromValue(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid strategy for property {}: {}. Using default: plain", ENGINE_STRATEGY, value);
            return StrategyType.PLAIN;
        }
    }

    public boolean isPersistenceEnabled() {
        return getBooleanProperty(ENGINE_PERSISTENCE_ENABLED, true);
    }

    public int getMaxRetries() {
        return Math.max(0, getIntProperty(ENGINE_MAX_RETRIES, DEFAULT_MAX_RETRIES));
    }

    public RetryBackoff getRetryBackoff() {
        String value = getStringProperty(ENGINE_RETRY_BACKOFF, RetryBackoff.FIXED.name());
        try {
            return RetryBackoff.fromValue(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid backoff for property {}: {}. Using default: FIXED", ENGINE_RETRY_BACKOFF, value);
            return RetryBackoff.FIXED;
        }
    }

    public long getRetryDelayMs() {
        return Math.max(0, getLongProperty(ENGINE_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS));
    }

    public long getRetryMaxDelayMs() {
        return Math.max(0, getLongProperty(ENGINE_RETRY_MAX_DELAY_MS, DEFAULT_RETRY_MAX_DELAY_MS));
    }

    /**
     * @return the per-step timeout, {@code 0} meaning no timeout
     */
    public long getStepTimeoutMs() {
        return Math.max(0, getLongProperty(ENGINE_STEP_TIMEOUT_MS, DEFAULT_STEP_TIMEOUT_MS));
    }

    public RunIdMode getRunIdMode() {
        String value = getStringProperty(ENGINE_RUN_ID_MODE, RunIdMode.TIMESTAMP.name());
        try {
            return RunIdMode.fromValue(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid run id mode for property {}: {}. Using default: TIMESTAMP", ENGINE_RUN_ID_MODE, value);
            return RunIdMode.TIMESTAMP;
        }
    }

    public int getWorkerThreads() {
        return Math.max(1, getIntProperty(ENGINE_WORKER_THREADS, DEFAULT_WORKER_THREADS));
    }

    // Monitoring Configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
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

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(STORAGE_DIR, DEFAULT_STORAGE_DIR);
        properties.setProperty(STORAGE_TYPE, DEFAULT_STORAGE_TYPE);
        properties.setProperty(ARCHIVE_MAX_ENTRIES, String.valueOf(DEFAULT_ARCHIVE_MAX_ENTRIES));
        properties.setProperty(ENGINE_STRATEGY, StrategyType.PLAIN.getValue());
        properties.setProperty(ENGINE_PERSISTENCE_ENABLED, "true");
        properties.setProperty(ENGINE_MAX_RETRIES, String.valueOf(DEFAULT_MAX_RETRIES));
        properties.setProperty(ENGINE_RETRY_BACKOFF, RetryBackoff.FIXED.name());
        properties.setProperty(ENGINE_RETRY_DELAY_MS, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(ENGINE_RETRY_MAX_DELAY_MS, String.valueOf(DEFAULT_RETRY_MAX_DELAY_MS));
        properties.setProperty(ENGINE_STEP_TIMEOUT_MS, String.valueOf(DEFAULT_STEP_TIMEOUT_MS));
        properties.setProperty(ENGINE_RUN_ID_MODE, RunIdMode.TIMESTAMP.name());
        properties.setProperty(ENGINE_WORKER_THREADS, String.valueOf(DEFAULT_WORKER_THREADS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "contentflow.properties",
                "config/contentflow.properties",
                System.getProperty("user.home") + "/.contentflow/contentflow.properties",
                "/etc/contentflow/contentflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("contentflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith(PREFIX))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "ContentFlowConfiguration{" +
                "storageDir=" + getStorageDirectory() +
                ", storageType=" + getStorageType() +
                ", strategy=" + getStrategy() +
                ", maxRetries=" + getMaxRetries() +
                ", stepTimeoutMs=" + getStepTimeoutMs() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
