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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ContentFlowConfiguration.
 * Validates defaults, property overrides, type conversion and fallbacks for invalid values.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
class ContentFlowConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(ContentFlowConfiguration.ENGINE_MAX_RETRIES);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaults() {
        ContentFlowConfiguration config = new ContentFlowConfiguration(null);

        assertEquals(Paths.get("workflow_runs"), config.getStorageDirectory());
        assertEquals("filesystem", config.getStorageType());
        assertEquals(50, config.getArchiveMaxEntries());
        assertEquals(StrategyType.PLAIN, config.getStrategy());
        assertTrue(config.isPersistenceEnabled());
        assertEquals(3, config.getMaxRetries());
        assertEquals(RetryBackoff.FIXED, config.getRetryBackoff());
        assertEquals(1000, config.getRetryDelayMs());
        assertEquals(300000, config.getStepTimeoutMs());
        assertEquals(RunIdMode.TIMESTAMP, config.getRunIdMode());
        assertEquals(4, config.getWorkerThreads());
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Override Tests ==========

    @Test
    void testPropertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(ContentFlowConfiguration.STORAGE_TYPE, "Memory");
        props.setProperty(ContentFlowConfiguration.ENGINE_STRATEGY, "resumable");
        props.setProperty(ContentFlowConfiguration.ENGINE_MAX_RETRIES, " 5 ");
        props.setProperty(ContentFlowConfiguration.ENGINE_RETRY_BACKOFF, "exponential");
        props.setProperty(ContentFlowConfiguration.ENGINE_RUN_ID_MODE, "random");
        props.setProperty(ContentFlowConfiguration.METRICS_ENABLED, "false");

        ContentFlowConfiguration config = new ContentFlowConfiguration(props);

        assertEquals("memory", config.getStorageType());
        assertEquals(StrategyType.RESUMABLE, config.getStrategy());
        assertEquals(5, config.getMaxRetries());
        assertEquals(RetryBackoff.EXPONENTIAL, config.getRetryBackoff());
        assertEquals(RunIdMode.RANDOM, config.getRunIdMode());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty(ContentFlowConfiguration.ENGINE_MAX_RETRIES, "7");

        ContentFlowConfiguration config = new ContentFlowConfiguration();

        assertEquals(7, config.getMaxRetries());
    }

    @Test
    void testExplicitPropertiesIgnoreSystemProperties() {
        System.setProperty(ContentFlowConfiguration.ENGINE_MAX_RETRIES, "7");

        ContentFlowConfiguration config = new ContentFlowConfiguration(new Properties());

        assertEquals(3, config.getMaxRetries());
    }

    // ========== Invalid Value Tests ==========

    @Test
    void testInvalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty(ContentFlowConfiguration.ENGINE_MAX_RETRIES, "many");
        props.setProperty(ContentFlowConfiguration.ENGINE_STRATEGY, "turbo");
        props.setProperty(ContentFlowConfiguration.ENGINE_RETRY_BACKOFF, "random");
        props.setProperty(ContentFlowConfiguration.ENGINE_RUN_ID_MODE, "sequential");
        props.setProperty(ContentFlowConfiguration.ARCHIVE_MAX_ENTRIES, "0");
        props.setProperty(ContentFlowConfiguration.ENGINE_STEP_TIMEOUT_MS, "-5");

        ContentFlowConfiguration config = new ContentFlowConfiguration(props);

        assertEquals(3, config.getMaxRetries());
        assertEquals(StrategyType.PLAIN, config.getStrategy());
        assertEquals(RetryBackoff.FIXED, config.getRetryBackoff());
        assertEquals(RunIdMode.TIMESTAMP, config.getRunIdMode());
        assertEquals(50, config.getArchiveMaxEntries());
        assertEquals(0, config.getStepTimeoutMs());
    }

    @Test
    void testGenericPropertyAccess() {
        ContentFlowConfiguration config = new ContentFlowConfiguration(null);
        config.setProperty("contentflow.custom", "value");

        assertEquals("value", config.getProperty("contentflow.custom"));
        assertEquals("fallback", config.getProperty("contentflow.absent", "fallback"));
        assertNull(config.getProperty("contentflow.absent"));
    }
}
