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

package dev.mars.contentflow.workflow.engine;

import dev.mars.contentflow.config.ContentFlowConfiguration;
import dev.mars.contentflow.model.RetryBackoff;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void testFixedDelay() {
        RetryPolicy policy = RetryPolicy.fixed(3, Duration.ofMillis(250));

        assertEquals(3, policy.getMaxRetries());
        assertEquals(RetryBackoff.FIXED, policy.getBackoff());
        for (int retry = 1; retry <= 5; retry++) {
            assertEquals(Duration.ofMillis(250), policy.delayBeforeRetry(retry));
        }
    }

    @Test
    void testExponentialDelayIsCapped() {
        RetryPolicy policy = RetryPolicy.exponential(10, Duration.ofMillis(100), Duration.ofMillis(1000));

        assertEquals(Duration.ofMillis(100), policy.delayBeforeRetry(1));
        assertEquals(Duration.ofMillis(200), policy.delayBeforeRetry(2));
        assertEquals(Duration.ofMillis(400), policy.delayBeforeRetry(3));
        assertEquals(Duration.ofMillis(800), policy.delayBeforeRetry(4));
        assertEquals(Duration.ofMillis(1000), policy.delayBeforeRetry(5));
        assertEquals(Duration.ofMillis(1000), policy.delayBeforeRetry(64));
    }

    @Test
    void testNone() {
        RetryPolicy none = RetryPolicy.none();

        assertEquals(0, none.getMaxRetries());
        assertEquals(Duration.ZERO, none.delayBeforeRetry(1));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(-1, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(1, Duration.ofMillis(-5)));
        assertThrows(NullPointerException.class,
                () -> new RetryPolicy(1, null, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.none().delayBeforeRetry(0));
    }

    @Test
    void testFromConfiguration() {
        Properties props = new Properties();
        props.setProperty(ContentFlowConfiguration.ENGINE_MAX_RETRIES, "5");
        props.setProperty(ContentFlowConfiguration.ENGINE_RETRY_BACKOFF, "exponential");
        props.setProperty(ContentFlowConfiguration.ENGINE_RETRY_DELAY_MS, "50");
        props.setProperty(ContentFlowConfiguration.ENGINE_RETRY_MAX_DELAY_MS, "120");

        RetryPolicy policy = RetryPolicy.fromConfiguration(new ContentFlowConfiguration(props));

        assertEquals(RetryPolicy.exponential(5, Duration.ofMillis(50), Duration.ofMillis(120)), policy);
        assertEquals(Duration.ofMillis(120), policy.delayBeforeRetry(3));
    }

    @Test
    void testDefaults() {
        RetryPolicy policy = RetryPolicy.fromConfiguration(new ContentFlowConfiguration(new Properties()));

        assertEquals(3, policy.getMaxRetries());
        assertEquals(RetryBackoff.FIXED, policy.getBackoff());
        assertEquals(Duration.ofSeconds(1), policy.delayBeforeRetry(2));
    }
}
