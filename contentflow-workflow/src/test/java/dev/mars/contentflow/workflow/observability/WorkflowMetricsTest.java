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

package dev.mars.contentflow.workflow.observability;

import dev.mars.contentflow.model.FailureType;
import dev.mars.contentflow.model.StrategyType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowMetricsTest {

    @Test
    void testSingleton() {
        assertSame(WorkflowMetrics.getInstance(), WorkflowMetrics.getInstance());
    }

    @Test
    void testActiveRunsFollowRunLifecycle() {
        WorkflowMetrics metrics = WorkflowMetrics.getInstance();
        long before = metrics.getActiveRuns();

        metrics.recordRunStarted("news", StrategyType.PLAIN);
        metrics.recordRunStarted("news", StrategyType.RESUMABLE);
        assertEquals(before + 2, metrics.getActiveRuns());

        metrics.recordRunSucceeded("news", StrategyType.PLAIN, 0.5);
        metrics.recordRunFailed("news", StrategyType.RESUMABLE, FailureType.CANCELLED, 0.1);
        assertEquals(before, metrics.getActiveRuns());
    }

    @Test
    void testStepRecordingAcceptsEveryFailureType() {
        WorkflowMetrics metrics = WorkflowMetrics.getInstance();

        for (FailureType type : FailureType.values()) {
            assertDoesNotThrow(() -> metrics.recordStepFailed("news", "digest", type, true));
        }
        assertDoesNotThrow(() -> metrics.recordStepExecuted("news", "digest", 1200));
        assertDoesNotThrow(() -> metrics.recordStepSkipped("news", "digest"));
        assertDoesNotThrow(() -> metrics.recordRunFailed("news", StrategyType.PLAIN, null, 1.0));
    }
}
