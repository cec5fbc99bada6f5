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
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the ContentFlow execution engine.
 *
 * Provides these metrics:
 * - contentflow.runs.active (gauge) - Currently executing runs
 * - contentflow.runs.total (counter) - Runs started
 * - contentflow.runs.succeeded (counter) - Runs that finished with every step succeeded
 * - contentflow.runs.failed (counter) - Runs that finished failed
 * - contentflow.runs.cancelled (counter) - Runs cancelled by a caller
 * - contentflow.steps.executed (counter) - Step attempts executed
 * - contentflow.steps.failed (counter) - Step attempts that failed
 * - contentflow.steps.retried (counter) - Step attempts followed by a retry
 * - contentflow.steps.skipped (counter) - Steps skipped
 * - contentflow.run.duration.seconds (histogram) - Run duration distribution
 * - contentflow.step.duration.seconds (histogram) - Step attempt duration distribution
 *
 * Without an OpenTelemetry SDK installed the global meter is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "contentflow-workflow";

    // Singleton instance
    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter runsTotal;
    private final LongCounter runsSucceeded;
    private final LongCounter runsFailed;
    private final LongCounter runsCancelled;
    private final LongCounter stepsExecuted;
    private final LongCounter stepsFailed;
    private final LongCounter stepsRetried;
    private final LongCounter stepsSkipped;

    // Histograms
    private final DoubleHistogram runDuration;
    private final DoubleHistogram stepDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeRuns = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> STRATEGY_KEY = AttributeKey.stringKey("execution.strategy");
    private static final AttributeKey<String> AGENT_KEY = AttributeKey.stringKey("step.agent");
    private static final AttributeKey<String> FAILURE_TYPE_KEY = AttributeKey.stringKey("failure.type");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        // Initialize counters
        runsTotal = meter.counterBuilder("contentflow.runs.total")
                .setDescription("Total number of runs started")
                .setUnit("1")
                .build();

        runsSucceeded = meter.counterBuilder("contentflow.runs.succeeded")
                .setDescription("Number of runs that succeeded")
                .setUnit("1")
                .build();

        runsFailed = meter.counterBuilder("contentflow.runs.failed")
                .setDescription("Number of runs that failed")
                .setUnit("1")
                .build();

        runsCancelled = meter.counterBuilder("contentflow.runs.cancelled")
                .setDescription("Number of cancelled runs")
                .setUnit("1")
                .build();

        stepsExecuted = meter.counterBuilder("contentflow.steps.executed")
                .setDescription("Number of step attempts executed")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("contentflow.steps.failed")
                .setDescription("Number of failed step attempts")
                .setUnit("1")
                .build();

        stepsRetried = meter.counterBuilder("contentflow.steps.retried")
                .setDescription("Number of step attempts followed by a retry")
                .setUnit("1")
                .build();

        stepsSkipped = meter.counterBuilder("contentflow.steps.skipped")
                .setDescription("Number of skipped steps")
                .setUnit("1")
                .build();

        // Initialize histograms
        runDuration = meter.histogramBuilder("contentflow.run.duration.seconds")
                .setDescription("Run duration in seconds")
                .setUnit("s")
                .build();

        stepDuration = meter.histogramBuilder("contentflow.step.duration.seconds")
                .setDescription("Step attempt duration in seconds")
                .setUnit("s")
                .build();

        // Initialize gauges
        meter.gaugeBuilder("contentflow.runs.active")
                .setDescription("Number of currently executing runs")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRuns.get()));

        logger.info("WorkflowMetrics initialized");
    }

    /**
     * Get the singleton instance of WorkflowMetrics.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordRunStarted(String workflowId, StrategyType strategy) {
        runsTotal.add(1, runAttributes(workflowId, strategy));
        activeRuns.incrementAndGet();
    }

    public void recordRunSucceeded(String workflowId, StrategyType strategy, double durationSeconds) {
        activeRuns.decrementAndGet();
        Attributes attrs = runAttributes(workflowId, strategy);
        runsSucceeded.add(1, attrs);
        runDuration.record(durationSeconds, attrs);
    }

    public void recordRunFailed(String workflowId, StrategyType strategy, FailureType failureType,
                                double durationSeconds) {
        activeRuns.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(STRATEGY_KEY, strategy.getValue())
                .put(FAILURE_TYPE_KEY, failureType != null ? failureType.getValue() : "unknown")
                .build();
        if (failureType == FailureType.CANCELLED) {
            runsCancelled.add(1, attrs);
        } else {
            runsFailed.add(1, attrs);
        }
        runDuration.record(durationSeconds, attrs);
    }

    /**
     * Record one step attempt.
     */
    public void recordStepExecuted(String workflowId, String agent, long durationMs) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(AGENT_KEY, agent)
                .build();
        stepsExecuted.add(1, attrs);
        stepDuration.record(durationMs / 1000.0, attrs);
    }

    public void recordStepFailed(String workflowId, String agent, FailureType failureType, boolean retrying) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(AGENT_KEY, agent)
                .put(FAILURE_TYPE_KEY, failureType.getValue())
                .build();
        stepsFailed.add(1, attrs);
        if (retrying) {
            stepsRetried.add(1, attrs);
        }
    }

    public void recordStepSkipped(String workflowId, String agent) {
        stepsSkipped.add(1, Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(AGENT_KEY, agent)
                .build());
    }

    /**
     * Get the current number of active runs.
     */
    public long getActiveRuns() {
        return activeRuns.get();
    }

    private static Attributes runAttributes(String workflowId, StrategyType strategy) {
        return Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(STRATEGY_KEY, strategy.getValue())
                .build();
    }
}
