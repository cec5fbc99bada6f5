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

package dev.mars.contentflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of one execution of a workflow.
 *
 * <p>The engine is the only writer: every state change produces a new snapshot
 * through one of the {@code with*} methods. The step result log is ordered by
 * the time the results were produced and never rewritten.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Run {

    private final String workflowId;
    private final String runId;
    private final String workflowVersion;
    private final StrategyType strategy;
    private final RunStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final List<StepResult> stepResults;
    private final String failedStepId;
    private final FailureType failureType;
    private final String errorMessage;

    @JsonCreator
    public Run(@JsonProperty("workflowId") String workflowId,
               @JsonProperty("runId") String runId,
               @JsonProperty("workflowVersion") String workflowVersion,
               @JsonProperty("strategy") StrategyType strategy,
               @JsonProperty("status") RunStatus status,
               @JsonProperty("startTime") Instant startTime,
               @JsonProperty("endTime") Instant endTime,
               @JsonProperty("stepResults") List<StepResult> stepResults,
               @JsonProperty("failedStepId") String failedStepId,
               @JsonProperty("failureType") FailureType failureType,
               @JsonProperty("errorMessage") String errorMessage) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow id cannot be null");
        this.runId = Objects.requireNonNull(runId, "Run id cannot be null");
        this.workflowVersion = workflowVersion;
        this.strategy = strategy;
        this.status = status != null ? status : RunStatus.PENDING;
        this.startTime = startTime;
        this.endTime = endTime;
        this.stepResults = stepResults != null ? List.copyOf(stepResults) : List.of();
        this.failedStepId = failedStepId;
        this.failureType = failureType;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates a new pending run for the given key.
     */
    public static Run pending(RunKey key, String workflowVersion, StrategyType strategy) {
        return new Run(key.getWorkflowId(), key.getRunId(), workflowVersion, strategy,
                RunStatus.PENDING, null, null, List.of(), null, null, null);
    }

    public Run started(Instant startTime) {
        return new Run(workflowId, runId, workflowVersion, strategy, RunStatus.RUNNING,
                startTime, null, stepResults, null, null, null);
    }

    public Run withStepResult(StepResult result) {
        Objects.requireNonNull(result, "Step result cannot be null");
        List<StepResult> results = new ArrayList<>(stepResults);
        results.add(result);
        return new Run(workflowId, runId, workflowVersion, strategy, status, startTime, endTime,
                results, failedStepId, failureType, errorMessage);
    }

    public Run withStepResults(List<StepResult> results) {
        return new Run(workflowId, runId, workflowVersion, strategy, status, startTime, endTime,
                results, failedStepId, failureType, errorMessage);
    }

    public Run succeeded(Instant endTime) {
        return new Run(workflowId, runId, workflowVersion, strategy, RunStatus.SUCCESS,
                startTime, endTime, stepResults, null, null, null);
    }

    public Run failed(Instant endTime, String failedStepId, FailureType failureType, String errorMessage) {
        return new Run(workflowId, runId, workflowVersion, strategy, RunStatus.FAILED,
                startTime, endTime, stepResults, failedStepId, failureType, errorMessage);
    }

    @JsonIgnore
    public RunKey getKey() {
        return RunKey.of(workflowId, runId);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getRunId() {
        return runId;
    }

    public String getWorkflowVersion() {
        return workflowVersion;
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public RunStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public List<StepResult> getStepResults() {
        return stepResults;
    }

    public String getFailedStepId() {
        return failedStepId;
    }

    public FailureType getFailureType() {
        return failureType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @JsonIgnore
    public Optional<Duration> getDuration() {
        if (startTime != null && endTime != null) {
            return Optional.of(Duration.between(startTime, endTime));
        }
        return Optional.empty();
    }

    /**
     * All recorded attempts of one step, oldest first.
     */
    public List<StepResult> getResultsFor(String stepId) {
        return stepResults.stream()
                .filter(r -> r.getStepId().equals(stepId))
                .collect(Collectors.toList());
    }

    /**
     * The most recent result of a step, which is its current outcome.
     */
    public Optional<StepResult> getLatestResult(String stepId) {
        for (int i = stepResults.size() - 1; i >= 0; i--) {
            StepResult result = stepResults.get(i);
            if (result.getStepId().equals(stepId)) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    /**
     * Latest result per step, in the order each step first appeared in the log.
     */
    @JsonIgnore
    public Map<String, StepResult> getLatestResults() {
        Map<String, StepResult> latest = new LinkedHashMap<>();
        for (StepResult result : stepResults) {
            latest.put(result.getStepId(), result);
        }
        return latest;
    }

    /**
     * The output of the last step that succeeded, if any step did.
     */
    @JsonIgnore
    public Optional<StepResult> getLastSuccessfulResult() {
        for (int i = stepResults.size() - 1; i >= 0; i--) {
            StepResult result = stepResults.get(i);
            if (result.isSuccessful()) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Run run = (Run) o;
        return workflowId.equals(run.workflowId) &&
               runId.equals(run.runId) &&
               Objects.equals(workflowVersion, run.workflowVersion) &&
               strategy == run.strategy &&
               status == run.status &&
               Objects.equals(startTime, run.startTime) &&
               Objects.equals(endTime, run.endTime) &&
               stepResults.equals(run.stepResults) &&
               Objects.equals(failedStepId, run.failedStepId) &&
               failureType == run.failureType &&
               Objects.equals(errorMessage, run.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, runId, status, stepResults);
    }

    @Override
    public String toString() {
        return "Run{" +
                "key=" + workflowId + "/" + runId +
                ", status=" + status +
                ", strategy=" + strategy +
                ", steps=" + stepResults.size() +
                (failedStepId != null ? ", failedStepId='" + failedStepId + '\'' : "") +
                (failureType != null ? ", failureType=" + failureType : "") +
                '}';
    }
}
