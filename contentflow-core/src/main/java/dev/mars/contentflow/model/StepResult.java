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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one attempt of one step.
 *
 * <p>Step results are append-only: a step that is retried produces one result
 * per attempt, and only the latest one decides the step's outcome. Results of
 * earlier attempts carry {@code retrying = true}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepResult {

    private final String stepId;
    private final StepStatus status;
    private final int attempt;
    private final boolean retrying;
    private final long durationMs;
    private final Map<String, Object> output;
    private final FailureType errorType;
    private final String errorMessage;
    private final String skipReason;
    private final Instant timestamp;

    @JsonCreator
    public StepResult(@JsonProperty("stepId") String stepId,
                      @JsonProperty("status") StepStatus status,
                      @JsonProperty("attempt") int attempt,
                      @JsonProperty("retrying") boolean retrying,
                      @JsonProperty("durationMs") long durationMs,
                      @JsonProperty("output") Map<String, Object> output,
                      @JsonProperty("errorType") FailureType errorType,
                      @JsonProperty("errorMessage") String errorMessage,
                      @JsonProperty("skipReason") String skipReason,
                      @JsonProperty("timestamp") Instant timestamp) {
        this.stepId = Objects.requireNonNull(stepId, "Step id cannot be null");
        this.status = Objects.requireNonNull(status, "Step status cannot be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Step result must carry a terminal status, got " + status);
        }
        this.attempt = attempt;
        this.retrying = retrying;
        this.durationMs = durationMs;
        this.output = output == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(output));
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.skipReason = skipReason;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static StepResult success(String stepId, int attempt, Map<String, Object> output, long durationMs) {
        return builder().stepId(stepId).status(StepStatus.SUCCESS).attempt(attempt)
                .output(output).durationMs(durationMs).build();
    }

    public static StepResult failure(String stepId, int attempt, FailureType errorType, String errorMessage,
                                     boolean retrying, long durationMs) {
        return builder().stepId(stepId).status(StepStatus.FAILED).attempt(attempt)
                .errorType(errorType).errorMessage(errorMessage)
                .retrying(retrying).durationMs(durationMs).build();
    }

    public static StepResult skipped(String stepId, String skipReason) {
        return builder().stepId(stepId).status(StepStatus.SKIPPED).attempt(0).skipReason(skipReason).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getStepId() {
        return stepId;
    }

    public StepStatus getStatus() {
        return status;
    }

    public int getAttempt() {
        return attempt;
    }

    public boolean isRetrying() {
        return retrying;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Map<String, Object> getOutput() {
        return output;
    }

    public FailureType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getSkipReason() {
        return skipReason;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public Optional<FailureType> getFailureType() {
        return Optional.ofNullable(errorType);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status == StepStatus.SUCCESS;
    }

    /**
     * Compares everything except the timing fields. Two executions of the same
     * deterministic units produce results that are the same outcome even though
     * their timestamps and durations differ.
     */
    public boolean sameOutcomeAs(StepResult other) {
        if (other == null) {
            return false;
        }
        return stepId.equals(other.stepId)
                && status == other.status
                && attempt == other.attempt
                && retrying == other.retrying
                && output.equals(other.output)
                && errorType == other.errorType
                && Objects.equals(errorMessage, other.errorMessage)
                && Objects.equals(skipReason, other.skipReason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepResult that = (StepResult) o;
        return sameOutcomeAs(that)
                && durationMs == that.durationMs
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, status, attempt, retrying, output, errorType, errorMessage, skipReason,
                durationMs, timestamp);
    }

    @Override
    public String toString() {
        return "StepResult{" +
                "stepId='" + stepId + '\'' +
                ", status=" + status +
                ", attempt=" + attempt +
                (retrying ? ", retrying" : "") +
                (errorType != null ? ", errorType=" + errorType : "") +
                (skipReason != null ? ", skipReason='" + skipReason + '\'' : "") +
                ", durationMs=" + durationMs +
                '}';
    }

    public static class Builder {
        private String stepId;
        private StepStatus status;
        private int attempt = 1;
        private boolean retrying;
        private long durationMs;
        private Map<String, Object> output;
        private FailureType errorType;
        private String errorMessage;
        private String skipReason;
        private Instant timestamp;

        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }

        public Builder status(StepStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder retrying(boolean retrying) {
            this.retrying = retrying;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder output(Map<String, Object> output) {
            this.output = output;
            return this;
        }

        public Builder errorType(FailureType errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder skipReason(String skipReason) {
            this.skipReason = skipReason;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public StepResult build() {
            return new StepResult(stepId, status, attempt, retrying, durationMs, output,
                    errorType, errorMessage, skipReason, timestamp);
        }
    }
}
