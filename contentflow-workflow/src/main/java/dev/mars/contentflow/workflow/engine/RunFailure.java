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

import dev.mars.contentflow.model.FailureType;

import java.util.Objects;
import java.util.Optional;

/**
 * Why a run failed: the failing step, the failure type, the error message, how
 * many attempts the step made and the underlying exception when there was one.
 */
public final class RunFailure {

    private final String stepId;
    private final FailureType type;
    private final String message;
    private final int attempts;
    private final Throwable cause;

    public RunFailure(String stepId, FailureType type, String message, int attempts, Throwable cause) {
        this.stepId = stepId;
        this.type = Objects.requireNonNull(type, "Failure type cannot be null");
        this.message = message;
        this.attempts = attempts;
        this.cause = cause;
    }

    /**
     * @return the failing step, empty when the run failed outside any step
     */
    public Optional<String> getStepId() {
        return Optional.ofNullable(stepId);
    }

    public FailureType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public int getAttempts() {
        return attempts;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return "RunFailure{" +
                "stepId='" + stepId + '\'' +
                ", type=" + type +
                ", attempts=" + attempts +
                ", message='" + message + '\'' +
                '}';
    }
}
