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

import dev.mars.contentflow.model.Run;
import dev.mars.contentflow.model.RunKey;
import dev.mars.contentflow.model.RunStatus;
import dev.mars.contentflow.model.StepResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal outcome of a run as returned to the caller.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public final class RunResult {

    private final Run run;
    private final RunFailure failure;

    public RunResult(Run run, RunFailure failure) {
        this.run = Objects.requireNonNull(run, "Run cannot be null");
        if (!run.isTerminal()) {
            throw new IllegalArgumentException("Run result requires a finished run: " + run.getKey()
                    + " is " + run.getStatus());
        }
        this.failure = failure;
    }

    public RunKey getKey() {
        return run.getKey();
    }

    public String getRunId() {
        return run.getRunId();
    }

    public RunStatus getStatus() {
        return run.getStatus();
    }

    public boolean isSuccessful() {
        return run.getStatus() == RunStatus.SUCCESS;
    }

    public Run getRun() {
        return run;
    }

    public List<StepResult> getStepResults() {
        return run.getStepResults();
    }

    public Optional<String> getFailedStepId() {
        return Optional.ofNullable(run.getFailedStepId());
    }

    public Optional<RunFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return "RunResult{" +
                "key=" + run.getKey() +
                ", status=" + run.getStatus() +
                ", steps=" + run.getStepResults().size() +
                (failure != null ? ", failure=" + failure : "") +
                '}';
    }
}
