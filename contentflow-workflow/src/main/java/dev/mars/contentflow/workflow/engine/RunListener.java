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

import dev.mars.contentflow.model.RunKey;
import dev.mars.contentflow.model.RunStatus;
import dev.mars.contentflow.model.StepResult;
import dev.mars.contentflow.model.StepStatus;

/**
 * Receives run and step status changes as they happen. Callbacks run on the
 * thread executing the run, in the order the changes occur. Exceptions thrown
 * by a listener are logged and do not affect the run.
 */
public interface RunListener {

    default void onRunStatusChanged(RunKey runKey, RunStatus from, RunStatus to) {
    }

    default void onStepStatusChanged(RunKey runKey, String stepId, StepStatus from, StepStatus to) {
    }

    /**
     * Called for every result appended to the run log, including failed
     * attempts that will be retried.
     */
    default void onStepResult(RunKey runKey, StepResult result) {
    }
}
