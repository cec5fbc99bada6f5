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

import dev.mars.contentflow.exceptions.InvalidTransitionException;
import dev.mars.contentflow.model.StepStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Current status of every step of one run, enforcing the step state machine.
 */
class StepStateTracker {

    private final Map<String, StepStatus> statuses = new LinkedHashMap<>();

    StepStateTracker(List<String> stepIds) {
        for (String stepId : stepIds) {
            statuses.put(stepId, StepStatus.PENDING);
        }
    }

    synchronized StepStatus get(String stepId) {
        StepStatus status = statuses.get(stepId);
        if (status == null) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
        return status;
    }

    /**
     * Moves a step to a new status.
     *
     * @return the previous status
     * @throws IllegalStateException wrapping an {@link InvalidTransitionException}
     *         if the step state machine does not allow the move
     */
    synchronized StepStatus transition(String stepId, StepStatus target) {
        StepStatus current = get(stepId);
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException(new InvalidTransitionException(
                    stepId, current, target, current.getValidTransitions()));
        }
        statuses.put(stepId, target);
        return current;
    }

    /**
     * Marks a pending step as already succeeded in an earlier execution of the run.
     */
    synchronized void restoreSucceeded(String stepId) {
        StepStatus current = get(stepId);
        if (current != StepStatus.PENDING) {
            throw new IllegalStateException("Only a pending step can be restored, '" + stepId + "' is " + current);
        }
        statuses.put(stepId, StepStatus.SUCCESS);
    }

    synchronized Map<String, StepStatus> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }
}
