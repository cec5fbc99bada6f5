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

package dev.mars.contentflow.workflow;

import dev.mars.contentflow.exceptions.ContentFlowException;

import java.util.List;

/**
 * Exception thrown when the steps of a workflow cannot be ordered because they
 * depend on each other in a cycle. Names every step that takes part in a cycle.
 */
public class CycleException extends ContentFlowException {

    private final String workflowName;
    private final List<String> cycleMembers;

    public CycleException(String workflowName, List<String> cycleMembers) {
        super("Circular dependency detected in workflow '" + workflowName + "' among steps: " + cycleMembers);
        this.workflowName = workflowName;
        this.cycleMembers = List.copyOf(cycleMembers);
    }

    public String getWorkflowName() {
        return workflowName;
    }

    /**
     * @return the ids of steps on a cycle, in declaration order
     */
    public List<String> getCycleMembers() {
        return cycleMembers;
    }
}
