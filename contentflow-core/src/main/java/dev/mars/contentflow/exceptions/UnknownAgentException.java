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

package dev.mars.contentflow.exceptions;

/**
 * Thrown when a step names an agent that is not registered.
 */
public class UnknownAgentException extends ContentFlowException {

    private final String agentName;
    private final String stepId;

    public UnknownAgentException(String agentName) {
        super("No unit of work registered for agent '" + agentName + "'");
        this.agentName = agentName;
        this.stepId = null;
    }

    public UnknownAgentException(String agentName, String stepId) {
        super("Step '" + stepId + "' references unregistered agent '" + agentName + "'");
        this.agentName = agentName;
        this.stepId = stepId;
    }

    public String getAgentName() {
        return agentName;
    }

    /**
     * The step that referenced the agent, or {@code null} when the lookup was not made for a step.
     */
    public String getStepId() {
        return stepId;
    }
}
