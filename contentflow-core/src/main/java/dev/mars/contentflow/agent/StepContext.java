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

package dev.mars.contentflow.agent;

import dev.mars.contentflow.model.RunKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a unit of work can know about the step it is executing.
 */
public final class StepContext {

    private final RunKey runKey;
    private final String stepId;
    private final String agentName;
    private final int attempt;
    private final Map<String, Object> config;

    public StepContext(RunKey runKey, String stepId, String agentName, int attempt, Map<String, Object> config) {
        this.runKey = Objects.requireNonNull(runKey, "Run key cannot be null");
        this.stepId = Objects.requireNonNull(stepId, "Step id cannot be null");
        this.agentName = agentName;
        this.attempt = attempt;
        this.config = config == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public RunKey getRunKey() {
        return runKey;
    }

    public String getStepId() {
        return stepId;
    }

    public String getAgentName() {
        return agentName;
    }

    /**
     * The attempt number, starting at 1.
     */
    public int getAttempt() {
        return attempt;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "StepContext{" +
                "run=" + runKey +
                ", stepId='" + stepId + '\'' +
                ", agent='" + agentName + '\'' +
                ", attempt=" + attempt +
                '}';
    }
}
