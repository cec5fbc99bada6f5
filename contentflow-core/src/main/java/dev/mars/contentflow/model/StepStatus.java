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
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle states of a single step within a run.
 *
 * <p>A step is either dispatched ({@code PENDING → RUNNING}) and then resolves
 * to {@code SUCCESS} or {@code FAILED}, or it is never dispatched because an
 * upstream step did not succeed ({@code PENDING → SKIPPED}). Retry attempts
 * happen while the step stays {@code RUNNING}; each attempt is still recorded
 * as its own {@link StepResult}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum StepStatus {

    PENDING("pending"),

    RUNNING("running"),

    SUCCESS("success"),

    FAILED("failed"),

    SKIPPED("skipped");

    private static final Map<StepStatus, Set<StepStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<StepStatus, Set<StepStatus>>(StepStatus.class);
        map.put(PENDING, EnumSet.of(RUNNING, SKIPPED));
        map.put(RUNNING, EnumSet.of(SUCCESS, FAILED));
        map.put(SUCCESS, EnumSet.noneOf(StepStatus.class));
        map.put(FAILED, EnumSet.noneOf(StepStatus.class));
        map.put(SKIPPED, EnumSet.noneOf(StepStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    StepStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == SKIPPED;
    }

    /**
     * <pre>
     *   PENDING → RUNNING, SKIPPED
     *   RUNNING → SUCCESS, FAILED
     *   SUCCESS, FAILED, SKIPPED → (terminal)
     * </pre>
     */
    public boolean canTransitionTo(StepStatus target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(StepStatus.class)).contains(target);
    }

    public Set<StepStatus> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    @JsonCreator
    public static StepStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Step status value must not be null");
        }
        for (StepStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown step status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
