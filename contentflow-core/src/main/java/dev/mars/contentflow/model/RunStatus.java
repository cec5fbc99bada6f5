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
 * Lifecycle states of a workflow run.
 *
 * <p>A run is created {@code PENDING}, moves to {@code RUNNING} when its first
 * step is dispatched and finishes in exactly one of the terminal states. A run
 * may also fail straight from {@code PENDING} when it cannot start at all, for
 * example when its input variables cannot be resolved.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public enum RunStatus {

    PENDING("pending", "Run has been created but no step has been dispatched"),

    RUNNING("running", "Run is executing steps"),

    SUCCESS("success", "Every step of the run succeeded"),

    FAILED("failed", "Run was aborted by a failed step, a persistence error or cancellation");

    // ── Transition table (single source of truth) ──────────────────────

    private static final Map<RunStatus, Set<RunStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<RunStatus, Set<RunStatus>>(RunStatus.class);
        map.put(PENDING, EnumSet.of(RUNNING, FAILED));
        map.put(RUNNING, EnumSet.of(SUCCESS, FAILED));
        map.put(SUCCESS, EnumSet.noneOf(RunStatus.class));
        map.put(FAILED, EnumSet.noneOf(RunStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;
    private final String description;

    RunStatus(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Checks if the status is final. Terminal runs are eligible for the archive.
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    /**
     * Checks whether a transition from this status to the target status is valid.
     *
     * <pre>
     *   PENDING → RUNNING, FAILED
     *   RUNNING → SUCCESS, FAILED
     *   SUCCESS → (terminal)
     *   FAILED  → (terminal)
     * </pre>
     *
     * @param target the target status
     * @return {@code true} if the transition is allowed
     */
    public boolean canTransitionTo(RunStatus target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(RunStatus.class)).contains(target);
    }

    public Set<RunStatus> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    /**
     * Parse a status from its string value.
     *
     * @param value the status value
     * @return the matching status
     * @throws IllegalArgumentException if the value is {@code null} or unknown
     */
    @JsonCreator
    public static RunStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Run status value must not be null");
        }
        for (RunStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
