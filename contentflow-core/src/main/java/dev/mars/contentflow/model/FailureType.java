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

/**
 * Classification of why a step or a run failed.
 */
public enum FailureType {

    /** The unit of work raised an error. */
    PROCESSING("processing", true),

    /** The unit of work did not finish within the step timeout. */
    TIMEOUT("timeout", true),

    /** Routed data did not match what the producer declared or the consumer requested. */
    SHAPE("shape", false),

    /** The step's agent name is not registered. */
    UNKNOWN_AGENT("unknown_agent", false),

    /** The step's static input could not be loaded, or a variable could not be resolved. */
    INPUT("input", false),

    /** A step result could not be written by a strategy that requires durability. */
    PERSISTENCE("persistence", false),

    /** The run was cancelled by a caller. */
    CANCELLED("cancelled", false);

    private final String value;
    private final boolean retryable;

    FailureType(String value, boolean retryable) {
        this.value = value;
        this.retryable = retryable;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether a step failing for this reason is worth another attempt.
     */
    public boolean isRetryable() {
        return retryable;
    }

    @JsonCreator
    public static FailureType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Failure type value must not be null");
        }
        for (FailureType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown failure type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
