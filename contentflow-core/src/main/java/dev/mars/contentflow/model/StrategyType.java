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
 * The execution strategies a run can be driven by.
 *
 * <ul>
 *   <li>{@code PLAIN} runs every step in one in-memory pass and treats persistence as best effort.</li>
 *   <li>{@code RESUMABLE} persists each step result as it happens and can pick a run up again
 *       from its last successful step.</li>
 * </ul>
 */
public enum StrategyType {

    PLAIN("plain"),

    RESUMABLE("resumable");

    private final String value;

    StrategyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StrategyType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Strategy value must not be null");
        }
        for (StrategyType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown execution strategy: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
