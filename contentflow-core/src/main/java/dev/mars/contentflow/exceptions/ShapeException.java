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

import java.util.List;

/**
 * Raised when data routed between two steps does not have the fields that
 * were declared or requested. Never retried: the same data would fail again.
 */
public class ShapeException extends ContentFlowException {

    private final String stepId;
    private final List<String> fields;

    /**
     * @param stepId the step whose input or output was malformed
     * @param fields the missing or unknown field names
     * @param message description of the mismatch
     */
    public ShapeException(String stepId, List<String> fields, String message) {
        super(message);
        this.stepId = stepId;
        this.fields = List.copyOf(fields);
    }

    public String getStepId() {
        return stepId;
    }

    public List<String> getFields() {
        return fields;
    }
}
