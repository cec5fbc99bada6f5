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
 * Raised when a step's unit of work keeps failing after every allowed attempt.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ProcessingException extends ContentFlowException {

    private final String stepId;
    private final int attempts;

    public ProcessingException(String stepId, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
        this.attempts = attempts;
    }

    public ProcessingException(String stepId, int attempts, Throwable cause) {
        this(stepId, attempts, "Step '" + stepId + "' failed after " + attempts + " attempt(s): "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
    }

    public String getStepId() {
        return stepId;
    }

    public int getAttempts() {
        return attempts;
    }
}
