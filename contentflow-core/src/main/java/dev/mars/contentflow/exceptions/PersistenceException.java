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

import dev.mars.contentflow.model.RunKey;

/**
 * Thrown by a run state store when a record cannot be written or read back.
 */
public class PersistenceException extends ContentFlowException {

    private final RunKey runKey;

    public PersistenceException(String message) {
        super(message);
        this.runKey = null;
    }

    public PersistenceException(RunKey runKey, String message, Throwable cause) {
        super(message + ": " + runKey, cause);
        this.runKey = runKey;
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
        this.runKey = null;
    }

    /**
     * The run the failed operation concerned, or {@code null} for store-wide operations.
     */
    public RunKey getRunKey() {
        return runKey;
    }
}
