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
 * Thrown when a run is created under a key that already exists. The existing
 * run is left untouched.
 */
public class RunIdentityException extends ContentFlowException {

    private final RunKey runKey;

    public RunIdentityException(RunKey runKey) {
        super("Run already exists: " + runKey);
        this.runKey = runKey;
    }

    public RunIdentityException(RunKey runKey, String message) {
        super(message);
        this.runKey = runKey;
    }

    public RunKey getRunKey() {
        return runKey;
    }
}
