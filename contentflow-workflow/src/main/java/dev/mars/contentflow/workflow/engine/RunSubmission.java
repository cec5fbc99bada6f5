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

package dev.mars.contentflow.workflow.engine;

import dev.mars.contentflow.model.RunKey;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A run accepted for asynchronous execution: its key is known immediately,
 * its result completes when the run finishes.
 */
public final class RunSubmission {

    private final RunKey key;
    private final CompletableFuture<RunResult> result;

    public RunSubmission(RunKey key, CompletableFuture<RunResult> result) {
        this.key = Objects.requireNonNull(key, "Run key cannot be null");
        this.result = Objects.requireNonNull(result, "Result future cannot be null");
    }

    public RunKey getKey() {
        return key;
    }

    public String getRunId() {
        return key.getRunId();
    }

    public CompletableFuture<RunResult> getResult() {
        return result;
    }

    @Override
    public String toString() {
        return "RunSubmission{" + key + ", done=" + result.isDone() + '}';
    }
}
