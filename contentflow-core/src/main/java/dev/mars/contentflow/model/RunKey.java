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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identity of a run: the workflow it belongs to and its run id.
 * Both parts are used as directory names by the filesystem store, so they are
 * restricted to characters that are safe in a path segment.
 */
public final class RunKey {

    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9._\\-]+");

    private final String workflowId;
    private final String runId;

    @JsonCreator
    public RunKey(@JsonProperty("workflowId") String workflowId,
                  @JsonProperty("runId") String runId) {
        this.workflowId = requireSegment(workflowId, "Workflow id");
        this.runId = requireSegment(runId, "Run id");
    }

    public static RunKey of(String workflowId, String runId) {
        return new RunKey(workflowId, runId);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getRunId() {
        return runId;
    }

    private static String requireSegment(String value, String label) {
        Objects.requireNonNull(value, label + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(label + " cannot be blank");
        }
        if (!SAFE_SEGMENT.matcher(value).matches() || value.equals(".") || value.equals("..")) {
            throw new IllegalArgumentException(label + " contains illegal characters: " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunKey runKey = (RunKey) o;
        return workflowId.equals(runKey.workflowId) && runId.equals(runKey.runId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, runId);
    }

    @Override
    public String toString() {
        return workflowId + "/" + runId;
    }
}
