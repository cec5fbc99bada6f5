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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Compact projection of a finished run, kept in the bounded per-workflow archive.
 *
 * <p>The summary is taken from the output of the last successful step: its
 * {@code digest} field, else its {@code summary} field, else the first
 * {@value #SUMMARY_CONTENT_LENGTH} characters of its {@code content} field.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ArchiveEntry {

    public static final int SUMMARY_CONTENT_LENGTH = 200;

    private final String workflowId;
    private final String runId;
    private final RunStatus status;
    private final Instant timestamp;
    private final String summary;
    private final List<String> tags;
    private final String source;

    @JsonCreator
    public ArchiveEntry(@JsonProperty("workflowId") String workflowId,
                        @JsonProperty("runId") String runId,
                        @JsonProperty("status") RunStatus status,
                        @JsonProperty("timestamp") Instant timestamp,
                        @JsonProperty("summary") String summary,
                        @JsonProperty("tags") List<String> tags,
                        @JsonProperty("source") String source) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow id cannot be null");
        this.runId = Objects.requireNonNull(runId, "Run id cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.summary = summary != null ? summary : "";
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.source = source;
    }

    /**
     * Builds the archive entry for a finished run.
     *
     * @param run a run in a terminal status
     * @return the archive projection
     * @throws IllegalArgumentException if the run has not finished
     */
    public static ArchiveEntry fromRun(Run run) {
        if (!run.isTerminal()) {
            throw new IllegalArgumentException("Only finished runs can be archived: " + run.getKey()
                    + " is " + run.getStatus());
        }
        Map<String, Object> output = run.getLastSuccessfulResult()
                .map(StepResult::getOutput)
                .orElse(Map.of());
        Instant timestamp = run.getEndTime() != null ? run.getEndTime() : Instant.now();
        return new ArchiveEntry(run.getWorkflowId(), run.getRunId(), run.getStatus(), timestamp,
                extractSummary(output), extractTags(output), extractSource(output));
    }

    static String extractSummary(Map<String, Object> output) {
        Object digest = output.get("digest");
        if (digest != null) {
            return digest.toString();
        }
        Object summary = output.get("summary");
        if (summary != null) {
            return summary.toString();
        }
        Object content = output.get("content");
        if (content != null) {
            String text = content.toString();
            return text.length() > SUMMARY_CONTENT_LENGTH ? text.substring(0, SUMMARY_CONTENT_LENGTH) : text;
        }
        return "";
    }

    static List<String> extractTags(Map<String, Object> output) {
        Object tags = output.get("tags");
        if (tags instanceof List) {
            return ((List<?>) tags).stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        return List.of();
    }

    static String extractSource(Map<String, Object> output) {
        Object metadata = output.get("metadata");
        if (metadata instanceof Map) {
            Object source = ((Map<?, ?>) metadata).get("source");
            return source != null ? source.toString() : null;
        }
        return null;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getRunId() {
        return runId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSummary() {
        return summary;
    }

    public List<String> getTags() {
        return tags;
    }

    public String getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArchiveEntry that = (ArchiveEntry) o;
        return workflowId.equals(that.workflowId) &&
               runId.equals(that.runId) &&
               status == that.status &&
               timestamp.equals(that.timestamp) &&
               summary.equals(that.summary) &&
               tags.equals(that.tags) &&
               Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, runId, status, timestamp, summary, tags, source);
    }

    @Override
    public String toString() {
        return "ArchiveEntry{" +
                "workflowId='" + workflowId + '\'' +
                ", runId='" + runId + '\'' +
                ", status=" + status +
                ", timestamp=" + timestamp +
                '}';
    }
}
