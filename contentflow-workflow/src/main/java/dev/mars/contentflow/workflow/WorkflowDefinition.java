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

package dev.mars.contentflow.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * An immutable, named and versioned list of steps.
 *
 * <p>The definition keeps the raw text it was parsed from so each run can store
 * a snapshot of exactly what it executed. Definitions built in code render a
 * YAML snapshot on demand.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public final class WorkflowDefinition {

    public static final String DEFAULT_VERSION = "1.0.0";

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9._\\-\\s]+");

    private final String name;
    private final String version;
    private final String description;
    private final List<String> tags;
    private final Map<String, Object> variables;
    private final List<StepSpec> steps;
    private final String source;

    private WorkflowDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Workflow name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Workflow name cannot be blank");
        }
        this.version = builder.version != null ? builder.version : DEFAULT_VERSION;
        this.description = builder.description;
        this.tags = List.copyOf(builder.tags);
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.steps = List.copyOf(builder.steps);
        this.source = builder.source;
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /**
     * Whether a name can serve as a workflow name. Letters, digits, whitespace,
     * {@code .}, {@code _} and {@code -} are allowed, so distinct names only share
     * a workflow id when they differ in case or whitespace. A name that derives
     * to {@code .} or {@code ..} is rejected.
     */
    public static boolean isValidName(String name) {
        if (name == null || name.isBlank() || !VALID_NAME.matcher(name).matches()) {
            return false;
        }
        String workflowId = toWorkflowId(name);
        return !workflowId.equals(".") && !workflowId.equals("..");
    }

    /**
     * Derives the storage identity of a workflow from its name: lower case,
     * whitespace runs replaced by {@code _}, and anything not safe in a path
     * segment replaced by {@code _}.
     */
    public static String toWorkflowId(String name) {
        return name.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", "_")
                .replaceAll("[^a-z0-9._\\-]", "_");
    }

    public String getWorkflowId() {
        return toWorkflowId(name);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * Workflow-level defaults for {@code {{name}}} references in step configuration.
     */
    public Map<String, Object> getVariables() {
        return variables;
    }

    public List<StepSpec> getSteps() {
        return steps;
    }

    public Optional<StepSpec> getStep(String stepId) {
        return steps.stream().filter(step -> step.getId().equals(stepId)).findFirst();
    }

    /**
     * @return the raw definition text, if this definition was parsed from text
     */
    public Optional<String> getSource() {
        return Optional.ofNullable(source);
    }

    /**
     * Returns a copy of this definition with its steps replaced.
     */
    public WorkflowDefinition withSteps(List<StepSpec> newSteps) {
        return toBuilder().steps(newSteps).build();
    }

    public Builder toBuilder() {
        return new Builder().name(name).version(version).description(description)
                .tags(tags).variables(variables).steps(steps).source(source);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return name.equals(that.name) &&
               version.equals(that.version) &&
               Objects.equals(description, that.description) &&
               tags.equals(that.tags) &&
               variables.equals(that.variables) &&
               steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, steps);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
                "name='" + name + '\'' +
                ", version='" + version + '\'' +
                ", steps=" + steps.size() +
                '}';
    }

    public static class Builder {
        private String name;
        private String version;
        private String description;
        private List<String> tags = new ArrayList<>();
        private Map<String, Object> variables = new LinkedHashMap<>();
        private List<StepSpec> steps = new ArrayList<>();
        private String source;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags != null ? tags : List.of());
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables = new LinkedHashMap<>(variables != null ? variables : Map.of());
            return this;
        }

        public Builder steps(List<StepSpec> steps) {
            this.steps = new ArrayList<>(steps != null ? steps : List.of());
            return this;
        }

        public Builder step(StepSpec step) {
            this.steps.add(step);
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }
}
