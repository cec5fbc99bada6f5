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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One declared step of a workflow: the agent that performs it, where its input
 * comes from and how its output is shaped.
 *
 * <p>Exactly one input source is set:</p>
 * <ul>
 *   <li>{@link InputSource#FILE}: a static file, {@code input_file}</li>
 *   <li>{@link InputSource#STEP}: the output of another step, {@code input_from}</li>
 *   <li>{@link InputSource#INITIAL}: the initial input the run was started with, {@code input: initial}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public final class StepSpec {

    public enum InputSource {
        FILE, STEP, INITIAL
    }

    private final String id;
    private final String name;
    private final String agent;
    private final InputSource inputSource;
    private final String inputFile;
    private final String inputFrom;
    private final List<String> dependsOn;
    private final Map<String, Object> config;
    private final List<String> outputs;
    private final List<String> inputs;
    private final Integer retries;
    private final String description;

    private StepSpec(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Step id cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.agent = Objects.requireNonNull(builder.agent, "Step agent cannot be null");
        this.inputFile = builder.inputFile;
        this.inputFrom = builder.inputFrom;
        this.inputSource = resolveInputSource(builder);
        this.dependsOn = List.copyOf(builder.dependsOn);
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(builder.config));
        this.outputs = List.copyOf(builder.outputs);
        this.inputs = List.copyOf(builder.inputs);
        if (builder.retries != null && builder.retries < 0) {
            throw new IllegalArgumentException("Step retries cannot be negative: " + builder.retries);
        }
        this.retries = builder.retries;
        this.description = builder.description;
    }

    private static InputSource resolveInputSource(Builder builder) {
        int sources = (builder.inputFile != null ? 1 : 0)
                + (builder.inputFrom != null ? 1 : 0)
                + (builder.initialInput ? 1 : 0);
        if (sources != 1) {
            throw new IllegalArgumentException("Step '" + builder.id + "' must declare exactly one input source");
        }
        if (builder.inputFile != null) {
            return InputSource.FILE;
        }
        return builder.inputFrom != null ? InputSource.STEP : InputSource.INITIAL;
    }

    public static Builder builder(String id, String agent) {
        return new Builder().id(id).agent(agent);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getAgent() {
        return agent;
    }

    public InputSource getInputSource() {
        return inputSource;
    }

    public String getInputFile() {
        return inputFile;
    }

    public String getInputFrom() {
        return inputFrom;
    }

    /**
     * Steps that must succeed before this one runs without feeding it data.
     */
    public List<String> getDependsOn() {
        return dependsOn;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * Declared output fields. Empty means the output is passed on as returned.
     */
    public List<String> getOutputs() {
        return outputs;
    }

    /**
     * Fields this step requires from its producer. Empty means it takes whatever is routed.
     */
    public List<String> getInputs() {
        return inputs;
    }

    public Optional<Integer> getRetries() {
        return Optional.ofNullable(retries);
    }

    public String getDescription() {
        return description;
    }

    public boolean hasStaticInput() {
        return inputSource != InputSource.STEP;
    }

    /**
     * Every step this one waits for: its {@code input_from} producer first,
     * then its {@code depends_on} entries, without duplicates.
     */
    public List<String> getUpstreamIds() {
        LinkedHashSet<String> upstream = new LinkedHashSet<>();
        if (inputFrom != null) {
            upstream.add(inputFrom);
        }
        upstream.addAll(dependsOn);
        return List.copyOf(upstream);
    }

    /**
     * Returns a copy of this step with its configuration replaced.
     */
    public StepSpec withConfig(Map<String, Object> newConfig) {
        return toBuilder().config(newConfig).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .id(id).name(name).agent(agent)
                .dependsOn(dependsOn).config(config)
                .outputs(outputs).inputs(inputs)
                .retries(retries).description(description);
        switch (inputSource) {
            case FILE -> builder.inputFile(inputFile);
            case STEP -> builder.inputFrom(inputFrom);
            case INITIAL -> builder.initialInput();
        }
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepSpec stepSpec = (StepSpec) o;
        return id.equals(stepSpec.id) &&
               name.equals(stepSpec.name) &&
               agent.equals(stepSpec.agent) &&
               inputSource == stepSpec.inputSource &&
               Objects.equals(inputFile, stepSpec.inputFile) &&
               Objects.equals(inputFrom, stepSpec.inputFrom) &&
               dependsOn.equals(stepSpec.dependsOn) &&
               config.equals(stepSpec.config) &&
               outputs.equals(stepSpec.outputs) &&
               inputs.equals(stepSpec.inputs) &&
               Objects.equals(retries, stepSpec.retries) &&
               Objects.equals(description, stepSpec.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, agent, inputSource, inputFile, inputFrom, dependsOn, config, outputs, inputs);
    }

    @Override
    public String toString() {
        return "StepSpec{" +
                "id='" + id + '\'' +
                ", agent='" + agent + '\'' +
                ", input=" + (inputSource == InputSource.FILE ? "file:" + inputFile
                        : inputSource == InputSource.STEP ? "step:" + inputFrom : "initial") +
                (dependsOn.isEmpty() ? "" : ", dependsOn=" + dependsOn) +
                '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private String agent;
        private String inputFile;
        private String inputFrom;
        private boolean initialInput;
        private List<String> dependsOn = new ArrayList<>();
        private Map<String, Object> config = new LinkedHashMap<>();
        private List<String> outputs = new ArrayList<>();
        private List<String> inputs = new ArrayList<>();
        private Integer retries;
        private String description;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder agent(String agent) {
            this.agent = agent;
            return this;
        }

        public Builder inputFile(String inputFile) {
            this.inputFile = inputFile;
            return this;
        }

        public Builder inputFrom(String inputFrom) {
            this.inputFrom = inputFrom;
            return this;
        }

        public Builder initialInput() {
            this.initialInput = true;
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = new ArrayList<>(dependsOn != null ? dependsOn : List.of());
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            return dependsOn(List.of(stepIds));
        }

        public Builder config(Map<String, Object> config) {
            this.config = new LinkedHashMap<>(config != null ? config : Map.of());
            return this;
        }

        public Builder configValue(String key, Object value) {
            this.config.put(key, value);
            return this;
        }

        public Builder outputs(List<String> outputs) {
            this.outputs = new ArrayList<>(outputs != null ? outputs : List.of());
            return this;
        }

        public Builder outputs(String... outputs) {
            return outputs(List.of(outputs));
        }

        public Builder inputs(List<String> inputs) {
            this.inputs = new ArrayList<>(inputs != null ? inputs : List.of());
            return this;
        }

        public Builder inputs(String... inputs) {
            return inputs(List.of(inputs));
        }

        public Builder retries(Integer retries) {
            this.retries = retries;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public StepSpec build() {
            return new StepSpec(this);
        }
    }
}
