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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses YAML workflow definitions using SnakeYAML.
 *
 * <pre>
 * workflow:
 *   name: pdf_to_digest
 *   version: 1.0.0
 * steps:
 *   - id: ingest_pdf
 *     agent: ingestion
 *     input_file: doc.pdf
 *     outputs: [text, pages]
 *   - id: generate_digest
 *     agent: digest
 *     input_from: ingest_pdf
 *     config: {format: markdown, limit: 10}
 * </pre>
 *
 * <p>Parsing never stops at the first problem. Every violation is collected
 * with its field path and reported together in one {@link SchemaException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {
    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowDefinitionParser.class);

    static final String INITIAL_INPUT = "initial";

    private static final String INVALID_NAME_MESSAGE =
            "Workflow name may only contain letters, digits, whitespace, '.', '_' and '-', got: ";

    private static final Set<String> STEP_KEYS = Set.of(
            "id", "name", "agent", "input_file", "input_from", "input", "depends_on",
            "config", "outputs", "inputs", "retries", "description");

    private final Yaml yaml;

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    @Override
    public WorkflowDefinition parse(Path definitionFile) throws SchemaException {
        try {
            String content = Files.readString(definitionFile, StandardCharsets.UTF_8);
            return parseFromString(content);
        } catch (IOException e) {
            throw new SchemaException("Failed to read workflow file: " + definitionFile, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String content) throws SchemaException {
        Object loaded;
        try {
            loaded = yaml.load(content);
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark();
            ValidationResult result = new ValidationResult();
            result.addError(mark != null ? mark.getLine() + 1 : 0, "",
                    "YAML syntax error: " + e.getProblem());
            throw new SchemaException(null, result);
        } catch (YAMLException e) {
            throw new SchemaException("YAML parsing failed: " + e.getMessage(), e);
        }

        ValidationResult result = new ValidationResult();
        if (!(loaded instanceof Map)) {
            result.addError("", "Workflow definition must be a mapping with 'workflow' and 'steps'");
            throw new SchemaException(null, result);
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) loaded;
        WorkflowDefinition.Builder builder = parseWorkflowSection(data, result);
        builder.steps(parseSteps(data, result));
        builder.source(content);

        String name = getStringValue(getMapValue(data, "workflow"), "name");
        if (!result.isValid()) {
            throw new SchemaException(name, result);
        }

        WorkflowDefinition definition = builder.build();
        logger.debug("Parsed workflow '{}' version {} with {} step(s)",
                definition.getName(), definition.getVersion(), definition.getSteps().size());
        return definition;
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();
        if (!WorkflowDefinition.isValidName(definition.getName())) {
            result.addError("workflow.name", INVALID_NAME_MESSAGE + definition.getName());
        }
        List<StepSpec> steps = definition.getSteps();
        if (steps.isEmpty()) {
            result.addError("steps", "Workflow must declare at least one step");
            return result;
        }

        Set<String> ids = new HashSet<>();
        for (StepSpec step : steps) {
            if (!ids.add(step.getId())) {
                result.addError("steps", "Duplicate step id: " + step.getId());
            }
        }
        for (int i = 0; i < steps.size(); i++) {
            StepSpec step = steps.get(i);
            String path = "steps[" + i + "]";
            if (step.getInputFrom() != null) {
                checkReference(step.getId(), step.getInputFrom(), ids, path + ".input_from", result);
            }
            for (int d = 0; d < step.getDependsOn().size(); d++) {
                checkReference(step.getId(), step.getDependsOn().get(d), ids,
                        path + ".depends_on[" + d + "]", result);
            }
        }
        return result;
    }

    @Override
    public String render(WorkflowDefinition definition) {
        Map<String, Object> workflow = new LinkedHashMap<>();
        workflow.put("name", definition.getName());
        workflow.put("version", definition.getVersion());
        if (definition.getDescription() != null) {
            workflow.put("description", definition.getDescription());
        }
        if (!definition.getTags().isEmpty()) {
            workflow.put("tags", new ArrayList<>(definition.getTags()));
        }
        if (!definition.getVariables().isEmpty()) {
            workflow.put("variables", new LinkedHashMap<>(definition.getVariables()));
        }

        List<Map<String, Object>> steps = new ArrayList<>();
        for (StepSpec step : definition.getSteps()) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("id", step.getId());
            if (!step.getName().equals(step.getId())) {
                map.put("name", step.getName());
            }
            map.put("agent", step.getAgent());
            switch (step.getInputSource()) {
                case FILE -> map.put("input_file", step.getInputFile());
                case STEP -> map.put("input_from", step.getInputFrom());
                case INITIAL -> map.put("input", INITIAL_INPUT);
            }
            if (!step.getDependsOn().isEmpty()) {
                map.put("depends_on", new ArrayList<>(step.getDependsOn()));
            }
            if (!step.getConfig().isEmpty()) {
                map.put("config", new LinkedHashMap<>(step.getConfig()));
            }
            if (!step.getOutputs().isEmpty()) {
                map.put("outputs", new ArrayList<>(step.getOutputs()));
            }
            if (!step.getInputs().isEmpty()) {
                map.put("inputs", new ArrayList<>(step.getInputs()));
            }
            step.getRetries().ifPresent(retries -> map.put("retries", retries));
            if (step.getDescription() != null) {
                map.put("description", step.getDescription());
            }
            steps.add(map);
        }

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("workflow", workflow);
        root.put("steps", steps);

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(options).dump(root);
    }

    private WorkflowDefinition.Builder parseWorkflowSection(Map<String, Object> data, ValidationResult result) {
        WorkflowDefinition.Builder builder = new WorkflowDefinition.Builder();
        Object section = data.get("workflow");
        if (section == null) {
            result.addError("workflow", "Required section 'workflow' is missing");
            return builder;
        }
        if (!(section instanceof Map)) {
            result.addError("workflow", "Section 'workflow' must be a mapping");
            return builder;
        }

        Map<String, Object> workflow = getMapValue(data, "workflow");
        String name = getStringValue(workflow, "name");
        if (name == null || name.trim().isEmpty()) {
            result.addError("workflow.name", "Workflow name is required");
        } else if (!WorkflowDefinition.isValidName(name)) {
            result.addError("workflow.name", INVALID_NAME_MESSAGE + name);
        } else {
            builder.name(name);
        }
        builder.version(getStringValue(workflow, "version", WorkflowDefinition.DEFAULT_VERSION));
        builder.description(getStringValue(workflow, "description"));
        builder.tags(getStringList(workflow, "tags", "workflow.tags", result));

        Object variables = workflow.get("variables");
        if (variables != null && !(variables instanceof Map)) {
            result.addError("workflow.variables", "Variables must be a mapping");
        } else {
            builder.variables(getMapValue(workflow, "variables"));
        }
        return builder;
    }

    private List<StepSpec> parseSteps(Map<String, Object> data, ValidationResult result) {
        Object stepsValue = data.get("steps");
        if (stepsValue == null) {
            result.addError("steps", "Required section 'steps' is missing");
            return List.of();
        }
        if (!(stepsValue instanceof List)) {
            result.addError("steps", "Section 'steps' must be a list");
            return List.of();
        }
        List<?> stepsList = (List<?>) stepsValue;
        if (stepsList.isEmpty()) {
            result.addError("steps", "Workflow must declare at least one step");
            return List.of();
        }

        List<StepSpec> steps = new ArrayList<>();
        // ids declared so far, including steps that failed validation
        Set<String> declared = new HashSet<>();
        for (int i = 0; i < stepsList.size(); i++) {
            String path = "steps[" + i + "]";
            Object item = stepsList.get(i);
            if (!(item instanceof Map)) {
                result.addError(path, "Step must be a mapping");
                continue;
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> stepData = (Map<String, Object>) item;
            StepSpec step = parseStep(stepData, path, declared, result);
            if (step != null) {
                steps.add(step);
            }
        }
        return steps;
    }

    private StepSpec parseStep(Map<String, Object> data, String path, Set<String> declared,
                               ValidationResult result) {
        int errorsBefore = result.getErrorCount();

        for (String key : data.keySet()) {
            if (!STEP_KEYS.contains(String.valueOf(key))) {
                result.addWarning(path + "." + key, "Unknown step field is ignored");
            }
        }

        String id = getStringValue(data, "id");
        if (id == null || id.trim().isEmpty()) {
            result.addError(path + ".id", "Step id is required");
            id = null;
        } else if (declared.contains(id)) {
            result.addError(path + ".id", "Duplicate step id: " + id);
        }

        String agent = getStringValue(data, "agent");
        if (agent == null || agent.trim().isEmpty()) {
            result.addError(path + ".agent", "Step agent is required");
        }

        String inputFile = getStringValue(data, "input_file");
        String inputFrom = getStringValue(data, "input_from");
        String input = getStringValue(data, "input");
        int sources = (inputFile != null ? 1 : 0) + (inputFrom != null ? 1 : 0) + (input != null ? 1 : 0);
        if (sources == 0) {
            result.addError(path, "Step must declare one of 'input_file', 'input_from' or 'input: initial'");
        } else if (sources > 1) {
            result.addError(path, "Step must declare only one of 'input_file', 'input_from' or 'input'");
        }
        if (input != null && !INITIAL_INPUT.equals(input)) {
            result.addError(path + ".input", "Unsupported input source '" + input + "', expected 'initial'");
        }
        if (inputFrom != null) {
            checkEarlierReference(id, inputFrom, declared, path + ".input_from", result);
        }

        List<String> dependsOn = getStringList(data, "depends_on", path + ".depends_on", result);
        for (int d = 0; d < dependsOn.size(); d++) {
            checkEarlierReference(id, dependsOn.get(d), declared, path + ".depends_on[" + d + "]", result);
        }

        Object config = data.get("config");
        if (config != null && !(config instanceof Map)) {
            result.addError(path + ".config", "Step config must be a mapping");
        }
        List<String> outputs = getStringList(data, "outputs", path + ".outputs", result);
        List<String> inputs = getStringList(data, "inputs", path + ".inputs", result);

        Integer retries = null;
        Object retriesValue = data.get("retries");
        if (retriesValue != null) {
            if (retriesValue instanceof Integer && (Integer) retriesValue >= 0) {
                retries = (Integer) retriesValue;
            } else {
                result.addError(path + ".retries", "Retries must be a non-negative integer, got: " + retriesValue);
            }
        }

        if (id != null) {
            declared.add(id);
        }
        if (result.getErrorCount() > errorsBefore) {
            return null;
        }

        StepSpec.Builder builder = new StepSpec.Builder()
                .id(id)
                .name(getStringValue(data, "name"))
                .agent(agent)
                .dependsOn(dependsOn)
                .config(getMapValue(data, "config"))
                .outputs(outputs)
                .inputs(inputs)
                .retries(retries)
                .description(getStringValue(data, "description"));
        if (inputFile != null) {
            builder.inputFile(inputFile);
        } else if (inputFrom != null) {
            builder.inputFrom(inputFrom);
        } else {
            builder.initialInput();
        }
        return builder.build();
    }

    private void checkEarlierReference(String stepId, String reference, Set<String> declared,
                                       String fieldPath, ValidationResult result) {
        if (reference.equals(stepId)) {
            result.addError(fieldPath, "Step '" + stepId + "' cannot reference itself");
        } else if (!declared.contains(reference)) {
            result.addError(fieldPath, "Referenced step '" + reference
                    + "' does not exist or is not declared before step '" + stepId + "'");
        }
    }

    private void checkReference(String stepId, String reference, Set<String> ids,
                                String fieldPath, ValidationResult result) {
        if (reference.equals(stepId)) {
            result.addError(fieldPath, "Step '" + stepId + "' cannot reference itself");
        } else if (!ids.contains(reference)) {
            result.addError(fieldPath, "Referenced step '" + reference + "' does not exist");
        }
    }

    // Utility methods for safe type conversion
    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    private List<String> getStringList(Map<String, Object> data, String key, String fieldPath,
                                       ValidationResult result) {
        if (data == null) return List.of();
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            result.addError(fieldPath, "'" + key + "' must be a list of strings");
            return List.of();
        }
        List<String> strings = new ArrayList<>();
        List<?> items = (List<?>) value;
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (item instanceof String) {
                strings.add((String) item);
            } else {
                result.addError(fieldPath + "[" + i + "]", "Expected a string, got: " + item);
            }
        }
        return strings;
    }
}
