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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves variables in step configuration using template substitution.
 * Supports variable references in the format {{variableName}}.
 *
 * <p>A string that consists of a single reference is replaced by the variable's
 * value with its type intact, so {@code limit: "{{limit}}"} can resolve to a
 * number. References embedded in longer text are substituted as strings.</p>
 */
public class VariableResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private final Map<String, Object> globalVariables;
    private final Map<String, Object> contextVariables;

    public VariableResolver() {
        this.globalVariables = new HashMap<>();
        this.contextVariables = new HashMap<>();
    }

    public VariableResolver(Map<String, Object> globalVariables) {
        this.globalVariables = new HashMap<>();
        this.contextVariables = new HashMap<>();
        if (globalVariables != null) {
            globalVariables.forEach((name, value) -> {
                if (value != null) {
                    this.globalVariables.put(name, value);
                }
            });
        }
    }

    /**
     * Creates a new resolver with additional context variables.
     * Context variables take precedence over global variables.
     */
    public VariableResolver withContext(Map<String, Object> contextVariables) {
        VariableResolver resolver = new VariableResolver(this.globalVariables);
        resolver.contextVariables.putAll(this.contextVariables);
        if (contextVariables != null) {
            contextVariables.forEach((name, value) -> {
                if (value != null) {
                    resolver.contextVariables.put(name, value);
                }
            });
        }
        return resolver;
    }

    /**
     * Resolves variables in a string template.
     *
     * @param template the template string containing variable references
     * @return the resolved string with variables substituted
     * @throws VariableResolutionException if a variable cannot be resolved
     */
    public String resolve(String template) throws VariableResolutionException {
        if (template == null) {
            return null;
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String variableName = matcher.group(1).trim();
            Object value = requireVariable(variableName);
            matcher.appendReplacement(result, Matcher.quoteReplacement(value.toString()));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Resolves one configuration value: strings are substituted, maps and lists
     * are resolved element by element, anything else is returned unchanged.
     */
    public Object resolveValue(Object value) throws VariableResolutionException {
        if (value instanceof String) {
            String template = (String) value;
            Matcher whole = VARIABLE_PATTERN.matcher(template);
            if (whole.matches()) {
                return requireVariable(whole.group(1).trim());
            }
            return resolve(template);
        }
        if (value instanceof Map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), resolveValue(entry.getValue()));
            }
            return resolved;
        }
        if (value instanceof List) {
            List<Object> resolved = new ArrayList<>();
            for (Object item : (List<?>) value) {
                resolved.add(resolveValue(item));
            }
            return resolved;
        }
        return value;
    }

    /**
     * Resolves variables in a step's configuration, creating a new instance with resolved values.
     */
    public StepSpec resolve(StepSpec step) throws VariableResolutionException {
        Objects.requireNonNull(step, "Step cannot be null");
        if (step.getConfig().isEmpty()) {
            return step;
        }

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : step.getConfig().entrySet()) {
            try {
                resolvedConfig.put(entry.getKey(), resolveValue(entry.getValue()));
            } catch (VariableResolutionException e) {
                throw new VariableResolutionException("Step '" + step.getId() + "' config '"
                        + entry.getKey() + "': " + e.getMessage(), e);
            }
        }
        return step.withConfig(resolvedConfig);
    }

    /**
     * Resolves variables in a complete workflow definition.
     */
    public WorkflowDefinition resolve(WorkflowDefinition workflow) throws VariableResolutionException {
        Objects.requireNonNull(workflow, "Workflow definition cannot be null");

        // Workflow variables are defaults, context variables win
        VariableResolver workflowResolver = new VariableResolver(workflow.getVariables());
        workflowResolver.contextVariables.putAll(this.getAllVariables());

        List<StepSpec> resolvedSteps = new ArrayList<>();
        for (StepSpec step : workflow.getSteps()) {
            resolvedSteps.add(workflowResolver.resolve(step));
        }
        return workflow.withSteps(resolvedSteps);
    }

    /**
     * Checks if a template contains any variable references.
     */
    public boolean hasVariables(String template) {
        if (template == null) {
            return false;
        }
        return VARIABLE_PATTERN.matcher(template).find();
    }

    /**
     * Gets all variable names referenced in a template.
     */
    public Set<String> getVariableNames(String template) {
        if (template == null) {
            return Set.of();
        }

        Set<String> variables = new LinkedHashSet<>();
        Matcher matcher = VARIABLE_PATTERN.matcher(template);

        while (matcher.find()) {
            variables.add(matcher.group(1).trim());
        }

        return variables;
    }

    /**
     * Gets all available variables (context variables override global variables).
     */
    public Map<String, Object> getAllVariables() {
        Map<String, Object> allVariables = new HashMap<>(globalVariables);
        allVariables.putAll(contextVariables);
        return Map.copyOf(allVariables);
    }

    private Object requireVariable(String variableName) {
        Object value = contextVariables.containsKey(variableName)
                ? contextVariables.get(variableName)
                : globalVariables.get(variableName);
        if (value == null) {
            throw new VariableResolutionException("Variable not found: " + variableName);
        }
        return value;
    }

    /**
     * Exception thrown when variable resolution fails.
     */
    public static class VariableResolutionException extends RuntimeException {
        public VariableResolutionException(String message) {
            super(message);
        }

        public VariableResolutionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
