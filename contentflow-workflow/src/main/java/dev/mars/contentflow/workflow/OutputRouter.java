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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.contentflow.exceptions.ShapeException;
import dev.mars.contentflow.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the input payload of a step.
 *
 * <p>A step fed by another step receives the producer's output projected in
 * three stages:</p>
 * <ol>
 *   <li>to the producer's declared {@code outputs}, when it declares any</li>
 *   <li>to the consumer's declared {@code inputs}, when it declares any</li>
 *   <li>through the consumer's {@code limit} (list items) and
 *       {@code max_length} (string characters) config values</li>
 * </ol>
 *
 * <p>A step with a static input receives the initial input, or a payload
 * describing its {@code input_file}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class OutputRouter {
    private static final Logger logger = LoggerFactory.getLogger(OutputRouter.class);

    public static final String CONFIG_LIMIT = "limit";
    public static final String CONFIG_MAX_LENGTH = "max_length";
    public static final String FILE_PATH = "file_path";
    public static final String FILE_NAME = "file_name";

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final Path inputDirectory;
    private final ObjectMapper mapper;

    public OutputRouter() {
        this(Paths.get(""));
    }

    /**
     * @param inputDirectory directory that relative {@code input_file} paths are resolved against
     */
    public OutputRouter(Path inputDirectory) {
        this.inputDirectory = Objects.requireNonNull(inputDirectory, "Input directory cannot be null");
        this.mapper = new ObjectMapper();
    }

    /**
     * Routes the output of a producer step to a consumer step.
     *
     * @param producerResult the producer's successful result
     * @param producerSpec   the producer's declaration
     * @param consumerSpec   the consumer's declaration
     * @return the consumer's input payload
     * @throws ShapeException if the producer did not return a field it declares,
     *         or the consumer asks for fields the producer does not provide
     */
    public Map<String, Object> route(StepResult producerResult, StepSpec producerSpec, StepSpec consumerSpec)
            throws ShapeException {
        Map<String, Object> output = producerResult.getOutput();

        Map<String, Object> payload;
        if (producerSpec.getOutputs().isEmpty()) {
            payload = new LinkedHashMap<>(output);
        } else {
            List<String> missing = missingFields(output, producerSpec.getOutputs());
            if (!missing.isEmpty()) {
                throw new ShapeException(consumerSpec.getId(), missing, "Step '" + producerSpec.getId()
                        + "' did not return declared output field(s) " + missing);
            }
            payload = project(output, producerSpec.getOutputs());
        }

        if (!consumerSpec.getInputs().isEmpty()) {
            List<String> unknown = missingFields(payload, consumerSpec.getInputs());
            if (!unknown.isEmpty()) {
                throw new ShapeException(consumerSpec.getId(), unknown, "Step '" + consumerSpec.getId()
                        + "' requires input field(s) " + unknown + " not provided by step '"
                        + producerSpec.getId() + "'");
            }
            payload = project(payload, consumerSpec.getInputs());
        }

        return applyLimits(payload, consumerSpec);
    }

    /**
     * Builds the input of a step that is not fed by another step.
     *
     * <ul>
     *   <li>{@code input: initial}: the initial input</li>
     *   <li>{@code input_file} ending in {@code .json}: the parsed JSON object</li>
     *   <li>any other {@code input_file}: {@code file_path} and {@code file_name}</li>
     * </ul>
     * Initial input entries are added to file payloads where the key is absent.
     *
     * @throws IOException if a JSON input file is missing or unreadable
     */
    public Map<String, Object> staticInput(StepSpec spec, Map<String, Object> initialInput) throws IOException {
        Map<String, Object> initial = initialInput != null ? initialInput : Map.of();
        Map<String, Object> payload;
        switch (spec.getInputSource()) {
            case INITIAL -> payload = new LinkedHashMap<>(initial);
            case FILE -> {
                payload = readInputFile(spec.getInputFile());
                initial.forEach(payload::putIfAbsent);
            }
            default -> throw new IllegalArgumentException("Step '" + spec.getId()
                    + "' takes its input from step '" + spec.getInputFrom() + "'");
        }
        return applyLimits(payload, spec);
    }

    private Map<String, Object> readInputFile(String inputFile) throws IOException {
        Path path = inputDirectory.resolve(inputFile);
        if (inputFile.toLowerCase(Locale.ROOT).endsWith(".json")) {
            if (!Files.isRegularFile(path)) {
                throw new NoSuchFileException(path.toString(), null, "Input file not found");
            }
            Map<String, Object> parsed = mapper.readValue(path.toFile(), PAYLOAD_TYPE);
            logger.debug("Loaded JSON input from {}", path);
            return parsed != null ? new LinkedHashMap<>(parsed) : new LinkedHashMap<>();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FILE_PATH, path.toString());
        payload.put(FILE_NAME, path.getFileName() != null ? path.getFileName().toString() : inputFile);
        return payload;
    }

    private Map<String, Object> applyLimits(Map<String, Object> payload, StepSpec consumerSpec) {
        Integer limit = intConfig(consumerSpec, CONFIG_LIMIT);
        Integer maxLength = intConfig(consumerSpec, CONFIG_MAX_LENGTH);
        if (limit == null && maxLength == null) {
            return payload;
        }
        Map<String, Object> limited = new LinkedHashMap<>();
        payload.forEach((key, value) -> {
            if (limit != null && value instanceof List && ((List<?>) value).size() > limit) {
                limited.put(key, new ArrayList<>(((List<?>) value).subList(0, limit)));
            } else if (maxLength != null && value instanceof String && ((String) value).length() > maxLength) {
                limited.put(key, ((String) value).substring(0, maxLength));
            } else {
                limited.put(key, value);
            }
        });
        return limited;
    }

    private Integer intConfig(StepSpec spec, String key) {
        Object value = spec.getConfig().get(key);
        if (value instanceof Number) {
            return Math.max(0, ((Number) value).intValue());
        }
        if (value instanceof String) {
            try {
                return Math.max(0, Integer.parseInt(((String) value).trim()));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric {} '{}' on step '{}'", key, value, spec.getId());
            }
        }
        return null;
    }

    private static List<String> missingFields(Map<String, Object> payload, List<String> fields) {
        List<String> missing = new ArrayList<>();
        for (String field : fields) {
            if (!payload.containsKey(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    private static Map<String, Object> project(Map<String, Object> payload, List<String> fields) {
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String field : fields) {
            projected.put(field, payload.get(field));
        }
        return projected;
    }
}
