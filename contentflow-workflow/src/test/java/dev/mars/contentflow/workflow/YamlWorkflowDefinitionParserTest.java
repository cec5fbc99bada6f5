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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for YamlWorkflowDefinitionParser.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-09-04
 */
class YamlWorkflowDefinitionParserTest {

    private YamlWorkflowDefinitionParser parser;

    @BeforeEach
    void setUp() {
        parser = new YamlWorkflowDefinitionParser();
    }

    private static Path resource(String name) throws URISyntaxException {
        return Paths.get(YamlWorkflowDefinitionParserTest.class.getResource("/workflows/" + name).toURI());
    }

    @Test
    void testParseValidWorkflowFile() throws Exception {
        WorkflowDefinition definition = parser.parse(resource("pdf-digest.yaml"));

        assertEquals("PDF Digest", definition.getName());
        assertEquals("pdf_digest", definition.getWorkflowId());
        assertEquals("1.2.0", definition.getVersion());
        assertEquals(List.of("pdf", "digest"), definition.getTags());
        assertEquals("markdown", definition.getVariables().get("digest_format"));
        assertEquals(2, definition.getSteps().size());
        assertTrue(definition.getSource().orElseThrow().contains("ingest_pdf"));

        StepSpec ingest = definition.getStep("ingest_pdf").orElseThrow();
        assertEquals(StepSpec.InputSource.FILE, ingest.getInputSource());
        assertEquals("doc.pdf", ingest.getInputFile());
        assertEquals(List.of("text", "pages"), ingest.getOutputs());
        assertEquals(1, ingest.getRetries().orElseThrow());

        StepSpec digest = definition.getStep("generate_digest").orElseThrow();
        assertEquals(StepSpec.InputSource.STEP, digest.getInputSource());
        assertEquals("ingest_pdf", digest.getInputFrom());
        assertEquals("{{digest_format}}", digest.getConfig().get("format"));
        assertTrue(digest.getRetries().isEmpty());
    }

    @Test
    void testAllViolationsAreReported() throws Exception {
        SchemaException e = assertThrows(SchemaException.class, () -> parser.parse(resource("invalid-steps.yaml")));

        assertThat(e.getValidationResult().getErrorFieldPaths()).contains(
                "workflow.name",
                "steps[1].agent",
                "steps[2].id",
                "steps[2].input_from",
                "steps[3]",
                "steps[3].retries");
        assertTrue(e.getViolations().size() >= 6);
    }

    @Test
    void testReferenceToUnknownStep() {
        String yaml = "workflow:\n" +
                "  name: refs\n" +
                "steps:\n" +
                "  - id: a\n" +
                "    agent: x\n" +
                "    input: initial\n" +
                "  - id: b\n" +
                "    agent: y\n" +
                "    input_from: Z\n";

        SchemaException e = assertThrows(SchemaException.class, () -> parser.parseFromString(yaml));

        assertEquals("refs", e.getWorkflowName());
        assertEquals(List.of("steps[1].input_from"), e.getValidationResult().getErrorFieldPaths());
        assertTrue(e.getViolations().get(0).getMessage().contains("'Z'"));
    }

    @Test
    void testForwardAndSelfReferencesAreRejected() {
        String yaml = "workflow:\n" +
                "  name: refs\n" +
                "steps:\n" +
                "  - id: a\n" +
                "    agent: x\n" +
                "    input_from: b\n" +
                "  - id: b\n" +
                "    agent: y\n" +
                "    input: initial\n" +
                "    depends_on: [b]\n";

        SchemaException e = assertThrows(SchemaException.class, () -> parser.parseFromString(yaml));

        assertEquals(List.of("steps[0].input_from", "steps[1].depends_on[0]"),
                e.getValidationResult().getErrorFieldPaths());
        assertTrue(e.getViolations().get(1).getMessage().contains("itself"));
    }

    @Test
    void testMissingInputSource() {
        String yaml = "workflow:\n  name: w\nsteps:\n  - id: a\n    agent: x\n";

        SchemaException e = assertThrows(SchemaException.class, () -> parser.parseFromString(yaml));

        assertEquals(List.of("steps[0]"), e.getValidationResult().getErrorFieldPaths());
    }

    @Test
    void testUnsupportedInputValue() {
        String yaml = "workflow:\n  name: w\nsteps:\n  - id: a\n    agent: x\n    input: stdin\n";

        SchemaException e = assertThrows(SchemaException.class, () -> parser.parseFromString(yaml));

        assertEquals(List.of("steps[0].input"), e.getValidationResult().getErrorFieldPaths());
    }

    @Test
    void testWorkflowNameMustMapToDistinctPathSafeId() {
        for (String name : List.of("..", ".", "a/b", "reports:daily")) {
            String yaml = "workflow:\n  name: '" + name + "'\nsteps:\n  - id: a\n    agent: x\n    input: initial\n";

            SchemaException e = assertThrows(SchemaException.class, () -> parser.parseFromString(yaml), name);

            assertEquals(List.of("workflow.name"), e.getValidationResult().getErrorFieldPaths(), name);
        }
    }

    @Test
    void testValidateRejectsBuiltDefinitionWithUnsafeName() {
        WorkflowDefinition definition = WorkflowDefinition.builder("..")
                .step(StepSpec.builder("a", "x").initialInput().build())
                .build();

        ValidationResult result = parser.validate(definition);

        assertEquals(List.of("workflow.name"), result.getErrorFieldPaths());
    }

    @Test
    void testMissingSections() {
        SchemaException e = assertThrows(SchemaException.class, () -> parser.parseFromString("other: 1\n"));

        assertThat(e.getValidationResult().getErrorFieldPaths()).containsExactly("workflow", "steps");
    }

    @Test
    void testEmptyStepList() {
        SchemaException e = assertThrows(SchemaException.class,
                () -> parser.parseFromString("workflow:\n  name: w\nsteps: []\n"));

        assertEquals(List.of("steps"), e.getValidationResult().getErrorFieldPaths());
    }

    @Test
    void testWrongFieldTypes() {
        String yaml = "workflow:\n" +
                "  name: w\n" +
                "  variables: [1, 2]\n" +
                "steps:\n" +
                "  - id: a\n" +
                "    agent: x\n" +
                "    input: initial\n" +
                "    config: not-a-map\n" +
                "    outputs: text\n" +
                "    retries: two\n";

        SchemaException e = assertThrows(SchemaException.class, () -> parser.parseFromString(yaml));

        assertThat(e.getValidationResult().getErrorFieldPaths()).containsExactly(
                "workflow.variables", "steps[0].config", "steps[0].outputs", "steps[0].retries");
    }

    @Test
    void testMalformedYamlReportsLine() {
        String yaml = "workflow:\n  name: w\nsteps:\n  - id: a\n    agent: [unclosed\n";

        SchemaException e = assertThrows(SchemaException.class, () -> parser.parseFromString(yaml));

        assertEquals(1, e.getViolations().size());
        assertTrue(e.getViolations().get(0).getLineNumber() > 0);
        assertTrue(e.getViolations().get(0).getMessage().startsWith("YAML syntax error"));
    }

    @Test
    void testNonMappingDocument() {
        SchemaException e = assertThrows(SchemaException.class, () -> parser.parseFromString("- just\n- a list\n"));

        assertEquals(1, e.getViolations().size());
    }

    @Test
    void testUnknownStepFieldIsOnlyAWarning() throws Exception {
        String yaml = "workflow:\n  name: w\nsteps:\n  - id: a\n    agent: x\n    input: initial\n    colour: blue\n";

        WorkflowDefinition definition = parser.parseFromString(yaml);

        assertEquals(1, definition.getSteps().size());
    }

    @Test
    void testDefaultVersion() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(
                "workflow:\n  name: w\nsteps:\n  - id: a\n    agent: x\n    input: initial\n");

        assertEquals(WorkflowDefinition.DEFAULT_VERSION, definition.getVersion());
        assertEquals(StepSpec.InputSource.INITIAL, definition.getSteps().get(0).getInputSource());
    }

    @Test
    void testMissingFile(@TempDir Path tempDir) {
        SchemaException e = assertThrows(SchemaException.class, () -> parser.parse(tempDir.resolve("absent.yaml")));

        assertNotNull(e.getCause());
        assertFalse(e.getValidationResult().isValid());
    }

    @Test
    void testRenderParsesBackToEquivalentDefinition() throws Exception {
        WorkflowDefinition original = parser.parse(resource("fan-in.yaml"));

        String rendered = parser.render(original);
        WorkflowDefinition reparsed = parser.parseFromString(rendered);

        assertEquals(original.getName(), reparsed.getName());
        assertEquals(original.getSteps(), reparsed.getSteps());
        assertTrue(rendered.contains("input: initial"));
    }

    @Test
    void testValidateProgrammaticDefinition() {
        WorkflowDefinition definition = WorkflowDefinition.builder("w")
                .step(StepSpec.builder("a", "x").initialInput().build())
                .step(StepSpec.builder("a", "y").inputFrom("missing").build())
                .step(StepSpec.builder("c", "z").initialInput().dependsOn("c").build())
                .build();

        ValidationResult result = parser.validate(definition);

        assertThat(result.getErrorFieldPaths()).containsExactly(
                "steps", "steps[1].input_from", "steps[2].depends_on[0]");
    }

    @Test
    void testValidateAllowsForwardReferences() {
        WorkflowDefinition definition = WorkflowDefinition.builder("w")
                .step(StepSpec.builder("a", "x").inputFrom("b").build())
                .step(StepSpec.builder("b", "y").initialInput().build())
                .build();

        assertTrue(parser.validate(definition).isValid());
        assertFalse(parser.validate(WorkflowDefinition.builder("empty").build()).isValid());
    }

    @Test
    void testConfigKeepsNestedValues() throws Exception {
        String yaml = "workflow:\n  name: w\nsteps:\n  - id: a\n    agent: x\n    input: initial\n" +
                "    config:\n      sources: [rss, web]\n      options: {depth: 2}\n";

        StepSpec step = parser.parseFromString(yaml).getSteps().get(0);

        assertEquals(List.of("rss", "web"), step.getConfig().get("sources"));
        assertEquals(Map.of("depth", 2), step.getConfig().get("options"));
    }
}
