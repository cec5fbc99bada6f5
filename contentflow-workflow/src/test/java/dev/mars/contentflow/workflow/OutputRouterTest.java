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

import dev.mars.contentflow.exceptions.ShapeException;
import dev.mars.contentflow.model.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class OutputRouterTest {

    @TempDir
    Path inputDir;

    private OutputRouter router;

    @BeforeEach
    void setUp() {
        router = new OutputRouter(inputDir);
    }

    @Test
    void testDeclaredOutputsAreProjected() throws Exception {
        StepSpec producer = StepSpec.builder("ingest", "ingestion").inputFile("doc.pdf").outputs("text", "pages").build();
        StepSpec consumer = StepSpec.builder("digest", "digest").inputFrom("ingest").build();
        StepResult result = StepResult.success("ingest", 1, Map.of("text", "hello", "pages", 5, "raw", "bytes"), 1);

        Map<String, Object> payload = router.route(result, producer, consumer);

        assertEquals(Map.of("text", "hello", "pages", 5), payload);
    }

    @Test
    void testUndeclaredOutputsPassThrough() throws Exception {
        StepSpec producer = StepSpec.builder("a", "x").initialInput().build();
        StepSpec consumer = StepSpec.builder("b", "y").inputFrom("a").build();
        StepResult result = StepResult.success("a", 1, Map.of("k", "v", "n", 1), 1);

        assertEquals(Map.of("k", "v", "n", 1), router.route(result, producer, consumer));
    }

    @Test
    void testMissingDeclaredOutput() {
        StepSpec producer = StepSpec.builder("ingest", "ingestion").initialInput().outputs("text", "pages").build();
        StepSpec consumer = StepSpec.builder("digest", "digest").inputFrom("ingest").build();
        StepResult result = StepResult.success("ingest", 1, Map.of("text", "hello"), 1);

        ShapeException e = assertThrows(ShapeException.class, () -> router.route(result, producer, consumer));

        assertEquals("digest", e.getStepId());
        assertEquals(List.of("pages"), e.getFields());
    }

    @Test
    void testConsumerInputsAreChecked() {
        StepSpec producer = StepSpec.builder("a", "x").initialInput().outputs("text").build();
        StepSpec consumer = StepSpec.builder("b", "y").inputFrom("a").inputs("text", "title", "author").build();
        StepResult result = StepResult.success("a", 1, Map.of("text", "t"), 1);

        ShapeException e = assertThrows(ShapeException.class, () -> router.route(result, producer, consumer));

        assertEquals(List.of("title", "author"), e.getFields());
        assertTrue(e.getMessage().contains("'b'"));
    }

    @Test
    void testConsumerInputsProjectPayload() throws Exception {
        StepSpec producer = StepSpec.builder("a", "x").initialInput().build();
        StepSpec consumer = StepSpec.builder("b", "y").inputFrom("a").inputs("text").build();
        StepResult result = StepResult.success("a", 1, Map.of("text", "t", "other", 1), 1);

        assertEquals(Map.of("text", "t"), router.route(result, producer, consumer));
    }

    @Test
    void testLimitAndMaxLength() throws Exception {
        StepSpec producer = StepSpec.builder("fetch", "rss").initialInput().build();
        StepSpec consumer = StepSpec.builder("digest", "digest").inputFrom("fetch")
                .configValue(OutputRouter.CONFIG_LIMIT, 2)
                .configValue(OutputRouter.CONFIG_MAX_LENGTH, "4")
                .build();
        StepResult result = StepResult.success("fetch", 1,
                Map.of("items", List.of("a", "b", "c"), "title", "headline", "count", 3), 1);

        Map<String, Object> payload = router.route(result, producer, consumer);

        assertEquals(List.of("a", "b"), payload.get("items"));
        assertEquals("head", payload.get("title"));
        assertEquals(3, payload.get("count"));
    }

    @Test
    void testNonNumericLimitIsIgnored() throws Exception {
        StepSpec producer = StepSpec.builder("fetch", "rss").initialInput().build();
        StepSpec consumer = StepSpec.builder("digest", "digest").inputFrom("fetch")
                .configValue(OutputRouter.CONFIG_LIMIT, "all").build();
        StepResult result = StepResult.success("fetch", 1, Map.of("items", List.of("a", "b", "c")), 1);

        assertEquals(List.of("a", "b", "c"), router.route(result, producer, consumer).get("items"));
    }

    @Test
    void testInitialInput() throws Exception {
        StepSpec step = StepSpec.builder("a", "x").initialInput().build();

        Map<String, Object> payload = router.staticInput(step, Map.of("topic", "java"));

        assertEquals(Map.of("topic", "java"), payload);
        assertEquals(Map.of(), router.staticInput(step, null));
    }

    @Test
    void testNonJsonInputFileIsDescribed() throws Exception {
        StepSpec step = StepSpec.builder("ingest", "ingestion").inputFile("doc.pdf").build();

        Map<String, Object> payload = router.staticInput(step, Map.of("lang", "en", OutputRouter.FILE_NAME, "ignored"));

        assertEquals(inputDir.resolve("doc.pdf").toString(), payload.get(OutputRouter.FILE_PATH));
        assertEquals("doc.pdf", payload.get(OutputRouter.FILE_NAME));
        assertEquals("en", payload.get("lang"));
    }

    @Test
    void testJsonInputFileIsParsed() throws Exception {
        Files.writeString(inputDir.resolve("feed.json"), "{\"items\": [1, 2, 3, 4], \"source\": \"rss\"}");
        StepSpec step = StepSpec.builder("fetch", "rss").inputFile("feed.json").configValue("limit", 2).build();

        Map<String, Object> payload = router.staticInput(step, Map.of("source", "initial", "extra", true));

        assertEquals(List.of(1, 2), payload.get("items"));
        assertEquals("rss", payload.get("source"));
        assertEquals(true, payload.get("extra"));
    }

    @Test
    void testMissingJsonInputFile() {
        StepSpec step = StepSpec.builder("fetch", "rss").inputFile("absent.json").build();

        assertThrows(NoSuchFileException.class, () -> router.staticInput(step, Map.of()));
    }

    @Test
    void testStaticInputRejectsStepFedByAnotherStep() {
        StepSpec step = StepSpec.builder("b", "y").inputFrom("a").build();

        assertThrows(IllegalArgumentException.class, () -> router.staticInput(step, Map.of()));
    }

    @Test
    void testRoutedPayloadIsIndependentOfProducerOutput() throws Exception {
        StepSpec producer = StepSpec.builder("a", "x").initialInput().build();
        StepSpec consumer = StepSpec.builder("b", "y").inputFrom("a").build();
        StepResult result = StepResult.success("a", 1, Map.of("k", "v"), 1);

        Map<String, Object> payload = router.route(result, producer, consumer);
        payload.put("added", 1);

        assertThat(result.getOutput()).containsOnlyKeys("k");
    }
}
