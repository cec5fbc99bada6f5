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

package dev.mars.contentflow.storage;

import dev.mars.contentflow.exceptions.PersistenceException;
import dev.mars.contentflow.exceptions.RunIdentityException;
import dev.mars.contentflow.model.ArchiveEntry;
import dev.mars.contentflow.model.FailureType;
import dev.mars.contentflow.model.Run;
import dev.mars.contentflow.model.RunKey;
import dev.mars.contentflow.model.RunStatus;
import dev.mars.contentflow.model.StepResult;
import dev.mars.contentflow.model.StrategyType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every run state store must share. Subclasses supply the store.
 */
abstract class AbstractRunStateStoreTest {

    protected static final String WORKFLOW = "news_digest";

    protected static final Clock FIXED_CLOCK =
            Clock.fixed(Instant.parse("2025-09-02T10:15:30.123Z"), ZoneOffset.UTC);

    protected abstract RunStateStore createStore(RunIdGenerator idGenerator, int archiveMaxEntries);

    protected RunStateStore createStore() {
        return createStore(new RunIdGenerator(), 3);
    }

    protected static Run finishedRun(String runId, String summary) {
        Instant end = Instant.parse("2025-09-02T10:00:00Z");
        return Run.pending(RunKey.of(WORKFLOW, runId), "1.0.0", StrategyType.PLAIN)
                .started(end.minusSeconds(1))
                .withStepResult(StepResult.success("summarize", 1, Map.of("summary", summary), 3))
                .succeeded(end);
    }

    @Test
    void testCreateRunGeneratesId() throws Exception {
        RunStateStore store = createStore(new RunIdGenerator(FIXED_CLOCK), 3);

        String runId = store.createRun(WORKFLOW, RunIdMode.TIMESTAMP);

        assertEquals("2025-09-02T10-15-30-123Z", runId);
        assertTrue(store.exists(RunKey.of(WORKFLOW, runId)));
        assertEquals(List.of(runId), store.listRunIds(WORKFLOW));
    }

    @Test
    void testRunIdCollisionIsRejected() throws Exception {
        RunStateStore store = createStore(new RunIdGenerator(FIXED_CLOCK), 3);
        String runId = store.createRun(WORKFLOW, RunIdMode.TIMESTAMP);
        RunKey key = RunKey.of(WORKFLOW, runId);
        store.appendStepResult(key, StepResult.success("a", 1, Map.of(), 1));

        RunIdentityException e = assertThrows(RunIdentityException.class,
                () -> store.createRun(WORKFLOW, RunIdMode.TIMESTAMP));

        assertEquals(key, e.getRunKey());
        store.saveRunMetadata(Run.pending(key, "1.0.0", StrategyType.PLAIN));
        assertEquals(1, store.getRun(key).orElseThrow().getStepResults().size());
    }

    @Test
    void testExplicitKeyCollision() throws Exception {
        RunStateStore store = createStore();
        RunKey key = RunKey.of(WORKFLOW, "manual");
        store.createRun(key);

        assertThrows(RunIdentityException.class, () -> store.createRun(key));
    }

    @Test
    void testRandomIdsAreDistinct() throws Exception {
        RunStateStore store = createStore();

        String first = store.createRun(WORKFLOW, RunIdMode.RANDOM);
        String second = store.createRun(WORKFLOW, RunIdMode.RANDOM);

        assertNotEquals(first, second);
        assertEquals(2, store.listRunIds(WORKFLOW).size());
    }

    @Test
    void testRunWithoutMetadataIsNotReadable() throws Exception {
        RunStateStore store = createStore();
        RunKey key = RunKey.of(WORKFLOW, "r1");
        store.createRun(key);

        assertTrue(store.getRun(key).isEmpty());
        assertTrue(store.getRun(RunKey.of(WORKFLOW, "never-created")).isEmpty());
    }

    @Test
    void testWritesRequireCreatedRun() {
        RunStateStore store = createStore();
        RunKey key = RunKey.of(WORKFLOW, "ghost");

        assertThrows(PersistenceException.class,
                () -> store.appendStepResult(key, StepResult.skipped("a", "reason")));
        assertThrows(PersistenceException.class,
                () -> store.saveRunMetadata(Run.pending(key, "1.0.0", StrategyType.PLAIN)));
    }

    @Test
    void testMetadataAndResultsRoundTrip() throws Exception {
        RunStateStore store = createStore();
        RunKey key = RunKey.of(WORKFLOW, "r1");
        store.createRun(key);
        Instant start = Instant.parse("2025-09-02T10:00:00Z");
        Run running = Run.pending(key, "2.1.0", StrategyType.RESUMABLE).started(start);
        store.saveRunMetadata(running);

        store.appendStepResult(key, StepResult.success("fetch", 1, Map.of("items", List.of("a", "b")), 10));
        store.appendStepResult(key, StepResult.failure("parse", 1, FailureType.PROCESSING, "bad", true, 4));
        store.appendStepResult(key, StepResult.failure("parse", 2, FailureType.PROCESSING, "bad", false, 4));
        store.saveRunMetadata(running.failed(start.plusSeconds(3), "parse", FailureType.PROCESSING, "bad"));

        Run loaded = store.getRun(key).orElseThrow();
        assertEquals(RunStatus.FAILED, loaded.getStatus());
        assertEquals(StrategyType.RESUMABLE, loaded.getStrategy());
        assertEquals("2.1.0", loaded.getWorkflowVersion());
        assertEquals("parse", loaded.getFailedStepId());
        assertEquals(FailureType.PROCESSING, loaded.getFailureType());
        assertEquals(start, loaded.getStartTime());
        assertThat(loaded.getStepResults())
                .extracting(StepResult::getStepId, StepResult::getAttempt)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple("fetch", 1),
                        org.assertj.core.groups.Tuple.tuple("parse", 1),
                        org.assertj.core.groups.Tuple.tuple("parse", 2));
        assertEquals(List.of("a", "b"), loaded.getStepResults().get(0).getOutput().get("items"));
        assertTrue(loaded.getStepResults().get(1).isRetrying());
    }

    @Test
    void testMetadataSaveDoesNotRewriteResults() throws Exception {
        RunStateStore store = createStore();
        RunKey key = RunKey.of(WORKFLOW, "r1");
        store.createRun(key);
        store.appendStepResult(key, StepResult.success("a", 1, Map.of(), 1));

        Run withForeignResults = Run.pending(key, "1.0.0", StrategyType.PLAIN)
                .withStepResult(StepResult.skipped("zzz", "ignored"));
        store.saveRunMetadata(withForeignResults);

        assertThat(store.getRun(key).orElseThrow().getStepResults())
                .extracting(StepResult::getStepId)
                .containsExactly("a");
    }

    @Test
    void testDefinitionSnapshot() throws Exception {
        RunStateStore store = createStore();
        RunKey key = RunKey.of(WORKFLOW, "r1");
        store.createRun(key);

        assertEquals(Optional.empty(), store.getDefinitionSnapshot(key));
        store.saveDefinitionSnapshot(key, "workflow:\n  name: news digest\n");

        assertEquals("workflow:\n  name: news digest\n", store.getDefinitionSnapshot(key).orElseThrow());
    }

    @Test
    void testArchiveIsNewestFirstAndBounded() throws Exception {
        RunStateStore store = createStore();
        for (int i = 1; i <= 5; i++) {
            Run run = finishedRun("r" + i, "summary " + i);
            store.createRun(run.getKey());
            store.saveRunMetadata(run);
            store.archive(run);
        }

        List<ArchiveEntry> entries = store.listRuns(WORKFLOW);

        assertThat(entries).extracting(ArchiveEntry::getRunId).containsExactly("r5", "r4", "r3");
        assertEquals("summary 5", entries.get(0).getSummary());
        assertEquals(3, store.getArchiveMaxEntries());
        // evicted from the archive, still readable in full
        Run evicted = store.getRun(RunKey.of(WORKFLOW, "r1")).orElseThrow();
        assertEquals(RunStatus.SUCCESS, evicted.getStatus());
        assertEquals(1, evicted.getStepResults().size());
    }

    @Test
    void testArchivingTwiceKeepsOneEntry() throws Exception {
        RunStateStore store = createStore();
        Run run = finishedRun("r1", "first");
        store.createRun(run.getKey());

        store.archive(run);
        store.archive(finishedRun("r1", "second"));

        List<ArchiveEntry> entries = store.listRuns(WORKFLOW);
        assertEquals(1, entries.size());
        assertEquals("second", entries.get(0).getSummary());
    }

    @Test
    void testConcurrentArchivingKeepsBoundAndEntries() throws Exception {
        int maxEntries = 5;
        int runs = 24;
        RunStateStore store = createStore(new RunIdGenerator(), maxEntries);
        for (int i = 0; i < runs; i++) {
            store.createRun(RunKey.of(WORKFLOW, "r" + i));
        }

        runConcurrently(runs, i -> store.archive(finishedRun("r" + i, "summary " + i)));

        List<ArchiveEntry> entries = store.listRuns(WORKFLOW);
        assertEquals(Math.min(runs, maxEntries), entries.size());
        assertEquals(entries.size(), entries.stream().map(ArchiveEntry::getRunId).distinct().count());
    }

    @Test
    void testConcurrentAppendsToOneRunKeepEveryResult() throws Exception {
        RunStateStore store = createStore();
        RunKey key = RunKey.of(WORKFLOW, "r1");
        store.createRun(key);
        store.saveRunMetadata(Run.pending(key, "1.0.0", StrategyType.PLAIN));
        int writers = 16;

        runConcurrently(writers, i -> store.appendStepResult(key, StepResult.success("step" + i, 1, Map.of(), 1)));

        List<StepResult> results = store.getRun(key).orElseThrow().getStepResults();
        assertThat(results).extracting(StepResult::getStepId)
                .containsExactlyInAnyOrderElementsOf(IntStream.range(0, writers)
                        .mapToObj(i -> "step" + i)
                        .collect(Collectors.toList()));
    }

    /**
     * Runs the task once per index, all threads released together.
     */
    protected static void runConcurrently(int threads, IndexedTask task) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Void>> futures = IntStream.range(0, threads)
                    .mapToObj(i -> executor.submit((Callable<Void>) () -> {
                        start.await();
                        task.run(i);
                        return null;
                    }))
                    .collect(Collectors.toList());
            start.countDown();
            for (Future<Void> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @FunctionalInterface
    protected interface IndexedTask {
        void run(int index) throws Exception;
    }

    @Test
    void testArchiveRejectsActiveRun() {
        RunStateStore store = createStore();
        Run running = Run.pending(RunKey.of(WORKFLOW, "r1"), "1.0.0", StrategyType.PLAIN).started(Instant.now());

        assertThrows(IllegalArgumentException.class, () -> store.archive(running));
    }

    @Test
    void testUnknownWorkflowHasNoRuns() throws Exception {
        RunStateStore store = createStore();

        assertTrue(store.listRuns("nothing").isEmpty());
        assertTrue(store.listRunIds("nothing").isEmpty());
    }

    @Test
    void testInvalidArchiveSize() {
        assertThrows(IllegalArgumentException.class, () -> createStore(new RunIdGenerator(), 0));
    }
}
