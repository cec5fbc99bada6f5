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

package dev.mars.contentflow.workflow.engine;

import dev.mars.contentflow.agent.DefaultAgentRegistry;
import dev.mars.contentflow.config.ContentFlowConfiguration;
import dev.mars.contentflow.exceptions.PersistenceException;
import dev.mars.contentflow.model.FailureType;
import dev.mars.contentflow.model.Run;
import dev.mars.contentflow.model.RunKey;
import dev.mars.contentflow.model.RunStatus;
import dev.mars.contentflow.model.StepResult;
import dev.mars.contentflow.model.StepStatus;
import dev.mars.contentflow.model.StrategyType;
import dev.mars.contentflow.storage.FileSystemRunStateStore;
import dev.mars.contentflow.workflow.StepSpec;
import dev.mars.contentflow.workflow.WorkflowDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.stubbing.Answer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

/**
 * Crash and resume of runs persisted on disk.
 */
class ResumableExecutionTest {

    @TempDir
    Path baseDirectory;

    private final ContentFlowConfiguration configuration = DefaultWorkflowEngineTest.testConfiguration();
    private final List<DefaultWorkflowEngine> engines = new ArrayList<>();

    private final AtomicBoolean storageLost = new AtomicBoolean();

    private ScriptedUnit fetch;
    private ScriptedUnit publish;

    @BeforeEach
    void setUp() {
        fetch = ScriptedUnit.returning(Map.of("items", List.of("one", "two")));
        publish = ScriptedUnit.returning(Map.of("summary", "published"));
    }

    @AfterEach
    void tearDown() {
        engines.forEach(DefaultWorkflowEngine::shutdown);
    }

    private DefaultWorkflowEngine newEngine(ScriptedUnit parse) {
        // a fresh store instance reads only what earlier engines left on disk
        return newEngine(parse, new FileSystemRunStateStore(baseDirectory));
    }

    private DefaultWorkflowEngine newEngine(ScriptedUnit parse, FileSystemRunStateStore store) {
        DefaultAgentRegistry registry = new DefaultAgentRegistry();
        registry.register("fetch", fetch);
        registry.register("parse", parse);
        registry.register("publish", publish);
        DefaultWorkflowEngine engine = new DefaultWorkflowEngine(registry, store, configuration);
        engines.add(engine);
        return engine;
    }

    /**
     * An engine whose writes stop reaching the disk once its parse step starts,
     * leaving the run on disk as a process dying mid-step would.
     */
    private DefaultWorkflowEngine crashingEngine() throws Exception {
        FileSystemRunStateStore store = spy(new FileSystemRunStateStore(baseDirectory));
        Answer<Object> unlessStorageLost = invocation -> {
            if (storageLost.get()) {
                throw new PersistenceException("storage lost");
            }
            return invocation.callRealMethod();
        };
        doAnswer(unlessStorageLost).when(store).appendStepResult(any(), any());
        doAnswer(unlessStorageLost).when(store).saveRunMetadata(any());
        doAnswer(unlessStorageLost).when(store).archive(any());
        return newEngine(new ScriptedUnit((input, context) -> {
            storageLost.set(true);
            throw new IllegalStateException("process died");
        }), store);
    }

    private static WorkflowDefinition pipeline() {
        return WorkflowDefinition.builder("News Pipeline")
                .step(StepSpec.builder("fetch", "fetch").initialInput().build())
                .step(StepSpec.builder("parse", "parse").inputFrom("fetch").build())
                .step(StepSpec.builder("publish", "publish").inputFrom("parse").build())
                .build();
    }

    private ExecutionOptions resumable(String runId) {
        return ExecutionOptions.builder(configuration)
                .strategy(StrategyType.RESUMABLE)
                .persistenceEnabled(true)
                .runId(runId)
                .build();
    }

    @Test
    void testResumeAfterCrashSkipsCompletedSteps() throws Exception {
        RunResult crashed = crashingEngine().execute(pipeline(), Map.of(), resumable("run-1"));
        assertEquals(FailureType.PERSISTENCE, crashed.getRun().getFailureType());
        assertEquals(0, publish.getInvocations());

        ScriptedUnit parse = ScriptedUnit.returning(Map.of("items", List.of("ONE", "TWO")));
        DefaultWorkflowEngine restarted = newEngine(parse);
        Run interrupted = restarted.getRun("news_pipeline", "run-1").orElseThrow();
        assertEquals(RunStatus.RUNNING, interrupted.getStatus());
        assertThat(interrupted.getStepResults()).extracting(StepResult::getStepId).containsExactly("fetch");
        assertEquals(List.of("run-1"), restarted.findResumableRuns("news_pipeline"));

        RunResult result = restarted.resume("news_pipeline", "run-1", Map.of());

        assertTrue(result.isSuccessful());
        assertEquals("run-1", result.getRunId());
        assertEquals(1, fetch.getInvocations());
        assertEquals(1, parse.getInvocations());
        assertEquals(1, publish.getInvocations());
        assertEquals(Map.of("items", List.of("one", "two")), parse.lastInput());
        assertEquals(Map.of("items", List.of("ONE", "TWO")), publish.lastInput());
        assertThat(result.getStepResults()).extracting(StepResult::getStepId)
                .containsExactly("fetch", "parse", "publish");

        Run stored = restarted.getRun("news_pipeline", "run-1").orElseThrow();
        assertEquals(RunStatus.SUCCESS, stored.getStatus());
        assertEquals(StrategyType.RESUMABLE, stored.getStrategy());
        assertTrue(restarted.findResumableRuns("news_pipeline").isEmpty());
        assertEquals(1, restarted.listRuns("news_pipeline").size());
    }

    @Test
    void testResumeAfterFailureContinuesAttemptNumbers() throws Exception {
        DefaultWorkflowEngine engine = newEngine(ScriptedUnit.failingUntil(1, Map.of("items", List.of())));

        RunResult failed = engine.execute(pipeline(), Map.of(), resumable("run-2"));

        assertEquals(RunStatus.FAILED, failed.getStatus());
        assertEquals("parse", failed.getFailedStepId().orElseThrow());
        assertEquals(StepStatus.SKIPPED, failed.getRun().getLatestResult("publish").orElseThrow().getStatus());
        assertEquals(0, publish.getInvocations());

        RunResult resumed = engine.resume("news_pipeline", "run-2", Map.of());

        assertTrue(resumed.isSuccessful());
        assertEquals(1, fetch.getInvocations());
        assertEquals(1, publish.getInvocations());
        List<StepResult> parseAttempts = resumed.getRun().getResultsFor("parse");
        assertThat(parseAttempts).extracting(StepResult::getAttempt).containsExactly(1, 2);
        assertThat(parseAttempts).extracting(StepResult::getStatus)
                .containsExactly(StepStatus.FAILED, StepStatus.SUCCESS);
        assertEquals(1, resumed.getRun().getLatestResult("publish").orElseThrow().getAttempt());
        assertEquals(RunStatus.SUCCESS, engine.getRun("news_pipeline", "run-2").orElseThrow().getStatus());
    }

    @Test
    void testResumingSucceededRunDoesNothing() throws Exception {
        ScriptedUnit parse = ScriptedUnit.returning(Map.of("items", List.of()));
        DefaultWorkflowEngine engine = newEngine(parse);
        RunResult first = engine.execute(pipeline(), Map.of(), resumable("run-3"));
        assertTrue(first.isSuccessful());

        RunResult again = engine.resume("news_pipeline", "run-3", Map.of());

        assertTrue(again.isSuccessful());
        assertEquals(3, again.getStepResults().size());
        assertEquals(1, fetch.getInvocations());
        assertEquals(1, parse.getInvocations());
        assertEquals(1, engine.listRuns("news_pipeline").size());
    }

    @Test
    void testResumeUnknownRun() {
        DefaultWorkflowEngine engine = newEngine(ScriptedUnit.returning(Map.of()));

        assertThrows(PersistenceException.class, () -> engine.resume("news_pipeline", "missing", Map.of()));
    }

    @Test
    void testDefinitionSnapshotIsPersisted() throws Exception {
        crashingEngine().execute(pipeline(), Map.of(), resumable("run-4"));

        FileSystemRunStateStore store = new FileSystemRunStateStore(baseDirectory);
        String snapshot = store.getDefinitionSnapshot(RunKey.of("news_pipeline", "run-4")).orElseThrow();

        assertThat(snapshot).contains("News Pipeline", "fetch", "input_from: parse");
    }
}
