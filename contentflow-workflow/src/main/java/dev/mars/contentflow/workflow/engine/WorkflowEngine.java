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

import dev.mars.contentflow.exceptions.ContentFlowException;
import dev.mars.contentflow.exceptions.PersistenceException;
import dev.mars.contentflow.model.ArchiveEntry;
import dev.mars.contentflow.model.Run;
import dev.mars.contentflow.workflow.WorkflowDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes workflow definitions and answers questions about their runs.
 *
 * <p>Problems with the definition itself (schema violations, cycles, unknown
 * agents) and run identity conflicts are thrown before any step runs. Once a
 * run has started the caller always receives a terminal {@link RunResult},
 * with step failures recorded in it rather than thrown.</p>
 */
public interface WorkflowEngine {

    /**
     * Executes a workflow with the engine's default options, blocking until the run finishes.
     *
     * @param definition   the workflow definition to execute
     * @param initialInput the payload of steps declaring {@code input: initial}, also used for variables
     * @return the finished run
     * @throws ContentFlowException if the run could not be started
     */
    RunResult execute(WorkflowDefinition definition, Map<String, Object> initialInput) throws ContentFlowException;

    /**
     * Executes a workflow, blocking until the run finishes.
     *
     * @param definition   the workflow definition to execute
     * @param initialInput the initial input
     * @param options      strategy, persistence, retries, timeout and run id settings
     * @return the finished run
     * @throws ContentFlowException if the run could not be started
     */
    RunResult execute(WorkflowDefinition definition, Map<String, Object> initialInput, ExecutionOptions options)
            throws ContentFlowException;

    /**
     * Starts a workflow on the engine's worker pool. The run id is reserved
     * before this method returns.
     *
     * @return the run key and a future of the finished run
     * @throws ContentFlowException if the run could not be started
     */
    RunSubmission submit(WorkflowDefinition definition, Map<String, Object> initialInput, ExecutionOptions options)
            throws ContentFlowException;

    /**
     * Continues a persisted run from its definition snapshot with the resumable
     * strategy. Steps with a recorded success are not executed again.
     *
     * @throws ContentFlowException if the run or its snapshot cannot be found or loaded
     */
    RunResult resume(String workflowId, String runId, Map<String, Object> initialInput) throws ContentFlowException;

    /**
     * Gets a run: active runs from memory, finished runs from the store.
     */
    Optional<Run> getRun(String workflowId, String runId) throws PersistenceException;

    /**
     * Gets the archive of a workflow's finished runs, newest first.
     */
    List<ArchiveEntry> listRuns(String workflowId) throws PersistenceException;

    /**
     * Gets the ids of persisted runs of a workflow that never reached a
     * terminal status and are not executing now.
     */
    List<String> findResumableRuns(String workflowId) throws PersistenceException;

    /**
     * Cancels an active run. Cancellation takes effect between steps and
     * between retry attempts.
     *
     * @return true if the run was active and is now being cancelled
     */
    boolean cancel(String workflowId, String runId);

    void addListener(RunListener listener);

    void removeListener(RunListener listener);

    /**
     * Shuts down the workflow engine and cleans up resources.
     */
    void shutdown();
}
