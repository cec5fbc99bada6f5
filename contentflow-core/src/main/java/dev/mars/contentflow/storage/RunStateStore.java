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
import dev.mars.contentflow.model.Run;
import dev.mars.contentflow.model.RunKey;
import dev.mars.contentflow.model.StepResult;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of workflow runs, addressed by {@code (workflowId, runId)}.
 *
 * <p>Contract shared by every implementation:</p>
 * <ul>
 *   <li>Run keys are never reused. Creating a run under an existing key fails
 *       with {@link RunIdentityException} and leaves the existing run intact.</li>
 *   <li>Step results are appended, never overwritten, and read back in append order.</li>
 *   <li>The archive holds at most {@link #getArchiveMaxEntries()} entries per
 *       workflow, newest first. Archiving a run that is already archived replaces
 *       its entry instead of adding a second one. Full run detail stays readable
 *       through {@link #getRun(RunKey)} after its archive entry is evicted.</li>
 *   <li>Writes for one run key are serialized; writes for different keys may
 *       proceed concurrently.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public interface RunStateStore {

    /**
     * Reserves a new run id for a workflow.
     *
     * @return the reserved run id
     * @throws RunIdentityException if the generated id is already taken, for
     *         example by a run created within the same millisecond
     */
    String createRun(String workflowId, RunIdMode mode) throws RunIdentityException, PersistenceException;

    /**
     * Reserves an explicit run key.
     *
     * @throws RunIdentityException if the key already exists
     */
    void createRun(RunKey key) throws RunIdentityException, PersistenceException;

    boolean exists(RunKey key) throws PersistenceException;

    /**
     * Stores the raw workflow definition the run was started from.
     */
    void saveDefinitionSnapshot(RunKey key, String definitionSource) throws PersistenceException;

    Optional<String> getDefinitionSnapshot(RunKey key) throws PersistenceException;

    /**
     * Writes the run-level fields of a run (status, timestamps, failure). Step
     * results carried by the snapshot are ignored: they are recorded through
     * {@link #appendStepResult(RunKey, StepResult)}.
     */
    void saveRunMetadata(Run run) throws PersistenceException;

    void appendStepResult(RunKey key, StepResult result) throws PersistenceException;

    /**
     * @return the run with every recorded step result, or empty if the run was
     *         never created or its metadata was never saved
     */
    Optional<Run> getRun(RunKey key) throws PersistenceException;

    /**
     * @return archive entries of a workflow, newest first
     */
    List<ArchiveEntry> listRuns(String workflowId) throws PersistenceException;

    /**
     * @return every run id ever created for a workflow, sorted
     */
    List<String> listRunIds(String workflowId) throws PersistenceException;

    /**
     * Adds a finished run to its workflow's archive, evicting the oldest entries
     * beyond the archive size. Append and eviction happen as one step.
     */
    void archive(Run run) throws PersistenceException;

    int getArchiveMaxEntries();
}
