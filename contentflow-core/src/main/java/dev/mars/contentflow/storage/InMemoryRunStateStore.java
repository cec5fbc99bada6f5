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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Run state store held entirely in memory. Suitable for tests and for runs
 * that do not need to survive the process.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class InMemoryRunStateStore implements RunStateStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryRunStateStore.class);

    private final Map<RunKey, RunRecord> runs = new ConcurrentHashMap<>();
    private final Map<String, List<ArchiveEntry>> archives = new ConcurrentHashMap<>();
    private final RunIdGenerator idGenerator;
    private final int archiveMaxEntries;

    public InMemoryRunStateStore() {
        this(new RunIdGenerator(), 50);
    }

    public InMemoryRunStateStore(RunIdGenerator idGenerator, int archiveMaxEntries) {
        if (archiveMaxEntries < 1) {
            throw new IllegalArgumentException("Archive size must be positive: " + archiveMaxEntries);
        }
        this.idGenerator = Objects.requireNonNull(idGenerator, "Run id generator cannot be null");
        this.archiveMaxEntries = archiveMaxEntries;
    }

    @Override
    public String createRun(String workflowId, RunIdMode mode) throws RunIdentityException {
        String runId = idGenerator.generate(mode);
        createRun(RunKey.of(workflowId, runId));
        return runId;
    }

    @Override
    public void createRun(RunKey key) throws RunIdentityException {
        if (runs.putIfAbsent(key, new RunRecord()) != null) {
            throw new RunIdentityException(key);
        }
        logger.debug("Created run {}", key);
    }

    @Override
    public boolean exists(RunKey key) {
        return runs.containsKey(key);
    }

    @Override
    public void saveDefinitionSnapshot(RunKey key, String definitionSource) throws PersistenceException {
        RunRecord state = requireRecord(key);
        synchronized (state) {
            state.definitionSource = definitionSource;
        }
    }

    @Override
    public Optional<String> getDefinitionSnapshot(RunKey key) {
        RunRecord state = runs.get(key);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.ofNullable(state.definitionSource);
        }
    }

    @Override
    public void saveRunMetadata(Run run) throws PersistenceException {
        RunRecord state = requireRecord(run.getKey());
        synchronized (state) {
            state.metadata = run.withStepResults(List.of());
        }
    }

    @Override
    public void appendStepResult(RunKey key, StepResult result) throws PersistenceException {
        Objects.requireNonNull(result, "Step result cannot be null");
        RunRecord state = requireRecord(key);
        synchronized (state) {
            state.results.add(result);
        }
    }

    @Override
    public Optional<Run> getRun(RunKey key) {
        RunRecord state = runs.get(key);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            if (state.metadata == null) {
                return Optional.empty();
            }
            return Optional.of(state.metadata.withStepResults(state.results));
        }
    }

    @Override
    public List<ArchiveEntry> listRuns(String workflowId) {
        return archives.getOrDefault(workflowId, List.of());
    }

    @Override
    public List<String> listRunIds(String workflowId) {
        return runs.keySet().stream()
                .filter(key -> key.getWorkflowId().equals(workflowId))
                .map(RunKey::getRunId)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public void archive(Run run) {
        ArchiveEntry entry = ArchiveEntry.fromRun(run);
        archives.compute(run.getWorkflowId(), (workflowId, current) ->
                List.copyOf(RunArchive.append(current != null ? current : List.of(), entry, archiveMaxEntries)));
        logger.debug("Archived run {}", run.getKey());
    }

    @Override
    public int getArchiveMaxEntries() {
        return archiveMaxEntries;
    }

    private RunRecord requireRecord(RunKey key) throws PersistenceException {
        RunRecord state = runs.get(key);
        if (state == null) {
            throw new PersistenceException("Run has not been created: " + key);
        }
        return state;
    }

    private static final class RunRecord {
        private Run metadata;
        private String definitionSource;
        private final List<StepResult> results = new ArrayList<>();
    }
}
