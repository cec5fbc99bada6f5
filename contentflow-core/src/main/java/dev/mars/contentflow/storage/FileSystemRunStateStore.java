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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.contentflow.exceptions.PersistenceException;
import dev.mars.contentflow.exceptions.RunIdentityException;
import dev.mars.contentflow.model.ArchiveEntry;
import dev.mars.contentflow.model.Run;
import dev.mars.contentflow.model.RunKey;
import dev.mars.contentflow.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Run state store backed by a directory tree of JSON files.
 *
 * <pre>
 * &lt;base&gt;/&lt;workflowId&gt;/run_archive.json               bounded archive, newest first
 * &lt;base&gt;/&lt;workflowId&gt;/&lt;runId&gt;/workflow.yaml          definition snapshot
 * &lt;base&gt;/&lt;workflowId&gt;/&lt;runId&gt;/run_metadata.json      run-level fields
 * &lt;base&gt;/&lt;workflowId&gt;/&lt;runId&gt;/steps/0001_&lt;step&gt;.json one file per step result
 * </pre>
 *
 * <p>Run directories are created with an atomic create so an existing run is
 * never reused. Step result files are created with {@code CREATE_NEW} and never
 * rewritten. Metadata and archive files are replaced through a temporary file
 * and an atomic move. Writes are serialized per run key and per workflow
 * archive inside this process.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class FileSystemRunStateStore implements RunStateStore {
    private static final Logger logger = LoggerFactory.getLogger(FileSystemRunStateStore.class);

    static final String DEFINITION_FILE = "workflow.yaml";
    static final String METADATA_FILE = "run_metadata.json";
    static final String ARCHIVE_FILE = "run_archive.json";
    static final String STEPS_DIR = "steps";

    private static final TypeReference<List<ArchiveEntry>> ARCHIVE_TYPE = new TypeReference<>() {
    };

    private final Path baseDirectory;
    private final RunIdGenerator idGenerator;
    private final int archiveMaxEntries;
    private final ObjectMapper mapper;
    private final Map<RunKey, Object> runLocks = new ConcurrentHashMap<>();
    private final Map<String, Object> archiveLocks = new ConcurrentHashMap<>();

    public FileSystemRunStateStore(Path baseDirectory) {
        this(baseDirectory, new RunIdGenerator(), 50);
    }

    public FileSystemRunStateStore(Path baseDirectory, RunIdGenerator idGenerator, int archiveMaxEntries) {
        if (archiveMaxEntries < 1) {
            throw new IllegalArgumentException("Archive size must be positive: " + archiveMaxEntries);
        }
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "Base directory cannot be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "Run id generator cannot be null");
        this.archiveMaxEntries = archiveMaxEntries;
        this.mapper = RunStateJson.createMapper();
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    @Override
    public String createRun(String workflowId, RunIdMode mode) throws RunIdentityException, PersistenceException {
        String runId = idGenerator.generate(mode);
        createRun(RunKey.of(workflowId, runId));
        return runId;
    }

    @Override
    public void createRun(RunKey key) throws RunIdentityException, PersistenceException {
        if (!tryCreateRunDirectory(key)) {
            throw new RunIdentityException(key);
        }
    }

    private boolean tryCreateRunDirectory(RunKey key) throws PersistenceException {
        Path runDir = runDirectory(key);
        try {
            Files.createDirectories(runDir.getParent());
            Files.createDirectory(runDir);
            Files.createDirectory(runDir.resolve(STEPS_DIR));
            logger.debug("Created run directory {}", runDir);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new PersistenceException(key, "Failed to create run directory", e);
        }
    }

    @Override
    public boolean exists(RunKey key) {
        return Files.isDirectory(runDirectory(key));
    }

    @Override
    public void saveDefinitionSnapshot(RunKey key, String definitionSource) throws PersistenceException {
        requireRun(key);
        synchronized (lockFor(key)) {
            try {
                FileManager.writeAtomically(runDirectory(key).resolve(DEFINITION_FILE),
                        (definitionSource != null ? definitionSource : "").getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new PersistenceException(key, "Failed to save definition snapshot", e);
            }
        }
    }

    @Override
    public Optional<String> getDefinitionSnapshot(RunKey key) throws PersistenceException {
        Path file = runDirectory(key).resolve(DEFINITION_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PersistenceException(key, "Failed to read definition snapshot", e);
        }
    }

    @Override
    public void saveRunMetadata(Run run) throws PersistenceException {
        RunKey key = run.getKey();
        requireRun(key);
        synchronized (lockFor(key)) {
            try {
                byte[] json = mapper.writeValueAsBytes(run.withStepResults(List.of()));
                FileManager.writeAtomically(runDirectory(key).resolve(METADATA_FILE), json);
            } catch (IOException e) {
                throw new PersistenceException(key, "Failed to save run metadata", e);
            }
        }
    }

    @Override
    public void appendStepResult(RunKey key, StepResult result) throws PersistenceException {
        Objects.requireNonNull(result, "Step result cannot be null");
        requireRun(key);
        Path stepsDir = runDirectory(key).resolve(STEPS_DIR);
        synchronized (lockFor(key)) {
            try {
                byte[] json = mapper.writeValueAsBytes(result);
                int sequence = listStepFiles(stepsDir).size() + 1;
                while (true) {
                    Path file = stepsDir.resolve(stepFileName(sequence, result.getStepId()));
                    try {
                        Files.write(file, json, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                        logger.debug("Appended step result {} for {}", file.getFileName(), key);
                        return;
                    } catch (FileAlreadyExistsException e) {
                        // written by another process since the listing
                        sequence++;
                    }
                }
            } catch (IOException e) {
                throw new PersistenceException(key, "Failed to append step result for step '"
                        + result.getStepId() + "'", e);
            }
        }
    }

    @Override
    public Optional<Run> getRun(RunKey key) throws PersistenceException {
        Path runDir = runDirectory(key);
        Path metadataFile = runDir.resolve(METADATA_FILE);
        if (!Files.exists(metadataFile)) {
            return Optional.empty();
        }
        synchronized (lockFor(key)) {
            try {
                Run metadata = mapper.readValue(metadataFile.toFile(), Run.class);
                List<StepResult> results = new ArrayList<>();
                for (Path file : listStepFiles(runDir.resolve(STEPS_DIR))) {
                    results.add(mapper.readValue(file.toFile(), StepResult.class));
                }
                return Optional.of(metadata.withStepResults(results));
            } catch (IOException e) {
                throw new PersistenceException(key, "Failed to read run", e);
            }
        }
    }

    @Override
    public List<ArchiveEntry> listRuns(String workflowId) throws PersistenceException {
        synchronized (archiveLockFor(workflowId)) {
            return readArchive(workflowId);
        }
    }

    @Override
    public List<String> listRunIds(String workflowId) throws PersistenceException {
        Path workflowDir = baseDirectory.resolve(workflowId);
        if (!Files.isDirectory(workflowDir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(workflowDir)) {
            return children.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PersistenceException("Failed to list runs of workflow " + workflowId, e);
        }
    }

    @Override
    public void archive(Run run) throws PersistenceException {
        ArchiveEntry entry = ArchiveEntry.fromRun(run);
        String workflowId = run.getWorkflowId();
        synchronized (archiveLockFor(workflowId)) {
            List<ArchiveEntry> updated = RunArchive.append(readArchive(workflowId), entry, archiveMaxEntries);
            try {
                FileManager.writeAtomically(archiveFile(workflowId), mapper.writeValueAsBytes(updated));
            } catch (IOException e) {
                throw new PersistenceException(run.getKey(), "Failed to write archive", e);
            }
        }
        logger.debug("Archived run {}", run.getKey());
    }

    @Override
    public int getArchiveMaxEntries() {
        return archiveMaxEntries;
    }

    private List<ArchiveEntry> readArchive(String workflowId) throws PersistenceException {
        Path file = archiveFile(workflowId);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<ArchiveEntry> entries = mapper.readValue(file.toFile(), ARCHIVE_TYPE);
            return entries != null ? List.copyOf(entries) : List.of();
        } catch (IOException e) {
            throw new PersistenceException("Failed to read archive of workflow " + workflowId, e);
        }
    }

    private void requireRun(RunKey key) throws PersistenceException {
        if (!exists(key)) {
            throw new PersistenceException("Run has not been created: " + key);
        }
    }

    private List<Path> listStepFiles(Path stepsDir) throws IOException {
        if (!Files.isDirectory(stepsDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(stepsDir)) {
            return files.filter(path -> path.getFileName().toString().endsWith(".json"))
                    .filter(path -> sequenceOf(path) > 0)
                    .sorted(Comparator.comparingInt(FileSystemRunStateStore::sequenceOf))
                    .collect(Collectors.toList());
        }
    }

    static String stepFileName(int sequence, String stepId) {
        return String.format("%04d_%s.json", sequence, stepId.replaceAll("[^A-Za-z0-9._\\-]", "_"));
    }

    private static int sequenceOf(Path file) {
        String name = file.getFileName().toString();
        int separator = name.indexOf('_');
        if (separator <= 0) {
            return -1;
        }
        try {
            return Integer.parseInt(name.substring(0, separator));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private Path runDirectory(RunKey key) {
        return baseDirectory.resolve(key.getWorkflowId()).resolve(key.getRunId());
    }

    private Path archiveFile(String workflowId) {
        return baseDirectory.resolve(workflowId).resolve(ARCHIVE_FILE);
    }

    private Object lockFor(RunKey key) {
        return runLocks.computeIfAbsent(key, k -> new Object());
    }

    private Object archiveLockFor(String workflowId) {
        return archiveLocks.computeIfAbsent(workflowId, k -> new Object());
    }
}
