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

import dev.mars.contentflow.agent.AgentRegistry;
import dev.mars.contentflow.config.ContentFlowConfiguration;
import dev.mars.contentflow.exceptions.ContentFlowException;
import dev.mars.contentflow.exceptions.PersistenceException;
import dev.mars.contentflow.exceptions.RunIdentityException;
import dev.mars.contentflow.exceptions.UnknownAgentException;
import dev.mars.contentflow.model.ArchiveEntry;
import dev.mars.contentflow.model.FailureType;
import dev.mars.contentflow.model.Run;
import dev.mars.contentflow.model.RunKey;
import dev.mars.contentflow.model.RunStatus;
import dev.mars.contentflow.model.StepResult;
import dev.mars.contentflow.model.StepStatus;
import dev.mars.contentflow.model.StrategyType;
import dev.mars.contentflow.storage.InMemoryRunStateStore;
import dev.mars.contentflow.storage.RunStateStore;
import dev.mars.contentflow.workflow.DependencyResolver;
import dev.mars.contentflow.workflow.ExecutionOrder;
import dev.mars.contentflow.workflow.OutputRouter;
import dev.mars.contentflow.workflow.SchemaException;
import dev.mars.contentflow.workflow.StepSpec;
import dev.mars.contentflow.workflow.ValidationResult;
import dev.mars.contentflow.workflow.VariableResolver;
import dev.mars.contentflow.workflow.WorkflowDefinition;
import dev.mars.contentflow.workflow.WorkflowDefinitionParser;
import dev.mars.contentflow.workflow.YamlWorkflowDefinitionParser;
import dev.mars.contentflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of WorkflowEngine.
 *
 * <p>A run is prepared on the caller's thread: the definition is validated,
 * every agent is checked, the steps are ordered and the run id is reserved in
 * the store together with a snapshot of the definition. The steps then run on
 * the caller's thread for {@link #execute} or on the worker pool for
 * {@link #submit}, driven by the strategy the options select.</p>
 *
 * <p>With persistence disabled each run is kept in a private in-memory store
 * that is discarded when the run finishes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class DefaultWorkflowEngine implements WorkflowEngine {
    private static final Logger logger = LoggerFactory.getLogger(DefaultWorkflowEngine.class);

    public static final String MDC_WORKFLOW_ID = "workflowId";
    public static final String MDC_RUN_ID = "runId";

    private final AgentRegistry registry;
    private final RunStateStore store;
    private final ContentFlowConfiguration configuration;
    private final WorkflowDefinitionParser parser;
    private final DependencyResolver dependencyResolver;
    private final WorkflowMetrics metrics;
    private final Map<StrategyType, ExecutionStrategy> strategies;
    private final ExecutorService runExecutor;
    private final ExecutorService stepExecutor;
    private final Map<RunKey, RunExecution> activeExecutions;
    private final List<RunListener> listeners;
    private volatile boolean shutdown = false;

    public DefaultWorkflowEngine(AgentRegistry registry, RunStateStore store) {
        this(registry, store, new ContentFlowConfiguration());
    }

    public DefaultWorkflowEngine(AgentRegistry registry, RunStateStore store, ContentFlowConfiguration configuration) {
        this(registry, store, configuration, new OutputRouter());
    }

    public DefaultWorkflowEngine(AgentRegistry registry, RunStateStore store, ContentFlowConfiguration configuration,
                                 OutputRouter router) {
        this.registry = Objects.requireNonNull(registry, "Agent registry cannot be null");
        this.store = Objects.requireNonNull(store, "Run state store cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        Objects.requireNonNull(router, "Output router cannot be null");
        this.parser = new YamlWorkflowDefinitionParser();
        this.dependencyResolver = new DependencyResolver();
        this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;
        this.runExecutor = Executors.newFixedThreadPool(configuration.getWorkerThreads(), namedThreads("contentflow-run"));
        this.stepExecutor = Executors.newCachedThreadPool(namedThreads("contentflow-step"));
        this.activeExecutions = new ConcurrentHashMap<>();
        this.listeners = new CopyOnWriteArrayList<>();

        StepInvoker invoker = new StepInvoker(stepExecutor);
        this.strategies = new EnumMap<>(StrategyType.class);
        strategies.put(StrategyType.PLAIN, new PlainExecutionStrategy(registry, router, invoker, metrics));
        strategies.put(StrategyType.RESUMABLE, new ResumableExecutionStrategy(registry, router, invoker, metrics));
    }

    @Override
    public RunResult execute(WorkflowDefinition definition, Map<String, Object> initialInput)
            throws ContentFlowException {
        return execute(definition, initialInput, ExecutionOptions.fromConfiguration(configuration));
    }

    @Override
    public RunResult execute(WorkflowDefinition definition, Map<String, Object> initialInput,
                             ExecutionOptions options) throws ContentFlowException {
        RunExecution execution = prepare(definition, initialInput, options);
        return runPrepared(execution);
    }

    @Override
    public RunSubmission submit(WorkflowDefinition definition, Map<String, Object> initialInput,
                                ExecutionOptions options) throws ContentFlowException {
        RunExecution execution = prepare(definition, initialInput, options);
        try {
            CompletableFuture<RunResult> result = CompletableFuture.supplyAsync(
                    () -> runPrepared(execution), runExecutor);
            return new RunSubmission(execution.getKey(), result);
        } catch (RejectedExecutionException e) {
            activeExecutions.remove(execution.getKey());
            throw new IllegalStateException("Workflow engine is shutdown", e);
        }
    }

    @Override
    public RunResult resume(String workflowId, String runId, Map<String, Object> initialInput)
            throws ContentFlowException {
        RunKey key = RunKey.of(workflowId, runId);
        if (!store.exists(key)) {
            throw new PersistenceException("Run not found: " + key);
        }
        String snapshot = store.getDefinitionSnapshot(key)
                .orElseThrow(() -> new PersistenceException("Run has no definition snapshot: " + key));
        WorkflowDefinition definition = parser.parseFromString(snapshot);
        if (!definition.getWorkflowId().equals(workflowId)) {
            throw new RunIdentityException(key, "Definition snapshot of " + key
                    + " belongs to workflow '" + definition.getWorkflowId() + "'");
        }

        ExecutionOptions options = ExecutionOptions.builder(configuration)
                .strategy(StrategyType.RESUMABLE)
                .persistenceEnabled(true)
                .runId(runId)
                .build();
        logger.info("Resuming run {}", key);
        return execute(definition, initialInput, options);
    }

    @Override
    public Optional<Run> getRun(String workflowId, String runId) throws PersistenceException {
        RunKey key = RunKey.of(workflowId, runId);
        RunExecution execution = activeExecutions.get(key);
        if (execution != null) {
            return Optional.of(execution.getRun());
        }
        return store.getRun(key);
    }

    @Override
    public List<ArchiveEntry> listRuns(String workflowId) throws PersistenceException {
        return store.listRuns(workflowId);
    }

    @Override
    public List<String> findResumableRuns(String workflowId) throws PersistenceException {
        List<String> resumable = new ArrayList<>();
        for (String runId : store.listRunIds(workflowId)) {
            RunKey key = RunKey.of(workflowId, runId);
            if (activeExecutions.containsKey(key)) {
                continue;
            }
            Optional<Run> run = store.getRun(key);
            if (run.isEmpty() || !run.get().isTerminal()) {
                resumable.add(runId);
            }
        }
        return resumable;
    }

    @Override
    public boolean cancel(String workflowId, String runId) {
        RunExecution execution = activeExecutions.get(RunKey.of(workflowId, runId));
        if (execution != null && execution.cancel()) {
            logger.info("Cancelling run {}", execution.getKey());
            return true;
        }
        return false;
    }

    @Override
    public void addListener(RunListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public void removeListener(RunListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void shutdown() {
        shutdown = true;
        activeExecutions.values().forEach(RunExecution::cancel);
        runExecutor.shutdown();
        stepExecutor.shutdown();
        logger.info("DefaultWorkflowEngine shutdown initiated");
    }

    /**
     * Validates the definition, reserves the run and builds its execution state.
     * Nothing here invokes a unit of work.
     */
    private RunExecution prepare(WorkflowDefinition definition, Map<String, Object> initialInput,
                                 ExecutionOptions options) throws ContentFlowException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        Objects.requireNonNull(options, "Execution options cannot be null");
        if (shutdown) {
            throw new IllegalStateException("Workflow engine is shutdown");
        }

        ValidationResult validation = parser.validate(definition);
        if (!validation.isValid()) {
            throw new SchemaException(definition.getName(), validation);
        }
        for (StepSpec step : definition.getSteps()) {
            if (!registry.isRegistered(step.getAgent())) {
                throw new UnknownAgentException(step.getAgent(), step.getId());
            }
        }
        ExecutionOrder declaredOrder = dependencyResolver.resolve(definition);

        Map<String, Object> input = initialInput != null ? initialInput : Map.of();
        RunStateStore runStore = options.isPersistenceEnabled() ? store : new InMemoryRunStateStore();
        String workflowId = definition.getWorkflowId();

        Run existing = null;
        RunKey key;
        if (options.getRunId().isPresent()) {
            key = RunKey.of(workflowId, options.getRunId().get());
            if (runStore.exists(key)) {
                if (options.getStrategy() != StrategyType.RESUMABLE) {
                    throw new RunIdentityException(key, "Run already exists: " + key
                            + ". Only the resumable strategy continues an existing run");
                }
                existing = runStore.getRun(key).orElse(null);
            } else {
                runStore.createRun(key);
            }
        } else {
            key = RunKey.of(workflowId, runStore.createRun(workflowId, options.getRunIdMode()));
        }

        Map<String, StepResult> restored = new HashMap<>();
        Run run;
        if (existing != null && existing.getStatus() == RunStatus.SUCCESS) {
            run = existing;
        } else if (existing != null) {
            for (StepSpec step : definition.getSteps()) {
                lastSuccess(existing, step.getId()).ifPresent(result -> restored.put(step.getId(), result));
            }
            run = Run.pending(key, definition.getVersion(), options.getStrategy())
                    .withStepResults(existing.getStepResults());
            logger.info("Run {} has {} recorded step success(es) to reuse", key, restored.size());
        } else {
            run = Run.pending(key, definition.getVersion(), options.getStrategy());
        }

        WorkflowDefinition resolved = definition;
        ExecutionOrder order = declaredOrder;
        RunFailure preparationFailure = null;
        try {
            resolved = new VariableResolver().withContext(input).resolve(definition);
            order = dependencyResolver.resolve(resolved);
        } catch (VariableResolver.VariableResolutionException e) {
            preparationFailure = new RunFailure(null, FailureType.INPUT, e.getMessage(), 0, e);
        }

        RunExecution execution = new RunExecution(run, resolved, order, input, options, runStore,
                listeners, restored);
        if (preparationFailure != null) {
            execution.setPreparationFailure(preparationFailure);
        }
        if (activeExecutions.putIfAbsent(key, execution) != null) {
            throw new RunIdentityException(key, "Run is already executing: " + key);
        }

        if (!run.isTerminal()) {
            try {
                if (runStore.getDefinitionSnapshot(key).isEmpty()) {
                    // rendered in execution order so the snapshot parses back
                    String snapshot = definition.getSource().isPresent()
                            ? definition.getSource().get()
                            : parser.render(definition.withSteps(declaredOrder.getOrderedSteps()));
                    runStore.saveDefinitionSnapshot(key, snapshot);
                }
                runStore.saveRunMetadata(run);
            } catch (PersistenceException e) {
                if (options.getStrategy() == StrategyType.RESUMABLE) {
                    activeExecutions.remove(key);
                    throw e;
                }
                logger.warn("Could not persist start of run {}, continuing: {}", key, e.getMessage());
            }
        }
        return execution;
    }

    private RunResult runPrepared(RunExecution execution) {
        RunKey key = execution.getKey();
        ExecutionOptions options = execution.getOptions();
        MDC.put(MDC_WORKFLOW_ID, key.getWorkflowId());
        MDC.put(MDC_RUN_ID, key.getRunId());
        Instant started = Instant.now();
        try {
            if (execution.getRun().getStatus() == RunStatus.SUCCESS) {
                logger.info("Run {} already succeeded, nothing to resume", key);
                return new RunResult(execution.getRun(), null);
            }

            logger.info("Starting run {} of workflow '{}' version {} ({} strategy, {} step(s))",
                    key, execution.getDefinition().getName(), execution.getDefinition().getVersion(),
                    options.getStrategy().getValue(), execution.getOrder().size());
            if (metrics != null) {
                metrics.recordRunStarted(key.getWorkflowId(), options.getStrategy());
            }

            Run finished;
            try {
                finished = strategies.get(options.getStrategy()).execute(execution);
            } catch (RuntimeException | Error e) {
                logger.error("Run {} aborted by an unexpected error: {}", key, e.getMessage(), e);
                finished = abort(execution, e);
            }

            if (options.isPersistenceEnabled()) {
                try {
                    store.archive(finished);
                } catch (PersistenceException e) {
                    logger.warn("Could not archive run {}: {}", key, e.getMessage());
                }
            }

            double seconds = Duration.between(started, Instant.now()).toMillis() / 1000.0;
            if (metrics != null) {
                if (finished.getStatus() == RunStatus.SUCCESS) {
                    metrics.recordRunSucceeded(key.getWorkflowId(), options.getStrategy(), seconds);
                } else {
                    metrics.recordRunFailed(key.getWorkflowId(), options.getStrategy(),
                            finished.getFailureType(), seconds);
                }
            }
            return new RunResult(finished, execution.getRunFailure().orElse(null));
        } finally {
            activeExecutions.remove(key);
            MDC.remove(MDC_WORKFLOW_ID);
            MDC.remove(MDC_RUN_ID);
        }
    }

    private Run abort(RunExecution execution, Throwable e) {
        RunFailure failure = new RunFailure(null, FailureType.PROCESSING,
                "Unexpected engine error: " + e.getMessage(), 0, e);
        execution.setRunFailure(failure);
        if (!execution.getRun().isTerminal()) {
            execution.transitionRun(RunStatus.FAILED, run -> run.failed(Instant.now(), null,
                    failure.getType(), failure.getMessage()));
            try {
                execution.getStore().saveRunMetadata(execution.getRun());
            } catch (PersistenceException pe) {
                logger.error("Failed to save final state of run {}: {}", execution.getKey(), pe.getMessage(), pe);
            }
        }
        return execution.getRun();
    }

    private static Optional<StepResult> lastSuccess(Run run, String stepId) {
        List<StepResult> results = run.getResultsFor(stepId);
        for (int i = results.size() - 1; i >= 0; i--) {
            if (results.get(i).getStatus() == StepStatus.SUCCESS) {
                return Optional.of(results.get(i));
            }
        }
        return Optional.empty();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
