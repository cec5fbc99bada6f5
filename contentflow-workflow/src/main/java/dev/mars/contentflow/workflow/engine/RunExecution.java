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

import dev.mars.contentflow.exceptions.InvalidTransitionException;
import dev.mars.contentflow.model.Run;
import dev.mars.contentflow.model.RunKey;
import dev.mars.contentflow.model.RunStatus;
import dev.mars.contentflow.model.StepResult;
import dev.mars.contentflow.model.StepStatus;
import dev.mars.contentflow.storage.RunStateStore;
import dev.mars.contentflow.workflow.ExecutionOrder;
import dev.mars.contentflow.workflow.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * State of one run while it executes: the in-memory run record, step statuses,
 * the first failure, cancellation and listener dispatch.
 *
 * <p>The run record is replaced as a whole on every change so readers on other
 * threads always see a consistent snapshot.</p>
 */
final class RunExecution {
    private static final Logger logger = LoggerFactory.getLogger(RunExecution.class);

    private final WorkflowDefinition definition;
    private final ExecutionOrder order;
    private final Map<String, Object> initialInput;
    private final ExecutionOptions options;
    private final RunStateStore store;
    private final List<RunListener> listeners;
    private final Map<String, StepResult> restoredResults;
    private final StepStateTracker tracker;
    private final CountDownLatch cancelLatch = new CountDownLatch(1);

    private volatile Run run;
    private volatile RunFailure failure;
    private volatile RunFailure preparationFailure;
    private volatile RunFailure runFailure;
    private volatile RunFailure persistenceFailure;

    RunExecution(Run run, WorkflowDefinition definition, ExecutionOrder order, Map<String, Object> initialInput,
                 ExecutionOptions options, RunStateStore store, List<RunListener> listeners,
                 Map<String, StepResult> restoredResults) {
        this.run = Objects.requireNonNull(run, "Run cannot be null");
        this.definition = Objects.requireNonNull(definition, "Definition cannot be null");
        this.order = Objects.requireNonNull(order, "Execution order cannot be null");
        this.initialInput = initialInput != null ? initialInput : Map.of();
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.listeners = listeners != null ? listeners : List.of();
        this.restoredResults = restoredResults != null ? Map.copyOf(restoredResults) : Map.of();
        this.tracker = new StepStateTracker(order.getOrderedStepIds());
    }

    RunKey getKey() {
        return run.getKey();
    }

    Run getRun() {
        return run;
    }

    WorkflowDefinition getDefinition() {
        return definition;
    }

    ExecutionOrder getOrder() {
        return order;
    }

    Map<String, Object> getInitialInput() {
        return initialInput;
    }

    ExecutionOptions getOptions() {
        return options;
    }

    RunStateStore getStore() {
        return store;
    }

    Optional<StepResult> getRestoredResult(String stepId) {
        return Optional.ofNullable(restoredResults.get(stepId));
    }

    Map<String, StepStatus> getStepStatuses() {
        return tracker.snapshot();
    }

    StepStatus getStepStatus(String stepId) {
        return tracker.get(stepId);
    }

    Optional<RunFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Records a failure. Only the first one is kept as the run's failure.
     */
    synchronized void recordFailure(RunFailure runFailure) {
        if (failure == null) {
            failure = runFailure;
        }
    }

    /**
     * Sets why the run as a whole failed. This can differ from the first step
     * failure, for example when the run was cancelled.
     */
    void setRunFailure(RunFailure runFailure) {
        this.runFailure = runFailure;
    }

    Optional<RunFailure> getRunFailure() {
        return Optional.ofNullable(runFailure);
    }

    /**
     * A failure found while preparing the run, such as an unresolvable variable.
     * The run fails before any step executes.
     */
    void setPreparationFailure(RunFailure runFailure) {
        this.preparationFailure = runFailure;
    }

    Optional<RunFailure> getPreparationFailure() {
        return Optional.ofNullable(preparationFailure);
    }

    boolean isPersistenceAborted() {
        return persistenceFailure != null;
    }

    /**
     * Stops the run after a write that had to be durable failed. Remaining
     * steps are skipped and the run fails with this failure.
     */
    synchronized void abortPersistence(RunFailure runFailure) {
        if (persistenceFailure == null) {
            persistenceFailure = runFailure;
        }
    }

    Optional<RunFailure> getPersistenceFailure() {
        return Optional.ofNullable(persistenceFailure);
    }

    boolean isCancelled() {
        return cancelLatch.getCount() == 0;
    }

    /**
     * Requests cancellation. Observed between steps and between retry attempts.
     *
     * @return {@code false} if the run has already finished
     */
    boolean cancel() {
        if (run.isTerminal()) {
            return false;
        }
        cancelLatch.countDown();
        return true;
    }

    /**
     * Waits before a retry.
     *
     * @return {@code true} if the full delay elapsed, {@code false} if the run was cancelled meanwhile
     */
    boolean awaitRetryDelay(Duration delay) throws InterruptedException {
        if (delay.isZero()) {
            return !isCancelled();
        }
        return !cancelLatch.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Moves the run to a new status through the run state machine.
     *
     * @throws IllegalStateException wrapping an {@link InvalidTransitionException}
     *         if the transition is not allowed
     */
    void transitionRun(RunStatus target, UnaryOperator<Run> change) {
        RunStatus from;
        synchronized (this) {
            from = run.getStatus();
            if (!from.canTransitionTo(target)) {
                throw new IllegalStateException(new InvalidTransitionException(
                        run.getKey().toString(), from, target, from.getValidTransitions()));
            }
            Run updated = change.apply(run);
            if (updated.getStatus() != target) {
                throw new IllegalStateException("Run change produced " + updated.getStatus() + ", expected " + target);
            }
            run = updated;
        }
        logger.debug("Run {} {} -> {}", run.getKey(), from, target);
        for (RunListener listener : listeners) {
            try {
                listener.onRunStatusChanged(run.getKey(), from, target);
            } catch (RuntimeException e) {
                logger.warn("Run listener failed on status change of {}: {}", run.getKey(), e.getMessage(), e);
            }
        }
    }

    void transitionStep(String stepId, StepStatus target) {
        StepStatus from = tracker.transition(stepId, target);
        for (RunListener listener : listeners) {
            try {
                listener.onStepStatusChanged(run.getKey(), stepId, from, target);
            } catch (RuntimeException e) {
                logger.warn("Run listener failed on status change of step '{}': {}", stepId, e.getMessage(), e);
            }
        }
    }

    void restoreStep(String stepId) {
        tracker.restoreSucceeded(stepId);
    }

    /**
     * Appends a result to the in-memory run log and notifies listeners.
     * Persisting the result is the strategy's concern.
     */
    void addResult(StepResult result) {
        synchronized (this) {
            run = run.withStepResult(result);
        }
        for (RunListener listener : listeners) {
            try {
                listener.onStepResult(run.getKey(), result);
            } catch (RuntimeException e) {
                logger.warn("Run listener failed on result of step '{}': {}", result.getStepId(), e.getMessage(), e);
            }
        }
    }
}
