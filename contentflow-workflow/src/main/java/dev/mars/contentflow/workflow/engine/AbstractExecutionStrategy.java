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
import dev.mars.contentflow.agent.StepContext;
import dev.mars.contentflow.agent.UnitOfWork;
import dev.mars.contentflow.exceptions.PersistenceException;
import dev.mars.contentflow.exceptions.ProcessingException;
import dev.mars.contentflow.exceptions.RunCancelledException;
import dev.mars.contentflow.exceptions.ShapeException;
import dev.mars.contentflow.exceptions.UnknownAgentException;
import dev.mars.contentflow.model.FailureType;
import dev.mars.contentflow.model.Run;
import dev.mars.contentflow.model.RunStatus;
import dev.mars.contentflow.model.StepResult;
import dev.mars.contentflow.model.StepStatus;
import dev.mars.contentflow.workflow.OutputRouter;
import dev.mars.contentflow.workflow.StepSpec;
import dev.mars.contentflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * The step loop shared by every strategy. Subclasses decide what a failed
 * write to the run state store means and which recorded results may be reused.
 *
 * <p>Steps run one at a time in dependency order. For each step:</p>
 * <ol>
 *   <li>a cancelled or aborted run skips it</li>
 *   <li>a reusable recorded success is taken as its outcome</li>
 *   <li>an upstream step that did not succeed skips it without invoking its unit</li>
 *   <li>otherwise its input is assembled once and its unit is invoked, retrying
 *       retryable failures; every attempt appends one result</li>
 * </ol>
 * A failed step does not stop independent branches.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
abstract class AbstractExecutionStrategy implements ExecutionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(AbstractExecutionStrategy.class);

    static final String MDC_STEP_ID = "stepId";

    private final AgentRegistry registry;
    private final OutputRouter router;
    private final StepInvoker invoker;
    private final WorkflowMetrics metrics;

    AbstractExecutionStrategy(AgentRegistry registry, OutputRouter router, StepInvoker invoker,
                              WorkflowMetrics metrics) {
        this.registry = registry;
        this.router = router;
        this.invoker = invoker;
        this.metrics = metrics;
    }

    /**
     * Handles a failed write to the run state store.
     *
     * @param execution the run
     * @param stepId    the step whose result was being written, or {@code null} for run metadata
     * @param e         the failure
     */
    protected abstract void onPersistenceFailure(RunExecution execution, String stepId, PersistenceException e);

    /**
     * @return a recorded success from an earlier execution of the run to reuse for the step
     */
    protected abstract Optional<StepResult> reusableResult(RunExecution execution, StepSpec step);

    @Override
    public Run execute(RunExecution execution) {
        Optional<RunFailure> preparationFailure = execution.getPreparationFailure();
        if (preparationFailure.isPresent()) {
            RunFailure failure = preparationFailure.get();
            logger.error("Run {} failed before any step ran: {}", execution.getKey(), failure.getMessage());
            execution.setRunFailure(failure);
            execution.transitionRun(RunStatus.FAILED, run -> run.failed(Instant.now(),
                    failure.getStepId().orElse(null), failure.getType(), failure.getMessage()));
            persistMetadata(execution, true);
            return execution.getRun();
        }

        execution.transitionRun(RunStatus.RUNNING, run -> run.started(Instant.now()));
        persistMetadata(execution, false);

        for (StepSpec step : execution.getOrder().getOrderedSteps()) {
            MDC.put(MDC_STEP_ID, step.getId());
            try {
                executeOrSkip(execution, step);
            } finally {
                MDC.remove(MDC_STEP_ID);
            }
        }
        return finish(execution);
    }

    private void executeOrSkip(RunExecution execution, StepSpec step) {
        String stepId = step.getId();
        if (execution.isCancelled()) {
            skip(execution, step, "Run cancelled");
            return;
        }
        if (execution.isPersistenceAborted()) {
            skip(execution, step, "Run aborted after a persistence failure");
            return;
        }

        Optional<StepResult> recorded = reusableResult(execution, step);
        if (recorded.isPresent()) {
            execution.restoreStep(stepId);
            logger.info("Reusing recorded result of step '{}' (attempt {})", stepId, recorded.get().getAttempt());
            return;
        }

        for (String upstreamId : execution.getOrder().upstreamOf(stepId)) {
            StepStatus upstreamStatus = execution.getStepStatus(upstreamId);
            if (upstreamStatus != StepStatus.SUCCESS) {
                skip(execution, step, "Upstream step '" + upstreamId + "' " + upstreamStatus.getValue());
                return;
            }
        }

        runStep(execution, step);
    }

    private void runStep(RunExecution execution, StepSpec step) {
        String stepId = step.getId();
        execution.transitionStep(stepId, StepStatus.RUNNING);
        int priorAttempts = (int) execution.getRun().getResultsFor(stepId).stream()
                .filter(result -> result.getStatus() != StepStatus.SKIPPED)
                .count();
        int firstAttempt = priorAttempts + 1;

        Map<String, Object> input;
        try {
            input = assembleInput(execution, step);
        } catch (ShapeException e) {
            failWithoutAttempt(execution, step, firstAttempt, FailureType.SHAPE, e.getMessage(), e);
            return;
        } catch (IOException e) {
            failWithoutAttempt(execution, step, firstAttempt, FailureType.INPUT,
                    "Failed to load input of step '" + stepId + "': " + e.getMessage(), e);
            return;
        }

        UnitOfWork unit;
        try {
            unit = registry.resolve(step.getAgent());
        } catch (UnknownAgentException e) {
            failWithoutAttempt(execution, step, firstAttempt, FailureType.UNKNOWN_AGENT, e.getMessage(), e);
            return;
        }

        RetryPolicy policy = execution.getOptions().getRetryPolicy();
        Duration timeout = execution.getOptions().getStepTimeout();
        int maxAttempts = maxAttempts(step.getRetries().orElse(policy.getMaxRetries()));
        String workflowId = execution.getKey().getWorkflowId();

        for (int tries = 1; ; tries++) {
            int attempt = priorAttempts + tries;
            StepContext context = new StepContext(execution.getKey(), stepId, step.getAgent(), attempt, step.getConfig());
            logger.debug("Dispatching step '{}' to agent '{}' (attempt {})", stepId, step.getAgent(), attempt);

            long started = System.nanoTime();
            FailureType type;
            Exception cause;
            try {
                Map<String, Object> output = invoker.invoke(unit, input, context, timeout);
                long durationMs = elapsedMs(started);
                recordExecuted(workflowId, step, durationMs);
                appendResult(execution, StepResult.success(stepId, attempt, output, durationMs));
                execution.transitionStep(stepId, StepStatus.SUCCESS);
                logger.debug("Step '{}' succeeded in {} ms", stepId, durationMs);
                return;
            } catch (StepInvoker.StepTimeoutException e) {
                type = FailureType.TIMEOUT;
                cause = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                type = FailureType.PROCESSING;
                cause = e;
            } catch (Exception e) {
                type = FailureType.PROCESSING;
                cause = e;
            }

            long durationMs = elapsedMs(started);
            String message = describe(cause);
            boolean retrying = tries < maxAttempts
                    && type.isRetryable()
                    && !execution.isCancelled()
                    && !execution.isPersistenceAborted()
                    && !Thread.currentThread().isInterrupted();
            if (retrying) {
                Duration delay = policy.delayBeforeRetry(tries);
                logger.warn("Step '{}' attempt {} of {} failed ({}), retrying in {} ms: {}",
                        stepId, tries, maxAttempts, type.getValue(), delay.toMillis(), message);
                retrying = awaitRetry(execution, delay);
            }
            // the attempt is recorded once it is known whether another one follows
            recordExecuted(workflowId, step, durationMs);
            if (metrics != null) {
                metrics.recordStepFailed(workflowId, step.getAgent(), type, retrying);
            }
            appendResult(execution, StepResult.failure(stepId, attempt, type, message, retrying, durationMs));

            if (!retrying || execution.isPersistenceAborted()) {
                logger.warn("Step '{}' failed after {} attempt(s): {}", stepId, tries, message);
                execution.transitionStep(stepId, StepStatus.FAILED);
                execution.recordFailure(new RunFailure(stepId, type, message, tries,
                        new ProcessingException(stepId, tries, message, cause)));
                return;
            }
        }
    }

    private static boolean awaitRetry(RunExecution execution, Duration delay) {
        try {
            return execution.awaitRetryDelay(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static int maxAttempts(int retries) {
        return retries == Integer.MAX_VALUE ? retries : retries + 1;
    }

    private Map<String, Object> assembleInput(RunExecution execution, StepSpec step)
            throws ShapeException, IOException {
        if (step.hasStaticInput()) {
            return router.staticInput(step, execution.getInitialInput());
        }
        String producerId = step.getInputFrom();
        StepSpec producer = execution.getDefinition().getStep(producerId)
                .orElseThrow(() -> new IllegalStateException("Unknown producer step: " + producerId));
        StepResult producerResult = execution.getRestoredResult(producerId)
                .or(() -> execution.getRun().getLatestResult(producerId).filter(StepResult::isSuccessful))
                .orElseThrow(() -> new IllegalStateException("Step '" + producerId + "' has no successful result"));
        return router.route(producerResult, producer, step);
    }

    private void failWithoutAttempt(RunExecution execution, StepSpec step, int attempt, FailureType type,
                                    String message, Exception cause) {
        logger.warn("Step '{}' failed before invoking agent '{}': {}", step.getId(), step.getAgent(), message);
        if (metrics != null) {
            metrics.recordStepFailed(execution.getKey().getWorkflowId(), step.getAgent(), type, false);
        }
        appendResult(execution, StepResult.failure(step.getId(), attempt, type, message, false, 0));
        execution.transitionStep(step.getId(), StepStatus.FAILED);
        execution.recordFailure(new RunFailure(step.getId(), type, message, 0, cause));
    }

    private void skip(RunExecution execution, StepSpec step, String reason) {
        logger.info("Skipping step '{}': {}", step.getId(), reason);
        execution.transitionStep(step.getId(), StepStatus.SKIPPED);
        appendResult(execution, StepResult.skipped(step.getId(), reason));
        if (metrics != null) {
            metrics.recordStepSkipped(execution.getKey().getWorkflowId(), step.getAgent());
        }
    }

    private Run finish(RunExecution execution) {
        Map<String, StepStatus> statuses = execution.getStepStatuses();
        boolean allSucceeded = statuses.values().stream().allMatch(status -> status == StepStatus.SUCCESS);
        Optional<RunFailure> persistenceFailure = execution.getPersistenceFailure();

        RunFailure failure = null;
        if (persistenceFailure.isPresent()) {
            failure = persistenceFailure.get();
        } else if (!allSucceeded && execution.isCancelled()) {
            Optional<RunFailure> stepFailure = execution.getFailure();
            failure = new RunFailure(stepFailure.flatMap(RunFailure::getStepId).orElse(null),
                    FailureType.CANCELLED, "Run cancelled",
                    stepFailure.map(RunFailure::getAttempts).orElse(0),
                    new RunCancelledException(execution.getKey()));
        } else if (!allSucceeded) {
            failure = execution.getFailure().orElseGet(() ->
                    new RunFailure(null, FailureType.PROCESSING, "Run did not complete every step", 0, null));
        }

        Instant end = Instant.now();
        if (failure == null) {
            execution.transitionRun(RunStatus.SUCCESS, run -> run.succeeded(end));
            logger.info("Run {} succeeded", execution.getKey());
        } else {
            RunFailure runFailure = failure;
            execution.setRunFailure(runFailure);
            execution.transitionRun(RunStatus.FAILED, run -> run.failed(end,
                    runFailure.getStepId().orElse(null), runFailure.getType(), runFailure.getMessage()));
            logger.error("Run {} failed ({}) at step '{}': {}", execution.getKey(), runFailure.getType().getValue(),
                    runFailure.getStepId().orElse("-"), runFailure.getMessage());
        }
        persistMetadata(execution, true);
        return execution.getRun();
    }

    /**
     * Appends a result to the run log and writes it to the store, unless an
     * earlier durable write already failed.
     */
    protected void appendResult(RunExecution execution, StepResult result) {
        execution.addResult(result);
        if (execution.isPersistenceAborted()) {
            return;
        }
        try {
            execution.getStore().appendStepResult(execution.getKey(), result);
        } catch (PersistenceException e) {
            onPersistenceFailure(execution, result.getStepId(), e);
        }
    }

    private void persistMetadata(RunExecution execution, boolean terminal) {
        if (execution.isPersistenceAborted() && !terminal) {
            return;
        }
        try {
            execution.getStore().saveRunMetadata(execution.getRun());
        } catch (PersistenceException e) {
            if (terminal) {
                logger.error("Failed to save final state of run {}: {}", execution.getKey(), e.getMessage(), e);
            } else {
                onPersistenceFailure(execution, null, e);
            }
        }
    }

    private void recordExecuted(String workflowId, StepSpec step, long durationMs) {
        if (metrics != null) {
            metrics.recordStepExecuted(workflowId, step.getAgent(), durationMs);
        }
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null && !message.isBlank()
                ? message
                : cause.getClass().getSimpleName();
    }
}
