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
import dev.mars.contentflow.exceptions.PersistenceException;
import dev.mars.contentflow.model.FailureType;
import dev.mars.contentflow.model.StepResult;
import dev.mars.contentflow.model.StrategyType;
import dev.mars.contentflow.workflow.OutputRouter;
import dev.mars.contentflow.workflow.StepSpec;
import dev.mars.contentflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Persists every step result as soon as it is produced so an interrupted run
 * can be continued under the same run id. On resumption the recorded success
 * of a step is reused and only the remaining steps execute.
 *
 * <p>Durability is required: a failed write aborts the run, skips the steps
 * that have not run and fails the run with {@link FailureType#PERSISTENCE}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
class ResumableExecutionStrategy extends AbstractExecutionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(ResumableExecutionStrategy.class);

    ResumableExecutionStrategy(AgentRegistry registry, OutputRouter router, StepInvoker invoker,
                               WorkflowMetrics metrics) {
        super(registry, router, invoker, metrics);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.RESUMABLE;
    }

    @Override
    protected void onPersistenceFailure(RunExecution execution, String stepId, PersistenceException e) {
        logger.error("Aborting run {}: could not persist {}: {}", execution.getKey(),
                stepId != null ? "result of step '" + stepId + "'" : "run metadata", e.getMessage(), e);
        execution.abortPersistence(new RunFailure(stepId, FailureType.PERSISTENCE,
                "Failed to persist run state: " + e.getMessage(), 0, e));
    }

    @Override
    protected Optional<StepResult> reusableResult(RunExecution execution, StepSpec step) {
        return execution.getRestoredResult(step.getId());
    }
}
