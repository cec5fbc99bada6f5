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
import dev.mars.contentflow.model.StepResult;
import dev.mars.contentflow.model.StrategyType;
import dev.mars.contentflow.workflow.OutputRouter;
import dev.mars.contentflow.workflow.StepSpec;
import dev.mars.contentflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Single pass over the steps. Writes to the run state store are best effort:
 * a failed write is logged and the run carries on.
 */
class PlainExecutionStrategy extends AbstractExecutionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(PlainExecutionStrategy.class);

    PlainExecutionStrategy(AgentRegistry registry, OutputRouter router, StepInvoker invoker,
                           WorkflowMetrics metrics) {
        super(registry, router, invoker, metrics);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.PLAIN;
    }

    @Override
    protected void onPersistenceFailure(RunExecution execution, String stepId, PersistenceException e) {
        logger.warn("Could not persist {} of run {}, continuing: {}",
                stepId != null ? "result of step '" + stepId + "'" : "run metadata",
                execution.getKey(), e.getMessage());
    }

    @Override
    protected Optional<StepResult> reusableResult(RunExecution execution, StepSpec step) {
        return Optional.empty();
    }
}
