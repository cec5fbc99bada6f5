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

import dev.mars.contentflow.model.Run;
import dev.mars.contentflow.model.StrategyType;

/**
 * Drives one prepared run from {@code PENDING} to a terminal status.
 * The engine picks the implementation by the run's {@link StrategyType}.
 */
interface ExecutionStrategy {

    StrategyType getType();

    /**
     * Executes every step of the run that still has to run.
     *
     * @param execution the prepared run
     * @return the finished run
     */
    Run execute(RunExecution execution);
}
