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

import dev.mars.contentflow.agent.StepContext;
import dev.mars.contentflow.agent.UnitOfWork;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls a unit of work, bounded by the step timeout. With a timeout the call
 * runs on a separate thread which is interrupted when the timeout expires.
 */
class StepInvoker {

    private final ExecutorService executor;

    StepInvoker(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * @throws StepTimeoutException if the unit did not return in time
     * @throws ExecutionException   wrapping an {@link Error} thrown by the unit
     * @throws Exception            whatever else the unit threw
     */
    Map<String, Object> invoke(UnitOfWork unit, Map<String, Object> input, StepContext context,
                               Duration timeout) throws Exception {
        if (timeout.isZero()) {
            try {
                return unit.process(input, context);
            } catch (Error e) {
                throw new ExecutionException(e);
            }
        }

        Future<Map<String, Object>> future = executor.submit(() -> unit.process(input, context));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StepTimeoutException(context.getStepId(), timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    /**
     * Thrown when a step attempt exceeds its timeout.
     */
    static class StepTimeoutException extends Exception {
        StepTimeoutException(String stepId, Duration timeout) {
            super("Step '" + stepId + "' timed out after " + timeout.toMillis() + " ms");
        }
    }
}
