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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for a unit of work. Runs a script per call and records every
 * input and context it was invoked with.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
class ScriptedUnit implements UnitOfWork {

    @FunctionalInterface
    interface Script {
        Map<String, Object> run(Map<String, Object> input, StepContext context) throws Exception;
    }

    private final Script script;
    private final AtomicInteger invocations = new AtomicInteger();
    private final List<Map<String, Object>> inputs = new CopyOnWriteArrayList<>();
    private final List<StepContext> contexts = new CopyOnWriteArrayList<>();

    ScriptedUnit(Script script) {
        this.script = script;
    }

    static ScriptedUnit returning(Map<String, Object> output) {
        return new ScriptedUnit((input, context) -> output);
    }

    static ScriptedUnit failing(String message) {
        return new ScriptedUnit((input, context) -> {
            throw new IllegalStateException(message);
        });
    }

    /**
     * Fails every attempt up to and including {@code failedAttempts}, then returns the output.
     */
    static ScriptedUnit failingUntil(int failedAttempts, Map<String, Object> output) {
        return new ScriptedUnit((input, context) -> {
            if (context.getAttempt() <= failedAttempts) {
                throw new IllegalStateException("flaky attempt " + context.getAttempt());
            }
            return output;
        });
    }

    @Override
    public Map<String, Object> process(Map<String, Object> input) throws Exception {
        throw new UnsupportedOperationException("invoked without a step context");
    }

    @Override
    public Map<String, Object> process(Map<String, Object> input, StepContext context) throws Exception {
        invocations.incrementAndGet();
        inputs.add(input);
        contexts.add(context);
        return script.run(input, context);
    }

    int getInvocations() {
        return invocations.get();
    }

    Map<String, Object> lastInput() {
        return inputs.get(inputs.size() - 1);
    }

    StepContext lastContext() {
        return contexts.get(contexts.size() - 1);
    }
}
