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

package dev.mars.contentflow.agent;

import java.util.Map;

/**
 * The capability contract every agent fulfils: take an input payload, return an output payload.
 *
 * <p>Implementations are opaque to the engine. Any exception thrown from
 * {@link #process(Map)} is treated as a processing failure of the step and is
 * subject to the step's retry policy. Implementations should respond to thread
 * interruption, which is how a step timeout is delivered.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
@FunctionalInterface
public interface UnitOfWork {

    /**
     * Processes one input payload.
     *
     * @param input the assembled step input, never {@code null}
     * @return the step output; {@code null} is recorded as an empty output
     * @throws Exception if processing fails
     */
    Map<String, Object> process(Map<String, Object> input) throws Exception;

    /**
     * Processes one input payload with access to the step's configuration and
     * identity. Units that need their step {@code config} override this method.
     *
     * @param input   the assembled step input
     * @param context the step being executed
     * @return the step output
     * @throws Exception if processing fails
     */
    default Map<String, Object> process(Map<String, Object> input, StepContext context) throws Exception {
        return process(input);
    }
}
