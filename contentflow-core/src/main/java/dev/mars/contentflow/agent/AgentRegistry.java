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

import dev.mars.contentflow.exceptions.UnknownAgentException;

import java.util.Set;

/**
 * Maps agent names used in workflow definitions to units of work.
 * Lookups are case-insensitive. Implementations must be safe for concurrent reads.
 */
public interface AgentRegistry {

    /**
     * Registers a unit of work, replacing any previous registration of the same name.
     *
     * @param name       the agent name steps refer to
     * @param unitOfWork the implementation
     */
    void register(String name, UnitOfWork unitOfWork);

    /**
     * Looks up a unit of work.
     *
     * @param name the agent name
     * @return the registered unit of work
     * @throws UnknownAgentException if nothing is registered under the name
     */
    UnitOfWork resolve(String name) throws UnknownAgentException;

    boolean isRegistered(String name);

    /**
     * @return {@code true} if a registration was removed
     */
    boolean unregister(String name);

    /**
     * @return the registered names, sorted
     */
    Set<String> getRegisteredNames();
}
