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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory agent registry keyed by lower-cased agent name.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class DefaultAgentRegistry implements AgentRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DefaultAgentRegistry.class);

    private final Map<String, UnitOfWork> units = new ConcurrentHashMap<>();

    public DefaultAgentRegistry() {
    }

    public DefaultAgentRegistry(Map<String, ? extends UnitOfWork> initial) {
        if (initial != null) {
            initial.forEach(this::register);
        }
    }

    @Override
    public void register(String name, UnitOfWork unitOfWork) {
        String key = normalize(name);
        Objects.requireNonNull(unitOfWork, "Unit of work cannot be null");
        UnitOfWork previous = units.put(key, unitOfWork);
        if (previous != null) {
            logger.info("Replaced unit of work for agent: {}", key);
        } else {
            logger.info("Registered agent: {}", key);
        }
    }

    /**
     * Registers an existing unit of work under an additional name.
     */
    public void registerAlias(String alias, String existingName) throws UnknownAgentException {
        UnitOfWork unit = resolve(existingName);
        units.put(normalize(alias), unit);
        logger.info("Registered agent alias: {} -> {}", alias, existingName);
    }

    @Override
    public UnitOfWork resolve(String name) throws UnknownAgentException {
        if (name == null) {
            throw new UnknownAgentException("null");
        }
        UnitOfWork unit = units.get(name.trim().toLowerCase(Locale.ROOT));
        if (unit == null) {
            throw new UnknownAgentException(name);
        }
        return unit;
    }

    @Override
    public boolean isRegistered(String name) {
        return name != null && units.containsKey(name.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean unregister(String name) {
        if (name == null) {
            return false;
        }
        boolean removed = units.remove(name.trim().toLowerCase(Locale.ROOT)) != null;
        if (removed) {
            logger.info("Unregistered agent: {}", name);
        }
        return removed;
    }

    @Override
    public Set<String> getRegisteredNames() {
        return Collections.unmodifiableSet(new TreeSet<>(units.keySet()));
    }

    private static String normalize(String name) {
        Objects.requireNonNull(name, "Agent name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Agent name cannot be blank");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "DefaultAgentRegistry{agents=" + getRegisteredNames() + '}';
    }
}
