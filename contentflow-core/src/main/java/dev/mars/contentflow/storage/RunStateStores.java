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

package dev.mars.contentflow.storage;

import dev.mars.contentflow.config.ContentFlowConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the run state store selected by configuration.
 */
public final class RunStateStores {
    private static final Logger logger = LoggerFactory.getLogger(RunStateStores.class);

    private RunStateStores() {
    }

    public static RunStateStore fromConfiguration(ContentFlowConfiguration configuration) {
        RunIdGenerator idGenerator = new RunIdGenerator();
        int archiveMaxEntries = configuration.getArchiveMaxEntries();
        String type = configuration.getStorageType();
        switch (type) {
            case "memory":
                logger.info("Using in-memory run state store");
                return new InMemoryRunStateStore(idGenerator, archiveMaxEntries);
            case "filesystem":
                logger.info("Using filesystem run state store at {}", configuration.getStorageDirectory().toAbsolutePath());
                return new FileSystemRunStateStore(configuration.getStorageDirectory(), idGenerator, archiveMaxEntries);
            default:
                throw new IllegalArgumentException("Unknown storage type: " + type);
        }
    }
}
