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

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * Generates run ids.
 */
public class RunIdGenerator {

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public RunIdGenerator() {
        this(Clock.systemUTC());
    }

    public RunIdGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public String generate(RunIdMode mode) {
        Objects.requireNonNull(mode, "Run id mode cannot be null");
        return switch (mode) {
            case RANDOM -> UUID.randomUUID().toString();
            case TIMESTAMP -> TIMESTAMP_FORMAT.format(clock.instant());
        };
    }
}
