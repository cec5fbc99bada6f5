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

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RunIdGeneratorTest {

    @Test
    void testTimestampIdsSortChronologically() {
        RunIdGenerator early = new RunIdGenerator(Clock.fixed(Instant.parse("2025-09-02T09:59:59.999Z"), ZoneOffset.UTC));
        RunIdGenerator late = new RunIdGenerator(Clock.fixed(Instant.parse("2025-09-02T10:00:00.000Z"), ZoneOffset.UTC));

        String first = early.generate(RunIdMode.TIMESTAMP);
        String second = late.generate(RunIdMode.TIMESTAMP);

        assertEquals("2025-09-02T09-59-59-999Z", first);
        assertEquals("2025-09-02T10-00-00-000Z", second);
        assertTrue(first.compareTo(second) < 0);
    }

    @Test
    void testRandomIdsAreUuids() {
        String id = new RunIdGenerator().generate(RunIdMode.RANDOM);

        assertEquals(id, UUID.fromString(id).toString());
    }

    @Test
    void testRunIdModeFromValue() {
        assertEquals(RunIdMode.RANDOM, RunIdMode.fromValue(" random "));
        assertThrows(IllegalArgumentException.class, () -> RunIdMode.fromValue("sequence"));
        assertThrows(NullPointerException.class, () -> new RunIdGenerator().generate(null));
    }
}
