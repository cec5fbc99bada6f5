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

package dev.mars.contentflow.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RunKeyTest {

    @Test
    void testValidKey() {
        RunKey key = RunKey.of("daily_digest", "2025-09-02T10-15-30-123Z");

        assertEquals("daily_digest", key.getWorkflowId());
        assertEquals("2025-09-02T10-15-30-123Z", key.getRunId());
        assertEquals("daily_digest/2025-09-02T10-15-30-123Z", key.toString());
    }

    @Test
    void testEquality() {
        assertEquals(RunKey.of("wf", "r1"), RunKey.of("wf", "r1"));
        assertEquals(RunKey.of("wf", "r1").hashCode(), RunKey.of("wf", "r1").hashCode());
        assertNotEquals(RunKey.of("wf", "r1"), RunKey.of("wf", "r2"));
        assertNotEquals(RunKey.of("wf", "r1"), RunKey.of("other", "r1"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "a/b", "..", ".", "run id", "x\\y"})
    void testRejectsUnsafeSegments(String value) {
        assertThrows(IllegalArgumentException.class, () -> RunKey.of("wf", value));
        assertThrows(IllegalArgumentException.class, () -> RunKey.of(value, "r1"));
    }

    @Test
    void testRejectsNull() {
        assertThrows(NullPointerException.class, () -> RunKey.of(null, "r1"));
        assertThrows(NullPointerException.class, () -> RunKey.of("wf", null));
    }
}
