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
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileManager.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
class FileManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteAtomicallyCreatesParentsAndReplaces() throws Exception {
        Path target = tempDir.resolve("nested").resolve("run_metadata.json");

        FileManager.writeAtomically(target, "{\"v\":1}".getBytes(StandardCharsets.UTF_8));
        FileManager.writeAtomically(target, "{\"v\":2}".getBytes(StandardCharsets.UTF_8));

        assertEquals("{\"v\":2}", Files.readString(target));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(1, files.count(), "temporary files must not be left behind");
        }
    }

    @Test
    void testCreateTempFileUsesTargetDirectory() throws Exception {
        Path target = tempDir.resolve("archive").resolve("run_archive.json");

        Path temp = FileManager.createTempFile(target, ".tmp");

        assertEquals(target.getParent(), temp.getParent());
        assertTrue(temp.getFileName().toString().startsWith("run_archive_"));
        assertTrue(temp.getFileName().toString().endsWith(".tmp"));
    }
}
