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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * File helpers for the filesystem run state store. Whole-file records are
 * replaced by writing a sibling temporary file and moving it over the target,
 * so readers see either the old or the new content.
 */
public final class FileManager {
    private static final Logger logger = LoggerFactory.getLogger(FileManager.class);

    private FileManager() {
    }

    public static void ensureDirectoryExists(Path filePath) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null && !Files.exists(parentDir)) {
            Files.createDirectories(parentDir);
            logger.debug("Created directory: {}", parentDir);
        }
    }

    public static Path createTempFile(Path targetFile, String suffix) throws IOException {
        Path parentDir = targetFile.getParent();
        if (parentDir == null) {
            parentDir = Paths.get(".");
        }
        Files.createDirectories(parentDir);

        String fileName = targetFile.getFileName().toString();
        String baseName = fileName.contains(".") ?
                fileName.substring(0, fileName.lastIndexOf('.')) : fileName;

        return Files.createTempFile(parentDir, baseName + "_", suffix);
    }

    /**
     * Moves a file over its target, atomically where the filesystem supports it.
     */
    public static void moveFile(Path source, Path target) throws IOException {
        ensureDirectoryExists(target);
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Replaces the content of a file through a temporary sibling file.
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = createTempFile(target, ".tmp");
        boolean moved = false;
        try {
            Files.write(temp, content);
            moveFile(temp, target);
            moved = true;
        } finally {
            if (!moved) {
                deleteQuietly(temp);
            }
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Failed to delete temporary file: {} - {}", path, e.getMessage());
        }
    }
}
