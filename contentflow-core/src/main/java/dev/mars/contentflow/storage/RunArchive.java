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

import dev.mars.contentflow.model.ArchiveEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, newest-first archive list operations shared by the store implementations.
 * Callers hold the workflow's archive lock while applying them.
 */
final class RunArchive {

    private RunArchive() {
    }

    /**
     * Returns the archive after adding an entry. An entry for the same run replaces
     * the existing one in place; a new run goes to the front and the oldest entries
     * beyond {@code maxEntries} are dropped.
     */
    static List<ArchiveEntry> append(List<ArchiveEntry> current, ArchiveEntry entry, int maxEntries) {
        List<ArchiveEntry> updated = new ArrayList<>(current);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getRunId().equals(entry.getRunId())) {
                updated.set(i, entry);
                return updated;
            }
        }
        updated.add(0, entry);
        while (updated.size() > maxEntries) {
            updated.remove(updated.size() - 1);
        }
        return updated;
    }
}
