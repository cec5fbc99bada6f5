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

/**
 * How new run ids are generated.
 */
public enum RunIdMode {

    /**
     * UTC creation time, {@code yyyy-MM-dd'T'HH-mm-ss-SSS'Z'}. Sorts chronologically
     * and is readable in directory listings.
     */
    TIMESTAMP,

    /** Random UUID. */
    RANDOM;

    public static RunIdMode fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Run id mode value must not be null");
        }
        for (RunIdMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown run id mode: " + value);
    }
}
