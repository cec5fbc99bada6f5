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

/**
 * How the delay between two attempts of a failing step grows.
 */
public enum RetryBackoff {

    /** Every retry waits the base delay. */
    FIXED,

    /** Retry {@code n} waits {@code base * 2^(n-1)}, capped at the maximum delay. */
    EXPONENTIAL;

    public static RetryBackoff fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Retry backoff value must not be null");
        }
        for (RetryBackoff backoff : values()) {
            if (backoff.name().equalsIgnoreCase(value.trim())) {
                return backoff;
            }
        }
        throw new IllegalArgumentException("Unknown retry backoff: " + value);
    }
}
