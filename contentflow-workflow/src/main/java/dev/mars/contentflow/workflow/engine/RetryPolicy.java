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

package dev.mars.contentflow.workflow.engine;

import dev.mars.contentflow.config.ContentFlowConfiguration;
import dev.mars.contentflow.model.RetryBackoff;

import java.time.Duration;
import java.util.Objects;

/**
 * How often a failed step is retried and how long to wait between attempts.
 *
 * <p>With {@link RetryBackoff#FIXED} every retry waits the base delay. With
 * {@link RetryBackoff#EXPONENTIAL} retry {@code n} waits
 * {@code baseDelay * 2^(n-1)}, capped at the maximum delay.</p>
 */
public final class RetryPolicy {

    private static final RetryPolicy NONE = new RetryPolicy(0, RetryBackoff.FIXED, Duration.ZERO, Duration.ZERO);

    private final int maxRetries;
    private final RetryBackoff backoff;
    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetryPolicy(int maxRetries, RetryBackoff backoff, Duration baseDelay, Duration maxDelay) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.backoff = Objects.requireNonNull(backoff, "Backoff cannot be null");
        this.baseDelay = Objects.requireNonNull(baseDelay, "Base delay cannot be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "Max delay cannot be null");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays cannot be negative");
        }
    }

    public static RetryPolicy none() {
        return NONE;
    }

    public static RetryPolicy fixed(int maxRetries, Duration delay) {
        return new RetryPolicy(maxRetries, RetryBackoff.FIXED, delay, delay);
    }

    public static RetryPolicy exponential(int maxRetries, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxRetries, RetryBackoff.EXPONENTIAL, baseDelay, maxDelay);
    }

    public static RetryPolicy fromConfiguration(ContentFlowConfiguration configuration) {
        return new RetryPolicy(configuration.getMaxRetries(), configuration.getRetryBackoff(),
                Duration.ofMillis(configuration.getRetryDelayMs()),
                Duration.ofMillis(configuration.getRetryMaxDelayMs()));
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public RetryBackoff getBackoff() {
        return backoff;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    /**
     * @param retryNumber the retry about to happen, starting at 1
     * @return the wait before that retry
     */
    public Duration delayBeforeRetry(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("Retry number starts at 1: " + retryNumber);
        }
        if (backoff == RetryBackoff.FIXED) {
            return baseDelay;
        }
        long baseMs = baseDelay.toMillis();
        long capMs = Math.max(baseMs, maxDelay.toMillis());
        int shift = Math.min(retryNumber - 1, 30);
        long delayMs = baseMs > (capMs >> shift) ? capMs : baseMs << shift;
        return Duration.ofMillis(Math.min(delayMs, capMs));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxRetries == that.maxRetries &&
               backoff == that.backoff &&
               baseDelay.equals(that.baseDelay) &&
               maxDelay.equals(that.maxDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, backoff, baseDelay, maxDelay);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxRetries=" + maxRetries +
                ", backoff=" + backoff +
                ", baseDelay=" + baseDelay +
                ", maxDelay=" + maxDelay +
                '}';
    }
}
