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
import dev.mars.contentflow.model.StrategyType;
import dev.mars.contentflow.storage.RunIdMode;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-run execution settings. Defaults come from {@link ContentFlowConfiguration}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public final class ExecutionOptions {

    private final StrategyType strategy;
    private final boolean persistenceEnabled;
    private final RetryPolicy retryPolicy;
    private final Duration stepTimeout;
    private final RunIdMode runIdMode;
    private final String runId;

    private ExecutionOptions(Builder builder) {
        this.strategy = Objects.requireNonNull(builder.strategy, "Strategy cannot be null");
        this.persistenceEnabled = builder.persistenceEnabled;
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "Retry policy cannot be null");
        this.stepTimeout = builder.stepTimeout != null ? builder.stepTimeout : Duration.ZERO;
        this.runIdMode = Objects.requireNonNull(builder.runIdMode, "Run id mode cannot be null");
        this.runId = builder.runId;
        if (stepTimeout.isNegative()) {
            throw new IllegalArgumentException("Step timeout cannot be negative: " + stepTimeout);
        }
        if (strategy == StrategyType.RESUMABLE && !persistenceEnabled) {
            throw new IllegalArgumentException("The resumable strategy requires persistence to be enabled");
        }
    }

    /**
     * Options with the built-in configuration defaults, without reading
     * configuration files or system properties.
     */
    public static ExecutionOptions defaults() {
        return builder().build();
    }

    public static ExecutionOptions fromConfiguration(ContentFlowConfiguration configuration) {
        return builder(configuration).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(ContentFlowConfiguration configuration) {
        return new Builder()
                .strategy(configuration.getStrategy())
                .persistenceEnabled(configuration.isPersistenceEnabled())
                .retryPolicy(RetryPolicy.fromConfiguration(configuration))
                .stepTimeout(Duration.ofMillis(configuration.getStepTimeoutMs()))
                .runIdMode(configuration.getRunIdMode());
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public boolean isPersistenceEnabled() {
        return persistenceEnabled;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * @return the per-attempt timeout, {@link Duration#ZERO} meaning none
     */
    public Duration getStepTimeout() {
        return stepTimeout;
    }

    public RunIdMode getRunIdMode() {
        return runIdMode;
    }

    /**
     * @return the caller-chosen run id, used to resume an existing run
     */
    public Optional<String> getRunId() {
        return Optional.ofNullable(runId);
    }

    public Builder toBuilder() {
        return new Builder()
                .strategy(strategy)
                .persistenceEnabled(persistenceEnabled)
                .retryPolicy(retryPolicy)
                .stepTimeout(stepTimeout)
                .runIdMode(runIdMode)
                .runId(runId);
    }

    @Override
    public String toString() {
        return "ExecutionOptions{" +
                "strategy=" + strategy +
                ", persistenceEnabled=" + persistenceEnabled +
                ", retryPolicy=" + retryPolicy +
                ", stepTimeout=" + stepTimeout +
                ", runIdMode=" + runIdMode +
                (runId != null ? ", runId='" + runId + '\'' : "") +
                '}';
    }

    public static class Builder {
        private static final ContentFlowConfiguration DEFAULTS = new ContentFlowConfiguration(null);

        private StrategyType strategy = DEFAULTS.getStrategy();
        private boolean persistenceEnabled = DEFAULTS.isPersistenceEnabled();
        private RetryPolicy retryPolicy = RetryPolicy.fromConfiguration(DEFAULTS);
        private Duration stepTimeout = Duration.ofMillis(DEFAULTS.getStepTimeoutMs());
        private RunIdMode runIdMode = DEFAULTS.getRunIdMode();
        private String runId;

        public Builder strategy(StrategyType strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder persistenceEnabled(boolean persistenceEnabled) {
            this.persistenceEnabled = persistenceEnabled;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.retryPolicy = new RetryPolicy(maxRetries, retryPolicy.getBackoff(),
                    retryPolicy.getBaseDelay(), retryPolicy.getMaxDelay());
            return this;
        }

        public Builder stepTimeout(Duration stepTimeout) {
            this.stepTimeout = stepTimeout;
            return this;
        }

        public Builder runIdMode(RunIdMode runIdMode) {
            this.runIdMode = runIdMode;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
