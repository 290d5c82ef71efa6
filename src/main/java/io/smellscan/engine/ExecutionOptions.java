package io.smellscan.engine;

import io.smellscan.report.FailurePolicy;

import java.time.Duration;
import java.util.Optional;

/**
 * Caller-supplied knobs of one module run.
 *
 * @param workerCount    size of the worker pool, at least 1
 * @param timeout        wall-clock limit for the whole module, or null for none
 * @param updateBaseline when true, nothing is filtered by the baseline and a new one is produced
 * @param failurePolicy  pass/fail decision applied to the aggregated result
 */
public record ExecutionOptions(
        int workerCount,
        Duration timeout,
        boolean updateBaseline,
        FailurePolicy failurePolicy
) {
    public ExecutionOptions {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        if (failurePolicy == null) {
            failurePolicy = FailurePolicy.DEFAULT;
        }
    }

    public static ExecutionOptions defaults() {
        return builder().build();
    }

    public Optional<Duration> timeoutIfAny() {
        return Optional.ofNullable(timeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int workerCount = Runtime.getRuntime().availableProcessors();
        private Duration timeout;
        private boolean updateBaseline;
        private FailurePolicy failurePolicy = FailurePolicy.DEFAULT;

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder updateBaseline(boolean updateBaseline) {
            this.updateBaseline = updateBaseline;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(workerCount, timeout, updateBaseline, failurePolicy);
        }
    }
}
