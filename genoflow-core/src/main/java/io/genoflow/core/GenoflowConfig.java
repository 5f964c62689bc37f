package io.genoflow.core;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/// Configuration options for the Genoflow execution environment.
///
/// Controls executor concurrency, the run-level timeout, failure handling and
/// which consistency checks run.
/// Use the {@link Builder} for fluent configuration or construct directly
/// with setters for mutable configuration.
///
/// ### Default Values
/// - `maxConcurrency`: `1` (strictly sequential execution)
/// - `runTimeout`: `null` (unlimited)
/// - `stopOnError`: `false` (independent tasks keep running after a failure)
/// - `disabledChecks`: empty (every default consistency check runs)
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link GenoflowFactory}.
/// Do not modify after environment creation.
///
/// @see GenoflowFactory#createEnvironment(GenoflowConfig, io.genoflow.core.task.TaskRegistry)
/// @see Builder
public class GenoflowConfig {
    private int maxConcurrency = 1;
    private Duration runTimeout;
    private boolean stopOnError;
    private Set<String> disabledChecks = Set.of();

    /// Creates a configuration with default values.
    public GenoflowConfig() {}

    /// Returns how many mutually independent tasks may run at once.
    ///
    /// @return worker count, `1` means sequential execution on the calling thread
    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /// Sets how many mutually independent tasks may run at once.
    ///
    /// ### Contracts
    /// - **Precondition**: `maxConcurrency` must be positive
    ///
    /// @param maxConcurrency worker count
    /// @throws IllegalArgumentException if `maxConcurrency` is below one
    public void setMaxConcurrency(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be positive: " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
    }

    /// Returns the run-level timeout.
    ///
    /// @return the timeout, or null when runs are unlimited
    public Duration getRunTimeout() {
        return runTimeout;
    }

    /// Sets the run-level timeout. When it elapses, scheduling stops and every
    /// task not yet running is skipped.
    ///
    /// @param runTimeout positive duration, or null for unlimited
    /// @throws IllegalArgumentException if the duration is zero or negative
    public void setRunTimeout(Duration runTimeout) {
        if (runTimeout != null && (runTimeout.isZero() || runTimeout.isNegative())) {
            throw new IllegalArgumentException("runTimeout must be positive: " + runTimeout);
        }
        this.runTimeout = runTimeout;
    }

    public boolean isStopOnError() {
        return stopOnError;
    }

    /// Enables halting the whole run at the first task failure.
    ///
    /// @param stopOnError `true` to skip every task not yet running after a failure
    public void setStopOnError(boolean stopOnError) {
        this.stopOnError = stopOnError;
    }

    /// Returns the names of default consistency checks that are switched off.
    ///
    /// @return immutable set of check names, never null
    public Set<String> getDisabledChecks() {
        return disabledChecks;
    }

    /// Switches off default consistency checks by name, e.g.
    /// `"population-frequency"` or `"score-evidence"`. Names are validated
    /// when the environment is created.
    ///
    /// @param disabledChecks check names, not null
    public void setDisabledChecks(Collection<String> disabledChecks) {
        Objects.requireNonNull(disabledChecks, "disabledChecks must not be null");
        this.disabledChecks = Collections.unmodifiableSet(new LinkedHashSet<>(disabledChecks));
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link GenoflowConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final GenoflowConfig config = new GenoflowConfig();

        public Builder maxConcurrency(int maxConcurrency) {
            config.setMaxConcurrency(maxConcurrency);
            return this;
        }

        public Builder runTimeout(Duration runTimeout) {
            config.setRunTimeout(runTimeout);
            return this;
        }

        public Builder stopOnError(boolean stopOnError) {
            config.stopOnError = stopOnError;
            return this;
        }

        public Builder disableCheck(String checkName) {
            Set<String> updated = new LinkedHashSet<>(config.disabledChecks);
            updated.add(Objects.requireNonNull(checkName, "checkName must not be null"));
            config.setDisabledChecks(updated);
            return this;
        }

        /// Builds and returns the configured {@link GenoflowConfig} instance.
        ///
        /// @return the configured instance, never null
        public GenoflowConfig build() {
            return config;
        }
    }
}
