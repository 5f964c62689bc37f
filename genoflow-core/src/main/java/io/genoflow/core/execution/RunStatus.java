package io.genoflow.core.execution;

/// Overall outcome of a run.
public enum RunStatus {

    /// Every task succeeded.
    ALL_SUCCEEDED,

    /// The run completed scheduling, but at least one task failed or was skipped.
    PARTIALLY_FAILED,

    /// Scheduling stopped early, because of a run timeout or a failure with
    /// stop-on-error enabled.
    HALTED_ON_ERROR
}
