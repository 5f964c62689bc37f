package io.genoflow.core.execution;

/// Lifecycle status of one task within a run.
///
/// Transitions only move forward:
/// ```
/// PENDING → RUNNING → SUCCEEDED | FAILED
/// PENDING → FAILED | SKIPPED
/// ```
/// Nothing leaves a terminal status.
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    /// Returns whether no further transition is allowed.
    ///
    /// @return true for succeeded, failed and skipped
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    /// Returns whether moving from this status to `next` is allowed.
    ///
    /// A pending task may fail without running when its configuration
    /// cannot be resolved.
    ///
    /// @param next target status, not null
    /// @return true if the transition is legal
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED || next == SKIPPED;
            case RUNNING -> next == SUCCEEDED || next == FAILED;
            case SUCCEEDED, FAILED, SKIPPED -> false;
        };
    }
}
