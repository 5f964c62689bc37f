package io.genoflow.core.exception;

/// Error taxonomy shared by plan validation, reference resolution and task execution.
///
/// ### Phases
/// - **Compile time** (fatal, no plan produced): {@link #INVALID_CONFIGURATION},
///   {@link #UNKNOWN_DEPENDENCY}, {@link #CYCLIC_DEPENDENCY}, {@link #UNDECLARED_DEPENDENCY}
/// - **Resolution time** (fails the owning task only): {@link #UNRESOLVED_REFERENCE},
///   {@link #MISSING_OUTPUT_KEY}
/// - **Task time** (fails the owning task, skips its dependents): {@link #TASK_ERROR}
/// - **Run level** (halts scheduling): {@link #RUN_TIMEOUT}
public enum ErrorKind {

    /// Required run parameters missing or mutually inconsistent.
    INVALID_CONFIGURATION,

    /// A `dependsOn` entry names a task absent from the plan.
    UNKNOWN_DEPENDENCY,

    /// The dependency relation contains a cycle.
    CYCLIC_DEPENDENCY,

    /// A config value references a task the owning task does not depend on.
    UNDECLARED_DEPENDENCY,

    /// A referenced task had not succeeded when its output was needed.
    UNRESOLVED_REFERENCE,

    /// A referenced output key is absent from the producing task's outputs.
    MISSING_OUTPUT_KEY,

    /// The task body signalled a failure.
    TASK_ERROR,

    /// The configured run timeout elapsed.
    RUN_TIMEOUT;

    /// Returns whether this kind is raised while compiling or validating a plan.
    ///
    /// @return true for the four plan-validation kinds
    public boolean isCompileTime() {
        return this == INVALID_CONFIGURATION
                || this == UNKNOWN_DEPENDENCY
                || this == CYCLIC_DEPENDENCY
                || this == UNDECLARED_DEPENDENCY;
    }
}
