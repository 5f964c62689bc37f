package io.genoflow.core.exception;

import java.io.Serial;
import java.util.Objects;

/// Base class for errors that prevent a plan from being compiled or executed.
///
/// Compile-time errors are fatal: no partial plan is produced and no task runs.
///
/// @see ErrorKind#isCompileTime()
public abstract class PlanValidationException extends Exception {

    @Serial private static final long serialVersionUID = 2790157434178650264L;

    private final ErrorKind kind;

    protected PlanValidationException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Returns the taxonomy entry for this error.
    ///
    /// @return error kind, never null
    public ErrorKind getKind() {
        return kind;
    }
}
