package io.genoflow.core.execution;

import io.genoflow.core.exception.ErrorKind;
import io.genoflow.core.exception.ReferenceResolutionException;
import io.genoflow.core.exception.TaskExecutionException;
import java.util.Objects;

/// Error captured for a failed task.
///
/// @param category phase in which the failure occurred, not null
/// @param kind body-defined or resolver-defined failure kind, not null
/// @param message failure message kept verbatim, never null after construction
public record TaskFailure(ErrorKind category, String kind, String message) {

    public TaskFailure {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        message = message != null ? message : "";
    }

    /// Captures a failure signalled by a task body.
    ///
    /// @param e the body's exception, not null
    /// @return failure in the `TASK_ERROR` category, never null
    public static TaskFailure from(TaskExecutionException e) {
        return new TaskFailure(ErrorKind.TASK_ERROR, e.getKind(), e.getMessage());
    }

    /// Captures a reference that could not be substituted into the task's config.
    ///
    /// @param e the resolver's exception, not null
    /// @return failure categorised by the resolution error kind, never null
    public static TaskFailure from(ReferenceResolutionException e) {
        return new TaskFailure(e.getKind(), e.getKind().name().toLowerCase(), e.getMessage());
    }

    /// Captures an unchecked exception escaping a task body. The kind is the
    /// exception's simple class name.
    ///
    /// @param e the exception, not null
    /// @return failure in the `TASK_ERROR` category, never null
    public static TaskFailure unexpected(RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        return new TaskFailure(ErrorKind.TASK_ERROR, e.getClass().getSimpleName(), message);
    }
}
