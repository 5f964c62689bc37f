package io.genoflow.core.exception;

import java.io.Serial;
import java.util.Objects;

/// Failure signalled by a task body.
///
/// The `kind` is chosen by the body (e.g. `"io"`, `"remote_service"`,
/// `"invalid_input"`) and is preserved together with the message in the
/// task's result. The executor never retries; retry policy belongs to the body.
public class TaskExecutionException extends Exception {

    @Serial private static final long serialVersionUID = 8140318553406672145L;

    /// Kind used when the registry has no body for a task type.
    public static final String UNKNOWN_TASK_TYPE = "unknown_task_type";

    private final String kind;

    public TaskExecutionException(String kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public TaskExecutionException(String kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Returns the body-defined failure kind.
    ///
    /// @return failure kind, never null
    public String getKind() {
        return kind;
    }
}
