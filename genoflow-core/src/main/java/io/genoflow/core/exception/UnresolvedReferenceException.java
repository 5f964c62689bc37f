package io.genoflow.core.exception;

import java.io.Serial;

/// Thrown when a referenced task has not succeeded at resolution time.
///
/// Dependency-ordered execution makes this unreachable; seeing it means the
/// executor scheduled a task before one of its producers finished.
public class UnresolvedReferenceException extends ReferenceResolutionException {

    @Serial private static final long serialVersionUID = 5152766381072337781L;

    public UnresolvedReferenceException(String referencedTaskId, String outputKey, String status) {
        super(
                ErrorKind.UNRESOLVED_REFERENCE,
                referencedTaskId,
                outputKey,
                "Cannot resolve ${output."
                        + referencedTaskId
                        + "."
                        + outputKey
                        + "}: task is "
                        + status);
    }
}
