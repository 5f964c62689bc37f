package io.genoflow.core.exception;

import java.io.Serial;
import java.util.Objects;

/// Base class for failures while substituting output references into a
/// task's configuration. Fails the owning task only.
public abstract class ReferenceResolutionException extends Exception {

    @Serial private static final long serialVersionUID = -7009315283563934025L;

    private final ErrorKind kind;
    private final String referencedTaskId;
    private final String outputKey;

    protected ReferenceResolutionException(
            ErrorKind kind, String referencedTaskId, String outputKey, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.referencedTaskId = referencedTaskId;
        this.outputKey = outputKey;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getReferencedTaskId() {
        return referencedTaskId;
    }

    public String getOutputKey() {
        return outputKey;
    }
}
