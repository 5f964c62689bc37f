package io.genoflow.core.storage;

import java.io.Serial;

/// Thrown when a run-state repository cannot read or write persisted state.
public class RunStateStorageException extends RuntimeException {

    @Serial private static final long serialVersionUID = 2318419550736101734L;

    public RunStateStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
