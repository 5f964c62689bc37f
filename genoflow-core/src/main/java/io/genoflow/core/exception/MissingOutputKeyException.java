package io.genoflow.core.exception;

import java.io.Serial;

/// Thrown when a referenced task succeeded but did not produce the requested key.
public class MissingOutputKeyException extends ReferenceResolutionException {

    @Serial private static final long serialVersionUID = -2425836520361394102L;

    public MissingOutputKeyException(String referencedTaskId, String outputKey) {
        super(
                ErrorKind.MISSING_OUTPUT_KEY,
                referencedTaskId,
                outputKey,
                "Task '" + referencedTaskId + "' has no output named '" + outputKey + "'");
    }
}
