package io.genoflow.core.exception;

import java.io.Serial;

/// Thrown when run parameters are missing or inconsistent, or when a plan
/// requests a task type the registry does not know.
public class InvalidConfigurationException extends PlanValidationException {

    @Serial private static final long serialVersionUID = -4410927795630187711L;

    public InvalidConfigurationException(String message) {
        super(ErrorKind.INVALID_CONFIGURATION, message);
    }
}
