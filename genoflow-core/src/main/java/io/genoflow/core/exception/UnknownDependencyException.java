package io.genoflow.core.exception;

import java.io.Serial;

/// Thrown when a task depends on an id that is not part of the same plan.
public class UnknownDependencyException extends PlanValidationException {

    @Serial private static final long serialVersionUID = 7355020318262211790L;

    private final String taskId;
    private final String dependencyId;

    public UnknownDependencyException(String taskId, String dependencyId) {
        super(
                ErrorKind.UNKNOWN_DEPENDENCY,
                "Task '" + taskId + "' depends on unknown task '" + dependencyId + "'");
        this.taskId = taskId;
        this.dependencyId = dependencyId;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getDependencyId() {
        return dependencyId;
    }
}
