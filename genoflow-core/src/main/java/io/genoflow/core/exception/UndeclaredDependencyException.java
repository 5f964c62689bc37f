package io.genoflow.core.exception;

import java.io.Serial;

/// Thrown when a task's config references the output of a task that is not
/// listed in its `dependsOn`.
///
/// Data flow must always be reflected in execution order, even when the
/// producing task happens to precede the consumer topologically.
public class UndeclaredDependencyException extends PlanValidationException {

    @Serial private static final long serialVersionUID = 3871200435560912057L;

    private final String taskId;
    private final String referencedTaskId;
    private final String outputKey;

    public UndeclaredDependencyException(String taskId, String referencedTaskId, String outputKey) {
        super(
                ErrorKind.UNDECLARED_DEPENDENCY,
                "Task '"
                        + taskId
                        + "' references output '"
                        + outputKey
                        + "' of task '"
                        + referencedTaskId
                        + "' without declaring it in dependsOn");
        this.taskId = taskId;
        this.referencedTaskId = referencedTaskId;
        this.outputKey = outputKey;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getReferencedTaskId() {
        return referencedTaskId;
    }

    public String getOutputKey() {
        return outputKey;
    }
}
