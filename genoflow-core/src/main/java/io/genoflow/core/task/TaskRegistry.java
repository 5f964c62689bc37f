package io.genoflow.core.task;

import io.genoflow.core.exception.TaskExecutionException;
import io.genoflow.core.execution.RunContext;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Registry mapping task-type identifiers to task bodies and their contracts.
///
/// The plan compiler consults it to reject plans requesting unknown task types,
/// the executor dispatches through {@link #invoke}, and the consistency checker
/// reads declared contracts.
///
/// @see DefaultTaskRegistry for the default implementation
public interface TaskRegistry {

    /// Registers a body together with the contract of its type.
    ///
    /// @apiNote **Side effects**: replaces any registration for the same type.
    ///
    /// @param contract the type's declared outputs and ranges, not null
    /// @param body the unit of work, not null
    void register(TaskContract contract, TaskBody body);

    /// Registers a body with an open contract.
    ///
    /// @param type task-type identifier, not null
    /// @param body the unit of work, not null
    default void register(String type, TaskBody body) {
        register(TaskContract.open(type), body);
    }

    Optional<TaskBody> getBody(String type);

    Optional<TaskContract> getContract(String type);

    boolean contains(String type);

    /// Returns the registered type identifiers.
    ///
    /// @return immutable set of types, never null
    Set<String> types();

    /// Invokes the body registered for a type.
    ///
    /// @param type task-type identifier, not null
    /// @param resolvedConfig configuration with references substituted, not null
    /// @param context the current run, not null
    /// @return outputs returned by the body, may be null
    /// @throws TaskExecutionException if the type is unknown or the body fails
    default Map<String, Object> invoke(
            String type, Map<String, Object> resolvedConfig, RunContext context)
            throws TaskExecutionException {
        TaskBody body =
                getBody(type)
                        .orElseThrow(
                                () ->
                                        new TaskExecutionException(
                                                TaskExecutionException.UNKNOWN_TASK_TYPE,
                                                "No task body registered for type: " + type));
        return body.invoke(resolvedConfig, context);
    }
}
