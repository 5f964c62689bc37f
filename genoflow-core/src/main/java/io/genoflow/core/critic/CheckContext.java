package io.genoflow.core.critic;

import io.genoflow.core.execution.TaskResult;
import io.genoflow.core.execution.TaskStatus;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.plan.TaskSpec;
import io.genoflow.core.task.TaskContract;
import io.genoflow.core.task.TaskRegistry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Read-only view of a finished run shared by all checks.
///
/// Task order follows the plan's declaration order. Contracts come from the
/// task registry; types registered without one, or not registered at all,
/// have no contract and are ignored by contract-driven checks.
public final class CheckContext {

    private final Plan plan;
    private final Map<String, TaskResult> results;
    private final TaskRegistry taskRegistry;

    public CheckContext(Plan plan, Map<String, TaskResult> results, TaskRegistry taskRegistry) {
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.results =
                Collections.unmodifiableMap(
                        new LinkedHashMap<>(Objects.requireNonNull(results, "results must not be null")));
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "taskRegistry must not be null");
    }

    public Plan plan() {
        return plan;
    }

    public List<TaskSpec> tasks() {
        return plan.tasks();
    }

    public Optional<TaskSpec> task(String taskId) {
        return plan.task(taskId);
    }

    public Optional<TaskResult> result(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    /// Returns the status of a task, treating tasks without a result as pending.
    ///
    /// @param taskId task id, not null
    /// @return status, never null
    public TaskStatus status(String taskId) {
        return result(taskId).map(TaskResult::status).orElse(TaskStatus.PENDING);
    }

    public boolean succeeded(String taskId) {
        return status(taskId) == TaskStatus.SUCCEEDED;
    }

    /// Returns the succeeded tasks of one type in plan order.
    ///
    /// @param type task-type identifier, not null
    /// @return tasks, never null
    public List<TaskSpec> succeededTasksOfType(String type) {
        return plan.tasks().stream()
                .filter(task -> task.type().equals(type) && succeeded(task.id()))
                .toList();
    }

    /// Returns one output value of a task.
    ///
    /// @param taskId task id, not null
    /// @param outputKey output key, not null
    /// @return the value, or empty if the task has no result or no such output
    public Optional<Object> output(String taskId, String outputKey) {
        return result(taskId).map(r -> r.outputs().get(outputKey));
    }

    /// Returns the declared contract of a task's type.
    ///
    /// @param task the task, not null
    /// @return contract, or empty if the type declares none
    public Optional<TaskContract> contractOf(TaskSpec task) {
        return taskRegistry.getContract(task.type());
    }

    /// Returns whether at least one task reached succeeded or failed.
    ///
    /// @return true if some task body completed
    public boolean hasCompletedTasks() {
        return results.values().stream()
                .anyMatch(
                        r -> r.status() == TaskStatus.SUCCEEDED || r.status() == TaskStatus.FAILED);
    }
}
