package io.genoflow.core.plan;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Compiled, immutable task graph for one analysis run.
///
/// Produced by a {@link Planner}, or loaded verbatim from storage to drive a
/// later execution without re-planning. Task order is the declaration order;
/// plans produced by {@link TemplatePlanner} are declared in topological order.
///
/// Plans are not validated on construction. {@link PlanValidator} checks
/// unique ids, known dependencies, acyclicity and declared references; the
/// planner and the executor both run it.
///
/// @param tasks task specs in declaration order, not null
/// @param metadata creation timestamp, format version and run parameters, not null
/// @see TaskSpec for individual nodes
/// @see TaskGraph for ordering queries
public record Plan(List<TaskSpec> tasks, PlanMetadata metadata) {

    public Plan {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    /// Creates a hand-built plan with fresh metadata and no run parameters.
    ///
    /// @param tasks task specs, not null
    /// @return new plan, never null
    public static Plan of(List<TaskSpec> tasks) {
        return new Plan(tasks, PlanMetadata.now(null, Map.of()));
    }

    public static Plan of(TaskSpec... tasks) {
        return of(List.of(tasks));
    }

    /// Looks up a task by id.
    ///
    /// @param taskId task id, not null
    /// @return the first task with that id, or empty
    public Optional<TaskSpec> task(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    /// Returns task ids in declaration order.
    ///
    /// @return ids, never null
    public List<String> taskIds() {
        return tasks.stream().map(TaskSpec::id).toList();
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    /// Returns a copy whose metadata carries a different creation timestamp.
    ///
    /// @param createdAt new timestamp, not null
    /// @return new plan, never null
    public Plan withCreatedAt(Instant createdAt) {
        return new Plan(tasks, metadata.withCreatedAt(createdAt));
    }
}
