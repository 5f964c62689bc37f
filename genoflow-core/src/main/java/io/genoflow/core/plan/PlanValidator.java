package io.genoflow.core.plan;

import io.genoflow.core.exception.InvalidConfigurationException;
import io.genoflow.core.exception.PlanValidationException;
import io.genoflow.core.exception.UndeclaredDependencyException;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/// Structural validation shared by the planner and the executor.
///
/// ### Checks, in order
/// 1. Task ids are unique, else `InvalidConfiguration`
/// 2. Every `dependsOn` id exists in the plan, else `UnknownDependency`
/// 3. A topological order exists, else `CyclicDependency`
/// 4. Every output reference names a task in the referencing task's
///    `dependsOn`, else `UndeclaredDependency`
///
/// The fourth check holds even when the referenced task precedes the consumer
/// by coincidence: data flow must be visible in the declared edges.
public final class PlanValidator {

    private PlanValidator() {}

    /// Validates a plan and returns its dependency graph.
    ///
    /// @param plan the plan to check, not null
    /// @return the plan's graph, never null
    /// @throws PlanValidationException on the first failing check
    public static TaskGraph validate(Plan plan) throws PlanValidationException {
        Objects.requireNonNull(plan, "plan must not be null");

        Set<String> seen = new HashSet<>();
        for (TaskSpec task : plan.tasks()) {
            if (!seen.add(task.id())) {
                throw new InvalidConfigurationException("Duplicate task id: " + task.id());
            }
        }

        TaskGraph graph = TaskGraph.of(plan);

        for (TaskSpec task : graph.topologicalOrder()) {
            for (OutputReference ref : task.references()) {
                if (!task.dependsOn(ref.taskId())) {
                    throw new UndeclaredDependencyException(task.id(), ref.taskId(), ref.outputKey());
                }
            }
        }
        return graph;
    }
}
