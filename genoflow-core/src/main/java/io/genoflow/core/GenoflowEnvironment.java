package io.genoflow.core;

import io.genoflow.core.critic.ConsistencyChecker;
import io.genoflow.core.execution.GraphExecutor;
import io.genoflow.core.plan.Planner;
import io.genoflow.core.storage.RunStateRepository;
import io.genoflow.core.task.TaskRegistry;

/// Container holding the wired Genoflow components: planner, executor,
/// consistency checker and their shared registry and run-state repository.
///
/// ### Contracts
/// - **Precondition**: all constructor parameters must be non-null
/// - **Postcondition**: all getters return the same instances passed to constructor
///
/// @implNote Safe for concurrent reads. All fields are final and set at
/// construction time; the contained components document their own thread safety.
///
/// @apiNote Create instances via {@link GenoflowFactory} rather than direct construction.
public final class GenoflowEnvironment {

    private final GenoflowConfig config;
    private final TaskRegistry taskRegistry;
    private final Planner planner;
    private final GraphExecutor graphExecutor;
    private final ConsistencyChecker consistencyChecker;
    private final RunStateRepository runStateRepository;

    public GenoflowEnvironment(
            GenoflowConfig config,
            TaskRegistry taskRegistry,
            Planner planner,
            GraphExecutor graphExecutor,
            ConsistencyChecker consistencyChecker,
            RunStateRepository runStateRepository) {
        this.config = config;
        this.taskRegistry = taskRegistry;
        this.planner = planner;
        this.graphExecutor = graphExecutor;
        this.consistencyChecker = consistencyChecker;
        this.runStateRepository = runStateRepository;
    }

    public GenoflowConfig getConfig() {
        return config;
    }

    public TaskRegistry getTaskRegistry() {
        return taskRegistry;
    }

    /// Returns the planner compiling run parameters into plans.
    ///
    /// @return the planner, never null
    public Planner getPlanner() {
        return planner;
    }

    public GraphExecutor getGraphExecutor() {
        return graphExecutor;
    }

    public ConsistencyChecker getConsistencyChecker() {
        return consistencyChecker;
    }

    /// Returns the repository that receives run checkpoints.
    ///
    /// Defaults to {@link io.genoflow.core.storage.InMemoryRunStateRepository}
    /// when no custom implementation is registered via {@link GenoflowFactory.Builder}.
    ///
    /// @return the run state repository, never null
    public RunStateRepository getRunStateRepository() {
        return runStateRepository;
    }
}
