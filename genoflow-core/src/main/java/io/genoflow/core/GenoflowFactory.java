package io.genoflow.core;

import io.genoflow.core.critic.ConsistencyChecker;
import io.genoflow.core.execution.CheckpointingRunListener;
import io.genoflow.core.execution.GraphExecutor;
import io.genoflow.core.plan.PlanTemplate;
import io.genoflow.core.plan.TemplatePlanner;
import io.genoflow.core.plan.VariantAnalysisTemplate;
import io.genoflow.core.storage.InMemoryRunStateRepository;
import io.genoflow.core.storage.RunStateRepository;
import io.genoflow.core.task.TaskRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Factory for creating and wiring Genoflow environments.
///
/// Provides static factory methods and a fluent {@link Builder} for constructing
/// fully-configured {@link GenoflowEnvironment} instances.
///
/// ### Usage Patterns
///
/// **Defaults with a populated registry**:
/// {@snippet :
/// var env = GenoflowFactory.createEnvironment(registry);
/// Plan plan = env.getPlanner().compile(parameters);
/// RunOutcome outcome = env.getGraphExecutor().run(plan);
/// FindingsReport report = env.getConsistencyChecker().check(plan, outcome);
/// }
///
/// **Builder with file-backed checkpoints**:
/// {@snippet :
/// var env = GenoflowFactory.builder()
///     .config(GenoflowConfig.builder().maxConcurrency(4).build())
///     .taskRegistry(registry)
///     .runStateRepository(new FileRunStateRepository(runsDir))
///     .build();
/// }
///
/// Every environment checkpoints runs into its run-state repository.
///
/// @see GenoflowEnvironment
/// @see GenoflowConfig
public final class GenoflowFactory {

    private GenoflowFactory() {}

    /// Creates an environment with default configuration.
    ///
    /// @param taskRegistry registry holding the task bodies, not null
    /// @return a fully-configured environment, never null
    public static GenoflowEnvironment createEnvironment(TaskRegistry taskRegistry) {
        return createEnvironment(new GenoflowConfig(), taskRegistry);
    }

    /// Creates an environment with the built-in templates, an in-memory
    /// run-state repository and the given configuration.
    ///
    /// @param config concurrency, timeout and stop-on-error settings, not null
    /// @param taskRegistry registry holding the task bodies, not null
    /// @return a fully-configured environment, never null
    public static GenoflowEnvironment createEnvironment(
            GenoflowConfig config, TaskRegistry taskRegistry) {
        return builder().config(config).taskRegistry(taskRegistry).build();
    }

    /// Returns the templates every environment starts with.
    ///
    /// @return built-in templates, never null
    public static List<PlanTemplate> builtInTemplates() {
        return List.of(new VariantAnalysisTemplate());
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link GenoflowEnvironment}.
    ///
    /// Required: `taskRegistry`. Everything else has a default.
    public static final class Builder {
        private GenoflowConfig config = new GenoflowConfig();
        private TaskRegistry taskRegistry;
        private final List<PlanTemplate> templates = new ArrayList<>(builtInTemplates());
        private RunStateRepository runStateRepository;

        private Builder() {}

        public Builder config(GenoflowConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder taskRegistry(TaskRegistry taskRegistry) {
            this.taskRegistry = taskRegistry;
            return this;
        }

        /// Adds a template next to the built-in ones.
        ///
        /// @param template template to add, not null
        /// @return this builder
        public Builder template(PlanTemplate template) {
            templates.add(Objects.requireNonNull(template, "template must not be null"));
            return this;
        }

        public Builder runStateRepository(RunStateRepository runStateRepository) {
            this.runStateRepository = runStateRepository;
            return this;
        }

        /// Wires the environment.
        ///
        /// @return a fully-configured environment, never null
        /// @throws NullPointerException if no task registry was set
        /// @throws IllegalArgumentException if two templates share an analysis type, or a
        ///     disabled check name matches no default check
        public GenoflowEnvironment build() {
            Objects.requireNonNull(taskRegistry, "taskRegistry must not be null");
            RunStateRepository repository =
                    runStateRepository != null ? runStateRepository : new InMemoryRunStateRepository();

            TemplatePlanner planner = new TemplatePlanner(templates, taskRegistry);
            GraphExecutor executor = new GraphExecutor(taskRegistry, config);
            executor.addListener(new CheckpointingRunListener(repository));
            ConsistencyChecker checker =
                    new ConsistencyChecker(
                            taskRegistry,
                            ConsistencyChecker.defaultChecks(config.getDisabledChecks()),
                            Clock.systemUTC());

            return new GenoflowEnvironment(
                    config, taskRegistry, planner, executor, checker, repository);
        }
    }
}
