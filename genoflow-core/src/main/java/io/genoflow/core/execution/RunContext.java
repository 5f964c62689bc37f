package io.genoflow.core.execution;

import io.genoflow.core.artifact.ArtifactStore;
import io.genoflow.core.artifact.InMemoryArtifactStore;
import io.genoflow.core.plan.Plan;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// State for one executor invocation, handed to every task body.
///
/// Holds the plan being executed, the run's {@link TaskResultStore}, the
/// artifact store and typed shared services (model clients, caches) supplied
/// by the caller. Created at run start and discarded at run end; never shared
/// between concurrent runs.
///
/// ### Required Fields
/// - `runId` - identifier of this run
/// - `plan` - plan being executed
/// - `results` - per-task results of this run
///
/// ### Optional Services
/// - `artifactStore` - defaults to an {@link InMemoryArtifactStore}
/// - typed services registered with {@link Builder#service(Class, Object)}
///
/// @implNote Immutable after construction; thread-safe for reads. The result
/// store it references is itself thread-safe.
public final class RunContext {

    private final String runId;
    private final Plan plan;
    private final TaskResultStore results;
    private final ArtifactStore artifactStore;
    private final Map<Class<?>, Object> services;

    private RunContext(Builder builder) {
        this.runId = builder.runId;
        this.plan = builder.plan;
        this.results = builder.results;
        this.artifactStore = builder.artifactStore;
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(builder.services));
    }

    public String getRunId() {
        return runId;
    }

    public Plan getPlan() {
        return plan;
    }

    /// Returns the results of this run. Bodies may read upstream results but
    /// cannot write them.
    ///
    /// @return result store, never null
    public TaskResultStore getResults() {
        return results;
    }

    public ArtifactStore getArtifactStore() {
        return artifactStore;
    }

    /// Looks up a shared service by type.
    ///
    /// @param type service type, not null
    /// @param <T> service type
    /// @return the service, or empty if none was registered
    public <T> Optional<T> getService(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return Optional.ofNullable(type.cast(services.get(type)));
    }

    /// Looks up a shared service that must be present.
    ///
    /// @param type service type, not null
    /// @param <T> service type
    /// @return the service, never null
    /// @throws IllegalStateException if no service of that type was registered
    public <T> T requireService(Class<T> type) {
        return getService(type)
                .orElseThrow(
                        () ->
                                new IllegalStateException(
                                        "No service registered for " + type.getName()));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link RunContext}.
    ///
    /// Required fields: `runId`, `plan`, `results`
    public static final class Builder {
        private String runId;
        private Plan plan;
        private TaskResultStore results;
        private ArtifactStore artifactStore;
        private final Map<Class<?>, Object> services = new LinkedHashMap<>();

        private Builder() {}

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder plan(Plan plan) {
            this.plan = plan;
            return this;
        }

        public Builder results(TaskResultStore results) {
            this.results = results;
            return this;
        }

        public Builder artifactStore(ArtifactStore artifactStore) {
            this.artifactStore = artifactStore;
            return this;
        }

        /// Registers a shared service under its type.
        ///
        /// @param type lookup key, not null
        /// @param service the instance, not null
        /// @param <T> service type
        /// @return this builder
        public <T> Builder service(Class<T> type, T service) {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(service, "service must not be null");
            services.put(type, service);
            return this;
        }

        Builder services(Map<Class<?>, Object> all) {
            services.putAll(all);
            return this;
        }

        /// Builds the context.
        ///
        /// @return new context, never null
        /// @throws NullPointerException if a required field is missing
        public RunContext build() {
            Objects.requireNonNull(runId, "runId must not be null");
            Objects.requireNonNull(plan, "plan must not be null");
            Objects.requireNonNull(results, "results must not be null");
            if (artifactStore == null) {
                artifactStore = new InMemoryArtifactStore();
            }
            return new RunContext(this);
        }
    }
}
