package io.genoflow.core.execution;

import io.genoflow.core.artifact.ArtifactStore;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.state.RunSnapshot;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Everything one executor invocation needs besides the executor's own configuration.
///
/// ### Usage
/// {@snippet :
/// RunOutcome outcome = executor.run(RunRequest.of(plan)
///         .withArtifactStore(new FileSystemArtifactStore(outputDir))
///         .withService(EmbeddingClient.class, client)
///         .withListener(new CheckpointingRunListener(repository)));
/// }
///
/// @param runId identifier for the run, null to generate one
/// @param plan plan to execute, not null
/// @param priorResults results of an earlier attempt to resume from, not null
/// @param artifactStore store for large outputs, null for an in-memory store
/// @param services typed shared services for task bodies, not null
/// @param listener per-run listener, not null
public record RunRequest(
        String runId,
        Plan plan,
        Map<String, TaskResult> priorResults,
        ArtifactStore artifactStore,
        Map<Class<?>, Object> services,
        RunListener listener) {

    public RunRequest {
        Objects.requireNonNull(plan, "plan must not be null");
        priorResults =
                priorResults != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(priorResults))
                        : Map.of();
        services =
                services != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(services))
                        : Map.of();
        listener = listener != null ? listener : RunListener.NOOP;
    }

    /// Creates a request for a fresh run of a plan.
    ///
    /// @param plan plan to execute, not null
    /// @return new request, never null
    public static RunRequest of(Plan plan) {
        return new RunRequest(null, plan, null, null, null, null);
    }

    /// Creates a request that continues a checkpointed run under the same run id.
    ///
    /// @param snapshot last checkpoint of the run, not null
    /// @return new request, never null
    public static RunRequest resume(RunSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        return new RunRequest(
                snapshot.runId(), snapshot.plan(), snapshot.results(), null, null, null);
    }

    public RunRequest withRunId(String newRunId) {
        return new RunRequest(newRunId, plan, priorResults, artifactStore, services, listener);
    }

    public RunRequest withPriorResults(Map<String, TaskResult> results) {
        return new RunRequest(runId, plan, results, artifactStore, services, listener);
    }

    public RunRequest withArtifactStore(ArtifactStore store) {
        return new RunRequest(runId, plan, priorResults, store, services, listener);
    }

    public RunRequest withListener(RunListener newListener) {
        return new RunRequest(runId, plan, priorResults, artifactStore, services, newListener);
    }

    /// Returns a copy with one more shared service.
    ///
    /// @param type lookup key, not null
    /// @param service the instance, not null
    /// @param <T> service type
    /// @return new request, never null
    public <T> RunRequest withService(Class<T> type, T service) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(service, "service must not be null");
        Map<Class<?>, Object> updated = new LinkedHashMap<>(services);
        updated.put(type, service);
        return new RunRequest(runId, plan, priorResults, artifactStore, updated, listener);
    }
}
