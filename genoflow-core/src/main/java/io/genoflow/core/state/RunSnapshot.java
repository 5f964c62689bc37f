package io.genoflow.core.state;

import io.genoflow.core.execution.TaskResult;
import io.genoflow.core.plan.Plan;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable snapshot of a run for persistence and resume.
///
/// Emitted by the executor after every terminal task transition. Passing a
/// snapshot back to
/// {@link io.genoflow.core.execution.GraphExecutor#resume(RunSnapshot)}
/// continues the run: succeeded tasks keep their outputs, everything else runs again.
///
/// ### Contracts
/// - **Precondition**: `runId` and `plan` must not be null
/// - **Postcondition**: all fields immutable after construction
///
/// ### Usage
/// {@snippet :
/// repository.save(snapshot);
/// // after a crash
/// RunSnapshot restored = repository.findByRunId(runId).orElseThrow();
/// RunOutcome outcome = executor.resume(restored);
/// }
///
/// @param runId identifier of the run, not null
/// @param plan plan being executed, not null
/// @param results result per task id, not null
/// @param createdAt when this snapshot was taken, not null after construction
/// @param checkpointReason why this checkpoint was taken, may be null
public record RunSnapshot(
        String runId,
        Plan plan,
        Map<String, TaskResult> results,
        Instant createdAt,
        String checkpointReason) {

    public RunSnapshot {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
        results =
                results != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(results))
                        : Map.of();
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /// Creates a snapshot stamped now.
    ///
    /// @param runId run id, not null
    /// @param plan plan, not null
    /// @param results current results, not null
    /// @param reason checkpoint reason, may be null
    /// @return new snapshot, never null
    public static RunSnapshot of(
            String runId, Plan plan, Map<String, TaskResult> results, String reason) {
        return new RunSnapshot(runId, plan, results, Instant.now(), reason);
    }

    /// Returns whether every task of the plan reached a terminal status.
    ///
    /// @return true if nothing is left to schedule
    public boolean isComplete() {
        return plan.taskIds().stream()
                .allMatch(id -> results.containsKey(id) && results.get(id).isTerminal());
    }
}
