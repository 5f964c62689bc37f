package io.genoflow.core.execution;

import io.genoflow.core.exception.ErrorKind;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Result of one executor invocation: overall status plus the final per-task
/// result table.
///
/// @param runId identifier of the run, not null
/// @param status overall outcome, not null
/// @param results final result per task id in plan order, not null
/// @param haltReason why scheduling stopped early, only when halted
/// @param haltKind error kind behind the halt (`RUN_TIMEOUT` or `TASK_ERROR`), null when
///     not halted or when the run was interrupted
/// @param startedAt when the run started, not null
/// @param finishedAt when the run ended, not null
public record RunOutcome(
        String runId,
        RunStatus status,
        Map<String, TaskResult> results,
        String haltReason,
        ErrorKind haltKind,
        Instant startedAt,
        Instant finishedAt) {

    public RunOutcome {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        results =
                results != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(results))
                        : Map.of();
    }

    public Optional<TaskResult> result(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    public TaskStatus statusOf(String taskId) {
        return result(taskId)
                .map(TaskResult::status)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
    }

    /// Returns the ids of tasks with the given status, in plan order.
    ///
    /// @param taskStatus status to filter by, not null
    /// @return matching ids, never null
    public List<String> tasksWithStatus(TaskStatus taskStatus) {
        return results.values().stream()
                .filter(r -> r.status() == taskStatus)
                .map(TaskResult::taskId)
                .toList();
    }

    public boolean isAllSucceeded() {
        return status == RunStatus.ALL_SUCCEEDED;
    }

    public boolean isHalted() {
        return status == RunStatus.HALTED_ON_ERROR;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
