package io.genoflow.core.execution;

import io.genoflow.core.plan.ConfigValues;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Runtime record of one task's execution.
///
/// Immutable; each status transition yields a new instance. Only the graph
/// executor creates transitions, under the task's lock in {@link TaskResultStore}.
///
/// ### Contracts
/// - **Precondition**: `error` only when failed; `skipReason` only when skipped
/// - **Postcondition**: `outputs` is unmodifiable, keeps the body's key order and holds
///   numbers in canonical form (see {@link ConfigValues#normalizeOutputs(Map)}), so a
///   persisted result reads back equal
/// - **Invariant**: transitions follow {@link TaskStatus#canTransitionTo(TaskStatus)};
///   anything else throws `IllegalStateException`
///
/// @param taskId id of the task, not null
/// @param status current status, not null
/// @param outputs named outputs (inline values or {@link io.genoflow.core.artifact.ArtifactRef}), not null
/// @param error failure details, only when failed
/// @param skipReason why the task was skipped, only when skipped
/// @param startedAt when the task started running, may be null
/// @param finishedAt when the task reached a terminal status, may be null
public record TaskResult(
        String taskId,
        TaskStatus status,
        Map<String, Object> outputs,
        TaskFailure error,
        String skipReason,
        Instant startedAt,
        Instant finishedAt) {

    public TaskResult {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        outputs = ConfigValues.normalizeOutputs(outputs);
        if (error != null && status != TaskStatus.FAILED) {
            throw new IllegalArgumentException("error is only allowed on failed results");
        }
        if (status == TaskStatus.FAILED && error == null) {
            throw new IllegalArgumentException("failed result requires an error");
        }
        if (skipReason != null && status != TaskStatus.SKIPPED) {
            throw new IllegalArgumentException("skipReason is only allowed on skipped results");
        }
    }

    /// Creates the initial result of a task.
    ///
    /// @param taskId task id, not null
    /// @return pending result, never null
    public static TaskResult pending(String taskId) {
        return new TaskResult(taskId, TaskStatus.PENDING, null, null, null, null, null);
    }

    public TaskResult start(Instant at) {
        checkTransition(TaskStatus.RUNNING);
        return new TaskResult(taskId, TaskStatus.RUNNING, null, null, null, at, null);
    }

    /// Records successful completion.
    ///
    /// @param producedOutputs outputs returned by the body, null treated as empty
    /// @param at completion time, not null
    /// @return succeeded result, never null
    /// @throws IllegalStateException if the task is not running
    public TaskResult succeed(Map<String, Object> producedOutputs, Instant at) {
        checkTransition(TaskStatus.SUCCEEDED);
        return new TaskResult(
                taskId, TaskStatus.SUCCEEDED, producedOutputs, null, null, startedAt, at);
    }

    public TaskResult fail(TaskFailure failure, Instant at) {
        Objects.requireNonNull(failure, "failure must not be null");
        checkTransition(TaskStatus.FAILED);
        return new TaskResult(taskId, TaskStatus.FAILED, null, failure, null, startedAt, at);
    }

    /// Records that the task will not run.
    ///
    /// @param reason human-readable reason, not null
    /// @param at skip time, not null
    /// @return skipped result, never null
    /// @throws IllegalStateException if the task is not pending
    public TaskResult skip(String reason, Instant at) {
        Objects.requireNonNull(reason, "reason must not be null");
        checkTransition(TaskStatus.SKIPPED);
        return new TaskResult(taskId, TaskStatus.SKIPPED, null, null, reason, null, at);
    }

    public boolean isSucceeded() {
        return status == TaskStatus.SUCCEEDED;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void checkTransition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition for task '" + taskId + "': " + status + " -> " + next);
        }
    }
}
