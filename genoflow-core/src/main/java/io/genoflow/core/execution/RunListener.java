package io.genoflow.core.execution;

import io.genoflow.core.plan.TaskSpec;
import io.genoflow.core.state.RunSnapshot;

/// Listener for run lifecycle events.
///
/// All methods have no-op defaults, so listeners override only what they need.
/// Exceptions thrown by a listener are logged by the executor and never break
/// the run.
///
/// ### Callback Lifecycle
/// ```
/// onRunStart(context)
///   onTaskStart(task, context)      task is Running, config resolved
///   onTaskComplete(task, result)    task reached Succeeded or Failed
///   onCheckpoint(snapshot)          after every terminal transition, skips included
/// onRunComplete(outcome)
/// ```
///
/// @implNote With a concurrency above one, `onTaskStart` arrives on worker
/// threads. The other callbacks are made from the scheduling thread.
///
/// @see CheckpointingRunListener for persisting checkpoints
public interface RunListener {

    default void onRunStart(RunContext context) {}

    default void onTaskStart(TaskSpec task, RunContext context) {}

    default void onTaskComplete(TaskSpec task, TaskResult result) {}

    /// Called when the run state is consistent and safe to persist.
    ///
    /// @param snapshot the current run state, not null
    default void onCheckpoint(RunSnapshot snapshot) {}

    default void onRunComplete(RunOutcome outcome) {}

    /// No-op listener instance that ignores all events.
    RunListener NOOP = new RunListener() {};
}
