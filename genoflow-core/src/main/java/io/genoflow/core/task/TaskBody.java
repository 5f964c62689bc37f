package io.genoflow.core.task;

import io.genoflow.core.exception.TaskExecutionException;
import io.genoflow.core.execution.RunContext;
import java.util.Map;

/// Capability implemented by every task type: turn a resolved configuration
/// into named outputs.
///
/// Bodies are black boxes to the executor. They may perform I/O against
/// external collaborators (files, model servers, evidence databases), write
/// large results to the run's {@link io.genoflow.core.artifact.ArtifactStore}
/// and return {@link io.genoflow.core.artifact.ArtifactRef} locators as outputs.
///
/// ### Contracts
/// - **Precondition**: `config` has every output reference already substituted
/// - **Postcondition**: returns the task's outputs; `null` is treated as no outputs
///
/// @implNote A single body instance serves every task of its type, possibly
/// from several worker threads at once. Keep per-run state in the
/// {@link RunContext}, not in fields.
///
/// @see TaskRegistry for registration
@FunctionalInterface
public interface TaskBody {

    /// Executes one task.
    ///
    /// @param config the task's configuration with references resolved, not null, unmodifiable
    /// @param context the current run, not null
    /// @return named outputs, may be null
    /// @throws TaskExecutionException to fail the task with a body-defined kind
    Map<String, Object> invoke(Map<String, Object> config, RunContext context)
            throws TaskExecutionException;
}
