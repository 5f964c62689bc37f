package io.genoflow.core.storage;

import io.genoflow.core.state.RunSnapshot;
import java.util.List;
import java.util.Optional;

/// Repository for run state persistence.
///
/// Provides checkpoint/restore for runs that may be interrupted. Each run id
/// maps to its latest snapshot.
///
/// ### Usage
/// {@snippet :
/// // Save checkpoint
/// repository.save(snapshot);
///
/// // Resume from checkpoint
/// repository.findByRunId(runId).ifPresent(executor::resume);
/// }
///
/// @see InMemoryRunStateRepository for the in-memory implementation
public interface RunStateRepository {

    /// Saves a snapshot, replacing any earlier snapshot of the same run.
    ///
    /// @param snapshot the state to persist, not null
    /// @throws NullPointerException if snapshot is null
    /// @throws RunStateStorageException if the snapshot cannot be written
    void save(RunSnapshot snapshot);

    /// Finds the latest snapshot of a run.
    ///
    /// @param runId the run identifier, not null
    /// @return the snapshot if found, empty otherwise
    /// @throws RunStateStorageException if stored state exists but cannot be read
    Optional<RunSnapshot> findByRunId(String runId);

    /// Finds runs whose latest snapshot still has unfinished tasks.
    ///
    /// @return incomplete snapshots, never null
    List<RunSnapshot> findIncomplete();

    /// Deletes the snapshot of a run.
    ///
    /// @param runId the run to delete, not null
    /// @return true if a snapshot was deleted, false if not found
    boolean delete(String runId);
}
