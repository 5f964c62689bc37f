package io.genoflow.core.artifact;

import java.io.IOException;
import java.util.Optional;

/// Storage for task outputs too large to hold inline.
///
/// Reachable from {@link io.genoflow.core.execution.RunContext#getArtifactStore()}.
/// Implementations must tolerate concurrent writes from different tasks;
/// two tasks never write the same `(taskId, name)` pair.
///
/// @see InMemoryArtifactStore
/// @see FileSystemArtifactStore
public interface ArtifactStore {

    /// Stores content produced by a task.
    ///
    /// @param taskId the producing task, not null
    /// @param name artifact name unique within the task (e.g. `scores.tsv`), not null
    /// @param content raw bytes, not null
    /// @param mediaType content type hint, may be null
    /// @return locator for the stored artifact, never null
    /// @throws IOException if the content cannot be written
    ArtifactRef write(String taskId, String name, byte[] content, String mediaType)
            throws IOException;

    /// Reads a previously stored artifact.
    ///
    /// @param ref locator returned by {@link #write}, not null
    /// @return the content, or empty if the artifact does not exist
    /// @throws IOException if the content exists but cannot be read
    Optional<byte[]> read(ArtifactRef ref) throws IOException;

    /// Returns whether an artifact exists.
    ///
    /// @param ref locator to check, not null
    /// @return true if {@link #read} would return content
    boolean exists(ArtifactRef ref);
}
