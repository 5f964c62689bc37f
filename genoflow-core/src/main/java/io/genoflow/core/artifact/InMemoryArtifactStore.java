package io.genoflow.core.artifact;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Artifact store backed by a concurrent map. Locators take the form
/// `mem://{taskId}/{name}`.
///
/// @implNote Thread-safe.
public final class InMemoryArtifactStore implements ArtifactStore {

    private static final String SCHEME = "mem://";

    private final Map<String, byte[]> artifacts = new ConcurrentHashMap<>();

    @Override
    public ArtifactRef write(String taskId, String name, byte[] content, String mediaType) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");

        String locator = SCHEME + taskId + "/" + name;
        artifacts.put(locator, content.clone());
        return new ArtifactRef(locator, mediaType);
    }

    @Override
    public Optional<byte[]> read(ArtifactRef ref) {
        Objects.requireNonNull(ref, "ref must not be null");
        byte[] content = artifacts.get(ref.locator());
        return content != null ? Optional.of(content.clone()) : Optional.empty();
    }

    @Override
    public boolean exists(ArtifactRef ref) {
        Objects.requireNonNull(ref, "ref must not be null");
        return artifacts.containsKey(ref.locator());
    }

    /// Returns the number of stored artifacts (useful for testing).
    public int size() {
        return artifacts.size();
    }
}
