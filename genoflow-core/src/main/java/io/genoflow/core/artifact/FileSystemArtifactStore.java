package io.genoflow.core.artifact;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Artifact store writing each artifact to `{root}/{taskId}/{name}`.
///
/// Locators are absolute file paths, which matches how the analysis pipeline
/// hands file paths (filtered VCF, contexts JSONL, scores TSV) between steps.
///
/// ### Contracts
/// - **Precondition**: `taskId` and `name` must not contain path separators
///   that escape the root directory
/// - **Postcondition**: parent directories are created on demand
/// - **Postcondition**: locators outside the root are never read; `read` returns
///   empty and `exists` false for them, as for any artifact this store does not hold
///
/// @implNote Thread-safe as long as two tasks never write the same artifact name,
/// which the executor guarantees by scoping artifacts per task.
public final class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger logger = Logger.getLogger(FileSystemArtifactStore.class.getName());

    private final Path root;

    /// Creates a store rooted at the given directory.
    ///
    /// @param root output directory for the run, not null; made absolute and normalized
    public FileSystemArtifactStore(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    @Override
    public ArtifactRef write(String taskId, String name, byte[] content, String mediaType)
            throws IOException {
        Objects.requireNonNull(content, "content must not be null");
        Path target = resolve(taskId, name);
        Files.createDirectories(target.getParent());
        Files.write(target, content);
        logger.fine("Wrote artifact " + target + " (" + content.length + " bytes)");
        return new ArtifactRef(target.toString(), mediaType);
    }

    @Override
    public Optional<byte[]> read(ArtifactRef ref) throws IOException {
        Objects.requireNonNull(ref, "ref must not be null");
        Optional<Path> path = locate(ref).filter(Files::isRegularFile);
        if (path.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(path.get()));
    }

    @Override
    public boolean exists(ArtifactRef ref) {
        Objects.requireNonNull(ref, "ref must not be null");
        return locate(ref).filter(Files::isRegularFile).isPresent();
    }

    /// Returns the root directory of this store.
    ///
    /// @return absolute root path, never null
    public Path getRoot() {
        return root;
    }

    /// Maps a locator to a path under the root.
    private Optional<Path> locate(ArtifactRef ref) {
        Path path;
        try {
            path = Path.of(ref.locator()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            logger.fine("Ignoring malformed artifact locator " + ref.locator() + ": " + e.getMessage());
            return Optional.empty();
        }
        if (!path.startsWith(root)) {
            logger.fine("Ignoring artifact locator outside " + root + ": " + ref.locator());
            return Optional.empty();
        }
        return Optional.of(path);
    }

    private Path resolve(String taskId, String name) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Path target = root.resolve(taskId).resolve(name).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException(
                    "Artifact path escapes store root: " + taskId + "/" + name);
        }
        return target;
    }
}
