package io.genoflow.serialization.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.genoflow.core.state.RunSnapshot;
import io.genoflow.core.storage.RunStateRepository;
import io.genoflow.core.storage.RunStateStorageException;
import io.genoflow.serialization.GenoflowSerializer;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Run state repository that keeps one JSON file per run in a directory.
///
/// Each save writes `<runId>.json` through a temporary file that is then moved
/// into place, so a crash mid-write leaves the previous checkpoint intact.
/// Snapshots survive process restarts, which is what makes
/// {@link io.genoflow.core.execution.GraphExecutor#resume} useful after a crash.
///
/// ### Contracts
/// - **Precondition**: run ids must be usable as file names (no path separators,
///   not `.` or `..`)
/// - **Postcondition**: {@link #findByRunId} returns a snapshot equal to the one
///   last saved
///
/// @implNote Thread-safe for distinct run ids. Concurrent saves of the same run
/// id race at the file level; the last move wins.
///
/// @see io.genoflow.core.storage.InMemoryRunStateRepository for the volatile variant
public final class FileRunStateRepository implements RunStateRepository {

    private static final Logger logger = Logger.getLogger(FileRunStateRepository.class.getName());

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    /// Creates a repository rooted at the given directory, creating it if needed.
    ///
    /// @param directory storage directory, not null
    /// @throws RunStateStorageException if the directory cannot be created
    public FileRunStateRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.mapper = GenoflowSerializer.createMapper();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RunStateStorageException("Cannot create state directory " + directory, e);
        }
    }

    @Override
    public void save(RunSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Path target = fileFor(snapshot.runId());
        Path temp = directory.resolve(target.getFileName() + ".tmp");
        try {
            mapper.writeValue(temp.toFile(), snapshot);
            move(temp, target);
        } catch (IOException e) {
            throw new RunStateStorageException(
                    "Failed to save snapshot of run " + snapshot.runId(), e);
        }
        logger.fine("Saved snapshot of run " + snapshot.runId() + " to " + target);
    }

    @Override
    public Optional<RunSnapshot> findByRunId(String runId) {
        Path file = fileFor(runId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public List<RunSnapshot> findIncomplete() {
        List<RunSnapshot> incomplete = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                RunSnapshot snapshot = read(file);
                if (!snapshot.isComplete()) {
                    incomplete.add(snapshot);
                }
            }
        } catch (IOException e) {
            throw new RunStateStorageException("Failed to list snapshots in " + directory, e);
        }
        return incomplete;
    }

    @Override
    public boolean delete(String runId) {
        try {
            return Files.deleteIfExists(fileFor(runId));
        } catch (IOException e) {
            throw new RunStateStorageException("Failed to delete snapshot of run " + runId, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private RunSnapshot read(Path file) {
        try {
            return mapper.readValue(file.toFile(), RunSnapshot.class);
        } catch (IOException e) {
            throw new RunStateStorageException("Failed to read snapshot " + file, e);
        }
    }

    private Path fileFor(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        if (runId.isBlank()
                || runId.equals(".")
                || runId.equals("..")
                || runId.contains("/")
                || runId.contains("\\")) {
            throw new IllegalArgumentException("runId is not usable as a file name: " + runId);
        }
        return directory.resolve(runId + SUFFIX);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(
                    source,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.fine("Atomic move not supported in " + target.getParent() + ", replacing");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
