package io.genoflow.core.storage;

import io.genoflow.core.state.RunSnapshot;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory run state repository (default implementation).
///
/// Thread-safe, no external dependencies. Stores the latest snapshot per run id.
///
/// @see RunStateRepository for contract
public final class InMemoryRunStateRepository implements RunStateRepository {

    private final Map<String, RunSnapshot> storage = new ConcurrentHashMap<>();

    @Override
    public void save(RunSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        storage.put(snapshot.runId(), snapshot);
    }

    @Override
    public Optional<RunSnapshot> findByRunId(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return Optional.ofNullable(storage.get(runId));
    }

    @Override
    public List<RunSnapshot> findIncomplete() {
        return storage.values().stream().filter(s -> !s.isComplete()).toList();
    }

    @Override
    public boolean delete(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return storage.remove(runId) != null;
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }

    public int count() {
        return storage.size();
    }
}
