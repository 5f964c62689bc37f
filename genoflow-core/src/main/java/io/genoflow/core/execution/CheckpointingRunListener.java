package io.genoflow.core.execution;

import io.genoflow.core.state.RunSnapshot;
import io.genoflow.core.storage.RunStateRepository;
import java.util.Objects;
import java.util.logging.Logger;

/// Listener that writes every checkpoint to a {@link RunStateRepository}, so
/// an interrupted run can be resumed from its last consistent state.
public final class CheckpointingRunListener implements RunListener {

    private static final Logger logger =
            Logger.getLogger(CheckpointingRunListener.class.getName());

    private final RunStateRepository repository;

    public CheckpointingRunListener(RunStateRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    @Override
    public void onCheckpoint(RunSnapshot snapshot) {
        repository.save(snapshot);
        logger.fine(
                "Checkpoint saved for run " + snapshot.runId() + ": " + snapshot.checkpointReason());
    }
}
