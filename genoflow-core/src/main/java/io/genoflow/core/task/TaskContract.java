package io.genoflow.core.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Out-of-band declaration of what a task type guarantees on success.
///
/// The executor does not enforce contracts; they feed the consistency checker,
/// which compares what tasks actually produced against what their types promise.
///
/// ### Contracts
/// - **Precondition**: `type` must not be null or blank
/// - **Postcondition**: all collections immutable and iteration-ordered
///
/// ### Usage
/// {@snippet :
/// TaskContract scoring = TaskContract.of("scoring", "scores_file", "variant_ids", "scores")
///         .withRange("scores", ValueRange.unit())
///         .withEntityOutput("variant_ids");
/// }
///
/// @param type task-type identifier this contract describes, not null
/// @param description human-readable summary, never null after construction
/// @param outputs output keys guaranteed to be present on success, not null
/// @param ranges expected numeric range per output key, not null
/// @param entityOutput output key holding the primary entity ids (e.g. variant ids), may be null
/// @param filterStep whether narrowing the entity set is this task's intended purpose
/// @see TaskRegistry#getContract(String)
public record TaskContract(
        String type,
        String description,
        Set<String> outputs,
        Map<String, ValueRange> ranges,
        String entityOutput,
        boolean filterStep) {

    public TaskContract {
        Objects.requireNonNull(type, "type must not be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        description = description != null ? description : "";
        outputs =
                outputs != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(outputs))
                        : Set.of();
        ranges =
                ranges != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(ranges))
                        : Map.of();
    }

    /// Creates a contract guaranteeing the given output keys.
    ///
    /// @param type task-type identifier, not null
    /// @param outputs guaranteed output keys
    /// @return new contract, never null
    public static TaskContract of(String type, String... outputs) {
        return new TaskContract(type, null, new LinkedHashSet<>(List.of(outputs)), null, null, false);
    }

    /// Creates a contract that promises nothing. Used for task types registered
    /// without a contract.
    ///
    /// @param type task-type identifier, not null
    /// @return new contract, never null
    public static TaskContract open(String type) {
        return new TaskContract(type, null, null, null, null, false);
    }

    public TaskContract withDescription(String newDescription) {
        return new TaskContract(type, newDescription, outputs, ranges, entityOutput, filterStep);
    }

    /// Returns a copy declaring an expected numeric range for an output key.
    ///
    /// @param outputKey key whose numeric values are constrained, not null
    /// @param range expected range, not null
    /// @return new contract, never null
    public TaskContract withRange(String outputKey, ValueRange range) {
        Objects.requireNonNull(outputKey, "outputKey must not be null");
        Objects.requireNonNull(range, "range must not be null");
        Map<String, ValueRange> updated = new LinkedHashMap<>(ranges);
        updated.put(outputKey, range);
        return new TaskContract(type, description, outputs, updated, entityOutput, filterStep);
    }

    public TaskContract withEntityOutput(String outputKey) {
        return new TaskContract(type, description, outputs, ranges, outputKey, filterStep);
    }

    /// Returns a copy marked as an intentional filter step, so that dropping
    /// entities relative to upstream tasks is not reported as lost coverage.
    ///
    /// @return new contract, never null
    public TaskContract asFilterStep() {
        return new TaskContract(type, description, outputs, ranges, entityOutput, true);
    }

    public boolean hasEntityOutput() {
        return entityOutput != null;
    }
}
