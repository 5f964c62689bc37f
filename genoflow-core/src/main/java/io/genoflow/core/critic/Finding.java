package io.genoflow.core.critic;

import java.util.List;
import java.util.Objects;

/// One issue or observation raised by a {@link ConsistencyCheck}.
///
/// @param severity how serious the finding is, not null
/// @param check name of the check that produced it, not null
/// @param taskIds tasks implicated, producer before consumer where both apply, not null
/// @param outputKeys output keys implicated, not null
/// @param description human-readable explanation, not null
public record Finding(
        Severity severity,
        String check,
        List<String> taskIds,
        List<String> outputKeys,
        String description) {

    public Finding {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(check, "check must not be null");
        Objects.requireNonNull(description, "description must not be null");
        taskIds = taskIds != null ? List.copyOf(taskIds) : List.of();
        outputKeys = outputKeys != null ? List.copyOf(outputKeys) : List.of();
    }

    public static Finding info(
            String check, List<String> taskIds, List<String> outputKeys, String description) {
        return new Finding(Severity.INFO, check, taskIds, outputKeys, description);
    }

    public static Finding warning(
            String check, List<String> taskIds, List<String> outputKeys, String description) {
        return new Finding(Severity.WARNING, check, taskIds, outputKeys, description);
    }

    public static Finding error(
            String check, List<String> taskIds, List<String> outputKeys, String description) {
        return new Finding(Severity.ERROR, check, taskIds, outputKeys, description);
    }
}
