package io.genoflow.core.plan;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Declarative description of one unit of work within a {@link Plan}.
///
/// ### Contracts
/// - **Precondition**: `id` and `type` must not be null or blank; `id` must not contain `.`
/// - **Postcondition**: all fields immutable; `config` is in {@link ConfigValues}
///   canonical form, so embedded `${output.T.K}` strings are already parsed into
///   {@link OutputReference} / {@link ReferenceTemplate} values
///
/// ### Usage
/// {@snippet :
/// TaskSpec scoring = TaskSpec.of(
///         "scoring",
///         "scoring",
///         Map.of("embeddings_file", "${output.embedding.embeddings_file}"),
///         "embedding");
/// scoring.references(); // [${output.embedding.embeddings_file}]
/// }
///
/// @param id unique identifier within the plan, not null
/// @param type registered task-type identifier, not null
/// @param dependsOn ids of tasks that must succeed first, insertion-ordered, not null
/// @param config per-type configuration in canonical form, not null
/// @param description human-readable summary, never null after construction
/// @see Plan for the containing graph
public record TaskSpec(
        String id, String type, Set<String> dependsOn, Map<String, Object> config, String description) {

    public TaskSpec {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (id.contains(".")) {
            throw new IllegalArgumentException("id must not contain '.': " + id);
        }
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank for task " + id);
        }
        dependsOn =
                dependsOn != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn))
                        : Set.of();
        config = ConfigValues.normalize(config);
        description = description != null ? description : "";
    }

    /// Creates a task spec without description.
    ///
    /// @param id unique task id, not null
    /// @param type task-type identifier, not null
    /// @param config raw configuration, may be null
    /// @param dependsOn ids of prerequisite tasks
    /// @return new spec, never null
    public static TaskSpec of(String id, String type, Map<String, ?> config, String... dependsOn) {
        return new TaskSpec(
                id, type, new LinkedHashSet<>(List.of(dependsOn)), ConfigValues.normalize(config), null);
    }

    public TaskSpec withDescription(String newDescription) {
        return new TaskSpec(id, type, dependsOn, config, newDescription);
    }

    /// Returns a copy with a different configuration.
    ///
    /// @param newConfig raw configuration, may be null
    /// @return new spec, never null
    public TaskSpec withConfig(Map<String, ?> newConfig) {
        return new TaskSpec(id, type, dependsOn, ConfigValues.normalize(newConfig), description);
    }

    /// Returns every output reference in this task's configuration.
    ///
    /// @return references in config order, never null
    public List<OutputReference> references() {
        return ConfigValues.references(config);
    }

    public boolean dependsOn(String taskId) {
        return dependsOn.contains(taskId);
    }
}
