package io.genoflow.core.critic.check;

import io.genoflow.core.artifact.ArtifactRef;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Reads primary entity ids (e.g. variant ids) out of an entity output value.
final class Entities {

    private Entities() {}

    /// Extracts entity ids.
    ///
    /// Collections contribute their elements, maps their keys and a plain
    /// string itself.
    ///
    /// @param value output value, may be null
    /// @return entity ids, or empty when the value is opaque or of another shape
    static Optional<Set<String>> of(Object value) {
        if (value instanceof Collection<?> collection) {
            Set<String> ids = new LinkedHashSet<>();
            collection.forEach(item -> ids.add(String.valueOf(item)));
            return Optional.of(ids);
        }
        if (value instanceof Map<?, ?> map) {
            Set<String> ids = new LinkedHashSet<>();
            map.keySet().forEach(key -> ids.add(String.valueOf(key)));
            return Optional.of(ids);
        }
        if (value instanceof String id) {
            return Optional.of(Set.of(id));
        }
        return Optional.empty();
    }

    static boolean isOpaque(Object value) {
        return value instanceof ArtifactRef;
    }

    /// Renders at most a handful of ids for a finding description.
    static String sample(Set<String> ids) {
        int limit = 5;
        String shown = String.join(", ", ids.stream().limit(limit).toList());
        return ids.size() > limit ? shown + ", ... (" + ids.size() + " total)" : shown;
    }
}
