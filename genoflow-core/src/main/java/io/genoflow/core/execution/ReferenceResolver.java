package io.genoflow.core.execution;

import io.genoflow.core.artifact.ArtifactRef;
import io.genoflow.core.exception.MissingOutputKeyException;
import io.genoflow.core.exception.ReferenceResolutionException;
import io.genoflow.core.exception.UnresolvedReferenceException;
import io.genoflow.core.plan.OutputReference;
import io.genoflow.core.plan.ReferenceTemplate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Substitutes output references in a task's configuration with the values
/// produced by upstream tasks.
///
/// ### Resolution rules
/// - an {@link OutputReference} resolves to the raw referenced value, keeping its type
/// - a {@link ReferenceTemplate} resolves to text, each reference replaced by the
///   value's string form ({@link ArtifactRef}s render as their locator)
/// - plain text has escaped reference syntax (`$${`) turned back into `${`
/// - maps and lists are resolved element by element
/// - every other value passes through unchanged
///
/// Resolution is total and eager: the whole config is resolved once, and the
/// first unresolvable reference aborts it.
///
/// @implNote Stateless and thread-safe.
public final class ReferenceResolver {

    private static final Logger logger = Logger.getLogger(ReferenceResolver.class.getName());

    /// Resolves a complete task configuration.
    ///
    /// @param config canonical configuration of one task, not null
    /// @param context the current run, not null
    /// @return configuration with every reference substituted, never null
    /// @throws UnresolvedReferenceException if a referenced task has not succeeded
    /// @throws MissingOutputKeyException if a referenced key is absent from the producer's outputs
    public Map<String, Object> resolve(Map<String, Object> config, RunContext context)
            throws ReferenceResolutionException {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : config.entrySet()) {
            resolved.put(entry.getKey(), resolveValue(entry.getValue(), context));
        }
        return Collections.unmodifiableMap(resolved);
    }

    /// Resolves one configuration value.
    ///
    /// @param value canonical config value, may be null
    /// @param context the current run, not null
    /// @return the concrete value, may be null
    /// @throws ReferenceResolutionException if a contained reference cannot be resolved
    public Object resolveValue(Object value, RunContext context)
            throws ReferenceResolutionException {
        if (value instanceof OutputReference ref) {
            return lookup(ref, context);
        }
        if (value instanceof ReferenceTemplate template) {
            return render(template, context);
        }
        if (value instanceof String text) {
            return OutputReference.unescape(text);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), resolveValue(entry.getValue(), context));
            }
            return Collections.unmodifiableMap(resolved);
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object item : list) {
                resolved.add(resolveValue(item, context));
            }
            return Collections.unmodifiableList(resolved);
        }
        return value;
    }

    private Object lookup(OutputReference ref, RunContext context)
            throws ReferenceResolutionException {
        TaskResult producer = context.getResults().get(ref.taskId()).orElse(null);
        if (producer == null || !producer.isSucceeded()) {
            String status = producer != null ? producer.status().name() : "not part of the plan";
            throw new UnresolvedReferenceException(ref.taskId(), ref.outputKey(), status);
        }
        if (!producer.outputs().containsKey(ref.outputKey())) {
            throw new MissingOutputKeyException(ref.taskId(), ref.outputKey());
        }
        Object value = producer.outputs().get(ref.outputKey());
        logger.fine("Resolved " + ref.expression() + " -> " + value);
        return value;
    }

    private String render(ReferenceTemplate template, RunContext context)
            throws ReferenceResolutionException {
        Map<OutputReference, Object> values = new LinkedHashMap<>();
        for (OutputReference ref : template.references()) {
            values.put(ref, lookup(ref, context));
        }
        return template.render(ref -> asText(values.get(ref)));
    }

    private static String asText(Object value) {
        if (value instanceof ArtifactRef artifact) {
            return artifact.locator();
        }
        return String.valueOf(value);
    }
}
