package io.genoflow.core.plan;

import io.genoflow.core.exception.InvalidConfigurationException;
import io.genoflow.core.exception.PlanValidationException;
import io.genoflow.core.task.TaskRegistry;
import java.io.Serial;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Planner that instantiates a fixed {@link PlanTemplate} per analysis type.
///
/// ### Placeholder Resolution
/// Skeleton config values and descriptions may contain `{name}` placeholders:
/// - a string that is exactly `{name}` takes the raw parameter value, so numbers
///   and lists keep their type
/// - text around a placeholder receives the value's string form
/// - `${...}` output references are never treated as placeholders
/// - parameter values are literal: `${` inside them is escaped as `$${`, so a value
///   never turns into an output reference
/// - a placeholder without a parameter value fails with `InvalidConfiguration`
///
/// ### Compilation steps
/// 1. Select the template for the analysis type
/// 2. Merge template defaults with supplied values; check required names
/// 3. Let the template check value consistency
/// 4. Substitute placeholders and reject task types absent from the registry
/// 5. Validate the graph and emit tasks in topological order
///
/// @implNote Thread-safe; templates and registry are only read.
/// @see Planner for the contract
public class TemplatePlanner implements Planner {

    private static final Logger logger = Logger.getLogger(TemplatePlanner.class.getName());

    private static final Pattern PLACEHOLDER_PATTERN =
            Pattern.compile("(?<!\\$)\\{([A-Za-z][A-Za-z0-9_]*)}");

    private final Map<String, PlanTemplate> templates;
    private final TaskRegistry taskRegistry;
    private final Clock clock;

    /// Creates a planner that does not check task types against a registry.
    ///
    /// @param templates available templates, not null
    public TemplatePlanner(Collection<? extends PlanTemplate> templates) {
        this(templates, null, Clock.systemUTC());
    }

    public TemplatePlanner(Collection<? extends PlanTemplate> templates, TaskRegistry taskRegistry) {
        this(templates, taskRegistry, Clock.systemUTC());
    }

    /// Creates a planner.
    ///
    /// @param templates available templates, not null
    /// @param taskRegistry registry used to reject unknown task types, may be null to skip the check
    /// @param clock source of plan creation timestamps, not null
    /// @throws IllegalArgumentException if two templates share an analysis type
    public TemplatePlanner(
            Collection<? extends PlanTemplate> templates, TaskRegistry taskRegistry, Clock clock) {
        Objects.requireNonNull(templates, "templates must not be null");
        this.templates = new LinkedHashMap<>();
        for (PlanTemplate template : templates) {
            if (this.templates.putIfAbsent(template.analysisType(), template) != null) {
                throw new IllegalArgumentException(
                        "Duplicate template for analysis type: " + template.analysisType());
            }
        }
        this.taskRegistry = taskRegistry;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Plan compile(RunParameters parameters) throws PlanValidationException {
        Objects.requireNonNull(parameters, "parameters must not be null");

        PlanTemplate template = templates.get(parameters.analysisType());
        if (template == null) {
            throw new InvalidConfigurationException(
                    "No template for analysis type '"
                            + parameters.analysisType()
                            + "'. Available: "
                            + templates.keySet());
        }

        Map<String, Object> merged = mergeParameters(template, parameters);
        template.validateParameters(merged);

        List<TaskSpec> tasks = new ArrayList<>();
        for (TaskSpec skeleton : template.tasks()) {
            tasks.add(instantiate(skeleton, merged));
        }
        checkTaskTypes(tasks);

        Plan declared =
                new Plan(
                        tasks,
                        new PlanMetadata(
                                clock.instant(),
                                PlanMetadata.CURRENT_FORMAT_VERSION,
                                template.analysisType(),
                                merged));
        TaskGraph graph = PlanValidator.validate(declared);
        Plan plan = new Plan(graph.topologicalOrder(), declared.metadata());

        logger.info(
                "Compiled plan for '"
                        + template.analysisType()
                        + "' with "
                        + plan.size()
                        + " tasks: "
                        + plan.taskIds());
        return plan;
    }

    /// Returns the analysis types this planner can compile.
    ///
    /// @return analysis types in registration order, never null
    public List<String> analysisTypes() {
        return List.copyOf(templates.keySet());
    }

    private Map<String, Object> mergeParameters(PlanTemplate template, RunParameters parameters)
            throws InvalidConfigurationException {
        Map<String, Object> merged = new LinkedHashMap<>(template.defaultParameters());
        parameters.values().forEach(
                (name, value) -> {
                    if (value != null) {
                        merged.put(name, value);
                    }
                });

        TreeSet<String> missing = new TreeSet<>();
        for (String required : template.requiredParameters()) {
            Object value = merged.get(required);
            if (value == null || (value instanceof String s && s.isBlank())) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new InvalidConfigurationException(
                    "Missing required parameters for '"
                            + template.analysisType()
                            + "': "
                            + missing);
        }
        return ConfigValues.normalizeLiteral(merged);
    }

    private TaskSpec instantiate(TaskSpec skeleton, Map<String, Object> parameters)
            throws InvalidConfigurationException {
        try {
            Map<String, Object> config = substituteMap(skeleton.config(), parameters);
            String description =
                    substituteText(skeleton.description(), parameters, false).toString();
            return skeleton.withConfig(config).withDescription(description);
        } catch (UnresolvedPlaceholderException e) {
            throw new InvalidConfigurationException(
                    "Task '" + skeleton.id() + "' uses unknown parameter '{" + e.name + "}'");
        }
    }

    private void checkTaskTypes(List<TaskSpec> tasks) throws InvalidConfigurationException {
        if (taskRegistry == null) {
            return;
        }
        for (TaskSpec task : tasks) {
            if (!taskRegistry.contains(task.type())) {
                throw new InvalidConfigurationException(
                        "Task '"
                                + task.id()
                                + "' requires unregistered task type '"
                                + task.type()
                                + "'");
            }
        }
    }

    private Map<String, Object> substituteMap(
            Map<String, Object> config, Map<String, Object> parameters) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        config.forEach((key, value) -> resolved.put(key, substitute(value, parameters)));
        return resolved;
    }

    private Object substitute(Object value, Map<String, Object> parameters) {
        if (value instanceof String text) {
            return substituteText(text, parameters, true);
        }
        if (value instanceof ReferenceTemplate template) {
            return substituteText(template.template(), parameters, true);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> resolved.put(String.valueOf(k), substitute(v, parameters)));
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(item -> resolved.add(substitute(item, parameters)));
            return resolved;
        }
        return value;
    }

    /// Replaces the placeholders in one string. With `escape` set, `${` inside
    /// parameter values is escaped so the value stays literal in the task config.
    private Object substituteText(String text, Map<String, Object> parameters, boolean escape) {
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        if (matcher.matches()) {
            Object value = lookup(matcher.group(1), parameters);
            return escape ? escapeValue(value) : value;
        }

        matcher.reset();
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = String.valueOf(lookup(matcher.group(1), parameters));
            if (escape) {
                replacement = OutputReference.escape(replacement);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static Object escapeValue(Object value) {
        if (value instanceof String text) {
            return OutputReference.escape(text);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> escaped = new LinkedHashMap<>();
            map.forEach((k, v) -> escaped.put(String.valueOf(k), escapeValue(v)));
            return escaped;
        }
        if (value instanceof List<?> list) {
            List<Object> escaped = new ArrayList<>(list.size());
            list.forEach(item -> escaped.add(escapeValue(item)));
            return escaped;
        }
        return value;
    }

    private static Object lookup(String name, Map<String, Object> parameters) {
        if (!parameters.containsKey(name) || parameters.get(name) == null) {
            throw new UnresolvedPlaceholderException(name);
        }
        return parameters.get(name);
    }

    /// Unwinds the recursive substitution when a parameter is missing.
    private static final class UnresolvedPlaceholderException extends RuntimeException {

        @Serial private static final long serialVersionUID = -3312870410925337861L;

        private final String name;

        UnresolvedPlaceholderException(String name) {
            super(null, null, false, false);
            this.name = name;
        }
    }
}
