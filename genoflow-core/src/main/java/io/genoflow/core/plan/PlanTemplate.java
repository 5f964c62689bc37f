package io.genoflow.core.plan;

import io.genoflow.core.exception.InvalidConfigurationException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Fixed task-graph skeleton for one analysis type.
///
/// Skeleton configs and descriptions may contain `{name}` placeholders that
/// {@link TemplatePlanner} fills from the run parameters. Output references
/// (`${output.T.K}`) pass through untouched.
///
/// @see VariantAnalysisTemplate for the built-in template
public interface PlanTemplate {

    /// Returns the analysis type this template compiles.
    ///
    /// @return template id, never null
    String analysisType();

    /// Returns parameter names that callers must supply.
    ///
    /// @return required names, never null
    Set<String> requiredParameters();

    /// Returns values used for parameters the caller omits.
    ///
    /// @return defaults, never null
    default Map<String, Object> defaultParameters() {
        return Map.of();
    }

    /// Returns the task skeletons in declaration order.
    ///
    /// @return skeleton specs, never null
    List<TaskSpec> tasks();

    /// Checks merged parameter values for mutual consistency.
    ///
    /// Called after defaults are applied and required names are verified.
    ///
    /// @param parameters merged parameters, not null
    /// @throws InvalidConfigurationException if values are out of range or contradict each other
    default void validateParameters(Map<String, Object> parameters)
            throws InvalidConfigurationException {}
}
