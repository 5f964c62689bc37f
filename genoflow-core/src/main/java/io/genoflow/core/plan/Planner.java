package io.genoflow.core.plan;

import io.genoflow.core.exception.PlanValidationException;

/// Compiles run parameters into an immutable, validated {@link Plan}.
///
/// ### Contracts
/// - **Precondition**: parameters name an analysis type the planner knows
/// - **Postcondition**: the returned plan passed {@link PlanValidator}; its tasks are
///   declared in topological order
/// - **Side effects**: none. Persisting the plan is the caller's job
///
/// ### Usage
/// {@snippet :
/// Planner planner = new TemplatePlanner(List.of(new VariantAnalysisTemplate()), registry);
/// Plan plan = planner.compile(RunParameters.of("variant-analysis")
///         .with("inputVcf", "examples/test.vcf")
///         .with("outputDir", "runs/test_run")
///         .with("sampleName", "NA12878"));
/// }
///
/// @see TemplatePlanner for the template-driven implementation
public interface Planner {

    /// Compiles a plan.
    ///
    /// @param parameters analysis type and parameter values, not null
    /// @return validated plan, never null
    /// @throws PlanValidationException if parameters are missing or inconsistent, or the
    ///     resulting graph is invalid
    Plan compile(RunParameters parameters) throws PlanValidationException;
}
