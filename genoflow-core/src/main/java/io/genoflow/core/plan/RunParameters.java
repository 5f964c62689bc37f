package io.genoflow.core.plan;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Parameters for compiling a plan: the analysis type selecting a template,
/// plus named values substituted into that template.
///
/// ### Usage
/// {@snippet :
/// RunParameters params = RunParameters.of(VariantAnalysisTemplate.ANALYSIS_TYPE)
///         .with("inputVcf", "examples/test.vcf")
///         .with("outputDir", "runs/test_run")
///         .with("sampleName", "NA12878");
/// }
///
/// @param analysisType template identifier, not null
/// @param values named parameter values, literal, not null
public record RunParameters(String analysisType, Map<String, Object> values) {

    public RunParameters {
        Objects.requireNonNull(analysisType, "analysisType must not be null");
        values = ConfigValues.normalizeLiteral(values);
    }

    public static RunParameters of(String analysisType) {
        return new RunParameters(analysisType, Map.of());
    }

    public static RunParameters of(String analysisType, Map<String, ?> values) {
        return new RunParameters(analysisType, ConfigValues.normalizeLiteral(values));
    }

    /// Returns a copy with one more parameter.
    ///
    /// @param name parameter name, not null
    /// @param value parameter value, may be null
    /// @return new parameters, never null
    public RunParameters with(String name, Object value) {
        Objects.requireNonNull(name, "name must not be null");
        Map<String, Object> updated = new LinkedHashMap<>(values);
        updated.put(name, value);
        return new RunParameters(analysisType, updated);
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }
}
