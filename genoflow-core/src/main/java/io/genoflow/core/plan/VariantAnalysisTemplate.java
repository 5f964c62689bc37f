package io.genoflow.core.plan;

import static io.genoflow.core.plan.VariantAnalysisTasks.EMBEDDING;
import static io.genoflow.core.plan.VariantAnalysisTasks.EVIDENCE_LOOKUP;
import static io.genoflow.core.plan.VariantAnalysisTasks.MAX_POPULATION_FREQUENCY;
import static io.genoflow.core.plan.VariantAnalysisTasks.REPORT_GENERATION;
import static io.genoflow.core.plan.VariantAnalysisTasks.SCORING;
import static io.genoflow.core.plan.VariantAnalysisTasks.SEQUENCE_CONTEXT;
import static io.genoflow.core.plan.VariantAnalysisTasks.VARIANT_FILTER;

import io.genoflow.core.exception.InvalidConfigurationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Built-in template for single-sample variant analysis.
///
/// ```
/// variant_filter → sequence_context → embedding → scoring → evidence_lookup → report_generation
/// ```
///
/// Scoring reads both the embeddings and the sequence contexts (gene annotation
/// comes from the contexts); the report reads both scores and evidence.
public class VariantAnalysisTemplate implements PlanTemplate {

    public static final String ANALYSIS_TYPE = "variant-analysis";

    private static final Map<String, Object> DEFAULTS = defaults();

    @Override
    public String analysisType() {
        return ANALYSIS_TYPE;
    }

    @Override
    public Set<String> requiredParameters() {
        return Set.of("inputVcf", "outputDir", "sampleName");
    }

    @Override
    public Map<String, Object> defaultParameters() {
        return DEFAULTS;
    }

    @Override
    public List<TaskSpec> tasks() {
        TaskSpec filter =
                TaskSpec.of(
                                VARIANT_FILTER,
                                VARIANT_FILTER,
                                config(
                                        "vcf_file", "{inputVcf}",
                                        "min_quality", "{minQuality}",
                                        MAX_POPULATION_FREQUENCY, "{maxPopulationFrequency}",
                                        "consequence_types", "{consequenceTypes}",
                                        "filtered_vcf", "{outputDir}/variants.filtered.vcf",
                                        "filter_stats", "{outputDir}/filter_stats.json"))
                        .withDescription(
                                "Candidate variant filtering for {sampleName} (quality, frequency, consequence)");

        TaskSpec context =
                TaskSpec.of(
                                SEQUENCE_CONTEXT,
                                SEQUENCE_CONTEXT,
                                config(
                                        "variants_file", "${output.variant_filter.filtered_vcf}",
                                        "contexts_file", "{outputDir}/contexts.jsonl"),
                                VARIANT_FILTER)
                        .withDescription("Reference/alternate sequence windows");

        TaskSpec embedding =
                TaskSpec.of(
                                EMBEDDING,
                                EMBEDDING,
                                config(
                                        "contexts_file", "${output.sequence_context.contexts_file}",
                                        "model_name", "{embeddingModel}",
                                        "pooling", "{pooling}",
                                        "batch_size", "{batchSize}",
                                        "mock_mode", "{mockMode}",
                                        "embeddings_file", "{outputDir}/embeddings.parquet"),
                                SEQUENCE_CONTEXT)
                        .withDescription("Sequence embedding generation");

        TaskSpec scoring =
                TaskSpec.of(
                                SCORING,
                                SCORING,
                                config(
                                        "embeddings_file", "${output.embedding.embeddings_file}",
                                        "contexts_file", "${output.sequence_context.contexts_file}",
                                        "scores_file", "{outputDir}/scores.tsv"),
                                EMBEDDING,
                                SEQUENCE_CONTEXT)
                        .withDescription("Variant effect scoring");

        TaskSpec evidence =
                TaskSpec.of(
                                EVIDENCE_LOOKUP,
                                EVIDENCE_LOOKUP,
                                config(
                                        "scores_file", "${output.scoring.scores_file}",
                                        "phenotype", "{phenotype}",
                                        "evidence_file", "{outputDir}/evidence.json"),
                                SCORING)
                        .withDescription("Evidence retrieval and attribution");

        TaskSpec report =
                TaskSpec.of(
                                REPORT_GENERATION,
                                REPORT_GENERATION,
                                config(
                                        "sample_name", "{sampleName}",
                                        "phenotype", "{phenotype}",
                                        "scores_file", "${output.scoring.scores_file}",
                                        "evidence_file", "${output.evidence_lookup.evidence_file}",
                                        "report_file", "{outputDir}/report.md"),
                                SCORING,
                                EVIDENCE_LOOKUP)
                        .withDescription("Report generation for {sampleName}");

        return List.of(filter, context, embedding, scoring, evidence, report);
    }

    @Override
    public void validateParameters(Map<String, Object> parameters)
            throws InvalidConfigurationException {
        double maxFrequency = number(parameters, "maxPopulationFrequency");
        if (maxFrequency < 0.0 || maxFrequency > 1.0) {
            throw new InvalidConfigurationException(
                    "maxPopulationFrequency must be within [0, 1], got " + maxFrequency);
        }
        if (number(parameters, "minQuality") < 0) {
            throw new InvalidConfigurationException(
                    "minQuality must not be negative, got " + parameters.get("minQuality"));
        }
        if (number(parameters, "batchSize") < 1) {
            throw new InvalidConfigurationException(
                    "batchSize must be positive, got " + parameters.get("batchSize"));
        }
    }

    private static double number(Map<String, Object> parameters, String name)
            throws InvalidConfigurationException {
        Object value = parameters.get(name);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException(name + " must be numeric, got '" + s + "'");
            }
        }
        throw new InvalidConfigurationException(name + " must be numeric, got " + value);
    }

    private static Map<String, Object> config(Object... keyValues) {
        Map<String, Object> config = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            config.put((String) keyValues[i], keyValues[i + 1]);
        }
        return config;
    }

    private static Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("phenotype", "");
        defaults.put("minQuality", 30);
        defaults.put("maxPopulationFrequency", 0.01);
        defaults.put(
                "consequenceTypes",
                List.of(
                        "missense_variant",
                        "stop_gained",
                        "frameshift_variant",
                        "splice_donor_variant",
                        "splice_acceptor_variant"));
        defaults.put("embeddingModel", "genos-1.2b");
        defaults.put("pooling", "mean");
        defaults.put("batchSize", 32);
        defaults.put("mockMode", false);
        return ConfigValues.normalizeLiteral(defaults);
    }
}
