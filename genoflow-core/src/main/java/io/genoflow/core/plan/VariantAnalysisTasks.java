package io.genoflow.core.plan;

import io.genoflow.core.task.TaskContract;
import io.genoflow.core.task.ValueRange;
import java.util.List;

/// Task-type identifiers and output contracts of the variant-analysis pipeline.
///
/// Bodies for these types live outside the core; whoever registers them should
/// register the matching contract so the consistency checker knows what to expect.
///
/// ### Usage
/// {@snippet :
/// registry.register(VariantAnalysisTasks.SCORING_CONTRACT, scoringBody);
/// }
public final class VariantAnalysisTasks {

    public static final String VARIANT_FILTER = "variant_filter";
    public static final String SEQUENCE_CONTEXT = "sequence_context";
    public static final String EMBEDDING = "embedding";
    public static final String SCORING = "scoring";
    public static final String EVIDENCE_LOOKUP = "evidence_lookup";
    public static final String REPORT_GENERATION = "report_generation";

    /// Output key carrying variant ids in every entity-bearing task.
    public static final String VARIANT_IDS = "variant_ids";

    /// Optional `variant_filter` output: variant id → population allele frequency
    /// of each variant that passed the filter.
    public static final String POPULATION_FREQUENCIES = "population_frequencies";

    /// Optional `evidence_lookup` output: variant id → evidence record with a
    /// `supporting_evidence` list and a `clinvar_significance` string.
    public static final String EVIDENCE = "evidence";

    /// Config key of `variant_filter` holding the population frequency cutoff.
    public static final String MAX_POPULATION_FREQUENCY = "max_pop_freq";

    public static final TaskContract VARIANT_FILTER_CONTRACT =
            TaskContract.of(VARIANT_FILTER, "filtered_vcf", "filter_stats", VARIANT_IDS, "pass_rate")
                    .withDescription("Candidate variant filtering by quality, frequency and consequence")
                    .withRange("pass_rate", ValueRange.unit())
                    .withRange(POPULATION_FREQUENCIES, ValueRange.unit())
                    .withEntityOutput(VARIANT_IDS)
                    .asFilterStep();

    public static final TaskContract SEQUENCE_CONTEXT_CONTRACT =
            TaskContract.of(SEQUENCE_CONTEXT, "contexts_file", VARIANT_IDS)
                    .withDescription("Reference and alternate sequence windows")
                    .withEntityOutput(VARIANT_IDS);

    public static final TaskContract EMBEDDING_CONTRACT =
            TaskContract.of(EMBEDDING, "embeddings_file", "embedding_dim", VARIANT_IDS)
                    .withDescription("Sequence embedding generation")
                    .withRange("embedding_dim", ValueRange.of(1, Integer.MAX_VALUE))
                    .withEntityOutput(VARIANT_IDS);

    public static final TaskContract SCORING_CONTRACT =
            TaskContract.of(SCORING, "scores_file", VARIANT_IDS, "scores")
                    .withDescription("Variant effect scoring")
                    .withRange("scores", ValueRange.unit())
                    .withEntityOutput(VARIANT_IDS);

    public static final TaskContract EVIDENCE_LOOKUP_CONTRACT =
            TaskContract.of(EVIDENCE_LOOKUP, "evidence_file", VARIANT_IDS, "grounding_rate")
                    .withDescription("Evidence retrieval and attribution")
                    .withRange("grounding_rate", ValueRange.unit())
                    .withEntityOutput(VARIANT_IDS);

    public static final TaskContract REPORT_GENERATION_CONTRACT =
            TaskContract.of(REPORT_GENERATION, "report_file")
                    .withDescription("Report rendering");

    private VariantAnalysisTasks() {}

    /// Returns every contract of the pipeline in execution order.
    ///
    /// @return contracts, never null
    public static List<TaskContract> contracts() {
        return List.of(
                VARIANT_FILTER_CONTRACT,
                SEQUENCE_CONTEXT_CONTRACT,
                EMBEDDING_CONTRACT,
                SCORING_CONTRACT,
                EVIDENCE_LOOKUP_CONTRACT,
                REPORT_GENERATION_CONTRACT);
    }
}
