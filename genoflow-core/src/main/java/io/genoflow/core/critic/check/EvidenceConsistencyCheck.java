package io.genoflow.core.critic.check;

import static io.genoflow.core.plan.VariantAnalysisTasks.EVIDENCE;
import static io.genoflow.core.plan.VariantAnalysisTasks.EVIDENCE_LOOKUP;
import static io.genoflow.core.plan.VariantAnalysisTasks.SCORING;

import io.genoflow.core.critic.CheckContext;
import io.genoflow.core.critic.ConsistencyCheck;
import io.genoflow.core.critic.Finding;
import io.genoflow.core.plan.TaskSpec;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Variant scores must agree with the evidence gathered for the same variants.
///
/// Compares the inline `scores` map of every succeeded `scoring` task with the
/// `evidence` map of every succeeded `evidence_lookup` task:
/// - a score above the high threshold with no supporting evidence is a `WARNING`
/// - a score below the low threshold for a variant ClinVar calls pathogenic is an `ERROR`
///
/// Variants missing from either side and tasks without these outputs are
/// skipped; coverage gaps are {@link CoverageCheck}'s business.
///
/// @see io.genoflow.core.plan.VariantAnalysisTasks#EVIDENCE
public final class EvidenceConsistencyCheck implements ConsistencyCheck {

    public static final String NAME = "score-evidence";

    public static final double DEFAULT_HIGH_SCORE = 0.7;
    public static final double DEFAULT_LOW_SCORE = 0.3;

    static final String SUPPORTING_EVIDENCE = "supporting_evidence";
    static final String CLINVAR_SIGNIFICANCE = "clinvar_significance";

    private static final String SCORES = "scores";

    private final double highScore;
    private final double lowScore;

    public EvidenceConsistencyCheck() {
        this(DEFAULT_HIGH_SCORE, DEFAULT_LOW_SCORE);
    }

    /// Creates a check with custom thresholds.
    ///
    /// @param highScore scores strictly above this need supporting evidence
    /// @param lowScore scores strictly below this must not be called pathogenic
    /// @throws IllegalArgumentException if `lowScore` exceeds `highScore`
    public EvidenceConsistencyCheck(double highScore, double lowScore) {
        if (lowScore > highScore) {
            throw new IllegalArgumentException(
                    "lowScore " + lowScore + " must not exceed highScore " + highScore);
        }
        this.highScore = highScore;
        this.lowScore = lowScore;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Finding> check(CheckContext context) {
        List<Finding> findings = new ArrayList<>();
        for (TaskSpec scoring : context.succeededTasksOfType(SCORING)) {
            if (!(context.output(scoring.id(), SCORES).orElse(null) instanceof Map<?, ?> scores)) {
                continue;
            }
            for (TaskSpec lookup : context.succeededTasksOfType(EVIDENCE_LOOKUP)) {
                if (context.output(lookup.id(), EVIDENCE).orElse(null) instanceof Map<?, ?> evidence) {
                    compare(scoring.id(), scores, lookup.id(), evidence, findings);
                }
            }
        }
        return findings;
    }

    private void compare(
            String scoringId,
            Map<?, ?> scores,
            String lookupId,
            Map<?, ?> evidence,
            List<Finding> findings) {
        Set<String> unsupported = new LinkedHashSet<>();
        Set<String> conflicting = new LinkedHashSet<>();
        scores.forEach(
                (variant, value) -> {
                    if (!(value instanceof Number number)
                            || !(evidence.get(variant) instanceof Map<?, ?> entry)) {
                        return;
                    }
                    double score = number.doubleValue();
                    if (score > highScore && supportCount(entry) == 0) {
                        unsupported.add(variant + "=" + value);
                    }
                    if (score < lowScore && calledPathogenic(entry)) {
                        conflicting.add(variant + "=" + value);
                    }
                });

        if (!unsupported.isEmpty()) {
            findings.add(
                    Finding.warning(
                            NAME,
                            List.of(scoringId, lookupId),
                            List.of(SCORES, EVIDENCE),
                            unsupported.size()
                                    + " variant(s) score above "
                                    + highScore
                                    + " in '"
                                    + scoringId
                                    + "' but have no supporting evidence in '"
                                    + lookupId
                                    + "': "
                                    + Entities.sample(unsupported)));
        }
        if (!conflicting.isEmpty()) {
            findings.add(
                    Finding.error(
                            NAME,
                            List.of(scoringId, lookupId),
                            List.of(SCORES, EVIDENCE),
                            conflicting.size()
                                    + " variant(s) score below "
                                    + lowScore
                                    + " in '"
                                    + scoringId
                                    + "' but ClinVar reports them pathogenic in '"
                                    + lookupId
                                    + "': "
                                    + Entities.sample(conflicting)));
        }
    }

    private static int supportCount(Map<?, ?> entry) {
        return entry.get(SUPPORTING_EVIDENCE) instanceof Collection<?> items ? items.size() : 0;
    }

    private static boolean calledPathogenic(Map<?, ?> entry) {
        return entry.get(CLINVAR_SIGNIFICANCE) instanceof String significance
                && significance.toLowerCase(Locale.ROOT).contains("pathogenic");
    }
}
