package io.genoflow.core.critic.check;

import static io.genoflow.core.critic.check.CheckFixtures.succeeded;
import static io.genoflow.core.plan.VariantAnalysisTasks.REPORT_GENERATION;
import static io.genoflow.core.plan.VariantAnalysisTasks.SCORING;
import static org.assertj.core.api.Assertions.assertThat;

import io.genoflow.core.critic.CheckContext;
import io.genoflow.core.critic.Finding;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.plan.TaskSpec;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DeclaredOutputsCheckTest {

    private final DeclaredOutputsCheck check = new DeclaredOutputsCheck();

    @Test
    void shouldWarnOncePerMissingGuaranteedOutput() {
        Plan plan =
                Plan.of(
                        TaskSpec.of(SCORING, SCORING, Map.of()),
                        TaskSpec.of(REPORT_GENERATION, REPORT_GENERATION, Map.of(), SCORING));

        List<Finding> findings =
                check.check(
                        new CheckContext(
                                plan,
                                Map.of(
                                        SCORING, succeeded(SCORING, Map.of("scores_file", "/out/s.tsv")),
                                        REPORT_GENERATION,
                                                succeeded(REPORT_GENERATION, Map.of("report_file", "/out/r.md"))),
                                CheckFixtures.variantRegistry()));

        assertThat(findings).extracting(f -> f.outputKeys().get(0)).containsExactly("variant_ids", "scores");
        assertThat(findings).allMatch(f -> f.taskIds().equals(List.of(SCORING)));
    }

    @Test
    void shouldIgnoreTasksWithoutContract() {
        Plan plan = Plan.of(TaskSpec.of("custom", "custom", Map.of()));

        List<Finding> findings =
                check.check(
                        new CheckContext(
                                plan,
                                Map.of("custom", succeeded("custom", Map.of())),
                                CheckFixtures.variantRegistry()));

        assertThat(findings).isEmpty();
    }
}
