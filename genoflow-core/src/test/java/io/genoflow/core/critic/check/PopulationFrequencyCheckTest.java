package io.genoflow.core.critic.check;

import static io.genoflow.core.critic.check.CheckFixtures.succeeded;
import static io.genoflow.core.plan.VariantAnalysisTasks.MAX_POPULATION_FREQUENCY;
import static io.genoflow.core.plan.VariantAnalysisTasks.POPULATION_FREQUENCIES;
import static io.genoflow.core.plan.VariantAnalysisTasks.VARIANT_FILTER;
import static org.assertj.core.api.Assertions.assertThat;

import io.genoflow.core.critic.CheckContext;
import io.genoflow.core.critic.Finding;
import io.genoflow.core.critic.Severity;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.plan.TaskSpec;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PopulationFrequencyCheckTest {

    private final PopulationFrequencyCheck check = new PopulationFrequencyCheck();

    private List<Finding> run(Map<String, Object> filterConfig, Map<String, Object> frequencies) {
        Plan plan = Plan.of(TaskSpec.of(VARIANT_FILTER, VARIANT_FILTER, filterConfig));
        return check.check(
                new CheckContext(
                        plan,
                        Map.of(
                                VARIANT_FILTER,
                                succeeded(VARIANT_FILTER, Map.of(POPULATION_FREQUENCIES, frequencies))),
                        CheckFixtures.variantRegistry()));
    }

    @Test
    void shouldWarnAboutCommonVariantsAboveDefaultCutoff() {
        List<Finding> findings = run(Map.of(), Map.of("v1", 0.002, "v2", 0.15));

        assertThat(findings).singleElement().satisfies(
                f -> {
                    assertThat(f.severity()).isEqualTo(Severity.WARNING);
                    assertThat(f.check()).isEqualTo(PopulationFrequencyCheck.NAME);
                    assertThat(f.taskIds()).containsExactly(VARIANT_FILTER);
                    assertThat(f.description()).contains("v2=0.15").contains("0.01").doesNotContain("v1");
                });
    }

    @Test
    void shouldUseCutoffFromFilterConfig() {
        Map<String, Object> config = Map.of(MAX_POPULATION_FREQUENCY, 0.2);

        assertThat(run(config, Map.of("v2", 0.15))).isEmpty();
        assertThat(run(config, Map.of("v2", 0.25))).hasSize(1);
    }

    @Test
    void shouldPassRareVariants() {
        assertThat(run(Map.of(), Map.of("v1", 0.0, "v2", 0.01))).isEmpty();
    }
}
