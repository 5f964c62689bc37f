package io.genoflow.core.critic.check;

import static io.genoflow.core.plan.VariantAnalysisTasks.MAX_POPULATION_FREQUENCY;
import static io.genoflow.core.plan.VariantAnalysisTasks.POPULATION_FREQUENCIES;
import static io.genoflow.core.plan.VariantAnalysisTasks.VARIANT_FILTER;

import io.genoflow.core.critic.CheckContext;
import io.genoflow.core.critic.ConsistencyCheck;
import io.genoflow.core.critic.Finding;
import io.genoflow.core.plan.TaskSpec;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Variants that passed a filter must be rare in the population.
///
/// Every succeeded `variant_filter` task reporting `population_frequencies` is
/// held to the cutoff in its own `max_pop_freq` config value, or to
/// {@link #DEFAULT_MAX_FREQUENCY} when the config carries none. One `WARNING`
/// per task lists the variants above the cutoff.
public final class PopulationFrequencyCheck implements ConsistencyCheck {

    public static final String NAME = "population-frequency";

    /// Pathogenic variants are usually rarer than 1%.
    public static final double DEFAULT_MAX_FREQUENCY = 0.01;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Finding> check(CheckContext context) {
        List<Finding> findings = new ArrayList<>();
        for (TaskSpec filter : context.succeededTasksOfType(VARIANT_FILTER)) {
            if (!(context.output(filter.id(), POPULATION_FREQUENCIES).orElse(null)
                    instanceof Map<?, ?> frequencies)) {
                continue;
            }
            double cutoff = cutoff(filter);
            Set<String> common = new LinkedHashSet<>();
            frequencies.forEach(
                    (variant, value) -> {
                        if (value instanceof Number number && number.doubleValue() > cutoff) {
                            common.add(variant + "=" + value);
                        }
                    });
            if (!common.isEmpty()) {
                findings.add(
                        Finding.warning(
                                NAME,
                                List.of(filter.id()),
                                List.of(POPULATION_FREQUENCIES),
                                common.size()
                                        + " variant(s) passed '"
                                        + filter.id()
                                        + "' with a population frequency above "
                                        + cutoff
                                        + ": "
                                        + Entities.sample(common)));
            }
        }
        return findings;
    }

    private static double cutoff(TaskSpec filter) {
        return filter.config().get(MAX_POPULATION_FREQUENCY) instanceof Number number
                ? number.doubleValue()
                : DEFAULT_MAX_FREQUENCY;
    }
}
