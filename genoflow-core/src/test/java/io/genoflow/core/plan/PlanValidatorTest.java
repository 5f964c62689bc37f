package io.genoflow.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.genoflow.core.exception.ErrorKind;
import io.genoflow.core.exception.InvalidConfigurationException;
import io.genoflow.core.exception.PlanValidationException;
import io.genoflow.core.exception.UndeclaredDependencyException;
import io.genoflow.core.exception.UnknownDependencyException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PlanValidatorTest {

    @Test
    void shouldAcceptReferenceToDeclaredDependency() throws Exception {
        Plan plan =
                Plan.of(
                        TaskSpec.of("a", "t", Map.of()),
                        TaskSpec.of("b", "t", Map.of("in", "${output.a.out}"), "a"));

        TaskGraph graph = PlanValidator.validate(plan);

        assertThat(graph.topologicalIds()).containsExactly("a", "b");
    }

    @Test
    void shouldRejectReferenceToUndeclaredTask() {
        Plan plan =
                Plan.of(
                        TaskSpec.of("a", "t", Map.of()),
                        TaskSpec.of("b", "t", Map.of("in", "prefix ${output.a.out} suffix")));

        assertThatThrownBy(() -> PlanValidator.validate(plan))
                .isInstanceOf(UndeclaredDependencyException.class)
                .satisfies(
                        e -> {
                            UndeclaredDependencyException ude = (UndeclaredDependencyException) e;
                            assertThat(ude.getTaskId()).isEqualTo("b");
                            assertThat(ude.getReferencedTaskId()).isEqualTo("a");
                            assertThat(ude.getOutputKey()).isEqualTo("out");
                            assertThat(ude.getKind()).isEqualTo(ErrorKind.UNDECLARED_DEPENDENCY);
                        });
    }

    @Test
    void shouldRejectReferenceToTransitiveAncestorOnly() {
        Plan plan =
                Plan.of(
                        TaskSpec.of("a", "t", Map.of()),
                        TaskSpec.of("b", "t", Map.of(), "a"),
                        TaskSpec.of("c", "t", Map.of("nested", Map.of("x", "${output.a.out}")), "b"));

        assertThatThrownBy(() -> PlanValidator.validate(plan))
                .isInstanceOf(UndeclaredDependencyException.class);
    }

    @Test
    void shouldRejectReferenceToTaskOutsidePlanAsUnknownDependency() {
        Plan plan = Plan.of(TaskSpec.of("b", "t", Map.of("in", "${output.a.out}"), "a"));

        assertThatThrownBy(() -> PlanValidator.validate(plan))
                .isInstanceOf(UnknownDependencyException.class);
    }

    @Test
    void shouldRejectDuplicateIds() {
        Plan plan = Plan.of(TaskSpec.of("a", "t", Map.of()), TaskSpec.of("a", "u", Map.of()));

        assertThatThrownBy(() -> PlanValidator.validate(plan))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Duplicate task id: a")
                .satisfies(
                        e ->
                                assertThat(((PlanValidationException) e).getKind())
                                        .isEqualTo(ErrorKind.INVALID_CONFIGURATION));
    }
}
