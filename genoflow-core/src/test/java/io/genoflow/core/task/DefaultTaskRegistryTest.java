package io.genoflow.core.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.genoflow.core.exception.TaskExecutionException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DefaultTaskRegistryTest {

    private DefaultTaskRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultTaskRegistry();
    }

    @Nested
    class Registration {

        @Test
        void shouldRegisterBodyWithContract() {
            TaskContract contract = TaskContract.of("scoring", "scores_file", "scores");
            TaskBody body = (config, context) -> Map.of();

            registry.register(contract, body);

            assertThat(registry.contains("scoring")).isTrue();
            assertThat(registry.getBody("scoring")).containsSame(body);
            assertThat(registry.getContract("scoring")).contains(contract);
            assertThat(registry.types()).containsExactly("scoring");
        }

        @Test
        void shouldRegisterOpenContractForBareBody() {
            registry.register("custom", (config, context) -> Map.of());

            TaskContract contract = registry.getContract("custom").orElseThrow();
            assertThat(contract.outputs()).isEmpty();
            assertThat(contract.hasEntityOutput()).isFalse();
        }

        @Test
        void shouldReplaceExistingRegistration() {
            TaskBody first = (config, context) -> Map.of("v", 1);
            TaskBody second = (config, context) -> Map.of("v", 2);

            registry.register("t", first);
            registry.register("t", second);

            assertThat(registry.getBody("t")).containsSame(second);
        }

        @Test
        void shouldUnregister() {
            registry.register("t", (config, context) -> Map.of());

            assertThat(registry.unregister("t")).isTrue();
            assertThat(registry.unregister("t")).isFalse();
            assertThat(registry.contains("t")).isFalse();
        }

        @Test
        void shouldRejectNullBody() {
            assertThatThrownBy(() -> registry.register(TaskContract.open("t"), null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("body");
        }
    }

    @Nested
    class Invocation {

        @Test
        void shouldInvokeRegisteredBody() throws Exception {
            registry.register("echo", (config, context) -> Map.of("echo", config.get("in")));

            Map<String, Object> outputs = registry.invoke("echo", Map.of("in", "x"), null);

            assertThat(outputs).containsEntry("echo", "x");
        }

        @Test
        void shouldFailForUnknownType() {
            assertThatThrownBy(() -> registry.invoke("nope", Map.of(), null))
                    .isInstanceOf(TaskExecutionException.class)
                    .hasMessageContaining("nope")
                    .satisfies(
                            e ->
                                    assertThat(((TaskExecutionException) e).getKind())
                                            .isEqualTo(TaskExecutionException.UNKNOWN_TASK_TYPE));
        }
    }

    @Nested
    class Contracts {

        @Test
        void shouldAccumulateRanges() {
            TaskContract contract =
                    TaskContract.of("scoring", "scores")
                            .withRange("scores", ValueRange.unit())
                            .withEntityOutput("variant_ids")
                            .asFilterStep();

            assertThat(contract.ranges()).containsEntry("scores", ValueRange.of(0.0, 1.0));
            assertThat(contract.entityOutput()).isEqualTo("variant_ids");
            assertThat(contract.filterStep()).isTrue();
        }

        @Test
        void shouldRejectInvertedRange() {
            assertThatThrownBy(() -> ValueRange.of(1.0, 0.0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
