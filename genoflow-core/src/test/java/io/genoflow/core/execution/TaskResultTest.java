package io.genoflow.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.genoflow.core.artifact.ArtifactRef;
import io.genoflow.core.exception.ErrorKind;
import io.genoflow.core.exception.MissingOutputKeyException;
import io.genoflow.core.exception.TaskExecutionException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TaskResultTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2025-01-01T00:00:05Z");

    @Nested
    class Transitions {

        @Test
        void shouldRecordSuccessWithTimestamps() {
            TaskResult result = TaskResult.pending("a").start(T0).succeed(Map.of("k", 1), T1);

            assertThat(result.status()).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(result.outputs()).containsExactlyEntriesOf(Map.of("k", 1));
            assertThat(result.startedAt()).isEqualTo(T0);
            assertThat(result.finishedAt()).isEqualTo(T1);
            assertThat(result.isSucceeded()).isTrue();
            assertThat(result.isTerminal()).isTrue();
        }

        @Test
        void shouldTreatNullOutputsAsEmpty() {
            TaskResult result = TaskResult.pending("a").start(T0).succeed(null, T1);

            assertThat(result.outputs()).isEmpty();
        }

        @Test
        void shouldKeepNullOutputValues() {
            Map<String, Object> outputs = new HashMap<>();
            outputs.put("k", null);

            TaskResult result = TaskResult.pending("a").start(T0).succeed(outputs, T1);

            assertThat(result.outputs()).containsKey("k");
            assertThat(result.outputs().get("k")).isNull();
        }

        @Test
        void shouldAllowFailureBeforeStart() {
            TaskFailure failure =
                    TaskFailure.from(new MissingOutputKeyException("producer", "key"));

            TaskResult result = TaskResult.pending("a").fail(failure, T0);

            assertThat(result.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(result.startedAt()).isNull();
            assertThat(result.error().category()).isEqualTo(ErrorKind.MISSING_OUTPUT_KEY);
            assertThat(result.error().kind()).isEqualTo("missing_output_key");
        }

        @Test
        void shouldSkipPendingTask() {
            TaskResult result = TaskResult.pending("a").skip("upstream task x failed", T0);

            assertThat(result.status()).isEqualTo(TaskStatus.SKIPPED);
            assertThat(result.skipReason()).isEqualTo("upstream task x failed");
        }

        @Test
        void shouldRejectSkippingRunningTask() {
            TaskResult running = TaskResult.pending("a").start(T0);

            assertThatThrownBy(() -> running.skip("late", T1))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("RUNNING -> SKIPPED");
        }

        @Test
        void shouldRejectLeavingTerminalStatus() {
            TaskResult done = TaskResult.pending("a").start(T0).succeed(Map.of(), T1);

            assertThatThrownBy(() -> done.start(T1)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> done.fail(new TaskFailure(ErrorKind.TASK_ERROR, "x", "y"), T1))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    class ConstructorValidation {

        @Test
        void shouldRequireErrorOnFailedResult() {
            assertThatThrownBy(
                            () -> new TaskResult("a", TaskStatus.FAILED, null, null, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectErrorOnSucceededResult() {
            TaskFailure failure = new TaskFailure(ErrorKind.TASK_ERROR, "x", "y");

            assertThatThrownBy(
                            () ->
                                    new TaskResult(
                                            "a", TaskStatus.SUCCEEDED, null, failure, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectSkipReasonOnPendingResult() {
            assertThatThrownBy(
                            () ->
                                    new TaskResult(
                                            "a", TaskStatus.PENDING, null, null, "why", null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldKeepBodyKindAndMessage() {
            TaskFailure failure =
                    TaskFailure.from(new TaskExecutionException("model_unavailable", "GPU busy"));

            assertThat(failure.category()).isEqualTo(ErrorKind.TASK_ERROR);
            assertThat(failure.kind()).isEqualTo("model_unavailable");
            assertThat(failure.message()).isEqualTo("GPU busy");
        }

        @Test
        void shouldUseSimpleClassNameForUnexpectedException() {
            TaskFailure failure = TaskFailure.unexpected(new IllegalStateException());

            assertThat(failure.kind()).isEqualTo("IllegalStateException");
            assertThat(failure.message()).isEqualTo("java.lang.IllegalStateException");
        }
    }

    @Nested
    class CanonicalOutputs {

        @Test
        void shouldNarrowIntegralAndWidenDecimalNumbers() {
            Map<String, Object> produced = new HashMap<>();
            produced.put("count", 5L);
            produced.put("reads", 7_000_000_000L);
            produced.put("ratio", 0.5f);
            produced.put("depths", List.of((short) 3, 4L));

            TaskResult result = TaskResult.pending("a").start(T0).succeed(produced, T1);

            assertThat(result.outputs().get("count")).isEqualTo(5);
            assertThat(result.outputs().get("reads")).isEqualTo(7_000_000_000L);
            assertThat(result.outputs().get("ratio")).isEqualTo(0.5);
            assertThat(result.outputs().get("depths")).isEqualTo(List.of(3, 4));
        }

        @Test
        void shouldKeepArtifactReferencesAndReferenceSyntax() {
            ArtifactRef vcf = new ArtifactRef("/runs/a.vcf", "text/vcf");

            TaskResult result =
                    TaskResult.pending("a")
                            .start(T0)
                            .succeed(Map.of("vcf", vcf, "note", "${output.x.y}"), T1);

            assertThat(result.outputs().get("vcf")).isSameAs(vcf);
            assertThat(result.outputs().get("note")).isEqualTo("${output.x.y}");
        }
    }
}
