package io.genoflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.genoflow.core.artifact.ArtifactRef;
import io.genoflow.core.critic.Finding;
import io.genoflow.core.critic.FindingsReport;
import io.genoflow.core.critic.ReportStatus;
import io.genoflow.core.exception.ErrorKind;
import io.genoflow.core.execution.TaskFailure;
import io.genoflow.core.execution.TaskResult;
import io.genoflow.core.execution.TaskStatus;
import io.genoflow.core.plan.OutputReference;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.plan.PlanMetadata;
import io.genoflow.core.plan.ReferenceTemplate;
import io.genoflow.core.plan.RunParameters;
import io.genoflow.core.plan.TaskSpec;
import io.genoflow.core.plan.TemplatePlanner;
import io.genoflow.core.plan.VariantAnalysisTemplate;
import io.genoflow.core.state.RunSnapshot;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GenoflowSerializerTest {

    private static final Instant CREATED = Instant.parse("2025-03-14T09:26:53.589Z");

    @Test
    void roundTrip_variantAnalysisPlan() throws Exception {
        Plan original =
                new TemplatePlanner(List.of(new VariantAnalysisTemplate()))
                        .compile(
                                RunParameters.of(VariantAnalysisTemplate.ANALYSIS_TYPE)
                                        .with("inputVcf", "/data/trio.vcf.gz")
                                        .with("outputDir", "/runs/trio")
                                        .with("sampleName", "trio-proband"));

        Plan restored = GenoflowSerializer.planFromJson(GenoflowSerializer.toJson(original));

        assertThat(restored).isEqualTo(original);
        assertThat(restored.taskIds()).containsExactlyElementsOf(original.taskIds());
        assertThat(restored.task("scoring").orElseThrow().config().get("embeddings_file"))
                .isInstanceOf(OutputReference.class);
    }

    @Test
    void roundTrip_handBuiltPlan() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("window", 128);
        nested.put("strands", List.of("+", "-"));
        nested.put("threshold", 0.25);
        nested.put("enabled", true);
        nested.put("reads", 5_000_000_000L);

        Plan original =
                new Plan(
                        List.of(
                                TaskSpec.of("align", "aligner", Map.of("bam", "/data/in.bam")),
                                TaskSpec.of(
                                                "annotate",
                                                "annotator",
                                                Map.of(
                                                        "input", "${output.align.bam}",
                                                        "label", "sample ${output.align.sample}.txt",
                                                        "params", nested),
                                                "align")
                                        .withDescription("Annotate aligned reads")),
                        new PlanMetadata(
                                CREATED,
                                PlanMetadata.CURRENT_FORMAT_VERSION,
                                "custom",
                                Map.of("note", "${output.not.a.reference}")));

        String json = GenoflowSerializer.toJson(original);
        Plan restored = GenoflowSerializer.planFromJson(json);

        assertThat(json).contains("\"${output.align.bam}\"").contains("\"createdAt\"");
        assertThat(restored).isEqualTo(original);
        assertThat(restored.task("annotate").orElseThrow().config().get("label"))
                .isInstanceOf(ReferenceTemplate.class);
        assertThat(restored.metadata().runParameters()).containsEntry("note", "${output.not.a.reference}");
    }

    @Test
    void planFromJson_rejectsNewerFormatVersion() {
        String json =
                """
                {
                  "metadata": {"createdAt": "2025-03-14T09:26:53Z", "formatVersion": 2},
                  "tasks": []
                }
                """;

        assertThatThrownBy(() -> GenoflowSerializer.planFromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported plan format version 2");
    }

    @Test
    void planFromJson_rejectsInvalidGraph() {
        String json =
                """
                {
                  "metadata": {"createdAt": "2025-03-14T09:26:53Z", "formatVersion": 1},
                  "tasks": [{"id": "a.b", "type": "t"}]
                }
                """;

        assertThatThrownBy(() -> GenoflowSerializer.planFromJson(json))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void planFromJson_ignoresUnknownFields() {
        String json =
                """
                {
                  "metadata": {"createdAt": "2025-03-14T09:26:53Z", "formatVersion": 1, "author": "x"},
                  "tasks": [{"id": "a", "type": "t", "retries": 3}]
                }
                """;

        Plan plan = GenoflowSerializer.planFromJson(json);

        assertThat(plan.taskIds()).containsExactly("a");
        assertThat(plan.metadata().analysisType()).isEmpty();
    }

    @Test
    void roundTrip_runSnapshot() {
        Plan plan =
                new Plan(
                        List.of(
                                TaskSpec.of("a", "t", Map.of()),
                                TaskSpec.of("b", "t", Map.of("in", "${output.a.vcf}"), "a"),
                                TaskSpec.of("c", "t", Map.of(), "b"),
                                TaskSpec.of("d", "t", Map.of())),
                        new PlanMetadata(CREATED, 1, "", Map.of()));
        TaskResult a =
                TaskResult.pending("a")
                        .start(CREATED)
                        .succeed(
                                Map.of(
                                        "vcf", new ArtifactRef("/runs/x/a.vcf", "text/vcf"),
                                        "count", 42,
                                        "ids", List.of("v1", "v2"),
                                        "stats", Map.of("pass", 40, "fail", 2)),
                                CREATED.plusSeconds(3));
        TaskResult b =
                TaskResult.pending("b")
                        .start(CREATED.plusSeconds(3))
                        .fail(
                                new TaskFailure(ErrorKind.TASK_ERROR, "oom", "out of memory"),
                                CREATED.plusSeconds(5));
        TaskResult c = TaskResult.pending("c").skip("upstream task b failed", CREATED.plusSeconds(5));
        TaskResult d = TaskResult.pending("d");
        Map<String, TaskResult> results = new LinkedHashMap<>();
        results.put("a", a);
        results.put("b", b);
        results.put("c", c);
        results.put("d", d);
        RunSnapshot original = new RunSnapshot("run-42", plan, results, CREATED, "task b FAILED");

        String json = GenoflowSerializer.toJson(original);
        RunSnapshot restored = GenoflowSerializer.snapshotFromJson(json);

        assertThat(json).contains("\"$artifact\"").doesNotContain("\"complete\"");
        assertThat(restored).isEqualTo(original);
        assertThat(restored.results().get("a").outputs().get("vcf")).isInstanceOf(ArtifactRef.class);
        assertThat(restored.results().get("b").error().kind()).isEqualTo("oom");
        assertThat(restored.results().get("d").status()).isEqualTo(TaskStatus.PENDING);
        assertThat(restored.isComplete()).isFalse();
    }

    @Test
    void roundTrip_findingsReport() {
        FindingsReport original =
                new FindingsReport(
                        List.of(
                                Finding.warning(
                                        "coverage",
                                        List.of("embedding", "scoring"),
                                        List.of("variant_ids"),
                                        "Task 'scoring' dropped 2 entities"),
                                Finding.info("referential_completeness", List.of(), List.of(), "ok")),
                        CREATED);

        String json = GenoflowSerializer.toJson(original);
        FindingsReport restored = GenoflowSerializer.reportFromJson(json);

        assertThat(json).contains("\"status\" : \"WARNING\"");
        assertThat(restored).isEqualTo(original);
        assertThat(restored.status()).isEqualTo(ReportStatus.WARNING);
    }

    @Test
    void writePlan_createsParentDirectories(@TempDir Path dir) throws Exception {
        Plan original =
                new Plan(
                        List.of(TaskSpec.of("a", "t", Map.of("k", 1))),
                        new PlanMetadata(CREATED, 1, "", Map.of()));
        Path file = dir.resolve("runs").resolve("plan.json");

        GenoflowSerializer.writePlan(original, file);

        assertThat(file).exists();
        assertThat(GenoflowSerializer.readPlan(file)).isEqualTo(original);
    }

    @Test
    void writeReport_writesStatus(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("report.json");

        GenoflowSerializer.writeReport(new FindingsReport(List.of(), CREATED), file);

        assertThat(Files.readString(file)).contains("\"PASS\"");
    }
}
