package io.genoflow.core;

import static io.genoflow.core.plan.VariantAnalysisTasks.EMBEDDING;
import static io.genoflow.core.plan.VariantAnalysisTasks.EVIDENCE;
import static io.genoflow.core.plan.VariantAnalysisTasks.EVIDENCE_LOOKUP;
import static io.genoflow.core.plan.VariantAnalysisTasks.REPORT_GENERATION;
import static io.genoflow.core.plan.VariantAnalysisTasks.SCORING;
import static io.genoflow.core.plan.VariantAnalysisTasks.SEQUENCE_CONTEXT;
import static io.genoflow.core.plan.VariantAnalysisTasks.VARIANT_FILTER;
import static io.genoflow.core.plan.VariantAnalysisTasks.VARIANT_IDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.genoflow.core.critic.FindingsReport;
import io.genoflow.core.critic.ReportStatus;
import io.genoflow.core.critic.check.EvidenceConsistencyCheck;
import io.genoflow.core.exception.TaskExecutionException;
import io.genoflow.core.execution.RunOutcome;
import io.genoflow.core.execution.RunStatus;
import io.genoflow.core.execution.TaskStatus;
import io.genoflow.core.plan.Plan;
import io.genoflow.core.plan.RunParameters;
import io.genoflow.core.plan.VariantAnalysisTasks;
import io.genoflow.core.plan.VariantAnalysisTemplate;
import io.genoflow.core.state.RunSnapshot;
import io.genoflow.core.storage.InMemoryRunStateRepository;
import io.genoflow.core.task.DefaultTaskRegistry;
import io.genoflow.core.task.TaskRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GenoflowFactoryTest {

    private static final List<String> VARIANTS = List.of("chr1:1000:A:G", "chr7:5520:C:T", "chr17:43044:G:A");

    private TaskRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultTaskRegistry();
        registry.register(
                VariantAnalysisTasks.VARIANT_FILTER_CONTRACT,
                (config, context) ->
                        Map.of(
                                "filtered_vcf", config.get("filtered_vcf"),
                                "filter_stats", config.get("filter_stats"),
                                VARIANT_IDS, VARIANTS,
                                "pass_rate", 0.6));
        registry.register(
                VariantAnalysisTasks.SEQUENCE_CONTEXT_CONTRACT,
                (config, context) ->
                        Map.of("contexts_file", config.get("contexts_file"), VARIANT_IDS, VARIANTS));
        registry.register(
                VariantAnalysisTasks.EMBEDDING_CONTRACT,
                (config, context) ->
                        Map.of(
                                "embeddings_file", config.get("embeddings_file"),
                                "embedding_dim", 1536,
                                VARIANT_IDS, VARIANTS));
        registry.register(
                VariantAnalysisTasks.SCORING_CONTRACT,
                (config, context) ->
                        Map.of(
                                "scores_file", config.get("scores_file"),
                                VARIANT_IDS, VARIANTS,
                                "scores", Map.of("chr1:1000:A:G", 0.91, "chr7:5520:C:T", 0.12, "chr17:43044:G:A", 0.57)));
        registry.register(
                VariantAnalysisTasks.EVIDENCE_LOOKUP_CONTRACT,
                (config, context) ->
                        Map.of(
                                "evidence_file", config.get("evidence_file"),
                                VARIANT_IDS, VARIANTS,
                                "grounding_rate", 0.8));
        registry.register(
                VariantAnalysisTasks.REPORT_GENERATION_CONTRACT,
                (config, context) -> Map.of("report_file", config.get("report_file")));
    }

    private static RunParameters parameters() {
        return RunParameters.of(VariantAnalysisTemplate.ANALYSIS_TYPE)
                .with("inputVcf", "/data/proband.vcf.gz")
                .with("outputDir", "/runs/proband")
                .with("sampleName", "proband")
                .with("mockMode", true);
    }

    @Nested
    class Wiring {

        @Test
        void shouldRequireTaskRegistry() {
            assertThatThrownBy(() -> GenoflowFactory.builder().build())
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("taskRegistry");
        }

        @Test
        void shouldExposeComponents() {
            GenoflowConfig config = GenoflowConfig.builder().maxConcurrency(2).build();

            GenoflowEnvironment env = GenoflowFactory.createEnvironment(config, registry);

            assertThat(env.getConfig()).isSameAs(config);
            assertThat(env.getTaskRegistry()).isSameAs(registry);
            assertThat(env.getPlanner()).isNotNull();
            assertThat(env.getGraphExecutor()).isNotNull();
            assertThat(env.getConsistencyChecker()).isNotNull();
            assertThat(env.getRunStateRepository()).isInstanceOf(InMemoryRunStateRepository.class);
        }

        @Test
        void shouldRejectInvalidConcurrency() {
            assertThatThrownBy(() -> GenoflowConfig.builder().maxConcurrency(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectUnknownDisabledCheck() {
            GenoflowConfig config = GenoflowConfig.builder().disableCheck("annotation").build();

            assertThatThrownBy(() -> GenoflowFactory.createEnvironment(config, registry))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("[annotation]");
        }
    }

    @Nested
    class EndToEnd {

        @Test
        void shouldCompileRunAndCheckVariantAnalysis() throws Exception {
            InMemoryRunStateRepository repository = new InMemoryRunStateRepository();
            GenoflowEnvironment env =
                    GenoflowFactory.builder()
                            .taskRegistry(registry)
                            .runStateRepository(repository)
                            .config(GenoflowConfig.builder().maxConcurrency(3).build())
                            .build();

            Plan plan = env.getPlanner().compile(parameters());
            RunOutcome outcome = env.getGraphExecutor().run(plan);
            FindingsReport report = env.getConsistencyChecker().check(plan, outcome);

            assertThat(outcome.status()).isEqualTo(RunStatus.ALL_SUCCEEDED);
            assertThat(outcome.result(REPORT_GENERATION).orElseThrow().outputs())
                    .containsEntry("report_file", "/runs/proband/report.md");
            assertThat(report.findings()).isEmpty();
            assertThat(report.status()).isEqualTo(ReportStatus.PASS);

            RunSnapshot last = repository.findByRunId(outcome.runId()).orElseThrow();
            assertThat(last.isComplete()).isTrue();
            assertThat(last.results()).isEqualTo(outcome.results());
        }

        @Test
        void shouldReportScoreEvidenceConflictUnlessCheckIsDisabled() throws Exception {
            registry.register(
                    VariantAnalysisTasks.EVIDENCE_LOOKUP_CONTRACT,
                    (config, context) ->
                            Map.of(
                                    "evidence_file", config.get("evidence_file"),
                                    VARIANT_IDS, VARIANTS,
                                    "grounding_rate", 0.8,
                                    EVIDENCE,
                                    Map.of(
                                            "chr7:5520:C:T",
                                            Map.of(
                                                    "supporting_evidence", List.of(),
                                                    "clinvar_significance", "Pathogenic"))));

            GenoflowEnvironment checked = GenoflowFactory.createEnvironment(registry);
            Plan plan = checked.getPlanner().compile(parameters());
            RunOutcome outcome = checked.getGraphExecutor().run(plan);

            FindingsReport report = checked.getConsistencyChecker().check(plan, outcome);
            assertThat(report.status()).isEqualTo(ReportStatus.FAIL);
            assertThat(report.findings())
                    .singleElement()
                    .satisfies(f -> assertThat(f.check()).isEqualTo(EvidenceConsistencyCheck.NAME));

            GenoflowEnvironment unchecked =
                    GenoflowFactory.createEnvironment(
                            GenoflowConfig.builder().disableCheck(EvidenceConsistencyCheck.NAME).build(),
                            registry);
            assertThat(unchecked.getConsistencyChecker().check(plan, outcome).status())
                    .isEqualTo(ReportStatus.PASS);
        }

        @Test
        void shouldResumeAfterFailedEmbedding() throws Exception {
            registry.register(
                    VariantAnalysisTasks.EMBEDDING_CONTRACT,
                    (config, context) -> {
                        throw new TaskExecutionException("model_unavailable", "embedding server down");
                    });
            GenoflowEnvironment env = GenoflowFactory.createEnvironment(registry);
            Plan plan = env.getPlanner().compile(parameters());

            RunOutcome failed = env.getGraphExecutor().run(plan);

            assertThat(failed.status()).isEqualTo(RunStatus.PARTIALLY_FAILED);
            assertThat(failed.tasksWithStatus(TaskStatus.SUCCEEDED))
                    .containsExactly(VARIANT_FILTER, SEQUENCE_CONTEXT);
            assertThat(failed.tasksWithStatus(TaskStatus.SKIPPED))
                    .containsExactly(SCORING, EVIDENCE_LOOKUP, REPORT_GENERATION);
            assertThat(env.getRunStateRepository().findIncomplete()).isEmpty();

            registry.register(
                    VariantAnalysisTasks.EMBEDDING_CONTRACT,
                    (config, context) ->
                            Map.of(
                                    "embeddings_file", config.get("embeddings_file"),
                                    "embedding_dim", 1536,
                                    VARIANT_IDS, VARIANTS));
            RunSnapshot checkpoint =
                    env.getRunStateRepository().findByRunId(failed.runId()).orElseThrow();

            RunOutcome resumed = env.getGraphExecutor().resume(checkpoint);

            assertThat(resumed.status()).isEqualTo(RunStatus.ALL_SUCCEEDED);
            assertThat(resumed.result(VARIANT_FILTER)).isEqualTo(failed.result(VARIANT_FILTER));
            assertThat(resumed.statusOf(EMBEDDING)).isEqualTo(TaskStatus.SUCCEEDED);
        }
    }
}
