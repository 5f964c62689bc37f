package io.genoflow.core.plan;

import static io.genoflow.core.plan.VariantAnalysisTasks.EMBEDDING;
import static io.genoflow.core.plan.VariantAnalysisTasks.EVIDENCE_LOOKUP;
import static io.genoflow.core.plan.VariantAnalysisTasks.REPORT_GENERATION;
import static io.genoflow.core.plan.VariantAnalysisTasks.SCORING;
import static io.genoflow.core.plan.VariantAnalysisTasks.SEQUENCE_CONTEXT;
import static io.genoflow.core.plan.VariantAnalysisTasks.VARIANT_FILTER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.genoflow.core.exception.InvalidConfigurationException;
import io.genoflow.core.task.DefaultTaskRegistry;
import io.genoflow.core.task.TaskContract;
import io.genoflow.core.task.TaskRegistry;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VariantAnalysisTemplateTest {

    private TemplatePlanner planner;

    @BeforeEach
    void setUp() {
        TaskRegistry registry = new DefaultTaskRegistry();
        for (TaskContract contract : VariantAnalysisTasks.contracts()) {
            registry.register(contract, (config, context) -> Map.of());
        }
        planner = new TemplatePlanner(List.of(new VariantAnalysisTemplate()), registry);
    }

    private static RunParameters parameters() {
        return RunParameters.of(VariantAnalysisTemplate.ANALYSIS_TYPE)
                .with("inputVcf", "/data/NA12878.vcf.gz")
                .with("outputDir", "/runs/na12878")
                .with("sampleName", "NA12878");
    }

    @Nested
    class Shape {

        @Test
        void shouldCompileSixTaskPipeline() throws Exception {
            Plan plan = planner.compile(parameters());

            assertThat(plan.taskIds())
                    .containsExactly(
                            VARIANT_FILTER,
                            SEQUENCE_CONTEXT,
                            EMBEDDING,
                            SCORING,
                            EVIDENCE_LOOKUP,
                            REPORT_GENERATION);
        }

        @Test
        void shouldDeclareDataFlowEdges() throws Exception {
            Plan plan = planner.compile(parameters());

            assertThat(plan.task(SCORING).orElseThrow().dependsOn())
                    .containsExactly(EMBEDDING, SEQUENCE_CONTEXT);
            assertThat(plan.task(REPORT_GENERATION).orElseThrow().dependsOn())
                    .containsExactly(SCORING, EVIDENCE_LOOKUP);
            assertThat(plan.task(REPORT_GENERATION).orElseThrow().references())
                    .containsExactly(
                            new OutputReference(SCORING, "scores_file"),
                            new OutputReference(EVIDENCE_LOOKUP, "evidence_file"));
        }

        @Test
        void shouldApplyDefaultsAndParameters() throws Exception {
            Plan plan = planner.compile(parameters().with("minQuality", 50));

            TaskSpec filter = plan.task(VARIANT_FILTER).orElseThrow();
            assertThat(filter.config())
                    .containsEntry("vcf_file", "/data/NA12878.vcf.gz")
                    .containsEntry("min_quality", 50)
                    .containsEntry("max_pop_freq", 0.01)
                    .containsEntry("filtered_vcf", "/runs/na12878/variants.filtered.vcf");
            assertThat(filter.config().get("consequence_types"))
                    .asInstanceOf(InstanceOfAssertFactories.LIST)
                    .contains("missense_variant", "stop_gained");
            assertThat(filter.description()).contains("NA12878");

            TaskSpec embedding = plan.task(EMBEDDING).orElseThrow();
            assertThat(embedding.config())
                    .containsEntry("batch_size", 32)
                    .containsEntry("mock_mode", false)
                    .containsEntry("model_name", "genos-1.2b");
        }
    }

    @Nested
    class ParameterValidation {

        @Test
        void shouldRejectFrequencyOutsideUnitInterval() {
            assertThatThrownBy(() -> planner.compile(parameters().with("maxPopulationFrequency", 1.5)))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("maxPopulationFrequency");
        }

        @Test
        void shouldRejectNegativeQuality() {
            assertThatThrownBy(() -> planner.compile(parameters().with("minQuality", -1)))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("minQuality");
        }

        @Test
        void shouldRejectNonNumericBatchSize() {
            assertThatThrownBy(() -> planner.compile(parameters().with("batchSize", "many")))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("batchSize must be numeric");
        }

        @Test
        void shouldAcceptNumericStrings() throws Exception {
            Plan plan = planner.compile(parameters().with("minQuality", "20"));

            assertThat(plan.task(VARIANT_FILTER).orElseThrow().config())
                    .containsEntry("min_quality", "20");
        }
    }
}
