package io.genoflow.core.plan;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConfigValuesTest {

    @Nested
    class References {

        @Test
        void shouldParseWholeStringReference() {
            Map<String, Object> config = ConfigValues.normalize(Map.of("in", "${output.a.file}"));

            assertThat(config.get("in")).isEqualTo(new OutputReference("a", "file"));
        }

        @Test
        void shouldParseEmbeddedReferencesAsTemplate() {
            Map<String, Object> config =
                    ConfigValues.normalize(Map.of("cmd", "cat ${output.a.x} ${output.b.y} > out"));

            assertThat(config.get("cmd")).isInstanceOf(ReferenceTemplate.class);
            ReferenceTemplate template = (ReferenceTemplate) config.get("cmd");
            assertThat(template.references())
                    .containsExactly(new OutputReference("a", "x"), new OutputReference("b", "y"));
        }

        @Test
        void shouldKeepPlainTextAndPlaceholders() {
            Map<String, Object> config =
                    ConfigValues.normalize(Map.of("a", "{outputDir}/x", "b", "$output.a.x"));

            assertThat(config).containsEntry("a", "{outputDir}/x").containsEntry("b", "$output.a.x");
        }

        @Test
        void shouldKeepKeyWithDots() {
            assertThat(OutputReference.parse("${output.a.nested.key}"))
                    .contains(new OutputReference("a", "nested.key"));
        }

        @Test
        void shouldCollectReferencesDepthFirst() {
            Map<String, Object> config =
                    ConfigValues.normalize(
                            Map.of(
                                    "list",
                                    List.of("${output.a.x}", Map.of("inner", "${output.b.y}"))));

            assertThat(ConfigValues.references(config))
                    .containsExactly(new OutputReference("a", "x"), new OutputReference("b", "y"));
        }

        @Test
        void shouldNotParseLiteralValues() {
            Map<String, Object> values = ConfigValues.normalizeLiteral(Map.of("p", "${output.a.x}"));

            assertThat(values.get("p")).isEqualTo("${output.a.x}");
        }
    }

    @Nested
    class Canonicalization {

        @Test
        void shouldNarrowIntegralNumbers() {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("long", 5L);
            values.put("big", 7_000_000_000L);
            values.put("bigInteger", BigInteger.TEN);
            values.put("decimal", new BigDecimal("3"));
            values.put("float", 0.5f);

            Map<String, Object> config = ConfigValues.normalize(values);

            assertThat(config.get("long")).isEqualTo(5);
            assertThat(config.get("big")).isEqualTo(7_000_000_000L);
            assertThat(config.get("bigInteger")).isEqualTo(10);
            assertThat(config.get("decimal")).isEqualTo(3);
            assertThat(config.get("float")).isEqualTo(0.5d);
        }

        @Test
        void shouldKeepNullValuesAndOrder() {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("z", null);
            values.put("a", true);

            Map<String, Object> config = ConfigValues.normalize(values);

            assertThat(config).containsKeys("z", "a");
            assertThat(config.keySet()).containsExactly("z", "a");
            assertThat(config.get("z")).isNull();
        }

        @Test
        void shouldRenderReferencesBackToRawText() {
            Map<String, Object> config =
                    ConfigValues.normalize(Map.of("in", "${output.a.x}", "cmd", "run ${output.b.y}"));

            @SuppressWarnings("unchecked")
            Map<String, Object> raw = (Map<String, Object>) ConfigValues.toRaw(config);

            assertThat(raw).containsEntry("in", "${output.a.x}").containsEntry("cmd", "run ${output.b.y}");
            assertThat(ConfigValues.normalize(raw)).isEqualTo(config);
        }
    }
}
