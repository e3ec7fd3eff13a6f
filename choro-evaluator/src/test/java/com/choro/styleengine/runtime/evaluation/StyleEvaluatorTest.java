package com.choro.styleengine.runtime.evaluation;

import com.choro.styleengine.api.exceptions.NoMatchException;
import com.choro.styleengine.api.model.DocumentFormat;
import com.choro.styleengine.api.model.EvaluationResult;
import com.choro.styleengine.api.model.ExplanationResult;
import com.choro.styleengine.api.model.Style;
import com.choro.styleengine.compiler.CoverageMode;
import com.choro.styleengine.compiler.StyleCompiler;
import com.choro.styleengine.runtime.model.StyleSheet;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StyleEvaluatorTest {

    private static StyleSheet literalSheet;
    private static StyleSheet fixedSheet;

    @BeforeAll
    static void compileSheets() throws IOException {
        StyleCompiler compiler = new StyleCompiler(OpenTelemetry.noop().getTracer("test"), CoverageMode.WARN);
        literalSheet = compile(compiler, "county_demographic", "/styles/county_demographic.sld", DocumentFormat.SLD);
        fixedSheet = compile(compiler, "county_demographic_fixed", "/styles/county_demographic_fixed.json",
                DocumentFormat.JSON);
    }

    private static StyleSheet compile(StyleCompiler compiler, String name, String resource, DocumentFormat format)
            throws IOException {
        try (InputStream in = StyleEvaluatorTest.class.getResourceAsStream(resource)) {
            return compiler.compile(name, in, format);
        }
    }

    @Nested
    @DisplayName("Literal county_demographic sheet")
    class LiteralSheet {

        private final StyleEvaluator evaluator = new StyleEvaluator(literalSheet);

        @ParameterizedTest
        @ValueSource(doubles = {250_000, 300_000, 1_000_000_000, Double.POSITIVE_INFINITY})
        @DisplayName("Values at or above 250K should get the darkest fill")
        void shouldClassifyLargeCounties(double value) {
            Style style = evaluator.evaluate(value);

            assertThat(style.title()).isEqualTo("> 250K");
            assertThat(style.fillColorHex()).isEqualTo("#666666");
            assertThat(style.strokeColorHex()).isEqualTo("#FFFFFF");
            assertThat(style.strokeWidthPx()).isEqualTo(1.0);
        }

        @ParameterizedTest
        @ValueSource(doubles = {24_999, 10_000, 0, -5, Double.NEGATIVE_INFINITY})
        @DisplayName("Values below 25K should get the lightest fill")
        void shouldClassifySmallCounties(double value) {
            Style style = evaluator.evaluate(value);

            assertThat(style.title()).isEqualTo("< 25K");
            assertThat(style.fillColorHex()).isEqualTo("#DCDCDC");
        }

        @ParameterizedTest
        @ValueSource(doubles = {25_000, 50_000, 60_000, 249_999.99})
        @DisplayName("Values between 25K and 250K should match no rule")
        void shouldRaiseNoMatchInGap(double value) {
            assertThatThrownBy(() -> evaluator.evaluate(value))
                    .isInstanceOf(NoMatchException.class)
                    .hasMessageContaining("county_demographic")
                    .satisfies(e -> {
                        NoMatchException noMatch = (NoMatchException) e;
                        assertThat(noMatch.getValue()).isEqualTo(value);
                        assertThat(noMatch.getStyleName()).isEqualTo("county_demographic");
                    });
        }

        @Test
        @DisplayName("NaN should match no rule")
        void shouldRejectNaN() {
            assertThatThrownBy(() -> evaluator.evaluate(Double.NaN))
                    .isInstanceOf(NoMatchException.class);
        }

        @Test
        @DisplayName("Repeated evaluation should return equal styles")
        void shouldBeIdempotent() {
            Style first = evaluator.evaluate(300_000);
            Style second = evaluator.evaluate(300_000);

            assertThat(second).isEqualTo(first);
            assertThat(literalSheet.getNumRules()).isEqualTo(3);
        }

        @Test
        @DisplayName("Trace should visit every rule on a miss")
        void traceShouldListAllRulesOnMiss() {
            EvaluationResult result = evaluator.evaluateWithTrace(60_000);

            assertThat(result.hasMatch()).isFalse();
            assertThat(result.trace().matchedTitle()).isNull();
            assertThat(result.trace().rulesVisited()).isEqualTo(3);
            assertThat(result.trace().ruleOutcomes())
                    .allSatisfy(outcome -> assertThat(outcome.matched()).isFalse());
            assertThat(result.trace().ruleOutcomes().get(1).predicate())
                    .isEqualTo("number >= 50000 AND number < 25000");
        }

        @Test
        @DisplayName("Trace should stop at the first matching rule")
        void traceShouldStopAtFirstMatch() {
            EvaluationResult result = evaluator.evaluateWithTrace(300_000);

            assertThat(result.hasMatch()).isTrue();
            assertThat(result.style().title()).isEqualTo("> 250K");
            assertThat(result.trace().rulesVisited()).isEqualTo(1);
            assertThat(result.trace().matchedTitle()).isEqualTo("> 250K");
            assertThat(result.trace().totalDurationNanos()).isNotNegative();
        }

        @Test
        @DisplayName("Explanation should show which half of the middle rule fails")
        void shouldExplainEmptyRule() {
            ExplanationResult explanation = evaluator.explainRule(60_000, "> 50K");

            assertThat(explanation.matched()).isFalse();
            assertThat(explanation.shadowedBy()).isNull();
            assertThat(explanation.conditionExplanations()).hasSize(2);
            assertThat(explanation.passedCount()).isEqualTo(1);
            ExplanationResult.ConditionExplanation failed = explanation.conditionExplanations().get(1);
            assertThat(failed.operator()).isEqualTo("<");
            assertThat(failed.threshold()).isEqualTo(25_000);
            assertThat(failed.reason()).isEqualTo(ExplanationResult.ConditionExplanation.REASON_AT_OR_ABOVE_THRESHOLD);
            assertThat(explanation.summary()).contains("failed 1/2 conditions");
        }

        @Test
        @DisplayName("Explaining an unknown title should fail")
        void shouldRejectUnknownTitle() {
            assertThatThrownBy(() -> evaluator.explainRule(1, "> 1M"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("> 1M");
        }

        @Test
        @DisplayName("Batch evaluation should keep order and stop at the first miss")
        void shouldEvaluateBatch() {
            List<Style> styles = evaluator.evaluateBatch(List.of(300_000.0, 10_000.0, 250_000.0));

            assertThat(styles).extracting(Style::title).containsExactly("> 250K", "< 25K", "> 250K");
            assertThatThrownBy(() -> evaluator.evaluateBatch(List.of(10_000.0, 60_000.0)))
                    .isInstanceOf(NoMatchException.class);
        }
    }

    @Nested
    @DisplayName("Corrected sheet")
    class CorrectedSheet {

        private final StyleEvaluator evaluator = new StyleEvaluator(fixedSheet);

        @Test
        @DisplayName("60000 should get the middle fill")
        void shouldClassifyMiddleBand() {
            Style style = evaluator.evaluate(60_000);

            assertThat(style.title()).isEqualTo("> 50K");
            assertThat(style.fillColorHex()).isEqualTo("#ABABAB");
        }

        @Test
        @DisplayName("The 25K to 50K band still matches no rule")
        void shouldKeepRemainingGap() {
            assertThatThrownBy(() -> evaluator.evaluate(30_000)).isInstanceOf(NoMatchException.class);
        }

        @Test
        @DisplayName("Explanation should confirm the match")
        void shouldExplainMatch() {
            ExplanationResult explanation = evaluator.explainRule(60_000, "> 50K");

            assertThat(explanation.matched()).isTrue();
            assertThat(explanation.failedCount()).isZero();
            assertThat(explanation.toDetailedString()).contains("MATCHED");
        }
    }

    @Test
    @DisplayName("Explanation should name the earlier rule that shadows a holding rule")
    void shouldReportShadowing() throws IOException {
        String json = """
                { "name": "overlapping", "rules": [
                    { "title": "big", "filter": { "operator": "GREATER_OR_EQUAL", "value": 100 } },
                    { "title": "huge", "filter": { "operator": "GREATER_OR_EQUAL", "value": 1000 } },
                    { "title": "small", "filter": { "operator": "LESS_THAN", "value": 100 } }
                ] }
                """;
        StyleSheet sheet = new StyleCompiler().compile("overlapping",
                new java.io.ByteArrayInputStream(json.getBytes(java.nio.charset.StandardCharsets.UTF_8)),
                DocumentFormat.JSON);
        StyleEvaluator evaluator = new StyleEvaluator(sheet);

        ExplanationResult explanation = evaluator.explainRule(5_000, "huge");

        assertThat(evaluator.evaluate(5_000).title()).isEqualTo("big");
        assertThat(explanation.matched()).isFalse();
        assertThat(explanation.shadowedBy()).isEqualTo("big");
        assertThat(explanation.summary()).contains("'big' matches first");
    }

    @Test
    @DisplayName("Metrics should count hits per rule and misses")
    void shouldTrackMetrics() {
        StyleEvaluator evaluator = new StyleEvaluator(literalSheet);

        evaluator.evaluate(300_000);
        evaluator.evaluate(400_000);
        evaluator.evaluate(10_000);
        assertThatThrownBy(() -> evaluator.evaluate(60_000)).isInstanceOf(NoMatchException.class);

        EvaluatorMetrics metrics = evaluator.getMetrics();
        assertThat(metrics.getTotalEvaluations()).isEqualTo(4);
        assertThat(metrics.getTotalMisses()).isEqualTo(1);
        assertThat(metrics.getRuleHits(0)).isEqualTo(2);
        assertThat(metrics.getRuleHits(1)).isZero();
        assertThat(metrics.getRuleHits(2)).isEqualTo(1);

        Map<String, Object> snapshot = metrics.getSnapshot();
        assertThat(snapshot).containsEntry("totalEvaluations", 4L)
                .containsEntry("totalMisses", 1L)
                .containsEntry("missRatePercent", 25.0)
                .containsKeys("p50LatencyNanos", "p99LatencyNanos");
        assertThat((long[]) snapshot.get("ruleHits")).containsExactly(2L, 0L, 1L);
    }

    @Test
    @DisplayName("Concurrent evaluation should agree with single-threaded results")
    void shouldBeThreadSafe() throws Exception {
        StyleEvaluator evaluator = new StyleEvaluator(literalSheet);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    int large = 0;
                    for (int i = 0; i < 1_000; i++) {
                        if (evaluator.evaluate(i % 2 == 0 ? 300_000 : 1_000).title().equals("> 250K")) {
                            large++;
                        }
                    }
                    return large;
                }));
            }
            for (Future<Integer> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS)).isEqualTo(500);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(evaluator.getMetrics().getTotalEvaluations()).isEqualTo(8_000);
        assertThat(evaluator.getMetrics().getRuleHits(0)).isEqualTo(4_000);
    }
}
