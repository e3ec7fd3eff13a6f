package com.choro.styleengine.compiler;

import com.choro.styleengine.api.CompilationListener;
import com.choro.styleengine.api.exceptions.MalformedRuleException;
import com.choro.styleengine.api.model.DocumentFormat;
import com.choro.styleengine.runtime.model.HexColor;
import com.choro.styleengine.runtime.model.Predicate;
import com.choro.styleengine.runtime.model.StyleRule;
import com.choro.styleengine.runtime.model.StyleSheet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StyleCompilerTest {

    private static final String LITERAL_SLD = "/styles/county_demographic.sld";
    private static final String FIXED_JSON = "/styles/county_demographic_fixed.json";

    @TempDir
    Path tempDir;

    private Path copyFixture(String resource) throws IOException {
        Path target = tempDir.resolve(resource.substring(resource.lastIndexOf('/') + 1));
        try (InputStream in = StyleCompilerTest.class.getResourceAsStream(resource)) {
            assertThat(in).as("fixture %s", resource).isNotNull();
            Files.copy(in, target);
        }
        return target;
    }

    private static StyleCompiler compiler(CoverageMode mode) {
        return new StyleCompiler(OpenTelemetry.noop().getTracer("test"), mode);
    }

    @Nested
    @DisplayName("Literal county_demographic SLD")
    class LiteralSld {

        @Test
        @DisplayName("Should keep the three rules in document order")
        void shouldCompileRulesInOrder() throws IOException {
            StyleSheet sheet = compiler(CoverageMode.WARN).compile(copyFixture(LITERAL_SLD));

            assertThat(sheet.getName()).isEqualTo("county_demographic");
            assertThat(sheet.getAttribute()).isEqualTo("number");
            assertThat(sheet.getRules()).extracting(StyleRule::title)
                    .containsExactly("> 250K", "> 50K", "< 25K");
            assertThat(sheet.getRules()).extracting(StyleRule::index).containsExactly(0, 1, 2);
        }

        @Test
        @DisplayName("Should keep the unsatisfiable middle rule as written")
        void shouldKeepLiteralMiddleRule() throws IOException {
            StyleSheet sheet = compiler(CoverageMode.WARN).compile(copyFixture(LITERAL_SLD));

            StyleRule middle = sheet.findRule("> 50K").orElseThrow();
            assertThat(middle.predicate()).isEqualTo(new Predicate.And(
                    new Predicate.GreaterOrEqual("number", 50000),
                    new Predicate.LessThan("number", 25000)));
            assertThat(middle.symbolizer().fill()).isEqualTo(HexColor.parse("#ABABAB"));
        }

        @Test
        @DisplayName("Should read fills, white strokes and unit stroke width")
        void shouldReadSymbolizers() throws IOException {
            StyleSheet sheet = compiler(CoverageMode.WARN).compile(copyFixture(LITERAL_SLD));

            assertThat(sheet.getRules()).extracting(r -> r.symbolizer().fill().hex())
                    .containsExactly("#666666", "#ABABAB", "#DCDCDC");
            assertThat(sheet.getRules()).allSatisfy(rule -> {
                assertThat(rule.symbolizer().stroke().hex()).isEqualTo("#FFFFFF");
                assertThat(rule.symbolizer().strokeWidth()).isEqualTo(1.0);
            });
        }

        @Test
        @DisplayName("WARN mode should attach the empty rule and the gap as warnings")
        void warnModeShouldAttachFindings() throws IOException {
            StyleSheet sheet = compiler(CoverageMode.WARN).compile(copyFixture(LITERAL_SLD));

            StyleSheet.CompileStats stats = sheet.getStats();
            assertThat(stats.hasWarnings()).isTrue();
            assertThat(stats.warnings()).containsExactly(
                    "Rule '> 50K' can never match: number >= 50000 AND number < 25000 is an empty range",
                    "No rule covers number in [25000, 250000)");
            assertThat(stats.metadata())
                    .containsEntry("format", "SLD")
                    .containsEntry("coverageMode", "WARN")
                    .containsEntry("emptyRuleCount", 1)
                    .containsEntry("gapCount", 1)
                    .containsEntry("overlapCount", 0)
                    .containsEntry("partition", false);
        }

        @Test
        @DisplayName("STRICT mode should reject the sheet")
        void strictModeShouldReject() throws IOException {
            Path sld = copyFixture(LITERAL_SLD);

            assertThatThrownBy(() -> compiler(CoverageMode.STRICT).compile(sld))
                    .isInstanceOf(MalformedRuleException.class)
                    .hasMessageContaining("Style 'county_demographic' does not cover its domain")
                    .hasMessageContaining("[25000, 250000)");
        }

        @Test
        @DisplayName("OFF mode should skip analysis entirely")
        void offModeShouldSkipAnalysis() throws IOException {
            StyleSheet sheet = compiler(CoverageMode.OFF).compile(copyFixture(LITERAL_SLD));

            assertThat(sheet.getStats().warnings()).isEmpty();
            assertThat(sheet.getStats().metadata())
                    .containsEntry("coverageMode", "OFF")
                    .doesNotContainKey("gapCount");
        }
    }

    @Nested
    @DisplayName("Corrected JSON sheet")
    class CorrectedJson {

        @Test
        @DisplayName("Should compile the corrected middle rule")
        void shouldCompileCorrectedRule() throws IOException {
            StyleSheet sheet = compiler(CoverageMode.WARN).compile(copyFixture(FIXED_JSON));

            assertThat(sheet.getName()).isEqualTo("county_demographic_fixed");
            assertThat(sheet.findRule("> 50K").orElseThrow().predicate().describe())
                    .isEqualTo("number >= 50000 AND number < 250000");
            assertThat(sheet.getStats().metadata()).containsEntry("format", "JSON");
        }

        @Test
        @DisplayName("Should still report the remaining 25K to 50K gap")
        void shouldReportRemainingGap() throws IOException {
            StyleSheet sheet = compiler(CoverageMode.WARN).compile(copyFixture(FIXED_JSON));

            assertThat(sheet.getStats().warnings())
                    .containsExactly("No rule covers number in [25000, 50000)");
        }
    }

    @Test
    @DisplayName("Should compile from a stream with an explicit format")
    void shouldCompileFromStream() throws IOException {
        String json = """
                { "rules": [
                    { "title": "low", "filter": { "operator": "LESS_THAN", "value": 10 } },
                    { "title": "high", "filter": { "operator": "GREATER_OR_EQUAL", "value": 10 } }
                ] }
                """;

        StyleSheet sheet = compiler(CoverageMode.STRICT).compile("inline",
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), DocumentFormat.JSON);

        assertThat(sheet.getName()).isEqualTo("inline");
        assertThat(sheet.getNumRules()).isEqualTo(2);
        assertThat(sheet.getStats().metadata()).containsEntry("partition", true);
        assertThat(sheet.getStats().warnings()).isEmpty();
    }

    @Test
    @DisplayName("STRICT mode should accept overlaps and log them as warnings")
    void strictModeShouldAllowOverlaps() throws IOException {
        String json = """
                { "rules": [
                    { "title": "low", "filter": { "operator": "LESS_THAN", "value": 20 } },
                    { "title": "high", "filter": { "operator": "GREATER_OR_EQUAL", "value": 10 } }
                ] }
                """;

        StyleSheet sheet = compiler(CoverageMode.STRICT).compile("overlapping",
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), DocumentFormat.JSON);

        assertThat(sheet.getStats().warnings())
                .containsExactly("Rules 'low' and 'high' overlap on [10, 20); 'low' wins there");
    }

    @Test
    @DisplayName("Should compile SLD symbolizers written as ogc:Literal expressions")
    void shouldCompileLiteralSymbolizers() throws IOException {
        StyleSheet sheet = compiler(CoverageMode.OFF).compile("literal", sldStream("""
                <CssParameter name="fill"><ogc:Literal>#666666</ogc:Literal></CssParameter>
                """, """
                <CssParameter name="stroke"><ogc:Literal>#FFFFFF</ogc:Literal></CssParameter>
                <CssParameter name="stroke-width"><ogc:Literal>3</ogc:Literal></CssParameter>
                """), DocumentFormat.SLD);

        assertThat(sheet.getRule(0).symbolizer()).satisfies(symbolizer -> {
            assertThat(symbolizer.fill()).isEqualTo(HexColor.parse("#666666"));
            assertThat(symbolizer.stroke()).isEqualTo(HexColor.parse("#FFFFFF"));
            assertThat(symbolizer.strokeWidth()).isEqualTo(3.0);
        });
    }

    @Test
    @DisplayName("Should reject SLD symbolizers computed from feature properties")
    void shouldRejectComputedSymbolizers() {
        assertThatThrownBy(() -> compiler(CoverageMode.OFF).compile("computed", sldStream("""
                <CssParameter name="fill"><ogc:PropertyName>colour</ogc:PropertyName></CssParameter>
                """, ""), DocumentFormat.SLD))
                .isInstanceOf(MalformedRuleException.class)
                .hasMessageContaining("fill parameter uses unsupported expression <PropertyName>");
    }

    @Test
    @DisplayName("Should reject an empty SLD parameter instead of applying the default")
    void shouldRejectEmptySymbolizerParameter() {
        assertThatThrownBy(() -> compiler(CoverageMode.OFF).compile("blank", sldStream(
                "<CssParameter name=\"fill\"/>", ""), DocumentFormat.SLD))
                .isInstanceOf(MalformedRuleException.class)
                .hasMessageContaining("Rule 'all' has invalid fill colour: ");
    }

    private static InputStream sldStream(String fillParameters, String strokeParameters) {
        String xml = """
                <StyledLayerDescriptor version="1.0.0"
                    xmlns="http://www.opengis.net/sld" xmlns:ogc="http://www.opengis.net/ogc">
                  <NamedLayer><UserStyle><FeatureTypeStyle>
                    <Rule>
                      <Title>all</Title>
                      <ogc:Filter>
                        <ogc:PropertyIsGreaterThanOrEqualTo>
                          <ogc:PropertyName>number</ogc:PropertyName>
                          <ogc:Literal>-Infinity</ogc:Literal>
                        </ogc:PropertyIsGreaterThanOrEqualTo>
                      </ogc:Filter>
                      <PolygonSymbolizer>
                        <Fill>""" + fillParameters + """
                </Fill>
                        <Stroke>""" + strokeParameters + """
                </Stroke>
                      </PolygonSymbolizer>
                    </Rule>
                  </FeatureTypeStyle></UserStyle></NamedLayer>
                </StyledLayerDescriptor>
                """;
        return new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should default to WARN coverage mode")
    void shouldDefaultToWarn() {
        assertThat(new StyleCompiler().getCoverageMode()).isEqualTo(CoverageMode.WARN);
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Listener and tracing")
    class ListenerAndTracing {

        @Mock
        private CompilationListener listener;

        @Mock
        private Tracer tracer;

        @Mock
        private SpanBuilder spanBuilder;

        @Mock
        private Span span;

        @Mock
        private Scope scope;

        private void stubTracer() {
            when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
            when(spanBuilder.startSpan()).thenReturn(span);
            when(span.makeCurrent()).thenReturn(scope);
        }

        @Test
        @DisplayName("Should report all four stages in order")
        void shouldReportStagesInOrder() throws IOException {
            StyleCompiler compiler = compiler(CoverageMode.WARN);
            compiler.setCompilationListener(listener);

            compiler.compile(copyFixture(LITERAL_SLD));

            InOrder order = inOrder(listener);
            order.verify(listener).onStageStart("PARSING", 1, 4);
            order.verify(listener).onStageComplete(eq("PARSING"), any());
            order.verify(listener).onStageStart("VALIDATION", 2, 4);
            order.verify(listener).onStageComplete(eq("VALIDATION"), any());
            order.verify(listener).onStageStart("MODEL_BUILDING", 3, 4);
            order.verify(listener).onStageComplete(eq("MODEL_BUILDING"), any());
            order.verify(listener).onStageStart("COVERAGE_ANALYSIS", 4, 4);
            order.verify(listener).onStageComplete(eq("COVERAGE_ANALYSIS"), any());
            verify(listener, never()).onError(anyString(), any());
        }

        @Test
        @DisplayName("Should pass stage metrics to the listener")
        void shouldPassStageMetrics() throws IOException {
            StyleCompiler compiler = compiler(CoverageMode.WARN);
            compiler.setCompilationListener(listener);

            compiler.compile(copyFixture(LITERAL_SLD));

            ArgumentCaptor<CompilationListener.StageResult> results =
                    ArgumentCaptor.forClass(CompilationListener.StageResult.class);
            verify(listener, times(4)).onStageComplete(anyString(), results.capture());
            List<CompilationListener.StageResult> stages = results.getAllValues();
            assertThat(stages.get(0).metrics()).containsEntry("ruleCount", 3);
            assertThat(stages.get(1).metrics()).containsEntry("validRules", 3);
            assertThat(stages.get(3).metrics())
                    .containsEntry("emptyRuleCount", 1)
                    .containsEntry("gapCount", 1);
            assertThat(stages).allSatisfy(stage -> assertThat(stage.durationNanos()).isNotNegative());
        }

        @Test
        @DisplayName("Should report the failing stage to the listener")
        void shouldReportFailingStage() throws IOException {
            StyleCompiler compiler = compiler(CoverageMode.STRICT);
            compiler.setCompilationListener(listener);
            Path sld = copyFixture(LITERAL_SLD);

            assertThatThrownBy(() -> compiler.compile(sld)).isInstanceOf(MalformedRuleException.class);

            verify(listener).onError(eq("COVERAGE_ANALYSIS"), any(MalformedRuleException.class));
            verify(listener, never()).onStageComplete(eq("COVERAGE_ANALYSIS"), any());
        }

        @Test
        @DisplayName("Should open one span per compilation and per stage")
        void shouldOpenSpans() throws IOException {
            stubTracer();
            StyleCompiler compiler = new StyleCompiler(tracer, CoverageMode.WARN);

            compiler.compile(copyFixture(FIXED_JSON));

            verify(tracer).spanBuilder("compile-style");
            verify(tracer).spanBuilder("parsing");
            verify(tracer).spanBuilder("validation");
            verify(tracer).spanBuilder("model-building");
            verify(tracer).spanBuilder("coverage-analysis");
            verify(span).setAttribute("style.name", "county_demographic_fixed");
            verify(span, times(5)).end();
        }

        @Test
        @DisplayName("Should record validation failures on the span")
        void shouldRecordExceptionOnSpan() {
            stubTracer();
            StyleCompiler compiler = new StyleCompiler(tracer, CoverageMode.WARN);
            String json = "{ \"rules\": [] }";

            assertThatThrownBy(() -> compiler.compile("empty",
                    new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), DocumentFormat.JSON))
                    .isInstanceOf(MalformedRuleException.class);

            // validation stage span and compile-style span
            verify(span, times(2)).recordException(any(MalformedRuleException.class));
            verify(span, times(3)).end();
        }
    }
}
