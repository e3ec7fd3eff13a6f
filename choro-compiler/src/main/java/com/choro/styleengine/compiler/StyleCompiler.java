/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.compiler;

import com.choro.styleengine.api.CompilationListener;
import com.choro.styleengine.api.IStyleCompiler;
import com.choro.styleengine.api.exceptions.MalformedRuleException;
import com.choro.styleengine.api.model.DocumentFormat;
import com.choro.styleengine.api.model.StyleDefinition;
import com.choro.styleengine.compiler.StyleDefinitionValidator.ValidatedRule;
import com.choro.styleengine.compiler.analysis.RuleCoverageAnalyzer;
import com.choro.styleengine.compiler.analysis.RuleCoverageAnalyzer.CoverageReport;
import com.choro.styleengine.compiler.parse.JsonStyleDocumentReader;
import com.choro.styleengine.compiler.parse.SldStyleDocumentReader;
import com.choro.styleengine.compiler.parse.StyleDocumentReader;
import com.choro.styleengine.runtime.model.StyleSheet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Compiles JSON or SLD style documents into immutable {@link StyleSheet}s.
 *
 * The compilation process runs four stages:
 * 1. PARSING: read the document into a format-neutral definition.
 * 2. VALIDATION: check titles, filters, thresholds, colours and stroke widths.
 * 3. MODEL_BUILDING: build the ordered, immutable rule list.
 * 4. COVERAGE_ANALYSIS: look for empty rules, gaps and overlaps, then log, reject or skip
 *    according to the {@link CoverageMode}.
 *
 * A compiler instance holds no per-document state and may be reused.
 */
public class StyleCompiler implements IStyleCompiler {
    private static final Logger logger = Logger.getLogger(StyleCompiler.class.getName());

    private static final int TOTAL_STAGES = 4;

    private final Map<DocumentFormat, StyleDocumentReader> readers = new EnumMap<>(DocumentFormat.class);
    private final StyleDefinitionValidator validator = new StyleDefinitionValidator();
    private final RuleCoverageAnalyzer coverageAnalyzer = new RuleCoverageAnalyzer();
    private final CoverageMode coverageMode;
    private Tracer tracer;
    private CompilationListener compilationListener;

    public StyleCompiler(Tracer tracer, CoverageMode coverageMode) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.coverageMode = Objects.requireNonNull(coverageMode, "coverageMode must not be null");
        readers.put(DocumentFormat.JSON, new JsonStyleDocumentReader());
        readers.put(DocumentFormat.SLD, new SldStyleDocumentReader());
    }

    public StyleCompiler(Tracer tracer) {
        this(tracer, CoverageMode.WARN);
    }

    public StyleCompiler() {
        this(OpenTelemetry.noop().getTracer("choro-compiler"));
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.compilationListener = listener;
    }

    public CoverageMode getCoverageMode() {
        return coverageMode;
    }

    /**
     * Compiles a style document file.
     *
     * @param stylePath path to a {@code .json}, {@code .sld} or {@code .xml} document
     * @return the compiled sheet, named after the document's declared name or its file stem
     * @throws IOException if the file cannot be read
     * @throws MalformedRuleException if the extension is unsupported or a rule is invalid
     */
    @Override
    public StyleSheet compile(Path stylePath) throws IOException {
        DocumentFormat format = DocumentFormat.fromPath(stylePath)
                .orElseThrow(() -> new MalformedRuleException("Unsupported style document type: " + stylePath));
        try (InputStream input = Files.newInputStream(stylePath)) {
            return compile(DocumentFormat.stem(stylePath), input, format);
        }
    }

    @Override
    public StyleSheet compile(String name, InputStream input, DocumentFormat format) throws IOException {
        Objects.requireNonNull(input, "input must not be null");
        StyleDocumentReader reader = readers.get(Objects.requireNonNull(format, "format must not be null"));

        Span span = tracer.spanBuilder("compile-style").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("style.name", name);
            span.setAttribute("style.format", format.name());
            long startTime = System.nanoTime();

            StyleDefinition definition = runStage("PARSING", 1,
                    () -> reader.read(name, input),
                    def -> Map.of("ruleCount", def.rules() == null ? 0 : def.rules().size()));

            List<ValidatedRule> rules = runStage("VALIDATION", 2,
                    () -> validator.validate(definition),
                    valid -> Map.of("validRules", valid.size()));

            StyleSheet.Builder builder = runStage("MODEL_BUILDING", 3,
                    () -> buildModel(definition, rules),
                    b -> Map.of("ruleCount", b.getRuleCount()));

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("format", format.name());
            metadata.put("coverageMode", coverageMode.name());

            List<String> warnings = List.of();
            if (coverageMode != CoverageMode.OFF) {
                CoverageReport report = runStage("COVERAGE_ANALYSIS", 4,
                        () -> checkCoverage(builder.build()),
                        r -> Map.of(
                                "emptyRuleCount", r.emptyRules().size(),
                                "gapCount", r.gaps().size(),
                                "overlapCount", r.overlaps().size()));
                metadata.put("emptyRuleCount", report.emptyRules().size());
                metadata.put("gapCount", report.gaps().size());
                metadata.put("overlapCount", report.overlaps().size());
                metadata.put("partition", report.isPartition());
                warnings = report.findings();
            }

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("ruleCount", builder.getRuleCount());
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));

            StyleSheet sheet = builder
                    .withStats(new StyleSheet.CompileStats(builder.getRuleCount(), compilationTime, metadata, warnings))
                    .build();
            logger.info(String.format("Compiled style '%s' (%s): %d rules, %d coverage warnings",
                    sheet.getName(), format, sheet.getNumRules(), warnings.size()));
            return sheet;

        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private StyleSheet.Builder buildModel(StyleDefinition definition, List<ValidatedRule> rules) {
        StyleSheet.Builder builder = new StyleSheet.Builder(definition.name())
                .withAttribute(definition.attribute());
        for (ValidatedRule rule : rules) {
            builder.addRule(rule.title(), rule.predicate(), rule.symbolizer());
        }
        return builder;
    }

    private CoverageReport checkCoverage(StyleSheet draft) {
        CoverageReport report = coverageAnalyzer.analyze(draft);
        if (coverageMode == CoverageMode.STRICT && report.hasBlockingFindings()) {
            throw new MalformedRuleException(String.format("Style '%s' does not cover its domain: %s",
                    draft.getName(), String.join("; ", report.blockingFindings())));
        }
        for (String finding : report.findings()) {
            logger.warning(String.format("Style '%s': %s", draft.getName(), finding));
        }
        return report;
    }

    @FunctionalInterface
    private interface StageAction<T> {
        T run() throws IOException;
    }

    private <T> T runStage(String stageName, int stageNumber, StageAction<T> action,
                           Function<T, Map<String, Object>> metrics) throws IOException {
        CompilationListener listener = this.compilationListener;
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        Span span = tracer.spanBuilder(stageName.toLowerCase().replace('_', '-')).startSpan();
        long stageStart = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            T result = action.run();
            if (listener != null) {
                listener.onStageComplete(stageName, new CompilationListener.StageResult(
                        stageName, System.nanoTime() - stageStart, metrics.apply(result)));
            }
            return result;
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }
}
