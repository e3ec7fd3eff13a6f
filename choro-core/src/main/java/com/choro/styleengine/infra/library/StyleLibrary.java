/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.infra.library;

import com.choro.styleengine.api.IStyleCompiler;
import com.choro.styleengine.api.IStyleEvaluator;
import com.choro.styleengine.api.exceptions.MalformedRuleException;
import com.choro.styleengine.api.exceptions.StyleNotFoundException;
import com.choro.styleengine.api.model.DocumentFormat;
import com.choro.styleengine.compiler.StyleCompiler;
import com.choro.styleengine.infra.config.StyleEngineConfig;
import com.choro.styleengine.infra.metrics.Counter;
import com.choro.styleengine.infra.metrics.MetricsRegistry;
import com.choro.styleengine.runtime.evaluation.StyleEvaluator;
import com.choro.styleengine.runtime.model.StyleSheet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The set of layer styles published by one styles directory.
 *
 * <p>Every {@code .sld}, {@code .xml} and {@code .json} document in the directory is compiled
 * once, at load time, and stored under its file stem. A map layer is styled by the document
 * named {@code <geolevel>_<subject>}; layers without one get the fallback style
 * ({@code polygon} unless configured otherwise).
 *
 * <p>Loading fails fast: one malformed document aborts the whole library. After loading the
 * library is read-only and safe to share between threads.
 */
public final class StyleLibrary {
    private static final Logger logger = Logger.getLogger(StyleLibrary.class.getName());

    static final String METRIC_STYLES_LOADED = "choro_styles_loaded";
    static final String METRIC_LOOKUPS = "choro_style_lookups_total";
    static final String METRIC_FALLBACKS = "choro_style_fallbacks_total";
    static final String METRIC_LOAD = "choro_style_load";

    private final Map<String, StyleSheet> sheets;
    private final Map<String, IStyleEvaluator> evaluators = new ConcurrentHashMap<>();
    private final String fallbackStyle;
    private final Tracer tracer;
    private final Counter lookups;
    private final Counter fallbacks;

    private StyleLibrary(Map<String, StyleSheet> sheets, String fallbackStyle, Tracer tracer,
                         MetricsRegistry metrics) {
        this.sheets = Collections.unmodifiableMap(sheets);
        this.fallbackStyle = fallbackStyle;
        this.tracer = tracer;
        this.lookups = metrics.counter(METRIC_LOOKUPS);
        this.fallbacks = metrics.counter(METRIC_FALLBACKS);
    }

    /**
     * Loads the styles directory named by {@code config}, compiling with the configured coverage
     * mode and a no-op tracer.
     */
    public static StyleLibrary load(StyleEngineConfig config) throws IOException {
        Tracer tracer = OpenTelemetry.noop().getTracer("choro-core");
        return load(config, new StyleCompiler(tracer, config.getCoverageMode()), tracer);
    }

    public static StyleLibrary load(StyleEngineConfig config, IStyleCompiler compiler, Tracer tracer)
            throws IOException {
        return load(config, compiler, tracer, MetricsRegistry.getInstance());
    }

    /**
     * Compiles every style document in the configured directory.
     *
     * @throws NoSuchFileException if the styles directory does not exist
     * @throws IOException if the directory or a document cannot be read
     * @throws MalformedRuleException if a document is invalid, two documents share a stem, or a
     *         sheet classifies on another attribute than the configured one
     */
    public static StyleLibrary load(StyleEngineConfig config, IStyleCompiler compiler, Tracer tracer,
                                    MetricsRegistry metrics) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(compiler, "compiler must not be null");
        Objects.requireNonNull(tracer, "tracer must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");

        Path dir = config.getStylesDir();
        Span span = tracer.spanBuilder("load-style-library").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("styles.dir", dir.toString());
            long startTime = System.nanoTime();

            if (!Files.isDirectory(dir)) {
                throw new NoSuchFileException(dir.toString(), null, "styles directory not found");
            }

            List<Path> documents;
            try (Stream<Path> files = Files.list(dir)) {
                documents = files
                        .filter(Files::isRegularFile)
                        .filter(p -> DocumentFormat.fromPath(p).isPresent())
                        .sorted()
                        .collect(Collectors.toList());
            }

            Map<String, StyleSheet> sheets = new TreeMap<>();
            Map<String, Path> sources = new TreeMap<>();
            for (Path document : documents) {
                String key = DocumentFormat.stem(document);
                Path previous = sources.putIfAbsent(key, document);
                if (previous != null) {
                    throw new MalformedRuleException(String.format("Duplicate style name '%s': %s and %s",
                            key, previous.getFileName(), document.getFileName()));
                }
                StyleSheet sheet = compile(compiler, document);
                if (!sheet.getAttribute().equals(config.getAttribute())) {
                    throw new MalformedRuleException(String.format(
                            "Style '%s' classifies on '%s' but the library expects '%s'",
                            key, sheet.getAttribute(), config.getAttribute()));
                }
                sheets.put(key, sheet);
            }

            long loadTime = System.nanoTime() - startTime;
            metrics.gauge(METRIC_STYLES_LOADED).set(sheets.size());
            metrics.timer(METRIC_LOAD).record(Duration.ofNanos(loadTime));
            span.setAttribute("styleCount", sheets.size());

            logger.info(String.format("Loaded %d styles from %s in %.2f ms",
                    sheets.size(), dir, loadTime / 1_000_000.0));
            if (!sheets.containsKey(config.getFallbackStyle())) {
                logger.warning(String.format(
                        "Fallback style '%s' not found in %s; layers without a style will fail",
                        config.getFallbackStyle(), dir));
            }
            return new StyleLibrary(sheets, config.getFallbackStyle(), tracer, metrics);

        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static StyleSheet compile(IStyleCompiler compiler, Path document) throws IOException {
        try {
            return compiler.compile(document);
        } catch (MalformedRuleException e) {
            logger.log(Level.SEVERE, "Failed to compile style document " + document, e);
            throw new MalformedRuleException(
                    "Style document " + document.getFileName() + " is invalid: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the style for a map layer.
     *
     * @param geolevel geographic level, e.g. {@code county}
     * @param subject  demographic subject, e.g. {@code demographic}
     * @return the sheet named {@code <geolevel>_<subject>}, or the fallback sheet
     * @throws StyleNotFoundException if neither exists
     */
    public StyleSheet styleFor(String geolevel, String subject) {
        return sheets.get(resolve(geolevel, subject));
    }

    /**
     * Returns a cached evaluator for the layer's style.
     *
     * @throws StyleNotFoundException if the layer has no style and there is no fallback
     */
    public IStyleEvaluator evaluatorFor(String geolevel, String subject) {
        String key = resolve(geolevel, subject);
        return evaluators.computeIfAbsent(key, k -> new StyleEvaluator(sheets.get(k), tracer));
    }

    private String resolve(String geolevel, String subject) {
        Objects.requireNonNull(geolevel, "geolevel must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        lookups.increment();

        String name = geolevel + "_" + subject;
        if (sheets.containsKey(name)) {
            return name;
        }
        if (!sheets.containsKey(fallbackStyle)) {
            throw new StyleNotFoundException(name, fallbackStyle);
        }
        fallbacks.increment();
        logger.fine(String.format("No style '%s', using fallback '%s'", name, fallbackStyle));
        return fallbackStyle;
    }

    /**
     * Names of all loaded styles, in sorted order.
     */
    public Set<String> styleNames() {
        return sheets.keySet();
    }

    public int size() {
        return sheets.size();
    }

    public String getFallbackStyle() {
        return fallbackStyle;
    }
}
