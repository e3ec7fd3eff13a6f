/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.runtime.evaluation;

import com.choro.styleengine.api.IStyleEvaluator;
import com.choro.styleengine.api.exceptions.NoMatchException;
import com.choro.styleengine.api.model.EvaluationResult;
import com.choro.styleengine.api.model.EvaluationTrace;
import com.choro.styleengine.api.model.ExplanationResult;
import com.choro.styleengine.api.model.Style;
import com.choro.styleengine.runtime.model.StyleRule;
import com.choro.styleengine.runtime.model.StyleSheet;
import com.choro.styleengine.runtime.operators.PredicateExplainer;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * First-match evaluator over a compiled {@link StyleSheet}.
 *
 * <h2>Semantics</h2>
 * <p>
 * Rules are tested in declaration order and the first rule whose predicate holds decides the
 * style. When none holds, {@link NoMatchException} is thrown; there is no default style. A
 * {@code NaN} value satisfies no comparison and therefore never matches.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The sheet is immutable and each call keeps its state on the stack, so one instance can be
 * shared by any number of threads. {@link EvaluatorMetrics} is the only shared mutable state.
 */
public final class StyleEvaluator implements IStyleEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(StyleEvaluator.class);

    private final StyleSheet sheet;
    private final List<StyleRule> rules;
    private final Tracer tracer;
    private final EvaluatorMetrics metrics;

    /**
     * Creates an evaluator.
     *
     * @param sheet  compiled style sheet
     * @param tracer OpenTelemetry tracer for observability
     */
    public StyleEvaluator(StyleSheet sheet, Tracer tracer) {
        this.sheet = Objects.requireNonNull(sheet, "sheet must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.rules = sheet.getRules();
        this.metrics = new EvaluatorMetrics(rules.size());
        logger.info("StyleEvaluator initialized for style '{}', {} rules", sheet.getName(), rules.size());
    }

    /**
     * Creates an evaluator with a no-op tracer.
     */
    public StyleEvaluator(StyleSheet sheet) {
        this(sheet, OpenTelemetry.noop().getTracer("choro-evaluator"));
    }

    @Override
    public Style evaluate(double value) {
        Span span = tracer.spanBuilder("evaluate-style").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("style.name", sheet.getName());
            span.setAttribute("value", value);
            long startTime = System.nanoTime();

            for (int i = 0; i < rules.size(); i++) {
                StyleRule rule = rules.get(i);
                if (rule.matches(value)) {
                    metrics.recordMatch(i, System.nanoTime() - startTime, i + 1);
                    span.setAttribute("matchedRule", rule.title());
                    return rule.toStyle();
                }
            }

            metrics.recordMiss(System.nanoTime() - startTime, rules.size());
            logger.debug("No rule in style '{}' matches {}={}", sheet.getName(), sheet.getAttribute(), value);
            throw new NoMatchException(sheet.getName(), sheet.getAttribute(), value);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>The trace lists the rules in the order they were tested, ending with the matching rule,
     * or every rule on a miss.
     */
    @Override
    public EvaluationResult evaluateWithTrace(double value) {
        long startTime = System.nanoTime();
        List<EvaluationTrace.RuleOutcome> outcomes = new ArrayList<>(rules.size());
        StyleRule matched = null;

        for (StyleRule rule : rules) {
            boolean holds = rule.matches(value);
            outcomes.add(new EvaluationTrace.RuleOutcome(
                    rule.index(), rule.title(), rule.predicate().describe(), holds));
            if (holds) {
                matched = rule;
                break;
            }
        }

        long duration = System.nanoTime() - startTime;
        EvaluationTrace trace = new EvaluationTrace(sheet.getName(), value, duration, List.copyOf(outcomes),
                matched == null ? null : matched.title());
        if (matched != null) {
            metrics.recordMatch(matched.index(), duration, trace.rulesVisited());
        } else {
            metrics.recordMiss(duration, trace.rulesVisited());
        }
        return new EvaluationResult(matched == null ? null : matched.toStyle(), trace);
    }

    /**
     * {@inheritDoc}
     *
     * <p>A rule whose predicate holds can still lose to an earlier rule; the result then names
     * that rule in {@code shadowedBy} and reports the rule as not matched.
     */
    @Override
    public ExplanationResult explainRule(double value, String title) {
        Objects.requireNonNull(title, "title must not be null");
        StyleRule rule = sheet.findRule(title)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Rule not found in style '" + sheet.getName() + "': " + title));

        List<ExplanationResult.ConditionExplanation> explanations =
                PredicateExplainer.explain(rule.predicate(), value);
        boolean holds = rule.matches(value);

        String shadowedBy = null;
        if (holds) {
            for (int i = 0; i < rule.index(); i++) {
                if (rules.get(i).matches(value)) {
                    shadowedBy = rules.get(i).title();
                    break;
                }
            }
        }
        boolean matched = holds && shadowedBy == null;

        String attribute = sheet.getAttribute();
        String summary;
        if (matched) {
            summary = String.format("Rule '%s' matched %s=%s", title, attribute, value);
        } else if (holds) {
            summary = String.format("Rule '%s' holds for %s=%s but '%s' matches first",
                    title, attribute, value, shadowedBy);
        } else {
            summary = String.format("Rule '%s' did not match %s=%s (failed %d/%d conditions)",
                    title, attribute, value,
                    explanations.stream().filter(e -> !e.passed()).count(),
                    explanations.size());
        }

        return new ExplanationResult(title, matched, shadowedBy, summary, explanations);
    }

    @Override
    public StyleSheet getStyleSheet() {
        return sheet;
    }

    public EvaluatorMetrics getMetrics() {
        return metrics;
    }
}
