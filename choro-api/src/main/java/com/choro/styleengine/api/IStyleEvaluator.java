/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api;

import com.choro.styleengine.api.model.EvaluationResult;
import com.choro.styleengine.api.model.ExplanationResult;
import com.choro.styleengine.api.model.Style;
import com.choro.styleengine.runtime.model.StyleSheet;

import java.util.List;
import java.util.Objects;

/**
 * Contract for classifying a feature attribute value into a style.
 *
 * <p>Rules are tried in declaration order and the first rule whose predicate holds wins.
 * Rule order is therefore part of the contract: authors must order rules from most specific
 * to least specific, or keep their ranges disjoint.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * StyleSheet sheet = compiler.compile(Path.of("styles/county_demographic.sld"));
 * IStyleEvaluator evaluator = new StyleEvaluator(sheet);
 *
 * Style style = evaluator.evaluate(300_000);
 * paint(geometry, style.fillColorHex(), style.strokeColorHex(), style.strokeWidthPx());
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe. The style sheet is immutable and every call is a
 * pure computation over its own input.
 */
public interface IStyleEvaluator {

    /**
     * Returns the style of the first rule whose predicate holds for {@code value}.
     *
     * @param value the feature attribute value
     * @return the matched rule's style
     * @throws com.choro.styleengine.api.exceptions.NoMatchException if no rule matches
     */
    Style evaluate(double value);

    /**
     * Evaluates with a rule-by-rule trace. A miss is reported in the result rather than thrown.
     *
     * <p><b>Performance Note:</b> intended for debugging and legend tooling.
     * For rendering, call {@link #evaluate(double)}.
     *
     * @param value the feature attribute value
     * @return the matched style (if any) and the trace
     */
    EvaluationResult evaluateWithTrace(double value);

    /**
     * Explains why the rule with the given title did or did not match {@code value}.
     *
     * @param value the feature attribute value
     * @param title the rule title
     * @return explanation with comparison-by-comparison analysis
     * @throws IllegalArgumentException if no rule carries the title
     */
    ExplanationResult explainRule(double value, String title);

    /**
     * Evaluates several values. Results are in input order.
     *
     * @param values values to evaluate
     * @return one style per value
     * @throws com.choro.styleengine.api.exceptions.NoMatchException on the first value that matches no rule
     */
    default List<Style> evaluateBatch(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        return values.stream()
            .map(this::evaluate)
            .toList();
    }

    /**
     * Returns the style sheet this evaluator classifies against.
     */
    StyleSheet getStyleSheet();
}
