/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.runtime.operators;

import com.choro.styleengine.api.model.ExplanationResult.ConditionExplanation;
import com.choro.styleengine.runtime.model.Predicate;

import java.util.ArrayList;
import java.util.List;

/**
 * Breaks a predicate into its leaf comparisons and reports each one against a value.
 *
 * <p>{@code And} nodes are flattened left to right, so the explanations follow the order the
 * comparisons appear in the style document. Every leaf is reported, including those an
 * evaluation would have short-circuited.
 */
public final class PredicateExplainer {

    static final String REASON_PASSED = "Passed";

    private PredicateExplainer() {
    }

    public static List<ConditionExplanation> explain(Predicate predicate, double value) {
        List<ConditionExplanation> explanations = new ArrayList<>();
        collect(predicate, value, explanations);
        return explanations;
    }

    private static void collect(Predicate predicate, double value, List<ConditionExplanation> out) {
        if (predicate instanceof Predicate.And and) {
            collect(and.left(), value, out);
            collect(and.right(), value, out);
        } else if (predicate instanceof Predicate.GreaterOrEqual gte) {
            boolean passed = gte.test(value);
            out.add(new ConditionExplanation(gte.field(), ">=", gte.threshold(), value, passed,
                    reason(passed, value, ConditionExplanation.REASON_BELOW_THRESHOLD)));
        } else if (predicate instanceof Predicate.LessThan lt) {
            boolean passed = lt.test(value);
            out.add(new ConditionExplanation(lt.field(), "<", lt.threshold(), value, passed,
                    reason(passed, value, ConditionExplanation.REASON_AT_OR_ABOVE_THRESHOLD)));
        } else {
            throw new IllegalArgumentException("Unsupported predicate: " + predicate);
        }
    }

    private static String reason(boolean passed, double value, String failure) {
        if (passed) {
            return REASON_PASSED;
        }
        return Double.isNaN(value) ? ConditionExplanation.REASON_NOT_A_NUMBER : failure;
    }
}
