/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.runtime.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Boolean condition over one numeric attribute.
 *
 * <p>The variant set is closed: a threshold comparison from below, one from above, and the
 * conjunction of two predicates. Comparisons follow IEEE-754 double semantics, so {@code NaN}
 * satisfies neither comparison.
 */
public sealed interface Predicate extends Serializable permits Predicate.GreaterOrEqual, Predicate.LessThan, Predicate.And {

    /**
     * Tests the predicate against an attribute value.
     */
    boolean test(double value);

    /**
     * Human-readable form, e.g. {@code number >= 50000 AND number < 25000}.
     */
    String describe();

    /**
     * True iff {@code value >= threshold}.
     */
    record GreaterOrEqual(String field, double threshold) implements Predicate {
        public GreaterOrEqual {
            Objects.requireNonNull(field, "field must not be null");
            if (Double.isNaN(threshold)) {
                throw new IllegalArgumentException("Threshold must not be NaN");
            }
        }

        @Override
        public boolean test(double value) {
            return value >= threshold;
        }

        @Override
        public String describe() {
            return field + " >= " + Predicate.formatThreshold(threshold);
        }
    }

    /**
     * True iff {@code value < threshold}.
     */
    record LessThan(String field, double threshold) implements Predicate {
        public LessThan {
            Objects.requireNonNull(field, "field must not be null");
            if (Double.isNaN(threshold)) {
                throw new IllegalArgumentException("Threshold must not be NaN");
            }
        }

        @Override
        public boolean test(double value) {
            return value < threshold;
        }

        @Override
        public String describe() {
            return field + " < " + Predicate.formatThreshold(threshold);
        }
    }

    /**
     * True iff both operands hold.
     */
    record And(Predicate left, Predicate right) implements Predicate {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public boolean test(double value) {
            return left.test(value) && right.test(value);
        }

        @Override
        public String describe() {
            return left.describe() + " AND " + right.describe();
        }
    }

    /**
     * Formats a threshold without a trailing {@code .0} when it is integral.
     */
    static String formatThreshold(double threshold) {
        if (threshold == Math.rint(threshold) && Math.abs(threshold) < 1e15) {
            return Long.toString((long) threshold);
        }
        return Double.toString(threshold);
    }
}
