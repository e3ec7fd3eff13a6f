/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.compiler.analysis;

import com.choro.styleengine.runtime.model.Predicate;

import java.io.Serializable;

/**
 * Range {@code [lower, upper)} of attribute values, optionally extended by the point +∞.
 *
 * <p>A {@code >=} comparison also accepts +∞, which no half-open range reaches, so
 * {@code includesPositiveInfinity} carries that point separately. It is only meaningful when
 * {@code upper} is +∞. A lower bound of -∞ includes the point -∞.
 */
public record Interval(double lower, double upper, boolean includesPositiveInfinity) implements Serializable {

    public static final Interval ALL = new Interval(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, true);

    public Interval {
        if (includesPositiveInfinity && upper != Double.POSITIVE_INFINITY) {
            throw new IllegalArgumentException("Only a range unbounded above can include +∞: " + upper);
        }
    }

    public Interval(double lower, double upper) {
        this(lower, upper, false);
    }

    /**
     * Returns the set of values a predicate accepts. Every predicate of the closed variant set
     * maps to exactly one interval.
     */
    public static Interval of(Predicate predicate) {
        if (predicate instanceof Predicate.GreaterOrEqual gte) {
            return new Interval(gte.threshold(), Double.POSITIVE_INFINITY, true);
        }
        if (predicate instanceof Predicate.LessThan lt) {
            return new Interval(Double.NEGATIVE_INFINITY, lt.threshold());
        }
        if (predicate instanceof Predicate.And and) {
            return of(and.left()).intersect(of(and.right()));
        }
        throw new IllegalArgumentException("Unsupported predicate: " + predicate);
    }

    public boolean isEmpty() {
        return !(lower < upper) && !includesPositiveInfinity;
    }

    public Interval intersect(Interval other) {
        return new Interval(Math.max(lower, other.lower), Math.min(upper, other.upper),
                includesPositiveInfinity && other.includesPositiveInfinity);
    }

    public String describe() {
        if (!(lower < upper)) {
            return includesPositiveInfinity ? "{+∞}" : "∅";
        }
        String left = lower == Double.NEGATIVE_INFINITY ? "(-∞" : "[" + Predicate.formatThreshold(lower);
        String right;
        if (upper == Double.POSITIVE_INFINITY) {
            right = includesPositiveInfinity ? "+∞]" : "+∞)";
        } else {
            right = Predicate.formatThreshold(upper) + ")";
        }
        return left + ", " + right;
    }

    @Override
    public String toString() {
        return describe();
    }
}
