/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Evaluation result containing the matched style (null on a miss) and an optional trace.
 *
 * <h2>Usage</h2>
 * <pre>
 * EvaluationResult result = evaluator.evaluateWithTrace(60_000);
 * if (!result.hasMatch()) {
 *     result.trace().ruleOutcomes().forEach(o -&gt; System.out.println(o.describe()));
 * }
 * </pre>
 */
public record EvaluationResult(
    @JsonProperty("style") Style style,
    @JsonProperty("trace") EvaluationTrace trace
) implements Serializable {

    /**
     * Returns true if some rule matched.
     */
    public boolean hasMatch() {
        return style != null;
    }
}
