/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Rule-by-rule record of a single evaluation.
 *
 * <p>Rules after the first match are not visited, so {@code ruleOutcomes} ends at the
 * matching rule. On a miss it lists every rule of the sheet.
 */
public record EvaluationTrace(
    @JsonProperty("style_name") String styleName,
    @JsonProperty("value") double value,
    @JsonProperty("total_duration_nanos") long totalDurationNanos,
    @JsonProperty("rule_outcomes") List<RuleOutcome> ruleOutcomes,
    @JsonProperty("matched_title") String matchedTitle
) implements Serializable {

    /**
     * Outcome of one rule's predicate.
     */
    public record RuleOutcome(
        @JsonProperty("rule_index") int ruleIndex,
        @JsonProperty("title") String title,
        @JsonProperty("predicate") String predicate,
        @JsonProperty("matched") boolean matched
    ) implements Serializable {

        public String describe() {
            return String.format("%s #%d '%s': %s", matched ? "✓" : "✗", ruleIndex, title, predicate);
        }
    }

    public int rulesVisited() {
        return ruleOutcomes.size();
    }
}
