/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Explanation for why a specific rule matched or didn't match a value.
 *
 * <p>Answers "why is this county painted grey?" by breaking the rule's filter down into its
 * comparisons. Note that {@code matched} reports the rule's own predicate; an earlier rule may
 * still win under first-match order, which {@code shadowedBy} reports.
 *
 * <h2>Usage</h2>
 * <pre>
 * ExplanationResult explanation = evaluator.explainRule(60_000, "&gt; 50K");
 * System.out.println(explanation.toDetailedString());
 * </pre>
 */
public record ExplanationResult(
    @JsonProperty("title") String title,
    @JsonProperty("matched") boolean matched,
    @JsonProperty("shadowed_by") String shadowedBy,
    @JsonProperty("summary") String summary,
    @JsonProperty("condition_explanations") List<ConditionExplanation> conditionExplanations
) implements Serializable {

    /**
     * Explanation for a single comparison within a rule.
     */
    public record ConditionExplanation(
        @JsonProperty("field_name") String fieldName,
        @JsonProperty("operator") String operator,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("actual_value") double actualValue,
        @JsonProperty("passed") boolean passed,
        @JsonProperty("reason") String reason
    ) implements Serializable {

        public static final String REASON_BELOW_THRESHOLD = "Value below threshold";
        public static final String REASON_AT_OR_ABOVE_THRESHOLD = "Value at or above threshold";
        public static final String REASON_NOT_A_NUMBER = "Value is NaN";

        public String describe() {
            if (passed) {
                return String.format("✓ %s %s %s (got: %s)", fieldName, operator, threshold, actualValue);
            }
            return String.format("✗ %s %s %s (got: %s) - %s", fieldName, operator, threshold, actualValue, reason);
        }
    }

    public long passedCount() {
        return conditionExplanations.stream()
            .filter(ConditionExplanation::passed)
            .count();
    }

    public long failedCount() {
        return conditionExplanations.stream()
            .filter(c -> !c.passed())
            .count();
    }

    public String toDetailedString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Rule: %s\n", title));
        sb.append(String.format("Result: %s\n", matched ? "MATCHED" : "NOT MATCHED"));
        if (shadowedBy != null) {
            sb.append(String.format("Shadowed by: %s\n", shadowedBy));
        }
        sb.append(String.format("Summary: %s\n\n", summary));
        sb.append(String.format("Conditions (%d passed, %d failed):\n", passedCount(), failedCount()));
        for (ConditionExplanation cond : conditionExplanations) {
            sb.append("  ").append(cond.describe()).append("\n");
        }
        return sb.toString();
    }
}
