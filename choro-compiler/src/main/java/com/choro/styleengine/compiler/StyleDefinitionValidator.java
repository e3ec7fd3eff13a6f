/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.compiler;

import com.choro.styleengine.api.exceptions.MalformedRuleException;
import com.choro.styleengine.api.model.StyleDefinition;
import com.choro.styleengine.api.model.StyleDefinition.FilterDefinition;
import com.choro.styleengine.api.model.StyleDefinition.RuleDefinition;
import com.choro.styleengine.runtime.model.HexColor;
import com.choro.styleengine.runtime.model.Predicate;
import com.choro.styleengine.runtime.model.Symbolizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a raw {@link StyleDefinition} into typed predicates and symbolizers.
 *
 * <p>Fails fast: the first invalid rule aborts with a {@link MalformedRuleException}
 * naming the rule and the problem.
 */
public class StyleDefinitionValidator {

    /**
     * A rule that passed validation.
     */
    public record ValidatedRule(String title, Predicate predicate, Symbolizer symbolizer) {}

    public List<ValidatedRule> validate(StyleDefinition definition) {
        if (definition.rules() == null || definition.rules().isEmpty()) {
            throw new MalformedRuleException("Style rules cannot be empty: " + definition.name());
        }

        String attribute = definition.attribute();
        Set<String> seenTitles = new HashSet<>();
        List<ValidatedRule> validated = new ArrayList<>(definition.rules().size());

        for (int i = 0; i < definition.rules().size(); i++) {
            RuleDefinition rule = definition.rules().get(i);
            if (rule == null) {
                throw new MalformedRuleException("Rule #" + (i + 1) + " is null");
            }
            String title = rule.title() == null ? null : rule.title().trim();
            if (title == null || title.isEmpty()) {
                throw new MalformedRuleException("Rule #" + (i + 1) + " has missing or empty title");
            }
            if (!seenTitles.add(title)) {
                throw new MalformedRuleException("Duplicate rule title: " + title);
            }
            if (rule.filter() == null) {
                throw new MalformedRuleException("Rule '" + title + "' has no filter");
            }

            Predicate predicate = toPredicate(title, attribute, rule.filter());
            Symbolizer symbolizer = toSymbolizer(title, rule);
            validated.add(new ValidatedRule(title, predicate, symbolizer));
        }
        return validated;
    }

    private Predicate toPredicate(String title, String attribute, FilterDefinition filter) {
        FilterOperator operator = FilterOperator.fromString(filter.operator());
        if (operator == null) {
            throw new MalformedRuleException("Rule '" + title + "' has unknown operator: " + filter.operator());
        }

        if (operator == FilterOperator.AND) {
            List<FilterDefinition> operands = filter.operands() == null ? List.of() : filter.operands();
            if (operands.size() != 2) {
                throw new MalformedRuleException(
                        "Rule '" + title + "': AND requires exactly 2 operands, got " + operands.size());
            }
            if (operands.get(0) == null || operands.get(1) == null) {
                throw new MalformedRuleException("Rule '" + title + "': AND has a null operand");
            }
            return new Predicate.And(
                    toPredicate(title, attribute, operands.get(0)),
                    toPredicate(title, attribute, operands.get(1)));
        }

        String field = filter.field() == null || filter.field().isBlank() ? attribute : filter.field().trim();
        if (!field.equals(attribute)) {
            throw new MalformedRuleException(String.format(
                    "Rule '%s': comparison on field '%s' but style attribute is '%s'", title, field, attribute));
        }
        double threshold = toThreshold(title, operator, filter.value());
        return operator == FilterOperator.GREATER_OR_EQUAL
                ? new Predicate.GreaterOrEqual(field, threshold)
                : new Predicate.LessThan(field, threshold);
    }

    private double toThreshold(String title, FilterOperator operator, Object value) {
        double threshold;
        if (value instanceof Number number) {
            threshold = number.doubleValue();
        } else if (value instanceof String text) {
            try {
                threshold = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new MalformedRuleException(String.format(
                        "Rule '%s': %s requires numeric value, got: %s", title, operator, value), e);
            }
        } else {
            throw new MalformedRuleException(String.format(
                    "Rule '%s': %s requires numeric value, got: %s", title, operator, value));
        }
        if (Double.isNaN(threshold)) {
            throw new MalformedRuleException(String.format(
                    "Rule '%s': %s requires numeric value, got: NaN", title, operator));
        }
        return threshold;
    }

    private Symbolizer toSymbolizer(String title, RuleDefinition rule) {
        HexColor fill = toColor(title, "fill", rule.fill(), Symbolizer.DEFAULT_FILL);
        HexColor stroke = toColor(title, "stroke", rule.stroke(), Symbolizer.DEFAULT_STROKE);
        double strokeWidth = toStrokeWidth(title, rule.strokeWidth());
        return new Symbolizer(fill, stroke, strokeWidth);
    }

    private HexColor toColor(String title, String role, String code, HexColor defaultColor) {
        if (code == null) {
            return defaultColor;
        }
        try {
            return HexColor.parse(code);
        } catch (IllegalArgumentException e) {
            throw new MalformedRuleException(
                    String.format("Rule '%s' has invalid %s colour: %s", title, role, code), e);
        }
    }

    private double toStrokeWidth(String title, Object value) {
        if (value == null) {
            return Symbolizer.DEFAULT_STROKE_WIDTH;
        }
        double width;
        if (value instanceof Number number) {
            width = number.doubleValue();
        } else if (value instanceof String text) {
            try {
                width = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new MalformedRuleException(
                        String.format("Rule '%s' has invalid stroke width: %s", title, value), e);
            }
        } else {
            throw new MalformedRuleException(String.format("Rule '%s' has invalid stroke width: %s", title, value));
        }
        if (!Double.isFinite(width) || width < 0) {
            throw new MalformedRuleException(String.format("Rule '%s' has invalid stroke width: %s", title, value));
        }
        return width;
    }
}
