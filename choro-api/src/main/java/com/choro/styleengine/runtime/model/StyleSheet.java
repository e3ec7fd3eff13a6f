/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.runtime.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiled, immutable, ordered list of style rules for one map layer.
 *
 * <p>A style sheet is built once at startup and passed explicitly to the evaluators that use
 * it. Rule order is declaration order and decides which rule wins when ranges overlap.
 */
public final class StyleSheet implements Serializable {

    private final String name;
    private final String attribute;
    private final List<StyleRule> rules;
    private final CompileStats stats;

    private StyleSheet(Builder builder) {
        this.name = builder.name;
        this.attribute = builder.attribute;
        this.rules = List.copyOf(builder.rules);
        this.stats = builder.stats != null
                ? builder.stats
                : new CompileStats(rules.size(), 0L, Map.of(), List.of());
    }

    public String getName() {
        return name;
    }

    /**
     * Name of the feature attribute every rule compares against.
     */
    public String getAttribute() {
        return attribute;
    }

    public List<StyleRule> getRules() {
        return rules;
    }

    public int getNumRules() {
        return rules.size();
    }

    public StyleRule getRule(int index) {
        return rules.get(index);
    }

    public Optional<StyleRule> findRule(String title) {
        return rules.stream()
                .filter(rule -> rule.title().equals(title))
                .findFirst();
    }

    public CompileStats getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return "StyleSheet{name='" + name + "', attribute='" + attribute + "', rules=" + rules.size() + "}";
    }

    /**
     * Statistics and load-time findings of a compilation.
     *
     * @param ruleCount          number of rules in the sheet
     * @param compilationTimeNanos wall time spent compiling
     * @param metadata           stage metrics (counts, analysis results)
     * @param warnings           human-readable coverage findings, empty for a clean sheet
     */
    public record CompileStats(
            int ruleCount,
            long compilationTimeNanos,
            Map<String, Object> metadata,
            List<String> warnings
    ) implements Serializable {
        public CompileStats {
            metadata = Map.copyOf(metadata);
            warnings = List.copyOf(warnings);
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }
    }

    public static class Builder {
        private final String name;
        private String attribute = "number";
        private final List<StyleRule> rules = new ArrayList<>();
        private CompileStats stats;

        public Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder withAttribute(String attribute) {
            this.attribute = Objects.requireNonNull(attribute, "attribute must not be null");
            return this;
        }

        /**
         * Appends a rule at the next index.
         */
        public Builder addRule(String title, Predicate predicate, Symbolizer symbolizer) {
            rules.add(new StyleRule(rules.size(), title, predicate, symbolizer));
            return this;
        }

        public Builder withStats(CompileStats stats) {
            this.stats = stats;
            return this;
        }

        public int getRuleCount() {
            return rules.size();
        }

        public StyleSheet build() {
            return new StyleSheet(this);
        }
    }
}
