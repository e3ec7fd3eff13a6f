/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.compiler.analysis;

import com.choro.styleengine.runtime.model.StyleRule;
import com.choro.styleengine.runtime.model.StyleSheet;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Checks whether a style sheet's rules partition the attribute domain.
 *
 * <p>Each rule's predicate is reduced to an {@link Interval} and the sheet is checked for:
 * <ul>
 *   <li><b>Empty rules</b>: predicates no value can satisfy, e.g.
 *       {@code number >= 50000 AND number < 25000}</li>
 *   <li><b>Gaps</b>: ranges no rule covers; values there raise a no-match error</li>
 *   <li><b>Overlaps</b>: ranges claimed by two rules; the later rule is shadowed there</li>
 * </ul>
 *
 * <p>The analyzer reports; it never rewrites rules.
 *
 * <h2>Usage</h2>
 * <pre>
 * CoverageReport report = new RuleCoverageAnalyzer().analyze(sheet);
 * report.findings().forEach(System.out::println);
 * </pre>
 */
public class RuleCoverageAnalyzer {

    public CoverageReport analyze(StyleSheet sheet) {
        String attribute = sheet.getAttribute();
        List<EmptyRule> emptyRules = new ArrayList<>();
        List<RuleRange> ranges = new ArrayList<>();

        for (StyleRule rule : sheet.getRules()) {
            Interval interval = Interval.of(rule.predicate());
            if (interval.isEmpty()) {
                emptyRules.add(new EmptyRule(rule.index(), rule.title(), rule.predicate().describe()));
            } else {
                ranges.add(new RuleRange(rule, interval));
            }
        }

        return new CoverageReport(
                sheet.getName(),
                emptyRules,
                findGaps(attribute, ranges),
                findOverlaps(ranges));
    }

    private List<Gap> findGaps(String attribute, List<RuleRange> ranges) {
        List<RuleRange> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparingDouble(r -> r.interval().lower()));

        List<Gap> gaps = new ArrayList<>();
        double covered = Double.NEGATIVE_INFINITY;
        boolean positiveInfinityCovered = false;
        for (RuleRange range : sorted) {
            if (range.interval().lower() > covered) {
                gaps.add(new Gap(attribute, new Interval(covered, range.interval().lower())));
            }
            covered = Math.max(covered, range.interval().upper());
            positiveInfinityCovered |= range.interval().includesPositiveInfinity();
        }
        if (covered < Double.POSITIVE_INFINITY || !positiveInfinityCovered) {
            gaps.add(new Gap(attribute,
                    new Interval(covered, Double.POSITIVE_INFINITY, !positiveInfinityCovered)));
        }
        return gaps;
    }

    private List<Overlap> findOverlaps(List<RuleRange> ranges) {
        List<Overlap> overlaps = new ArrayList<>();
        // ranges is in declaration order, so the first of each pair wins
        for (int i = 0; i < ranges.size(); i++) {
            for (int j = i + 1; j < ranges.size(); j++) {
                RuleRange winner = ranges.get(i);
                RuleRange shadowed = ranges.get(j);
                Interval shared = winner.interval().intersect(shadowed.interval());
                if (!shared.isEmpty()) {
                    overlaps.add(new Overlap(
                            winner.rule().title(),
                            shadowed.rule().title(),
                            shared,
                            shared.equals(shadowed.interval())));
                }
            }
        }
        return overlaps;
    }

    private record RuleRange(StyleRule rule, Interval interval) {}

    /**
     * A rule whose predicate no value satisfies.
     */
    public record EmptyRule(int ruleIndex, String title, String predicate) implements Serializable {
        public String describe() {
            return String.format("Rule '%s' can never match: %s is an empty range", title, predicate);
        }
    }

    /**
     * A range of values no rule covers.
     */
    public record Gap(String attribute, Interval range) implements Serializable {
        public String describe() {
            return String.format("No rule covers %s in %s", attribute, range.describe());
        }
    }

    /**
     * A range claimed by two rules. Under first-match order {@code shadowedTitle} never wins there.
     */
    public record Overlap(
            String winningTitle,
            String shadowedTitle,
            Interval range,
            boolean fullyShadowed
    ) implements Serializable {
        public String describe() {
            if (fullyShadowed) {
                return String.format("Rule '%s' is unreachable: '%s' already matches all of %s",
                        shadowedTitle, winningTitle, range.describe());
            }
            return String.format("Rules '%s' and '%s' overlap on %s; '%s' wins there",
                    winningTitle, shadowedTitle, range.describe(), winningTitle);
        }
    }

    /**
     * Report containing coverage findings for one style sheet.
     */
    public record CoverageReport(
            String styleName,
            List<EmptyRule> emptyRules,
            List<Gap> gaps,
            List<Overlap> overlaps
    ) implements Serializable {

        public CoverageReport {
            emptyRules = List.copyOf(emptyRules);
            gaps = List.copyOf(gaps);
            overlaps = List.copyOf(overlaps);
        }

        /**
         * True when the rules form an exact partition of the domain.
         */
        public boolean isPartition() {
            return emptyRules.isEmpty() && gaps.isEmpty() && overlaps.isEmpty();
        }

        /**
         * True when some values cannot be styled or some rules can never apply.
         */
        public boolean hasBlockingFindings() {
            return !emptyRules.isEmpty() || !gaps.isEmpty();
        }

        /**
         * All findings as human-readable lines: empty rules, then gaps, then overlaps.
         */
        public List<String> findings() {
            List<String> findings = new ArrayList<>();
            emptyRules.forEach(e -> findings.add(e.describe()));
            gaps.forEach(g -> findings.add(g.describe()));
            overlaps.forEach(o -> findings.add(o.describe()));
            return findings;
        }

        public List<String> blockingFindings() {
            List<String> findings = new ArrayList<>();
            emptyRules.forEach(e -> findings.add(e.describe()));
            gaps.forEach(g -> findings.add(g.describe()));
            return findings;
        }
    }
}
