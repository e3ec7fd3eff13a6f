/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.runtime.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters for one {@link StyleEvaluator}.
 *
 * <p>Tracks evaluations, misses (values no rule matched), per-rule hit counts, rules visited
 * per evaluation and an approximate latency distribution. All methods are safe to call from
 * many threads at once.
 */
public final class EvaluatorMetrics {

    private final LongAdder totalEvaluations = new LongAdder();
    private final LongAdder totalMisses = new LongAdder();
    private final LongAdder totalEvaluationTimeNanos = new LongAdder();
    private final LongAdder totalRulesVisited = new LongAdder();
    private final LongAdder[] ruleHits;

    private final LatencyHistogram latencyHistogram = new LatencyHistogram();

    public EvaluatorMetrics(int ruleCount) {
        this.ruleHits = new LongAdder[ruleCount];
        for (int i = 0; i < ruleCount; i++) {
            ruleHits[i] = new LongAdder();
        }
    }

    /**
     * Records an evaluation that ended on rule {@code ruleIndex}.
     */
    public void recordMatch(int ruleIndex, long evaluationTimeNanos, int rulesVisited) {
        record(evaluationTimeNanos, rulesVisited);
        ruleHits[ruleIndex].increment();
    }

    /**
     * Records an evaluation that matched no rule.
     */
    public void recordMiss(long evaluationTimeNanos, int rulesVisited) {
        record(evaluationTimeNanos, rulesVisited);
        totalMisses.increment();
    }

    private void record(long evaluationTimeNanos, int rulesVisited) {
        totalEvaluations.increment();
        totalEvaluationTimeNanos.add(evaluationTimeNanos);
        totalRulesVisited.add(rulesVisited);
        latencyHistogram.record(evaluationTimeNanos);
    }

    public long getTotalEvaluations() {
        return totalEvaluations.sum();
    }

    public long getTotalMisses() {
        return totalMisses.sum();
    }

    public long getRuleHits(int ruleIndex) {
        return ruleHits[ruleIndex].sum();
    }

    /**
     * Get comprehensive metrics snapshot.
     * Creates new map instance to avoid concurrent modification.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();

        long evals = totalEvaluations.sum();
        long misses = totalMisses.sum();
        long totalTime = totalEvaluationTimeNanos.sum();
        long visited = totalRulesVisited.sum();

        snapshot.put("totalEvaluations", evals);
        snapshot.put("totalMisses", misses);
        snapshot.put("missRatePercent", evals > 0 ? (double) misses / evals * 100.0 : 0.0);
        snapshot.put("avgEvaluationTimeNanos", evals > 0 ? totalTime / evals : 0L);
        snapshot.put("avgRulesVisitedPerEval", evals > 0 ? (double) visited / evals : 0.0);

        long[] hits = new long[ruleHits.length];
        for (int i = 0; i < ruleHits.length; i++) {
            hits[i] = ruleHits[i].sum();
        }
        snapshot.put("ruleHits", hits);

        snapshot.put("p50LatencyNanos", latencyHistogram.getPercentile(0.50));
        snapshot.put("p95LatencyNanos", latencyHistogram.getPercentile(0.95));
        snapshot.put("p99LatencyNanos", latencyHistogram.getPercentile(0.99));

        return snapshot;
    }

    /**
     * Fixed-bucket latency histogram. Evaluations walk a handful of rules, so the buckets
     * cover 0 to 1 ms in 10 µs steps with one overflow bucket.
     */
    private static class LatencyHistogram {
        private static final int NUM_BUCKETS = 100;
        private static final long MAX_LATENCY_NANOS = 1_000_000;
        private final LongAdder[] buckets = new LongAdder[NUM_BUCKETS];
        private final LongAdder overflow = new LongAdder();

        LatencyHistogram() {
            for (int i = 0; i < NUM_BUCKETS; i++) {
                buckets[i] = new LongAdder();
            }
        }

        void record(long latencyNanos) {
            if (latencyNanos >= MAX_LATENCY_NANOS) {
                overflow.increment();
                return;
            }
            int bucket = (int) (Math.max(latencyNanos, 0) * NUM_BUCKETS / MAX_LATENCY_NANOS);
            buckets[Math.min(bucket, NUM_BUCKETS - 1)].increment();
        }

        long getPercentile(double percentile) {
            long total = overflow.sum();
            for (LongAdder bucket : buckets) {
                total += bucket.sum();
            }

            if (total == 0) return 0;

            long target = (long) Math.ceil(total * percentile);
            long cumulative = 0;

            for (int i = 0; i < NUM_BUCKETS; i++) {
                cumulative += buckets[i].sum();
                if (cumulative >= target) {
                    return (long) ((i + 0.5) * MAX_LATENCY_NANOS / NUM_BUCKETS);
                }
            }

            return MAX_LATENCY_NANOS;
        }
    }
}
