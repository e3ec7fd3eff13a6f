/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.infra.metrics.impl.prometheus;

import com.choro.styleengine.infra.metrics.Timer;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Adapter that bridges the {@link Timer} interface to a Prometheus {@link Histogram}.
 *
 * <p>Durations are observed in seconds, the Prometheus base unit. Percentiles are computed by
 * the Prometheus server with {@code histogram_quantile()}, so {@link #percentile(double)} is not
 * supported here.
 */
final class PrometheusTimerAdapter implements Timer {

    private final Histogram.Child histogram;

    PrometheusTimerAdapter(Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        if (callable == null) {
            throw new IllegalArgumentException("Callable cannot be null");
        }
        Histogram.Timer timer = histogram.startTimer();
        try {
            return callable.call();
        } finally {
            // Always record duration, even on exception
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public Duration percentile(double percentile) {
        throw new UnsupportedOperationException(String.format(
                "Percentiles are calculated by Prometheus server, not client. "
                        + "Use PromQL query: histogram_quantile(%.2f, rate(metric_name_bucket[5m])). "
                        + "For client-side percentiles, use InMemoryTimer.",
                percentile));
    }

    /**
     * Number of observations, the {@code _count} series.
     */
    long count() {
        double[] buckets = histogram.get().buckets;
        return (long) buckets[buckets.length - 1];
    }

    /**
     * Sum of observations in seconds, the {@code _sum} series.
     */
    double sum() {
        return histogram.get().sum;
    }
}
