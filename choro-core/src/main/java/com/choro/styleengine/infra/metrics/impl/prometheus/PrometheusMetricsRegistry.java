/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.infra.metrics.impl.prometheus;

import com.choro.styleengine.infra.metrics.Counter;
import com.choro.styleengine.infra.metrics.Gauge;
import com.choro.styleengine.infra.metrics.MetricsRegistry;
import com.choro.styleengine.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Histogram;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsRegistry} backed by the Prometheus simpleclient.
 *
 * <p>One Prometheus collector is registered per metric name; tags become its labels, so every
 * call for a given name must pass the same label names. Timers are histograms in seconds with a
 * {@code _seconds} suffix.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private static final double[] TIMER_BUCKETS = {0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0};

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> promCounters = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Gauge> promGauges = new ConcurrentHashMap<>();
    private final Map<String, Histogram> promHistograms = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        checkTags(name, tags);
        return counters.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Counter promCounter = promCounters.computeIfAbsent(name, n ->
                    io.prometheus.client.Counter.build()
                            .name(sanitizeName(n))
                            .help("Counter " + n)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new PrometheusCounterAdapter(promCounter, extractLabelValues(tags));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        checkTags(name, tags);
        return gauges.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Gauge promGauge = promGauges.computeIfAbsent(name, n ->
                    io.prometheus.client.Gauge.build()
                            .name(sanitizeName(n))
                            .help("Gauge " + n)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new PrometheusGaugeAdapter(promGauge, extractLabelValues(tags));
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        checkTags(name, tags);
        return timers.computeIfAbsent(key(name, tags), k -> {
            Histogram promHistogram = promHistograms.computeIfAbsent(name, n ->
                    Histogram.build()
                            .name(sanitizeName(n) + "_seconds")
                            .help("Timer " + n)
                            .buckets(TIMER_BUCKETS)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new PrometheusTimerAdapter(promHistogram, extractLabelValues(tags));
        });
    }

    static String sanitizeName(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static void checkTags(String name, String[] tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags for metric '" + name + "' must be name/value pairs");
        }
    }

    private static String key(String name, String[] tags) {
        return tags.length == 0 ? name : name + "{" + String.join(",", tags) + "}";
    }

    private static String[] extractLabelNames(String[] tags) {
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] extractLabelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }
}
