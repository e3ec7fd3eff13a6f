/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.infra.metrics;

import com.choro.styleengine.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Backend-neutral entry point for counters, gauges and timers.
 *
 * <p>Tags are passed as alternating label names and values:
 * <pre>{@code
 * registry.counter("choro_style_lookups_total", "outcome", "fallback").increment();
 * }</pre>
 *
 * <p>Implementations return the same metric for the same name and tags.
 */
public interface MetricsRegistry {

    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * Returns the process-wide registry chosen through {@link java.util.ServiceLoader}.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
