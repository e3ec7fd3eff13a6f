/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.infra.metrics.impl.prometheus;

import com.choro.styleengine.infra.metrics.MetricsRegistry;
import com.choro.styleengine.infra.metrics.api.MetricsRegistryProvider;

public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;  // Prefer Prometheus in production
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
