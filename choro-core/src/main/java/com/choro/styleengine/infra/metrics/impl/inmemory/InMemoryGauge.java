/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.infra.metrics.impl.inmemory;

import com.choro.styleengine.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {
    private volatile double value;
    private final String name;

    InMemoryGauge(String name) {
        this.name = name;
    }

    @Override
    public void set(double value) {
        this.value = value;
    }

    @Override
    public double value() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{name='%s', value=%.2f}", name, value);
    }
}
