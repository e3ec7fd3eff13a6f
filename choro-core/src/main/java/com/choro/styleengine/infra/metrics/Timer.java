/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Records how long operations take.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Runs {@code callable} and records its duration, also when it throws.
     */
    <T> T record(Callable<T> callable) throws Exception;

    void record(Duration duration);

    /**
     * Returns the given percentile (0.0 to 1.0) of recorded durations, where the backend keeps them.
     *
     * @throws UnsupportedOperationException if the backend computes percentiles server-side
     */
    Duration percentile(double percentile);
}
