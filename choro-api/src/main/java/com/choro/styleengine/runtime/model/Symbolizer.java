/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.runtime.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Polygon paint parameters of a rule.
 */
public record Symbolizer(HexColor fill, HexColor stroke, double strokeWidth) implements Serializable {

    // OGC Symbology Encoding defaults
    public static final HexColor DEFAULT_FILL = new HexColor("#808080");
    public static final HexColor DEFAULT_STROKE = new HexColor("#000000");
    public static final double DEFAULT_STROKE_WIDTH = 1.0;

    public Symbolizer {
        Objects.requireNonNull(fill, "fill must not be null");
        Objects.requireNonNull(stroke, "stroke must not be null");
        if (!Double.isFinite(strokeWidth) || strokeWidth < 0) {
            throw new IllegalArgumentException("Stroke width must be a finite, non-negative number, got: " + strokeWidth);
        }
    }
}
