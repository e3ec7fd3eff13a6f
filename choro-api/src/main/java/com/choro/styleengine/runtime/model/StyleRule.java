/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.runtime.model;

import com.choro.styleengine.api.model.Style;

import java.io.Serializable;
import java.util.Objects;

/**
 * A titled predicate-to-symbolizer binding.
 *
 * @param index      zero-based declaration position within the sheet
 * @param title      rule title, unique within the sheet
 * @param predicate  applicability condition
 * @param symbolizer paint parameters applied on a match
 */
public record StyleRule(int index, String title, Predicate predicate, Symbolizer symbolizer) implements Serializable {

    public StyleRule {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(symbolizer, "symbolizer must not be null");
    }

    public boolean matches(double value) {
        return predicate.test(value);
    }

    public Style toStyle() {
        return new Style(title, symbolizer.fill().hex(), symbolizer.stroke().hex(), symbolizer.strokeWidth());
    }
}
