/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api.exceptions;

/**
 * Thrown when a value satisfies none of the rules of a style sheet.
 *
 * <p>This signals an authoring gap in the style, so callers get the failure rather than an
 * arbitrary default style.
 */
public class NoMatchException extends RuntimeException {

    private final double value;
    private final String styleName;

    public NoMatchException(String styleName, String attribute, double value) {
        super(String.format("No rule in style '%s' matches %s=%s", styleName, attribute, value));
        this.value = value;
        this.styleName = styleName;
    }

    public double getValue() {
        return value;
    }

    public String getStyleName() {
        return styleName;
    }
}
