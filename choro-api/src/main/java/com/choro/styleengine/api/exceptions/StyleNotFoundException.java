/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api.exceptions;

/**
 * Thrown when neither a layer's own style nor the fallback style is loaded.
 */
public class StyleNotFoundException extends RuntimeException {

    private final String styleName;

    public StyleNotFoundException(String styleName, String fallbackStyle) {
        super(String.format("No style '%s' and no fallback style '%s' loaded", styleName, fallbackStyle));
        this.styleName = styleName;
    }

    public String getStyleName() {
        return styleName;
    }
}
