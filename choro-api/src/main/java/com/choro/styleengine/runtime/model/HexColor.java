/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.runtime.model;

import java.io.Serializable;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A {@code #RRGGBB} colour code, normalised to upper case.
 */
public record HexColor(String hex) implements Serializable {

    private static final Pattern HEX_PATTERN = Pattern.compile("#[0-9A-Fa-f]{6}");

    public HexColor {
        if (hex == null || !HEX_PATTERN.matcher(hex).matches()) {
            throw new IllegalArgumentException("Colour must be #RRGGBB, got: " + hex);
        }
        hex = hex.toUpperCase(Locale.ROOT);
    }

    /**
     * Parses a colour code, tolerating surrounding whitespace.
     *
     * @throws IllegalArgumentException if the code is not {@code #RRGGBB}
     */
    public static HexColor parse(String text) {
        return new HexColor(text == null ? null : text.trim());
    }

    @Override
    public String toString() {
        return hex;
    }
}
