/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.compiler;

import java.util.Locale;

/**
 * What the compiler does with coverage findings (empty rules, gaps, overlaps).
 */
public enum CoverageMode {
    /** Log findings and attach them to the sheet's stats. Rules are kept as written. */
    WARN,
    /** Reject sheets with empty rules or gaps. Overlaps are still only logged. */
    STRICT,
    /** Skip coverage analysis. */
    OFF;

    public static CoverageMode parse(String text) {
        if (text == null || text.isBlank()) {
            return WARN;
        }
        try {
            return CoverageMode.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown coverage mode: " + text + " (expected WARN, STRICT or OFF)", e);
        }
    }
}
