/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.compiler;

import java.util.Locale;

/**
 * Filter operators accepted in style documents.
 */
public enum FilterOperator {
    GREATER_OR_EQUAL, LESS_THAN, AND;

    /**
     * Safely converts a document operator to an enum, accepting a few common spellings.
     *
     * @param text the operator string (e.g., "GREATER_OR_EQUAL", ">=")
     * @return the corresponding operator, or null if not recognised
     */
    public static FilterOperator fromString(String text) {
        if (text == null) return null;
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case ">=":
            case "GREATER_THAN_OR_EQUAL":
            case "GREATER_THAN_OR_EQUAL_TO":
                return GREATER_OR_EQUAL;
            case "<":
                return LESS_THAN;
            case "&&":
                return AND;
            default:
                try {
                    return FilterOperator.valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    return null; // Unknown operator
                }
        }
    }

    public boolean isComparison() {
        return this != AND;
    }
}
