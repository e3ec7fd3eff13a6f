/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Document representation of a style, as read from JSON or SLD.
 * This is a simple Data Transfer Object used only for loading; nothing in it is validated yet.
 */
public record StyleDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("attribute") String attribute,
        @JsonProperty("rules") List<RuleDefinition> rules
) {
    public static final String DEFAULT_ATTRIBUTE = "number";

    /**
     * DTO for a single rule.
     */
    public record RuleDefinition(
            @JsonProperty("title") String title,
            @JsonProperty("filter") FilterDefinition filter,
            @JsonProperty("fill") String fill,
            @JsonProperty("stroke") String stroke,
            @JsonProperty("stroke_width") Object strokeWidth
    ) {}

    /**
     * DTO for a filter expression. Comparisons carry {@code field} and {@code value};
     * conjunctions carry {@code operands}.
     */
    public record FilterDefinition(
            @JsonProperty("operator") String operator,
            @JsonProperty("field") String field,
            @JsonProperty("value") Object value,
            @JsonProperty("operands") List<FilterDefinition> operands
    ) {
        public static FilterDefinition comparison(String operator, String field, Object value) {
            return new FilterDefinition(operator, field, value, null);
        }
    }

    public String attribute() {
        return attribute != null && !attribute.isBlank() ? attribute : DEFAULT_ATTRIBUTE;
    }
}
