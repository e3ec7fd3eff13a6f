/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.compiler.parse;

import com.choro.styleengine.api.exceptions.MalformedRuleException;
import com.choro.styleengine.api.model.StyleDefinition;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads JSON style documents:
 * <pre>{@code
 * {
 *   "name": "county_demographic",
 *   "attribute": "number",
 *   "rules": [
 *     { "title": "> 250K",
 *       "filter": { "operator": "GREATER_OR_EQUAL", "value": 250000 },
 *       "fill": "#666666", "stroke": "#FFFFFF", "stroke_width": 1 }
 *   ]
 * }
 * }</pre>
 */
public class JsonStyleDocumentReader implements StyleDocumentReader {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false);

    @Override
    public StyleDefinition read(String name, InputStream input) throws IOException {
        StyleDefinition definition;
        try {
            definition = objectMapper.readValue(input, StyleDefinition.class);
        } catch (JsonProcessingException e) {
            throw new MalformedRuleException(
                    "Style document '" + name + "' is not a valid JSON style: " + e.getOriginalMessage(), e);
        }
        if (definition == null) {
            throw new MalformedRuleException("Style document '" + name + "' is empty");
        }
        if (definition.name() == null || definition.name().isBlank()) {
            return new StyleDefinition(name, definition.attribute(), definition.rules());
        }
        return definition;
    }
}
