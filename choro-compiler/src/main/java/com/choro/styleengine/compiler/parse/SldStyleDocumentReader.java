/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.compiler.parse;

import com.choro.styleengine.api.exceptions.MalformedRuleException;
import com.choro.styleengine.api.model.StyleDefinition;
import com.choro.styleengine.api.model.StyleDefinition.FilterDefinition;
import com.choro.styleengine.api.model.StyleDefinition.RuleDefinition;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the polygon-styling subset of a Styled Layer Descriptor.
 *
 * <p>Supported structure (namespace prefixes are ignored):
 * <pre>{@code
 * StyledLayerDescriptor/NamedLayer/UserStyle/FeatureTypeStyle/Rule
 *   Title
 *   Filter/(PropertyIsGreaterThanOrEqualTo | PropertyIsLessThan | And)
 *   PolygonSymbolizer/Fill/CssParameter[@name=fill]
 *   PolygonSymbolizer/Stroke/CssParameter[@name=stroke | @name=stroke-width]
 * }</pre>
 *
 * <p>A parameter value is either plain text or one {@code ogc:Literal}; other expressions
 * ({@code ogc:PropertyName}, functions) are rejected.
 *
 * <p>Other filter elements are passed through under their element name and rejected by the
 * compiler as unknown operators.
 */
public class SldStyleDocumentReader implements StyleDocumentReader {

    static final String GREATER_OR_EQUAL_ELEMENT = "PropertyIsGreaterThanOrEqualTo";
    static final String LESS_THAN_ELEMENT = "PropertyIsLessThan";
    static final String AND_ELEMENT = "And";

    private static final Map<String, String> OPERATOR_BY_ELEMENT = Map.of(
            GREATER_OR_EQUAL_ELEMENT, "GREATER_OR_EQUAL",
            LESS_THAN_ELEMENT, "LESS_THAN",
            AND_ELEMENT, "AND");

    // Jackson XML keeps element text next to attributes under the empty key
    private static final String TEXT_KEY = "";
    private static final String NAME_ATTRIBUTE = "name";
    private static final String LITERAL_ELEMENT = "Literal";

    private final XmlMapper xmlMapper;

    public SldStyleDocumentReader() {
        this.xmlMapper = new XmlMapper();
        this.xmlMapper.configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false);
    }

    @Override
    public StyleDefinition read(String name, InputStream input) throws IOException {
        JsonNode root;
        try {
            root = xmlMapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new MalformedRuleException(
                    "Style document '" + name + "' is not well-formed SLD: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new MalformedRuleException("Style document '" + name + "' has no StyledLayerDescriptor content");
        }

        String styleName = name;
        List<RuleDefinition> rules = new ArrayList<>();
        for (JsonNode layer : children(root, "NamedLayer")) {
            for (JsonNode userStyle : children(layer, "UserStyle")) {
                String declaredName = text(userStyle.get("Name"));
                if (declaredName != null && !declaredName.isBlank() && rules.isEmpty()) {
                    styleName = declaredName;
                }
                for (JsonNode featureTypeStyle : children(userStyle, "FeatureTypeStyle")) {
                    for (JsonNode rule : children(featureTypeStyle, "Rule")) {
                        rules.add(readRule(rule));
                    }
                }
            }
        }
        return new StyleDefinition(styleName, null, rules);
    }

    private RuleDefinition readRule(JsonNode rule) {
        String title = text(rule.get("Title"));
        if (title == null || title.isBlank()) {
            title = text(rule.get("Name"));
        }

        FilterDefinition filter = null;
        JsonNode filterNode = rule.get("Filter");
        if (filterNode != null && filterNode.isObject()) {
            List<FilterDefinition> expressions = readExpressions(filterNode);
            if (expressions.size() == 1) {
                filter = expressions.get(0);
            } else if (!expressions.isEmpty()) {
                // An ogc:Filter holds exactly one expression; report what was found
                filter = new FilterDefinition("MULTIPLE_EXPRESSIONS", null, null, expressions);
            }
        }

        String fill = null;
        String stroke = null;
        String strokeWidth = null;
        for (JsonNode symbolizer : children(rule, "PolygonSymbolizer")) {
            for (JsonNode fillNode : children(symbolizer, "Fill")) {
                for (JsonNode parameter : parameters(fillNode)) {
                    if ("fill".equals(text(parameter.get(NAME_ATTRIBUTE)))) {
                        fill = parameterValue(title, "fill", parameter);
                    }
                }
            }
            for (JsonNode strokeNode : children(symbolizer, "Stroke")) {
                for (JsonNode parameter : parameters(strokeNode)) {
                    String parameterName = text(parameter.get(NAME_ATTRIBUTE));
                    if ("stroke".equals(parameterName)) {
                        stroke = parameterValue(title, parameterName, parameter);
                    } else if ("stroke-width".equals(parameterName)) {
                        strokeWidth = parameterValue(title, parameterName, parameter);
                    }
                }
            }
        }
        return new RuleDefinition(title, filter, fill, stroke, strokeWidth);
    }

    /**
     * Reads every filter expression directly under {@code parent}, in document order.
     */
    private List<FilterDefinition> readExpressions(JsonNode parent) {
        List<FilterDefinition> expressions = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = parent.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String element = field.getKey();
            for (JsonNode node : asList(field.getValue())) {
                expressions.add(readExpression(element, node));
            }
        }
        return expressions;
    }

    private FilterDefinition readExpression(String element, JsonNode node) {
        String operator = OPERATOR_BY_ELEMENT.getOrDefault(element, element);
        if (AND_ELEMENT.equals(element)) {
            List<FilterDefinition> operands = node.isObject() ? readExpressions(node) : List.of();
            return new FilterDefinition(operator, null, null, operands);
        }
        return FilterDefinition.comparison(operator, text(node.get("PropertyName")), text(node.get("Literal")));
    }

    /**
     * Returns a symbolizer parameter's value, either its text or a single {@code ogc:Literal}.
     * A parameter that is present but empty yields {@code ""} so validation rejects it.
     *
     * @throws MalformedRuleException if the value is any other expression
     */
    private static String parameterValue(String title, String parameterName, JsonNode parameter) {
        if (!parameter.isObject()) {
            return text(parameter);
        }
        Iterator<String> names = parameter.fieldNames();
        while (names.hasNext()) {
            String element = names.next();
            if (!NAME_ATTRIBUTE.equals(element) && !TEXT_KEY.equals(element) && !LITERAL_ELEMENT.equals(element)) {
                throw new MalformedRuleException(String.format(
                        "Rule '%s': %s parameter uses unsupported expression <%s>; only literal values are supported",
                        title, parameterName, element));
            }
        }

        JsonNode literal = parameter.get(LITERAL_ELEMENT);
        if (literal == null) {
            String value = text(parameter.get(TEXT_KEY));
            return value == null ? "" : value;
        }
        String mixedText = text(parameter.get(TEXT_KEY));
        if (literal.isContainerNode() || (mixedText != null && !mixedText.isEmpty())) {
            throw new MalformedRuleException(String.format(
                    "Rule '%s': %s parameter must hold a single literal value", title, parameterName));
        }
        String value = text(literal);
        return value == null ? "" : value;
    }

    private static List<JsonNode> parameters(JsonNode node) {
        List<JsonNode> parameters = new ArrayList<>(children(node, "CssParameter"));
        parameters.addAll(children(node, "SvgParameter"));
        return parameters;
    }

    private static List<JsonNode> children(JsonNode parent, String name) {
        if (parent == null || !parent.isObject()) {
            return List.of();
        }
        return asList(parent.get(name));
    }

    private static List<JsonNode> asList(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>(node.size());
            node.forEach(elements::add);
            return elements;
        }
        return List.of(node);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return null;
        }
        return node.asText().trim();
    }
}
