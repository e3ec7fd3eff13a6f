/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Paint parameters of a matched rule, consumed by the renderer and by legend builders.
 *
 * @param title          rule title, shown in legends
 * @param fillColorHex   fill colour as {@code #RRGGBB}
 * @param strokeColorHex stroke colour as {@code #RRGGBB}
 * @param strokeWidthPx  stroke width in pixels
 */
public record Style(
    @JsonProperty("title") String title,
    @JsonProperty("fill_color") String fillColorHex,
    @JsonProperty("stroke_color") String strokeColorHex,
    @JsonProperty("stroke_width") double strokeWidthPx
) implements Serializable {
}
