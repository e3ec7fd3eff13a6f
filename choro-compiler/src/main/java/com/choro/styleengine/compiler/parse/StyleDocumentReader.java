/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.compiler.parse;

import com.choro.styleengine.api.model.StyleDefinition;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads one style document format into the format-neutral {@link StyleDefinition}.
 *
 * <p>Readers only map structure. Values are checked later by the compiler, so a reader
 * passes unknown operators and odd literals through untouched.
 */
public interface StyleDocumentReader {

    /**
     * @param name  sheet name to use when the document does not carry one
     * @param input document contents, left open
     * @return the raw definition
     * @throws IOException if the stream cannot be read
     * @throws com.choro.styleengine.api.exceptions.MalformedRuleException if the document is not well-formed
     */
    StyleDefinition read(String name, InputStream input) throws IOException;
}
