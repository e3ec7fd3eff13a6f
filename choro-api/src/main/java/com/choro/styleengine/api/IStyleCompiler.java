/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api;

import com.choro.styleengine.api.model.DocumentFormat;
import com.choro.styleengine.runtime.model.StyleSheet;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Contract for compiling a style document into an immutable {@link StyleSheet}.
 */
public interface IStyleCompiler {

    /**
     * Compiles a style document from a file. The format is chosen from the file extension
     * ({@code .json}, {@code .sld} or {@code .xml}) and the sheet is named after the file stem.
     *
     * @param stylePath path to the style document
     * @return compiled style sheet
     * @throws IOException if the file cannot be read
     * @throws com.choro.styleengine.api.exceptions.MalformedRuleException if any rule is invalid
     */
    StyleSheet compile(Path stylePath) throws IOException;

    /**
     * Compiles a style document from a stream. The stream is not closed.
     *
     * @param name   name given to the sheet when the document does not carry one
     * @param input  document contents
     * @param format document format
     * @return compiled style sheet
     * @throws IOException if the stream cannot be read
     */
    StyleSheet compile(String name, InputStream input, DocumentFormat format) throws IOException;

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
