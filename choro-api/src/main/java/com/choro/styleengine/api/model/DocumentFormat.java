/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.api.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported style document formats.
 */
public enum DocumentFormat {
    /** JSON rule document. */
    JSON,
    /** Styled Layer Descriptor XML (filter and symbolizer subset). */
    SLD;

    /**
     * Detects the format from a file extension.
     *
     * @param path the document path
     * @return the format, or empty for unsupported extensions
     */
    public static Optional<DocumentFormat> fromPath(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".json")) {
            return Optional.of(JSON);
        }
        if (fileName.endsWith(".sld") || fileName.endsWith(".xml")) {
            return Optional.of(SLD);
        }
        return Optional.empty();
    }

    /**
     * Returns the file name without its extension.
     */
    public static String stem(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
