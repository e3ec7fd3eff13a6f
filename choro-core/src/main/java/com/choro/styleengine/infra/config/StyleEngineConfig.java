/*
 * Copyright (c) 2025 Choro Style Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.choro.styleengine.infra.config;

import com.choro.styleengine.api.model.StyleDefinition;
import com.choro.styleengine.compiler.CoverageMode;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable configuration of the style engine.
 *
 * <p>Values are resolved in this order, later sources winning:
 * <ol>
 *   <li>builder defaults</li>
 *   <li>a properties file ({@code choro.properties} on the classpath by default)</li>
 *   <li>environment variables</li>
 * </ol>
 *
 * <table>
 *   <caption>Settings</caption>
 *   <tr><th>Property</th><th>Environment</th><th>Default</th></tr>
 *   <tr><td>{@code choro.styles.dir}</td><td>{@code CHORO_STYLES_DIR}</td><td>{@code styles}</td></tr>
 *   <tr><td>{@code choro.styles.fallback}</td><td>{@code CHORO_FALLBACK_STYLE}</td><td>{@code polygon}</td></tr>
 *   <tr><td>{@code choro.compiler.coverage.mode}</td><td>{@code CHORO_COVERAGE_MODE}</td><td>{@code WARN}</td></tr>
 *   <tr><td>{@code choro.compiler.attribute}</td><td>{@code CHORO_ATTRIBUTE}</td><td>{@code number}</td></tr>
 * </table>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * StyleEngineConfig config = StyleEngineConfig.builder()
 *     .stylesDir(Path.of("/srv/maps/sld"))
 *     .coverageMode(CoverageMode.STRICT)
 *     .build();
 * }</pre>
 */
public final class StyleEngineConfig {

    private static final Logger logger = Logger.getLogger(StyleEngineConfig.class.getName());

    public static final String DEFAULT_PROPERTIES_FILE = "choro.properties";
    public static final String DEFAULT_STYLES_DIR = "styles";
    public static final String DEFAULT_FALLBACK_STYLE = "polygon";

    static final String PROP_STYLES_DIR = "choro.styles.dir";
    static final String PROP_FALLBACK_STYLE = "choro.styles.fallback";
    static final String PROP_COVERAGE_MODE = "choro.compiler.coverage.mode";
    static final String PROP_ATTRIBUTE = "choro.compiler.attribute";

    static final String ENV_STYLES_DIR = "CHORO_STYLES_DIR";
    static final String ENV_FALLBACK_STYLE = "CHORO_FALLBACK_STYLE";
    static final String ENV_COVERAGE_MODE = "CHORO_COVERAGE_MODE";
    static final String ENV_ATTRIBUTE = "CHORO_ATTRIBUTE";

    private final Path stylesDir;
    private final String fallbackStyle;
    private final CoverageMode coverageMode;
    private final String attribute;

    private StyleEngineConfig(Builder builder) {
        this.stylesDir = builder.stylesDir;
        this.fallbackStyle = builder.fallbackStyle;
        this.coverageMode = builder.coverageMode;
        this.attribute = builder.attribute;
        validate();
    }

    private void validate() {
        Objects.requireNonNull(stylesDir, "stylesDir must not be null");
        Objects.requireNonNull(coverageMode, "coverageMode must not be null");
        if (fallbackStyle == null || fallbackStyle.isBlank()) {
            throw new IllegalArgumentException("fallbackStyle must not be blank");
        }
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("attribute must not be blank");
        }
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads {@code choro.properties} from the classpath, then applies environment overrides.
     */
    public static StyleEngineConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES_FILE);
    }

    /**
     * Loads a properties file from the classpath or, failing that, the file system, then applies
     * environment overrides. A missing file leaves the defaults in place.
     *
     * @param propertiesPath classpath resource name or file path
     */
    public static StyleEngineConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading style engine configuration from: " + propertiesPath);
        return fromSources(readProperties(propertiesPath), System.getenv());
    }

    static StyleEngineConfig fromSources(Properties props, Map<String, String> env) {
        Builder builder = builder();

        Optional.ofNullable(props.getProperty(PROP_STYLES_DIR)).ifPresent(builder::stylesDir);
        Optional.ofNullable(props.getProperty(PROP_FALLBACK_STYLE)).ifPresent(builder::fallbackStyle);
        Optional.ofNullable(props.getProperty(PROP_COVERAGE_MODE)).ifPresent(builder::coverageMode);
        Optional.ofNullable(props.getProperty(PROP_ATTRIBUTE)).ifPresent(builder::attribute);

        getEnv(env, ENV_STYLES_DIR).ifPresent(builder::stylesDir);
        getEnv(env, ENV_FALLBACK_STYLE).ifPresent(builder::fallbackStyle);
        getEnv(env, ENV_COVERAGE_MODE).ifPresent(builder::coverageMode);
        getEnv(env, ENV_ATTRIBUTE).ifPresent(builder::attribute);

        return builder.build();
    }

    private static Properties readProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = StyleEngineConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
                return props;
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read classpath resource: " + propertiesPath, e);
        }

        try (InputStream is = new FileInputStream(propertiesPath)) {
            props.load(is);
            logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
        } catch (IOException e) {
            logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
        }
        return props;
    }

    private static Optional<String> getEnv(Map<String, String> env, String key) {
        String value = env.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public Path getStylesDir() {
        return stylesDir;
    }

    public String getFallbackStyle() {
        return fallbackStyle;
    }

    public CoverageMode getCoverageMode() {
        return coverageMode;
    }

    public String getAttribute() {
        return attribute;
    }

    public Builder toBuilder() {
        return builder()
                .stylesDir(stylesDir)
                .fallbackStyle(fallbackStyle)
                .coverageMode(coverageMode)
                .attribute(attribute);
    }

    @Override
    public String toString() {
        return String.format("StyleEngineConfig{stylesDir=%s, fallbackStyle='%s', coverageMode=%s, attribute='%s'}",
                stylesDir, fallbackStyle, coverageMode, attribute);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static class Builder {
        private Path stylesDir = Path.of(DEFAULT_STYLES_DIR);
        private String fallbackStyle = DEFAULT_FALLBACK_STYLE;
        private CoverageMode coverageMode = CoverageMode.WARN;
        private String attribute = StyleDefinition.DEFAULT_ATTRIBUTE;

        private Builder() {
        }

        public Builder stylesDir(Path stylesDir) {
            this.stylesDir = stylesDir;
            return this;
        }

        public Builder stylesDir(String stylesDir) {
            return stylesDir(Path.of(stylesDir.trim()));
        }

        public Builder fallbackStyle(String fallbackStyle) {
            this.fallbackStyle = fallbackStyle == null ? null : fallbackStyle.trim();
            return this;
        }

        public Builder coverageMode(CoverageMode coverageMode) {
            this.coverageMode = coverageMode;
            return this;
        }

        /**
         * @throws IllegalArgumentException for values other than WARN, STRICT or OFF
         */
        public Builder coverageMode(String coverageMode) {
            return coverageMode(CoverageMode.parse(coverageMode));
        }

        public Builder attribute(String attribute) {
            this.attribute = attribute == null ? null : attribute.trim();
            return this;
        }

        public StyleEngineConfig build() {
            return new StyleEngineConfig(this);
        }
    }
}
