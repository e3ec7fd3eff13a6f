package com.choro.styleengine.infra.config;

import com.choro.styleengine.compiler.CoverageMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StyleEngineConfigTest {

    @Test
    @DisplayName("Builder defaults should match the documented settings")
    void shouldUseDefaults() {
        StyleEngineConfig config = StyleEngineConfig.builder().build();

        assertThat(config.getStylesDir()).isEqualTo(Path.of("styles"));
        assertThat(config.getFallbackStyle()).isEqualTo("polygon");
        assertThat(config.getCoverageMode()).isEqualTo(CoverageMode.WARN);
        assertThat(config.getAttribute()).isEqualTo("number");
    }

    @Test
    @DisplayName("Properties should override defaults")
    void shouldReadProperties() {
        Properties props = new Properties();
        props.setProperty(StyleEngineConfig.PROP_STYLES_DIR, "/srv/sld");
        props.setProperty(StyleEngineConfig.PROP_COVERAGE_MODE, "strict");

        StyleEngineConfig config = StyleEngineConfig.fromSources(props, Map.of());

        assertThat(config.getStylesDir()).isEqualTo(Path.of("/srv/sld"));
        assertThat(config.getCoverageMode()).isEqualTo(CoverageMode.STRICT);
        assertThat(config.getFallbackStyle()).isEqualTo("polygon");
    }

    @Test
    @DisplayName("Environment variables should override properties")
    void environmentShouldWin() {
        Properties props = new Properties();
        props.setProperty(StyleEngineConfig.PROP_FALLBACK_STYLE, "polygon");
        props.setProperty(StyleEngineConfig.PROP_COVERAGE_MODE, "STRICT");

        StyleEngineConfig config = StyleEngineConfig.fromSources(props, Map.of(
                StyleEngineConfig.ENV_FALLBACK_STYLE, " outline ",
                StyleEngineConfig.ENV_COVERAGE_MODE, "OFF",
                StyleEngineConfig.ENV_ATTRIBUTE, ""));

        assertThat(config.getFallbackStyle()).isEqualTo("outline");
        assertThat(config.getCoverageMode()).isEqualTo(CoverageMode.OFF);
        assertThat(config.getAttribute()).isEqualTo("number");
    }

    @Test
    @DisplayName("Should reject an unknown coverage mode")
    void shouldRejectUnknownMode() {
        Properties props = new Properties();
        props.setProperty(StyleEngineConfig.PROP_COVERAGE_MODE, "LOUD");

        assertThatThrownBy(() -> StyleEngineConfig.fromSources(props, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown coverage mode: LOUD");
    }

    @Test
    @DisplayName("Should reject blank names")
    void shouldRejectBlankValues() {
        assertThatThrownBy(() -> StyleEngineConfig.builder().fallbackStyle("  ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fallbackStyle");
        assertThatThrownBy(() -> StyleEngineConfig.builder().attribute(null).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("attribute");
        assertThatThrownBy(() -> StyleEngineConfig.builder().coverageMode((CoverageMode) null).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should read choro.properties from the classpath")
    void shouldLoadDefaultResource() {
        StyleEngineConfig config = StyleEngineConfig.loadDefault();

        assertThat(config.getStylesDir()).isEqualTo(Path.of("styles"));
        assertThat(config.getFallbackStyle()).isEqualTo("polygon");
    }

    @Test
    @DisplayName("Should read a properties file from disk")
    void shouldLoadFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("maps.properties");
        Files.writeString(file, "choro.styles.dir=/data/sld\nchoro.compiler.attribute=density\n");

        StyleEngineConfig config = StyleEngineConfig.loadFromProperties(file.toString());

        assertThat(config.getStylesDir()).isEqualTo(Path.of("/data/sld"));
        assertThat(config.getAttribute()).isEqualTo("density");
    }

    @Test
    @DisplayName("A missing properties file should keep the defaults")
    void missingFileShouldKeepDefaults(@TempDir Path dir) {
        StyleEngineConfig config = StyleEngineConfig.loadFromProperties(dir.resolve("absent.properties").toString());

        assertThat(config.getFallbackStyle()).isEqualTo("polygon");
        assertThat(config.getCoverageMode()).isEqualTo(CoverageMode.WARN);
    }

    @Test
    @DisplayName("toBuilder should copy every setting")
    void toBuilderShouldCopy() {
        StyleEngineConfig original = StyleEngineConfig.builder()
                .stylesDir("/srv/sld")
                .coverageMode(CoverageMode.STRICT)
                .attribute("density")
                .build();

        StyleEngineConfig copy = original.toBuilder().fallbackStyle("outline").build();

        assertThat(copy.getStylesDir()).isEqualTo(original.getStylesDir());
        assertThat(copy.getCoverageMode()).isEqualTo(CoverageMode.STRICT);
        assertThat(copy.getAttribute()).isEqualTo("density");
        assertThat(copy.getFallbackStyle()).isEqualTo("outline");
        assertThat(copy.toString()).contains("outline", "STRICT");
    }
}
