package org.seisview.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;

@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final List<String> messages = new ArrayList<>();

    private final ConfigLoader.ConfigMessageHandler handler = (level, message) -> messages.add(level + ": " + message);

    @AfterEach
    void clearSystemProperty() {
        System.clearProperty("config.file");
    }

    @Test
    void resolve_explicitFileOverridesDefaults() throws Exception {
        Path file = Files.writeString(tempDir.resolve("custom.conf"), "seisview.http.port = 9123\n");

        Config config = ConfigLoader.resolve(file.toFile(), handler);

        assertThat(config.getInt("seisview.http.port")).isEqualTo(9123);
        assertThat(config.getString("seisview.storage.volume-file-name")).isEqualTo("latest.sgy");
        assertThat(messages).singleElement().asString().startsWith("INFO").contains("--config");
    }

    @Test
    void resolve_missingExplicitFileFails() {
        File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, handler))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing.conf");
    }

    @Test
    void resolve_systemPropertyFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("sys.conf"), "seisview.volume.slice-cache.maximum-size = 3\n");
        System.setProperty("config.file", file.toString());

        Config config = ConfigLoader.resolve(null, tempDir.resolve("absent.conf").toFile(), handler);

        assertThat(config.getInt("seisview.volume.slice-cache.maximum-size")).isEqualTo(3);
        assertThat(messages).singleElement().asString().contains("-Dconfig.file");
    }

    @Test
    void resolve_workingDirectoryFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("seisview.conf"),
            "seisview.volume.segy.header-convention = legacy\n");

        Config config = ConfigLoader.resolve(null, file.toFile(), handler);

        assertThat(config.getString("seisview.volume.segy.header-convention")).isEqualTo("legacy");
    }

    @Test
    void resolve_fallsBackToClasspathDefaults() {
        Config config = ConfigLoader.resolve(null, tempDir.resolve("absent.conf").toFile(), handler);

        assertThat(config.getInt("seisview.http.port")).isEqualTo(8000);
        assertThat(config.getStringList("seisview.http.cors.allowed-origins")).containsExactly("*");
        assertThat(config.hasPath("seisview.http.routes.segy.className")).isTrue();
        assertThat(messages).singleElement().asString().startsWith("WARN");
    }
}
