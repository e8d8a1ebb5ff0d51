package org.veridrive.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ConfigLoader}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_withExplicitFile_shouldOverrideDefaults() throws Exception {
        File file = tempDir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), "veridrive.spill-target-code = 2\n");

        Config config = ConfigLoader.load(file);

        assertThat(config.getInt("veridrive.spill-target-code")).isEqualTo(2);
        // untouched keys still come from reference.conf
        assertThat(config.getBoolean("veridrive.compile")).isTrue();
    }

    @Test
    void load_withMissingExplicitFile_shouldThrow() {
        File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(FileNotFoundException.class)
                .hasMessageContaining("missing.conf");
    }

    @Test
    void load_systemProperty_shouldWinOverFile() throws Exception {
        File file = tempDir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), "veridrive.optimize = false\n");
        System.setProperty("veridrive.optimize", "true");
        ConfigFactory.invalidateCaches();
        try {
            Config config = ConfigLoader.load(file);

            assertThat(config.getBoolean("veridrive.optimize")).isTrue();
        } finally {
            System.clearProperty("veridrive.optimize");
            ConfigFactory.invalidateCaches();
        }
    }
}
