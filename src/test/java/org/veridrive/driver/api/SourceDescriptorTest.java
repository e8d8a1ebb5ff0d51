package org.veridrive.driver.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SourceDescriptorTest {

    @Test
    void extensionOf_shouldLowerCaseAndKeepDot() {
        assertThat(SourceDescriptor.extensionOf("Max.VP")).isEqualTo(".vp");
        assertThat(SourceDescriptor.extensionOf("archive.tar.gz")).isEqualTo(".gz");
    }

    @Test
    void extensionOf_withoutExtension_shouldBeEmpty() {
        assertThat(SourceDescriptor.extensionOf("Makefile")).isEmpty();
        assertThat(SourceDescriptor.extensionOf(".hidden")).isEmpty();
        assertThat(SourceDescriptor.extensionOf("trailing.")).isEmpty();
    }

    @Test
    void fileName_shouldDropDirectories() {
        SourceDescriptor descriptor = SourceDescriptor.program(Path.of("src", "max.vp"));

        assertThat(descriptor.fileName()).isEqualTo("max.vp");
        assertThat(descriptor.kind()).isEqualTo(SourceKind.PROGRAM);
    }
}
