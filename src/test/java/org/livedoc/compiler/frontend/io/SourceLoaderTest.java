package org.livedoc.compiler.frontend.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SourceLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsFilesWithNormalizedLineEndings() throws Exception {
        Path file = tempDir.resolve("main.json");
        Files.writeString(file, "{\r\n  \"A\": 1\r\n}\r\n");

        SourceLoader.LoadResult result = SourceLoader.load(file.toString());

        assertThat(result.content()).isEqualTo("{\n  \"A\": 1\n}\n");
        assertThat(result.logicalName()).endsWith("main.json");
    }

    @Test
    void loadsClasspathResources() throws Exception {
        SourceLoader.LoadResult result = SourceLoader.load("classpath:org/livedoc/fixtures/widgets.json");

        assertThat(result.logicalName()).isEqualTo("org/livedoc/fixtures/widgets.json");
        assertThat(result.content()).contains("\"Primary\"");
    }

    @Test
    void reportsMissingSources() {
        assertThatThrownBy(() -> SourceLoader.load("classpath:org/livedoc/fixtures/none.json"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Resource not found in classpath");
        assertThatThrownBy(() -> SourceLoader.load(tempDir.resolve("none.json").toString()))
                .isInstanceOf(IOException.class);
    }
}
