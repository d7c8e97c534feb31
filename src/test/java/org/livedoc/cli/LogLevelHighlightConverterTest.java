package org.livedoc.cli;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void colorsOnlyInfoAndAbove() {
        assertThat(LogLevelHighlightConverter.colorFor(Level.ERROR)).contains("\u001B[31m");
        assertThat(LogLevelHighlightConverter.colorFor(Level.WARN)).contains("\u001B[33m");
        assertThat(LogLevelHighlightConverter.colorFor(Level.INFO)).contains("\u001B[34m");
        assertThat(LogLevelHighlightConverter.colorFor(Level.DEBUG)).isEmpty();
        assertThat(LogLevelHighlightConverter.colorFor(Level.TRACE)).isEmpty();
    }
}
