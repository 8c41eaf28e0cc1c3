package org.pxdforge.cli;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import ch.qos.logback.classic.Level;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void colorOf_colorsErrorWarnAndInfoOnly() {
        assertThat(LogLevelHighlightConverter.colorOf(Level.ERROR)).contains("\u001B[31m");
        assertThat(LogLevelHighlightConverter.colorOf(Level.WARN)).contains("\u001B[33m");
        assertThat(LogLevelHighlightConverter.colorOf(Level.INFO)).contains("\u001B[36m");
        assertThat(LogLevelHighlightConverter.colorOf(Level.DEBUG)).isEmpty();
        assertThat(LogLevelHighlightConverter.colorOf(Level.TRACE)).isEmpty();
    }
}
