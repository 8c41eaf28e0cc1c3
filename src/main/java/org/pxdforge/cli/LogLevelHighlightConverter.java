package org.pxdforge.cli;

import java.util.Optional;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the level column of console output: errors red, warnings yellow, info cyan.
 * Debug and trace stay uncolored.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return colorOf(event.getLevel())
                .map(color -> color + in + ANSI_RESET)
                .orElse(in);
    }

    static Optional<String> colorOf(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> Optional.of(ANSI_RED);
            case Level.WARN_INT -> Optional.of(ANSI_YELLOW);
            case Level.INFO_INT -> Optional.of(ANSI_CYAN);
            default -> Optional.empty();
        };
    }
}
