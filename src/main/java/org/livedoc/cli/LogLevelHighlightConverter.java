package org.livedoc.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.Optional;

/**
 * Logback converter that colors the level of console log lines.
 *
 * <p>Errors are red, warnings yellow and info blue; debug and trace stay uncolored.</p>
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String BLUE = "\u001B[34m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return colorFor(event.getLevel()).map(color -> color + in + RESET).orElse(in);
    }

    static Optional<String> colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> Optional.of(RED);
            case Level.WARN_INT -> Optional.of(YELLOW);
            case Level.INFO_INT -> Optional.of(BLUE);
            default -> Optional.empty();
        };
    }
}
