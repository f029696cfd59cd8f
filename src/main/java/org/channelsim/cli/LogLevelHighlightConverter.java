package org.channelsim.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colors the log level on the console.
 * <p>
 * ERROR is red, WARN yellow, INFO blue and DEBUG/TRACE gray. Coloring is disabled when the
 * {@code NO_COLOR} environment variable is set, since result JSON may share the terminal.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_BLUE = "\u001B[34m";
    private static final String ANSI_GRAY = "\u001B[90m";

    private final boolean enabled = System.getenv("NO_COLOR") == null;

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (!enabled) {
            return in;
        }
        String color = colorFor(event.getLevel());
        return color == null ? in : color + in + ANSI_RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            case Level.DEBUG_INT, Level.TRACE_INT -> ANSI_GRAY;
            default -> null;
        };
    }
}
