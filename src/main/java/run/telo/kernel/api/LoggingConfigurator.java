package run.telo.kernel.api;

import ch.qos.logback.classic.Level;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link LogLevel} to the kernel's logger hierarchy. No-op when logback is not the bound backend.
 */
final class LoggingConfigurator {
    static final String ROOT_PACKAGE = "run.telo";

    private LoggingConfigurator() {}

    static void apply(LogLevel level) {
        if (LoggerFactory.getLogger(ROOT_PACKAGE) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(toLogback(level));
        }
    }

    static Level toLogback(LogLevel level) {
        return switch (level) {
            case TRACE -> Level.TRACE;
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR, FATAL -> Level.ERROR;
            case OFF -> Level.OFF;
        };
    }
}
