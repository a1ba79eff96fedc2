package io.hearthwarrio.pagelens.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code logging.level} to the Logback root logger.
 */
final class LogLevels {

    private LogLevels() {
    }

    /**
     * @return false when SLF4J is not bound to Logback
     */
    static boolean apply(String level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (!(root instanceof ch.qos.logback.classic.Logger)) {
            return false;
        }
        ((ch.qos.logback.classic.Logger) root).setLevel(Level.toLevel(level, Level.INFO));
        return true;
    }
}
