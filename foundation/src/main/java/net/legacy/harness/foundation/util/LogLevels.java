package net.legacy.harness.foundation.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.experimental.UtilityClass;
import org.slf4j.LoggerFactory;

/**
 * Helpers reading and temporarily changing the level of the root logger.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@UtilityClass
public class LogLevels {

    /**
     * Whether the root logger emits INFO messages.
     *
     * @return true when the root logger threshold is INFO or lower
     */
    public static boolean isRootInfoEnabled() {
        return LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).isInfoEnabled();
    }

    /**
     * Turns the root logger off until the returned handle is closed.
     *
     * <p>When the SLF4J binding is not Logback the call has no effect.
     *
     * @return a handle restoring the previous root level on close
     */
    public static Suppression suppressRoot() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(root instanceof Logger)) {
            return new Suppression(null, null);
        }
        Logger logbackRoot = (Logger) root;
        Level previous = logbackRoot.getLevel();
        logbackRoot.setLevel(Level.OFF);
        return new Suppression(logbackRoot, previous);
    }

    /**
     * Scoped root logger suppression.
     */
    public static final class Suppression implements AutoCloseable {
        private final Logger logger;
        private final Level previous;

        private Suppression(Logger logger, Level previous) {
            this.logger = logger;
            this.previous = previous;
        }

        @Override
        public void close() {
            if (logger != null) {
                logger.setLevel(previous);
            }
        }
    }

}
