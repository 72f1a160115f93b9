package net.legacy.harness.foundation.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Standardized logging utility for module testing.
 *
 * <p>Every message is tagged with the module it concerns, so that engine and test-module logs
 * share one format: {@code [TEST] [module] icon message}. Messages use {@link String#format}
 * placeholders.
 *
 * @author qwq-dev
 * @version 1.1
 * @since 2025-06-07 22:30
 */
@Slf4j
@UtilityClass
public class TestLogger {
    private static final String TEST_PREFIX = "[TEST]";
    private static final String INFO_ICON = "ℹ️";
    private static final String WARNING_ICON = "⚠️";

    /**
     * Logs general test information.
     *
     * @param moduleName the name of the module being tested
     * @param message    the information message
     * @param replace    format arguments for message string formatting
     */
    public static void logInfo(String moduleName, String message, Object... replace) {
        if (log.isInfoEnabled()) {
            log.info("{} [{}] {} {}", TEST_PREFIX, moduleName, INFO_ICON, String.format(message, replace));
        }
    }

    /**
     * Logs a test warning message.
     *
     * @param moduleName the name of the module being tested
     * @param message    the warning message
     * @param replace    format arguments for message string formatting
     */
    public static void logWarning(String moduleName, String message, Object... replace) {
        if (log.isWarnEnabled()) {
            log.warn("{} [{}] {} {}", TEST_PREFIX, moduleName, WARNING_ICON, String.format(message, replace));
        }
    }

    /**
     * Logs a debug message.
     *
     * @param moduleName the name of the module being tested
     * @param message    the debug message
     * @param replace    format arguments for message string formatting
     */
    public static void logDebug(String moduleName, String message, Object... replace) {
        if (log.isDebugEnabled()) {
            log.debug("{} [{}] [DEBUG] {}", TEST_PREFIX, moduleName, String.format(message, replace));
        }
    }

    /**
     * Logs test execution statistics.
     *
     * @param moduleName   the name of the module being tested
     * @param totalTests   the total number of tests
     * @param run          the number of tests started
     * @param failureCount the number of failed tests
     * @param errorCount   the number of tests ending in an error
     * @param durationMs   the total execution duration in milliseconds
     */
    public static void logStatistics(String moduleName, int totalTests, int run,
                                     int failureCount, int errorCount, long durationMs) {
        if (log.isDebugEnabled()) {
            log.debug("{} [{}] {} Statistics: Total={}, Run={}, Failed={}, Errors={}, Duration={}ms", TEST_PREFIX,
                    moduleName, "📊", totalTests, run, failureCount, errorCount, durationMs);
        }
    }
}
