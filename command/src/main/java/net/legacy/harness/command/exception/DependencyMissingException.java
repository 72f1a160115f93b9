package net.legacy.harness.command.exception;

/**
 * Raised when no test engine is available, before any argument is processed.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public class DependencyMissingException extends CommandException {

    public DependencyMissingException(String message) {
        super(message);
    }
}
