package net.legacy.harness.command.exception;

/**
 * Fatal error of the test command.
 *
 * <p>The command prints {@code CommandException: <message>} and exits with status 1.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public class CommandException extends Exception {

    /**
     * Constructs a new command exception with the specified detail message.
     *
     * @param message the detail message
     */
    public CommandException(String message) {
        super(message);
    }

    /**
     * Constructs a new command exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
