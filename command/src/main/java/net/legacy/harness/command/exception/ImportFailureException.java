package net.legacy.harness.command.exception;

import net.legacy.harness.foundation.test.TestLoadException;

/**
 * Raised when the engine cannot load a resolved test identifier.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public class ImportFailureException extends CommandException {
    static final String MESSAGE_PREFIX = "Invalid test argument name: ";

    /**
     * Wraps a load error, keeping the engine's message verbatim.
     *
     * @param cause the load error
     */
    public ImportFailureException(TestLoadException cause) {
        super(MESSAGE_PREFIX + cause.getMessage(), cause);
    }
}
