package net.legacy.harness.command;

import picocli.CommandLine;

/**
 * Command line entry point of the {@code test} command.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public final class TestCommandLauncher {

    private TestCommandLauncher() {
    }

    public static void main(String[] args) {
        System.exit(newCommandLine(new TestCommand()).execute(args));
    }

    /**
     * Creates the command line of a command, with clustered short options enabled.
     *
     * @param command the command
     * @return the command line
     */
    static CommandLine newCommandLine(TestCommand command) {
        return new CommandLine(command).setPosixClusteredShortOptionsAllowed(true);
    }
}
