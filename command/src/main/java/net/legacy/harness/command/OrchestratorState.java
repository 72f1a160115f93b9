package net.legacy.harness.command;

/**
 * Phases of one test command execution.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public enum OrchestratorState {
    INIT,
    RESOLVING,
    LISTING_CATALOG,
    BUILDING,
    LISTING_SUITE,
    RUNNING,
    DONE
}
