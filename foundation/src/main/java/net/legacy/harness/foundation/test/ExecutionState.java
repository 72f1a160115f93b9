package net.legacy.harness.foundation.test;

import lombok.Getter;

/**
 * Counters of one test run.
 *
 * <p>{@code totalTests} is fixed when the state is created, after the suite is built. The other
 * counters only grow and are updated exclusively by the thread executing the suite.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@Getter
public class ExecutionState {
    private final int totalTests;
    private int run;
    private int errors;
    private int failures;
    private int skipped;

    /**
     * Creates the state of a run.
     *
     * @param totalTests the number of tests in the suite
     */
    public ExecutionState(int totalTests) {
        this.totalTests = totalTests;
    }

    void recordRun() {
        run++;
    }

    void recordError() {
        errors++;
    }

    void recordFailure() {
        failures++;
    }

    void recordSkip() {
        skipped++;
    }

    /**
     * Whether no failure and no error has been recorded.
     *
     * @return true if the run is successful so far
     */
    public boolean wasSuccessful() {
        return failures == 0 && errors == 0;
    }

    @Override
    public String toString() {
        return "ExecutionState{total=" + totalTests + ", run=" + run + ", errors=" + errors
                + ", failures=" + failures + ", skipped=" + skipped + "}";
    }
}
