package net.legacy.harness.foundation.engine;

import net.legacy.harness.foundation.test.InterruptHandler;
import net.legacy.harness.foundation.test.RunConfiguration;
import net.legacy.harness.foundation.test.TestComposite;
import net.legacy.harness.foundation.test.TestLoadException;
import net.legacy.harness.foundation.test.TestNode;
import net.legacy.harness.foundation.test.TestResultCollector;
import net.legacy.harness.foundation.test.TestResultSummary;
import net.legacy.harness.foundation.test.TextResultCollector;
import net.legacy.harness.foundation.test.Verbosity;

import java.io.PrintStream;
import java.util.List;

/**
 * Entry point of a module test engine.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader}. A command drives an
 * engine in three steps: load a suite, create a collector sized to the suite, run.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public interface TestEngine {

    /**
     * Loads identifiers into one composite suite, one child per identifier, in order.
     *
     * @param identifiers fully qualified module, class or method identifiers
     * @return the suite
     * @throws TestLoadException if any identifier cannot be loaded; nothing is partially returned
     */
    TestComposite loadByIdentifiers(List<String> identifiers) throws TestLoadException;

    /**
     * Counts the runnable tests of a suite.
     *
     * @param root the suite root
     * @return the number of leaves
     */
    default int countLeaves(TestNode root) {
        return root.countTestCases();
    }

    /**
     * Creates the engine's default collector.
     *
     * @param stream     the stream receiving markers and the report
     * @param verbosity  the output detail level
     * @param totalTests the number of tests in the suite
     * @return a fresh collector
     */
    TextResultCollector createResultCollector(PrintStream stream, Verbosity verbosity, int totalTests);

    /**
     * Runs a suite.
     *
     * @param root          the suite root
     * @param configuration the configuration of the run
     * @param collector     the collector receiving outcomes
     * @return the summary of the run
     */
    TestResultSummary run(TestNode root, RunConfiguration configuration, TestResultCollector collector);

    /**
     * Installs the interrupt handling for a run.
     *
     * @param collector the collector to stop on interrupt
     * @return the handler, to be closed when the run ends
     */
    InterruptHandler installInterruptHandler(TestResultCollector collector);

}
