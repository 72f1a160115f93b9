package net.legacy.harness.foundation.engine;

import net.legacy.harness.foundation.test.InterruptHandler;
import net.legacy.harness.foundation.test.RunConfiguration;
import net.legacy.harness.foundation.test.TestComposite;
import net.legacy.harness.foundation.test.TestLoadException;
import net.legacy.harness.foundation.test.TestLoader;
import net.legacy.harness.foundation.test.TestNode;
import net.legacy.harness.foundation.test.TestResultCollector;
import net.legacy.harness.foundation.test.TestResultSummary;
import net.legacy.harness.foundation.test.TestRunner;
import net.legacy.harness.foundation.test.TextResultCollector;
import net.legacy.harness.foundation.test.Verbosity;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * {@link TestEngine} loading {@code @ModuleTest} classes by reflection and reporting as text.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public class ReflectiveTestEngine implements TestEngine {
    private final TestLoader loader;
    private final PrintStream reportStream;

    /**
     * Creates the engine used through {@link java.util.ServiceLoader}: the context class loader
     * (or this class's loader), reporting to standard error.
     */
    public ReflectiveTestEngine() {
        this(defaultClassLoader(), System.err);
    }

    /**
     * Creates an engine.
     *
     * @param classLoader  the class loader used to find tests
     * @param reportStream the stream receiving the final report
     */
    public ReflectiveTestEngine(ClassLoader classLoader, PrintStream reportStream) {
        this.loader = new TestLoader(classLoader);
        this.reportStream = Objects.requireNonNull(reportStream, "reportStream");
    }

    @Override
    public TestComposite loadByIdentifiers(List<String> identifiers) throws TestLoadException {
        return loader.loadAll(identifiers);
    }

    @Override
    public TextResultCollector createResultCollector(PrintStream stream, Verbosity verbosity, int totalTests) {
        return new TextResultCollector(stream, verbosity, totalTests);
    }

    @Override
    public TestResultSummary run(TestNode root, RunConfiguration configuration, TestResultCollector collector) {
        return new TestRunner(reportStream).run(root, configuration, collector);
    }

    @Override
    public InterruptHandler installInterruptHandler(TestResultCollector collector) {
        return InterruptHandler.install(collector);
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : ReflectiveTestEngine.class.getClassLoader();
    }
}
