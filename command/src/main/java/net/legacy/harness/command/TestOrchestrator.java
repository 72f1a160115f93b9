package net.legacy.harness.command;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.legacy.harness.command.catalog.CatalogProvider;
import net.legacy.harness.command.catalog.PackageCatalogProvider;
import net.legacy.harness.command.config.HarnessConfiguration;
import net.legacy.harness.command.engine.EngineAvailability;
import net.legacy.harness.command.engine.EngineCapability;
import net.legacy.harness.command.exception.CommandException;
import net.legacy.harness.command.exception.DependencyMissingException;
import net.legacy.harness.command.report.ProgressResultCollector;
import net.legacy.harness.command.resolve.TestNameResolver;
import net.legacy.harness.command.suite.SuiteBuilder;
import net.legacy.harness.command.suite.SuiteFlattener;
import net.legacy.harness.foundation.engine.TestEngine;
import net.legacy.harness.foundation.test.InterruptHandler;
import net.legacy.harness.foundation.test.RunConfiguration;
import net.legacy.harness.foundation.test.TestComposite;
import net.legacy.harness.foundation.test.TestResultSummary;
import net.legacy.harness.foundation.test.TextResultCollector;
import net.legacy.harness.foundation.test.Verbosity;
import net.legacy.harness.foundation.util.LogLevels;

import java.io.PrintStream;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.function.Supplier;

/**
 * Drives one test command: resolve names, then list or build and run the suite.
 *
 * <p>States, in order: {@code INIT} (engine check), {@code RESOLVING}, then either
 * {@code LISTING_CATALOG}, or {@code BUILDING} followed by {@code LISTING_SUITE} or
 * {@code RUNNING}, and finally {@code DONE}. Listings go to {@code out}; the run report goes to
 * {@code err}.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@Slf4j
public class TestOrchestrator {
    private final CatalogProvider catalogProvider;
    private final TestNameResolver resolver;
    private final SuiteFlattener flattener;
    private final Supplier<EngineAvailability> engineCapability;
    private final PrintStream out;
    private final PrintStream err;

    /**
     * The last state entered.
     */
    @Getter
    private volatile OrchestratorState state = OrchestratorState.INIT;

    public TestOrchestrator(CatalogProvider catalogProvider, TestNameResolver resolver, SuiteFlattener flattener,
                            Supplier<EngineAvailability> engineCapability, PrintStream out, PrintStream err) {
        this.catalogProvider = Objects.requireNonNull(catalogProvider, "catalogProvider");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.flattener = Objects.requireNonNull(flattener, "flattener");
        this.engineCapability = Objects.requireNonNull(engineCapability, "engineCapability");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    /**
     * Creates an orchestrator wired from a configuration, writing to the standard streams.
     *
     * @param configuration the harness configuration
     * @param classLoader   the class loader tests and the engine are found with
     * @return the orchestrator
     */
    public static TestOrchestrator create(HarnessConfiguration configuration, ClassLoader classLoader) {
        return new TestOrchestrator(
                new PackageCatalogProvider(configuration, classLoader),
                new TestNameResolver(configuration),
                new SuiteFlattener(configuration.getDisplayPrefix()),
                new EngineCapability(classLoader),
                System.out,
                System.err);
    }

    /**
     * Executes the command.
     *
     * @param configuration the run settings
     * @param arguments     the test names given by the user, possibly empty
     * @return the exit code: 0 on success or listing, 1 if any test failed or errored
     * @throws CommandException if no engine is available or a name cannot be loaded
     */
    public int execute(RunConfiguration configuration, List<String> arguments) throws CommandException {
        enter(OrchestratorState.INIT);
        EngineAvailability availability = engineCapability.get();
        if (!availability.isAvailable()) {
            throw new DependencyMissingException(availability.getReason());
        }
        TestEngine engine = availability.getEngine();

        enter(OrchestratorState.RESOLVING);
        SortedSet<String> catalog = catalogProvider.sortedKnownModuleNames();

        if (configuration.isListOnly() && arguments.isEmpty()) {
            enter(OrchestratorState.LISTING_CATALOG);
            printListing(catalog);
            return done(0);
        }

        List<String> identifiers = resolver.resolveAll(catalog, arguments);
        log.debug("Resolved {} to {}", arguments, identifiers);

        enter(OrchestratorState.BUILDING);
        TestComposite suite = new SuiteBuilder(engine).build(identifiers);

        if (configuration.isListOnly()) {
            enter(OrchestratorState.LISTING_SUITE);
            printListing(flattener.flatten(suite));
            return done(0);
        }

        enter(OrchestratorState.RUNNING);
        TestResultSummary summary = run(engine, suite, configuration);
        return done(summary.isSuccess() ? 0 : 1);
    }

    private TestResultSummary run(TestEngine engine, TestComposite suite, RunConfiguration configuration) {
        int totalTests = engine.countLeaves(suite);
        TextResultCollector base = engine.createResultCollector(err, configuration.getVerbosity(), totalTests);
        ProgressResultCollector collector = new ProgressResultCollector(base, totalTests);
        log.debug("Running {} tests ({})", totalTests, configuration);

        LogLevels.Suppression suppression = configuration.getVerbosity() == Verbosity.VERBOSE
                ? LogLevels.suppressRoot()
                : null;
        try (InterruptHandler ignored = engine.installInterruptHandler(collector)) {
            return engine.run(suite, configuration, collector);
        } finally {
            if (suppression != null) {
                suppression.close();
            }
        }
    }

    private void printListing(Collection<String> names) {
        out.print(SuiteFlattener.render(names));
        out.flush();
    }

    private int done(int exitCode) {
        enter(OrchestratorState.DONE);
        return exitCode;
    }

    private void enter(OrchestratorState next) {
        log.debug("{} -> {}", state, next);
        state = next;
    }
}
