package net.legacy.harness.command;

import lombok.extern.slf4j.Slf4j;
import net.legacy.harness.command.config.HarnessConfiguration;
import net.legacy.harness.command.exception.CommandException;
import net.legacy.harness.foundation.test.RunConfiguration;
import net.legacy.harness.foundation.test.Verbosity;
import net.legacy.harness.foundation.util.LogLevels;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * The {@code test} command.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@Slf4j
@Command(
        name = "test",
        sortOptions = false,
        usageHelpAutoWidth = true,
        synopsisHeading = "%nUsage:%n  ",
        descriptionHeading = "%nDescription:%n",
        parameterListHeading = "%nParameters:%n",
        optionListHeading = "%nOptions:%n",
        footerHeading = "%nExamples:%n",
        description = {
                "Runs tests against the harness. Tests are organized into modules named by their",
                "package, below the configured namespace (harness.test.namespace). A module name",
                "runs the whole module; module.Class runs one test class and module.Class.method",
                "one test. Names that are not known modules are passed to the engine verbatim, so",
                "fully qualified class and method names work as well. Without names, every known",
                "module runs.",
                "",
                "The exit status is 0 when no test failed or errored and 1 otherwise. Interrupting",
                "a run once stops it after the current test; a second interrupt exits at once."
        },
        footer = {
                "  test                       run every module",
                "  test -l                    list the known modules",
                "  test -l cp                 list the tests of module cp",
                "  test cp.CpCases            run one test class",
                "  test -uf cp mv             unit tests of cp and mv, stop at the first failure"
        })
public class TestCommand implements Callable<Integer> {

    @Option(names = "-l", description = "List available tests instead of running them.")
    boolean listOnly;

    @Option(names = "-u", description = "Only run unit tests; integration tests are skipped.")
    boolean unitOnly;

    @Option(names = "-f", description = "Stop the run after the first failure or error.")
    boolean failFast;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
    boolean helpRequested;

    @Parameters(paramLabel = "name", arity = "0..*", description = "Test modules, classes or methods.")
    List<String> names = new ArrayList<>();

    private final TestOrchestrator orchestrator;
    private final PrintStream err;

    /**
     * Creates the command wired from the bundled configuration.
     */
    public TestCommand() {
        this(TestOrchestrator.create(HarnessConfiguration.load(), TestCommand.class.getClassLoader()), System.err);
    }

    public TestCommand(TestOrchestrator orchestrator, PrintStream err) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.err = Objects.requireNonNull(err, "err");
    }

    @Override
    public Integer call() {
        RunConfiguration configuration = toRunConfiguration();
        try {
            return orchestrator.execute(configuration, names);
        } catch (CommandException exception) {
            log.debug("Test command failed", exception);
            err.println("CommandException: " + exception.getMessage());
            err.flush();
            return 1;
        }
    }

    /**
     * Builds the run settings from the flags and the root log level.
     *
     * @return the run configuration
     */
    RunConfiguration toRunConfiguration() {
        return RunConfiguration.builder()
                .listOnly(listOnly)
                .unitOnly(unitOnly)
                .failFast(failFast)
                .verbosity(LogLevels.isRootInfoEnabled() ? Verbosity.DOTS : Verbosity.VERBOSE)
                .build();
    }
}
