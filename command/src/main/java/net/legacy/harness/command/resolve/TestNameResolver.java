package net.legacy.harness.command.resolve;

import com.google.common.collect.ImmutableList;
import net.legacy.harness.command.config.HarnessConfiguration;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Maps user-supplied test names to identifiers the engine can load.
 *
 * <p>A name that is a known module, or whose first dotted segment is one, is expanded by
 * prepending {@code namespace + "." + moduleMarker} to the whole name: with {@code cp} in the
 * catalog, {@code cp.CpCases.testCopy} becomes
 * {@code net.legacy.harness.tests.test_cp.CpCases.testCopy}. Every other name is returned as is
 * and left for the engine to accept or reject. Resolution never fails.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public class TestNameResolver {
    private final String modulePrefix;

    public TestNameResolver(HarnessConfiguration configuration) {
        this.modulePrefix = Objects.requireNonNull(configuration, "configuration").getDisplayPrefix();
    }

    /**
     * Resolves one name.
     *
     * @param catalog  the known module names
     * @param argument the name given by the user
     * @return the expanded identifier, or the argument unchanged
     */
    public String resolve(Set<String> catalog, String argument) {
        int dot = argument.indexOf('.');
        String head = dot < 0 ? argument : argument.substring(0, dot);
        if (catalog.contains(argument) || catalog.contains(head)) {
            return modulePrefix + argument;
        }
        return argument;
    }

    /**
     * Resolves every argument in order, or every catalog entry when there are no arguments.
     *
     * @param catalog   the known module names, in iteration order
     * @param arguments the names given by the user
     * @return the identifiers to load
     */
    public List<String> resolveAll(Set<String> catalog, List<String> arguments) {
        Iterable<String> names = arguments.isEmpty() ? catalog : arguments;
        ImmutableList.Builder<String> resolved = ImmutableList.builder();
        for (String name : names) {
            resolved.add(resolve(catalog, name));
        }
        return resolved.build();
    }
}
