package net.legacy.harness.command.catalog;

import java.util.SortedSet;

/**
 * Supplies the short names of the known test modules.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@FunctionalInterface
public interface CatalogProvider {

    /**
     * Gets the known module names, e.g. {@code cp} for the package {@code <namespace>.test_cp}.
     *
     * @return the names, sorted ascending, unmodifiable
     */
    SortedSet<String> sortedKnownModuleNames();

}
