package net.legacy.harness.command.suite;

import net.legacy.harness.command.exception.ImportFailureException;
import net.legacy.harness.foundation.engine.TestEngine;
import net.legacy.harness.foundation.test.TestComposite;
import net.legacy.harness.foundation.test.TestLoadException;

import java.util.List;
import java.util.Objects;

/**
 * Builds the runnable suite of a list of resolved identifiers.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public class SuiteBuilder {
    private final TestEngine engine;

    public SuiteBuilder(TestEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Loads one sub-tree per identifier, in order.
     *
     * @param identifiers the resolved identifiers
     * @return the suite
     * @throws ImportFailureException if any identifier cannot be loaded
     */
    public TestComposite build(List<String> identifiers) throws ImportFailureException {
        try {
            return engine.loadByIdentifiers(identifiers);
        } catch (TestLoadException exception) {
            throw new ImportFailureException(exception);
        }
    }
}
