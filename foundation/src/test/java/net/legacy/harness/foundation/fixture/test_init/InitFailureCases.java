package net.legacy.harness.foundation.fixture.test_init;

import net.legacy.harness.foundation.annotation.ModuleTest;
import net.legacy.harness.foundation.test.AbstractModuleTestCase;

/**
 * Cannot be initialized; every test of this class errors.
 */
@ModuleTest(testName = "init-failure", priority = 1)
public class InitFailureCases extends AbstractModuleTestCase {
    static final int PORT = Integer.parseInt("not a port");

    public void testFirst() {
        validateResult(PORT > 0, "port must be positive");
    }

    public void testSecond() {
    }
}
