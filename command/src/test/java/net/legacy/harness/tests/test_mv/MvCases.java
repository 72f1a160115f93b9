package net.legacy.harness.tests.test_mv;

import net.legacy.harness.foundation.annotation.ModuleTest;
import net.legacy.harness.foundation.test.AbstractModuleTestCase;
import net.legacy.harness.foundation.test.TestExecutionContext;

/**
 * Integration tests, skipped on unit-only runs.
 */
@ModuleTest(testName = "mv", integration = true, tags = {"storage", "integration"})
public class MvCases extends AbstractModuleTestCase {

    public void testMove(TestExecutionContext context) {
        validateResult(!context.isUnitOnly(), "integration test ran on a unit-only run");
    }

    public boolean testRename() {
        return "old".replace("old", "new").equals("new");
    }
}
