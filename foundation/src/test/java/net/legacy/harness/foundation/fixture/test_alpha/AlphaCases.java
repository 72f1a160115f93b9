package net.legacy.harness.foundation.fixture.test_alpha;

import net.legacy.harness.foundation.annotation.ModuleTest;
import net.legacy.harness.foundation.test.AbstractModuleTestCase;
import net.legacy.harness.foundation.test.TestExecutionContext;

/**
 * Passing tests of the alpha fixture module.
 */
@ModuleTest(testName = "alpha", description = "Always passing tests", tags = {"fixture"})
public class AlphaCases extends AbstractModuleTestCase {

    public void testOne() {
        validateResult(1 + 1 == 2, "arithmetic is broken");
    }

    public boolean testTwo(TestExecutionContext context) {
        return context.getModuleName().endsWith("test_alpha");
    }

    /**
     * Not a test: does not start with "test".
     */
    public void helper() {
        throw new IllegalStateException("helper must never run");
    }

    /**
     * Not a test: unsupported parameter.
     */
    public void testWithArgument(String value) {
        throw new IllegalStateException("must never run");
    }

    /**
     * Not a test: static.
     */
    public static void testStatic() {
        throw new IllegalStateException("must never run");
    }
}
