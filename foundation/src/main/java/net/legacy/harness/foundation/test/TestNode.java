package net.legacy.harness.foundation.test;

/**
 * A node of a test suite tree.
 *
 * <p>A node is either a {@link TestComposite} aggregating child nodes or a {@link TestLeaf}
 * wrapping one runnable test method.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public interface TestNode {

    /**
     * Gets the identifier this node was loaded from.
     *
     * @return the identifier
     */
    TestIdentifier getIdentifier();

    /**
     * Counts the runnable tests beneath this node.
     *
     * @return the number of leaves reachable from this node
     */
    int countTestCases();

}
