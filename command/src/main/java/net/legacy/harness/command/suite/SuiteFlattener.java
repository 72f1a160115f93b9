package net.legacy.harness.command.suite;

import net.legacy.harness.foundation.test.TestComposite;
import net.legacy.harness.foundation.test.TestLeaf;
import net.legacy.harness.foundation.test.TestNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Lists the test names of a built suite without running anything.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public class SuiteFlattener {
    private final String displayPrefix;

    /**
     * Creates a flattener.
     *
     * @param displayPrefix the prefix removed from every name that starts with it
     */
    public SuiteFlattener(String displayPrefix) {
        this.displayPrefix = Objects.requireNonNull(displayPrefix, "displayPrefix");
    }

    /**
     * Collects the leaf names of a suite.
     *
     * @param root the suite root
     * @return the names without the display prefix, sorted and deduplicated
     */
    public List<String> flatten(TestNode root) {
        TreeSet<String> names = new TreeSet<>();
        Deque<TestNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TestNode node = stack.pop();
            if (node instanceof TestComposite) {
                ((TestComposite) node).getChildren().forEach(stack::push);
            } else if (node instanceof TestLeaf) {
                names.add(node.getIdentifier().stripPrefix(displayPrefix));
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Renders a name listing.
     *
     * @param names the names, in display order
     * @return {@code Found <N> test names:} followed by one indented line per name
     */
    public static String render(Collection<String> names) {
        StringBuilder listing = new StringBuilder();
        listing.append("Found ").append(names.size()).append(" test names:").append(System.lineSeparator());
        for (String name : names) {
            listing.append("  ").append(name).append(System.lineSeparator());
        }
        return listing.toString();
    }
}
