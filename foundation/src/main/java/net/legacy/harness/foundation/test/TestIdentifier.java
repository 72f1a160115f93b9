package net.legacy.harness.foundation.test;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import org.apache.commons.lang3.Validate;

import java.util.List;

/**
 * Immutable dotted path addressing a test module, a test class or a single test method,
 * in the form {@code module[.Class[.method]]}.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TestIdentifier implements Comparable<TestIdentifier> {
    private static final char SEPARATOR = '.';
    private static final Splitter SPLITTER = Splitter.on(SEPARATOR);

    private final String value;

    /**
     * Creates an identifier from its dotted string form.
     *
     * @param value the dotted path, must not be blank
     * @return the identifier
     */
    public static TestIdentifier of(String value) {
        Validate.notBlank(value, "Test identifier must not be blank");
        return new TestIdentifier(value);
    }

    /**
     * Creates the identifier of a test method.
     *
     * @param testClass  the declaring test class
     * @param methodName the test method name
     * @return the identifier {@code <class name>.<method name>}
     */
    public static TestIdentifier ofMethod(Class<?> testClass, String methodName) {
        return of(testClass.getName() + SEPARATOR + methodName);
    }

    /**
     * Gets the dot-separated segments of this identifier.
     *
     * @return the segments, in order
     */
    public List<String> segments() {
        return ImmutableList.copyOf(SPLITTER.split(value));
    }

    /**
     * Gets the last {@code count} segments joined with dots.
     *
     * <p>When the identifier has fewer segments the whole identifier is returned.
     *
     * @param count the number of trailing segments to keep
     * @return the trailing part of the identifier
     */
    public String tail(int count) {
        Validate.isTrue(count > 0, "count must be positive: %d", count);
        List<String> segments = segments();
        if (segments.size() <= count) {
            return value;
        }
        return String.join(String.valueOf(SEPARATOR), segments.subList(segments.size() - count, segments.size()));
    }

    /**
     * Removes {@code prefix} from the start of this identifier, once.
     *
     * @param prefix the exact prefix to remove
     * @return the shortened string, or the full identifier when it does not start with the prefix
     */
    public String stripPrefix(String prefix) {
        if (prefix.isEmpty() || !value.startsWith(prefix)) {
            return value;
        }
        return value.substring(prefix.length());
    }

    @Override
    public int compareTo(TestIdentifier other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
