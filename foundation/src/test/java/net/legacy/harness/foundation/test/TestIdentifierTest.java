package net.legacy.harness.foundation.test;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TestIdentifierTest {

    @Test
    void tailKeepsTrailingSegments() {
        TestIdentifier identifier = TestIdentifier.of("pkg.test_cp.TestCp.test_streaming");

        assertThat(identifier.tail(2)).isEqualTo("TestCp.test_streaming");
        assertThat(identifier.tail(10)).isEqualTo("pkg.test_cp.TestCp.test_streaming");
        assertThat(identifier.segments()).containsExactly("pkg", "test_cp", "TestCp", "test_streaming");
    }

    @Test
    void stripPrefixRemovesExactPrefixOnce() {
        TestIdentifier identifier = TestIdentifier.of("ns.test_cp.CpCases.testCopy");

        assertThat(identifier.stripPrefix("ns.test_")).isEqualTo("cp.CpCases.testCopy");
        assertThat(identifier.stripPrefix("other.test_")).isEqualTo("ns.test_cp.CpCases.testCopy");
        assertThat(identifier.stripPrefix("")).isEqualTo("ns.test_cp.CpCases.testCopy");
    }

    @Test
    void stripPrefixDoesNotEatCharactersOfTheName() {
        // a character-set strip of "ns.test_" would also remove the leading "t" and "e" of "test_errors"
        assertThat(TestIdentifier.of("ns.test_test_errors.X").stripPrefix("ns.test_")).isEqualTo("test_errors.X");
    }

    @Test
    void ordersLexicographically() {
        assertThat(TestIdentifier.of("a.b")).isLessThan(TestIdentifier.of("a.c"));
        assertThat(TestIdentifier.of("a.b")).isEqualTo(TestIdentifier.of("a.b"));
    }

    @Test
    void rejectsBlankIdentifiers() {
        assertThatThrownBy(() -> TestIdentifier.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
