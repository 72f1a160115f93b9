package net.legacy.harness.command.report;

import lombok.Getter;
import net.legacy.harness.foundation.test.ExecutionState;
import net.legacy.harness.foundation.test.TestLeaf;
import net.legacy.harness.foundation.test.TestResultCollector;
import net.legacy.harness.foundation.test.TextResultCollector;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * Collector that keeps a live status line on top of the engine's text collector.
 *
 * <p>When a test starts, in dot mode, the current line is rewritten as
 * <pre>{@code 7/120 finished - E[2] F[1] s[0] - CpCases.testStreaming - }</pre>
 * padded or cut to {@value #LINE_WIDTH} characters (the trailing {@code " - "} excluded); the
 * delegate's marker for the test follows once it completes. Every other hook only delegates.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
public class ProgressResultCollector implements TestResultCollector {
    /**
     * Width of the status line, carriage return excluded.
     */
    public static final int LINE_WIDTH = 73;

    private static final String LINE_FORMAT = "%d/%d finished - E[%d] F[%d] s[%d] - %s";

    private final TextResultCollector delegate;

    @Getter
    private final int totalTests;

    public ProgressResultCollector(TextResultCollector delegate, int totalTests) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.totalTests = totalTests;
    }

    @Override
    public void onTestStart(TestLeaf test) {
        delegate.onTestStart(test);
        if (delegate.isDots()) {
            delegate.getStream().print("\r" + statusLine(test) + " - ");
            delegate.getStream().flush();
        }
    }

    /**
     * Renders the status line of a starting test from the current counters.
     *
     * @param test the starting test
     * @return the line, exactly {@value #LINE_WIDTH} characters
     */
    String statusLine(TestLeaf test) {
        ExecutionState state = delegate.getState();
        String line = String.format(LINE_FORMAT, state.getRun(), totalTests, state.getErrors(),
                state.getFailures(), state.getSkipped(), test.getIdentifier().tail(2));
        return StringUtils.rightPad(StringUtils.left(line, LINE_WIDTH), LINE_WIDTH);
    }

    @Override
    public void onPass(TestLeaf test) {
        delegate.onPass(test);
    }

    @Override
    public void onFail(TestLeaf test, Throwable failure) {
        delegate.onFail(test, failure);
    }

    @Override
    public void onError(TestLeaf test, Throwable error) {
        delegate.onError(test, error);
    }

    @Override
    public void onSkip(TestLeaf test, String reason) {
        delegate.onSkip(test, reason);
    }

    @Override
    public void onTestEnd(TestLeaf test) {
        delegate.onTestEnd(test);
    }

    @Override
    public void requestStop() {
        delegate.requestStop();
    }

    @Override
    public boolean isStopRequested() {
        return delegate.isStopRequested();
    }

    @Override
    public ExecutionState getState() {
        return delegate.getState();
    }

    @Override
    public void printErrors() {
        delegate.printErrors();
    }
}
