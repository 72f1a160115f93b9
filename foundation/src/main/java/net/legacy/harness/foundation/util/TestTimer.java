package net.legacy.harness.foundation.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Named, monotonic timers for test runs.
 *
 * <p>Timers measure with {@link System#nanoTime()}, so that run durations stay correct across
 * wall clock adjustments.
 *
 * @author qwq-dev
 * @version 2.0
 * @since 2025-06-07 22:30
 */
public class TestTimer {
    private final Map<String, Long> runningTimers = new ConcurrentHashMap<>();

    /**
     * Starts, or restarts, a named timer.
     *
     * @param timerName the name of the timer
     */
    public void startTimer(String timerName) {
        runningTimers.put(timerName, System.nanoTime());
    }

    /**
     * Stops a named timer.
     *
     * @param timerName the name of the timer to stop
     * @return the elapsed time in milliseconds, or -1 if the timer is not running
     */
    public long stopTimer(String timerName) {
        Long startNanos = runningTimers.remove(timerName);
        if (startNanos == null) {
            return -1;
        }
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
