package net.legacy.harness.command.engine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import net.legacy.harness.foundation.engine.TestEngine;
import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * Result of the engine capability check: either an engine, or the reason none is available.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class EngineAvailability {
    private final TestEngine engine;

    @Getter
    private final String reason;

    /**
     * Creates an available result.
     *
     * @param engine the engine
     * @return the result
     */
    public static EngineAvailability available(TestEngine engine) {
        return new EngineAvailability(Objects.requireNonNull(engine, "engine"), null);
    }

    /**
     * Creates a missing result.
     *
     * @param reason why no engine is available
     * @return the result
     */
    public static EngineAvailability missing(String reason) {
        Validate.notBlank(reason, "reason must not be blank");
        return new EngineAvailability(null, reason);
    }

    public boolean isAvailable() {
        return engine != null;
    }

    /**
     * Gets the engine.
     *
     * @return the engine
     * @throws IllegalStateException if no engine is available
     */
    public TestEngine getEngine() {
        Validate.validState(engine != null, "No engine available: %s", reason);
        return engine;
    }
}
