package net.legacy.harness.command.engine;

import lombok.extern.slf4j.Slf4j;
import net.legacy.harness.foundation.engine.TestEngine;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.Supplier;

/**
 * Looks up the test engine through {@link ServiceLoader}.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@Slf4j
public class EngineCapability implements Supplier<EngineAvailability> {
    static final String MISSING_MESSAGE = "No test engine is available; add the foundation module to the classpath";

    private final ClassLoader classLoader;

    public EngineCapability(ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    @Override
    public EngineAvailability get() {
        Iterator<TestEngine> engines = ServiceLoader.load(TestEngine.class, classLoader).iterator();
        try {
            if (engines.hasNext()) {
                TestEngine engine = engines.next();
                log.debug("Using test engine {}", engine.getClass().getName());
                return EngineAvailability.available(engine);
            }
        } catch (ServiceConfigurationError error) {
            log.debug("Test engine registration is broken", error);
            return EngineAvailability.missing(MISSING_MESSAGE + " (" + error.getMessage() + ")");
        }
        return EngineAvailability.missing(MISSING_MESSAGE);
    }
}
