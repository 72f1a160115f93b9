package net.legacy.harness.command.config;

import java.util.Map;

/**
 * Interface for configuration sources.
 *
 * <p>Sources are merged by {@link #getPriority()}: a key defined by a higher priority source
 * overrides the same key of a lower priority one.
 *
 * @author qwq-dev
 * @version 2.1
 * @since 2025-06-20 10:00
 */
public interface ConfigurationSource {

    /**
     * Gets the name of the configuration source.
     *
     * @return the source name
     */
    String getName();

    /**
     * Gets the priority of the configuration source.
     *
     * @return the priority (higher values have higher priority)
     */
    int getPriority();

    /**
     * Loads all configuration properties from this source.
     *
     * @return a map of configuration properties, never null
     */
    Map<String, String> load();

}
