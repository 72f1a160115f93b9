package net.legacy.harness.command.config;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration source reading a properties file from the classpath.
 *
 * <p>A missing resource yields an empty configuration.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@Slf4j
public class ClasspathConfigurationSource implements ConfigurationSource {
    /**
     * Name of the bundled configuration resource.
     */
    public static final String DEFAULT_RESOURCE = "harness.properties";

    private final String resourceName;
    private final ClassLoader classLoader;

    public ClasspathConfigurationSource(String resourceName, ClassLoader classLoader) {
        this.resourceName = Objects.requireNonNull(resourceName, "resourceName");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    @Override
    public String getName() {
        return "Classpath(" + resourceName + ")";
    }

    @Override
    public int getPriority() {
        return 0;
    }

    @Override
    public Map<String, String> load() {
        Map<String, String> result = new HashMap<>();
        try (InputStream input = classLoader.getResourceAsStream(resourceName)) {
            if (input == null) {
                log.debug("Configuration resource {} not found", resourceName);
                return result;
            }
            Properties properties = new Properties();
            try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            for (String name : properties.stringPropertyNames()) {
                result.put(name, properties.getProperty(name).trim());
            }
        } catch (IOException exception) {
            log.warn("Failed to read configuration resource {}: {}", resourceName, exception.getMessage());
        }
        return result;
    }
}
