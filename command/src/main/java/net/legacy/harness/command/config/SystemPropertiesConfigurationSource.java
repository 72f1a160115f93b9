package net.legacy.harness.command.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration source backed by Java system properties, e.g.
 * {@code -Dharness.test.namespace=com.example.tests}.
 *
 * @author qwq-dev
 * @version 2.1
 * @since 2025-06-20 10:00
 */
public class SystemPropertiesConfigurationSource implements ConfigurationSource {
    private final Properties systemProperties;

    /**
     * Creates a new system properties configuration source.
     */
    public SystemPropertiesConfigurationSource() {
        this(System.getProperties());
    }

    SystemPropertiesConfigurationSource(Properties systemProperties) {
        this.systemProperties = systemProperties;
    }

    @Override
    public String getName() {
        return "SystemProperties";
    }

    @Override
    public int getPriority() {
        return 1; // Overrides the bundled defaults
    }

    @Override
    public Map<String, String> load() {
        Map<String, String> result = new HashMap<>();
        for (String propertyName : systemProperties.stringPropertyNames()) {
            result.put(propertyName, systemProperties.getProperty(propertyName));
        }
        return result;
    }
}
