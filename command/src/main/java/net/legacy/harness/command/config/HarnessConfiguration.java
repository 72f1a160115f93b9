package net.legacy.harness.command.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of the test command: where test modules live and how their packages are named.
 *
 * <p>Test modules are packages named {@code <namespace>.<moduleMarker><name>}, e.g.
 * {@code net.legacy.harness.tests.test_cp} for the module {@code cp}.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@Slf4j
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class HarnessConfiguration {
    public static final String NAMESPACE_KEY = "harness.test.namespace";
    public static final String MODULE_MARKER_KEY = "harness.test.module-marker";
    public static final String DEFAULT_NAMESPACE = "net.legacy.harness.tests";
    public static final String DEFAULT_MODULE_MARKER = "test_";

    /**
     * Package holding the test modules.
     */
    private final String namespace;

    /**
     * Prefix of every test module package's last segment.
     */
    private final String moduleMarker;

    /**
     * Creates a configuration from explicit values.
     *
     * @param namespace    the package holding the test modules
     * @param moduleMarker the module package prefix
     * @return the configuration
     */
    public static HarnessConfiguration of(String namespace, String moduleMarker) {
        Validate.notBlank(namespace, "namespace must not be blank");
        Validate.notNull(moduleMarker, "moduleMarker must not be null");
        Validate.isTrue(!namespace.startsWith(".") && !namespace.endsWith("."), "Invalid namespace: %s", namespace);
        return new HarnessConfiguration(namespace, moduleMarker);
    }

    /**
     * Loads the configuration from the bundled {@code harness.properties} and system properties.
     *
     * @return the configuration
     */
    public static HarnessConfiguration load() {
        ClassLoader classLoader = HarnessConfiguration.class.getClassLoader();
        return from(List.of(
                new ClasspathConfigurationSource(ClasspathConfigurationSource.DEFAULT_RESOURCE, classLoader),
                new SystemPropertiesConfigurationSource()));
    }

    /**
     * Merges configuration sources, higher priority sources winning.
     *
     * @param sources the sources to merge
     * @return the configuration
     */
    public static HarnessConfiguration from(List<? extends ConfigurationSource> sources) {
        List<ConfigurationSource> sortedSources = new ArrayList<>(sources);
        sortedSources.sort(Comparator.comparingInt(ConfigurationSource::getPriority));

        Map<String, String> merged = new HashMap<>();
        for (ConfigurationSource source : sortedSources) {
            Map<String, String> properties = source.load();
            log.debug("Loaded {} properties from {} (priority: {})", properties.size(), source.getName(),
                    source.getPriority());
            merged.putAll(properties);
        }

        String namespace = StringUtils.defaultIfBlank(merged.get(NAMESPACE_KEY), DEFAULT_NAMESPACE).trim();
        String moduleMarker = merged.getOrDefault(MODULE_MARKER_KEY, DEFAULT_MODULE_MARKER).trim();
        return of(namespace, moduleMarker);
    }

    /**
     * Gets the prefix shared by every fully qualified test module name,
     * {@code namespace + "." + moduleMarker}.
     *
     * @return the display prefix
     */
    public String getDisplayPrefix() {
        return namespace + "." + moduleMarker;
    }

    @Override
    public String toString() {
        return "HarnessConfiguration{namespace=" + namespace + ", moduleMarker=" + moduleMarker + "}";
    }
}
