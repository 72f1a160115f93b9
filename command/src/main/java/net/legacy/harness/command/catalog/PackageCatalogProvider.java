package net.legacy.harness.command.catalog;

import com.google.common.collect.ImmutableSortedSet;
import lombok.extern.slf4j.Slf4j;
import net.legacy.harness.command.config.HarnessConfiguration;
import net.legacy.harness.foundation.annotation.ModuleTest;
import net.legacy.harness.foundation.test.TestLoader;
import net.legacy.harness.foundation.util.ClassScanner;

import java.util.Objects;
import java.util.SortedSet;

/**
 * Catalog of the module packages directly below the namespace that hold enabled {@link ModuleTest} classes.
 *
 * <p>Only classes {@link TestLoader#isEnabledModuleTestClass(Class)} accepts count, so every
 * listed module can also be loaded.
 *
 * <p>A class in {@code <namespace>.<marker>cp} contributes the name {@code cp}. Classes in
 * deeper packages, or in packages without the marker, are not modules.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-07-02 10:15
 */
@Slf4j
public class PackageCatalogProvider implements CatalogProvider {
    private final HarnessConfiguration configuration;
    private final ClassLoader classLoader;

    public PackageCatalogProvider(HarnessConfiguration configuration, ClassLoader classLoader) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    @Override
    public SortedSet<String> sortedKnownModuleNames() {
        String modulePrefix = configuration.getDisplayPrefix();
        ImmutableSortedSet.Builder<String> names = ImmutableSortedSet.naturalOrder();
        for (Class<?> testClass : ClassScanner.findAnnotatedClasses(configuration.getNamespace(), ModuleTest.class,
                classLoader)) {
            String packageName = testClass.getPackageName();
            if (!packageName.startsWith(modulePrefix) || !TestLoader.isEnabledModuleTestClass(testClass)) {
                continue;
            }
            String name = packageName.substring(modulePrefix.length());
            if (!name.isEmpty() && name.indexOf('.') < 0) {
                names.add(name);
            }
        }

        SortedSet<String> catalog = names.build();
        log.debug("Found {} test modules under {}", catalog.size(), configuration.getNamespace());
        return catalog;
    }
}
