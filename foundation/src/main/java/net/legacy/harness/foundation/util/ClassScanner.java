package net.legacy.harness.foundation.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.Validate;
import org.reflections.Reflections;
import org.reflections.ReflectionsException;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;

import java.lang.annotation.Annotation;
import java.net.URL;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Utility for scanning the classpath for annotated classes and loading classes by name.
 *
 * <p>Scanning is backed by Reflections. Results are always restricted to the requested package,
 * since the scanned classpath roots usually hold unrelated packages as well.
 *
 * @author qwq-dev
 * @version 1.2
 * @since 2024-12-19 17:00
 */
@UtilityClass
public class ClassScanner {

    /**
     * Finds the classes directly annotated with {@code annotationClass} in {@code basePackage} and its
     * sub-packages.
     *
     * @param basePackage     the base package to scan
     * @param annotationClass the annotation class to look for
     * @param classLoader     the class loader used to locate and load classes
     * @return the annotated classes, in no particular order
     */
    public static Set<Class<?>> findAnnotatedClasses(String basePackage, Class<? extends Annotation> annotationClass,
                                                     ClassLoader classLoader) {
        Validate.notBlank(basePackage, "basePackage must not be blank");
        Collection<URL> urls = ClasspathHelper.forPackage(basePackage, classLoader);
        if (urls.isEmpty()) {
            return Set.of();
        }

        Reflections reflections = new Reflections(new ConfigurationBuilder()
                .setUrls(urls)
                .setClassLoaders(new ClassLoader[]{classLoader})
                .filterInputsBy(new FilterBuilder().includePackage(basePackage)));

        Set<Class<?>> annotated;
        try {
            annotated = reflections.getTypesAnnotatedWith(annotationClass);
        } catch (ReflectionsException exception) {
            // Raised by Reflections when nothing at all was indexed under the package
            TestLogger.logDebug("scanner", "No annotated types under %s: %s", basePackage, exception.getMessage());
            return Set.of();
        }

        String prefix = basePackage + ".";
        return annotated.stream()
                .filter(clazz -> clazz.isAnnotationPresent(annotationClass))
                .filter(clazz -> clazz.getPackageName().equals(basePackage)
                        || clazz.getPackageName().startsWith(prefix))
                .collect(Collectors.toSet());
    }

    /**
     * Finds the classes directly annotated with {@code annotationClass} declared in exactly
     * {@code packageName}, ignoring sub-packages.
     *
     * @param packageName     the package to scan
     * @param annotationClass the annotation class to look for
     * @param classLoader     the class loader used to locate and load classes
     * @return the annotated classes of the package, in no particular order
     */
    public static Set<Class<?>> findAnnotatedClassesInPackage(String packageName,
                                                              Class<? extends Annotation> annotationClass,
                                                              ClassLoader classLoader) {
        return findAnnotatedClasses(packageName, annotationClass, classLoader).stream()
                .filter(clazz -> clazz.getPackageName().equals(packageName))
                .collect(Collectors.toSet());
    }

    /**
     * Loads a class by its binary name without initializing it.
     *
     * @param className   the fully qualified class name
     * @param classLoader the class loader to use
     * @return the class, or empty if no such class can be loaded
     */
    public static Optional<Class<?>> loadClass(String className, ClassLoader classLoader) {
        try {
            return Optional.of(Class.forName(className, false, classLoader));
        } catch (ClassNotFoundException | LinkageError exception) {
            TestLogger.logDebug("scanner", "Cannot load class %s: %s", className, exception);
            return Optional.empty();
        }
    }

}
