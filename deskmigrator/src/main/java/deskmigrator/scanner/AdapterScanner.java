package deskmigrator.scanner;

import deskmigrator.annotations.SourceComponent;
import deskmigrator.annotations.TargetComponent;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Scans packages for classes annotated with {@link SourceComponent} or
 * {@link TargetComponent}.
 *
 * <p>Only classes inside the given packages (and their subpackages) are
 * returned, so adapters elsewhere on the classpath are never picked up by
 * accident.
 *
 * <h2>Usage:</h2>
 * <pre>
 * AdapterScanResult scanned = AdapterScanner.scan("com.example.adapters");
 * AdapterRegistry registry = new AdapterResolver().resolve(scanned);
 * </pre>
 *
 * @see AdapterScanResult
 * @see AdapterResolver
 */
public final class AdapterScanner {

    private static final Logger log = LoggerFactory.getLogger(AdapterScanner.class);

    private AdapterScanner() {}

    /**
     * Scans packages using the default classloader.
     *
     * @param packages base packages to scan
     * @return the annotated classes found
     */
    public static AdapterScanResult scan(String... packages) {
        return scan(null, packages);
    }

    /**
     * Scans packages using a specific classloader.
     *
     * @param classLoader the classloader to scan, or null for default
     * @param packages base packages to scan
     * @return the annotated classes found
     */
    public static AdapterScanResult scan(ClassLoader classLoader, String... packages) {
        Objects.requireNonNull(packages, "packages");
        if (packages.length == 0) {
            throw new IllegalArgumentException("At least one package is required");
        }

        FilterBuilder filter = new FilterBuilder();
        for (String pkg : packages) {
            filter.includePackage(pkg);
        }
        ConfigurationBuilder config = new ConfigurationBuilder()
                .setScanners(Scanners.TypesAnnotated, Scanners.SubTypes)
                .filterInputsBy(filter);

        for (String pkg : packages) {
            if (classLoader != null) {
                config.addUrls(ClasspathHelper.forPackage(pkg, classLoader));
            } else {
                config.addUrls(ClasspathHelper.forPackage(pkg));
            }
        }
        if (classLoader != null) {
            config.addClassLoaders(classLoader);
        }

        Reflections reflections = new Reflections(config);

        Set<Class<?>> sources = annotated(reflections, SourceComponent.class, packages);
        Set<Class<?>> targets = annotated(reflections, TargetComponent.class, packages);
        log.debug("Scanned {}: {} source adapter(s), {} target adapter(s)",
                List.of(packages), sources.size(), targets.size());
        return new AdapterScanResult(sources, targets);
    }

    private static Set<Class<?>> annotated(Reflections reflections,
                                           Class<? extends Annotation> annotation,
                                           String[] packages) {
        List<String> prefixes = new ArrayList<>(packages.length);
        for (String pkg : packages) {
            prefixes.add(pkg + ".");
        }
        Set<Class<?>> result = new LinkedHashSet<>();
        for (Class<?> type : reflections.getTypesAnnotatedWith(annotation, true)) {
            if (type.isAnnotationPresent(annotation) && inPackages(type, prefixes)) {
                result.add(type);
            }
        }
        return result;
    }

    private static boolean inPackages(Class<?> type, Collection<String> prefixes) {
        return prefixes.stream().anyMatch(p -> type.getName().startsWith(p));
    }
}
