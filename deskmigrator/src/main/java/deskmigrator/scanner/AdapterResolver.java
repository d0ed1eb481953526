package deskmigrator.scanner;

import deskmigrator.adapter.AdapterRegistry;
import deskmigrator.adapter.SourceAdapter;
import deskmigrator.adapter.TargetAdapter;
import deskmigrator.annotations.SourceComponent;
import deskmigrator.annotations.TargetComponent;

import java.lang.reflect.Constructor;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;

/**
 * Instantiates scanned adapter classes and registers them in an
 * {@link AdapterRegistry}.
 *
 * <p>Classes are validated against the expected interface and created via
 * their no-arg constructor. A class carrying both annotations is instantiated
 * once and registered on both sides.
 *
 * @see AdapterScanner
 */
public final class AdapterResolver {

    /**
     * Builds a registry from a scan result.
     *
     * @param scanned annotated classes
     * @return a new registry
     * @throws IllegalStateException if a class is invalid or two adapters claim the same component
     */
    public AdapterRegistry resolve(AdapterScanResult scanned) {
        return resolve(scanned, AdapterRegistry.builder());
    }

    /**
     * Adds scanned adapters to an existing builder, alongside adapters registered by hand.
     */
    public AdapterRegistry resolve(AdapterScanResult scanned, AdapterRegistry.Builder builder) {
        Map<Class<?>, Object> instances = new HashMap<>();

        scanned.sourceAdapters().stream()
                .sorted(Comparator.comparing(Class::getName))
                .forEach(type -> {
                    SourceAdapter adapter = instantiate(type, SourceAdapter.class, "@SourceComponent", instances);
                    String[] components = type.getAnnotation(SourceComponent.class).value();
                    if (components.length == 0) {
                        builder.defaultSource(adapter);
                    } else {
                        builder.source(adapter, components);
                    }
                });

        scanned.targetAdapters().stream()
                .sorted(Comparator.comparing(Class::getName))
                .forEach(type -> {
                    TargetAdapter adapter = instantiate(type, TargetAdapter.class, "@TargetComponent", instances);
                    String[] components = type.getAnnotation(TargetComponent.class).value();
                    if (components.length == 0) {
                        builder.defaultTarget(adapter);
                    } else {
                        builder.target(adapter, components);
                    }
                });

        return builder.build();
    }

    private <T> T instantiate(Class<?> type,
                              Class<T> expectedInterface,
                              String annotationName,
                              Map<Class<?>, Object> instances) {
        if (!expectedInterface.isAssignableFrom(type)) {
            throw new IllegalStateException(
                    annotationName + " must implement " + expectedInterface.getSimpleName()
                            + ": " + type.getName()
            );
        }

        Object existing = instances.get(type);
        if (existing != null) {
            return expectedInterface.cast(existing);
        }

        try {
            Constructor<?> ctor = type.getDeclaredConstructor();
            ctor.setAccessible(true);
            T instance = expectedInterface.cast(ctor.newInstance());
            instances.put(type, instance);
            return instance;
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException(
                    type.getName() + " must have a no-arg constructor", e
            );
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(
                    "Failed to instantiate " + type.getName(), e
            );
        }
    }
}
