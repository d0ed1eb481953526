package deskmigrator.scanner;

import java.util.Set;

/**
 * Immutable result of scanning for annotated adapter classes.
 *
 * @param sourceAdapters classes annotated with {@link deskmigrator.annotations.SourceComponent}
 * @param targetAdapters classes annotated with {@link deskmigrator.annotations.TargetComponent}
 * @see AdapterScanner
 * @see AdapterResolver
 */
public record AdapterScanResult(Set<Class<?>> sourceAdapters, Set<Class<?>> targetAdapters) {

    public AdapterScanResult {
        sourceAdapters = Set.copyOf(sourceAdapters);
        targetAdapters = Set.copyOf(targetAdapters);
    }

    public boolean isEmpty() {
        return sourceAdapters.isEmpty() && targetAdapters.isEmpty();
    }
}
