package deskmigrator.adapter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Source and target adapters keyed by component name, with an optional
 * default adapter for each side.
 *
 * <p>Built with {@link #builder()} or from annotated classes by
 * {@link deskmigrator.scanner.AdapterResolver}. Immutable once built.
 */
public final class AdapterRegistry {

    private final Map<String, SourceAdapter> sources;
    private final Map<String, TargetAdapter> targets;
    private final SourceAdapter defaultSource;
    private final TargetAdapter defaultTarget;

    private AdapterRegistry(Builder b) {
        this.sources = Map.copyOf(b.sources);
        this.targets = Map.copyOf(b.targets);
        this.defaultSource = b.defaultSource;
        this.defaultTarget = b.defaultTarget;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the component's source adapter, falling back to the default one. */
    public Optional<SourceAdapter> sourceFor(String component) {
        SourceAdapter adapter = sources.get(component);
        return Optional.ofNullable(adapter != null ? adapter : defaultSource);
    }

    /** Returns the component's target adapter, falling back to the default one. */
    public Optional<TargetAdapter> targetFor(String component) {
        TargetAdapter adapter = targets.get(component);
        return Optional.ofNullable(adapter != null ? adapter : defaultTarget);
    }

    /**
     * Lists the adapters that are missing for a set of components.
     *
     * @param components component names, in the order to report them
     * @return entries such as {@code "macros (target)"}, empty if every adapter is present
     */
    public List<String> missingAdapters(Collection<String> components) {
        List<String> missing = new ArrayList<>();
        for (String component : components) {
            if (sourceFor(component).isEmpty()) missing.add(component + " (source)");
            if (targetFor(component).isEmpty()) missing.add(component + " (target)");
        }
        return missing;
    }

    /**
     * Builder for {@link AdapterRegistry}.
     */
    public static final class Builder {
        private final Map<String, SourceAdapter> sources = new LinkedHashMap<>();
        private final Map<String, TargetAdapter> targets = new LinkedHashMap<>();
        private SourceAdapter defaultSource;
        private TargetAdapter defaultTarget;

        /**
         * Registers a source adapter for components.
         *
         * @throws IllegalStateException if a component already has a source adapter
         */
        public Builder source(SourceAdapter adapter, String... components) {
            Objects.requireNonNull(adapter, "adapter");
            for (String component : components) {
                if (sources.putIfAbsent(component, adapter) != null) {
                    throw new IllegalStateException("Multiple source adapters for component: " + component);
                }
            }
            return this;
        }

        /**
         * Registers a target adapter for components.
         *
         * @throws IllegalStateException if a component already has a target adapter
         */
        public Builder target(TargetAdapter adapter, String... components) {
            Objects.requireNonNull(adapter, "adapter");
            for (String component : components) {
                if (targets.putIfAbsent(component, adapter) != null) {
                    throw new IllegalStateException("Multiple target adapters for component: " + component);
                }
            }
            return this;
        }

        public Builder defaultSource(SourceAdapter adapter) {
            if (defaultSource != null) {
                throw new IllegalStateException("Multiple default source adapters");
            }
            this.defaultSource = Objects.requireNonNull(adapter, "adapter");
            return this;
        }

        public Builder defaultTarget(TargetAdapter adapter) {
            if (defaultTarget != null) {
                throw new IllegalStateException("Multiple default target adapters");
            }
            this.defaultTarget = Objects.requireNonNull(adapter, "adapter");
            return this;
        }

        public AdapterRegistry build() {
            return new AdapterRegistry(this);
        }
    }
}
