package deskmigrator.plan;

import deskmigrator.catalog.ComponentCatalog;
import deskmigrator.catalog.ComponentType;
import deskmigrator.exceptions.ValidationException;
import deskmigrator.job.MigrationJob;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered list of components a job will migrate.
 *
 * <p>Plans are built using {@link #build(ComponentCatalog, MigrationJob)}, which:
 * <ul>
 *   <li>Rejects unknown names in the requested or ignored sets</li>
 *   <li>Keeps catalog order, so referenced components come first</li>
 *   <li>Drops ignored components</li>
 * </ul>
 *
 * @see ComponentCatalog
 * @see deskmigrator.engine.JobOrchestrator
 */
public final class MigrationPlan {

    private final List<ComponentType> ordered;

    private MigrationPlan(List<ComponentType> ordered) {
        this.ordered = ordered;
    }

    // ===== public API =====

    /** Returns the planned component types in execution order. */
    public List<ComponentType> orderedComponents() {
        return ordered;
    }

    /** Returns the planned component names in execution order. */
    public List<String> componentNames() {
        return ordered.stream().map(ComponentType::name).toList();
    }

    public boolean includes(String component) {
        return ordered.stream().anyMatch(t -> t.name().equals(component));
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    // ===== factory =====

    /**
     * Builds the plan for a job.
     *
     * @param catalog the component catalog
     * @param job the job whose requested and ignored sets are planned
     * @return the plan, possibly empty
     * @throws ValidationException if either set names a component the catalog does not know
     */
    public static MigrationPlan build(ComponentCatalog catalog, MigrationJob job) throws ValidationException {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(job, "job");

        List<String> candidates = job.requestsAll()
                ? catalog.names()
                : catalog.orderedList(job.requestedComponents());
        catalog.requireKnown(job.ignoredItems());

        List<ComponentType> ordered = new ArrayList<>(candidates.size());
        for (String name : candidates) {
            if (!job.ignoredItems().contains(name)) {
                ordered.add(catalog.type(name));
            }
        }
        return new MigrationPlan(List.copyOf(ordered));
    }

    @Override
    public String toString() {
        return "MigrationPlan" + componentNames();
    }
}
