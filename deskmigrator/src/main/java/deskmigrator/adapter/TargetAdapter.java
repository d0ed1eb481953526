package deskmigrator.adapter;

import deskmigrator.exceptions.AdapterException;
import deskmigrator.job.InstanceRef;

/**
 * Creates entities in the target instance.
 *
 * <p>Records passed in already have their references rewritten to target ids.
 * With record parallelism enabled, {@link #create} is called concurrently for
 * records of the same component.
 *
 * @see deskmigrator.annotations.TargetComponent
 * @see AdapterRegistry
 */
@FunctionalInterface
public interface TargetAdapter {

    /**
     * Creates one entity.
     *
     * @param component the component name
     * @param record the translated record
     * @param target the target instance
     * @return the id minted by the target instance
     * @throws AdapterException if creation fails
     */
    String create(String component, MigrationRecord record, InstanceRef target) throws AdapterException;
}
