package deskmigrator.adapter;

import deskmigrator.exceptions.AdapterException;

import java.util.List;

/**
 * Reads the records of one component, either from a snapshot blob or from the
 * live source instance.
 *
 * <p>Implementations own authentication, pagination and rate limiting. They
 * may be called from several job threads at once and should be stateless or
 * thread-safe.
 *
 * @see deskmigrator.annotations.SourceComponent
 * @see AdapterRegistry
 */
@FunctionalInterface
public interface SourceAdapter {

    /**
     * Fetches all records of a component.
     *
     * @param component the component name
     * @param source where to read from
     * @return records in source order, never null
     * @throws AdapterException if the records cannot be read
     */
    List<MigrationRecord> fetch(String component, SourceSpec source) throws AdapterException;
}
