package deskmigrator.mapping;

import deskmigrator.exceptions.DuplicateMappingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only table mapping {@code (entityType, sourceId)} to the id minted by
 * the target instance.
 *
 * <p>Key features:
 * <ul>
 *   <li>Insert-only: a second {@link #record} for the same key fails and the
 *       first mapping stays</li>
 *   <li>Lookups are in-memory hash lookups and never block on I/O</li>
 *   <li>Thread-safe, so one table can be shared per target instance</li>
 * </ul>
 *
 * @see ReferenceRewriter
 * @see TranslatorProvider
 */
public final class IdentifierTranslator {

    private record Key(String entityType, String sourceId) {}

    private final ConcurrentMap<Key, IdMapping> table = new ConcurrentHashMap<>();
    private final List<IdMapping> insertionOrder = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> entityTypes = ConcurrentHashMap.newKeySet();

    /**
     * Records a new mapping.
     *
     * @param entityType the component name
     * @param sourceId id in the source instance
     * @param targetId id in the target instance
     * @param metadata free-form context (may be null)
     * @return the stored mapping
     * @throws DuplicateMappingException if the key is already mapped
     */
    public IdMapping record(String entityType, String sourceId, String targetId, Map<String, String> metadata)
            throws DuplicateMappingException {
        IdMapping mapping = new IdMapping(entityType, sourceId, targetId, metadata);
        IdMapping existing = table.putIfAbsent(new Key(entityType, sourceId), mapping);
        if (existing != null) {
            throw new DuplicateMappingException(entityType, sourceId, existing.targetId());
        }
        insertionOrder.add(mapping);
        entityTypes.add(entityType);
        return mapping;
    }

    /**
     * Looks up the target id for a source entity.
     *
     * @param entityType the component name
     * @param sourceId id in the source instance
     * @return the target id, or empty if not mapped
     */
    public Optional<String> resolve(String entityType, String sourceId) {
        IdMapping mapping = table.get(new Key(entityType, sourceId));
        return mapping == null ? Optional.empty() : Optional.of(mapping.targetId());
    }

    public boolean contains(String entityType, String sourceId) {
        return table.containsKey(new Key(entityType, sourceId));
    }

    /** Returns true if at least one mapping of the type was recorded. */
    public boolean hasType(String entityType) {
        return entityTypes.contains(entityType);
    }

    /** Returns every mapping in insertion order. */
    public List<IdMapping> mappings() {
        synchronized (insertionOrder) {
            return List.copyOf(insertionOrder);
        }
    }

    /** Returns the mappings of one type in insertion order. */
    public List<IdMapping> mappingsFor(String entityType) {
        synchronized (insertionOrder) {
            return insertionOrder.stream()
                    .filter(m -> m.entityType().equals(entityType))
                    .toList();
        }
    }

    public int size() {
        return table.size();
    }

    /** Drops every mapping. Only used when a target instance scope is reset. */
    void clear() {
        synchronized (insertionOrder) {
            table.clear();
            insertionOrder.clear();
            entityTypes.clear();
        }
    }
}
