package deskmigrator.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One migratable entity type and the record fields that reference other types.
 *
 * <p>{@code referenceFields} maps a record field name to the name of the
 * component it points at. A field may hold a single id or a list of ids.
 *
 * @param name the component name, e.g. {@code ticket_forms}
 * @param referenceFields field name to referenced component name, in declaration order
 * @see ComponentCatalog
 */
public record ComponentType(String name, Map<String, String> referenceFields) {

    public ComponentType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(referenceFields, "referenceFields");
        referenceFields = Collections.unmodifiableMap(new LinkedHashMap<>(referenceFields));
    }

    /** Creates a component type without references. */
    public static ComponentType of(String name) {
        return new ComponentType(name, Map.of());
    }

    /** Returns a copy of this type with one more reference field. */
    public ComponentType withReference(String field, String referencedComponent) {
        Map<String, String> refs = new LinkedHashMap<>(referenceFields);
        refs.put(field, referencedComponent);
        return new ComponentType(name, refs);
    }

    /** Returns true if any field of this type references another component. */
    public boolean hasReferences() {
        return !referenceFields.isEmpty();
    }
}
