package deskmigrator.mapping;

import deskmigrator.adapter.MigrationRecord;
import deskmigrator.catalog.ComponentType;
import deskmigrator.exceptions.TranslationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites the foreign references of a source record to target instance ids.
 *
 * <p>For every reference field declared by the record's {@link ComponentType}:
 * <ul>
 *   <li>Null values and absent fields are left alone</li>
 *   <li>Scalar values are replaced by the mapped target id</li>
 *   <li>List values are replaced element by element; null elements stay null</li>
 * </ul>
 *
 * <p>A referenced component is available when it has already been migrated in
 * the current job or, with a {@link TranslatorScope#TARGET_INSTANCE} scope,
 * when the shared table already holds entities of that type.
 *
 * @see IdentifierTranslator
 */
public final class ReferenceRewriter {

    private final IdentifierTranslator translator;
    private final TranslatorScope scope;

    public ReferenceRewriter(IdentifierTranslator translator, TranslatorScope scope) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    /**
     * Returns a copy of the record with every reference field rewritten.
     *
     * @param type the record's component type
     * @param record the source record
     * @param migratedInJob components that already succeeded in this job
     * @return the rewritten record, or the same record if the type has no references
     * @throws TranslationException on the first reference that cannot be resolved
     */
    public MigrationRecord rewrite(ComponentType type, MigrationRecord record, Set<String> migratedInJob)
            throws TranslationException {
        if (!type.hasReferences()) {
            return record;
        }

        MigrationRecord result = record;
        for (Map.Entry<String, String> ref : type.referenceFields().entrySet()) {
            String field = ref.getKey();
            String referencedType = ref.getValue();
            Object value = record.get(field);
            if (value == null) continue;

            if (!isAvailable(referencedType, migratedInJob)) {
                throw new TranslationException(
                        "Referenced component " + referencedType + " has not been migrated",
                        type.name(), record.sourceId(), field, referencedType, null);
            }

            if (value instanceof Collection<?> values) {
                List<Object> rewritten = new ArrayList<>(values.size());
                for (Object element : values) {
                    rewritten.add(element == null ? null
                            : resolve(type, record, field, referencedType, element));
                }
                result = result.with(field, rewritten);
            } else {
                result = result.with(field, resolve(type, record, field, referencedType, value));
            }
        }
        return result;
    }

    private boolean isAvailable(String referencedType, Set<String> migratedInJob) {
        if (migratedInJob.contains(referencedType)) return true;
        return scope == TranslatorScope.TARGET_INSTANCE && translator.hasType(referencedType);
    }

    private String resolve(ComponentType type, MigrationRecord record, String field,
                           String referencedType, Object value) throws TranslationException {
        String sourceId = String.valueOf(value);
        Optional<String> targetId = translator.resolve(referencedType, sourceId);
        if (targetId.isEmpty()) {
            throw new TranslationException(
                    "No mapping for " + referencedType + "/" + sourceId + " referenced by field " + field,
                    type.name(), record.sourceId(), field, referencedType, sourceId);
        }
        return targetId.get();
    }
}
