package deskmigrator.exceptions;

/**
 * Exception thrown when a foreign reference in a source record cannot be
 * rewritten to a target instance id.
 *
 * <p>Either the referenced component has not been migrated in this job, or
 * the referenced source id is absent from the identifier table.
 *
 * @see deskmigrator.mapping.ReferenceRewriter
 */
public class TranslationException extends MigrateException {

    private final String field;
    private final String referencedType;
    private final String referencedId;

    public TranslationException(String message,
                                String component,
                                String sourceRecordId,
                                String field,
                                String referencedType,
                                String referencedId) {
        super(message, component, sourceRecordId, "translate");
        this.field = field;
        this.referencedType = referencedType;
        this.referencedId = referencedId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSLATION;
    }

    /** Returns the record field holding the unresolved reference. */
    public String getField() {
        return field;
    }

    /** Returns the component type the field refers to. */
    public String getReferencedType() {
        return referencedType;
    }

    /** Returns the unresolved source id, or null if the whole type was unavailable. */
    public String getReferencedId() {
        return referencedId;
    }
}
