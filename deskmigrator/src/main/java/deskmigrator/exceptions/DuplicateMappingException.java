package deskmigrator.exceptions;

/**
 * Exception thrown when an identifier mapping is recorded twice for the same
 * {@code (entityType, sourceId)} key. The existing mapping is left untouched.
 *
 * @see deskmigrator.mapping.IdentifierTranslator#record
 */
public class DuplicateMappingException extends MigrateException {

    private final String existingTargetId;

    public DuplicateMappingException(String entityType, String sourceId, String existingTargetId) {
        super("Mapping already recorded for " + entityType + "/" + sourceId
                        + " -> " + existingTargetId,
                entityType, sourceId, "record");
        this.existingTargetId = existingTargetId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DUPLICATE_MAPPING;
    }

    /** Returns the target id already recorded for the key. */
    public String getExistingTargetId() {
        return existingTargetId;
    }
}
