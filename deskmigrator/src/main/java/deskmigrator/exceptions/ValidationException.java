package deskmigrator.exceptions;

/**
 * Exception thrown when a job cannot be accepted as described.
 *
 * <p>Raised before any component runs, without touching the identifier
 * translator or any adapter. Typical causes:
 * <ul>
 *   <li>Unknown component names in the requested or ignored sets</li>
 *   <li>A malformed job request (missing instance info, bad source type)</li>
 *   <li>A snapshot-sourced job without a snapshot id</li>
 *   <li>No source or target adapter registered for a planned component</li>
 * </ul>
 *
 * @see deskmigrator.catalog.ComponentCatalog#orderedList(java.util.Set)
 * @see deskmigrator.job.JobRequestParser
 */
public class ValidationException extends MigrateException {

    /**
     * Creates a new validation exception with the specified message.
     *
     * @param message a description of the validation failure
     */
    public ValidationException(String message) { super(message); }

    /**
     * Creates a new validation exception with the specified message and cause.
     *
     * @param message a description of the validation failure
     * @param cause the underlying exception
     */
    public ValidationException(String message, Throwable cause) { super(message, cause); }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
