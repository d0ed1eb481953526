package deskmigrator.exceptions;

/**
 * Category of a migration failure, reported in {@link deskmigrator.job.JobResult}.
 *
 * @see MigrateException#kind()
 */
public enum ErrorKind {
    /** Malformed or unknown job shape, unrecognized component name, missing adapter. */
    VALIDATION,
    /** Snapshot could not be used as a migration source. */
    SNAPSHOT,
    /** A reference inside a source record could not be rewritten. */
    TRANSLATION,
    /** A mapping for the same (entityType, sourceId) was already recorded. */
    DUPLICATE_MAPPING,
    /** Source fetch or target create failed. */
    ADAPTER,
    /** Job was cancelled at a component boundary. */
    CANCELLED,
    /** Anything else. */
    UNKNOWN
}
