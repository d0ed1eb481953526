package deskmigrator.exceptions;

/**
 * Base exception for every failure raised while running a migration job.
 *
 * <p>Carries optional diagnostic context that is appended to {@link #getMessage()}:
 * <ul>
 *   <li>The component (entity type) being migrated</li>
 *   <li>The source id of the record that caused the failure</li>
 *   <li>The stage where the failure occurred (validate, fetch, translate, create, record)</li>
 * </ul>
 *
 * <p>Subclasses report their category through {@link #kind()}.
 *
 * @see ErrorKind
 * @see deskmigrator.engine.JobOrchestrator
 */
public class MigrateException extends Exception {

    private final String component;
    private final String sourceRecordId;
    private final String stage;

    // ---------------- constructors ----------------

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        this(message, null, null, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    /**
     * Creates a new migration exception with diagnostic context.
     *
     * @param message the error message
     * @param component the component being migrated (may be null)
     * @param sourceRecordId the source id of the offending record (may be null)
     * @param stage the stage where the failure occurred (may be null)
     */
    public MigrateException(String message, String component, String sourceRecordId, String stage) {
        this(message, component, sourceRecordId, stage, null);
    }

    /**
     * Creates a new migration exception with diagnostic context and cause.
     *
     * @param message the error message
     * @param component the component being migrated (may be null)
     * @param sourceRecordId the source id of the offending record (may be null)
     * @param stage the stage where the failure occurred (may be null)
     * @param cause the underlying cause
     */
    public MigrateException(String message,
                            String component,
                            String sourceRecordId,
                            String stage,
                            Throwable cause) {
        super(message, cause);
        this.component = component;
        this.sourceRecordId = sourceRecordId;
        this.stage = stage;
    }

    // ---------------- getters ----------------

    /** Returns the failure category. */
    public ErrorKind kind() {
        return ErrorKind.UNKNOWN;
    }

    /** Returns the component being migrated, or null if not set. */
    public String getComponent() {
        return component;
    }

    /** Returns the source id of the offending record, or null if not set. */
    public String getSourceRecordId() {
        return sourceRecordId;
    }

    /** Returns the stage where the failure occurred, or null if not set. */
    public String getStage() {
        return stage;
    }

    /** Returns the message without the appended diagnostic context. */
    public String getBareMessage() {
        return super.getMessage();
    }

    // ---------------- diagnostics ----------------

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));

        if (component != null) sb.append(" [component=").append(component).append("]");
        if (sourceRecordId != null) sb.append(" [sourceId=").append(sourceRecordId).append("]");
        if (stage != null) sb.append(" [stage=").append(stage).append("]");

        return sb.toString();
    }
}
