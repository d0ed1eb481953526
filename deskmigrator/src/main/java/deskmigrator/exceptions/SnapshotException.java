package deskmigrator.exceptions;

import java.util.List;

/**
 * Exception thrown when a snapshot cannot be used as a migration source.
 *
 * @see deskmigrator.snapshot.SnapshotValidator
 */
public class SnapshotException extends MigrateException {

    /** Why the snapshot was rejected. */
    public enum Reason {
        /** The snapshot id did not resolve. */
        NOT_FOUND,
        /** The snapshot has no breakdown section. */
        MALFORMED,
        /** One or more required components are absent from the breakdown. */
        MISSING_COMPONENTS,
        /** The snapshot is locked and reserved. */
        LOCKED
    }

    private final Reason reason;
    private final String snapshotId;
    private final List<String> missingComponents;

    public SnapshotException(Reason reason, String snapshotId, String message) {
        this(reason, snapshotId, message, List.of(), null);
    }

    public SnapshotException(Reason reason, String snapshotId, String message, Throwable cause) {
        this(reason, snapshotId, message, List.of(), cause);
    }

    public SnapshotException(Reason reason,
                             String snapshotId,
                             String message,
                             List<String> missingComponents,
                             Throwable cause) {
        super(message, null, null, "validate", cause);
        this.reason = reason;
        this.snapshotId = snapshotId;
        this.missingComponents = List.copyOf(missingComponents);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SNAPSHOT;
    }

    public Reason getReason() {
        return reason;
    }

    public String getSnapshotId() {
        return snapshotId;
    }

    /** Returns every missing component for {@link Reason#MISSING_COMPONENTS}, otherwise empty. */
    public List<String> getMissingComponents() {
        return missingComponents;
    }
}
