package deskmigrator.snapshot;

import deskmigrator.exceptions.SnapshotException;
import deskmigrator.exceptions.SnapshotException.Reason;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Checks that a snapshot can serve as the source for a set of components.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>the snapshot resolved ({@link Reason#NOT_FOUND})</li>
 *   <li>it has a breakdown section ({@link Reason#MALFORMED})</li>
 *   <li>every required component is in the breakdown ({@link Reason#MISSING_COMPONENTS},
 *       naming all missing ones)</li>
 *   <li>it is not locked ({@link Reason#LOCKED})</li>
 * </ol>
 *
 * <p>Validation has no side effects and may be repeated with the same outcome.
 */
public final class SnapshotValidator {

    /**
     * Validates a snapshot.
     *
     * @param snapshot the resolved snapshot, or null if the reference did not resolve
     * @param requiredComponents components the job will read from the snapshot
     * @throws SnapshotException if the snapshot cannot be used
     */
    public void validate(Snapshot snapshot, Collection<String> requiredComponents) throws SnapshotException {
        validate(snapshot, null, requiredComponents);
    }

    /**
     * Validates a snapshot, using {@code requestedId} in the not-found message.
     *
     * @param snapshot the resolved snapshot, or null if the reference did not resolve
     * @param requestedId the id the job asked for (may be null)
     * @param requiredComponents components the job will read from the snapshot
     * @throws SnapshotException if the snapshot cannot be used
     */
    public void validate(Snapshot snapshot, String requestedId, Collection<String> requiredComponents)
            throws SnapshotException {
        Objects.requireNonNull(requiredComponents, "requiredComponents");

        if (snapshot == null) {
            throw new SnapshotException(Reason.NOT_FOUND, requestedId,
                    "Snapshot " + (requestedId != null ? requestedId + " " : "") + "not found");
        }

        if (!snapshot.hasBreakdown()) {
            throw new SnapshotException(Reason.MALFORMED, snapshot.id(),
                    "Snapshot " + snapshot.id() + " breakdown is missing");
        }

        List<String> missing = new ArrayList<>();
        for (String component : requiredComponents) {
            if (snapshot.breakdownFor(component) == null) {
                missing.add(component);
            }
        }
        if (!missing.isEmpty()) {
            throw new SnapshotException(Reason.MISSING_COMPONENTS, snapshot.id(),
                    "Snapshot " + snapshot.id() + " missing required components: " + String.join(", ", missing),
                    missing, null);
        }

        if (snapshot.locked()) {
            throw new SnapshotException(Reason.LOCKED, snapshot.id(),
                    "Cannot use locked snapshot " + snapshot.id() + " for migration");
        }
    }
}
