package deskmigrator.snapshot;

import java.util.Optional;

/**
 * Looks up snapshot metadata by id. Implemented by the snapshot storage
 * collaborator; blob contents are read by a {@link deskmigrator.adapter.SourceAdapter}.
 */
public interface SnapshotStore {

    /**
     * Resolves a snapshot.
     *
     * @param snapshotId the snapshot id
     * @return the snapshot, or empty if the id does not resolve
     * @throws Exception if the store itself cannot be reached
     */
    Optional<Snapshot> resolve(String snapshotId) throws Exception;
}
