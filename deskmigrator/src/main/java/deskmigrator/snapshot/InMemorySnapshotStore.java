package deskmigrator.snapshot;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshot store holding metadata in memory. Used by tests and the demo.
 */
public final class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    public InMemorySnapshotStore put(Snapshot snapshot) {
        snapshots.put(snapshot.id(), snapshot);
        return this;
    }

    @Override
    public Optional<Snapshot> resolve(String snapshotId) {
        if (snapshotId == null) return Optional.empty();
        return Optional.ofNullable(snapshots.get(snapshotId));
    }
}
