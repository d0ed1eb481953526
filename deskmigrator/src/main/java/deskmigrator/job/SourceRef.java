package deskmigrator.job;

import java.util.Objects;

/**
 * Source side of a job.
 *
 * @param type snapshot or live
 * @param instance the source instance
 * @param snapshotId the snapshot to read from; only meaningful for {@link SourceType#SNAPSHOT}
 */
public record SourceRef(SourceType type, InstanceRef instance, String snapshotId) {

    public SourceRef {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(instance, "instance");
    }

    public static SourceRef snapshot(InstanceRef instance, String snapshotId) {
        return new SourceRef(SourceType.SNAPSHOT, instance, snapshotId);
    }

    public static SourceRef live(InstanceRef instance) {
        return new SourceRef(SourceType.LIVE, instance, null);
    }

    public boolean isSnapshot() {
        return type == SourceType.SNAPSHOT;
    }
}
