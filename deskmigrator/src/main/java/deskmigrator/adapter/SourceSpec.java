package deskmigrator.adapter;

import deskmigrator.job.InstanceRef;
import deskmigrator.job.SourceType;
import deskmigrator.snapshot.ComponentBreakdown;
import deskmigrator.snapshot.Snapshot;

import java.util.Objects;

/**
 * Tells a {@link SourceAdapter} where to read one component from.
 *
 * @param type snapshot or live
 * @param instance the source instance
 * @param snapshot the validated snapshot, null for live sources
 * @param breakdown the snapshot's entry for the component, null for live sources
 */
public record SourceSpec(SourceType type, InstanceRef instance, Snapshot snapshot, ComponentBreakdown breakdown) {

    public SourceSpec {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(instance, "instance");
    }

    public static SourceSpec live(InstanceRef instance) {
        return new SourceSpec(SourceType.LIVE, instance, null, null);
    }

    public static SourceSpec snapshot(InstanceRef instance, Snapshot snapshot, ComponentBreakdown breakdown) {
        Objects.requireNonNull(snapshot, "snapshot");
        return new SourceSpec(SourceType.SNAPSHOT, instance, snapshot, breakdown);
    }

    public boolean isSnapshot() {
        return type == SourceType.SNAPSHOT;
    }
}
