package deskmigrator.snapshot;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, time-stamped capture of a source instance, partitioned by component.
 *
 * <p>{@code breakdown} is null when the stored snapshot has no breakdown
 * section; {@link SnapshotValidator} reports that as malformed.
 *
 * @param id snapshot id
 * @param name display name
 * @param parentId id of the source instance the snapshot was taken from (may be null)
 * @param locked locked snapshots are reserved and never used as a migration source
 * @param createdAt capture time (may be null)
 * @param tags free-form tags
 * @param breakdown component name to stored blob metadata, or null
 */
public record Snapshot(
        String id,
        String name,
        String parentId,
        boolean locked,
        Instant createdAt,
        Set<String> tags,
        Map<String, ComponentBreakdown> breakdown
) {
    public Snapshot {
        Objects.requireNonNull(id, "id");
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        breakdown = breakdown == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }

    /** Returns true if the snapshot carries a breakdown section. */
    public boolean hasBreakdown() {
        return breakdown != null;
    }

    /** Returns the breakdown entry for a component, or null. */
    public ComponentBreakdown breakdownFor(String component) {
        return breakdown == null ? null : breakdown.get(component);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Builder for constructing {@link Snapshot} instances.
     */
    public static final class Builder {
        private final String id;
        private String name;
        private String parentId;
        private boolean locked;
        private Instant createdAt;
        private final Set<String> tags = new LinkedHashSet<>();
        private Map<String, ComponentBreakdown> breakdown = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder parentId(String parentId) { this.parentId = parentId; return this; }
        public Builder locked(boolean locked) { this.locked = locked; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder tag(String tag) { this.tags.add(tag); return this; }

        public Builder component(String component, long recordCount, long byteSize, String storageLocation) {
            if (breakdown == null) breakdown = new LinkedHashMap<>();
            breakdown.put(component, new ComponentBreakdown(recordCount, byteSize, storageLocation));
            return this;
        }

        /** Drops the breakdown section entirely. */
        public Builder withoutBreakdown() {
            this.breakdown = null;
            return this;
        }

        public Snapshot build() {
            return new Snapshot(id, name, parentId, locked, createdAt, tags, breakdown);
        }
    }
}
