package intake;

import deskmigrator.snapshot.InMemorySnapshotStore;
import deskmigrator.snapshot.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Loads snapshot metadata from {@code index.yml} in the snapshot base directory.
 *
 * <pre>
 * snapshots:
 *   - id: 42
 *     name: nightly
 *     parentId: acme-eu
 *     locked: false
 *     tags: [nightly]
 *     breakdown:
 *       groups: {recordCount: 2, byteSize: 310, storageLocation: nightly-42/groups.json}
 * </pre>
 *
 * An entry without {@code breakdown} is loaded as a snapshot with no breakdown.
 */
public final class SnapshotIndex {

    private static final Logger log = LoggerFactory.getLogger(SnapshotIndex.class);

    public static final String FILE_NAME = "index.yml";

    private SnapshotIndex() {}

    public static InMemorySnapshotStore load(Path baseDir) throws IOException {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        Path index = baseDir.resolve(FILE_NAME);
        if (!Files.exists(index)) {
            log.warn("No snapshot index at {}, snapshot jobs will fail", index);
            return store;
        }

        Object root;
        try (Reader reader = Files.newBufferedReader(index, StandardCharsets.UTF_8)) {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        }
        if (!(root instanceof Map<?, ?> doc) || !(doc.get("snapshots") instanceof List<?> entries)) {
            throw new IOException(index + ": expected a 'snapshots' list");
        }

        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> map) || map.get("id") == null) {
                throw new IOException(index + ": every snapshot needs an id");
            }
            Snapshot snapshot = toSnapshot(map);
            store.put(snapshot);
            log.debug("Indexed snapshot {} ({} component(s))", snapshot.id(),
                    snapshot.hasBreakdown() ? snapshot.breakdown().size() : 0);
        }
        log.info("Loaded {} snapshot(s) from {}", entries.size(), index);
        return store;
    }

    private static Snapshot toSnapshot(Map<?, ?> map) {
        Snapshot.Builder builder = Snapshot.builder(String.valueOf(map.get("id")))
                .name(string(map.get("name")))
                .parentId(string(map.get("parentId")))
                .locked(Boolean.TRUE.equals(map.get("locked")));
        Object createdAt = map.get("createdAt");
        if (createdAt instanceof Date date) {
            builder.createdAt(date.toInstant());
        } else if (createdAt != null) {
            builder.createdAt(Instant.parse(String.valueOf(createdAt)));
        }
        if (map.get("tags") instanceof List<?> tags) {
            tags.forEach(t -> builder.tag(String.valueOf(t)));
        }

        if (!(map.get("breakdown") instanceof Map<?, ?> breakdown)) {
            return builder.withoutBreakdown().build();
        }
        breakdown.forEach((component, raw) -> {
            Map<?, ?> entry = raw instanceof Map<?, ?> m ? m : Map.of();
            builder.component(String.valueOf(component),
                    number(entry.get("recordCount"), -1),
                    number(entry.get("byteSize"), 0),
                    string(entry.get("storageLocation")));
        });
        return builder.build();
    }

    private static String string(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    private static long number(Object value, long fallback) {
        return value instanceof Number n ? n.longValue() : fallback;
    }
}
