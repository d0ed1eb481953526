package deskmigrator.adapter;

import deskmigrator.exceptions.AdapterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads snapshot components from files below a base directory.
 *
 * <p>Each component's breakdown entry names a storage location relative to the
 * base directory. The file holds a JSON or YAML array of objects; each object
 * needs an {@code id} field, used as the record's source id.
 */
public final class FileSnapshotSourceAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(FileSnapshotSourceAdapter.class);

    private final Path baseDir;

    public FileSnapshotSourceAdapter(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    }

    @Override
    public List<MigrationRecord> fetch(String component, SourceSpec source) throws AdapterException {
        if (!source.isSnapshot() || source.breakdown() == null) {
            throw new AdapterException("File source only serves snapshot components", component, null, "fetch");
        }
        String location = source.breakdown().storageLocation();
        if (location == null || location.isBlank()) {
            throw new AdapterException("Snapshot " + source.snapshot().id() + " has no storage location",
                    component, null, "fetch");
        }

        Path file = baseDir.resolve(location).normalize();
        if (!file.startsWith(baseDir.normalize())) {
            throw new AdapterException("Storage location escapes base directory: " + location,
                    component, null, "fetch");
        }

        Object root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (IOException e) {
            throw new AdapterException("Cannot read " + file, component, null, "fetch", e);
        } catch (YAMLException e) {
            throw new AdapterException("Cannot parse " + file, component, null, "fetch", e);
        }

        if (root == null) {
            return List.of();
        }
        if (!(root instanceof List<?> items)) {
            throw new AdapterException(file + " must contain an array of records", component, null, "fetch");
        }

        List<MigrationRecord> records = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new AdapterException(file + " contains a non-object record", component, null, "fetch");
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            map.forEach((k, v) -> payload.put(String.valueOf(k), v));
            try {
                records.add(MigrationRecord.fromMap(payload));
            } catch (IllegalArgumentException e) {
                throw new AdapterException(e.getMessage(), component, null, "fetch", e);
            }
        }

        long expected = source.breakdown().recordCount();
        if (expected >= 0 && expected != records.size()) {
            log.warn("Snapshot {} lists {} {} record(s), file {} has {}",
                    source.snapshot().id(), expected, component, file, records.size());
        }
        return records;
    }
}
