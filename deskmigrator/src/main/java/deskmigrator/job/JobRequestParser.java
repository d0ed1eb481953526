package deskmigrator.job;

import deskmigrator.exceptions.ValidationException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns a job submission into a {@link MigrationJob}.
 *
 * <p>Accepted shape (JSON or YAML):
 * <pre>
 * source:
 *   type: snapshot            # or live
 *   instanceInfo: {id, name, subdomain, tags?, credentials?}
 *   snapshotId: 42            # snapshot sources only
 * target:
 *   instanceInfo: {id, name, subdomain, tags?, credentials?}
 * components: [groups, macros] # or ignoredItems: [apps]
 * </pre>
 *
 * <p>Exactly one of {@code components} and {@code ignoredItems} must be given.
 * Component names are not checked here; unknown names fail when the job is planned.
 */
public final class JobRequestParser {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    /**
     * Returns a new job id of the form {@code migration-<epochMillis>-<n>}.
     */
    public static String newJobId() {
        return "migration-" + System.currentTimeMillis() + "-" + SEQUENCE.incrementAndGet();
    }

    /**
     * Parses a JSON or YAML document.
     *
     * @throws ValidationException if the document is not a mapping or a field is missing or invalid
     */
    public MigrationJob parse(String document, String jobId) throws ValidationException {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(document);
        } catch (YAMLException e) {
            throw new ValidationException("Request body is not valid JSON or YAML", e);
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new ValidationException("Request body must be an object");
        }
        return parse(map, jobId);
    }

    /**
     * Parses an already-decoded request.
     *
     * @throws ValidationException if a field is missing or invalid
     */
    public MigrationJob parse(Map<?, ?> request, String jobId) throws ValidationException {
        Map<?, ?> source = requireMap(request, "source", "");
        Map<?, ?> target = requireMap(request, "target", "");

        String typeName = requireString(source, "type", "source.");
        SourceType type = SourceType.fromWire(typeName);
        if (type == null) {
            throw new ValidationException("source.type must be 'snapshot' or 'live', got '" + typeName + "'");
        }

        InstanceRef sourceInstance = instance(requireMap(source, "instanceInfo", "source."), "source.instanceInfo.");
        InstanceRef targetInstance = instance(requireMap(target, "instanceInfo", "target."), "target.instanceInfo.");

        SourceRef sourceRef;
        if (type == SourceType.SNAPSHOT) {
            Object snapshotId = source.get("snapshotId");
            sourceRef = SourceRef.snapshot(sourceInstance, snapshotId != null ? String.valueOf(snapshotId) : null);
        } else {
            sourceRef = SourceRef.live(sourceInstance);
        }

        boolean hasComponents = request.get("components") != null;
        boolean hasIgnored = request.get("ignoredItems") != null;
        if (hasComponents == hasIgnored) {
            throw new ValidationException("Exactly one of 'components' or 'ignoredItems' is required");
        }

        if (hasComponents) {
            return MigrationJob.forComponents(jobId, sourceRef, targetInstance,
                    stringSet(request.get("components"), "components"));
        }
        return MigrationJob.allExcept(jobId, sourceRef, targetInstance,
                stringSet(request.get("ignoredItems"), "ignoredItems"));
    }

    // ===== helpers =====

    private static InstanceRef instance(Map<?, ?> info, String path) throws ValidationException {
        String id = requireString(info, "id", path);
        String name = requireString(info, "name", path);
        String subdomain = requireString(info, "subdomain", path);
        Set<String> tags = info.get("tags") == null ? Set.of() : stringSet(info.get("tags"), path + "tags");

        Credentials credentials = Credentials.empty();
        Object raw = info.get("credentials");
        if (raw != null) {
            if (!(raw instanceof Map<?, ?> creds)) {
                throw new ValidationException(path + "credentials must be an object");
            }
            Map<String, String> entries = new LinkedHashMap<>();
            creds.forEach((k, v) -> {
                if (k != null && v != null) entries.put(String.valueOf(k), String.valueOf(v));
            });
            credentials = Credentials.of(entries);
        }
        return new InstanceRef(id, name, subdomain, tags, credentials);
    }

    private static Map<?, ?> requireMap(Map<?, ?> parent, String key, String path) throws ValidationException {
        Object value = parent.get(key);
        if (value == null) {
            throw new ValidationException("Missing required field: " + path + key);
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ValidationException(path + key + " must be an object");
        }
        return map;
    }

    private static String requireString(Map<?, ?> parent, String key, String path) throws ValidationException {
        Object value = parent.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            throw new ValidationException("Missing required field: " + path + key);
        }
        if (value instanceof Map || value instanceof Collection) {
            throw new ValidationException(path + key + " must be a scalar");
        }
        return String.valueOf(value);
    }

    private static Set<String> stringSet(Object value, String path) throws ValidationException {
        if (!(value instanceof Collection<?> items)) {
            throw new ValidationException(path + " must be a list of strings");
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : items) {
            if (!(item instanceof String s)) {
                throw new ValidationException(path + " must be a list of strings");
            }
            result.add(s);
        }
        return result;
    }
}
