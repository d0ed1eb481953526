package deskmigrator.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One translated identifier: the entity {@code sourceId} of type
 * {@code entityType} was created as {@code targetId} in the target instance.
 *
 * @param entityType component name
 * @param sourceId id in the source instance
 * @param targetId id in the target instance
 * @param metadata free-form context; null values are dropped
 */
public record IdMapping(String entityType, String sourceId, String targetId, Map<String, String> metadata) {

    /** Metadata key holding the id of the job that produced the mapping. */
    public static final String JOB_ID = "jobId";
    /** Metadata key holding the target instance id. */
    public static final String TARGET_INSTANCE_ID = "targetInstanceId";

    public IdMapping {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(targetId, "targetId");
        Map<String, String> copy = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        metadata = Collections.unmodifiableMap(copy);
    }
}
