package deskmigrator.adapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One source entity as fetched by a {@link SourceAdapter}.
 *
 * @param sourceId id of the entity in the source instance
 * @param fields entity payload; values may be null
 */
public record MigrationRecord(String sourceId, Map<String, Object> fields) {

    /** Field used as the source id when building records from raw maps. */
    public static final String ID_FIELD = "id";

    public MigrationRecord {
        Objects.requireNonNull(sourceId, "sourceId");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Builds a record from a raw payload, taking the source id from {@code id}.
     *
     * @throws IllegalArgumentException if the payload has no id
     */
    public static MigrationRecord fromMap(Map<String, ?> payload) {
        Object id = payload.get(ID_FIELD);
        if (id == null) {
            throw new IllegalArgumentException("record has no '" + ID_FIELD + "' field: " + payload.keySet());
        }
        return new MigrationRecord(String.valueOf(id), new LinkedHashMap<>(payload));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /** Returns a copy with one field replaced. */
    public MigrationRecord with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new MigrationRecord(sourceId, copy);
    }
}
