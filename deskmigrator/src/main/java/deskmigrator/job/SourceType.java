package deskmigrator.job;

import java.util.Locale;

/**
 * Where a job reads its records from.
 */
public enum SourceType {
    /** A stored point-in-time snapshot of the source instance. */
    SNAPSHOT("snapshot"),
    /** The running source instance's API. */
    LIVE("live");

    private final String wireName;

    SourceType(String wireName) {
        this.wireName = wireName;
    }

    /** Returns the lowercase name used in job requests. */
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a request value.
     *
     * @return the source type, or null if the value is not recognized
     */
    public static SourceType fromWire(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (SourceType t : values()) {
            if (t.wireName.equals(v)) return t;
        }
        return null;
    }
}
