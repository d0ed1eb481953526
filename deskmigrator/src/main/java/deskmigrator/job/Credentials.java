package deskmigrator.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Opaque secret bundle for a helpdesk instance (for example {@code email} and
 * {@code token}). Values are only handed to adapters; {@link #toString()}
 * prints the key names and never the values.
 */
public final class Credentials {

    private static final Credentials EMPTY = new Credentials(Map.of());

    private final Map<String, String> entries;

    private Credentials(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Credentials of(Map<String, String> entries) {
        Objects.requireNonNull(entries, "entries");
        return entries.isEmpty() ? EMPTY : new Credentials(entries);
    }

    public static Credentials empty() {
        return EMPTY;
    }

    /** Returns the secret stored under a key, or null. */
    public String get(String key) {
        return entries.get(key);
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Credentials other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Credentials{keys=" + new TreeSet<>(entries.keySet()) + ", values=****}";
    }
}
