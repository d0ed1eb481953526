package deskmigrator.job;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Reference to a helpdesk instance taking part in a migration.
 *
 * @param id instance id
 * @param name display name
 * @param subdomain instance subdomain, used by API clients
 * @param tags free-form tags
 * @param credentials secrets for the instance API; masked in {@link #toString()}
 */
public record InstanceRef(String id, String name, String subdomain, Set<String> tags, Credentials credentials) {

    public InstanceRef {
        Objects.requireNonNull(id, "id");
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        credentials = credentials == null ? Credentials.empty() : credentials;
    }

    public static InstanceRef of(String id, String name, String subdomain) {
        return new InstanceRef(id, name, subdomain, Set.of(), Credentials.empty());
    }
}
