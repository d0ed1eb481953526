package deskmigrator.catalog;

import deskmigrator.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fixed total order over the migratable component types.
 *
 * <p>The order substitutes for per-edge dependency resolution: each type may
 * only reference types earlier in the list. This is verified when the catalog
 * is built, so a reference field pointing forward (or at an unknown type) is
 * rejected up front instead of surfacing as a translation failure mid-job.
 *
 * <p>Instances are immutable and safe to share between jobs.
 *
 * @see ComponentType
 * @see deskmigrator.plan.MigrationPlan
 */
public final class ComponentCatalog {

    public static final String CUSTOM_STATUSES = "custom_statuses";
    public static final String GROUPS = "groups";
    public static final String CUSTOM_ROLES = "custom_roles";
    public static final String TICKET_FIELDS = "ticket_fields";
    public static final String TICKET_FORMS = "ticket_forms";
    public static final String BRANDS = "brands";
    public static final String DYNAMIC_CONTENT = "dynamic_content";
    public static final String MACROS = "macros";
    public static final String TRIGGERS = "triggers";
    public static final String TRIGGER_CATEGORIES = "trigger_categories";
    public static final String VIEWS = "views";
    public static final String WEBHOOKS = "webhooks";
    public static final String APPS = "apps";
    public static final String SKILLS = "skills";

    private static final ComponentCatalog DEFAULT = of(List.of(
            ComponentType.of(CUSTOM_STATUSES),
            ComponentType.of(GROUPS),
            ComponentType.of(CUSTOM_ROLES),
            ComponentType.of(TICKET_FIELDS),
            ComponentType.of(TICKET_FORMS)
                    .withReference("ticket_field_ids", TICKET_FIELDS),
            ComponentType.of(BRANDS)
                    .withReference("ticket_form_ids", TICKET_FORMS),
            ComponentType.of(DYNAMIC_CONTENT),
            ComponentType.of(MACROS)
                    .withReference("restriction_group_ids", GROUPS),
            ComponentType.of(TRIGGERS)
                    .withReference("group_id", GROUPS)
                    .withReference("custom_status_id", CUSTOM_STATUSES)
                    .withReference("ticket_form_id", TICKET_FORMS)
                    .withReference("brand_id", BRANDS),
            ComponentType.of(TRIGGER_CATEGORIES),
            ComponentType.of(VIEWS)
                    .withReference("restriction_group_ids", GROUPS),
            ComponentType.of(WEBHOOKS),
            ComponentType.of(APPS),
            ComponentType.of(SKILLS)
    ));

    private final List<ComponentType> types;
    private final Map<String, Integer> positions;

    private ComponentCatalog(List<ComponentType> types, Map<String, Integer> positions) {
        this.types = types;
        this.positions = positions;
    }

    /** Returns the helpdesk catalog in its dependency order. */
    public static ComponentCatalog defaultCatalog() {
        return DEFAULT;
    }

    /**
     * Builds a catalog from types listed in migration order.
     *
     * @param types component types, dependencies first
     * @return an immutable catalog
     * @throws IllegalArgumentException if a name is listed twice
     * @throws IllegalStateException if a reference field points at an unknown,
     *         self or later type
     */
    public static ComponentCatalog of(List<ComponentType> types) {
        Objects.requireNonNull(types, "types");

        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < types.size(); i++) {
            String name = types.get(i).name();
            if (positions.putIfAbsent(name, i) != null) {
                throw new IllegalArgumentException("Duplicate component in catalog: " + name);
            }
        }

        checkReferenceOrder(types, positions);
        return new ComponentCatalog(List.copyOf(types), Map.copyOf(positions));
    }

    private static void checkReferenceOrder(List<ComponentType> types, Map<String, Integer> positions) {
        for (int i = 0; i < types.size(); i++) {
            ComponentType type = types.get(i);
            for (Map.Entry<String, String> ref : type.referenceFields().entrySet()) {
                Integer target = positions.get(ref.getValue());
                if (target == null) {
                    throw new IllegalStateException(type.name() + "." + ref.getKey()
                            + " references unknown component " + ref.getValue());
                }
                if (target >= i) {
                    throw new IllegalStateException(type.name() + "." + ref.getKey()
                            + " references " + ref.getValue()
                            + " which is not migrated before " + type.name());
                }
            }
        }
    }

    // ===== public API =====

    /**
     * Returns the requested components that the catalog knows, in catalog order.
     *
     * @param requested component names, in any order
     * @return the same names, ordered by catalog position
     * @throws ValidationException naming every unknown component
     */
    public List<String> orderedList(Set<String> requested) throws ValidationException {
        Objects.requireNonNull(requested, "requested");
        requireKnown(requested);

        List<String> ordered = new ArrayList<>(requested.size());
        for (ComponentType type : types) {
            if (requested.contains(type.name())) {
                ordered.add(type.name());
            }
        }
        return Collections.unmodifiableList(ordered);
    }

    /**
     * Rejects any name the catalog does not contain.
     *
     * @param names component names to check
     * @throws ValidationException naming every unknown component, sorted
     */
    public void requireKnown(Set<String> names) throws ValidationException {
        Set<String> unknown = new TreeSet<>();
        for (String name : names) {
            if (name == null || !positions.containsKey(name)) {
                unknown.add(String.valueOf(name));
            }
        }
        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown component(s): " + String.join(", ", unknown));
        }
    }

    /** Returns all component names in catalog order. */
    public List<String> names() {
        List<String> names = new ArrayList<>(types.size());
        for (ComponentType type : types) {
            names.add(type.name());
        }
        return Collections.unmodifiableList(names);
    }

    /** Returns all component types in catalog order. */
    public List<ComponentType> all() {
        return types;
    }

    public boolean contains(String name) {
        return positions.containsKey(name);
    }

    /**
     * Returns the type registered under a name.
     *
     * @throws IllegalArgumentException if the catalog does not contain it
     */
    public ComponentType type(String name) {
        Integer pos = positions.get(name);
        if (pos == null) {
            throw new IllegalArgumentException("Unknown component: " + name);
        }
        return types.get(pos);
    }

    /** Returns the zero-based catalog position, or -1 if unknown. */
    public int positionOf(String name) {
        return positions.getOrDefault(name, -1);
    }

    public int size() {
        return types.size();
    }
}
