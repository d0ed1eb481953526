package deskmigrator.catalog;

import deskmigrator.exceptions.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ComponentCatalog")
class ComponentCatalogTest {

    private final ComponentCatalog catalog = ComponentCatalog.defaultCatalog();

    @Nested
    @DisplayName("default catalog")
    class DefaultCatalog {

        @Test
        @DisplayName("should list helpdesk components in dependency order")
        void shouldListComponentsInOrder() {
            assertThat(catalog.names()).containsExactly(
                    "custom_statuses", "groups", "custom_roles", "ticket_fields", "ticket_forms",
                    "brands", "dynamic_content", "macros", "triggers", "trigger_categories",
                    "views", "webhooks", "apps", "skills");
        }

        @Test
        @DisplayName("should declare trigger references to earlier components")
        void shouldDeclareTriggerReferences() {
            ComponentType triggers = catalog.type(ComponentCatalog.TRIGGERS);

            assertThat(triggers.referenceFields())
                    .containsEntry("group_id", "groups")
                    .containsEntry("brand_id", "brands");
            assertThat(catalog.positionOf("brands")).isLessThan(catalog.positionOf("triggers"));
        }

        @Test
        @DisplayName("should report unknown names")
        void shouldReportUnknownNames() {
            assertThat(catalog.contains("tickets")).isFalse();
            assertThat(catalog.positionOf("tickets")).isEqualTo(-1);
            assertThatThrownBy(() -> catalog.type("tickets"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("orderedList")
    class OrderedList {

        @Test
        @DisplayName("should return requested names in catalog order")
        void shouldOrderByCatalog() throws ValidationException {
            Set<String> requested = new LinkedHashSet<>(List.of("macros", "groups", "ticket_fields"));

            assertThat(catalog.orderedList(requested))
                    .containsExactly("groups", "ticket_fields", "macros");
        }

        @Test
        @DisplayName("should return an empty list for an empty request")
        void shouldHandleEmptyRequest() throws ValidationException {
            assertThat(catalog.orderedList(Set.of())).isEmpty();
        }

        @Test
        @DisplayName("should name every unknown component, sorted")
        void shouldRejectUnknownNames() {
            Set<String> requested = new LinkedHashSet<>(List.of("zebras", "groups", "tickets"));

            assertThatThrownBy(() -> catalog.orderedList(requested))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Unknown component(s): tickets, zebras");
        }
    }

    @Nested
    @DisplayName("consistency check")
    class ConsistencyCheck {

        @Test
        @DisplayName("should reject a reference to a later component")
        void shouldRejectForwardReference() {
            List<ComponentType> types = List.of(
                    ComponentType.of("macros").withReference("group_id", "groups"),
                    ComponentType.of("groups"));

            assertThatThrownBy(() -> ComponentCatalog.of(types))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("macros")
                    .hasMessageContaining("groups");
        }

        @Test
        @DisplayName("should reject a self reference")
        void shouldRejectSelfReference() {
            List<ComponentType> types = List.of(
                    ComponentType.of("groups").withReference("parent_id", "groups"));

            assertThatThrownBy(() -> ComponentCatalog.of(types))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should reject a reference to an unknown component")
        void shouldRejectUnknownReference() {
            List<ComponentType> types = List.of(
                    ComponentType.of("macros").withReference("group_id", "teams"));

            assertThatThrownBy(() -> ComponentCatalog.of(types))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("teams");
        }

        @Test
        @DisplayName("should reject duplicate names")
        void shouldRejectDuplicates() {
            List<ComponentType> types = List.of(ComponentType.of("groups"), ComponentType.of("groups"));

            assertThatThrownBy(() -> ComponentCatalog.of(types))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
