package deskmigrator.scanner;

import deskmigrator.adapter.MigrationRecord;
import deskmigrator.adapter.SourceAdapter;
import deskmigrator.adapter.SourceSpec;
import deskmigrator.annotations.SourceComponent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AdapterResolver")
class AdapterResolverTest {

    @SourceComponent("groups")
    static class NotAnAdapter {
    }

    @SourceComponent("groups")
    static class NeedsArguments implements SourceAdapter {
        NeedsArguments(String endpoint) {
        }

        @Override
        public List<MigrationRecord> fetch(String component, SourceSpec source) {
            return List.of();
        }
    }

    @SourceComponent("groups")
    static class FirstGroups implements SourceAdapter {
        @Override
        public List<MigrationRecord> fetch(String component, SourceSpec source) {
            return List.of();
        }
    }

    @SourceComponent("groups")
    static class SecondGroups implements SourceAdapter {
        @Override
        public List<MigrationRecord> fetch(String component, SourceSpec source) {
            return List.of();
        }
    }

    private final AdapterResolver resolver = new AdapterResolver();

    @Test
    @DisplayName("should reject annotated classes that are not adapters")
    void shouldRejectNonAdapter() {
        assertThatThrownBy(() -> resolver.resolve(new AdapterScanResult(Set.of(NotAnAdapter.class), Set.of())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must implement SourceAdapter");
    }

    @Test
    @DisplayName("should require a no-arg constructor")
    void shouldRequireNoArgConstructor() {
        assertThatThrownBy(() -> resolver.resolve(new AdapterScanResult(Set.of(NeedsArguments.class), Set.of())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no-arg constructor");
    }

    @Test
    @DisplayName("should reject two adapters claiming the same component")
    void shouldRejectConflicts() {
        AdapterScanResult scanned = new AdapterScanResult(Set.of(FirstGroups.class, SecondGroups.class), Set.of());

        assertThatThrownBy(() -> resolver.resolve(scanned))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Multiple source adapters for component: groups");
    }
}
