package deskmigrator.plan;

import deskmigrator.catalog.ComponentCatalog;
import deskmigrator.exceptions.ValidationException;
import deskmigrator.job.InstanceRef;
import deskmigrator.job.MigrationJob;
import deskmigrator.job.SourceRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MigrationPlan")
class MigrationPlanTest {

    private static final InstanceRef SOURCE = InstanceRef.of("src-1", "Source", "source");
    private static final InstanceRef TARGET = InstanceRef.of("tgt-1", "Target", "target");

    private final ComponentCatalog catalog = ComponentCatalog.defaultCatalog();

    @Test
    @DisplayName("should order requested components by catalog position")
    void shouldOrderRequested() throws ValidationException {
        MigrationJob job = MigrationJob.forComponents("job-1", SourceRef.live(SOURCE), TARGET,
                new LinkedHashSet<>(List.of("triggers", "groups", "brands")));

        MigrationPlan plan = MigrationPlan.build(catalog, job);

        assertThat(plan.componentNames()).containsExactly("groups", "brands", "triggers");
        assertThat(plan.includes("brands")).isTrue();
        assertThat(plan.includes("macros")).isFalse();
    }

    @Test
    @DisplayName("should plan the whole catalog minus ignored items")
    void shouldPlanAllExceptIgnored() throws ValidationException {
        MigrationJob job = MigrationJob.allExcept("job-1", SourceRef.live(SOURCE), TARGET,
                Set.of("apps", "skills", "webhooks"));

        MigrationPlan plan = MigrationPlan.build(catalog, job);

        assertThat(plan.size()).isEqualTo(catalog.size() - 3);
        assertThat(plan.componentNames()).doesNotContain("apps", "skills", "webhooks")
                .startsWith("custom_statuses", "groups");
    }

    @Test
    @DisplayName("should allow an empty plan")
    void shouldAllowEmptyPlan() throws ValidationException {
        MigrationJob job = MigrationJob.forComponents("job-1", SourceRef.live(SOURCE), TARGET, Set.of());

        assertThat(MigrationPlan.build(catalog, job).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should reject unknown requested components")
    void shouldRejectUnknownRequested() {
        MigrationJob job = MigrationJob.forComponents("job-1", SourceRef.live(SOURCE), TARGET,
                Set.of("groups", "tickets"));

        assertThatThrownBy(() -> MigrationPlan.build(catalog, job))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("tickets");
    }

    @Test
    @DisplayName("should reject unknown ignored items")
    void shouldRejectUnknownIgnored() {
        MigrationJob job = MigrationJob.allExcept("job-1", SourceRef.live(SOURCE), TARGET, Set.of("users"));

        assertThatThrownBy(() -> MigrationPlan.build(catalog, job))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("users");
    }
}
