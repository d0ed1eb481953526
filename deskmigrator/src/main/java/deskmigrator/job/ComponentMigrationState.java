package deskmigrator.job;

import java.util.Objects;

/**
 * Snapshot of one component's progress within a job. Every transition
 * produces a new instance; terminal states have no successors.
 *
 * @param component the component name
 * @param status current stage
 * @param sourceRecordCount records fetched from the source, -1 before the fetch completes
 * @param error failure message for {@link ComponentStatus#FAILED}, otherwise null
 */
public record ComponentMigrationState(String component, ComponentStatus status, int sourceRecordCount, String error) {

    public ComponentMigrationState {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(status, "status");
    }

    public static ComponentMigrationState pending(String component) {
        return new ComponentMigrationState(component, ComponentStatus.PENDING, -1, null);
    }

    /**
     * Moves to a later, non-failed stage.
     *
     * @throws IllegalStateException if this state is terminal or {@code next} is not later
     */
    public ComponentMigrationState advance(ComponentStatus next) {
        requireOpen();
        if (next == ComponentStatus.FAILED || next.ordinal() <= status.ordinal()) {
            throw new IllegalStateException(component + ": cannot move from " + status + " to " + next);
        }
        return new ComponentMigrationState(component, next, sourceRecordCount, null);
    }

    public ComponentMigrationState withRecordCount(int count) {
        requireOpen();
        return new ComponentMigrationState(component, status, count, error);
    }

    public ComponentMigrationState fail(String message) {
        requireOpen();
        return new ComponentMigrationState(component, ComponentStatus.FAILED, sourceRecordCount, message);
    }

    private void requireOpen() {
        if (status.isTerminal()) {
            throw new IllegalStateException(component + " is already " + status);
        }
    }
}
