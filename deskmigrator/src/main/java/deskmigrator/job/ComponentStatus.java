package deskmigrator.job;

/**
 * Stage of one component within a job. Stages only move forward.
 */
public enum ComponentStatus {
    PENDING,
    FETCHING,
    TRANSLATING,
    CREATING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
