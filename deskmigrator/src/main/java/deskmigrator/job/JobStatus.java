package deskmigrator.job;

/**
 * Lifecycle of a migration job.
 *
 * <pre>
 * QUEUED -&gt; VALIDATING -&gt; MIGRATING -&gt; COMPLETED
 *    \__________\_____________\______-&gt; FAILED
 * </pre>
 */
public enum JobStatus {
    QUEUED(false),
    VALIDATING(false),
    MIGRATING(false),
    COMPLETED(true),
    FAILED(true);

    private final boolean terminal;

    JobStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /** Returns true if a job in this status may move to {@code next}. */
    public boolean canTransitionTo(JobStatus next) {
        if (terminal || next == null) return false;
        if (next == FAILED) return true;
        return switch (this) {
            case QUEUED -> next == VALIDATING;
            case VALIDATING -> next == MIGRATING;
            case MIGRATING -> next == COMPLETED;
            default -> false;
        };
    }
}
