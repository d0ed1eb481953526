package deskmigrator.progress;

import deskmigrator.job.ComponentMigrationState;

/**
 * Receives progress, log lines and component state changes of a running job.
 *
 * <p>Callbacks run on the job thread. Implementations should return quickly;
 * an exception thrown from a callback is logged and otherwise ignored.
 *
 * @see NoopJobListener
 */
public interface JobListener {

    /** Called after each component succeeds, with the percentage of planned components done. */
    default void onProgress(String jobId, int percent) {}

    /** Called for each human-readable progress line. */
    default void onLog(String jobId, String line) {}

    /** Called on every component state transition. */
    default void onComponentState(String jobId, ComponentMigrationState state) {}
}
