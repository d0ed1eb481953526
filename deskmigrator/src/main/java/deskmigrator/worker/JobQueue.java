package deskmigrator.worker;

import deskmigrator.job.MigrationJob;

/**
 * FIFO of jobs waiting for a worker thread.
 *
 * <p>Implementations must be safe for one producer and several consumers.
 *
 * @see InMemoryJobQueue
 */
public interface JobQueue {

    void enqueue(MigrationJob job);

    /** Blocks until a job is available. */
    MigrationJob take() throws InterruptedException;

    int size();
}
