package deskmigrator.worker;

import deskmigrator.job.MigrationJob;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded in-process job queue. Jobs are lost when the process exits.
 */
public final class InMemoryJobQueue implements JobQueue {

    private final BlockingQueue<MigrationJob> jobs = new LinkedBlockingQueue<>();

    @Override
    public void enqueue(MigrationJob job) {
        jobs.add(job);
    }

    @Override
    public MigrationJob take() throws InterruptedException {
        return jobs.take();
    }

    @Override
    public int size() {
        return jobs.size();
    }
}
