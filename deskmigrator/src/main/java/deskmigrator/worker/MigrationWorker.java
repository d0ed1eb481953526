package deskmigrator.worker;

import deskmigrator.engine.CancellationToken;
import deskmigrator.engine.JobOrchestrator;
import deskmigrator.exceptions.UnknownMigrationException;
import deskmigrator.job.JobAcknowledgement;
import deskmigrator.job.JobResult;
import deskmigrator.job.JobStatus;
import deskmigrator.job.MigrationJob;
import deskmigrator.progress.JobListener;
import deskmigrator.progress.NoopJobListener;
import deskmigrator.state.JobTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs queued jobs on a fixed number of worker threads.
 *
 * <p>Each job runs as a single task on one worker thread; components of a job
 * never run in parallel. Jobs can be cancelled while queued or running; a
 * running job stops before its next component.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationWorker worker = new MigrationWorker(orchestrator, new InMemoryJobQueue(), tracker, listener);
 * worker.start();
 * JobAcknowledgement ack = worker.submit(job);
 * </pre>
 */
public final class MigrationWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MigrationWorker.class);

    private final JobOrchestrator orchestrator;
    private final JobQueue queue;
    private final JobTracker tracker;
    private final JobListener listener;
    private final int threads;

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<JobResult>> completions = new ConcurrentHashMap<>();

    private ExecutorService executor;

    public MigrationWorker(JobOrchestrator orchestrator, JobQueue queue, JobTracker tracker, JobListener listener) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.listener = listener != null ? listener : NoopJobListener.INSTANCE;
        this.threads = orchestrator.config().workerThreads();
    }

    /** Starts the worker threads. */
    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Worker already started");
        }
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "migration-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < threads; i++) {
            executor.submit(this::consume);
        }
        log.info("Migration worker started with {} thread(s)", threads);
    }

    /**
     * Queues a job.
     *
     * @return the acknowledgement to send back to the submitter
     * @throws IllegalStateException if a job with the same id is already active
     */
    public JobAcknowledgement submit(MigrationJob job) {
        Objects.requireNonNull(job, "job");
        if (tokens.putIfAbsent(job.id(), new CancellationToken()) != null) {
            throw new IllegalStateException("Job already active: " + job.id());
        }
        completions.put(job.id(), new CompletableFuture<>());
        tracker.queued(job);
        queue.enqueue(job);
        log.info("Job {} queued", job.id());
        return JobAcknowledgement.queued(job);
    }

    /**
     * Requests cancellation of an active job.
     *
     * @return true if the job was active and is now marked cancelled
     */
    public boolean cancel(String jobId) {
        CancellationToken token = tokens.get(jobId);
        if (token == null) {
            return false;
        }
        boolean cancelled = token.cancel();
        if (cancelled) {
            log.info("Cancellation requested for job {}", jobId);
        }
        return cancelled;
    }

    /** Returns a future completed with the job's result, if the job is known to this worker. */
    public Optional<CompletableFuture<JobResult>> completion(String jobId) {
        return Optional.ofNullable(completions.get(jobId));
    }

    public JobTracker tracker() {
        return tracker;
    }

    private void consume() {
        while (!Thread.currentThread().isInterrupted()) {
            MigrationJob job;
            try {
                job = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            runJob(job);
        }
        log.debug("Worker thread {} stopped", Thread.currentThread().getName());
    }

    private void runJob(MigrationJob job) {
        CancellationToken token = tokens.computeIfAbsent(job.id(), k -> new CancellationToken());
        CompletableFuture<JobResult> completion = completions.computeIfAbsent(job.id(), k -> new CompletableFuture<>());
        try {
            JobResult result = orchestrator.run(job, listener, token);
            tracker.finished(result);
            completion.complete(result);
        } catch (Throwable e) {
            log.error("Job {} crashed outside the orchestrator", job.id(), e);
            if (!job.status().isTerminal()) {
                job.transitionTo(JobStatus.FAILED);
            }
            tracker.finished(JobResult.failed(job.id(), new UnknownMigrationException(null, e),
                    List.of(), List.of(), null));
            completion.completeExceptionally(e);
        } finally {
            tokens.remove(job.id());
            completions.remove(job.id(), completion);
        }
    }

    /**
     * Interrupts the worker threads and waits up to the timeout for them to stop.
     * A running job sees the interrupt in its current adapter call.
     */
    public synchronized void shutdown(long timeout, TimeUnit unit) throws InterruptedException {
        if (executor == null) return;
        executor.shutdownNow();
        if (!executor.awaitTermination(timeout, unit)) {
            log.warn("Worker threads did not stop within {} {}", timeout, unit);
        }
        executor = null;
    }

    @Override
    public void close() throws InterruptedException {
        shutdown(30, TimeUnit.SECONDS);
    }
}
