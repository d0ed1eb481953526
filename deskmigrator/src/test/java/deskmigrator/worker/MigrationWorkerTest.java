package deskmigrator.worker;

import deskmigrator.adapter.AdapterRegistry;
import deskmigrator.adapter.MigrationRecord;
import deskmigrator.config.MigrationConfig;
import deskmigrator.engine.JobOrchestrator;
import deskmigrator.exceptions.ErrorKind;
import deskmigrator.job.InstanceRef;
import deskmigrator.job.JobAcknowledgement;
import deskmigrator.job.JobResult;
import deskmigrator.job.JobStatus;
import deskmigrator.job.MigrationJob;
import deskmigrator.job.SourceRef;
import deskmigrator.state.JobTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("MigrationWorker")
class MigrationWorkerTest {

    private MigrationWorker worker;
    private JobTracker tracker;

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger(100);
        AdapterRegistry registry = AdapterRegistry.builder()
                .defaultSource((component, spec) -> List.of(new MigrationRecord("1", Map.of("name", component))))
                .defaultTarget((component, record, instance) -> String.valueOf(ids.incrementAndGet()))
                .build();
        JobOrchestrator orchestrator = JobOrchestrator.builder()
                .adapters(registry)
                .config(MigrationConfig.builder().workerThreads(2).build())
                .build();
        tracker = new JobTracker(10);
        worker = new MigrationWorker(orchestrator, new InMemoryJobQueue(), tracker, null);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        worker.shutdown(5, TimeUnit.SECONDS);
    }

    private static MigrationJob job(String id, String... components) {
        return MigrationJob.forComponents(id, SourceRef.live(InstanceRef.of("s", "S", "s")),
                InstanceRef.of("t", "T", "t"), Set.of(components));
    }

    @Test
    @DisplayName("should acknowledge, run and record a submitted job")
    void shouldRunSubmittedJob() throws Exception {
        JobAcknowledgement ack = worker.submit(job("job-1", "groups", "macros"));
        CompletableFuture<JobResult> completion = worker.completion("job-1").orElseThrow();
        worker.start();
        JobResult result = completion.get(5, TimeUnit.SECONDS);

        assertThat(ack.status()).isEqualTo(JobAcknowledgement.QUEUED);
        assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(result.idMappings()).hasSize(2);
        assertThat(tracker.status("job-1")).contains(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("should show queued jobs before a thread picks them up")
    void shouldTrackQueuedJobs() {
        worker.submit(job("job-1", "groups"));

        assertThat(tracker.status("job-1")).contains(JobStatus.QUEUED);
        assertThat(tracker.progress("job-1")).contains(0);
    }

    @Test
    @DisplayName("should fail a job cancelled while queued")
    void shouldCancelQueuedJob() throws Exception {
        worker.submit(job("job-1", "groups"));
        CompletableFuture<JobResult> completion = worker.completion("job-1").orElseThrow();

        assertThat(worker.cancel("job-1")).isTrue();
        assertThat(worker.cancel("job-1")).isFalse();
        worker.start();

        JobResult result = completion.get(5, TimeUnit.SECONDS);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(tracker.status("job-1")).contains(JobStatus.FAILED);
    }

    @Test
    @DisplayName("should reject a second submission with an active id")
    void shouldRejectDuplicateSubmission() {
        worker.submit(job("job-1", "groups"));

        assertThatThrownBy(() -> worker.submit(job("job-1", "groups")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(worker.cancel("unknown")).isFalse();
    }

    @Test
    @DisplayName("should run several jobs concurrently")
    void shouldRunManyJobs() throws Exception {
        worker.start();
        for (int i = 0; i < 5; i++) {
            worker.submit(job("job-" + i, "groups"));
        }

        for (int i = 0; i < 5; i++) {
            CompletableFuture<JobResult> completion = worker.completion("job-" + i).orElse(null);
            if (completion != null) {
                completion.get(5, TimeUnit.SECONDS);
            }
        }

        long deadline = System.currentTimeMillis() + 5_000;
        while (tracker.history().size() < 5 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(tracker.history()).hasSize(5)
                .allSatisfy(entry -> assertThat(entry.status()).isEqualTo(JobStatus.COMPLETED));
    }

    @Test
    @DisplayName("should fail a job whose adapter throws an Error and keep serving the queue")
    void shouldSurviveAdapterError() throws Exception {
        AdapterRegistry registry = AdapterRegistry.builder()
                .defaultSource((component, spec) -> List.of(new MigrationRecord("1", Map.of("name", component))))
                .defaultTarget((component, record, instance) -> {
                    if (component.equals("macros")) {
                        throw new AssertionError("macro endpoint broke");
                    }
                    return "900";
                })
                .build();
        JobOrchestrator orchestrator = JobOrchestrator.builder()
                .adapters(registry)
                .config(MigrationConfig.builder().workerThreads(1).build())
                .build();
        worker = new MigrationWorker(orchestrator, new InMemoryJobQueue(), tracker, null);

        worker.submit(job("bad", "macros"));
        worker.submit(job("good", "groups"));
        CompletableFuture<JobResult> bad = worker.completion("bad").orElseThrow();
        CompletableFuture<JobResult> good = worker.completion("good").orElseThrow();
        worker.start();

        JobResult badResult = bad.get(5, TimeUnit.SECONDS);
        assertThat(badResult.status()).isEqualTo(JobStatus.FAILED);
        assertThat(badResult.errorKind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(badResult.failedComponent()).isEqualTo("macros");
        assertThat(good.get(5, TimeUnit.SECONDS).status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(tracker.status("bad")).contains(JobStatus.FAILED);
        assertThat(tracker.activeJobIds()).isEmpty();
    }

    @Test
    @DisplayName("should record a job that escapes the orchestrator as failed")
    void shouldRecordCrashedJob() throws Exception {
        JobOrchestrator crashing = mock(JobOrchestrator.class);
        when(crashing.config()).thenReturn(MigrationConfig.builder().workerThreads(1).build());
        when(crashing.run(any(MigrationJob.class), any(), any()))
                .thenThrow(new StackOverflowError("deep"))
                .thenAnswer(inv -> JobResult.completed(inv.<MigrationJob>getArgument(0).id(),
                        List.of(), List.of(), null));
        worker = new MigrationWorker(crashing, new InMemoryJobQueue(), tracker, null);

        worker.submit(job("crash", "groups"));
        worker.submit(job("next", "groups"));
        CompletableFuture<JobResult> crash = worker.completion("crash").orElseThrow();
        CompletableFuture<JobResult> next = worker.completion("next").orElseThrow();
        worker.start();

        assertThatThrownBy(() -> crash.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(StackOverflowError.class);
        assertThat(next.get(5, TimeUnit.SECONDS).isCompleted()).isTrue();
        assertThat(tracker.historyEntry("crash"))
                .hasValueSatisfying(entry -> assertThat(entry.status()).isEqualTo(JobStatus.FAILED));
        assertThat(tracker.activeJobIds()).isEmpty();
    }
}
