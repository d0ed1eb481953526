package deskmigrator.engine;

import deskmigrator.adapter.AdapterRegistry;
import deskmigrator.adapter.InMemoryAuditSink;
import deskmigrator.adapter.MigrationRecord;
import deskmigrator.adapter.SourceAdapter;
import deskmigrator.adapter.SourceSpec;
import deskmigrator.adapter.TargetAdapter;
import deskmigrator.alert.MigrationAlertLogger;
import deskmigrator.config.AlertLevel;
import deskmigrator.config.MigrationConfig;
import deskmigrator.exceptions.AdapterException;
import deskmigrator.exceptions.ErrorKind;
import deskmigrator.job.ComponentMigrationState;
import deskmigrator.job.ComponentStatus;
import deskmigrator.job.InstanceRef;
import deskmigrator.job.JobResult;
import deskmigrator.job.JobStatus;
import deskmigrator.job.MigrationJob;
import deskmigrator.job.SourceRef;
import deskmigrator.mapping.IdMapping;
import deskmigrator.mapping.TranslatorScope;
import deskmigrator.progress.JobListener;
import deskmigrator.snapshot.InMemorySnapshotStore;
import deskmigrator.snapshot.Snapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("JobOrchestrator")
class JobOrchestratorTest {

    private static final InstanceRef SOURCE = InstanceRef.of("src-1", "Acme EU", "acme-eu");
    private static final InstanceRef TARGET = InstanceRef.of("tgt-1", "Acme US", "acme-us");

    private FixtureSource source;
    private MintingTarget target;
    private InMemorySnapshotStore snapshots;
    private InMemoryAuditSink audit;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        source = new FixtureSource();
        source.put("groups", record("g1", Map.of("name", "Tier 1")), record("g2", Map.of("name", "Tier 2")));
        source.put("ticket_fields", record("f1", Map.of("title", "Priority")));
        source.put("macros",
                record("m1", Map.of("title", "Close", "restriction_group_ids", List.of("g1"))),
                record("m2", Map.of("title", "Escalate", "restriction_group_ids", List.of("g1", "g2"))));

        target = new MintingTarget();
        audit = new InMemoryAuditSink();
        listener = new RecordingListener();
        snapshots = new InMemorySnapshotStore()
                .put(Snapshot.builder("42")
                        .name("nightly")
                        .parentId("src-1")
                        .component("groups", 2, 512, "groups.json")
                        .component("ticket_fields", 1, 256, "ticket_fields.json")
                        .component("macros", 2, 1024, "macros.json")
                        .build())
                .put(Snapshot.builder("43").locked(true)
                        .component("groups", 2, 512, "groups.json")
                        .build());
    }

    private JobOrchestrator orchestrator(MigrationConfig config) {
        return JobOrchestrator.builder()
                .adapters(AdapterRegistry.builder().defaultSource(source).defaultTarget(target).build())
                .snapshotStore(snapshots)
                .auditSink(audit)
                .config(config)
                .build();
    }

    private JobOrchestrator orchestrator() {
        return orchestrator(MigrationConfig.DEFAULTS);
    }

    private static MigrationJob snapshotJob(String id, String snapshotId, String... components) {
        return MigrationJob.forComponents(id, SourceRef.snapshot(SOURCE, snapshotId), TARGET,
                new LinkedHashSet<>(List.of(components)));
    }

    private static MigrationRecord record(String id, Map<String, Object> fields) {
        Map<String, Object> copy = new HashMap<>(fields);
        copy.put("id", id);
        return new MigrationRecord(id, copy);
    }

    @Nested
    @DisplayName("successful jobs")
    class Successful {

        @Test
        @DisplayName("should migrate components in order and report progress per component")
        void shouldMigrateInOrder() {
            MigrationJob job = snapshotJob("job-1", "42", "ticket_fields", "groups");

            JobResult result = orchestrator().run(job, listener, CancellationToken.none());

            assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.progressPercent()).isEqualTo(100);
            assertThat(listener.progress).containsExactly(50, 100);
            assertThat(target.created).containsExactly("groups/g1", "groups/g2", "ticket_fields/f1");
            assertThat(result.idMappings()).hasSize(3);
            assertThat(result.componentStates()).extracting(ComponentMigrationState::status)
                    .containsOnly(ComponentStatus.SUCCEEDED);
            assertThat(result.metrics().componentsCompleted()).isEqualTo(2);
            assertThat(result.metrics().recordsCreated()).isEqualTo(3);
            assertThat(audit.mappingsFor("job-1")).hasSize(3);
        }

        @Test
        @DisplayName("should rewrite references to ids created earlier in the job")
        void shouldRewriteReferences() {
            JobResult result = orchestrator().run(snapshotJob("job-1", "42", "groups", "macros"));

            assertThat(result.isCompleted()).isTrue();
            String g1 = target.idOf("groups/g1");
            String g2 = target.idOf("groups/g2");
            assertThat(target.payload("macros/m2").get("restriction_group_ids")).isEqualTo(List.of(g1, g2));
        }

        @Test
        @DisplayName("should complete an empty plan with full progress")
        void shouldCompleteEmptyPlan() {
            MigrationJob job = MigrationJob.forComponents("job-1", SourceRef.live(SOURCE), TARGET, Set.of());

            JobResult result = orchestrator().run(job, listener, CancellationToken.none());

            assertThat(result.isCompleted()).isTrue();
            assertThat(job.progressPercent()).isEqualTo(100);
            assertThat(result.idMappings()).isEmpty();
        }

        @Test
        @DisplayName("should hand live sources a live spec")
        void shouldUseLiveSpec() {
            MigrationJob job = MigrationJob.forComponents("job-1", SourceRef.live(SOURCE), TARGET, Set.of("groups"));

            orchestrator().run(job);

            assertThat(source.specs).allSatisfy(spec -> assertThat(spec.isSnapshot()).isFalse());
        }
    }

    @Nested
    @DisplayName("failed jobs")
    class Failed {

        @Test
        @DisplayName("should stop at a failed create and keep mappings created so far")
        void shouldKeepPartialMappings() {
            target.failOn("macros/m2");
            MigrationJob job = snapshotJob("job-1", "42", "groups", "macros");

            JobResult result = orchestrator().run(job, listener, CancellationToken.none());

            assertThat(result.status()).isEqualTo(JobStatus.FAILED);
            assertThat(result.failedComponent()).isEqualTo("macros");
            assertThat(result.errorKind()).isEqualTo(ErrorKind.ADAPTER);
            assertThat(result.errorMessage()).contains("macros").contains("m2");
            assertThat(result.idMappings()).extracting(IdMapping::sourceId).containsExactly("g1", "g2", "m1");
            assertThat(job.progressPercent()).isEqualTo(50);
            assertThat(result.componentStates())
                    .filteredOn(s -> s.component().equals("macros"))
                    .singleElement()
                    .satisfies(s -> assertThat(s.status()).isEqualTo(ComponentStatus.FAILED));
        }

        @Test
        @DisplayName("should fail an unresolved snapshot before touching any adapter")
        void shouldFailUnresolvedSnapshot() {
            SourceAdapter sourceMock = mock(SourceAdapter.class);
            TargetAdapter targetMock = mock(TargetAdapter.class);
            JobOrchestrator orchestrator = JobOrchestrator.builder()
                    .adapters(AdapterRegistry.builder().defaultSource(sourceMock).defaultTarget(targetMock).build())
                    .snapshotStore(snapshots)
                    .build();
            MigrationJob job = snapshotJob("job-1", "999", "groups");

            JobResult result = orchestrator.run(job);

            assertThat(result.errorKind()).isEqualTo(ErrorKind.SNAPSHOT);
            assertThat(result.errorMessage()).contains("999");
            assertThat(result.idMappings()).isEmpty();
            assertThat(job.progressPercent()).isZero();
            verifyNoInteractions(sourceMock, targetMock);
        }

        @Test
        @DisplayName("should write the snapshot failure to the job log")
        void shouldLogUnresolvedSnapshot() {
            JobResult result = orchestrator().run(snapshotJob("job-1", "999", "groups"), listener,
                    CancellationToken.none());

            assertThat(result.errorKind()).isEqualTo(ErrorKind.SNAPSHOT);
            assertThat(listener.lines).first().isEqualTo("Fetching snapshot 999");
            assertThat(listener.lines).last().asString().startsWith("Migration failed:").contains("999");
        }

        @Test
        @DisplayName("should fail the job when an adapter throws an Error")
        void shouldFailOnAdapterError() {
            JobOrchestrator orchestrator = JobOrchestrator.builder()
                    .adapters(AdapterRegistry.builder()
                            .defaultSource(source)
                            .defaultTarget((component, record, instance) -> {
                                throw new AssertionError("target blew up");
                            })
                            .build())
                    .build();
            MigrationJob job = MigrationJob.forComponents("job-1", SourceRef.live(SOURCE), TARGET,
                    Set.of("groups"));

            JobResult result = orchestrator.run(job, listener, CancellationToken.none());

            assertThat(result.status()).isEqualTo(JobStatus.FAILED);
            assertThat(job.status()).isEqualTo(JobStatus.FAILED);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.UNKNOWN);
            assertThat(result.failedComponent()).isEqualTo("groups");
            assertThat(result.errorMessage()).contains("target blew up");
            assertThat(result.componentStates()).singleElement()
                    .satisfies(s -> assertThat(s.status()).isEqualTo(ComponentStatus.FAILED));
            assertThat(listener.lines).last().asString().contains("target blew up");
        }

        @Test
        @DisplayName("should fail when the snapshot lacks a requested component")
        void shouldFailMissingComponent() {
            JobResult result = orchestrator().run(snapshotJob("job-1", "42", "groups", "ticket_forms"));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.SNAPSHOT);
            assertThat(result.errorMessage()).contains("ticket_forms");
            assertThat(target.created).isEmpty();
        }

        @Test
        @DisplayName("should refuse a locked snapshot")
        void shouldRefuseLockedSnapshot() {
            JobResult result = orchestrator().run(snapshotJob("job-1", "43", "groups"));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.SNAPSHOT);
            assertThat(result.errorMessage()).contains("locked");
        }

        @Test
        @DisplayName("should require a snapshot id for snapshot sources")
        void shouldRequireSnapshotId() {
            JobResult result = orchestrator().run(snapshotJob("job-1", null, "groups"));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION);
        }

        @Test
        @DisplayName("should reject unknown components")
        void shouldRejectUnknownComponents() {
            JobResult result = orchestrator().run(snapshotJob("job-1", "42", "groups", "tickets"));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION);
            assertThat(result.errorMessage()).contains("tickets");
            assertThat(result.failedComponent()).isNull();
        }

        @Test
        @DisplayName("should reject components without adapters")
        void shouldRejectMissingAdapters() {
            JobOrchestrator orchestrator = JobOrchestrator.builder()
                    .adapters(AdapterRegistry.builder().source(source, "groups").target(target, "groups").build())
                    .build();
            MigrationJob job = MigrationJob.forComponents("job-1", SourceRef.live(SOURCE), TARGET,
                    Set.of("groups", "macros"));

            JobResult result = orchestrator.run(job);

            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION);
            assertThat(result.errorMessage()).contains("macros (source)", "macros (target)");
            assertThat(source.specs).isEmpty();
        }

        @Test
        @DisplayName("should not fail a job when a listener throws")
        void shouldTolerateListenerFailure() {
            JobListener exploding = new JobListener() {
                @Override
                public void onProgress(String jobId, int percent) {
                    throw new IllegalStateException("listener failure");
                }
            };
            MigrationJob job = snapshotJob("job-1", "42", "groups");

            JobResult result = orchestrator().run(job, exploding, CancellationToken.none());

            assertThat(result.isCompleted()).isTrue();
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("should leave the process-wide alert level untouched")
        void shouldNotChangeAlertLevel() {
            AlertLevel before = MigrationAlertLogger.getAlertLevel();
            try {
                MigrationAlertLogger.setAlertLevel(AlertLevel.ERROR);

                orchestrator(MigrationConfig.builder().alertLevel(AlertLevel.DEBUG).build());

                assertThat(MigrationAlertLogger.getAlertLevel()).isEqualTo(AlertLevel.ERROR);
            } finally {
                MigrationAlertLogger.setAlertLevel(before);
            }
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("should stop before the next component and name it")
        void shouldCancelAtComponentBoundary() {
            CancellationToken token = new CancellationToken();
            JobListener cancelling = new JobListener() {
                @Override
                public void onProgress(String jobId, int percent) {
                    token.cancel();
                }
            };
            MigrationJob job = snapshotJob("job-1", "42", "groups", "ticket_fields", "macros");

            JobResult result = orchestrator().run(job, cancelling, token);

            assertThat(result.status()).isEqualTo(JobStatus.FAILED);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(result.failedComponent()).isEqualTo("ticket_fields");
            assertThat(result.idMappings()).hasSize(2);
            assertThat(result.componentStates())
                    .filteredOn(s -> s.component().equals("ticket_fields"))
                    .singleElement()
                    .satisfies(s -> assertThat(s.status()).isEqualTo(ComponentStatus.PENDING));
        }

        @Test
        @DisplayName("should not start a job cancelled while queued")
        void shouldNotStartCancelledJob() {
            CancellationToken token = new CancellationToken();
            token.cancel();
            MigrationJob job = snapshotJob("job-1", "42", "groups");

            JobResult result = orchestrator().run(job, listener, token);

            assertThat(result.errorKind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(result.failedComponent()).isNull();
            assertThat(target.created).isEmpty();
        }
    }

    @Nested
    @DisplayName("translator scope")
    class Scope {

        private final MigrationConfig shared = MigrationConfig.builder()
                .translatorScope(TranslatorScope.TARGET_INSTANCE)
                .build();

        @Test
        @DisplayName("should reject re-migrating the same entities into the same target")
        void shouldRejectRerun() {
            JobOrchestrator orchestrator = orchestrator(shared);

            assertThat(orchestrator.run(snapshotJob("job-1", "42", "groups")).isCompleted()).isTrue();
            JobResult rerun = orchestrator.run(snapshotJob("job-2", "42", "groups"));

            assertThat(rerun.errorKind()).isEqualTo(ErrorKind.DUPLICATE_MAPPING);
            assertThat(rerun.failedComponent()).isEqualTo("groups");
        }

        @Test
        @DisplayName("should resolve references created by an earlier job")
        void shouldResolveAcrossJobs() {
            JobOrchestrator orchestrator = orchestrator(shared);
            orchestrator.run(snapshotJob("job-1", "42", "groups"));

            JobResult result = orchestrator.run(snapshotJob("job-2", "42", "macros"));

            assertThat(result.isCompleted()).isTrue();
            assertThat(target.payload("macros/m1").get("restriction_group_ids"))
                    .isEqualTo(List.of(target.idOf("groups/g1")));
        }

        @Test
        @DisplayName("should not see earlier jobs in job scope")
        void shouldIsolateJobScope() {
            JobOrchestrator orchestrator = orchestrator();
            orchestrator.run(snapshotJob("job-1", "42", "groups"));

            JobResult result = orchestrator.run(snapshotJob("job-2", "42", "macros"));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.TRANSLATION);
            assertThat(target.created).doesNotContain("macros/m1");
        }
    }

    // ===== fixtures =====

    private static final class FixtureSource implements SourceAdapter {
        private final Map<String, List<MigrationRecord>> records = new HashMap<>();
        private final List<SourceSpec> specs = new CopyOnWriteArrayList<>();

        void put(String component, MigrationRecord... items) {
            records.put(component, List.of(items));
        }

        @Override
        public List<MigrationRecord> fetch(String component, SourceSpec spec) {
            specs.add(spec);
            return records.getOrDefault(component, List.of());
        }
    }

    private static final class MintingTarget implements TargetAdapter {
        private final AtomicInteger sequence = new AtomicInteger(1000);
        private final List<String> created = new CopyOnWriteArrayList<>();
        private final Map<String, String> ids = new HashMap<>();
        private final Map<String, MigrationRecord> payloads = new HashMap<>();
        private final Set<String> failures = new LinkedHashSet<>();

        void failOn(String key) {
            failures.add(key);
        }

        String idOf(String key) {
            return ids.get(key);
        }

        MigrationRecord payload(String key) {
            return payloads.get(key);
        }

        @Override
        public synchronized String create(String component, MigrationRecord record, InstanceRef instance)
                throws AdapterException {
            String key = component + "/" + record.sourceId();
            if (failures.contains(key)) {
                throw new AdapterException("422 Unprocessable Entity");
            }
            String id = String.valueOf(sequence.incrementAndGet());
            created.add(key);
            ids.put(key, id);
            payloads.put(key, record);
            return id;
        }
    }

    private static final class RecordingListener implements JobListener {
        private final List<Integer> progress = new ArrayList<>();
        private final List<String> lines = new ArrayList<>();

        @Override
        public void onProgress(String jobId, int percent) {
            progress.add(percent);
        }

        @Override
        public void onLog(String jobId, String line) {
            lines.add(line);
        }
    }
}
