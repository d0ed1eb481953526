package deskmigrator.engine;

import deskmigrator.adapter.AdapterRegistry;
import deskmigrator.adapter.AuditSink;
import deskmigrator.adapter.NoopAuditSink;
import deskmigrator.alert.MigrationAlertLogger;
import deskmigrator.catalog.ComponentCatalog;
import deskmigrator.catalog.ComponentType;
import deskmigrator.config.MigrationConfig;
import deskmigrator.exceptions.MigrateException;
import deskmigrator.exceptions.MigrationCancelledException;
import deskmigrator.exceptions.SnapshotException;
import deskmigrator.exceptions.UnknownMigrationException;
import deskmigrator.exceptions.ValidationException;
import deskmigrator.job.JobResult;
import deskmigrator.job.JobStatus;
import deskmigrator.job.MigrationJob;
import deskmigrator.job.SourceRef;
import deskmigrator.mapping.IdentifierTranslator;
import deskmigrator.mapping.ReferenceRewriter;
import deskmigrator.mapping.TranslatorProvider;
import deskmigrator.metrics.MigrationMetrics;
import deskmigrator.metrics.MigrationMetricsCollector;
import deskmigrator.plan.MigrationPlan;
import deskmigrator.progress.JobListener;
import deskmigrator.progress.NoopJobListener;
import deskmigrator.snapshot.Snapshot;
import deskmigrator.snapshot.SnapshotStore;
import deskmigrator.snapshot.SnapshotValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives a migration job through its lifecycle.
 *
 * <h2>Lifecycle:</h2>
 * <ol>
 *   <li><b>QUEUED -&gt; VALIDATING</b>: plan the components, check that adapters exist,
 *       resolve and validate the snapshot for snapshot sources</li>
 *   <li><b>VALIDATING -&gt; MIGRATING</b>: migrate each planned component in catalog order,
 *       checking for cancellation before each one</li>
 *   <li><b>MIGRATING -&gt; COMPLETED</b>: every component succeeded</li>
 * </ol>
 *
 * <p>Any failure moves the job to FAILED. Entities already created in the target
 * stay there; the result carries their mappings. Progress is reported after each
 * component succeeds as the percentage of planned components done.
 *
 * <h2>Usage:</h2>
 * <pre>
 * JobOrchestrator orchestrator = JobOrchestrator.builder()
 *         .adapters(registry)
 *         .snapshotStore(store)
 *         .config(MigrationConfigLoader.load())
 *         .build();
 * JobResult result = orchestrator.run(job, listener, CancellationToken.none());
 * </pre>
 *
 * @see ComponentMigrator
 * @see deskmigrator.worker.MigrationWorker
 */
public final class JobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final ComponentCatalog catalog;
    private final AdapterRegistry adapters;
    private final SnapshotStore snapshotStore;
    private final SnapshotValidator validator;
    private final TranslatorProvider translators;
    private final MigrationConfig config;
    private final ComponentMigrator componentMigrator;

    private JobOrchestrator(Builder b) {
        this.catalog = b.catalog;
        this.adapters = Objects.requireNonNull(b.adapters, "adapters");
        this.snapshotStore = b.snapshotStore;
        this.validator = b.validator;
        this.config = b.config;
        this.translators = b.translators != null ? b.translators : new TranslatorProvider(config.translatorScope());
        this.componentMigrator = new ComponentMigrator(adapters, b.auditSink, config);
        log.debug("Orchestrator configured: {}", config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ComponentCatalog catalog() {
        return catalog;
    }

    public MigrationConfig config() {
        return config;
    }

    public TranslatorProvider translators() {
        return translators;
    }

    /** Runs a job without a listener or external cancellation. */
    public JobResult run(MigrationJob job) {
        return run(job, NoopJobListener.INSTANCE, CancellationToken.none());
    }

    /**
     * Runs a job to completion or failure.
     *
     * <p>Never throws for migration failures; they are reported in the result.
     * A {@link VirtualMachineError} is rethrown once the job has been failed.
     *
     * @param job a job in {@link JobStatus#QUEUED}
     * @param listener progress, log and component state callbacks
     * @param token checked before validation and before each component
     * @return the outcome, always terminal
     */
    public JobResult run(MigrationJob job, JobListener listener, CancellationToken token) {
        Objects.requireNonNull(job, "job");
        JobListener callbacks = listener != null ? listener : NoopJobListener.INSTANCE;
        CancellationToken cancellation = token != null ? token : CancellationToken.none();

        MigrationMetricsCollector metrics = new MigrationMetricsCollector().start(job.id());
        JobContext ctx = null;
        String current = null;

        try {
            if (cancellation.isCancelled()) {
                MigrationAlertLogger.jobCancelled(job.id(), null);
                throw new MigrationCancelledException(job.id(), null);
            }

            // VALIDATING
            job.transitionTo(JobStatus.VALIDATING);
            MigrationPlan plan = MigrationPlan.build(catalog, job);
            metrics.plannedComponents(plan.size());
            MigrationAlertLogger.jobStarted(job.id(), job.source().type().wireName(), plan.size());
            log.info("Job {} planned {} component(s): {}", job.id(), plan.size(), plan.componentNames());

            requireAdapters(plan);
            Snapshot snapshot = resolveSnapshot(job, plan, callbacks);
            MigrationAlertLogger.jobValidated(job.id(), snapshot != null ? snapshot.id() : null);

            IdentifierTranslator translator = translators.translatorFor(job.id(), job.target().id());
            ReferenceRewriter rewriter = new ReferenceRewriter(translator, translators.scope());
            ctx = new JobContext(job, plan, snapshot, translator, rewriter, callbacks);
            final JobContext running = ctx;

            // MIGRATING
            job.transitionTo(JobStatus.MIGRATING);
            int total = plan.size();
            int done = 0;
            for (ComponentType type : plan.orderedComponents()) {
                if (cancellation.isCancelled()) {
                    MigrationAlertLogger.jobCancelled(job.id(), type.name());
                    throw new MigrationCancelledException(job.id(), type.name());
                }
                current = type.name();

                log.info("Job {} migrating {} ({}/{})", job.id(), current, done + 1, total);
                running.log("Migrating " + current);
                MigrationAlertLogger.componentStarted(job.id(), current);
                long start = System.nanoTime();

                int fetched = metrics.timed(current, () -> componentMigrator.migrate(running, type));

                long durationMs = (System.nanoTime() - start) / 1_000_000;
                running.markMigrated(current);
                metrics.componentCompleted(current, fetched);
                MigrationAlertLogger.componentCompleted(job.id(), current, fetched, durationMs);
                log.info("Job {} migrated {} ({} record(s) in {} ms)", job.id(), current, fetched, durationMs);
                running.log("Migrated " + current + ": " + fetched + " record(s)");

                done++;
                int percent = done * 100 / total;
                job.advanceProgress(percent);
                running.progress(percent);
                current = null;
            }

            if (total == 0) {
                log.info("Job {} has nothing to migrate", job.id());
                job.advanceProgress(100);
                running.progress(100);
            }

            job.transitionTo(JobStatus.COMPLETED);
            MigrationMetrics finished = metrics.recordsCreated(ctx.producedMappings().size()).finish();
            log.info("Job {} completed: {}", job.id(), finished.summary());
            MigrationAlertLogger.jobCompleted(job.id(), finished);
            running.log("Migration completed");
            return JobResult.completed(job.id(), ctx.producedMappings(), ctx.states(), finished);

        } catch (MigrateException e) {
            return fail(job, ctx, callbacks, e, metrics);
        } catch (RuntimeException e) {
            log.error("Job {} hit an unexpected error{}", job.id(),
                    current != null ? " in " + current : "", e);
            return fail(job, ctx, callbacks, new UnknownMigrationException(current, e), metrics);
        } catch (Error e) {
            log.error("Job {} hit a fatal error{}", job.id(),
                    current != null ? " in " + current : "", e);
            JobResult failed = fail(job, ctx, callbacks, new UnknownMigrationException(current, e), metrics);
            if (e instanceof VirtualMachineError) {
                throw e;
            }
            return failed;
        }
    }

    // ===== validation =====

    private void requireAdapters(MigrationPlan plan) throws ValidationException {
        List<String> missing = adapters.missingAdapters(plan.componentNames());
        if (!missing.isEmpty()) {
            throw new ValidationException("No adapter registered for: " + String.join(", ", missing));
        }
    }

    private Snapshot resolveSnapshot(MigrationJob job, MigrationPlan plan, JobListener listener)
            throws MigrateException {
        SourceRef source = job.source();
        if (!source.isSnapshot()) {
            return null;
        }

        String snapshotId = source.snapshotId();
        if (snapshotId == null || snapshotId.isBlank()) {
            throw new ValidationException("snapshotId is required for snapshot sources");
        }
        if (snapshotStore == null) {
            throw new ValidationException("No snapshot store configured");
        }

        emit(listener, job.id(), "Fetching snapshot " + snapshotId);
        Optional<Snapshot> resolved;
        try {
            resolved = snapshotStore.resolve(snapshotId);
        } catch (Exception e) {
            throw new SnapshotException(SnapshotException.Reason.NOT_FOUND, snapshotId,
                    "Failed to resolve snapshot " + snapshotId, e);
        }

        Snapshot snapshot = resolved != null ? resolved.orElse(null) : null;
        emit(listener, job.id(), "Validating snapshot " + snapshotId);
        validator.validate(snapshot, snapshotId, plan.componentNames());

        String sourceInstanceId = source.instance().id();
        if (snapshot.parentId() != null && !snapshot.parentId().equals(sourceInstanceId)) {
            log.warn("Job {} uses snapshot {} taken from instance {}, not source instance {}",
                    job.id(), snapshotId, snapshot.parentId(), sourceInstanceId);
        }
        return snapshot;
    }

    // ===== failure =====

    private JobResult fail(MigrationJob job, JobContext ctx, JobListener listener, MigrateException error,
                           MigrationMetricsCollector metrics) {
        if (ctx != null && !(error instanceof MigrationCancelledException)) {
            ctx.failIfOpen(error.getComponent(), error.getMessage());
        }
        log.error("Job {} failed{}: {}", job.id(),
                error.getComponent() != null ? " at " + error.getComponent() : "", error.getMessage());
        emit(listener, job.id(), "Migration failed: " + error.getMessage());

        if (!job.status().isTerminal()) {
            job.transitionTo(JobStatus.FAILED);
        }

        MigrationMetrics partial = metrics.recordsCreated(ctx != null ? ctx.producedMappings().size() : 0).finish();
        MigrationAlertLogger.jobFailed(job.id(), error, partial);
        if (ctx != null) {
            return JobResult.failed(job.id(), error, ctx.producedMappings(), ctx.states(), partial);
        }
        return JobResult.failed(job.id(), error, List.of(), List.of(), partial);
    }

    // Log lines for phases that run before a JobContext exists.
    private static void emit(JobListener listener, String jobId, String line) {
        try {
            listener.onLog(jobId, line);
        } catch (RuntimeException e) {
            log.warn("Listener failed on log line for job {}: {}", jobId, e.toString());
        }
    }

    /**
     * Builder for {@link JobOrchestrator}.
     */
    public static final class Builder {
        private ComponentCatalog catalog = ComponentCatalog.defaultCatalog();
        private AdapterRegistry adapters;
        private SnapshotStore snapshotStore;
        private SnapshotValidator validator = new SnapshotValidator();
        private TranslatorProvider translators;
        private AuditSink auditSink = NoopAuditSink.INSTANCE;
        private MigrationConfig config = MigrationConfig.DEFAULTS;

        public Builder catalog(ComponentCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            return this;
        }

        public Builder adapters(AdapterRegistry adapters) {
            this.adapters = Objects.requireNonNull(adapters, "adapters");
            return this;
        }

        public Builder snapshotStore(SnapshotStore snapshotStore) {
            this.snapshotStore = snapshotStore;
            return this;
        }

        public Builder validator(SnapshotValidator validator) {
            this.validator = Objects.requireNonNull(validator, "validator");
            return this;
        }

        /** Shares translators with other orchestrators; by default one is created from the config's scope. */
        public Builder translators(TranslatorProvider translators) {
            this.translators = translators;
            return this;
        }

        public Builder auditSink(AuditSink auditSink) {
            this.auditSink = auditSink != null ? auditSink : NoopAuditSink.INSTANCE;
            return this;
        }

        public Builder config(MigrationConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public JobOrchestrator build() {
            return new JobOrchestrator(this);
        }
    }
}
