package deskmigrator.engine;

import deskmigrator.adapter.AdapterRegistry;
import deskmigrator.adapter.AuditSink;
import deskmigrator.adapter.MigrationRecord;
import deskmigrator.adapter.SourceAdapter;
import deskmigrator.adapter.SourceSpec;
import deskmigrator.adapter.TargetAdapter;
import deskmigrator.alert.MigrationAlertLogger;
import deskmigrator.catalog.ComponentType;
import deskmigrator.config.MigrationConfig;
import deskmigrator.exceptions.AdapterException;
import deskmigrator.exceptions.DuplicateMappingException;
import deskmigrator.exceptions.MigrateException;
import deskmigrator.exceptions.MigrationTimeoutException;
import deskmigrator.job.ComponentStatus;
import deskmigrator.job.InstanceRef;
import deskmigrator.mapping.IdMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Migrates every record of one component from the source to the target instance.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li><b>fetch</b>: read all records through the component's {@link SourceAdapter}</li>
 *   <li><b>translate</b>: rewrite the references of every record; nothing is created
 *       if any record fails</li>
 *   <li><b>create</b>: create each record through the {@link TargetAdapter}</li>
 *   <li><b>record</b>: store each new id in the translator and the {@link AuditSink}</li>
 * </ol>
 *
 * <p>The first failing record stops the component. With a record parallelism
 * above one, creates run on a bounded pool, but results are consumed and
 * recorded in source order on the job thread, and pending creates are
 * cancelled after a failure.
 */
public final class ComponentMigrator {

    private static final Logger log = LoggerFactory.getLogger(ComponentMigrator.class);

    private final AdapterRegistry adapters;
    private final AuditSink auditSink;
    private final Duration adapterTimeout;
    private final int recordParallelism;

    public ComponentMigrator(AdapterRegistry adapters, AuditSink auditSink, MigrationConfig config) {
        this.adapters = Objects.requireNonNull(adapters, "adapters");
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink");
        this.adapterTimeout = config.adapterTimeout();
        this.recordParallelism = config.recordParallelism();
    }

    /**
     * Migrates one component.
     *
     * @param ctx the running job
     * @param type the component to migrate
     * @return the number of records fetched from the source
     * @throws MigrateException on the first fetch, translation, create or record failure
     */
    public int migrate(JobContext ctx, ComponentType type) throws MigrateException {
        String component = type.name();
        SourceAdapter source = adapters.sourceFor(component).orElseThrow(
                () -> new AdapterException("No source adapter registered", component, null, "fetch"));
        TargetAdapter target = adapters.targetFor(component).orElseThrow(
                () -> new AdapterException("No target adapter registered", component, null, "create"));

        ctx.advance(component, ComponentStatus.FETCHING);
        List<MigrationRecord> records = fetch(ctx, source, component);
        ctx.recordCount(component, records.size());
        log.debug("Job {} fetched {} {} record(s)", ctx.jobId(), records.size(), component);

        ctx.advance(component, ComponentStatus.TRANSLATING);
        List<MigrationRecord> translated = new ArrayList<>(records.size());
        for (MigrationRecord record : records) {
            translated.add(ctx.rewriter().rewrite(type, record, ctx.migratedComponents()));
        }

        ctx.advance(component, ComponentStatus.CREATING);
        InstanceRef instance = ctx.job().target();
        if (recordParallelism > 1 && translated.size() > 1) {
            createParallel(ctx, target, component, translated, instance);
        } else {
            for (MigrationRecord record : translated) {
                String targetId = create(target, component, record, instance);
                record(ctx, component, record, targetId);
            }
        }

        ctx.advance(component, ComponentStatus.SUCCEEDED);
        return records.size();
    }

    // ===== fetch =====

    private List<MigrationRecord> fetch(JobContext ctx, SourceAdapter source, String component)
            throws AdapterException {
        SourceSpec spec = ctx.sourceSpecFor(component);
        List<MigrationRecord> records;
        try {
            records = TimeoutExecutor.executeWithTimeoutChecked(
                    "fetch " + component, adapterTimeout, () -> source.fetch(component, spec));
        } catch (AdapterException e) {
            if (e.getComponent() != null) throw e;
            throw new AdapterException(e.getBareMessage(), component, null, "fetch", e);
        } catch (MigrationTimeoutException e) {
            throw new AdapterException(e.getMessage(), component, null, "fetch", e);
        } catch (Exception e) {
            throw new AdapterException("Fetch failed: " + describe(e), component, null, "fetch", e);
        }
        if (records == null) {
            throw new AdapterException("Source adapter returned no record list", component, null, "fetch");
        }
        return records;
    }

    // ===== create =====

    private String create(TargetAdapter target, String component, MigrationRecord record, InstanceRef instance)
            throws AdapterException {
        String targetId;
        try {
            targetId = TimeoutExecutor.executeWithTimeoutChecked(
                    "create " + component + "/" + record.sourceId(), adapterTimeout,
                    () -> target.create(component, record, instance));
        } catch (AdapterException e) {
            throw createFailure(component, record, e.getBareMessage(), e);
        } catch (MigrationTimeoutException e) {
            throw createFailure(component, record, e.getMessage(), e);
        } catch (Exception e) {
            throw createFailure(component, record, describe(e), e);
        }
        if (targetId == null || targetId.isBlank()) {
            throw createFailure(component, record, "target adapter returned no id", null);
        }
        return targetId;
    }

    private void createParallel(JobContext ctx, TargetAdapter target, String component,
                                List<MigrationRecord> records, InstanceRef instance) throws MigrateException {
        ExecutorService pool = Executors.newFixedThreadPool(
                Math.min(recordParallelism, records.size()), threadFactory(ctx.jobId(), component));
        try {
            List<Future<String>> futures = new ArrayList<>(records.size());
            for (MigrationRecord record : records) {
                futures.add(pool.submit(() -> create(target, component, record, instance)));
            }

            for (int i = 0; i < records.size(); i++) {
                MigrationRecord record = records.get(i);
                String targetId;
                try {
                    targetId = futures.get(i).get();
                } catch (ExecutionException e) {
                    cancelFrom(futures, i + 1);
                    Throwable cause = e.getCause();
                    if (cause instanceof AdapterException adapterError) throw adapterError;
                    throw createFailure(component, record, describe(cause), cause);
                } catch (InterruptedException e) {
                    cancelFrom(futures, i);
                    Thread.currentThread().interrupt();
                    throw createFailure(component, record, "interrupted", e);
                }

                try {
                    record(ctx, component, record, targetId);
                } catch (MigrateException e) {
                    cancelFrom(futures, i + 1);
                    throw e;
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static void cancelFrom(List<Future<String>> futures, int from) {
        for (int i = from; i < futures.size(); i++) {
            futures.get(i).cancel(true);
        }
    }

    private static AdapterException createFailure(String component, MigrationRecord record,
                                                  String reason, Throwable cause) {
        return new AdapterException(
                "Failed to create " + component + " record " + record.sourceId() + ": " + reason,
                component, record.sourceId(), "create", cause);
    }

    // ===== record =====

    private void record(JobContext ctx, String component, MigrationRecord record, String targetId)
            throws DuplicateMappingException {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(IdMapping.JOB_ID, ctx.jobId());
        metadata.put(IdMapping.TARGET_INSTANCE_ID, ctx.job().target().id());

        IdMapping mapping = ctx.translator().record(component, record.sourceId(), targetId, metadata);
        ctx.mappingRecorded(mapping);
        log.debug("Job {} created {}/{} -> {}", ctx.jobId(), component, record.sourceId(), targetId);

        try {
            auditSink.append(mapping);
        } catch (Exception e) {
            log.warn("Audit append failed for {}/{} in job {}", component, record.sourceId(), ctx.jobId(), e);
            MigrationAlertLogger.auditAppendFailed(ctx.jobId(), component, record.sourceId(), e);
        }
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static ThreadFactory threadFactory(String jobId, String component) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "migration-create-" + jobId + "-" + component + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
