package deskmigrator.engine;

import deskmigrator.adapter.SourceSpec;
import deskmigrator.job.ComponentMigrationState;
import deskmigrator.job.ComponentStatus;
import deskmigrator.job.MigrationJob;
import deskmigrator.mapping.IdMapping;
import deskmigrator.mapping.IdentifierTranslator;
import deskmigrator.mapping.ReferenceRewriter;
import deskmigrator.plan.MigrationPlan;
import deskmigrator.progress.JobListener;
import deskmigrator.snapshot.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-run state of a job once validation has passed.
 *
 * <p>Holds:
 * <ul>
 *   <li>The job, its plan and the validated snapshot (null for live sources)</li>
 *   <li>The identifier translator and reference rewriter for this run</li>
 *   <li>The components that already succeeded and every component's state</li>
 *   <li>The mappings recorded by this run</li>
 * </ul>
 *
 * <p>Owned by the job thread. Listener callbacks that throw are logged and ignored.
 */
public final class JobContext {

    private static final Logger log = LoggerFactory.getLogger(JobContext.class);

    private final MigrationJob job;
    private final MigrationPlan plan;
    private final Snapshot snapshot;
    private final IdentifierTranslator translator;
    private final ReferenceRewriter rewriter;
    private final JobListener listener;

    private final Set<String> migrated = new LinkedHashSet<>();
    private final Map<String, ComponentMigrationState> states = new LinkedHashMap<>();
    private final List<IdMapping> produced = new ArrayList<>();

    public JobContext(MigrationJob job,
                      MigrationPlan plan,
                      Snapshot snapshot,
                      IdentifierTranslator translator,
                      ReferenceRewriter rewriter,
                      JobListener listener) {
        this.job = job;
        this.plan = plan;
        this.snapshot = snapshot;
        this.translator = translator;
        this.rewriter = rewriter;
        this.listener = listener;
        plan.componentNames().forEach(c -> states.put(c, ComponentMigrationState.pending(c)));
    }

    public MigrationJob job() { return job; }

    public String jobId() { return job.id(); }

    public MigrationPlan plan() { return plan; }

    /** Returns the validated snapshot, or null for live sources. */
    public Snapshot snapshot() { return snapshot; }

    public IdentifierTranslator translator() { return translator; }

    public ReferenceRewriter rewriter() { return rewriter; }

    /** Describes where the source adapter should read a component from. */
    public SourceSpec sourceSpecFor(String component) {
        if (snapshot == null) {
            return SourceSpec.live(job.source().instance());
        }
        return SourceSpec.snapshot(job.source().instance(), snapshot, snapshot.breakdownFor(component));
    }

    // ===== component bookkeeping =====

    /** Components that succeeded in this run, in completion order. */
    public Set<String> migratedComponents() {
        return Collections.unmodifiableSet(migrated);
    }

    void markMigrated(String component) {
        migrated.add(component);
    }

    public ComponentMigrationState state(String component) {
        return states.get(component);
    }

    /** Returns every planned component's state, in plan order. */
    public List<ComponentMigrationState> states() {
        return List.copyOf(states.values());
    }

    void advance(String component, ComponentStatus next) {
        update(states.get(component).advance(next));
    }

    void recordCount(String component, int count) {
        update(states.get(component).withRecordCount(count));
    }

    /** Marks the component failed unless it already reached a terminal state. */
    void failIfOpen(String component, String message) {
        ComponentMigrationState current = component != null ? states.get(component) : null;
        if (current != null && !current.status().isTerminal()) {
            update(current.fail(message));
        }
    }

    private void update(ComponentMigrationState state) {
        states.put(state.component(), state);
        try {
            listener.onComponentState(job.id(), state);
        } catch (RuntimeException e) {
            log.warn("Listener failed on component state for job {}: {}", job.id(), e.toString());
        }
    }

    // ===== mappings =====

    void mappingRecorded(IdMapping mapping) {
        produced.add(mapping);
    }

    /** Returns the mappings recorded by this run, in creation order. */
    public List<IdMapping> producedMappings() {
        return List.copyOf(produced);
    }

    // ===== listener =====

    void progress(int percent) {
        try {
            listener.onProgress(job.id(), percent);
        } catch (RuntimeException e) {
            log.warn("Listener failed on progress for job {}: {}", job.id(), e.toString());
        }
    }

    void log(String line) {
        try {
            listener.onLog(job.id(), line);
        } catch (RuntimeException e) {
            log.warn("Listener failed on log line for job {}: {}", job.id(), e.toString());
        }
    }
}
