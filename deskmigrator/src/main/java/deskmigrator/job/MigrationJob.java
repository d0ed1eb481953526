package deskmigrator.job;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A migration job: what to copy, from where, to where, and how far it got.
 *
 * <p>The descriptor fields are immutable. {@link #status()} and
 * {@link #progressPercent()} are written only by the orchestrator through
 * {@link #transitionTo(JobStatus)} and {@link #advanceProgress(int)}, which
 * enforce the state machine and non-decreasing progress. Readers on other
 * threads (worker, dashboard) see the latest values.
 *
 * <p>The requested set is either explicit ({@link #forComponents}) or the
 * whole catalog minus {@link #ignoredItems()} ({@link #allExcept}).
 */
public final class MigrationJob {

    private final String id;
    private final SourceRef source;
    private final InstanceRef target;
    private final Set<String> requestedComponents;
    private final Set<String> ignoredItems;
    private final Instant createdAt;

    private volatile JobStatus status = JobStatus.QUEUED;
    private volatile int progressPercent;

    private MigrationJob(String id,
                         SourceRef source,
                         InstanceRef target,
                         Set<String> requestedComponents,
                         Set<String> ignoredItems) {
        this.id = Objects.requireNonNull(id, "id");
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.requestedComponents = requestedComponents == null ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(requestedComponents));
        this.ignoredItems = ignoredItems == null ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(ignoredItems));
        this.createdAt = Instant.now();
    }

    /** Creates a job for an explicit component set. */
    public static MigrationJob forComponents(String id, SourceRef source, InstanceRef target,
                                             Set<String> components) {
        Objects.requireNonNull(components, "components");
        return new MigrationJob(id, source, target, components, Set.of());
    }

    /** Creates a job for every catalog component except the ignored ones. */
    public static MigrationJob allExcept(String id, SourceRef source, InstanceRef target,
                                         Set<String> ignoredItems) {
        return new MigrationJob(id, source, target, null, ignoredItems);
    }

    public String id() { return id; }

    public SourceRef source() { return source; }

    public InstanceRef target() { return target; }

    /** Returns the explicit component set, or null when the job requests the whole catalog. */
    public Set<String> requestedComponents() { return requestedComponents; }

    public Set<String> ignoredItems() { return ignoredItems; }

    public boolean requestsAll() { return requestedComponents == null; }

    public Instant createdAt() { return createdAt; }

    public JobStatus status() { return status; }

    public int progressPercent() { return progressPercent; }

    /**
     * Moves the job to its next status.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public synchronized void transitionTo(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + ": illegal transition " + status + " -> " + next);
        }
        status = next;
    }

    /**
     * Raises progress.
     *
     * @param percent new progress, 0-100, not below the current value
     * @throws IllegalArgumentException if out of range
     * @throws IllegalStateException if lower than the current progress or the job is terminal
     */
    public synchronized void advanceProgress(int percent) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("progress out of range: " + percent);
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is " + status);
        }
        if (percent < progressPercent) {
            throw new IllegalStateException("Job " + id + ": progress may not decrease from "
                    + progressPercent + " to " + percent);
        }
        progressPercent = percent;
    }

    @Override
    public String toString() {
        return "MigrationJob{" +
                "id='" + id + '\'' +
                ", source=" + source.type() + (source.snapshotId() != null ? ":" + source.snapshotId() : "") +
                ", sourceInstance=" + source.instance().subdomain() +
                ", target=" + target.subdomain() +
                ", components=" + (requestsAll() ? "ALL" : requestedComponents) +
                ", ignored=" + ignoredItems +
                ", status=" + status +
                ", progress=" + progressPercent +
                '}';
    }
}
