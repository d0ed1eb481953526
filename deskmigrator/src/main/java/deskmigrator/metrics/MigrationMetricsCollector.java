package deskmigrator.metrics;

import java.time.Duration;
import java.time.Instant;

/**
 * Collects timing and record counts for a single job run.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationMetricsCollector collector = new MigrationMetricsCollector().start(jobId);
 * collector.plannedComponents(plan.size());
 *
 * int fetched = collector.timed("groups", () -&gt; migrateGroups());
 * collector.componentCompleted("groups", fetched);
 *
 * MigrationMetrics metrics = collector.recordsCreated(created).finish();
 * </pre>
 *
 * <p>Not thread-safe; a collector belongs to the job thread.
 */
public final class MigrationMetricsCollector {

    private MigrationMetrics.Builder builder;
    private Instant startTime;
    private int componentsCompleted;

    public MigrationMetricsCollector start(String jobId) {
        this.startTime = Instant.now();
        this.componentsCompleted = 0;
        this.builder = MigrationMetrics.builder()
                .jobId(jobId)
                .startTime(startTime);
        return this;
    }

    public MigrationMetricsCollector plannedComponents(int count) {
        builder.plannedComponents(count);
        return this;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Times a component and returns the action's result. The duration is
     * recorded even when the action throws.
     */
    public <T, E extends Exception> T timed(String component, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            builder.componentDuration(component, Duration.ofNanos(System.nanoTime() - start).toMillis());
        }
    }

    /**
     * Records a finished component.
     *
     * @param component the component name
     * @param fetched records read from the source
     */
    public MigrationMetricsCollector componentCompleted(String component, int fetched) {
        builder.recordCount(component, fetched);
        componentsCompleted++;
        return this;
    }

    /** Sets the number of target entities created by the run, including those of a failed component. */
    public MigrationMetricsCollector recordsCreated(int count) {
        builder.recordsCreated(count);
        return this;
    }

    public MigrationMetrics finish() {
        Instant endTime = Instant.now();
        return builder
                .endTime(endTime)
                .componentsCompleted(componentsCompleted)
                .totalDurationMs(Duration.between(startTime, endTime).toMillis())
                .build();
    }
}
