package deskmigrator.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during one job run.
 *
 * <p>Captures:
 * <ul>
 *   <li>Timing information (total duration, per-component durations)</li>
 *   <li>Per-component source record counts</li>
 *   <li>Totals of records created and components completed</li>
 * </ul>
 *
 * <p>Use {@link #summary()} for a human-readable line, or {@link #toMap()}
 * for JSON serialization.
 *
 * @see MigrationMetricsCollector
 */
public record MigrationMetrics(
        String jobId,
        Instant startTime,
        Instant endTime,
        Map<String, Long> componentDurations,
        Map<String, Integer> recordCounts,
        long totalDurationMs,
        int recordsCreated,
        int componentsCompleted,
        int plannedComponents
) {
    public MigrationMetrics {
        componentDurations = Collections.unmodifiableMap(new LinkedHashMap<>(componentDurations));
        recordCounts = Collections.unmodifiableMap(new LinkedHashMap<>(recordCounts));
    }

    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the duration of a component.
     *
     * @return duration in milliseconds, or 0 if the component did not run
     */
    public long componentDuration(String component) {
        return componentDurations.getOrDefault(component, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Job %s in %dms | Components: %d/%d | Records created: %d",
                jobId, totalDurationMs, componentsCompleted, plannedComponents, recordsCreated);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("jobId", jobId);
        map.put("startTime", startTime != null ? startTime.toString() : null);
        map.put("endTime", endTime != null ? endTime.toString() : null);
        map.put("totalDurationMs", totalDurationMs);
        map.put("recordsCreated", recordsCreated);
        map.put("componentsCompleted", componentsCompleted);
        map.put("plannedComponents", plannedComponents);
        map.put("componentDurationsMs", new LinkedHashMap<>(componentDurations));
        map.put("recordCounts", new LinkedHashMap<>(recordCounts));
        return map;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link MigrationMetrics}.
     */
    public static class Builder {
        private String jobId;
        private Instant startTime;
        private Instant endTime;
        private final Map<String, Long> componentDurations = new LinkedHashMap<>();
        private final Map<String, Integer> recordCounts = new LinkedHashMap<>();
        private long totalDurationMs;
        private int recordsCreated, componentsCompleted, plannedComponents;

        public Builder jobId(String id) { this.jobId = id; return this; }
        public Builder startTime(Instant t) { this.startTime = t; return this; }
        public Builder endTime(Instant t) { this.endTime = t; return this; }

        public Builder componentDuration(String component, long ms) {
            this.componentDurations.put(component, ms);
            return this;
        }

        public Builder recordCount(String component, int count) {
            this.recordCounts.put(component, count);
            return this;
        }

        public Builder totalDurationMs(long v) { this.totalDurationMs = v; return this; }
        public Builder recordsCreated(int v) { this.recordsCreated = v; return this; }
        public Builder componentsCompleted(int v) { this.componentsCompleted = v; return this; }
        public Builder plannedComponents(int v) { this.plannedComponents = v; return this; }

        public MigrationMetrics build() {
            return new MigrationMetrics(jobId, startTime, endTime, componentDurations, recordCounts,
                    totalDurationMs, recordsCreated, componentsCompleted, plannedComponents);
        }
    }
}
