package deskmigrator.job;

import deskmigrator.exceptions.ErrorKind;
import deskmigrator.exceptions.MigrateException;
import deskmigrator.mapping.IdMapping;
import deskmigrator.metrics.MigrationMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one job run.
 *
 * @param status {@link JobStatus#COMPLETED} or {@link JobStatus#FAILED}
 * @param jobId the job id
 * @param idMappings every mapping recorded by this run, in creation order
 * @param componentStates final state of each planned component, in plan order
 * @param failedComponent the component that failed, null on success or for pre-migration failures
 * @param errorKind failure category, null on success
 * @param errorMessage failure message with diagnostic context, null on success
 * @param metrics timing and counts
 */
public record JobResult(
        JobStatus status,
        String jobId,
        List<IdMapping> idMappings,
        List<ComponentMigrationState> componentStates,
        String failedComponent,
        ErrorKind errorKind,
        String errorMessage,
        MigrationMetrics metrics
) {
    public JobResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(jobId, "jobId");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("result status must be terminal: " + status);
        }
        idMappings = idMappings == null ? List.of() : List.copyOf(idMappings);
        componentStates = componentStates == null ? List.of() : List.copyOf(componentStates);
    }

    public static JobResult completed(String jobId, List<IdMapping> mappings,
                                      List<ComponentMigrationState> states, MigrationMetrics metrics) {
        return new JobResult(JobStatus.COMPLETED, jobId, mappings, states, null, null, null, metrics);
    }

    public static JobResult failed(String jobId, MigrateException error, List<IdMapping> mappings,
                                   List<ComponentMigrationState> states, MigrationMetrics metrics) {
        return new JobResult(JobStatus.FAILED, jobId, mappings, states,
                error.getComponent(), error.kind(), error.getMessage(), metrics);
    }

    public boolean isCompleted() {
        return status == JobStatus.COMPLETED;
    }

    /**
     * Converts the result to a map for JSON serialization.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("jobId", jobId);
        map.put("status", status == JobStatus.COMPLETED ? "completed" : "failed");
        map.put("failedComponent", failedComponent);
        map.put("errorKind", errorKind != null ? errorKind.name() : null);
        map.put("errorMessage", errorMessage);
        map.put("components", componentStates.stream().map(s -> {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("component", s.component());
            c.put("status", s.status().name());
            c.put("sourceRecordCount", s.sourceRecordCount());
            c.put("error", s.error());
            return c;
        }).toList());
        map.put("idMappings", idMappings.stream().map(m -> {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("entityType", m.entityType());
            e.put("sourceId", m.sourceId());
            e.put("targetId", m.targetId());
            return e;
        }).toList());
        if (metrics != null) {
            map.put("metrics", metrics.toMap());
        }
        return map;
    }
}
