package deskmigrator.state;

import deskmigrator.exceptions.ErrorKind;
import deskmigrator.job.JobResult;
import deskmigrator.job.JobStatus;
import deskmigrator.metrics.MigrationMetrics;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record of one finished job, kept in {@link JobTracker} history.
 *
 * <p>The number of entries retained is controlled by the
 * {@code migration.history.size} configuration property.
 *
 * @param jobId the job id
 * @param finishedAt when the job completed or failed
 * @param status COMPLETED or FAILED
 * @param failedComponent the failing component (null on success)
 * @param errorKind failure category (null on success)
 * @param errorMessage failure message (null on success)
 * @param mappingCount number of id mappings the run produced
 * @param metrics metrics of the run
 */
public record JobHistoryEntry(
        String jobId,
        Instant finishedAt,
        JobStatus status,
        String failedComponent,
        ErrorKind errorKind,
        String errorMessage,
        int mappingCount,
        MigrationMetrics metrics
) {
    public static JobHistoryEntry of(JobResult result) {
        return new JobHistoryEntry(
                result.jobId(),
                Instant.now(),
                result.status(),
                result.failedComponent(),
                result.errorKind(),
                result.errorMessage(),
                result.idMappings().size(),
                result.metrics()
        );
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("jobId", jobId);
        map.put("finishedAt", finishedAt.toString());
        map.put("status", status.name());
        map.put("failedComponent", failedComponent);
        map.put("errorKind", errorKind != null ? errorKind.name() : null);
        map.put("errorMessage", errorMessage);
        map.put("mappingCount", mappingCount);
        if (metrics != null) {
            map.put("metrics", metrics.toMap());
        }
        return map;
    }
}
