package deskmigrator.alert;

import deskmigrator.config.AlertLevel;
import deskmigrator.exceptions.MigrateException;
import deskmigrator.metrics.MigrationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for migration events.
 *
 * <p>Entries use markers like JOB_STARTED, COMPONENT_COMPLETED, JOB_FAILED
 * followed by key=value pairs, so log aggregators can parse and alert on them.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs warnings and errors only</li>
 *   <li>ERROR: logs errors only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - JOB_STARTED job=migration-1 source=snapshot components=2
 * 12:00:00.100 INFO  migration - COMPONENT_STARTED job=migration-1 component=groups
 * 12:00:00.500 INFO  migration - COMPONENT_COMPLETED job=migration-1 component=groups records=12 duration_ms=400
 * 12:00:01.000 INFO  migration - JOB_COMPLETED job=migration-1 duration_ms=1000 records_created=30
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void jobStarted(String jobId, String sourceType, int plannedComponents) {
        if (shouldLogInfo()) {
            log.info("JOB_STARTED job={} source={} components={}", jobId, sourceType, plannedComponents);
        }
    }

    public static void jobValidated(String jobId, String snapshotId) {
        if (shouldLogInfo()) {
            log.info("JOB_VALIDATED job={} snapshot={}", jobId, snapshotId != null ? snapshotId : "-");
        }
    }

    public static void componentStarted(String jobId, String component) {
        if (shouldLogInfo()) {
            log.info("COMPONENT_STARTED job={} component={}", jobId, component);
        }
    }

    public static void componentCompleted(String jobId, String component, int records, long durationMs) {
        if (shouldLogInfo()) {
            log.info("COMPONENT_COMPLETED job={} component={} records={} duration_ms={}",
                    jobId, component, records, durationMs);
        }
    }

    public static void jobCompleted(String jobId, MigrationMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("JOB_COMPLETED job={} duration_ms={} records_created={} components={}",
                    jobId, metrics.totalDurationMs(), metrics.recordsCreated(), metrics.componentsCompleted());
        }
    }

    /**
     * Log when a job fails. Always written.
     *
     * @param jobId the job id
     * @param error the failure
     * @param partialMetrics metrics collected before the failure (may be null)
     */
    public static void jobFailed(String jobId, MigrateException error, MigrationMetrics partialMetrics) {
        String component = error.getComponent() != null ? error.getComponent() : "-";
        if (partialMetrics != null) {
            log.error("JOB_FAILED job={} kind={} component={} error=\"{}\" duration_ms={} records_created={}",
                    jobId, error.kind(), component, error.getBareMessage(),
                    partialMetrics.totalDurationMs(), partialMetrics.recordsCreated());
        } else {
            log.error("JOB_FAILED job={} kind={} component={} error=\"{}\"",
                    jobId, error.kind(), component, error.getBareMessage());
        }
    }

    public static void jobCancelled(String jobId, String nextComponent) {
        if (shouldLogWarn()) {
            log.warn("JOB_CANCELLED job={} next_component={}", jobId, nextComponent != null ? nextComponent : "-");
        }
    }

    public static void auditAppendFailed(String jobId, String component, String sourceId, Throwable error) {
        if (shouldLogWarn()) {
            log.warn("AUDIT_APPEND_FAILED job={} component={} source_id={} error=\"{}\"",
                    jobId, component, sourceId, error.getMessage());
        }
    }
}
