package deskmigrator.job;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response returned to the caller when a job is accepted onto the queue.
 *
 * @param jobId the assigned job id
 * @param status always {@code queued}
 * @param message human-readable confirmation
 * @param details echo of the source, target and component selection
 */
public record JobAcknowledgement(String jobId, String status, String message, Map<String, Object> details) {

    public static final String QUEUED = "queued";

    /**
     * Builds the acknowledgement for a queued job.
     */
    public static JobAcknowledgement queued(MigrationJob job) {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("name", job.source().instance().name());
        source.put("type", job.source().type().wireName());
        if (job.source().snapshotId() != null) {
            source.put("snapshotId", job.source().snapshotId());
        }

        Map<String, Object> target = new LinkedHashMap<>();
        target.put("name", job.target().name());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", source);
        details.put("target", target);
        if (job.requestsAll()) {
            details.put("components", "all");
            details.put("ignoredItems", List.copyOf(job.ignoredItems()));
        } else {
            details.put("components", List.copyOf(job.requestedComponents()));
        }

        return new JobAcknowledgement(job.id(), QUEUED, "Migration job has been queued", details);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("jobId", jobId);
        map.put("status", status);
        map.put("message", message);
        map.put("details", details);
        return map;
    }
}
