package deskmigrator.adapter;

import deskmigrator.mapping.IdMapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Audit sink partitioned by job id. Concurrent jobs append to separate
 * partitions and never see each other's entries.
 */
public final class InMemoryAuditSink implements AuditSink {

    private static final String NO_JOB = "";

    private final Map<String, List<IdMapping>> byJob = new ConcurrentHashMap<>();

    @Override
    public void append(IdMapping mapping) {
        String jobId = mapping.metadata().getOrDefault(IdMapping.JOB_ID, NO_JOB);
        byJob.computeIfAbsent(jobId, k -> Collections.synchronizedList(new ArrayList<>())).add(mapping);
    }

    /** Returns the mappings appended for a job, in append order. */
    public List<IdMapping> mappingsFor(String jobId) {
        List<IdMapping> list = byJob.get(jobId);
        if (list == null) return List.of();
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    public int size() {
        return byJob.values().stream().mapToInt(List::size).sum();
    }
}
