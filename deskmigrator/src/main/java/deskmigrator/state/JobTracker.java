package deskmigrator.state;

import deskmigrator.job.JobResult;
import deskmigrator.job.JobStatus;
import deskmigrator.job.MigrationJob;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe registry of submitted jobs.
 *
 * <p>Tracks:
 * <ul>
 *   <li>Status and progress of every queued or running job</li>
 *   <li>A bounded history of finished jobs, most recent first</li>
 * </ul>
 *
 * <p>Updated by {@link deskmigrator.worker.MigrationWorker}; read by dashboards
 * and health checks.
 *
 * @see JobHistoryEntry
 */
public final class JobTracker {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, MigrationJob> active = new LinkedHashMap<>();
    private final Map<String, Instant> submittedAt = new LinkedHashMap<>();
    private final List<JobHistoryEntry> history = new ArrayList<>();

    private volatile int maxHistorySize;

    public JobTracker(int maxHistorySize) {
        setMaxHistorySize(maxHistorySize);
    }

    /** Starts tracking a job that was just queued. */
    public void queued(MigrationJob job) {
        lock.writeLock().lock();
        try {
            active.put(job.id(), job);
            submittedAt.put(job.id(), Instant.now());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Moves a job from the active set into history. */
    public void finished(JobResult result) {
        lock.writeLock().lock();
        try {
            active.remove(result.jobId());
            submittedAt.remove(result.jobId());
            history.add(0, JobHistoryEntry.of(result));
            trim();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the status of a job: live for active jobs, final for jobs still in history.
     */
    public Optional<JobStatus> status(String jobId) {
        lock.readLock().lock();
        try {
            MigrationJob job = active.get(jobId);
            if (job != null) return Optional.of(job.status());
            return findInHistory(jobId).map(JobHistoryEntry::status);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Returns the progress of an active job, or 100/last value for finished ones. */
    public Optional<Integer> progress(String jobId) {
        lock.readLock().lock();
        try {
            MigrationJob job = active.get(jobId);
            if (job != null) return Optional.of(job.progressPercent());
            return findInHistory(jobId).map(e -> e.status() == JobStatus.COMPLETED ? 100
                    : e.metrics() != null && e.metrics().plannedComponents() > 0
                    ? e.metrics().componentsCompleted() * 100 / e.metrics().plannedComponents() : 0);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<JobHistoryEntry> historyEntry(String jobId) {
        lock.readLock().lock();
        try {
            return findInHistory(jobId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Returns the ids of jobs that are queued or running, in submission order. */
    public List<String> activeJobIds() {
        lock.readLock().lock();
        try {
            return List.copyOf(active.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Returns finished jobs, most recent first. */
    public List<JobHistoryEntry> history() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(history));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sets the maximum number of history entries to keep.
     *
     * @throws IllegalArgumentException if size is not positive
     */
    public void setMaxHistorySize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("maxHistorySize must be positive: " + size);
        }
        lock.writeLock().lock();
        try {
            this.maxHistorySize = size;
            trim();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    /** Converts one job's state to a map for JSON serialization. */
    public Optional<Map<String, Object>> toMap(String jobId) {
        lock.readLock().lock();
        try {
            MigrationJob job = active.get(jobId);
            if (job != null) {
                Map<String, Object> map = new LinkedHashMap<>();
                map.put("jobId", job.id());
                map.put("status", job.status().name());
                map.put("progress", job.progressPercent());
                map.put("submittedAt", submittedAt.get(jobId).toString());
                return Optional.of(map);
            }
            return findInHistory(jobId).map(JobHistoryEntry::toMap);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Converts the tracker to a map for JSON serialization. */
    public Map<String, Object> toMap() {
        lock.readLock().lock();
        try {
            Map<String, Object> map = new LinkedHashMap<>();
            List<Map<String, Object>> running = new ArrayList<>();
            for (MigrationJob job : active.values()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("jobId", job.id());
                entry.put("status", job.status().name());
                entry.put("progress", job.progressPercent());
                running.add(entry);
            }
            map.put("active", running);
            map.put("history", history.stream().map(JobHistoryEntry::toMap).toList());
            return map;
        } finally {
            lock.readLock().unlock();
        }
    }

    private Optional<JobHistoryEntry> findInHistory(String jobId) {
        return history.stream().filter(e -> e.jobId().equals(jobId)).findFirst();
    }

    private void trim() {
        while (history.size() > maxHistorySize) {
            history.remove(history.size() - 1);
        }
    }
}
