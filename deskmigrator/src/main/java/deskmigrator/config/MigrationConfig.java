package deskmigrator.config;

import deskmigrator.mapping.TranslatorScope;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Central configuration for the migration service.
 *
 * <p>Covers:
 * <ul>
 *   <li>Adapter call timeout</li>
 *   <li>Identifier translator scope</li>
 *   <li>Record-level create parallelism and worker thread count</li>
 *   <li>Job history size and alert level</li>
 *   <li>Base directory for snapshot blobs</li>
 * </ul>
 *
 * <p>Load from {@code migration.properties} or {@code migration.yml} with
 * {@link MigrationConfigLoader}.
 */
public final class MigrationConfig {

    public static final MigrationConfig DEFAULTS = builder().build();

    private final Duration adapterTimeout;
    private final TranslatorScope translatorScope;
    private final int recordParallelism;
    private final int workerThreads;
    private final int historySize;
    private final AlertLevel alertLevel;
    private final Path snapshotBaseDir;

    private MigrationConfig(Builder b) {
        this.adapterTimeout = b.adapterTimeout;
        this.translatorScope = b.translatorScope;
        this.recordParallelism = b.recordParallelism;
        this.workerThreads = b.workerThreads;
        this.historySize = b.historySize;
        this.alertLevel = b.alertLevel;
        this.snapshotBaseDir = b.snapshotBaseDir;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the timeout applied to each adapter call; zero disables it. */
    public Duration adapterTimeout() { return adapterTimeout; }

    /** Returns the identifier translator scope. */
    public TranslatorScope translatorScope() { return translatorScope; }

    /** Returns how many target creates of one component may run at once. */
    public int recordParallelism() { return recordParallelism; }

    /** Returns the number of jobs the worker runs concurrently. */
    public int workerThreads() { return workerThreads; }

    /** Returns the maximum number of finished jobs kept in history. */
    public int historySize() { return historySize; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    /** Returns the directory snapshot storage locations are resolved against. */
    public Path snapshotBaseDir() { return snapshotBaseDir; }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "adapterTimeout=" + adapterTimeout.toSeconds() + "s" +
                ", translatorScope=" + translatorScope +
                ", recordParallelism=" + recordParallelism +
                ", workerThreads=" + workerThreads +
                ", historySize=" + historySize +
                ", alertLevel=" + alertLevel +
                ", snapshotBaseDir=" + snapshotBaseDir +
                '}';
    }

    /**
     * Builder for {@link MigrationConfig}.
     */
    public static final class Builder {
        private Duration adapterTimeout = Duration.ZERO;
        private TranslatorScope translatorScope = TranslatorScope.JOB;
        private int recordParallelism = 1;
        private int workerThreads = 1;
        private int historySize = 10;
        private AlertLevel alertLevel = AlertLevel.WARNING;
        private Path snapshotBaseDir = Path.of("snapshots");

        public Builder adapterTimeout(Duration timeout) {
            this.adapterTimeout = timeout == null || timeout.isNegative() ? Duration.ZERO : timeout;
            return this;
        }

        public Builder adapterTimeoutSeconds(long seconds) {
            return adapterTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder translatorScope(TranslatorScope scope) {
            this.translatorScope = Objects.requireNonNull(scope, "scope");
            return this;
        }

        public Builder recordParallelism(int parallelism) {
            if (parallelism <= 0) throw new IllegalArgumentException("recordParallelism must be positive");
            this.recordParallelism = parallelism;
            return this;
        }

        public Builder workerThreads(int threads) {
            if (threads <= 0) throw new IllegalArgumentException("workerThreads must be positive");
            this.workerThreads = threads;
            return this;
        }

        public Builder historySize(int size) {
            if (size <= 0) throw new IllegalArgumentException("historySize must be positive");
            this.historySize = size;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = Objects.requireNonNull(level, "level");
            return this;
        }

        public Builder snapshotBaseDir(Path dir) {
            this.snapshotBaseDir = Objects.requireNonNull(dir, "dir");
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(this);
        }
    }
}
