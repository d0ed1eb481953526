package deskmigrator.progress;

/**
 * Default listener that ignores every callback.
 */
public enum NoopJobListener implements JobListener {
    INSTANCE
}
